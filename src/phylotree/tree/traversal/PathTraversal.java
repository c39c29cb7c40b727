/*******************************************************************************
 * PhyloTree - Phylogenetic trees and Newick processing
 * Copyright 2026 PhyloTree contributors
 *
 * This file is part of PhyloTree.
 *
 *     PhyloTree is free software: you can redistribute it and/or modify
 *     it under the terms of the GNU General Public License as published by
 *     the Free Software Foundation, either version 3 of the License, or
 *     (at your option) any later version.
 *
 *     PhyloTree is distributed in the hope that it will be useful,
 *     but WITHOUT ANY WARRANTY; without even the implied warranty of
 *     MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 *     GNU General Public License for more details.
 *
 *     You should have received a copy of the GNU General Public License
 *     along with PhyloTree.  If not, see <http://www.gnu.org/licenses/>.
 *******************************************************************************/
package phylotree.tree.traversal;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

import phylotree.tree.StructureException;
import phylotree.tree.Tree;
import phylotree.tree.TreeLink;
import phylotree.tree.TreeNode;
import phylotree.tree.TreeOrientation;

/**
 * Visits the nodes in the path between two nodes. The path goes up from the start node to the lowest
 * common ancestor of both nodes relative to the root of the tree, and then down to the end node.
 * The depth of each step is its distance to the start node along the path
 * @author PhyloTree contributors
 *
 * @param <N> Type of the node data
 * @param <E> Type of the edge data
 */
public class PathTraversal<N,E> extends TreeTraversal<N,E> {
	
	private final TreeNode<N,E> end;
	
	public PathTraversal(Tree<N,E> tree, TreeNode<N,E> start, TreeNode<N,E> end) {
		super(tree, start);
		if(start == null) throw new StructureException("The start node of a path can not be null");
		tree.checkNode(end);
		this.end = end;
	}
	
	public TreeNode<N,E> getEnd() {
		return end;
	}

	@Override
	public Iterator<TraversalStep<N,E>> iterator() {
		return new PathIterator();
	}
	
	/**
	 * Calculates the lowest common ancestor walking up from both nodes at the same time
	 * @return TreeNode The lowest common ancestor of the start and the end nodes
	 */
	public TreeNode<N,E> getLowestCommonAncestor() {
		TreeOrientation<N,E> orientation = new TreeOrientation<>(tree, tree.getRoot());
		List<TreeNode<N,E>> upFromStart = new ArrayList<>();
		List<TreeNode<N,E>> upFromEnd = new ArrayList<>();
		return findLowestCommonAncestor(orientation, upFromStart, upFromEnd);
	}
	
	private TreeNode<N,E> findLowestCommonAncestor(TreeOrientation<N,E> orientation, List<TreeNode<N,E>> upFromStart, List<TreeNode<N,E>> upFromEnd) {
		if(!orientation.isReachable(start) || !orientation.isReachable(end)) throw new StructureException("Nodes "+start.getIndex()+" and "+end.getIndex()+" are not connected to the root");
		Set<Integer> visitedFromStart = new HashSet<>();
		Set<Integer> visitedFromEnd = new HashSet<>();
		TreeNode<N,E> x = start;
		TreeNode<N,E> y = end;
		upFromStart.add(x);
		visitedFromStart.add(x.getIndex());
		upFromEnd.add(y);
		visitedFromEnd.add(y.getIndex());
		while (true) {
			if(visitedFromEnd.contains(x.getIndex())) return x;
			if(visitedFromStart.contains(y.getIndex())) return y;
			TreeNode<N,E> parentX = orientation.getParent(x);
			if(parentX!=null) {
				x = parentX;
				upFromStart.add(x);
				visitedFromStart.add(x.getIndex());
			}
			TreeNode<N,E> parentY = orientation.getParent(y);
			if(parentY!=null) {
				y = parentY;
				upFromEnd.add(y);
				visitedFromEnd.add(y.getIndex());
			}
		}
	}
	
	private List<TraversalStep<N,E>> calculatePath() {
		TreeOrientation<N,E> orientation = new TreeOrientation<>(tree, tree.getRoot());
		List<TreeNode<N,E>> upFromStart = new ArrayList<>();
		List<TreeNode<N,E>> upFromEnd = new ArrayList<>();
		TreeNode<N,E> lca = findLowestCommonAncestor(orientation, upFromStart, upFromEnd);
		List<TraversalStep<N,E>> path = new ArrayList<>();
		path.add(createStartStep());
		for(int i=1;i<upFromStart.size() && upFromStart.get(i-1)!=lca;i++) {
			TreeLink<N,E> upLink = orientation.getParentLink(upFromStart.get(i-1));
			path.add(new TraversalStep<>(upFromStart.get(i), upLink.getEdge(), upLink.getOuter(), path.size()));
		}
		int lcaPosEnd = upFromEnd.indexOf(lca);
		for(int i=lcaPosEnd-1;i>=0;i--) {
			TreeNode<N,E> node = upFromEnd.get(i);
			TreeLink<N,E> upLink = orientation.getParentLink(node);
			path.add(new TraversalStep<>(node, upLink.getEdge(), upLink, path.size()));
		}
		return path;
	}
	
	private class PathIterator extends StepIterator {
		private final List<TraversalStep<N,E>> path = calculatePath();
		private int next = 0;
		
		@Override
		protected TraversalStep<N,E> calculateNext() {
			if(next>=path.size()) return null;
			return path.get(next++);
		}
	}
}
