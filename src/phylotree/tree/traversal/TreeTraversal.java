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
import java.util.ConcurrentModificationException;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import phylotree.tree.StructureException;
import phylotree.tree.Tree;
import phylotree.tree.TreeLink;
import phylotree.tree.TreeNode;

/**
 * Base class for the traversals of a tree. Each call to {@link #iterator()} starts a new traversal.
 * Iterators keep only their own cursor. They fail with a {@link ConcurrentModificationException} if the
 * structure of the tree changes while they are in use.
 * <p>
 * The start node is the root of the traversal. The adjacent nodes of a node are visited in the order
 * of its circular list of links, starting after the link through which the node was reached, or at the
 * first link of the node for the start node.
 * </p>
 * @author PhyloTree contributors
 *
 * @param <N> Type of the node data
 * @param <E> Type of the edge data
 */
public abstract class TreeTraversal<N,E> implements Iterable<TraversalStep<N,E>> {
	
	protected final Tree<N,E> tree;
	protected final TreeNode<N,E> start;
	
	/**
	 * Creates a traversal starting at the root of the given tree
	 * @param tree to traverse
	 */
	protected TreeTraversal(Tree<N,E> tree) {
		this(tree, tree.getRoot());
	}
	
	/**
	 * Creates a traversal starting at the given node. The start node can be null only for empty trees
	 * @param tree to traverse
	 * @param start Node where the traversal starts
	 */
	protected TreeTraversal(Tree<N,E> tree, TreeNode<N,E> start) {
		this.tree = tree;
		if(start!=null) tree.checkNode(start);
		else if (!tree.isEmpty()) throw new StructureException("The start node of a traversal can not be null");
		this.start = start;
	}
	
	public Tree<N,E> getTree() {
		return tree;
	}
	
	public TreeNode<N,E> getStart() {
		return start;
	}
	
	/**
	 * @return List<TraversalStep> Steps of a complete traversal
	 */
	public List<TraversalStep<N,E>> steps() {
		List<TraversalStep<N,E>> answer = new ArrayList<>();
		for(TraversalStep<N,E> step:this) answer.add(step);
		return answer;
	}
	
	/**
	 * @return List<TreeNode> Nodes in the order of a complete traversal
	 */
	public List<TreeNode<N,E>> nodes() {
		List<TreeNode<N,E>> answer = new ArrayList<>();
		for(TraversalStep<N,E> step:this) answer.add(step.getNode());
		return answer;
	}
	
	/**
	 * Returns the links that go out from the given node, excluding the link through which the node was reached
	 * @param node Current node
	 * @param entry Link of the node through which the node was reached. Null for the start node
	 * @return List<TreeLink> Links in the order of the circular list of the node
	 */
	protected List<TreeLink<N,E>> getOutgoingLinks(TreeNode<N,E> node, TreeLink<N,E> entry) {
		List<TreeLink<N,E>> answer = new ArrayList<>();
		TreeLink<N,E> first = (entry!=null)?entry:node.getLink();
		if(first == null) return answer;
		TreeLink<N,E> current = (entry!=null)?first.getNext():first;
		while (current != entry) {
			answer.add(current);
			current = current.getNext();
			if(current == first) break;
		}
		return answer;
	}
	
	/**
	 * Creates the step to visit the node at the other side of the given link
	 * @param outgoing Link of the current node
	 * @param depth Depth of the current node
	 * @return TraversalStep step for the adjacent node
	 */
	protected TraversalStep<N,E> descend(TreeLink<N,E> outgoing, int depth) {
		TreeLink<N,E> entry = outgoing.getOuter();
		return new TraversalStep<>(entry.getNode(), entry.getEdge(), entry, depth+1);
	}
	
	protected TraversalStep<N,E> createStartStep() {
		if(start==null) return null;
		return new TraversalStep<>(start, null, null, 0);
	}
	
	/**
	 * Node in process within depth first traversals
	 */
	protected class Frame {
		protected final TraversalStep<N,E> step;
		protected final List<TreeLink<N,E>> outgoing;
		protected int next = 0;
		protected boolean visited = false;
		
		protected Frame(TraversalStep<N,E> step) {
			this.step = step;
			this.outgoing = getOutgoingLinks(step.getNode(), step.getLink());
		}
		
		protected boolean hasMoreChildren() {
			return next < outgoing.size();
		}
		
		protected TraversalStep<N,E> nextChild() {
			return descend(outgoing.get(next++), step.getDepth());
		}
	}
	
	/**
	 * Iterator that calculates one step ahead and checks that the tree was not modified 
	 */
	protected abstract class StepIterator implements Iterator<TraversalStep<N,E>> {
		private final int expectedModificationCount = tree.getModificationCount();
		private TraversalStep<N,E> nextStep;
		private boolean calculated = false;
		
		/**
		 * @return TraversalStep Next step of the traversal or null if the traversal is finished
		 */
		protected abstract TraversalStep<N,E> calculateNext();
		
		@Override
		public boolean hasNext() {
			checkModifications();
			if(!calculated) {
				nextStep = calculateNext();
				calculated = true;
			}
			return nextStep != null;
		}

		@Override
		public TraversalStep<N,E> next() {
			if(!hasNext()) throw new NoSuchElementException();
			calculated = false;
			return nextStep;
		}
		
		@Override
		public void remove() {
			throw new UnsupportedOperationException("Remove not supported by tree traversals");
		}
		
		private void checkModifications() {
			if(tree.getModificationCount()!=expectedModificationCount) throw new ConcurrentModificationException("Tree modified during traversal");
		}
	}
}
