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
package phylotree.tree;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;

/**
 * Directions of the links of a tree relative to a given root. Calculated with a single breadth
 * first pass, so the tree itself never stores directions and re-rooting does not modify it.
 * The orientation is a snapshot. It must be recalculated after any structural change of the tree
 * @author PhyloTree contributors
 *
 * @param <N> Type of the node data
 * @param <E> Type of the edge data
 */
public class TreeOrientation<N,E> {
	private static final int NOT_REACHED = -2;
	
	private final Tree<N,E> tree;
	private final TreeNode<N,E> root;
	// Index of the link of each node pointing to the root. -1 for the root
	private final int [] parentLinks;
	private final int [] depths;
	private int reachableCount = 0;
	private final int modificationCount;
	
	public TreeOrientation(Tree<N,E> tree, TreeNode<N,E> root) {
		tree.checkNode(root);
		this.tree = tree;
		this.root = root;
		this.modificationCount = tree.getModificationCount();
		parentLinks = new int[tree.getNodeSlots()];
		depths = new int[tree.getNodeSlots()];
		Arrays.fill(parentLinks, NOT_REACHED);
		Arrays.fill(depths, -1);
		parentLinks[root.getIndex()] = -1;
		depths[root.getIndex()] = 0;
		reachableCount = 1;
		Deque<TreeNode<N,E>> queue = new ArrayDeque<>();
		queue.add(root);
		while (!queue.isEmpty()) {
			TreeNode<N,E> node = queue.poll();
			for(TreeLink<N,E> link:getChildLinks(node)) {
				TreeLink<N,E> outer = link.getOuter();
				int childIdx = outer.getNodeIndex();
				if(depths[childIdx]>=0) throw new StructureException("Cycle detected at node "+childIdx);
				parentLinks[childIdx] = outer.getIndex();
				depths[childIdx] = depths[node.getIndex()]+1;
				reachableCount++;
				queue.add(outer.getNode());
			}
		}
	}
	
	public Tree<N,E> getTree() {
		return tree;
	}
	
	public TreeNode<N,E> getRoot() {
		return root;
	}
	
	/**
	 * @return int modification count of the tree when this orientation was calculated
	 */
	public int getModificationCount() {
		return modificationCount;
	}
	
	public int getReachableCount() {
		return reachableCount;
	}
	
	public boolean isReachable(TreeNode<N,E> node) {
		tree.checkNode(node);
		return depths[node.getIndex()]>=0;
	}
	
	/**
	 * @param node to query
	 * @return int Number of edges between the root and the given node
	 */
	public int getDepth(TreeNode<N,E> node) {
		checkReachable(node);
		return depths[node.getIndex()];
	}
	
	/**
	 * @param node to query
	 * @return TreeLink Link of the given node that points to the root. Null for the root
	 */
	public TreeLink<N,E> getParentLink(TreeNode<N,E> node) {
		checkReachable(node);
		int idx = parentLinks[node.getIndex()];
		if(idx<0) return null;
		return tree.getLink(idx);
	}
	
	public TreeNode<N,E> getParent(TreeNode<N,E> node) {
		TreeLink<N,E> link = getParentLink(node);
		if(link == null) return null;
		return link.getOuter().getNode();
	}
	
	public TreeEdge<N,E> getParentEdge(TreeNode<N,E> node) {
		TreeLink<N,E> link = getParentLink(node);
		if(link == null) return null;
		return link.getEdge();
	}
	
	/**
	 * Returns the links of the given node that point away from the root. The order is the order
	 * of the circular list starting after the link pointing to the root
	 * @param node to query
	 * @return List<TreeLink> Links to the children of the node
	 */
	public List<TreeLink<N,E>> getChildLinks(TreeNode<N,E> node) {
		List<TreeLink<N,E>> answer = new ArrayList<>();
		TreeLink<N,E> parentLink = getParentLink(node);
		TreeLink<N,E> start = (parentLink!=null)?parentLink:node.getLink();
		if(start == null) return answer;
		TreeLink<N,E> current = (parentLink!=null)?start.getNext():start;
		while (current!=parentLink) {
			answer.add(current);
			current = current.getNext();
			if(current == start) break;
		}
		return answer;
	}
	
	public List<TreeNode<N,E>> getChildren(TreeNode<N,E> node) {
		List<TreeNode<N,E>> answer = new ArrayList<>();
		for(TreeLink<N,E> link:getChildLinks(node)) answer.add(link.getOuter().getNode());
		return answer;
	}
	
	/**
	 * @param edge to query
	 * @return TreeLink Link of the edge located at the node closer to the root
	 */
	public TreeLink<N,E> getPrimaryLink(TreeEdge<N,E> edge) {
		tree.checkEdge(edge);
		TreeLink<N,E> link = edge.getPrimaryLink();
		TreeLink<N,E> outer = link.getOuter();
		int d1 = depths[link.getNodeIndex()];
		int d2 = depths[outer.getNodeIndex()];
		if(d1<0 || d2<0) throw new StructureException("Edge "+edge.getIndex()+" is not reachable from node "+root.getIndex());
		return (d1<d2)?link:outer;
	}
	
	/**
	 * @param edge to query
	 * @return TreeLink Link of the edge located at the node farther from the root
	 */
	public TreeLink<N,E> getSecondaryLink(TreeEdge<N,E> edge) {
		return getPrimaryLink(edge).getOuter();
	}
	
	private void checkReachable(TreeNode<N,E> node) {
		tree.checkNode(node);
		if(node.getIndex()>=depths.length || depths[node.getIndex()]<0) throw new StructureException("Node "+node.getIndex()+" is not reachable from node "+root.getIndex());
	}
}
