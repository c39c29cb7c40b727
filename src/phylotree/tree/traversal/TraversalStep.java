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

import phylotree.tree.TreeEdge;
import phylotree.tree.TreeLink;
import phylotree.tree.TreeNode;

/**
 * Element produced by a traversal. The edge and the link are the ones through which the
 * traversal arrived at the node. Both are null for the node where the traversal starts.
 * The depth is the number of edges between the start node and the node.
 * <p>
 * Traversals visiting a node more than once (Euler tour and roundtrip) tell through
 * {@link #isFirstVisit()} and {@link #isLastVisit()} which visit is reported. For the roundtrip
 * these are the enter and exit events. Traversals visiting every node once set both flags.
 * </p>
 * @author PhyloTree contributors
 *
 * @param <N> Type of the node data
 * @param <E> Type of the edge data
 */
public class TraversalStep<N,E> {
	private final TreeNode<N,E> node;
	private final TreeEdge<N,E> edge;
	private final TreeLink<N,E> link;
	private final int depth;
	private final boolean firstVisit;
	private final boolean lastVisit;
	
	public TraversalStep(TreeNode<N,E> node, TreeEdge<N,E> edge, TreeLink<N,E> link, int depth) {
		this(node, edge, link, depth, true, true);
	}
	
	public TraversalStep(TreeNode<N,E> node, TreeEdge<N,E> edge, TreeLink<N,E> link, int depth, boolean firstVisit, boolean lastVisit) {
		this.node = node;
		this.edge = edge;
		this.link = link;
		this.depth = depth;
		this.firstVisit = firstVisit;
		this.lastVisit = lastVisit;
	}
	
	public TreeNode<N,E> getNode() {
		return node;
	}
	
	public TreeEdge<N,E> getEdge() {
		return edge;
	}
	
	/**
	 * @return Link of the node through which the traversal arrived at the node
	 */
	public TreeLink<N,E> getLink() {
		return link;
	}
	
	public int getDepth() {
		return depth;
	}
	
	public boolean isFirstVisit() {
		return firstVisit;
	}
	
	public boolean isLastVisit() {
		return lastVisit;
	}
	
	/**
	 * @return true if this step is the start node of the traversal
	 */
	public boolean isStart() {
		return link == null;
	}
	
	TraversalStep<N,E> withVisit(boolean first, boolean last) {
		return new TraversalStep<>(node, edge, link, depth, first, last);
	}

	@Override
	public String toString() {
		return node+" depth: "+depth+(firstVisit?" first":"")+(lastVisit?" last":"");
	}
}
