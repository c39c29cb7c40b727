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

/**
 * Directed adjacency record of a {@link Tree}. Each link belongs to one node and one edge.
 * The next link is the following link of the same node in its circular list. The outer link is
 * the link at the other end of the same edge
 * @author PhyloTree contributors
 *
 * @param <N> Type of the node data
 * @param <E> Type of the edge data
 */
public class TreeLink<N,E> {
	private Tree<N,E> tree;
	private int index;
	private int nodeIndex;
	private int edgeIndex;
	private int nextIndex;
	private int outerIndex;
	
	TreeLink(Tree<N,E> tree, int index, int nodeIndex, int edgeIndex) {
		this.tree = tree;
		this.index = index;
		this.nodeIndex = nodeIndex;
		this.edgeIndex = edgeIndex;
		this.nextIndex = index;
		this.outerIndex = -1;
	}
	
	public int getIndex() {
		return index;
	}
	
	public Tree<N,E> getTree() {
		return tree;
	}
	
	public TreeLink<N,E> getNext() {
		return owner().getLink(nextIndex);
	}
	
	public TreeLink<N,E> getOuter() {
		return owner().getLink(outerIndex);
	}
	
	public TreeNode<N,E> getNode() {
		return owner().getNode(nodeIndex);
	}
	
	public TreeEdge<N,E> getEdge() {
		return owner().getEdge(edgeIndex);
	}
	
	Tree<N,E> owner() {
		if(tree==null) throw new StructureException("Link "+index+" does not belong to a tree anymore");
		return tree;
	}
	
	int getNodeIndex() {
		return nodeIndex;
	}
	
	int getEdgeIndex() {
		return edgeIndex;
	}
	
	int getNextIndex() {
		return nextIndex;
	}
	
	void setNextIndex(int nextIndex) {
		this.nextIndex = nextIndex;
	}
	
	int getOuterIndex() {
		return outerIndex;
	}
	
	void setOuterIndex(int outerIndex) {
		this.outerIndex = outerIndex;
	}
	
	void detach() {
		tree = null;
	}

	@Override
	public String toString() {
		return "Link "+index+" node: "+nodeIndex+" edge: "+edgeIndex+" next: "+nextIndex+" outer: "+outerIndex;
	}
}
