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
 * Edge of a {@link Tree}. Connects exactly two links, each one located at a different node.
 * The primary link is located at the first node given when the edge was created
 * @author PhyloTree contributors
 *
 * @param <N> Type of the node data
 * @param <E> Type of the edge data
 */
public class TreeEdge<N,E> {
	private Tree<N,E> tree;
	private int index;
	private E data;
	private int primaryLinkIndex;
	private int secondaryLinkIndex;
	
	TreeEdge(Tree<N,E> tree, int index, E data) {
		this.tree = tree;
		this.index = index;
		this.data = data;
	}
	
	public int getIndex() {
		return index;
	}
	
	public E getData() {
		return data;
	}
	
	public void setData(E data) {
		this.data = data;
	}
	
	public Tree<N,E> getTree() {
		return tree;
	}
	
	public TreeLink<N,E> getPrimaryLink() {
		return owner().getLink(primaryLinkIndex);
	}
	
	public TreeLink<N,E> getSecondaryLink() {
		return owner().getLink(secondaryLinkIndex);
	}
	
	public TreeNode<N,E> getPrimaryNode() {
		return getPrimaryLink().getNode();
	}
	
	public TreeNode<N,E> getSecondaryNode() {
		return getSecondaryLink().getNode();
	}
	
	Tree<N,E> owner() {
		if(tree==null) throw new StructureException("Edge "+index+" does not belong to a tree anymore");
		return tree;
	}
	
	int getPrimaryLinkIndex() {
		return primaryLinkIndex;
	}
	
	int getSecondaryLinkIndex() {
		return secondaryLinkIndex;
	}
	
	void setLinkIndexes(int primaryLinkIndex, int secondaryLinkIndex) {
		this.primaryLinkIndex = primaryLinkIndex;
		this.secondaryLinkIndex = secondaryLinkIndex;
	}
	
	void detach() {
		tree = null;
	}

	@Override
	public String toString() {
		if(data==null) return "Edge "+index;
		return "Edge "+index+" ("+data+")";
	}
}
