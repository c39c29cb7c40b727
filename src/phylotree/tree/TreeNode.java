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
 * Node of a {@link Tree}. Holds the payload data and the index of one of its links.
 * Adjacent edges are obtained following the circular list of links starting at {@link #getLink()}
 * @author PhyloTree contributors
 *
 * @param <N> Type of the node data
 * @param <E> Type of the edge data
 */
public class TreeNode<N,E> {
	private Tree<N,E> tree;
	private int index;
	private N data;
	private int linkIndex = -1;
	
	TreeNode(Tree<N,E> tree, int index, N data) {
		this.tree = tree;
		this.index = index;
		this.data = data;
	}
	
	/**
	 * @return Position of this node in the nodes of the tree
	 */
	public int getIndex() {
		return index;
	}
	
	public N getData() {
		return data;
	}
	
	public void setData(N data) {
		this.data = data;
	}
	
	/**
	 * @return Tree owning this node or null if the reference was invalidated
	 */
	public Tree<N,E> getTree() {
		return tree;
	}
	
	/**
	 * @return First link of the circular list of links of this node. Null if the node has no edges 
	 */
	public TreeLink<N,E> getLink() {
		if(linkIndex<0) return null;
		return owner().getLink(linkIndex);
	}
	
	public int getDegree() {
		return owner().getDegree(this);
	}
	
	Tree<N,E> owner() {
		if(tree==null) throw new StructureException("Node "+index+" does not belong to a tree anymore");
		return tree;
	}
	
	int getLinkIndex() {
		return linkIndex;
	}
	
	void setLinkIndex(int linkIndex) {
		this.linkIndex = linkIndex;
	}
	
	void detach() {
		tree = null;
	}

	@Override
	public String toString() {
		if(data==null) return "Node "+index;
		return "Node "+index+" ("+data+")";
	}
}
