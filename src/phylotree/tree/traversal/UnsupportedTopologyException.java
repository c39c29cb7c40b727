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

import phylotree.tree.TreeNode;

/**
 * Signals that a traversal is not defined for the topology around a node
 * @author PhyloTree contributors
 */
public class UnsupportedTopologyException extends RuntimeException {

	private static final long serialVersionUID = 1L;
	private final transient TreeNode<?,?> node;

	public UnsupportedTopologyException(String message, TreeNode<?,?> node) {
		super(message+". Node: "+node);
		this.node = node;
	}

	/**
	 * @return The node where the traversal is not defined
	 */
	public TreeNode<?,?> getNode() {
		return node;
	}
}
