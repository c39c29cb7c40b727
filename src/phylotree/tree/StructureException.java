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
 * Signals an invalid structural operation on a {@link Tree}, for example a self loop
 * or the use of a reference that does not belong to the tree anymore.
 * @author PhyloTree contributors
 */
public class StructureException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	public StructureException(String reason) {
		super(reason);
	}

	/**
	 * @return Description of the problem
	 */
	public String getReason() {
		return getMessage();
	}
}
