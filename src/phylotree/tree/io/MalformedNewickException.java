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
package phylotree.tree.io;

import phylotree.main.io.TextFormatException;

/**
 * Signals a Newick text that does not follow the grammar or a sequence of broker elements that
 * does not describe a tree
 * @author PhyloTree contributors
 */
public class MalformedNewickException extends TextFormatException {

	private static final long serialVersionUID = 1L;
	private final String reason;

	public MalformedNewickException(String reason, int line, int column) {
		super(reason, line, column);
		this.reason = reason;
	}

	public MalformedNewickException(String reason, int line, int column, Throwable cause) {
		super(reason, line, column, cause);
		this.reason = reason;
	}

	/**
	 * @return Description of the problem without position information
	 */
	public String getReason() {
		return reason;
	}
}
