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
package phylotree.main.io;

import java.io.IOException;

/**
 * Signals that a text input does not follow the expected format.
 * Carries the 1-based line and column where the problem was detected.
 * @author PhyloTree contributors
 */
public class TextFormatException extends IOException {

	private static final long serialVersionUID = 1L;
	private final int line;
	private final int column;

	public TextFormatException(String message, int line, int column) {
		super(message+" at line "+line+" column "+column);
		this.line = line;
		this.column = column;
	}

	public TextFormatException(String message, int line, int column, Throwable cause) {
		super(message+" at line "+line+" column "+column, cause);
		this.line = line;
		this.column = column;
	}

	/**
	 * @return 1-based line of the problem
	 */
	public int getLine() {
		return line;
	}

	/**
	 * @return 1-based column of the problem
	 */
	public int getColumn() {
		return column;
	}
}
