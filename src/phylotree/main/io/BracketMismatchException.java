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

/**
 * Signals an opening bracket without closing bracket, or a closing bracket that does not
 * match the last open one.
 * @author PhyloTree contributors
 */
public class BracketMismatchException extends TextFormatException {

	private static final long serialVersionUID = 1L;
	private final LexerToken token;

	public BracketMismatchException(String message, LexerToken token) {
		super(message, token.getLine(), token.getColumn());
		this.token = token;
	}

	/**
	 * @return The offending bracket token
	 */
	public LexerToken getToken() {
		return token;
	}
}
