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
 * Types of the tokens produced by a {@link Lexer}
 * @author PhyloTree contributors
 */
public enum LexerTokenType {
	ERROR,
	EOF,
	WHITESPACE,
	COMMENT,
	SYMBOL,
	NUMBER,
	STRING,
	OPERATOR,
	BRACKET,
	TAG
}
