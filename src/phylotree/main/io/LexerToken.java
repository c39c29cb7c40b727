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
 * Token produced by a {@link Lexer}. Stores the exact literal text as it appears in the input
 * and the decoded value (quoted strings without quotes and with escapes resolved, error messages
 * for error tokens).
 * @author PhyloTree contributors
 */
public class LexerToken {
	private final LexerTokenType type;
	private final int line;
	private final int column;
	private final String text;
	private final String value;

	public LexerToken(LexerTokenType type, int line, int column, String text) {
		this(type, line, column, text, text);
	}

	public LexerToken(LexerTokenType type, int line, int column, String text, String value) {
		this.type = type;
		this.line = line;
		this.column = column;
		this.text = text;
		this.value = value;
	}

	public LexerTokenType getType() {
		return type;
	}

	/**
	 * @return 1-based line where the token starts
	 */
	public int getLine() {
		return line;
	}

	/**
	 * @return 1-based column where the token starts
	 */
	public int getColumn() {
		return column;
	}

	/**
	 * @return Literal text of the token
	 */
	public String getText() {
		return text;
	}

	/**
	 * @return Decoded value of the token
	 */
	public String getValue() {
		return value;
	}

	public boolean isError() {
		return type == LexerTokenType.ERROR;
	}

	public boolean isEOF() {
		return type == LexerTokenType.EOF;
	}

	public boolean isOperator() {
		return type == LexerTokenType.OPERATOR;
	}

	/**
	 * Usage: token.isOperator(';') is true only if this token is the semicolon operator
	 * @param c Operator character
	 * @return boolean true if this token is the given operator
	 */
	public boolean isOperator(char c) {
		return type == LexerTokenType.OPERATOR && text.length()==1 && text.charAt(0) == c;
	}

	public boolean isBracket() {
		return type == LexerTokenType.BRACKET;
	}

	public boolean isBracket(char c) {
		return type == LexerTokenType.BRACKET && text.charAt(0) == c;
	}

	@Override
	public String toString() {
		return type+" '"+text+"' ("+line+":"+column+")";
	}
}
