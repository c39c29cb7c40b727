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

import phylotree.main.io.Lexer;
import phylotree.main.io.LexerTokenType;
import phylotree.main.io.ParseUtils;

/**
 * Lexer for Newick texts. Square brackets enclose comments, which are included as tokens by default.
 * Curly brackets enclose tags. Any run of characters different from whitespace, quotes and
 * the delimiters ( ) [ ] { } , : ; = is a single label token. Labels are typed as numbers if the whole
 * label is a number and as symbols otherwise.
 * @author PhyloTree contributors
 */
public class NewickLexer extends Lexer {
	
	public static final String DELIMITERS = "()[]{},:;=";
	
	public NewickLexer() {
		setCommentDelimiters('[', ']', false);
		setIncludeCommentTokens(true);
	}

	@Override
	protected void scanToken() {
		char c = text.charAt(position);
		if (isWhitespace(c)) scanWhitespace();
		else if (c == '[') scanComment();
		else if (c == '{') scanTag();
		else if (isQuotemark(c)) scanString();
		else if (c == ',' || c == ':' || c == ';' || c == '=') scanSingleCharacter(LexerTokenType.OPERATOR);
		else if (isBracket(c)) scanSingleCharacter(LexerTokenType.BRACKET);
		else if (isLabelCharacter(c)) scanLabel();
		else scanError("Unrecognized character");
	}
	
	protected void scanTag() {
		int start = position;
		int startLine = line;
		position++;
		while (position<text.length() && text.charAt(position)!='}') {
			if(text.charAt(position)=='\n') line++;
			position++;
		}
		if(position>=text.length()) {
			pushToken(LexerTokenType.ERROR, start, position, startLine, "Unterminated tag");
			return;
		}
		position++;
		pushToken(LexerTokenType.TAG, start, position, startLine, text.substring(start+1, position-1).trim());
	}
	
	protected void scanLabel() {
		int start = position;
		while (position<text.length() && isLabelCharacter(text.charAt(position))) position++;
		String label = text.substring(start, position);
		if(!ParseUtils.isNumber(label)) {
			pushToken(LexerTokenType.SYMBOL, start, position, line);
		} else if (!isGlueSignToNumber() && isSign(label.charAt(0))) {
			pushToken(LexerTokenType.OPERATOR, start, start+1, line);
			pushToken(LexerTokenType.NUMBER, start+1, position, line);
		} else {
			pushToken(LexerTokenType.NUMBER, start, position, line);
		}
	}
	
	/**
	 * @param c Character to check
	 * @return true if the character can be part of an unquoted label
	 */
	public static boolean isLabelCharacter(char c) {
		return !isWhitespace(c) && !isQuotemark(c) && !Character.isISOControl(c) && DELIMITERS.indexOf(c)<0;
	}
}
