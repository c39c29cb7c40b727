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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;

/**
 * Single pass scanner that splits a text into typed tokens. The main token types are:
 * <ul>
 * <li>Symbols: start with a letter or underscore, followed by letters, digits or underscores</li>
 * <li>Numbers: [+-]123[.456][eE[+-]789]</li>
 * <li>Strings: enclosed in single or double quotes. Backslash escapes \n, \t and \r are translated
 * into their whitespace characters. Any other escaped character, including the quote, is taken literally</li>
 * <li>Operators: one of + - * / &lt; &gt; ? ! ^ = % &amp; | , : ;</li>
 * <li>Brackets: one of ( ) [ ] { }</li>
 * </ul>
 * Whitespace and comment tokens are only kept if the corresponding options are enabled. 
 * Comments are disabled until delimiters are set with {@link #setCommentDelimiters(char, char, boolean)}.
 * Unrecognized characters and unterminated strings or comments produce error tokens. The scan
 * continues after an error, so all errors of a text can be retrieved with {@link #getErrors()}.
 * @author PhyloTree contributors
 */
public class Lexer {
	
	public static final String OPERATORS = "+-*/<>?!^=%&|,:;";
	public static final String LEFT_BRACKETS = "([{";
	public static final String RIGHT_BRACKETS = ")]}";
	
	public static final boolean DEF_INCLUDE_WHITESPACE_TOKENS = false;
	public static final boolean DEF_INCLUDE_COMMENT_TOKENS = false;
	public static final boolean DEF_GLUE_SIGN_TO_NUMBER = true;
	
	// Parameters
	private boolean includeWhitespaceTokens = DEF_INCLUDE_WHITESPACE_TOKENS;
	private boolean includeCommentTokens = DEF_INCLUDE_COMMENT_TOKENS;
	private boolean glueSignToNumber = DEF_GLUE_SIGN_TO_NUMBER;
	private char commentStart = 0;
	private char commentEnd = 0;
	private boolean nestedComments = false;
	
	// Scan state. Shared by all scan methods during a call to analyze
	protected String text = "";
	protected int position = 0;
	protected int line = 1;
	private List<LexerToken> tokens = new ArrayList<>();
	
	public boolean isIncludeWhitespaceTokens() {
		return includeWhitespaceTokens;
	}
	public void setIncludeWhitespaceTokens(boolean includeWhitespaceTokens) {
		this.includeWhitespaceTokens = includeWhitespaceTokens;
	}
	
	public boolean isIncludeCommentTokens() {
		return includeCommentTokens;
	}
	public void setIncludeCommentTokens(boolean includeCommentTokens) {
		this.includeCommentTokens = includeCommentTokens;
	}
	
	public boolean isGlueSignToNumber() {
		return glueSignToNumber;
	}
	/**
	 * Determines whether a sign preceding a number is part of the number token.
	 * If false, a text like 1+2 produces the three tokens 1 + 2. If true, -3.14 is a single number token
	 * @param glueSignToNumber New value
	 */
	public void setGlueSignToNumber(boolean glueSignToNumber) {
		this.glueSignToNumber = glueSignToNumber;
	}
	
	/**
	 * Enables comments delimited by the given characters
	 * @param start Character that opens a comment
	 * @param end Character that closes a comment
	 * @param nested Tells if comments can be nested
	 */
	public void setCommentDelimiters(char start, char end, boolean nested) {
		this.commentStart = start;
		this.commentEnd = end;
		this.nestedComments = nested;
	}
	
	/**
	 * Scans the given text. Tokens from previous calls are discarded
	 * @param text to analyze
	 * @return List<LexerToken> Tokens in the order of the text
	 */
	public List<LexerToken> analyze(String text) {
		this.text = text;
		position = 0;
		line = 1;
		tokens = new ArrayList<>();
		while (position < text.length()) {
			scanToken();
		}
		return getTokens();
	}
	
	public List<LexerToken> getTokens() {
		return Collections.unmodifiableList(tokens);
	}
	
	public int size() {
		return tokens.size();
	}
	
	public boolean isEmpty() {
		return tokens.isEmpty();
	}
	
	/**
	 * Returns the token at the given index or an end of file token if the index is beyond the last token
	 * @param index of the token
	 * @return LexerToken at the given index
	 */
	public LexerToken getToken(int index) {
		if(index<tokens.size()) return tokens.get(index);
		return new LexerToken(LexerTokenType.EOF, line, columnOf(text.length()), "");
	}
	
	/**
	 * @return List<LexerToken> Error tokens produced by the last scan
	 */
	public List<LexerToken> getErrors() {
		List<LexerToken> errors = new ArrayList<>();
		for(LexerToken token:tokens) {
			if(token.isError()) errors.add(token);
		}
		return errors;
	}
	
	/**
	 * Throws an exception describing all error tokens if the last scan produced any error
	 * @throws LexerException If at least one error token was produced
	 */
	public void checkErrors() throws LexerException {
		List<LexerToken> errors = getErrors();
		if(errors.size()>0) throw new LexerException(errors);
	}
	
	/**
	 * Checks that the brackets of the last scan are properly nested and closed
	 * @throws BracketMismatchException At the first closing bracket that does not match,
	 * or at the innermost opening bracket that is never closed
	 */
	public void validateBrackets() throws BracketMismatchException {
		Deque<LexerToken> open = new ArrayDeque<>();
		for(LexerToken token:tokens) {
			if(!token.isBracket()) continue;
			char c = token.getText().charAt(0);
			int leftIdx = LEFT_BRACKETS.indexOf(c); 
			if(leftIdx>=0) {
				open.push(token);
				continue;
			}
			if(open.isEmpty()) throw new BracketMismatchException("Closing bracket "+c+" without opening bracket", token);
			LexerToken last = open.pop();
			char expected = RIGHT_BRACKETS.charAt(LEFT_BRACKETS.indexOf(last.getText().charAt(0)));
			if(c!=expected) throw new BracketMismatchException("Closing bracket "+c+" does not match opening bracket "+last.getText()+" at line "+last.getLine()+" column "+last.getColumn(), token);
		}
		if(!open.isEmpty()) {
			LexerToken unmatched = open.peek();
			throw new BracketMismatchException("Opening bracket "+unmatched.getText()+" is never closed", unmatched);
		}
	}
	
	/**
	 * @return String with one line per token, useful for debugging
	 */
	public String dump() {
		StringBuilder answer = new StringBuilder();
		for(LexerToken token:tokens) {
			answer.append(token.getLine()).append(':').append(token.getColumn()).append('\t');
			answer.append(token.getType()).append('\t').append(token.getText()).append('\n');
		}
		return answer.toString();
	}
	
	/**
	 * Scans the token starting at the current position. Dispatches by the class of the first character
	 */
	protected void scanToken() {
		char c = text.charAt(position);
		if (isWhitespace(c)) scanWhitespace();
		else if (commentStart!=0 && c == commentStart) scanComment();
		else if (isLetter(c)) scanSymbol();
		else if (isDigit(c) || (glueSignToNumber && isSign(c) && isDigit(peek(position+1)))) scanNumber();
		else if (isQuotemark(c)) scanString();
		else if (isOperator(c)) scanSingleCharacter(LexerTokenType.OPERATOR);
		else if (isBracket(c)) scanSingleCharacter(LexerTokenType.BRACKET);
		else scanError("Unrecognized character");
	}
	
	protected void scanWhitespace() {
		int start = position;
		int startLine = line;
		while (position<text.length() && isWhitespace(text.charAt(position))) {
			if(text.charAt(position)=='\n') line++;
			position++;
		}
		if(includeWhitespaceTokens) pushToken(LexerTokenType.WHITESPACE, start, position, startLine);
	}
	
	protected void scanComment() {
		int start = position;
		int startLine = line;
		int level = 0;
		while (position<text.length()) {
			char c = text.charAt(position);
			position++;
			if(c == commentStart && (nestedComments || level==0)) level++;
			else if (c == commentEnd) {
				level--;
				if(level==0) break;
			} else if (c=='\n') line++;
		}
		if(level>0) {
			pushToken(LexerTokenType.ERROR, start, position, startLine, "Unterminated comment");
			return;
		}
		if(includeCommentTokens) {
			pushToken(LexerTokenType.COMMENT, start, position, startLine, text.substring(start+1, position-1));
		}
	}
	
	protected void scanSymbol() {
		int start = position;
		while (position<text.length() && (isLetter(text.charAt(position)) || isDigit(text.charAt(position)))) {
			position++;
		}
		pushToken(LexerTokenType.SYMBOL, start, position, line);
	}
	
	protected void scanNumber() {
		int start = position;
		position = findNumberEnd(text, position);
		pushToken(LexerTokenType.NUMBER, start, position, line);
	}
	
	protected void scanString() {
		int start = position;
		int startLine = line;
		char quote = text.charAt(position);
		position++;
		StringBuilder value = new StringBuilder();
		boolean closed = false;
		while (position<text.length()) {
			char c = text.charAt(position);
			if(c == '\\' && position+1<text.length()) {
				char escaped = text.charAt(position+1);
				if(escaped == 'n') value.append('\n');
				else if (escaped == 't') value.append('\t');
				else if (escaped == 'r') value.append('\r');
				else value.append(escaped);
				if(escaped == '\n') line++;
				position+=2;
				continue;
			}
			position++;
			if(c == quote) {
				closed = true;
				break;
			}
			if(c=='\n') line++;
			value.append(c);
		}
		if(!closed) {
			pushToken(LexerTokenType.ERROR, start, position, startLine, "Unterminated string");
			return;
		}
		pushToken(LexerTokenType.STRING, start, position, startLine, value.toString());
	}
	
	protected void scanSingleCharacter(LexerTokenType type) {
		pushToken(type, position, position+1, line);
		position++;
	}
	
	/**
	 * Produces an error token for the character at the current position and moves past it
	 * @param message Description of the error
	 */
	protected void scanError(String message) {
		pushToken(LexerTokenType.ERROR, position, position+1, line, message);
		position++;
	}
	
	protected void pushToken(LexerTokenType type, int start, int end, int tokenLine) {
		String literal = text.substring(start, end);
		pushToken(type, start, end, tokenLine, literal);
	}
	
	protected void pushToken(LexerTokenType type, int start, int end, int tokenLine, String value) {
		tokens.add(new LexerToken(type, tokenLine, columnOf(start), text.substring(start, end), value));
	}
	
	/**
	 * Calculates the 1-based column of the given position going back to the previous new line
	 * @param start Position in the text
	 * @return int column
	 */
	protected int columnOf(int start) {
		int lineStart = start;
		while (lineStart>0 && text.charAt(lineStart-1)!='\n') lineStart--;
		return start-lineStart+1;
	}
	
	protected char peek(int pos) {
		if(pos<0 || pos>=text.length()) return 0;
		return text.charAt(pos);
	}
	
	/**
	 * Finds the end of the number starting at the given position
	 * @param s Text to analyze
	 * @param start Position where the number starts. It can be a sign
	 * @return int Position after the last character of the number
	 */
	public static int findNumberEnd(CharSequence s, int start) {
		int n = s.length();
		int i = start;
		if(i<n && isSign(s.charAt(i))) i++;
		while (i<n && isDigit(s.charAt(i))) i++;
		if(i+1<n && s.charAt(i)=='.' && isDigit(s.charAt(i+1))) {
			i++;
			while (i<n && isDigit(s.charAt(i))) i++;
		}
		if(i<n && (s.charAt(i)=='e' || s.charAt(i)=='E')) {
			int j = i+1;
			if(j<n && isSign(s.charAt(j))) j++;
			if(j<n && isDigit(s.charAt(j))) {
				i = j;
				while (i<n && isDigit(s.charAt(i))) i++;
			}
		}
		return i;
	}
	
	public static boolean isWhitespace(char c) {
		return c==' ' || c=='\n' || c=='\r' || c=='\t' || c=='\b' || c==0x0B || c=='\f';
	}
	
	public static boolean isLetter(char c) {
		return (c>='a' && c<='z') || (c>='A' && c<='Z') || c=='_';
	}
	
	public static boolean isDigit(char c) {
		return c>='0' && c<='9';
	}
	
	public static boolean isSign(char c) {
		return c=='+' || c=='-';
	}
	
	public static boolean isQuotemark(char c) {
		return c=='"' || c=='\'';
	}
	
	public static boolean isOperator(char c) {
		return OPERATORS.indexOf(c)>=0;
	}
	
	public static boolean isBracket(char c) {
		return LEFT_BRACKETS.indexOf(c)>=0 || RIGHT_BRACKETS.indexOf(c)>=0;
	}
}
