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

import java.util.ArrayList;
import java.util.List;

import phylotree.main.io.LexerToken;
import phylotree.main.io.LexerTokenType;
import phylotree.main.io.ParseUtils;

/**
 * Builds broker elements from the tokens produced by a {@link NewickLexer}.
 * Open groups are tracked in an explicit stack. Parsing stops at the first grammar violation
 * @author PhyloTree contributors
 */
public class NewickParser {
	
	public static final boolean DEF_READ_COMMENTS = true;
	public static final boolean DEF_READ_TAGS = true;
	
	private boolean readComments = DEF_READ_COMMENTS;
	private boolean readTags = DEF_READ_TAGS;
	
	//Parsing state
	private List<LexerToken> tokens;
	private int index;
	private NewickBroker broker;
	private final List<NewickBrokerElement> openGroups = new ArrayList<>();
	// Element that receives names, lengths and annotations
	private NewickBrokerElement last;
	private boolean expectSubtree;
	private boolean nameAllowed;
	private final List<String> pendingComments = new ArrayList<>();
	private final List<String> pendingTags = new ArrayList<>();
	
	public boolean isReadComments() {
		return readComments;
	}
	
	public void setReadComments(boolean readComments) {
		this.readComments = readComments;
	}
	
	public boolean isReadTags() {
		return readTags;
	}
	
	public void setReadTags(boolean readTags) {
		this.readTags = readTags;
	}
	
	/**
	 * Parses a text containing exactly one tree. Comments after the terminating semicolon are ignored
	 * @param tokens Tokens of the text
	 * @return NewickBroker Elements of the tree
	 * @throws MalformedNewickException If the tokens do not describe exactly one tree
	 */
	public NewickBroker parse(List<LexerToken> tokens) throws MalformedNewickException {
		start(tokens);
		NewickBroker answer = parseTree();
		if(answer == null) throw new MalformedNewickException("No tree found", 1, 1);
		int next = skipIgnorable(index);
		if(next<tokens.size()) {
			LexerToken extra = tokens.get(next);
			throw new MalformedNewickException("Unexpected content after the end of the tree: "+extra.getText(), extra.getLine(), extra.getColumn());
		}
		return answer;
	}
	
	/**
	 * Parses a text containing zero or more trees. Each tree can be preceded by a name and an equals sign
	 * @param tokens Tokens of the text
	 * @return List<NewickBroker> Elements of each tree in the order of the text
	 * @throws MalformedNewickException If some tree is malformed
	 */
	public List<NewickBroker> parseTrees(List<LexerToken> tokens) throws MalformedNewickException {
		start(tokens);
		List<NewickBroker> answer = new ArrayList<>();
		while(true) {
			NewickBroker broker = parseTree();
			if(broker == null) break;
			answer.add(broker);
		}
		return answer;
	}
	
	private void start(List<LexerToken> tokens) {
		this.tokens = tokens;
		index = 0;
	}
	
	private NewickBroker parseTree() throws MalformedNewickException {
		int first = skipIgnorable(index);
		if(first>=tokens.size()) {
			index = first;
			return null;
		}
		broker = new NewickBroker();
		openGroups.clear();
		last = null;
		expectSubtree = true;
		nameAllowed = false;
		pendingComments.clear();
		pendingTags.clear();
		LexerToken firstToken = tokens.get(first);
		int afterName = skipIgnorable(first+1);
		if(isLabel(firstToken) && afterName<tokens.size() && tokens.get(afterName).isOperator('=')) {
			broker.setTreeName(firstToken.getValue());
			index = afterName+1;
		}
		while (true) {
			if(index>=tokens.size()) {
				int [] end = endPosition();
				throw new MalformedNewickException("Missing ; at the end of the tree", end[0], end[1]);
			}
			LexerToken token = tokens.get(index);
			index++;
			LexerTokenType type = token.getType();
			if(type == LexerTokenType.WHITESPACE) continue;
			if(type == LexerTokenType.COMMENT) {
				if(readComments) annotate(token.getValue(), false);
			} else if (type == LexerTokenType.TAG) {
				if(readTags) annotate(token.getValue(), true);
			} else if (isLabel(token)) {
				processLabel(token);
			} else if (token.isBracket('(')) {
				openGroup(token);
			} else if (token.isBracket(')')) {
				closeGroup(token);
			} else if (token.isOperator(',')) {
				processComma(token);
			} else if (token.isOperator(':')) {
				processBranchLength(token);
			} else if (token.isOperator(';')) {
				finishTree(token);
				return broker;
			} else {
				throw error("Unexpected token "+token.getText(), token);
			}
		}
	}

	private void annotate(String value, boolean tag) {
		if(last==null) {
			if(tag) pendingTags.add(value);
			else pendingComments.add(value);
		} else if (tag) {
			last.addTag(value);
		} else {
			last.addComment(value);
		}
	}
	
	private NewickBrokerElement createElement(LexerToken token) {
		NewickBrokerElement element = new NewickBrokerElement(openGroups.size());
		element.setPosition(token.getLine(), token.getColumn());
		if(last==null) {
			for(String comment:pendingComments) element.addComment(comment);
			for(String tag:pendingTags) element.addTag(tag);
			pendingComments.clear();
			pendingTags.clear();
		}
		broker.add(element);
		last = element;
		expectSubtree = false;
		return element;
	}
	
	private void createEmptyLeafIfNeeded(LexerToken token) {
		if(!expectSubtree) return;
		createElement(token);
		nameAllowed = false;
	}

	private void processLabel(LexerToken token) throws MalformedNewickException {
		if(expectSubtree) {
			NewickBrokerElement leaf = createElement(token);
			leaf.setName(token.getValue());
			nameAllowed = false;
		} else if (nameAllowed) {
			last.setName(token.getValue());
			nameAllowed = false;
		} else {
			throw error("Unexpected name "+token.getText(), token);
		}
	}
	
	private void openGroup(LexerToken token) throws MalformedNewickException {
		if(!expectSubtree) throw error("Unexpected (", token);
		NewickBrokerElement group = createElement(token);
		openGroups.add(group);
		expectSubtree = true;
		nameAllowed = false;
	}
	
	private void closeGroup(LexerToken token) throws MalformedNewickException {
		if(openGroups.isEmpty()) throw error("Closing parenthesis without opening parenthesis", token);
		createEmptyLeafIfNeeded(token);
		last = openGroups.remove(openGroups.size()-1);
		expectSubtree = false;
		nameAllowed = true;
	}
	
	private void processComma(LexerToken token) throws MalformedNewickException {
		if(openGroups.isEmpty()) throw error("Comma outside of parentheses", token);
		createEmptyLeafIfNeeded(token);
		expectSubtree = true;
		nameAllowed = false;
	}
	
	private void processBranchLength(LexerToken token) throws MalformedNewickException {
		createEmptyLeafIfNeeded(token);
		if(last.hasBranchLength()) throw error("Duplicate branch length", token);
		int next = skipToBranchLength(index);
		if(next>=tokens.size()) throw error("Missing branch length after :", token);
		LexerToken numberToken = tokens.get(next);
		String sign = "";
		if(numberToken.isOperator('+') || numberToken.isOperator('-')) {
			sign = numberToken.getText();
			next++;
			if(next>=tokens.size()) throw error("Missing branch length after :", numberToken);
			numberToken = tokens.get(next);
		}
		if(numberToken.getType()!=LexerTokenType.NUMBER) throw error("Invalid branch length "+numberToken.getText(), numberToken);
		double length;
		try {
			length = ParseUtils.parseDouble(sign+numberToken.getText());
		} catch (NumberFormatException e) {
			throw new MalformedNewickException("Invalid branch length "+numberToken.getText(), numberToken.getLine(), numberToken.getColumn(), e);
		}
		if(Double.isInfinite(length) || Double.isNaN(length)) throw error("Branch length "+sign+numberToken.getText()+" is out of range", numberToken);
		last.setBranchLength(length);
		index = next+1;
		nameAllowed = false;
	}
	
	private void finishTree(LexerToken token) throws MalformedNewickException {
		if(!openGroups.isEmpty()) {
			NewickBrokerElement unclosed = openGroups.get(openGroups.size()-1);
			throw error("Missing ) for the group opened at line "+unclosed.getLine()+" column "+unclosed.getColumn(), token);
		}
		createEmptyLeafIfNeeded(token);
	}
	
	private int skipIgnorable(int start) {
		int i = start;
		while(i<tokens.size()) {
			LexerTokenType type = tokens.get(i).getType();
			if(type != LexerTokenType.WHITESPACE && type != LexerTokenType.COMMENT) break;
			i++;
		}
		return i;
	}
	
	/**
	 * Skips whitespace and comments between a colon and its branch length.
	 * Comments found are attached to the current element
	 */
	private int skipToBranchLength(int start) {
		int i = start;
		while(i<tokens.size()) {
			LexerToken token = tokens.get(i);
			if(token.getType()==LexerTokenType.COMMENT) {
				if(readComments) last.addComment(token.getValue());
			} else if (token.getType()!=LexerTokenType.WHITESPACE) {
				break;
			}
			i++;
		}
		return i;
	}
	
	private int [] endPosition() {
		if(tokens.isEmpty()) return new int[] {1,1};
		LexerToken lastToken = tokens.get(tokens.size()-1);
		return new int[] {lastToken.getLine(), lastToken.getColumn()+lastToken.getText().length()};
	}
	
	private static boolean isLabel(LexerToken token) {
		LexerTokenType type = token.getType();
		return type == LexerTokenType.SYMBOL || type == LexerTokenType.STRING || type == LexerTokenType.NUMBER;
	}
	
	private static MalformedNewickException error(String reason, LexerToken token) {
		return new MalformedNewickException(reason, token.getLine(), token.getColumn());
	}
}
