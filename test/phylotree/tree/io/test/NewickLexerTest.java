package phylotree.tree.io.test;

import java.util.List;

import junit.framework.TestCase;
import phylotree.main.io.LexerToken;
import phylotree.main.io.LexerTokenType;
import phylotree.tree.io.NewickLexer;

public class NewickLexerTest extends TestCase {
	
	public void testTreeTokens() {
		NewickLexer lexer = new NewickLexer();
		List<LexerToken> tokens = lexer.analyze("(A:0.1,'B c':2e-3)F;");
		String [] texts = {"(", "A", ":", "0.1", ",", "'B c'", ":", "2e-3", ")", "F", ";"};
		LexerTokenType [] types = {LexerTokenType.BRACKET, LexerTokenType.SYMBOL, LexerTokenType.OPERATOR, LexerTokenType.NUMBER,
				LexerTokenType.OPERATOR, LexerTokenType.STRING, LexerTokenType.OPERATOR, LexerTokenType.NUMBER,
				LexerTokenType.BRACKET, LexerTokenType.SYMBOL, LexerTokenType.OPERATOR};
		assertEquals(texts.length, tokens.size());
		for(int i=0;i<texts.length;i++) {
			assertEquals(texts[i], tokens.get(i).getText());
			assertEquals(types[i], tokens.get(i).getType());
		}
		assertEquals("B c", tokens.get(5).getValue());
	}
	
	public void testLabels() {
		NewickLexer lexer = new NewickLexer();
		List<LexerToken> tokens = lexer.analyze("Homo.sapiens-1 12 12abc 1.5.2 x/y");
		assertEquals(5, tokens.size());
		assertEquals("Homo.sapiens-1", tokens.get(0).getText());
		assertEquals(LexerTokenType.SYMBOL, tokens.get(0).getType());
		assertEquals(LexerTokenType.NUMBER, tokens.get(1).getType());
		assertEquals(LexerTokenType.SYMBOL, tokens.get(2).getType());
		assertEquals(LexerTokenType.SYMBOL, tokens.get(3).getType());
		assertEquals("x/y", tokens.get(4).getText());
	}
	
	public void testCommentsAndTags() {
		NewickLexer lexer = new NewickLexer();
		List<LexerToken> tokens = lexer.analyze("A[&support=0.9]{2}");
		assertEquals(3, tokens.size());
		assertEquals(LexerTokenType.COMMENT, tokens.get(1).getType());
		assertEquals("&support=0.9", tokens.get(1).getValue());
		assertEquals(LexerTokenType.TAG, tokens.get(2).getType());
		assertEquals("2", tokens.get(2).getValue());
		
		lexer.setIncludeCommentTokens(false);
		tokens = lexer.analyze("A[comment]");
		assertEquals(1, tokens.size());
	}
	
	public void testSigns() {
		NewickLexer lexer = new NewickLexer();
		List<LexerToken> tokens = lexer.analyze(":-0.5");
		assertEquals(2, tokens.size());
		assertEquals("-0.5", tokens.get(1).getText());
		lexer.setGlueSignToNumber(false);
		tokens = lexer.analyze(":-0.5");
		assertEquals(3, tokens.size());
		assertTrue(tokens.get(1).isOperator('-'));
		assertEquals("0.5", tokens.get(2).getText());
	}
	
	public void testErrors() {
		NewickLexer lexer = new NewickLexer();
		lexer.analyze("(A,B)[open;\n");
		assertEquals(1, lexer.getErrors().size());
		assertEquals("Unterminated comment", lexer.getErrors().get(0).getValue());
		lexer.analyze("(A{x,B);");
		assertEquals(1, lexer.getErrors().size());
		assertEquals("Unterminated tag", lexer.getErrors().get(0).getValue());
		assertEquals(3, lexer.getErrors().get(0).getColumn());
		lexer.analyze("(A,\u0001B);");
		assertEquals(1, lexer.getErrors().size());
		assertEquals(4, lexer.getErrors().get(0).getColumn());
	}
	
	public void testLabelCharacters() {
		assertTrue(NewickLexer.isLabelCharacter('a'));
		assertTrue(NewickLexer.isLabelCharacter('.'));
		assertTrue(NewickLexer.isLabelCharacter('|'));
		assertFalse(NewickLexer.isLabelCharacter(':'));
		assertFalse(NewickLexer.isLabelCharacter('='));
		assertFalse(NewickLexer.isLabelCharacter(' '));
		assertFalse(NewickLexer.isLabelCharacter('\''));
	}
}
