package phylotree.main.io.test;

import java.util.List;

import junit.framework.TestCase;
import phylotree.main.io.BracketMismatchException;
import phylotree.main.io.Lexer;
import phylotree.main.io.LexerException;
import phylotree.main.io.LexerToken;
import phylotree.main.io.LexerTokenType;
import phylotree.main.io.ParseUtils;

public class LexerTest extends TestCase {
	
	public void testBasicTokens() {
		Lexer lexer = new Lexer();
		List<LexerToken> tokens = lexer.analyze("f(x_1, -2.5e3) 'a b'");
		assertEquals(7, tokens.size());
		assertEquals(LexerTokenType.SYMBOL, tokens.get(0).getType());
		assertEquals("f", tokens.get(0).getText());
		assertTrue(tokens.get(1).isBracket('('));
		assertEquals("x_1", tokens.get(2).getText());
		assertTrue(tokens.get(3).isOperator(','));
		assertEquals(LexerTokenType.NUMBER, tokens.get(4).getType());
		assertEquals("-2.5e3", tokens.get(4).getText());
		assertTrue(tokens.get(5).isBracket(')'));
		assertEquals(LexerTokenType.STRING, tokens.get(6).getType());
		assertEquals("'a b'", tokens.get(6).getText());
		assertEquals("a b", tokens.get(6).getValue());
	}
	
	public void testPositions() {
		Lexer lexer = new Lexer();
		List<LexerToken> tokens = lexer.analyze("a\n  bc\n\td");
		assertEquals(3, tokens.size());
		assertEquals(1, tokens.get(0).getLine());
		assertEquals(1, tokens.get(0).getColumn());
		assertEquals(2, tokens.get(1).getLine());
		assertEquals(3, tokens.get(1).getColumn());
		assertEquals(3, tokens.get(2).getLine());
		assertEquals(2, tokens.get(2).getColumn());
	}
	
	public void testWhitespaceTokens() {
		Lexer lexer = new Lexer();
		lexer.setIncludeWhitespaceTokens(true);
		List<LexerToken> tokens = lexer.analyze("a  b");
		assertEquals(3, tokens.size());
		assertEquals(LexerTokenType.WHITESPACE, tokens.get(1).getType());
		assertEquals("  ", tokens.get(1).getText());
	}
	
	public void testGlueSign() {
		Lexer lexer = new Lexer();
		List<LexerToken> tokens = lexer.analyze("1 -2");
		assertEquals(2, tokens.size());
		assertEquals("-2", tokens.get(1).getText());
		
		lexer.setGlueSignToNumber(false);
		tokens = lexer.analyze("1 -2");
		assertEquals(3, tokens.size());
		assertTrue(tokens.get(1).isOperator('-'));
		assertEquals(LexerTokenType.NUMBER, tokens.get(2).getType());
		assertEquals("2", tokens.get(2).getText());
	}
	
	public void testComments() {
		Lexer lexer = new Lexer();
		lexer.setCommentDelimiters('{', '}', true);
		List<LexerToken> tokens = lexer.analyze("a {x {y} z} b");
		assertEquals(2, tokens.size());
		lexer.setIncludeCommentTokens(true);
		tokens = lexer.analyze("a {x {y} z} b");
		assertEquals(3, tokens.size());
		assertEquals(LexerTokenType.COMMENT, tokens.get(1).getType());
		assertEquals("x {y} z", tokens.get(1).getValue());
		
		lexer.setCommentDelimiters('[', ']', false);
		tokens = lexer.analyze("[one\ntwo] c");
		assertEquals(2, tokens.size());
		assertEquals("c", tokens.get(1).getText());
		assertEquals(2, tokens.get(1).getLine());
	}
	
	public void testStringEscapes() {
		Lexer lexer = new Lexer();
		List<LexerToken> tokens = lexer.analyze("\"a\\\"b\\\\c\\n\"");
		assertEquals(1, tokens.size());
		assertEquals("a\"b\\c\n", tokens.get(0).getValue());
	}
	
	public void testErrorsAreCollected() {
		Lexer lexer = new Lexer();
		List<LexerToken> tokens = lexer.analyze("a # b $ 'open");
		assertEquals(5, tokens.size());
		List<LexerToken> errors = lexer.getErrors();
		assertEquals(3, errors.size());
		assertEquals("#", errors.get(0).getText());
		assertEquals(3, errors.get(0).getColumn());
		assertEquals("Unterminated string", errors.get(2).getValue());
		try {
			lexer.checkErrors();
			fail("Lexical errors not reported");
		} catch (LexerException e) {
			assertEquals(1, e.getLine());
			assertEquals(3, e.getColumn());
			assertEquals("#", e.getText());
			assertEquals(3, e.getErrors().size());
		}
	}
	
	public void testValidateBrackets() throws Exception {
		Lexer lexer = new Lexer();
		lexer.analyze("(a [b] {c})");
		lexer.validateBrackets();
		
		lexer.analyze("(a,\n (b)");
		try {
			lexer.validateBrackets();
			fail("Unclosed bracket not reported");
		} catch (BracketMismatchException e) {
			assertEquals(1, e.getLine());
			assertEquals(1, e.getColumn());
			assertEquals("(", e.getToken().getText());
		}
		
		lexer.analyze("(a]");
		try {
			lexer.validateBrackets();
			fail("Mismatched bracket not reported");
		} catch (BracketMismatchException e) {
			assertEquals(3, e.getColumn());
		}
		
		lexer.analyze("a)");
		try {
			lexer.validateBrackets();
			fail("Closing bracket without opening bracket not reported");
		} catch (BracketMismatchException e) {
			assertEquals(2, e.getColumn());
		}
	}
	
	public void testTokenAccess() {
		Lexer lexer = new Lexer();
		lexer.analyze("x y");
		assertEquals(2, lexer.size());
		assertFalse(lexer.isEmpty());
		assertEquals("y", lexer.getToken(1).getText());
		assertTrue(lexer.getToken(2).isEOF());
		assertEquals(4, lexer.getToken(2).getColumn());
		try {
			lexer.getTokens().clear();
			fail("Token list should not be modifiable");
		} catch (UnsupportedOperationException e) {
			// expected
		}
	}
	
	public void testParseUtils() {
		assertTrue(ParseUtils.isNumber("12"));
		assertTrue(ParseUtils.isNumber("-0.5"));
		assertTrue(ParseUtils.isNumber("1e-3"));
		assertFalse(ParseUtils.isNumber("1e"));
		assertFalse(ParseUtils.isNumber(".5"));
		assertFalse(ParseUtils.isNumber("A1"));
		assertFalse(ParseUtils.isNumber("-"));
		assertEquals(0.001, ParseUtils.parseDouble("1e-3"), 1e-12);
		assertEquals("0.123457", ParseUtils.createDecimalFormat(6).format(0.1234567));
		assertEquals("2", ParseUtils.createDecimalFormat(6).format(2.0));
		assertEquals("1234.5", ParseUtils.createDecimalFormat(3).format(1234.5));
		try {
			ParseUtils.parseDouble("abc");
			fail("Invalid number parsed");
		} catch (NumberFormatException e) {
			// expected
		}
	}
}
