package org.metricshub.wordlang.frontend;

import static org.junit.Assert.*;

import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;

public class LexerTest {

	private static List<Integer> kinds(List<Token> tokens) {
		List<Integer> kinds = new ArrayList<Integer>();
		for (Token token : tokens) {
			kinds.add(token.getKind());
		}
		return kinds;
	}

	private static List<Integer> kinds(int... expected) {
		List<Integer> kinds = new ArrayList<Integer>();
		for (int kind : expected) {
			kinds.add(kind);
		}
		return kinds;
	}

	@Test
	public void testDeclaration() {
		List<Token> tokens = new Lexer().tokenize("List a = \"cat\" + \"dog\";");
		assertEquals(
				kinds(TokenKind.LIST, TokenKind.IDENTIFIER, '=', TokenKind.STRING, '+', TokenKind.STRING, ';'),
				kinds(tokens));
		assertEquals("a", tokens.get(1).getText());
		assertEquals("\"cat\"", tokens.get(3).getText());
	}

	@Test
	public void testMaximalMunchOnKeywords() {
		List<Token> tokens = new Lexer().tokenize("Lists filter_out filter_outs filter_ inx in List");
		assertEquals(
				kinds(
						TokenKind.IDENTIFIER,
						TokenKind.FILTER_OUT,
						TokenKind.IDENTIFIER,
						TokenKind.IDENTIFIER,
						TokenKind.IDENTIFIER,
						TokenKind.IN,
						TokenKind.LIST),
				kinds(tokens));
		assertEquals("filter_outs", tokens.get(2).getText());
	}

	@Test
	public void testKeywordsAreCaseSensitive() {
		List<Token> tokens = new Lexer().tokenize("list PRINT Print print");
		assertEquals(
				kinds(TokenKind.IDENTIFIER, TokenKind.IDENTIFIER, TokenKind.IDENTIFIER, TokenKind.PRINT),
				kinds(tokens));
	}

	@Test
	public void testCommentsAndWhitespaceAreDropped() {
		List<Token> tokens = new Lexer().tokenize("// a comment with \"quotes\"\nprint(a); // trailing\n");
		assertEquals(kinds(TokenKind.PRINT, '(', TokenKind.IDENTIFIER, ')', ';'), kinds(tokens));
		assertEquals(2, tokens.get(0).getLine());
	}

	@Test
	public void testCommentAndWhitespaceTokens() {
		Lexer lexer = new Lexer();
		String input = "a //x\n b";
		assertEquals(TokenKind.IDENTIFIER, lexer.nextToken(input).getKind());
		assertEquals(TokenKind.WHITESPACE, lexer.nextToken(input).getKind());
		Token comment = lexer.nextToken(input);
		assertEquals(TokenKind.COMMENT, comment.getKind());
		assertEquals("//x", comment.getText());
		Token newline = lexer.nextToken(input);
		assertEquals(TokenKind.WHITESPACE, newline.getKind());
		assertEquals(1, newline.getLine());
		assertEquals(2, lexer.getCurrentLine());
		lexer.nextToken(input);
		Token b = lexer.nextToken(input);
		assertEquals("b", b.getText());
		assertEquals(2, b.getLine());
		assertEquals(TokenKind.EOF, lexer.nextToken(input).getKind());
		assertEquals(TokenKind.EOF, lexer.nextToken(input).getKind());
	}

	@Test
	public void testStringWithEscapedQuote() {
		List<Token> tokens = new Lexer().tokenize("\"a\\\"b\" ;");
		assertEquals(kinds(TokenKind.STRING, ';'), kinds(tokens));
		assertEquals("\"a\\\"b\"", tokens.get(0).getText());
	}

	@Test
	public void testStringEndingWithBackslash() {
		List<Token> tokens = new Lexer().tokenize("\"a\\\\\"");
		assertEquals(kinds(TokenKind.STRING), kinds(tokens));
		assertEquals("\"a\\\\\"", tokens.get(0).getText());
	}

	@Test
	public void testLongestStringWinsAfterBackslashQuote() {
		List<Token> tokens = new Lexer().tokenize("\"a\\\\\" + \"b\"");
		assertEquals(kinds(TokenKind.STRING, TokenKind.IDENTIFIER, '"'), kinds(tokens));
		assertEquals("\"a\\\\\" + \"", tokens.get(0).getText());
	}

	@Test
	public void testStringsDoNotSpanLines() {
		List<Token> tokens = new Lexer().tokenize("\"ab\ncd\"");
		assertEquals('"', tokens.get(0).getKind());
		assertEquals(TokenKind.IDENTIFIER, tokens.get(1).getKind());
		assertEquals("ab", tokens.get(1).getText());
		assertEquals(TokenKind.IDENTIFIER, tokens.get(2).getKind());
		assertEquals(2, tokens.get(2).getLine());
		assertEquals('"', tokens.get(3).getKind());
	}

	@Test
	public void testUnknownCharactersBecomeSingleCharacterTokens() {
		List<Token> tokens = new Lexer().tokenize("a#1é|");
		assertEquals(kinds(TokenKind.IDENTIFIER, '#', '1', 'é', '|'), kinds(tokens));
		assertEquals("é", tokens.get(3).getText());
	}

	@Test
	public void testNulCharacterIsNotEndOfInput() {
		List<Token> tokens = new Lexer().tokenize("a\u0000b");
		assertEquals(kinds(TokenKind.IDENTIFIER, 0, TokenKind.IDENTIFIER), kinds(tokens));
	}

	@Test
	public void testLineNumbers() throws Exception {
		List<Token> tokens = new Lexer().tokenize(new StringReader("List a;\n\n  print(a);\r\n{\n}"));
		assertEquals(1, tokens.get(0).getLine());
		assertEquals(3, tokens.get(3).getLine());
		Token close = tokens.get(tokens.size() - 1);
		assertEquals('}', close.getKind());
		assertEquals(5, close.getLine());
	}

	@Test
	public void testEmptyInput() {
		Lexer lexer = new Lexer();
		assertTrue(lexer.tokenize("").isEmpty());
		assertTrue(lexer.tokenize("  // only a comment").isEmpty());
		assertEquals(TokenKind.EOF, lexer.nextToken("").getKind());
	}

	@Test
	public void testTokenToString() {
		Token token = new Token(TokenKind.IDENTIFIER, "abc", 3);
		assertTrue(token.is(TokenKind.IDENTIFIER));
		assertFalse(token.is(TokenKind.STRING));
		assertTrue(token.toString().contains("abc"));
	}
}
