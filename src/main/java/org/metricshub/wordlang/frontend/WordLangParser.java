package org.metricshub.wordlang.frontend;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * WordLang
 * ჻჻჻჻჻჻
 * Copyright (C) 2006 - 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.metricshub.wordlang.frontend.ast.AssignAst;
import org.metricshub.wordlang.frontend.ast.AstNode;
import org.metricshub.wordlang.frontend.ast.BinarySetOpAst;
import org.metricshub.wordlang.frontend.ast.FilterAst;
import org.metricshub.wordlang.frontend.ast.FilterOutAst;
import org.metricshub.wordlang.frontend.ast.LiteralAst;
import org.metricshub.wordlang.frontend.ast.LoadAst;
import org.metricshub.wordlang.frontend.ast.ParserException;
import org.metricshub.wordlang.frontend.ast.PrintAst;
import org.metricshub.wordlang.frontend.ast.Program;
import org.metricshub.wordlang.frontend.ast.StatementBlockAst;
import org.metricshub.wordlang.frontend.ast.VariableRefAst;
import org.metricshub.wordlang.util.ScriptSource;

/**
 * Converts a WordLang script into a syntax tree.
 * <p>
 * The whole script is tokenized first, then parsed by recursive descent.
 * Variable names are resolved to slots as they are parsed, through the
 * {@link SymbolTable}, so the resulting tree only contains slot indices.
 * The first error stops the parse with a {@link ParserException}.
 * <p>
 * A parser instance parses a single script.
 */
public class WordLangParser {

	private final boolean decodeEscapes;

	private String sourceDescription;
	private SymbolTable symbolTable;
	private List<Token> tokens;
	private int tokenIdx;

	/**
	 * @param decodeEscapes whether backslash escapes in string literals are
	 *        decoded, or kept verbatim
	 */
	public WordLangParser(boolean decodeEscapes) {
		this.decodeEscapes = decodeEscapes;
	}

	/**
	 * Parse the script served by the specified source.
	 *
	 * @param scriptSource the script
	 * @return the parsed program
	 * @throws IOException upon an IO error while reading the script
	 * @throws ParserException upon a syntax error
	 */
	public Program parse(ScriptSource scriptSource) throws IOException {
		if (scriptSource == null) {
			throw new IOException("No script source supplied");
		}
		List<Token> scriptTokens;
		try (Reader reader = scriptSource.getReader()) {
			scriptTokens = new Lexer().tokenize(reader);
		}
		return parse(scriptSource.getDescription(), scriptTokens);
	}

	/**
	 * Parse an already tokenized script.
	 *
	 * @param description origin of the script, for error messages
	 * @param scriptTokens significant tokens of the script
	 * @return the parsed program
	 * @throws ParserException upon a syntax error
	 */
	public Program parse(String description, List<Token> scriptTokens) {
		if (tokens != null) {
			throw new IllegalStateException("A WordLangParser instance parses a single script");
		}
		this.sourceDescription = description;
		this.symbolTable = new SymbolTable(description);
		this.tokens = Collections.unmodifiableList(new ArrayList<Token>(scriptTokens));
		this.tokenIdx = 0;
		return PROGRAM();
	}

	// TOKEN HANDLING

	private Token currentToken() {
		if (tokenIdx < tokens.size()) {
			return tokens.get(tokenIdx);
		}
		int lastLine = tokens.isEmpty() ? 1 : tokens.get(tokens.size() - 1).getLine();
		return new Token(TokenKind.EOF, "", lastLine);
	}

	private Token useToken() {
		Token token = currentToken();
		if (tokenIdx < tokens.size()) {
			tokenIdx++;
		}
		return token;
	}

	private Token useToken(int requiredKind) {
		Token token = currentToken();
		if (!token.is(requiredKind)) {
			throw parserException(
					token,
					"Expected token type " + TokenKind.name(requiredKind) + ", but found " + TokenKind.name(token.getKind()));
		}
		return useToken();
	}

	private Token useToken(int requiredKind, String errorMessage) {
		if (!currentToken().is(requiredKind)) {
			throw parserException(currentToken(), errorMessage);
		}
		return useToken();
	}

	private boolean useTokenIf(int kind) {
		if (currentToken().is(kind)) {
			useToken();
			return true;
		}
		return false;
	}

	// RECURSIVE DESCENT PARSER:
	// CHECKSTYLE.OFF: MethodName

	// PROGRAM : STATEMENT* EOF
	Program PROGRAM() {
		int line = currentToken().getLine();
		List<AstNode> statements = new ArrayList<AstNode>();
		while (!currentToken().is(TokenKind.EOF)) {
			addStatement(statements, STATEMENT());
		}
		return new Program(sourceDescription, new StatementBlockAst(line, statements), symbolTable.slotNames());
	}

	// STATEMENT : DECLARATION | PRINT_STATEMENT | BLOCK | ';' | EXPRESSION ';'
	// returns null for statements that do nothing
	AstNode STATEMENT() {
		Token token = currentToken();
		switch (token.getKind()) {
		case TokenKind.LIST:
			return DECLARATION();
		case TokenKind.PRINT:
			return PRINT_STATEMENT();
		case TokenKind.FOREACH:
			throw parserException(token, "'foreach' loops are not implemented.");
		case '{':
			return BLOCK();
		case ';':
			useToken();
			return null;
		default:
			AstNode expression = EXPRESSION();
			useToken(';');
			return expression;
		}
	}

	// DECLARATION : 'List' ID [ '=' EXPRESSION ] ';'
	AstNode DECLARATION() {
		useToken(TokenKind.LIST);
		Token variable = useToken(TokenKind.IDENTIFIER);
		int slot = symbolTable.declare(variable.getLine(), variable.getText());

		if (useTokenIf(';')) {
			return null;
		}
		Token equals = useToken('=', "Expected ';' or '='.");

		VariableRefAst target = new VariableRefAst(variable.getLine(), slot, variable.getText());
		AstNode value = EXPRESSION();
		useToken(';');
		return new AssignAst(equals.getLine(), target, value);
	}

	// PRINT_STATEMENT : 'print' '(' EXPRESSION [ ',' EXPRESSION ]* ')' ';'
	AstNode PRINT_STATEMENT() {
		Token print = useToken(TokenKind.PRINT);
		useToken('(');
		List<AstNode> arguments = new ArrayList<AstNode>();
		do {
			arguments.add(EXPRESSION());
		} while (useTokenIf(','));
		useToken(')');
		useToken(';');
		return new PrintAst(print.getLine(), arguments);
	}

	// BLOCK : '{' STATEMENT* '}'
	AstNode BLOCK() {
		Token open = useToken('{');
		symbolTable.pushScope();
		List<AstNode> statements = new ArrayList<AstNode>();
		while (!currentToken().is('}') && !currentToken().is(TokenKind.EOF)) {
			addStatement(statements, STATEMENT());
		}
		symbolTable.popScope();
		useToken('}');
		return new StatementBlockAst(open.getLine(), statements);
	}

	// EXPRESSION : ASSIGNMENT_EXPRESSION
	AstNode EXPRESSION() {
		return ASSIGNMENT_EXPRESSION();
	}

	// ASSIGNMENT_EXPRESSION : ADDITIVE_EXPRESSION [ '=' ASSIGNMENT_EXPRESSION ]
	AstNode ASSIGNMENT_EXPRESSION() {
		AstNode lhs = ADDITIVE_EXPRESSION();
		if (currentToken().is('=')) {
			Token equals = useToken();
			if (!(lhs instanceof VariableRefAst)) {
				throw parserException(equals, "Left side of '=' must be a variable.");
			}
			// right associative
			AstNode rhs = ASSIGNMENT_EXPRESSION();
			return new AssignAst(equals.getLine(), (VariableRefAst) lhs, rhs);
		}
		return lhs;
	}

	// ADDITIVE_EXPRESSION : PIPE_EXPRESSION [ ('+' | '-') PIPE_EXPRESSION ]*
	AstNode ADDITIVE_EXPRESSION() {
		AstNode lhs = PIPE_EXPRESSION();
		while (currentToken().is('+') || currentToken().is('-')) {
			Token operator = useToken();
			AstNode rhs = PIPE_EXPRESSION();
			lhs = new BinarySetOpAst(
					operator.getLine(),
					BinarySetOpAst.Operator.fromSymbol(operator.getKind()),
					lhs,
					rhs);
		}
		return lhs;
	}

	// PIPE_EXPRESSION : TERM [ '|' ('filter' | 'filter_out') '(' EXPRESSION ')' ]*
	AstNode PIPE_EXPRESSION() {
		AstNode lhs = TERM();
		while (useTokenIf('|')) {
			Token filter = useToken();
			if (!filter.is(TokenKind.FILTER) && !filter.is(TokenKind.FILTER_OUT)) {
				throw parserException(filter, "Unexpected symbol " + TokenKind.name(filter.getKind()) + " after '|'.");
			}
			useToken('(');
			AstNode filters = EXPRESSION();
			useToken(')');
			if (filter.is(TokenKind.FILTER)) {
				lhs = new FilterAst(filter.getLine(), lhs, filters);
			} else {
				lhs = new FilterOutAst(filter.getLine(), lhs, filters);
			}
		}
		return lhs;
	}

	// TERM : ID | 'load' '(' EXPRESSION ')' | STRING | '(' EXPRESSION ')'
	AstNode TERM() {
		Token token = useToken();
		switch (token.getKind()) {
		case TokenKind.IDENTIFIER: {
			int slot = symbolTable.lookup(token.getText());
			if (slot == SymbolTable.NO_SLOT) {
				throw parserException(token, "Unknown variable '" + token.getText() + "'.");
			}
			return new VariableRefAst(token.getLine(), slot, token.getText());
		}
		case TokenKind.LOAD: {
			useToken('(');
			AstNode fileNames = EXPRESSION();
			useToken(')');
			return new LoadAst(token.getLine(), fileNames);
		}
		case TokenKind.STRING: {
			String text = token.getText();
			String word = text.substring(1, text.length() - 1);
			if (decodeEscapes) {
				word = decodeEscapes(word);
			}
			return new LiteralAst(token.getLine(), Collections.singleton(word));
		}
		case '(': {
			AstNode expression = EXPRESSION();
			useToken(')');
			return expression;
		}
		default:
			throw parserException(token, "Expected expression. Found " + TokenKind.name(token.getKind()) + ".");
		}
	}

	// CHECKSTYLE.ON: MethodName

	private static void addStatement(List<AstNode> statements, AstNode statement) {
		if (statement != null) {
			statements.add(statement);
		}
	}

	/**
	 * Decodes <code>\n</code>, <code>\t</code> and <code>\r</code>; any other
	 * escaped character stands for itself.
	 */
	private static String decodeEscapes(String literal) {
		StringBuilder decoded = new StringBuilder(literal.length());
		for (int i = 0; i < literal.length(); i++) {
			char c = literal.charAt(i);
			if (c != '\\' || i + 1 == literal.length()) {
				decoded.append(c);
				continue;
			}
			c = literal.charAt(++i);
			switch (c) {
			case 'n':
				decoded.append('\n');
				break;
			case 't':
				decoded.append('\t');
				break;
			case 'r':
				decoded.append('\r');
				break;
			default:
				decoded.append(c);
				break;
			}
		}
		return decoded.toString();
	}

	private ParserException parserException(Token token, String msg) {
		return new ParserException(msg, sourceDescription, token.getLine());
	}
}
