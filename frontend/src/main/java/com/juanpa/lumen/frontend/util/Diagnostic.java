// File: src/main/java/com/juanpa/lumen/frontend/util/Diagnostic.java
package com.juanpa.lumen.frontend.util;

import com.juanpa.lumen.frontend.lexer.Token;
import com.juanpa.lumen.frontend.lexer.TokenType;

/**
 * A single syntax error found by the parser.
 *
 * @param kind     The category of the error.
 * @param message  Human-readable description.
 * @param line     Line of the offending token.
 * @param column   Column of the offending token.
 * @param expected The token type that was required, if the error is about a specific token; otherwise null.
 * @param actual   The token type that was found, if known; otherwise null.
 */
public record Diagnostic(
		Kind kind,
		String message,
		int line,
		int column,
		TokenType expected,
		TokenType actual)
{
	public enum Kind
	{
		UNEXPECTED_TOKEN,
		MALFORMED_EXPRESSION,
		INITIALIZER_COUNT_MISMATCH,
		UNTERMINATED_BLOCK,
		GENERAL          // Free-form error outside the parser's categories
	}

	/**
	 * A specific token type was required but another one was found.
	 */
	public static Diagnostic unexpectedToken(TokenType expected, Token found)
	{
		String message = "Expected " + describe(expected) + " but found " + describe(found) + ".";
		return new Diagnostic(Kind.UNEXPECTED_TOKEN, message, found.getLine(), found.getColumn(), expected, found.getType());
	}

	/**
	 * The current token cannot start or continue the construct being parsed.
	 */
	public static Diagnostic unexpectedToken(String expectation, Token found)
	{
		String message = "Expected " + expectation + " but found " + describe(found) + ".";
		return new Diagnostic(Kind.UNEXPECTED_TOKEN, message, found.getLine(), found.getColumn(), null, found.getType());
	}

	public static Diagnostic malformedExpression(String context, Token found)
	{
		String message = "Malformed " + context + " at " + describe(found) + ".";
		return new Diagnostic(Kind.MALFORMED_EXPRESSION, message, found.getLine(), found.getColumn(), null, found.getType());
	}

	/**
	 * An error described only by its message and position.
	 */
	public static Diagnostic general(int line, int column, String message)
	{
		return new Diagnostic(Kind.GENERAL, message, line, column, null, null);
	}

	public static Diagnostic initializerCountMismatch(int declaredCount, int initializerCount, Token at)
	{
		String message = "Declared " + declaredCount + " variable(s) but found " + initializerCount + " initializer(s).";
		return new Diagnostic(Kind.INITIALIZER_COUNT_MISMATCH, message, at.getLine(), at.getColumn(), null, at.getType());
	}

	public static Diagnostic unterminatedBlock(TokenType expectedTerminator, Token found)
	{
		String message = "Block is not terminated, expected " + describe(expectedTerminator) + " before end of input.";
		return new Diagnostic(Kind.UNTERMINATED_BLOCK, message, found.getLine(), found.getColumn(), expectedTerminator, found.getType());
	}

	private static String describe(Token token)
	{
		if (token.getType() == TokenType.EOF)
		{
			return "end of input";
		}
		return "'" + token.getLexeme() + "' (" + token.getType() + ")";
	}

	private static String describe(TokenType type)
	{
		switch (type)
		{
			case IDENTIFIER:
				return "an identifier";
			case NUMBER:
				return "a number";
			case EOF:
				return "end of input";
			default:
				return type.name();
		}
	}

	@Override
	public String toString()
	{
		return "[" + kind + "] Line " + line + ", Column " + column + ": " + message;
	}
}
