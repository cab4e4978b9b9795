// File: src/main/java/com/juanpa/lumen/frontend/lexer/Token.java
package com.juanpa.lumen.frontend.lexer;

import java.util.Objects;

/**
 * Represents a single classified token handed to the parser.
 * Each token carries its type, the source text (lexeme) and
 * its position in the source for error reporting.
 */
public class Token
{
	private final TokenType type;    // The classification of the token (e.g., IDENTIFIER, NUMBER, PLUS)
	private final String lexeme;     // The actual text of the token (e.g., "count", "42", "+")
	private final int line;          // The line number where the token starts
	private final int column;        // The column number where the token starts

	/**
	 * Constructs a new Token instance.
	 *
	 * @param type   The TokenType of this token.
	 * @param lexeme The raw string value of the token from the source code.
	 * @param line   The line number where this token begins.
	 * @param column The column number where this token begins.
	 */
	public Token(TokenType type, String lexeme, int line, int column)
	{
		this.type = Objects.requireNonNull(type, "type");
		this.lexeme = Objects.requireNonNull(lexeme, "lexeme");
		this.line = line;
		this.column = column;
	}

	/**
	 * Creates the end-of-input sentinel at the given position.
	 */
	public static Token eof(int line, int column)
	{
		return new Token(TokenType.EOF, "", line, column);
	}

	public TokenType getType()
	{
		return type;
	}

	public String getLexeme()
	{
		return lexeme;
	}

	public int getLine()
	{
		return line;
	}

	public int getColumn()
	{
		return column;
	}

	public boolean is(TokenType expected)
	{
		return type == expected;
	}

	/**
	 * Format: "TokenType 'lexeme' (Line:L, Col:C)"
	 */
	@Override
	public String toString()
	{
		return type + " '" + lexeme + "' (Line:" + line + ", Col:" + column + ")";
	}

	/**
	 * Compares type and lexeme only; two tokens at different positions
	 * with the same spelling are considered equal.
	 */
	@Override
	public boolean equals(Object o)
	{
		if (this == o)
			return true;
		if (o == null || getClass() != o.getClass())
			return false;

		Token token = (Token) o;
		return type == token.type && lexeme.equals(token.lexeme);
	}

	@Override
	public int hashCode()
	{
		return 31 * type.hashCode() + lexeme.hashCode();
	}
}
