// File: src/main/java/com/juanpa/lumen/frontend/lexer/TokenSource.java
package com.juanpa.lumen.frontend.lexer;

/**
 * A forward-only cursor over a finite sequence of tokens terminated by {@link TokenType#EOF}.
 * <p>
 * The only way to move backwards is to restore a position previously obtained from {@link #mark()};
 * the parser uses this for bounded lookahead when two grammar alternatives share a prefix.
 */
public interface TokenSource
{
	/**
	 * @return The token under the cursor. Once the end is reached this is always the EOF token.
	 */
	Token current();

	/**
	 * Moves the cursor to the next token. Has no effect when the cursor is on EOF.
	 *
	 * @return The token that was current before advancing.
	 */
	Token advance();

	/**
	 * Looks ahead without moving the cursor.
	 *
	 * @param offset 0 for the current token, 1 for the next one, and so on.
	 * @return The token at the offset, or EOF when the offset runs past the end.
	 */
	Token peek(int offset);

	default boolean is(TokenType type)
	{
		return current().getType() == type;
	}

	default boolean isOneOf(TokenType... types)
	{
		TokenType currentType = current().getType();
		for (TokenType type : types)
		{
			if (currentType == type)
			{
				return true;
			}
		}
		return false;
	}

	default boolean isAtEnd()
	{
		return is(TokenType.EOF);
	}

	/**
	 * Snapshots the cursor position.
	 *
	 * @return An opaque position to hand back to {@link #reset(int)}.
	 */
	int mark();

	/**
	 * Restores a position obtained from {@link #mark()}.
	 *
	 * @param mark The snapshot to return to.
	 */
	void reset(int mark);
}
