// File: src/main/java/com/juanpa/lumen/frontend/lexer/TokenStream.java
package com.juanpa.lumen.frontend.lexer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * List-backed {@link TokenSource}. The scanner hands over a complete token list;
 * an EOF token is appended if the list does not already end with one.
 */
public class TokenStream implements TokenSource
{
	private final List<Token> tokens;
	private int current = 0; // Current position in the token list

	public TokenStream(List<Token> tokens)
	{
		List<Token> copy = new ArrayList<>(tokens);
		if (copy.isEmpty() || copy.get(copy.size() - 1).getType() != TokenType.EOF)
		{
			Token last = copy.isEmpty() ? null : copy.get(copy.size() - 1);
			copy.add(last == null ? Token.eof(1, 1) : Token.eof(last.getLine(), last.getColumn() + last.getLexeme().length()));
		}
		this.tokens = Collections.unmodifiableList(copy);
	}

	@Override
	public Token current()
	{
		return tokens.get(current);
	}

	@Override
	public Token advance()
	{
		Token previous = current();
		if (!isAtEnd())
		{
			current++;
		}
		return previous;
	}

	@Override
	public Token peek(int offset)
	{
		if (current + offset >= tokens.size())
		{
			return tokens.get(tokens.size() - 1);
		}
		return tokens.get(current + offset);
	}

	@Override
	public int mark()
	{
		return current;
	}

	@Override
	public void reset(int mark)
	{
		if (mark < 0 || mark >= tokens.size())
		{
			throw new IllegalArgumentException("Invalid token stream mark: " + mark);
		}
		current = mark;
	}

	/**
	 * @return The number of tokens including the trailing EOF.
	 */
	public int size()
	{
		return tokens.size();
	}

	public List<Token> getTokens()
	{
		return tokens;
	}
}
