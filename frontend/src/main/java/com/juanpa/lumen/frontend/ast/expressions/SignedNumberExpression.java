// File: src/main/java/com/juanpa/lumen/frontend/ast/expressions/SignedNumberExpression.java

package com.juanpa.lumen.frontend.ast.expressions;

import com.juanpa.lumen.frontend.ast.ASTVisitor;

import java.util.Objects;

/**
 * AST node for a numeric literal with an explicit leading sign (e.g., -5, +3).
 * Only literals are wrapped; a sign in front of a parenthesized expression
 * becomes a {@link NegatedExpression} or is dropped.
 */
public class SignedNumberExpression implements Expression
{
	public enum Sign
	{
		PLUS,
		MINUS
	}

	private final Sign sign;
	private final String value; // Digits without the sign

	public SignedNumberExpression(Sign sign, String value)
	{
		this.sign = Objects.requireNonNull(sign, "sign");
		this.value = Objects.requireNonNull(value, "value");
	}

	public Sign getSign()
	{
		return sign;
	}

	public String getValue()
	{
		return value;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitSignedNumberExpression(this);
	}

	@Override
	public String toString()
	{
		return (sign == Sign.MINUS ? "-" : "+") + value;
	}
}
