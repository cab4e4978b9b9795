// File: src/main/java/com/juanpa/lumen/frontend/ast/expressions/NegatedExpression.java

package com.juanpa.lumen.frontend.ast.expressions;

import com.juanpa.lumen.frontend.ast.ASTVisitor;

import java.util.Objects;

/**
 * AST node for a unary minus applied to a parenthesized expression, e.g. `-(a + b)`.
 */
public class NegatedExpression implements Expression
{
	private final Expression expression; // The expression inside the parentheses

	public NegatedExpression(Expression expression)
	{
		this.expression = Objects.requireNonNull(expression, "expression");
	}

	public Expression getExpression()
	{
		return expression;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitNegatedExpression(this);
	}

	@Override
	public String toString()
	{
		return "(-" + expression + ")";
	}
}
