// File: src/main/java/com/juanpa/lumen/frontend/ast/expressions/LogicalExpression.java

package com.juanpa.lumen.frontend.ast.expressions;

import com.juanpa.lumen.frontend.ast.ASTVisitor;

import java.util.Objects;

/**
 * AST node combining two logic operands with `&&` or `||`.
 * Both operators bind equally tight and associate to the left.
 */
public class LogicalExpression implements Logic
{
	public enum Operator
	{
		AND("&&"),
		OR("||");

		private final String symbol;

		Operator(String symbol)
		{
			this.symbol = symbol;
		}

		public String getSymbol()
		{
			return symbol;
		}
	}

	private final Logic left;
	private final Operator operator;
	private final Logic right;

	public LogicalExpression(Logic left, Operator operator, Logic right)
	{
		this.left = Objects.requireNonNull(left, "left");
		this.operator = Objects.requireNonNull(operator, "operator");
		this.right = Objects.requireNonNull(right, "right");
	}

	public Logic getLeft()
	{
		return left;
	}

	public Operator getOperator()
	{
		return operator;
	}

	public Logic getRight()
	{
		return right;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitLogicalExpression(this);
	}

	@Override
	public String toString()
	{
		return "(" + left + " " + operator.getSymbol() + " " + right + ")";
	}
}
