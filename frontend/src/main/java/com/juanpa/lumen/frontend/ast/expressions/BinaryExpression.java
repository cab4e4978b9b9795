// File: src/main/java/com/juanpa/lumen/frontend/ast/expressions/BinaryExpression.java

package com.juanpa.lumen.frontend.ast.expressions;

import com.juanpa.lumen.frontend.ast.ASTVisitor;

import java.util.Objects;

/**
 * AST node representing a binary arithmetic operation (e.g., a + b, 2 ^ n).
 * It has a left operand, an operator, and a right operand.
 * POW is right-associative, every other operator is left-associative.
 */
public class BinaryExpression implements Expression
{
	public enum Operator
	{
		ADD("+"),
		SUB("-"),
		MUL("*"),
		DIV("/"),
		MOD("%"),
		POW("^");

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

	private final Expression left;
	private final Operator operator;
	private final Expression right;

	public BinaryExpression(Expression left, Operator operator, Expression right)
	{
		this.left = Objects.requireNonNull(left, "left");
		this.operator = Objects.requireNonNull(operator, "operator");
		this.right = Objects.requireNonNull(right, "right");
	}

	public Expression getLeft()
	{
		return left;
	}

	public Operator getOperator()
	{
		return operator;
	}

	public Expression getRight()
	{
		return right;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitBinaryExpression(this);
	}

	@Override
	public String toString()
	{
		return "(" + left + " " + operator.getSymbol() + " " + right + ")";
	}
}
