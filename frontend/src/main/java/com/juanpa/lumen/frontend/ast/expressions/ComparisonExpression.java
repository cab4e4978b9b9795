// File: src/main/java/com/juanpa/lumen/frontend/ast/expressions/ComparisonExpression.java

package com.juanpa.lumen.frontend.ast.expressions;

import com.juanpa.lumen.frontend.ast.ASTVisitor;

import java.util.Objects;

/**
 * AST node for the operands of a logic expression.
 * Either a relational comparison of two arithmetic expressions (e.g., a + 1 >= b),
 * or one of the operand-less forms `true`, `false`, or a bare identifier used as a boolean.
 */
public class ComparisonExpression implements Logic
{
	public enum Operator
	{
		EQ("=="),
		NEQ("!="),
		GT(">"),
		LT("<"),
		GTE(">="),
		LTE("<="),
		LITERAL_TRUE("true"),
		LITERAL_FALSE("false"),
		IDENTIFIER_REF("");

		private final String symbol;

		Operator(String symbol)
		{
			this.symbol = symbol;
		}

		public String getSymbol()
		{
			return symbol;
		}

		/**
		 * @return True for the operand-less forms (true, false, identifier).
		 */
		public boolean isStandalone()
		{
			return this == LITERAL_TRUE || this == LITERAL_FALSE || this == IDENTIFIER_REF;
		}
	}

	private final Expression left;   // Null for the standalone forms
	private final Expression right;  // Null for the standalone forms
	private final Operator operator;
	private final String value;      // Literal/identifier spelling, or the relational operator's spelling

	private ComparisonExpression(Expression left, Expression right, Operator operator, String value)
	{
		this.left = left;
		this.right = right;
		this.operator = operator;
		this.value = value;
	}

	/**
	 * Creates a relational comparison such as `a < b`.
	 */
	public static ComparisonExpression relational(Expression left, Operator operator, Expression right)
	{
		Objects.requireNonNull(operator, "operator");
		if (operator.isStandalone())
		{
			throw new IllegalArgumentException("Operator " + operator + " does not take operands.");
		}
		return new ComparisonExpression(Objects.requireNonNull(left, "left"), Objects.requireNonNull(right, "right"), operator, operator.getSymbol());
	}

	/**
	 * Creates one of the operand-less forms. The value holds the literal or identifier spelling.
	 */
	public static ComparisonExpression standalone(Operator operator, String value)
	{
		Objects.requireNonNull(operator, "operator");
		if (!operator.isStandalone())
		{
			throw new IllegalArgumentException("Operator " + operator + " requires two operands.");
		}
		return new ComparisonExpression(null, null, operator, Objects.requireNonNull(value, "value"));
	}

	public Expression getLeft()
	{
		return left;
	}

	public Expression getRight()
	{
		return right;
	}

	public Operator getOperator()
	{
		return operator;
	}

	public String getValue()
	{
		return value;
	}

	public boolean isStandalone()
	{
		return operator.isStandalone();
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitComparisonExpression(this);
	}

	@Override
	public String toString()
	{
		if (isStandalone())
		{
			return value;
		}
		return "(" + left + " " + operator.getSymbol() + " " + right + ")";
	}
}
