// File: src/main/java/com/juanpa/lumen/frontend/ast/expressions/PostfixUnaryExpression.java

package com.juanpa.lumen.frontend.ast.expressions;

import com.juanpa.lumen.frontend.ast.ASTVisitor;
import com.juanpa.lumen.frontend.ast.statements.Statement;

import java.util.Objects;

/**
 * AST node representing a postfix increment or decrement (e.g., x++, y--).
 * It appears both inside arithmetic expressions and as a standalone statement,
 * so it is an {@link Expression} and a {@link Statement} at once.
 * Whether the identifier was declared is a semantic question and is not checked here.
 */
public class PostfixUnaryExpression implements Expression, Statement
{
	public enum Operator
	{
		INCREMENT("++"),
		DECREMENT("--");

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

	private final String identifier; // The variable being modified
	private final Operator operator;

	public PostfixUnaryExpression(String identifier, Operator operator)
	{
		this.identifier = Objects.requireNonNull(identifier, "identifier");
		this.operator = Objects.requireNonNull(operator, "operator");
	}

	public String getIdentifier()
	{
		return identifier;
	}

	public Operator getOperator()
	{
		return operator;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitPostfixUnaryExpression(this);
	}

	@Override
	public String toString()
	{
		return "(" + identifier + operator.getSymbol() + ")";
	}
}
