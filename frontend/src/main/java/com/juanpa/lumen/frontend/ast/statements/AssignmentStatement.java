// File: src/main/java/com/juanpa/lumen/frontend/ast/statements/AssignmentStatement.java

package com.juanpa.lumen.frontend.ast.statements;

import com.juanpa.lumen.frontend.ast.ASTNode;
import com.juanpa.lumen.frontend.ast.ASTVisitor;
import com.juanpa.lumen.frontend.ast.expressions.Expression;
import com.juanpa.lumen.frontend.ast.expressions.FinalExpression;
import com.juanpa.lumen.frontend.ast.expressions.Logic;

import java.util.Objects;

/**
 * AST node representing an assignment (e.g., x = 5, flag = a && b, y *= 2).
 * Exactly one of the arithmetic value and the logic value is set.
 * Only plain `=` may carry a logic value.
 */
public class AssignmentStatement implements Statement
{
	public enum Operator
	{
		ASSIGN("="),
		PLUS_ASSIGN("+="),
		MINUS_ASSIGN("-="),
		STAR_ASSIGN("*="),
		SLASH_ASSIGN("/=");

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

	private final FinalExpression target;
	private final Operator operator;
	private final Expression value;      // Arithmetic right-hand side, or null
	private final Logic logicValue;      // Logic right-hand side, or null

	private AssignmentStatement(FinalExpression target, Operator operator, Expression value, Logic logicValue)
	{
		this.target = Objects.requireNonNull(target, "target");
		this.operator = Objects.requireNonNull(operator, "operator");
		if (!target.isIdentifier())
		{
			throw new IllegalArgumentException("Assignment target must be an identifier, got " + target.getKind());
		}
		this.value = value;
		this.logicValue = logicValue;
	}

	public static AssignmentStatement arithmetic(FinalExpression target, Operator operator, Expression value)
	{
		return new AssignmentStatement(target, operator, Objects.requireNonNull(value, "value"), null);
	}

	public static AssignmentStatement logic(FinalExpression target, Logic value)
	{
		return new AssignmentStatement(target, Operator.ASSIGN, null, Objects.requireNonNull(value, "value"));
	}

	public FinalExpression getTarget()
	{
		return target;
	}

	public Operator getOperator()
	{
		return operator;
	}

	/**
	 * @return The arithmetic right-hand side, or null if this assignment has a logic value.
	 */
	public Expression getValue()
	{
		return value;
	}

	/**
	 * @return The logic right-hand side, or null if this assignment has an arithmetic value.
	 */
	public Logic getLogicValue()
	{
		return logicValue;
	}

	public boolean isLogic()
	{
		return logicValue != null;
	}

	/**
	 * @return Whichever right-hand side is set.
	 */
	public ASTNode getRightHandSide()
	{
		return isLogic() ? logicValue : value;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitAssignmentStatement(this);
	}

	@Override
	public String toString()
	{
		return target + " " + operator.getSymbol() + " " + getRightHandSide();
	}
}
