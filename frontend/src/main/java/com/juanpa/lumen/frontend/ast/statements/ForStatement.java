// File: src/main/java/com/juanpa/lumen/frontend/ast/statements/ForStatement.java
package com.juanpa.lumen.frontend.ast.statements;

import com.juanpa.lumen.frontend.ast.ASTVisitor;
import com.juanpa.lumen.frontend.ast.expressions.Logic;
import com.juanpa.lumen.frontend.ast.expressions.PostfixUnaryExpression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * AST node representing a 'for' loop statement.
 * The header has an initializer (a single-variable declaration or an assignment),
 * a condition, and a step (an assignment or a postfix increment/decrement).
 * The body holds assignments and postfix increments/decrements.
 */
public class ForStatement implements Statement
{
	private final Statement initializer;
	private final Logic condition;
	private final Statement step;
	private final List<Statement> body;

	public ForStatement(Statement initializer, Logic condition, Statement step, List<Statement> body)
	{
		this.initializer = Objects.requireNonNull(initializer, "initializer");
		this.condition = Objects.requireNonNull(condition, "condition");
		this.step = Objects.requireNonNull(step, "step");
		if (!(initializer instanceof AssignmentStatement) && !isSingleInitializedDeclaration(initializer))
		{
			throw new IllegalArgumentException("For initializer must be an assignment or a single initialized declaration, got " + initializer);
		}
		if (!isSimpleStatement(step))
		{
			throw new IllegalArgumentException("For step must be an assignment or a postfix increment/decrement, got " + step);
		}
		for (Statement statement : body)
		{
			if (!isSimpleStatement(statement))
			{
				throw new IllegalArgumentException("For body allows only assignments and postfix increments/decrements, got " + statement);
			}
		}
		this.body = Collections.unmodifiableList(new ArrayList<>(body));
	}

	private static boolean isSimpleStatement(Statement statement)
	{
		return statement instanceof AssignmentStatement || statement instanceof PostfixUnaryExpression;
	}

	private static boolean isSingleInitializedDeclaration(Statement statement)
	{
		if (!(statement instanceof DeclarationStatement))
		{
			return false;
		}
		DeclarationStatement declaration = (DeclarationStatement) statement;
		return declaration.getNames().size() == 1 && declaration.hasInitializers();
	}

	public Statement getInitializer()
	{
		return initializer;
	}

	public Logic getCondition()
	{
		return condition;
	}

	public Statement getStep()
	{
		return step;
	}

	public List<Statement> getBody()
	{
		return body;
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder("For (");
		sb.append(initializer);
		sb.append("; ").append(condition);
		sb.append("; ").append(step);
		sb.append(") {\n");
		for (Statement statement : body)
		{
			sb.append("  ").append(statement).append("\n");
		}
		sb.append("}");
		return sb.toString();
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitForStatement(this);
	}
}
