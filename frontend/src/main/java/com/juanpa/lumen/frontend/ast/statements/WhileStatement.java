// File: src/main/java/com/juanpa/lumen/frontend/ast/statements/WhileStatement.java
package com.juanpa.lumen.frontend.ast.statements;

import com.juanpa.lumen.frontend.ast.ASTVisitor;
import com.juanpa.lumen.frontend.ast.expressions.Logic;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * AST node representing a 'while' loop statement.
 * Includes a condition and the assignments of the loop body.
 */
public class WhileStatement implements Statement
{
	private final Logic condition;
	private final List<AssignmentStatement> body;

	public WhileStatement(Logic condition, List<AssignmentStatement> body)
	{
		this.condition = Objects.requireNonNull(condition, "condition");
		this.body = Collections.unmodifiableList(new ArrayList<>(body));
	}

	public Logic getCondition()
	{
		return condition;
	}

	public List<AssignmentStatement> getBody()
	{
		return body;
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder("While (").append(condition).append(") {\n");
		for (AssignmentStatement statement : body)
		{
			sb.append("  ").append(statement).append("\n");
		}
		sb.append("}");
		return sb.toString();
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitWhileStatement(this);
	}
}
