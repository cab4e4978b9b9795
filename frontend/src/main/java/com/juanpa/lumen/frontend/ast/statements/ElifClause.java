// File: src/main/java/com/juanpa/lumen/frontend/ast/statements/ElifClause.java

package com.juanpa.lumen.frontend.ast.statements;

import com.juanpa.lumen.frontend.ast.ASTNode;
import com.juanpa.lumen.frontend.ast.ASTVisitor;
import com.juanpa.lumen.frontend.ast.expressions.Logic;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One `elif cond: begin ... end` arm of an {@link IfStatement}.
 */
public class ElifClause implements ASTNode
{
	private final Logic condition;
	private final List<AssignmentStatement> body;

	public ElifClause(Logic condition, List<AssignmentStatement> body)
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
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitElifClause(this);
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder("Elif (").append(condition).append(") {\n");
		for (AssignmentStatement statement : body)
		{
			sb.append("  ").append(statement).append("\n");
		}
		sb.append("}");
		return sb.toString();
	}
}
