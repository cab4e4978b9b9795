// File: src/main/java/com/juanpa/lumen/frontend/ast/statements/IfStatement.java
package com.juanpa.lumen.frontend.ast.statements;

import com.juanpa.lumen.frontend.ast.ASTVisitor;
import com.juanpa.lumen.frontend.ast.expressions.Logic;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * AST node representing an 'if' statement with any number of 'elif' arms
 * and an optional 'else' block. Every branch body is a list of assignments.
 */
public class IfStatement implements Statement
{
	private final Logic condition;
	private final List<AssignmentStatement> thenBranch;
	private final List<ElifClause> elifClauses;     // In source order
	private final List<AssignmentStatement> elseBranch;
	private final boolean hasElse;                  // An empty else block is still an else

	/**
	 * Constructs an IfStatement.
	 *
	 * @param condition   The condition of the 'if' arm.
	 * @param thenBranch  The assignments executed when the condition holds.
	 * @param elifClauses The 'elif' arms, in source order.
	 * @param elseBranch  The assignments of the 'else' block; empty when there is none.
	 * @param hasElse     Whether an 'else' block was written.
	 */
	public IfStatement(Logic condition, List<AssignmentStatement> thenBranch, List<ElifClause> elifClauses,
					   List<AssignmentStatement> elseBranch, boolean hasElse)
	{
		this.condition = Objects.requireNonNull(condition, "condition");
		this.thenBranch = Collections.unmodifiableList(new ArrayList<>(thenBranch));
		this.elifClauses = Collections.unmodifiableList(new ArrayList<>(elifClauses));
		this.elseBranch = Collections.unmodifiableList(new ArrayList<>(elseBranch));
		if (!hasElse && !elseBranch.isEmpty())
		{
			throw new IllegalArgumentException("Else assignments given for an if statement without 'else'.");
		}
		this.hasElse = hasElse;
	}

	public Logic getCondition()
	{
		return condition;
	}

	public List<AssignmentStatement> getThenBranch()
	{
		return thenBranch;
	}

	public List<ElifClause> getElifClauses()
	{
		return elifClauses;
	}

	public List<AssignmentStatement> getElseBranch()
	{
		return elseBranch;
	}

	public boolean hasElse()
	{
		return hasElse;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitIfStatement(this);
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder("If (").append(condition).append(") {\n");
		appendBlock(sb, thenBranch);
		sb.append("}");
		for (ElifClause clause : elifClauses)
		{
			sb.append(" ").append(clause);
		}
		if (hasElse)
		{
			sb.append(" Else {\n");
			appendBlock(sb, elseBranch);
			sb.append("}");
		}
		return sb.toString();
	}

	// Helper for indentation
	private static void appendBlock(StringBuilder sb, List<AssignmentStatement> block)
	{
		for (AssignmentStatement statement : block)
		{
			sb.append("  ").append(statement).append("\n");
		}
	}
}
