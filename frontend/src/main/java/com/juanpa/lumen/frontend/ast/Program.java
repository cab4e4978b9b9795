// File: src/main/java/com/juanpa/lumen/frontend/ast/Program.java

package com.juanpa.lumen.frontend.ast;

import com.juanpa.lumen.frontend.ast.statements.Statement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The root AST node representing an entire Lumen program.
 * Contains the top-level statements in source order.
 */
public class Program implements ASTNode
{
	private final List<Statement> statements;

	public Program(List<Statement> statements)
	{
		this.statements = Collections.unmodifiableList(new ArrayList<>(statements));
	}

	public List<Statement> getStatements()
	{
		return statements;
	}

	public int size()
	{
		return statements.size();
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitProgram(this);
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder();
		for (Statement statement : statements)
		{
			sb.append(statement.toString()).append("\n");
		}
		return sb.toString();
	}
}
