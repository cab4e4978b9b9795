// File: src/main/java/com/juanpa/lumen/frontend/ast/statements/PrintStatement.java
package com.juanpa.lumen.frontend.ast.statements;

import com.juanpa.lumen.frontend.ast.ASTNode;
import com.juanpa.lumen.frontend.ast.ASTVisitor;
import com.juanpa.lumen.frontend.ast.expressions.Expression;
import com.juanpa.lumen.frontend.ast.expressions.Logic;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * AST node representing a 'print' statement.
 * Each argument is either an arithmetic {@link Expression} or a {@link Logic} node.
 */
public class PrintStatement implements Statement
{
	private final List<ASTNode> arguments;

	public PrintStatement(List<? extends ASTNode> arguments)
	{
		if (arguments.isEmpty())
		{
			throw new IllegalArgumentException("A print statement needs at least one argument.");
		}
		for (ASTNode argument : arguments)
		{
			if (!(argument instanceof Expression) && !(argument instanceof Logic))
			{
				throw new IllegalArgumentException("Not a printable expression: " + argument);
			}
		}
		this.arguments = Collections.unmodifiableList(new ArrayList<>(arguments));
	}

	public List<ASTNode> getArguments()
	{
		return arguments;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitPrintStatement(this);
	}

	@Override
	public String toString()
	{
		return "Print " + arguments.stream().map(ASTNode::toString).collect(Collectors.joining(", "));
	}
}
