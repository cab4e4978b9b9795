// File: src/main/java/com/juanpa/lumen/frontend/ast/statements/DeclarationStatement.java

package com.juanpa.lumen.frontend.ast.statements;

import com.juanpa.lumen.frontend.ast.ASTNode;
import com.juanpa.lumen.frontend.ast.ASTVisitor;
import com.juanpa.lumen.frontend.ast.expressions.Expression;
import com.juanpa.lumen.frontend.ast.expressions.Logic;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * AST node representing a variable declaration statement, e.g. `int a, b = 1, 2;`.
 * Holds the declared kind, the variable names, and the optional initializers.
 * Initializer i belongs to variable i; when present there is exactly one per name.
 */
public class DeclarationStatement implements Statement
{
	public enum Kind
	{
		INT("int"),
		BOOL("bool");

		private final String keyword;

		Kind(String keyword)
		{
			this.keyword = keyword;
		}

		public String getKeyword()
		{
			return keyword;
		}
	}

	private final Kind kind;
	private final List<String> names;
	private final List<ASTNode> initializers; // Expression for INT, Logic for BOOL

	/**
	 * Constructs a DeclarationStatement.
	 *
	 * @param kind         The declared type.
	 * @param names        The declared variable names, at least one.
	 * @param initializers Either empty or one initializer per name. `int` initializers must be
	 *                     {@link Expression}s, `bool` initializers {@link Logic} nodes.
	 */
	public DeclarationStatement(Kind kind, List<String> names, List<? extends ASTNode> initializers)
	{
		this.kind = Objects.requireNonNull(kind, "kind");
		if (names.isEmpty())
		{
			throw new IllegalArgumentException("A declaration needs at least one variable name.");
		}
		if (!initializers.isEmpty() && initializers.size() != names.size())
		{
			throw new IllegalArgumentException("Declared " + names.size() + " variable(s) but got " + initializers.size() + " initializer(s).");
		}
		Class<?> expected = kind == Kind.INT ? Expression.class : Logic.class;
		for (ASTNode initializer : initializers)
		{
			if (!expected.isInstance(initializer))
			{
				throw new IllegalArgumentException("Initializer " + initializer + " is not valid for a '" + kind.getKeyword() + "' declaration.");
			}
		}
		this.names = Collections.unmodifiableList(new ArrayList<>(names));
		this.initializers = Collections.unmodifiableList(new ArrayList<>(initializers));
	}

	public Kind getKind()
	{
		return kind;
	}

	public List<String> getNames()
	{
		return names;
	}

	public List<ASTNode> getInitializers()
	{
		return initializers;
	}

	public boolean hasInitializers()
	{
		return !initializers.isEmpty();
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitDeclarationStatement(this);
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder("VarDecl: ").append(kind.getKeyword()).append(" ");
		sb.append(String.join(", ", names));
		if (hasInitializers())
		{
			sb.append(" = ");
			for (int i = 0; i < initializers.size(); i++)
			{
				if (i > 0)
				{
					sb.append(", ");
				}
				sb.append(initializers.get(i));
			}
		}
		return sb.toString();
	}
}
