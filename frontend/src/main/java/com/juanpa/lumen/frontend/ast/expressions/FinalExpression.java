// File: src/main/java/com/juanpa/lumen/frontend/ast/expressions/FinalExpression.java

package com.juanpa.lumen.frontend.ast.expressions;

import com.juanpa.lumen.frontend.ast.ASTVisitor;

import java.util.Objects;

/**
 * AST leaf node: an identifier, a number, or one of the literals `true`/`false`.
 * The value is the source spelling.
 */
public class FinalExpression implements Expression
{
	public enum Kind
	{
		IDENTIFIER,
		NUMBER,
		TRUE,
		FALSE
	}

	private final Kind kind;
	private final String value;

	public FinalExpression(Kind kind, String value)
	{
		this.kind = Objects.requireNonNull(kind, "kind");
		this.value = Objects.requireNonNull(value, "value");
	}

	public static FinalExpression identifier(String name)
	{
		return new FinalExpression(Kind.IDENTIFIER, name);
	}

	public static FinalExpression number(String digits)
	{
		return new FinalExpression(Kind.NUMBER, digits);
	}

	public Kind getKind()
	{
		return kind;
	}

	public String getValue()
	{
		return value;
	}

	public boolean isIdentifier()
	{
		return kind == Kind.IDENTIFIER;
	}

	@Override
	public <R> R accept(ASTVisitor<R> visitor)
	{
		return visitor.visitFinalExpression(this);
	}

	@Override
	public String toString()
	{
		return value;
	}
}
