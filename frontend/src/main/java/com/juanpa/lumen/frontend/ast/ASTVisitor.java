// File: src/main/java/com/juanpa/lumen/frontend/ast/ASTVisitor.java

package com.juanpa.lumen.frontend.ast;

import com.juanpa.lumen.frontend.ast.expressions.*;
import com.juanpa.lumen.frontend.ast.statements.*;


/**
 * Interface for the Visitor pattern that allows AST traversal.
 * Each `visit` method corresponds to a specific AST node type.
 * The generic type `R` represents the return value type of the `visit` methods;
 * consumers that only walk the tree can use `Void`.
 * <p>
 * Every syntactic node type must be handled. Only the program root has a default (no-op)
 * implementation, so a consumer that is handed individual statements does not need it.
 */
public interface ASTVisitor<R>
{
	// --- Root ---
	default R visitProgram(Program program)
	{
		return null;
	}

	// --- Statements ---
	R visitDeclarationStatement(DeclarationStatement statement);

	R visitAssignmentStatement(AssignmentStatement statement);

	R visitIfStatement(IfStatement statement);

	R visitElifClause(ElifClause clause);

	R visitWhileStatement(WhileStatement statement);

	R visitForStatement(ForStatement statement);

	R visitPrintStatement(PrintStatement statement);

	// --- Arithmetic expressions ---
	R visitFinalExpression(FinalExpression expression);

	R visitBinaryExpression(BinaryExpression expression);

	R visitPostfixUnaryExpression(PostfixUnaryExpression expression);

	R visitSignedNumberExpression(SignedNumberExpression expression);

	R visitNegatedExpression(NegatedExpression expression);

	// --- Logic expressions ---
	R visitComparisonExpression(ComparisonExpression expression);

	R visitLogicalExpression(LogicalExpression expression);
}
