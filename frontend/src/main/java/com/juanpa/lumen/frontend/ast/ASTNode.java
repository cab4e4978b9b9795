package com.juanpa.lumen.frontend.ast;

/**
 * Base interface for all nodes in the Abstract Syntax Tree (AST).
 * Nodes are immutable once built and own their children exclusively.
 */
public interface ASTNode
{
	/**
	 * Accepts an ASTVisitor to traverse this node.
	 * Each concrete node calls exactly the visit method for its own type,
	 * so consumers get variant-specific behavior without the node knowing the consumer.
	 *
	 * @param visitor The ASTVisitor instance.
	 * @param <R>     The return type of the visitor's visit methods.
	 * @return The result of the visitor's operation.
	 */
	<R> R accept(ASTVisitor<R> visitor);
}
