// File: src/main/java/com/juanpa/lumen/frontend/ast/expressions/Expression.java

package com.juanpa.lumen.frontend.ast.expressions;

import com.juanpa.lumen.frontend.ast.ASTNode;

/**
 * Base interface for arithmetic expression nodes.
 * Expressions are parts of the program that produce a numeric value.
 */
public interface Expression extends ASTNode
{
}
