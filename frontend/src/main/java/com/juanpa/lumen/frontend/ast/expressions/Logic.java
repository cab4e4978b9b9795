// File: src/main/java/com/juanpa/lumen/frontend/ast/expressions/Logic.java

package com.juanpa.lumen.frontend.ast.expressions;

import com.juanpa.lumen.frontend.ast.ASTNode;

/**
 * Base interface for boolean-valued nodes: comparisons and their
 * combinations with `&&` and `||`.
 */
public interface Logic extends ASTNode
{
}
