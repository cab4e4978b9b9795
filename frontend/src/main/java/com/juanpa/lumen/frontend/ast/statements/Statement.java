// File: src/main/java/com/juanpa/lumen/frontend/ast/statements/Statement.java
package com.juanpa.lumen.frontend.ast.statements;

import com.juanpa.lumen.frontend.ast.ASTNode;

/**
 * Base interface for all statement nodes in the Abstract Syntax Tree.
 * Statements are units of execution that do not produce a value.
 */
public interface Statement extends ASTNode
{
}
