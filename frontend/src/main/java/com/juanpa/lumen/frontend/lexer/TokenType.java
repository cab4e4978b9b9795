// File: src/main/java/com/juanpa/lumen/frontend/lexer/TokenType.java
package com.juanpa.lumen.frontend.lexer;

/**
 * Defines the types of tokens the Lumen parser understands.
 * The scanner producing them is an external collaborator; this enum is the contract between the two.
 */
public enum TokenType
{
	// --- Keywords ---
	// Declarations
	INT, BOOL,

	// Control Flow
	IF, ELIF, ELSE, WHILE, FOR, PRINT, BEGIN, END,

	// --- Literals ---
	IDENTIFIER,
	NUMBER,
	TRUE, FALSE,

	// --- Punctuation & Delimiters ---
	LEFT_PAREN, RIGHT_PAREN,       // ( )
	COMMA, SEMICOLON, COLON,

	// --- Operators ---
	// Unary
	PLUS_PLUS, MINUS_MINUS,        // ++ --

	// Arithmetic
	PLUS, MINUS,                   // + -
	STAR, SLASH, PERCENT,          // * / %
	CARET,                         // ^ (power)

	// Relational & Equality
	EQUAL_EQUAL, BANG_EQUAL,       // == !=
	GREATER, LESS,                 // > <
	GREATER_EQUAL, LESS_EQUAL,     // >= <=

	// Logical
	AND_AND,                       // &&
	PIPE_PIPE,                     // ||

	// Assignment & Compound Assignment
	ASSIGN,                        // =
	PLUS_ASSIGN, MINUS_ASSIGN,     // += -=
	STAR_ASSIGN, SLASH_ASSIGN,     // *= /=

	// --- Special Tokens ---
	EOF // End Of Input
}
