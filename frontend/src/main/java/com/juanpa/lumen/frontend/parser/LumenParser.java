// File: src/main/java/com/juanpa/lumen/frontend/parser/LumenParser.java

package com.juanpa.lumen.frontend.parser;

import com.juanpa.lumen.frontend.ast.ASTNode;
import com.juanpa.lumen.frontend.ast.Program;
import com.juanpa.lumen.frontend.ast.expressions.*;
import com.juanpa.lumen.frontend.ast.statements.*;
import com.juanpa.lumen.frontend.lexer.Token;
import com.juanpa.lumen.frontend.lexer.TokenSource;
import com.juanpa.lumen.frontend.lexer.TokenStream;
import com.juanpa.lumen.frontend.lexer.TokenType;
import com.juanpa.lumen.frontend.util.Debug;
import com.juanpa.lumen.frontend.util.Diagnostic;
import com.juanpa.lumen.frontend.util.ErrorReporter;
import com.juanpa.lumen.frontend.util.ParserConfig;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * The LumenParser is responsible for performing syntactic analysis.
 * It takes the tokens handed over by the scanner and builds an
 * Abstract Syntax Tree (AST) based on the Lumen language grammar.
 * This parser uses a recursive-descent approach.
 * <p>
 * Error handling is all-or-nothing: the first syntax error is reported once, every remaining
 * token is discarded, and {@link #parse()} returns null. Each rule signals failure by returning null,
 * and callers forward that null without reporting again.
 */
public class LumenParser
{
	// Tokens that may directly follow a complete logic expression
	private static final TokenType[] LOGIC_FOLLOWERS = {
			TokenType.AND_AND, TokenType.PIPE_PIPE, TokenType.RIGHT_PAREN, TokenType.COLON,
			TokenType.SEMICOLON, TokenType.COMMA, TokenType.END
	};

	private final TokenSource tokens;          // Cursor over the token sequence
	private final ErrorReporter errorReporter; // For reporting parsing errors
	private int speculationDepth = 0;          // > 0 while inside a trial parse
	private boolean consumed = false;
	private final Boolean trace;               // Trace setting for parse(), or null to leave Debug untouched

	/**
	 * A parsed statement together with whether the statement already stepped past its own terminator.
	 * An if statement without 'else' moves past its last 'end' while looking for 'elif'/'else';
	 * every other statement stops on its terminator and leaves it to the statement loop.
	 */
	private record ParsedStatement(
			Statement statement,
			boolean terminatorConsumed)
	{
	}

	/**
	 * Constructs a LumenParser.
	 *
	 * @param tokens        The list of tokens produced by the scanner.
	 * @param errorReporter An instance of ErrorReporter for handling parsing errors.
	 */
	public LumenParser(List<Token> tokens, ErrorReporter errorReporter)
	{
		this(new TokenStream(tokens), errorReporter);
	}

	public LumenParser(TokenSource tokens, ErrorReporter errorReporter)
	{
		this.tokens = tokens;
		this.errorReporter = errorReporter;
		this.trace = null;
	}

	public LumenParser(List<Token> tokens, ErrorReporter errorReporter, ParserConfig config)
	{
		this(new TokenStream(tokens), errorReporter, config);
	}

	/**
	 * Constructs a LumenParser that traces according to the given configuration.
	 * The setting is applied for the duration of {@link #parse()} only.
	 */
	public LumenParser(TokenSource tokens, ErrorReporter errorReporter, ParserConfig config)
	{
		this.tokens = tokens;
		this.errorReporter = errorReporter;
		this.trace = config.isTraceEnabled();
	}

	/**
	 * Starts the parsing process for the entire token stream.
	 * Grammar: `PROGRAM := STATEMENT*`
	 *
	 * @return The root of the parsed AST, or null if a syntax error was found.
	 * @throws IllegalStateException if this parser has already been used.
	 */
	public Program parse()
	{
		if (consumed)
		{
			throw new IllegalStateException("A LumenParser instance can only parse once.");
		}
		consumed = true;

		if (trace == null)
		{
			return parseStatements();
		}
		boolean previousTrace = Debug.isEnabled();
		Debug.setEnabled(trace);
		try
		{
			return parseStatements();
		}
		finally
		{
			Debug.setEnabled(previousTrace);
		}
	}

	private Program parseStatements()
	{
		List<Statement> statements = new ArrayList<>();
		while (!tokens.isAtEnd())
		{
			ParsedStatement parsed = statement();
			if (parsed == null)
			{
				Debug.log("Parse aborted after %d statement(s).", statements.size());
				return null;
			}
			statements.add(parsed.statement());
			if (!parsed.terminatorConsumed())
			{
				tokens.advance();
			}
		}
		Debug.log("Parsed %d statement(s).", statements.size());
		return new Program(statements);
	}

	/**
	 * Parses a single top-level statement.
	 * This method acts as a dispatcher for different statement types.
	 */
	private ParsedStatement statement()
	{
		Token token = tokens.current();
		Debug.log("Statement starting with %s", token);
		Debug.indent();
		try
		{
			switch (token.getType())
			{
				case INT:
				case BOOL:
					return pending(declaration(false));
				case IDENTIFIER:
					return pending(identifierStatement());
				case IF:
					return ifStatement();
				case WHILE:
					return pending(whileStatement());
				case FOR:
					return pending(forStatement());
				case PRINT:
					return pending(printStatement());
				default:
					return fail(Diagnostic.unexpectedToken("a statement (declaration, assignment, 'if', 'while', 'for' or 'print')", token));
			}
		}
		finally
		{
			Debug.dedent();
		}
	}

	private ParsedStatement pending(Statement statement)
	{
		return statement == null ? null : new ParsedStatement(statement, false);
	}

	/**
	 * Parses an `int` or `bool` declaration. The cursor is left on the terminating ';'.
	 * Grammar: `('int' | 'bool') IDENTIFIER (',' IDENTIFIER)* ('=' INIT (',' INIT)*)? ';'`
	 * where INIT is an arithmetic expression for `int` and a logic expression for `bool`.
	 *
	 * @param forHeader True inside a for-loop header, where exactly one initialized variable is allowed.
	 * @return A DeclarationStatement AST node, or null on a syntax error.
	 */
	private DeclarationStatement declaration(boolean forHeader)
	{
		Token keyword = tokens.advance();
		DeclarationStatement.Kind kind = keyword.is(TokenType.INT) ? DeclarationStatement.Kind.INT : DeclarationStatement.Kind.BOOL;

		List<String> names = new ArrayList<>();
		Token name = expect(TokenType.IDENTIFIER);
		if (name == null)
		{
			return null;
		}
		names.add(name.getLexeme());
		while (!forHeader && match(TokenType.COMMA))
		{
			name = expect(TokenType.IDENTIFIER);
			if (name == null)
			{
				return null;
			}
			names.add(name.getLexeme());
		}

		List<ASTNode> initializers = new ArrayList<>();
		if (forHeader && expect(TokenType.ASSIGN) == null)
		{
			return null;
		}
		if (forHeader || match(TokenType.ASSIGN))
		{
			Token firstInitializer = tokens.current();
			do
			{
				ASTNode initializer = kind == DeclarationStatement.Kind.INT ? expression() : logic();
				if (initializer == null)
				{
					return null;
				}
				initializers.add(initializer);
			}
			while (!forHeader && match(TokenType.COMMA));

			if (initializers.size() != names.size())
			{
				return fail(Diagnostic.initializerCountMismatch(names.size(), initializers.size(), firstInitializer));
			}
		}

		if (!tokens.is(TokenType.SEMICOLON))
		{
			return fail(Diagnostic.unexpectedToken(TokenType.SEMICOLON, tokens.current()));
		}
		return new DeclarationStatement(kind, names, initializers);
	}

	/**
	 * Parses a statement that starts with an identifier: either `x++;`/`x--;` or an assignment.
	 * The cursor is left on the terminating ';'.
	 */
	private Statement identifierStatement()
	{
		Statement statement = simpleStatement(TokenType.SEMICOLON);
		if (statement == null)
		{
			return null;
		}
		if (!tokens.is(TokenType.SEMICOLON))
		{
			return fail(Diagnostic.unexpectedToken(TokenType.SEMICOLON, tokens.current()));
		}
		return statement;
	}

	/**
	 * Parses a postfix increment/decrement if one is followed by the terminator,
	 * otherwise backtracks and parses an assignment.
	 *
	 * @param terminator The token that ends this statement in its context (';' or ')').
	 */
	private Statement simpleStatement(TokenType terminator)
	{
		PostfixUnaryExpression unary = attempt(this::postfixUnary, terminator);
		if (unary != null)
		{
			return unary;
		}
		return assignment(terminator);
	}

	/**
	 * Grammar: `IDENTIFIER ('++' | '--')`
	 */
	private PostfixUnaryExpression postfixUnary()
	{
		Token name = expect(TokenType.IDENTIFIER);
		if (name == null)
		{
			return null;
		}
		if (match(TokenType.PLUS_PLUS))
		{
			return new PostfixUnaryExpression(name.getLexeme(), PostfixUnaryExpression.Operator.INCREMENT);
		}
		if (match(TokenType.MINUS_MINUS))
		{
			return new PostfixUnaryExpression(name.getLexeme(), PostfixUnaryExpression.Operator.DECREMENT);
		}
		return fail(Diagnostic.unexpectedToken("'++' or '--'", tokens.current()));
	}

	/**
	 * Parses an assignment.
	 * Grammar: `IDENTIFIER ('=' (LOGIC | EXPRESSION) | ('+=' | '-=' | '*=' | '/=') EXPRESSION)`
	 * A plain '=' binds a logic expression if one parses up to the terminator; otherwise the
	 * right-hand side is re-read as an arithmetic expression.
	 *
	 * @param terminator The token that ends this assignment in its context.
	 * @return An AssignmentStatement AST node, or null on a syntax error.
	 */
	private AssignmentStatement assignment(TokenType terminator)
	{
		Token name = expect(TokenType.IDENTIFIER);
		if (name == null)
		{
			return null;
		}
		FinalExpression target = FinalExpression.identifier(name.getLexeme());

		AssignmentStatement.Operator operator;
		Token operatorToken = tokens.current();
		switch (operatorToken.getType())
		{
			case ASSIGN:
				operator = AssignmentStatement.Operator.ASSIGN;
				break;
			case PLUS_ASSIGN:
				operator = AssignmentStatement.Operator.PLUS_ASSIGN;
				break;
			case MINUS_ASSIGN:
				operator = AssignmentStatement.Operator.MINUS_ASSIGN;
				break;
			case STAR_ASSIGN:
				operator = AssignmentStatement.Operator.STAR_ASSIGN;
				break;
			case SLASH_ASSIGN:
				operator = AssignmentStatement.Operator.SLASH_ASSIGN;
				break;
			default:
				return fail(Diagnostic.unexpectedToken("an assignment operator", operatorToken));
		}
		tokens.advance();

		if (operator == AssignmentStatement.Operator.ASSIGN)
		{
			Logic logicValue = attempt(this::logic, terminator);
			if (logicValue != null)
			{
				return AssignmentStatement.logic(target, logicValue);
			}
		}

		Expression value = expression();
		if (value == null)
		{
			return null;
		}
		return AssignmentStatement.arithmetic(target, operator, value);
	}

	/**
	 * Parses an additive expression.
	 * Grammar: `TERM (('+' | '-') TERM)*`
	 */
	private Expression expression()
	{
		Expression expr = term();
		if (expr == null)
		{
			return null;
		}

		while (tokens.isOneOf(TokenType.PLUS, TokenType.MINUS))
		{
			BinaryExpression.Operator operator = tokens.advance().is(TokenType.PLUS) ? BinaryExpression.Operator.ADD : BinaryExpression.Operator.SUB;
			Expression right = term();
			if (right == null)
			{
				return null;
			}
			expr = new BinaryExpression(expr, operator, right);
		}
		return expr;
	}

	/**
	 * Parses a multiplicative expression.
	 * Grammar: `FACTOR (('*' | '/' | '%') FACTOR)*`
	 */
	private Expression term()
	{
		Expression expr = factor();
		if (expr == null)
		{
			return null;
		}

		while (tokens.isOneOf(TokenType.STAR, TokenType.SLASH, TokenType.PERCENT))
		{
			Token operatorToken = tokens.advance();
			BinaryExpression.Operator operator;
			if (operatorToken.is(TokenType.STAR))
			{
				operator = BinaryExpression.Operator.MUL;
			}
			else if (operatorToken.is(TokenType.SLASH))
			{
				operator = BinaryExpression.Operator.DIV;
			}
			else
			{
				operator = BinaryExpression.Operator.MOD;
			}
			Expression right = factor();
			if (right == null)
			{
				return null;
			}
			expr = new BinaryExpression(expr, operator, right);
		}
		return expr;
	}

	/**
	 * Parses an exponentiation. The right operand recurses into this rule, so `^` is right-associative.
	 * Grammar: `FINAL ('^' FACTOR)?`
	 */
	private Expression factor()
	{
		Expression base = finalExpression();
		if (base == null)
		{
			return null;
		}
		if (match(TokenType.CARET))
		{
			Expression exponent = factor();
			if (exponent == null)
			{
				return null;
			}
			return new BinaryExpression(base, BinaryExpression.Operator.POW, exponent);
		}
		return base;
	}

	/**
	 * Parses the operands of arithmetic expressions.
	 * Grammar: `NUMBER | IDENTIFIER ('++' | '--')? | '-' (NUMBER | '(' EXPRESSION ')')
	 * | '+' (NUMBER | '(' EXPRESSION ')') | '(' EXPRESSION ')'`
	 */
	private Expression finalExpression()
	{
		Token token = tokens.current();
		switch (token.getType())
		{
			case NUMBER:
				tokens.advance();
				return FinalExpression.number(token.getLexeme());
			case IDENTIFIER:
				tokens.advance();
				if (match(TokenType.PLUS_PLUS))
				{
					return new PostfixUnaryExpression(token.getLexeme(), PostfixUnaryExpression.Operator.INCREMENT);
				}
				if (match(TokenType.MINUS_MINUS))
				{
					return new PostfixUnaryExpression(token.getLexeme(), PostfixUnaryExpression.Operator.DECREMENT);
				}
				return FinalExpression.identifier(token.getLexeme());
			case MINUS:
			case PLUS:
				return signedOperand();
			case LEFT_PAREN:
				tokens.advance();
				return parenthesized();
			default:
				return fail(Diagnostic.malformedExpression("arithmetic expression", token));
		}
	}

	/**
	 * Parses `-5`, `+5`, `-(expr)` or `+(expr)`. A plus in front of a parenthesized
	 * expression has no effect and yields the inner expression.
	 */
	private Expression signedOperand()
	{
		Token sign = tokens.advance();
		boolean negative = sign.is(TokenType.MINUS);

		if (tokens.is(TokenType.NUMBER))
		{
			Token number = tokens.advance();
			return new SignedNumberExpression(negative ? SignedNumberExpression.Sign.MINUS : SignedNumberExpression.Sign.PLUS, number.getLexeme());
		}
		if (match(TokenType.LEFT_PAREN))
		{
			Expression inner = parenthesized();
			if (inner == null)
			{
				return null;
			}
			return negative ? new NegatedExpression(inner) : inner;
		}
		return fail(Diagnostic.malformedExpression("signed operand, '" + sign.getLexeme() + "' must be followed by a number or '('", tokens.current()));
	}

	/**
	 * Parses the rest of `'(' EXPRESSION ')'` after the opening parenthesis.
	 */
	private Expression parenthesized()
	{
		Expression inner = expression();
		if (inner == null || expect(TokenType.RIGHT_PAREN) == null)
		{
			return null;
		}
		return inner;
	}

	/**
	 * Parses a chain of comparisons joined by `&&` and `||`.
	 * Both operators share one precedence level and associate to the left.
	 * Grammar: `COMPARISON (('&&' | '||') COMPARISON)*`
	 */
	private Logic logic()
	{
		Logic expr = comparison();
		if (expr == null)
		{
			return null;
		}

		while (tokens.isOneOf(TokenType.AND_AND, TokenType.PIPE_PIPE))
		{
			LogicalExpression.Operator operator = tokens.advance().is(TokenType.AND_AND) ? LogicalExpression.Operator.AND : LogicalExpression.Operator.OR;
			Logic right = comparison();
			if (right == null)
			{
				return null;
			}
			expr = new LogicalExpression(expr, operator, right);
		}
		return expr;
	}

	/**
	 * Parses a single logic operand.
	 * Grammar: `'(' LOGIC ')' | 'true' | 'false' | IDENTIFIER | EXPRESSION RELOP EXPRESSION`
	 * A parenthesis that does not enclose a complete logic expression opens an arithmetic operand instead,
	 * and an identifier followed by an arithmetic or relational operator starts a relational comparison.
	 */
	private Logic comparison()
	{
		Token token = tokens.current();
		switch (token.getType())
		{
			case LEFT_PAREN:
				Logic grouped = attempt(this::parenthesizedLogic, LOGIC_FOLLOWERS);
				if (grouped != null)
				{
					return grouped;
				}
				break;
			case TRUE:
				tokens.advance();
				return ComparisonExpression.standalone(ComparisonExpression.Operator.LITERAL_TRUE, token.getLexeme());
			case FALSE:
				tokens.advance();
				return ComparisonExpression.standalone(ComparisonExpression.Operator.LITERAL_FALSE, token.getLexeme());
			case IDENTIFIER:
				if (!continuesOperand(tokens.peek(1).getType()))
				{
					tokens.advance();
					return ComparisonExpression.standalone(ComparisonExpression.Operator.IDENTIFIER_REF, token.getLexeme());
				}
				break;
			default:
				break;
		}

		Expression left = expression();
		if (left == null)
		{
			return null;
		}
		ComparisonExpression.Operator operator = relationalOperator(tokens.current().getType());
		if (operator == null)
		{
			return fail(Diagnostic.malformedExpression("comparison, expected a relational operator", tokens.current()));
		}
		tokens.advance();
		Expression right = expression();
		if (right == null)
		{
			return null;
		}
		return ComparisonExpression.relational(left, operator, right);
	}

	private Logic parenthesizedLogic()
	{
		if (expect(TokenType.LEFT_PAREN) == null)
		{
			return null;
		}
		Logic inner = logic();
		if (inner == null || expect(TokenType.RIGHT_PAREN) == null)
		{
			return null;
		}
		return inner;
	}

	private ComparisonExpression.Operator relationalOperator(TokenType type)
	{
		switch (type)
		{
			case EQUAL_EQUAL:
				return ComparisonExpression.Operator.EQ;
			case BANG_EQUAL:
				return ComparisonExpression.Operator.NEQ;
			case GREATER:
				return ComparisonExpression.Operator.GT;
			case LESS:
				return ComparisonExpression.Operator.LT;
			case GREATER_EQUAL:
				return ComparisonExpression.Operator.GTE;
			case LESS_EQUAL:
				return ComparisonExpression.Operator.LTE;
			default:
				return null;
		}
	}

	/**
	 * @return True if a token of this type after an identifier means the identifier is an arithmetic operand.
	 */
	private boolean continuesOperand(TokenType type)
	{
		switch (type)
		{
			case PLUS:
			case MINUS:
			case STAR:
			case SLASH:
			case PERCENT:
			case CARET:
			case PLUS_PLUS:
			case MINUS_MINUS:
				return true;
			default:
				return relationalOperator(type) != null;
		}
	}

	/**
	 * Parses an if statement.
	 * Grammar: `'if' LOGIC BLOCK ('elif' LOGIC BLOCK)* ('else' BLOCK)?`
	 * <p>
	 * The search for 'elif'/'else' moves past the 'end' of the preceding block. Without an 'else'
	 * the statement therefore finishes past its own terminator; with one it stops on the else block's 'end'.
	 */
	private ParsedStatement ifStatement()
	{
		tokens.advance(); // 'if'

		Logic condition = logic();
		if (condition == null)
		{
			return null;
		}
		List<AssignmentStatement> thenBranch = assignmentBlock();
		if (thenBranch == null)
		{
			return null;
		}
		tokens.advance(); // 'end'

		List<ElifClause> elifClauses = new ArrayList<>();
		while (match(TokenType.ELIF))
		{
			Logic elifCondition = logic();
			if (elifCondition == null)
			{
				return null;
			}
			List<AssignmentStatement> elifBody = assignmentBlock();
			if (elifBody == null)
			{
				return null;
			}
			tokens.advance(); // 'end'
			elifClauses.add(new ElifClause(elifCondition, elifBody));
		}

		if (match(TokenType.ELSE))
		{
			List<AssignmentStatement> elseBranch = assignmentBlock();
			if (elseBranch == null)
			{
				return null;
			}
			return new ParsedStatement(new IfStatement(condition, thenBranch, elifClauses, elseBranch, true), false);
		}
		return new ParsedStatement(new IfStatement(condition, thenBranch, elifClauses, List.of(), false), true);
	}

	/**
	 * Parses a while loop statement. The cursor is left on the closing 'end'.
	 * Grammar: `'while' LOGIC BLOCK`
	 */
	private WhileStatement whileStatement()
	{
		tokens.advance(); // 'while'

		Logic condition = logic();
		if (condition == null)
		{
			return null;
		}
		List<AssignmentStatement> body = assignmentBlock();
		if (body == null)
		{
			return null;
		}
		return new WhileStatement(condition, body);
	}

	/**
	 * Parses a block of assignments and leaves the cursor on its closing 'end'.
	 * Grammar: `':' 'begin' (ASSIGNMENT ';')* 'end'`
	 */
	private List<AssignmentStatement> assignmentBlock()
	{
		if (expect(TokenType.COLON) == null || expect(TokenType.BEGIN) == null)
		{
			return null;
		}

		List<AssignmentStatement> body = new ArrayList<>();
		while (!tokens.is(TokenType.END))
		{
			if (tokens.isAtEnd())
			{
				return fail(Diagnostic.unterminatedBlock(TokenType.END, tokens.current()));
			}
			AssignmentStatement assignment = assignment(TokenType.SEMICOLON);
			if (assignment == null || expect(TokenType.SEMICOLON) == null)
			{
				return null;
			}
			body.add(assignment);
		}
		return body;
	}

	/**
	 * Parses a for loop statement. The cursor is left on the closing 'end'.
	 * Grammar: `'for' '(' INIT ';' LOGIC ';' STEP ')' ':' 'begin' (SIMPLE_STATEMENT ';')* 'end'`
	 * where INIT is a single initialized declaration or an assignment, and STEP and
	 * SIMPLE_STATEMENT are an assignment or a postfix increment/decrement.
	 */
	private ForStatement forStatement()
	{
		tokens.advance(); // 'for'
		if (expect(TokenType.LEFT_PAREN) == null)
		{
			return null;
		}

		Statement initializer;
		if (tokens.isOneOf(TokenType.INT, TokenType.BOOL))
		{
			initializer = declaration(true);
		}
		else
		{
			initializer = assignment(TokenType.SEMICOLON);
		}
		if (initializer == null || expect(TokenType.SEMICOLON) == null)
		{
			return null;
		}

		Logic condition = logic();
		if (condition == null || expect(TokenType.SEMICOLON) == null)
		{
			return null;
		}

		Statement step = simpleStatement(TokenType.RIGHT_PAREN);
		if (step == null || expect(TokenType.RIGHT_PAREN) == null)
		{
			return null;
		}

		if (expect(TokenType.COLON) == null || expect(TokenType.BEGIN) == null)
		{
			return null;
		}
		List<Statement> body = new ArrayList<>();
		while (!tokens.is(TokenType.END))
		{
			if (tokens.isAtEnd())
			{
				return fail(Diagnostic.unterminatedBlock(TokenType.END, tokens.current()));
			}
			Statement statement = simpleStatement(TokenType.SEMICOLON);
			if (statement == null || expect(TokenType.SEMICOLON) == null)
			{
				return null;
			}
			body.add(statement);
		}
		return new ForStatement(initializer, condition, step, body);
	}

	/**
	 * Parses a print statement. The cursor is left on the closing 'end'.
	 * Grammar: `'print' ':' 'begin' PRINTABLE (',' PRINTABLE)* 'end'`
	 */
	private PrintStatement printStatement()
	{
		tokens.advance(); // 'print'
		if (expect(TokenType.COLON) == null || expect(TokenType.BEGIN) == null)
		{
			return null;
		}

		List<ASTNode> arguments = new ArrayList<>();
		do
		{
			ASTNode argument = printable();
			if (argument == null)
			{
				return null;
			}
			arguments.add(argument);
		}
		while (match(TokenType.COMMA));

		if (!tokens.is(TokenType.END))
		{
			if (tokens.isAtEnd())
			{
				return fail(Diagnostic.unterminatedBlock(TokenType.END, tokens.current()));
			}
			return fail(Diagnostic.unexpectedToken(TokenType.END, tokens.current()));
		}
		return new PrintStatement(arguments);
	}

	/**
	 * Parses one print argument: a bare `true`/`false`, an arithmetic expression,
	 * or, when neither fits up to the next ',' or 'end', a logic expression.
	 */
	private ASTNode printable()
	{
		Token token = tokens.current();
		TokenType next = tokens.peek(1).getType();
		if ((token.is(TokenType.TRUE) || token.is(TokenType.FALSE)) &&(next == TokenType.COMMA || next == TokenType.END))
		{
			tokens.advance();
			return new FinalExpression(token.is(TokenType.TRUE) ? FinalExpression.Kind.TRUE : FinalExpression.Kind.FALSE, token.getLexeme());
		}

		Expression value = attempt(this::expression, TokenType.COMMA, TokenType.END);
		if (value != null)
		{
			return value;
		}
		return logic();
	}

	/**
	 * Runs a rule speculatively. Diagnostics raised inside are suppressed. The attempt succeeds only
	 * if the rule produces a node and, when followers are given, the next token is one of them.
	 * On failure the cursor is restored to where it was before the attempt.
	 *
	 * @param rule      The grammar rule to try.
	 * @param followers The token types allowed directly after a successful parse; none means any.
	 * @return The node produced by the rule, or null if the attempt failed.
	 */
	private <T> T attempt(Supplier<T> rule, TokenType... followers)
	{
		int mark = tokens.mark();
		speculationDepth++;
		try
		{
			T result = rule.get();
			if (result != null && (followers.length == 0 || tokens.isOneOf(followers)))
			{
				return result;
			}
			tokens.reset(mark);
			Debug.log("Trial parse from %s did not fit, backtracking.", tokens.current());
			return null;
		}
		finally
		{
			speculationDepth--;
		}
	}

	/**
	 * Consumes the current token if its type matches.
	 *
	 * @return True if the token was consumed.
	 */
	private boolean match(TokenType type)
	{
		if (tokens.is(type))
		{
			tokens.advance();
			return true;
		}
		return false;
	}

	/**
	 * Consumes the current token if it has the expected type, otherwise fails.
	 *
	 * @param type The expected TokenType.
	 * @return The consumed Token, or null after reporting the error.
	 */
	private Token expect(TokenType type)
	{
		if (tokens.is(type))
		{
			return tokens.advance();
		}
		return fail(Diagnostic.unexpectedToken(type, tokens.current()));
	}

	/**
	 * Reports a syntax error and enters panic mode: all remaining tokens are discarded
	 * so that every enclosing rule unwinds. Inside a trial parse nothing is reported or
	 * discarded; {@link #attempt} restores the cursor.
	 *
	 * @return Always null, the failure signal of every rule.
	 */
	private <T> T fail(Diagnostic diagnostic)
	{
		if (speculationDepth > 0)
		{
			return null;
		}
		errorReporter.report(diagnostic);
		synchronize();
		return null;
	}

	/**
	 * Discards tokens up to the end of input.
	 */
	private void synchronize()
	{
		while (!tokens.isAtEnd())
		{
			tokens.advance();
		}
	}
}
