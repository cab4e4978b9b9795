package com.juanpa.lumen.frontend.parser;

import com.juanpa.lumen.frontend.ast.Program;
import com.juanpa.lumen.frontend.ast.expressions.*;
import com.juanpa.lumen.frontend.ast.statements.*;
import com.juanpa.lumen.frontend.lexer.Token;
import com.juanpa.lumen.frontend.lexer.TokenSource;
import com.juanpa.lumen.frontend.lexer.TokenStream;
import com.juanpa.lumen.frontend.util.Debug;
import com.juanpa.lumen.frontend.util.ErrorReporter;
import com.juanpa.lumen.frontend.util.ParserConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

public class StatementParserTest
{
	private ErrorReporter errorReporter;

	@BeforeEach
	void setUp()
	{
		errorReporter = new ErrorReporter(false);
	}

	private Program parseProgram(String source)
	{
		System.out.println("Input program: " + source);
		Program program = new LumenParser(TestTokens.of(source), errorReporter).parse();
		assertNotNull(program, "Program should parse: " + errorReporter.getDiagnostics());
		assertFalse(errorReporter.hasErrors());
		System.out.println("Generated AST:\n" + program);
		return program;
	}

	private Statement parseSingle(String source)
	{
		Program program = parseProgram(source);
		assertEquals(1, program.size());
		return program.getStatements().get(0);
	}

	@Test
	void testEmptyProgram()
	{
		System.out.println("--- Running test: testEmptyProgram ---");
		Program program = parseProgram("");
		assertEquals(0, program.size());
		assertTrue(program.getStatements().isEmpty());
	}

	@Test
	void testDeclarationWithoutInitializers()
	{
		System.out.println("--- Running test: testDeclarationWithoutInitializers ---");
		DeclarationStatement declaration = (DeclarationStatement) parseSingle("int a, b, c;");
		assertEquals(DeclarationStatement.Kind.INT, declaration.getKind());
		assertEquals(List.of("a", "b", "c"), declaration.getNames());
		assertFalse(declaration.hasInitializers());
		assertEquals("VarDecl: int a, b, c", declaration.toString());
	}

	@Test
	void testDeclarationWithPairedInitializers()
	{
		System.out.println("--- Running test: testDeclarationWithPairedInitializers ---");
		DeclarationStatement declaration = (DeclarationStatement) parseSingle("int a, b = 1, 2 * x;");
		assertEquals(2, declaration.getInitializers().size());
		assertEquals("VarDecl: int a, b = 1, (2 * x)", declaration.toString());
	}

	@Test
	void testBoolDeclarationTakesLogicInitializers()
	{
		System.out.println("--- Running test: testBoolDeclarationTakesLogicInitializers ---");
		DeclarationStatement declaration = (DeclarationStatement) parseSingle("bool f, g = a < b, done;");
		assertEquals(DeclarationStatement.Kind.BOOL, declaration.getKind());
		assertInstanceOf(ComparisonExpression.class, declaration.getInitializers().get(0));
		ComparisonExpression second = (ComparisonExpression) declaration.getInitializers().get(1);
		assertEquals(ComparisonExpression.Operator.IDENTIFIER_REF, second.getOperator());
	}

	@Test
	void testAssignmentWithLogicRightHandSide()
	{
		System.out.println("--- Running test: testAssignmentWithLogicRightHandSide ---");
		AssignmentStatement assignment = (AssignmentStatement) parseSingle("x = y && z;");
		assertTrue(assignment.isLogic());
		assertNull(assignment.getValue());
		assertEquals("x", assignment.getTarget().getValue());
		assertEquals("x = (y && z)", assignment.toString());

		AssignmentStatement comparison = (AssignmentStatement) parseSingle("x = a > b;");
		assertTrue(comparison.isLogic());
	}

	@Test
	void testAssignmentFallsBackToArithmetic()
	{
		System.out.println("--- Running test: testAssignmentFallsBackToArithmetic ---");
		AssignmentStatement assignment = (AssignmentStatement) parseSingle("x = y + z;");
		assertFalse(assignment.isLogic());
		assertEquals(AssignmentStatement.Operator.ASSIGN, assignment.getOperator());
		assertEquals("(y + z)", assignment.getValue().toString());

		AssignmentStatement grouped = (AssignmentStatement) parseSingle("x = (a + b) * 2;");
		assertFalse(grouped.isLogic());
		assertEquals("((a + b) * 2)", grouped.getValue().toString());

		AssignmentStatement number = (AssignmentStatement) parseSingle("x = 5;");
		assertFalse(number.isLogic());
	}

	@Test
	void testCompoundAssignmentsAreAlwaysArithmetic()
	{
		System.out.println("--- Running test: testCompoundAssignmentsAreAlwaysArithmetic ---");
		Program program = parseProgram("a += b; a -= 1; a *= c; a /= 2;");
		assertEquals(4, program.size());

		AssignmentStatement first = (AssignmentStatement) program.getStatements().get(0);
		assertEquals(AssignmentStatement.Operator.PLUS_ASSIGN, first.getOperator());
		assertFalse(first.isLogic());
		assertInstanceOf(FinalExpression.class, first.getValue());

		assertEquals(AssignmentStatement.Operator.MINUS_ASSIGN, ((AssignmentStatement) program.getStatements().get(1)).getOperator());
		assertEquals(AssignmentStatement.Operator.STAR_ASSIGN, ((AssignmentStatement) program.getStatements().get(2)).getOperator());
		assertEquals(AssignmentStatement.Operator.SLASH_ASSIGN, ((AssignmentStatement) program.getStatements().get(3)).getOperator());
	}

	@Test
	void testPostfixStatements()
	{
		System.out.println("--- Running test: testPostfixStatements ---");
		Program program = parseProgram("count++; count--;");
		assertEquals(2, program.size());

		PostfixUnaryExpression increment = (PostfixUnaryExpression) program.getStatements().get(0);
		assertEquals("count", increment.getIdentifier());
		assertEquals(PostfixUnaryExpression.Operator.INCREMENT, increment.getOperator());
		assertEquals(PostfixUnaryExpression.Operator.DECREMENT, ((PostfixUnaryExpression) program.getStatements().get(1)).getOperator());
	}

	@Test
	void testIfElifElse()
	{
		System.out.println("--- Running test: testIfElifElse ---");
		String source = "if a > 1: begin x = 1; y = 2; end\n"
				+ "elif a < 0: begin x = 2; end\n"
				+ "elif a == 0: begin end\n"
				+ "else: begin x = 3; end\n"
				+ "y = 4;";
		Program program = parseProgram(source);
		assertEquals(2, program.size());

		IfStatement ifStatement = (IfStatement) program.getStatements().get(0);
		assertEquals("(a > 1)", ifStatement.getCondition().toString());
		assertEquals(2, ifStatement.getThenBranch().size());
		assertEquals(2, ifStatement.getElifClauses().size());
		assertEquals("(a < 0)", ifStatement.getElifClauses().get(0).getCondition().toString());
		assertTrue(ifStatement.getElifClauses().get(1).getBody().isEmpty());
		assertTrue(ifStatement.hasElse());
		assertEquals("x = 3", ifStatement.getElseBranch().get(0).toString());

		assertEquals("y = 4", program.getStatements().get(1).toString());
	}

	@Test
	void testIfWithLiteralConditions()
	{
		System.out.println("--- Running test: testIfWithLiteralConditions ---");
		IfStatement ifStatement = (IfStatement) parseSingle("if true: begin x=1; end elif false: begin x=2; end else: begin x=3; end");
		assertEquals(ComparisonExpression.Operator.LITERAL_TRUE, ((ComparisonExpression) ifStatement.getCondition()).getOperator());
		assertEquals(1, ifStatement.getElifClauses().size());
		assertFalse(ifStatement.getElseBranch().isEmpty());
	}

	@Test
	void testIfWithoutElseFollowedByStatement()
	{
		System.out.println("--- Running test: testIfWithoutElseFollowedByStatement ---");
		Program program = parseProgram("if ready: begin x = 1; end y = 2; z++;");
		assertEquals(3, program.size());

		IfStatement ifStatement = (IfStatement) program.getStatements().get(0);
		assertFalse(ifStatement.hasElse());
		assertTrue(ifStatement.getElseBranch().isEmpty());
		assertTrue(ifStatement.getElifClauses().isEmpty());
		assertInstanceOf(AssignmentStatement.class, program.getStatements().get(1));
		assertInstanceOf(PostfixUnaryExpression.class, program.getStatements().get(2));
	}

	@Test
	void testIfWithoutElseAtEndOfInput()
	{
		System.out.println("--- Running test: testIfWithoutElseAtEndOfInput ---");
		IfStatement ifStatement = (IfStatement) parseSingle("if a: begin end");
		assertTrue(ifStatement.getThenBranch().isEmpty());
		assertFalse(ifStatement.hasElse());
	}

	@Test
	void testEmptyElseIsStillAnElse()
	{
		System.out.println("--- Running test: testEmptyElseIsStillAnElse ---");
		Program program = parseProgram("if a: begin x = 1; end else: begin end x = 2;");
		assertEquals(2, program.size());
		IfStatement ifStatement = (IfStatement) program.getStatements().get(0);
		assertTrue(ifStatement.hasElse());
		assertTrue(ifStatement.getElseBranch().isEmpty());
	}

	@Test
	void testWhileLoop()
	{
		System.out.println("--- Running test: testWhileLoop ---");
		Program program = parseProgram("while i < 10 && running: begin i += 1; total = total + i; end print: begin total end");
		assertEquals(2, program.size());

		WhileStatement loop = (WhileStatement) program.getStatements().get(0);
		assertEquals("((i < 10) && running)", loop.getCondition().toString());
		assertEquals(2, loop.getBody().size());
		assertEquals(AssignmentStatement.Operator.PLUS_ASSIGN, loop.getBody().get(0).getOperator());
	}

	@Test
	void testForLoopWithDeclarationHeader()
	{
		System.out.println("--- Running test: testForLoopWithDeclarationHeader ---");
		ForStatement loop = (ForStatement) parseSingle("for (int i = 0; i < 10; i++): begin total += i; i--; end");

		DeclarationStatement initializer = (DeclarationStatement) loop.getInitializer();
		assertEquals(List.of("i"), initializer.getNames());
		assertEquals("0", initializer.getInitializers().get(0).toString());
		assertEquals("(i < 10)", loop.getCondition().toString());
		assertInstanceOf(PostfixUnaryExpression.class, loop.getStep());

		assertEquals(2, loop.getBody().size());
		assertInstanceOf(AssignmentStatement.class, loop.getBody().get(0));
		assertInstanceOf(PostfixUnaryExpression.class, loop.getBody().get(1));
	}

	@Test
	void testForLoopWithAssignmentHeader()
	{
		System.out.println("--- Running test: testForLoopWithAssignmentHeader ---");
		Program program = parseProgram("for (i = 0; i < n; i = i + 1): begin x = x * 2; end x++;");
		assertEquals(2, program.size());

		ForStatement loop = (ForStatement) program.getStatements().get(0);
		assertEquals("i = 0", loop.getInitializer().toString());
		AssignmentStatement step = (AssignmentStatement) loop.getStep();
		assertFalse(step.isLogic());
		assertEquals("(i + 1)", step.getValue().toString());
		assertEquals(1, loop.getBody().size());
	}

	@Test
	void testPrintStatement()
	{
		System.out.println("--- Running test: testPrintStatement ---");
		PrintStatement print = (PrintStatement) parseSingle("print: begin a + 1, true, x > 2, b end");
		assertEquals(4, print.getArguments().size());
		assertEquals("Print (a + 1), true, (x > 2), b", print.toString());

		assertInstanceOf(BinaryExpression.class, print.getArguments().get(0));
		FinalExpression literal = assertInstanceOf(FinalExpression.class, print.getArguments().get(1));
		assertEquals(FinalExpression.Kind.TRUE, literal.getKind());
		assertInstanceOf(ComparisonExpression.class, print.getArguments().get(2));
		assertInstanceOf(FinalExpression.class, print.getArguments().get(3));
	}

	@Test
	void testPrintWithLogicConnective()
	{
		System.out.println("--- Running test: testPrintWithLogicConnective ---");
		PrintStatement print = (PrintStatement) parseSingle("print: begin false && done end");
		assertInstanceOf(LogicalExpression.class, print.getArguments().get(0));
	}

	@Test
	void testMixedProgramStatementCount()
	{
		System.out.println("--- Running test: testMixedProgramStatementCount ---");
		String source = "int i, total = 0, 0;\n"
				+ "bool done = false;\n"
				+ "while i < 5: begin total += i; i = i + 1; end\n"
				+ "if total > 10: begin done = true; end\n"
				+ "for (int k = 0; k < 3; k++): begin total -= 1; end\n"
				+ "print: begin total, done end";
		Program program = parseProgram(source);
		assertEquals(6, program.size());
		assertInstanceOf(DeclarationStatement.class, program.getStatements().get(0));
		assertInstanceOf(DeclarationStatement.class, program.getStatements().get(1));
		assertInstanceOf(WhileStatement.class, program.getStatements().get(2));
		assertInstanceOf(IfStatement.class, program.getStatements().get(3));
		assertInstanceOf(ForStatement.class, program.getStatements().get(4));
		assertInstanceOf(PrintStatement.class, program.getStatements().get(5));
	}

	@Test
	void testParserAcceptsTokenSource()
	{
		System.out.println("--- Running test: testParserAcceptsTokenSource ---");
		TokenStream stream = new TokenStream(TestTokens.of("x = 1;"));
		Program program = new LumenParser(stream, errorReporter).parse();
		assertNotNull(program);
		assertEquals(1, program.size());
		assertTrue(stream.isAtEnd());
	}

	@Test
	void testParserWithTracingConfig()
	{
		System.out.println("--- Running test: testParserWithTracingConfig ---");
		Properties props = new Properties();
		props.setProperty("parser.trace", "true");
		ParserConfig config = new ParserConfig(props);
		Debug.setEnabled(false);
		try
		{
			boolean[] tracedWhileParsing = {false};
			TokenStream stream = new TokenStream(TestTokens.of("int a = 1; if a > 0: begin a = 2; end"));
			TokenSource watching = new TokenSource()
			{
				@Override
				public Token current()
				{
					return stream.current();
				}

				@Override
				public Token advance()
				{
					tracedWhileParsing[0] |= Debug.isEnabled();
					return stream.advance();
				}

				@Override
				public Token peek(int offset)
				{
					return stream.peek(offset);
				}

				@Override
				public int mark()
				{
					return stream.mark();
				}

				@Override
				public void reset(int mark)
				{
					stream.reset(mark);
				}
			};

			LumenParser parser = new LumenParser(watching, errorReporter, config);
			assertFalse(Debug.isEnabled(), "Constructing a parser must not switch tracing on");
			Program program = parser.parse();
			assertNotNull(program);
			assertEquals(2, program.size());
			assertTrue(tracedWhileParsing[0], "Tracing should be on while parse() runs");
			assertFalse(Debug.isEnabled(), "Tracing should be restored once parse() returns");

			Program again = new LumenParser(TestTokens.of("x = 1;"), errorReporter, config).parse();
			assertNotNull(again);
			assertFalse(Debug.isEnabled());
		}
		finally
		{
			Debug.setEnabled(false);
		}
	}

	@Test
	void testParserCanOnlyBeUsedOnce()
	{
		System.out.println("--- Running test: testParserCanOnlyBeUsedOnce ---");
		LumenParser parser = new LumenParser(TestTokens.of("x = 1;"), errorReporter);
		assertNotNull(parser.parse());
		assertThrows(IllegalStateException.class, parser::parse);
	}
}
