package com.juanpa.lumen.frontend.parser;

import com.juanpa.lumen.frontend.ast.ASTNode;
import com.juanpa.lumen.frontend.ast.Program;
import com.juanpa.lumen.frontend.ast.expressions.*;
import com.juanpa.lumen.frontend.ast.statements.DeclarationStatement;
import com.juanpa.lumen.frontend.util.ErrorReporter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Arithmetic expression parsing: precedence, associativity and the operand forms.
 */
public class ExpressionParserTest
{
	private ErrorReporter errorReporter;

	@BeforeEach
	void setUp()
	{
		errorReporter = new ErrorReporter(false);
	}

	/**
	 * Parses `int r = <source>;` and returns the single initializer.
	 */
	private ASTNode parseInitializer(String source)
	{
		System.out.println("Input expression: " + source);
		Program program = new LumenParser(TestTokens.of("int r = " + source + ";"), errorReporter).parse();
		assertNotNull(program, "Expression should parse: " + errorReporter.getDiagnostics());
		assertFalse(errorReporter.hasErrors());
		DeclarationStatement declaration = (DeclarationStatement) program.getStatements().get(0);
		ASTNode initializer = declaration.getInitializers().get(0);
		System.out.println("Generated AST: " + initializer);
		return initializer;
	}

	@Test
	void testMultiplicationBindsTighterThanAddition()
	{
		System.out.println("--- Running test: testMultiplicationBindsTighterThanAddition ---");
		ASTNode node = parseInitializer("1 + 2 * 3");
		assertEquals("(1 + (2 * 3))", node.toString());

		BinaryExpression sum = (BinaryExpression) node;
		assertEquals(BinaryExpression.Operator.ADD, sum.getOperator());
		assertInstanceOf(FinalExpression.class, sum.getLeft());
		assertEquals(BinaryExpression.Operator.MUL, ((BinaryExpression) sum.getRight()).getOperator());
	}

	@Test
	void testAdditiveAndMultiplicativeOperatorsAreLeftAssociative()
	{
		System.out.println("--- Running test: testAdditiveAndMultiplicativeOperatorsAreLeftAssociative ---");
		assertEquals("((10 - 4) - 3)", parseInitializer("10 - 4 - 3").toString());
		assertEquals("((8 % 3) * 2)", parseInitializer("8 % 3 * 2").toString());
		assertEquals("((a / b) / c)", parseInitializer("a / b / c").toString());
	}

	@Test
	void testExponentIsRightAssociative()
	{
		System.out.println("--- Running test: testExponentIsRightAssociative ---");
		ASTNode node = parseInitializer("2 ^ 3 ^ 2");
		assertEquals("(2 ^ (3 ^ 2))", node.toString());
		assertEquals("(2 * (3 ^ 2))", parseInitializer("2 * 3 ^ 2").toString());
	}

	@Test
	void testParenthesesOverridePrecedence()
	{
		System.out.println("--- Running test: testParenthesesOverridePrecedence ---");
		ASTNode node = parseInitializer("(1 + 2) * 3");
		assertEquals("((1 + 2) * 3)", node.toString());
		assertEquals(BinaryExpression.Operator.MUL, ((BinaryExpression) node).getOperator());
	}

	@Test
	void testSignedNumbers()
	{
		System.out.println("--- Running test: testSignedNumbers ---");
		ASTNode negative = parseInitializer("-5");
		SignedNumberExpression signed = assertInstanceOf(SignedNumberExpression.class, negative);
		assertEquals(SignedNumberExpression.Sign.MINUS, signed.getSign());
		assertEquals("5", signed.getValue());

		ASTNode positive = parseInitializer("+7 - 1");
		assertEquals("(+7 - 1)", positive.toString());
		SignedNumberExpression left = (SignedNumberExpression) ((BinaryExpression) positive).getLeft();
		assertEquals(SignedNumberExpression.Sign.PLUS, left.getSign());
	}

	@Test
	void testNegatedParenthesizedExpression()
	{
		System.out.println("--- Running test: testNegatedParenthesizedExpression ---");
		ASTNode node = parseInitializer("-(a + b) * 2");
		assertEquals("((-(a + b)) * 2)", node.toString());
		NegatedExpression negated = (NegatedExpression) ((BinaryExpression) node).getLeft();
		assertEquals("(a + b)", negated.getExpression().toString());
	}

	@Test
	void testUnaryPlusOnParenthesizedExpressionYieldsInnerExpression()
	{
		System.out.println("--- Running test: testUnaryPlusOnParenthesizedExpressionYieldsInnerExpression ---");
		ASTNode node = parseInitializer("2 * +(a + 1)");
		assertEquals("(2 * (a + 1))", node.toString());
		assertInstanceOf(BinaryExpression.class, ((BinaryExpression) node).getRight());
	}

	@Test
	void testPostfixOperandInsideExpression()
	{
		System.out.println("--- Running test: testPostfixOperandInsideExpression ---");
		ASTNode node = parseInitializer("i++ * 2 + j--");
		assertEquals("(((i++) * 2) + (j--))", node.toString());

		BinaryExpression sum = (BinaryExpression) node;
		PostfixUnaryExpression decrement = assertInstanceOf(PostfixUnaryExpression.class, sum.getRight());
		assertEquals("j", decrement.getIdentifier());
		assertEquals(PostfixUnaryExpression.Operator.DECREMENT, decrement.getOperator());
	}

	@Test
	void testIdentifiersAndNumbersBecomeFinalExpressions()
	{
		System.out.println("--- Running test: testIdentifiersAndNumbersBecomeFinalExpressions ---");
		FinalExpression number = assertInstanceOf(FinalExpression.class, parseInitializer("42"));
		assertEquals(FinalExpression.Kind.NUMBER, number.getKind());
		assertEquals("42", number.getValue());

		FinalExpression identifier = assertInstanceOf(FinalExpression.class, parseInitializer("count"));
		assertTrue(identifier.isIdentifier());
		assertEquals("count", identifier.getValue());
	}
}
