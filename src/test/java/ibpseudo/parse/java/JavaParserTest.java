package ibpseudo.parse.java;

import ibpseudo.ast.java.JavaAssign;
import ibpseudo.ast.java.JavaBinary;
import ibpseudo.ast.java.JavaBlock;
import ibpseudo.ast.java.JavaClassDecl;
import ibpseudo.ast.java.JavaComment;
import ibpseudo.ast.java.JavaExprStmt;
import ibpseudo.ast.java.JavaFor;
import ibpseudo.ast.java.JavaForEach;
import ibpseudo.ast.java.JavaIf;
import ibpseudo.ast.java.JavaLiteral;
import ibpseudo.ast.java.JavaMethodCall;
import ibpseudo.ast.java.JavaMethodDecl;
import ibpseudo.ast.java.JavaName;
import ibpseudo.ast.java.JavaProgram;
import ibpseudo.ast.java.JavaStmt;
import ibpseudo.ast.java.JavaSwitch;
import ibpseudo.ast.java.JavaUnary;
import ibpseudo.ast.java.JavaVarDecl;
import ibpseudo.diag.DiagnosticKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class JavaParserTest {
	@Test
	void parsesSingleDeclarationOnFirstLine() {
		ParseResult result = parse("int x = 5;");

		JavaProgram program = result.program().orElseThrow();
		assertEquals(1, program.declarations().size());
		JavaVarDecl decl = assertInstanceOf(JavaVarDecl.class, program.declarations().get(0));
		assertEquals("x", decl.name());
		assertEquals("int", decl.type().name());
		assertEquals(1, decl.location().line());
		assertInstanceOf(JavaLiteral.class, decl.initializer());
		assertTrue(result.diagnostics().isEmpty());
	}

	@Test
	void multiplicationBindsTighterThanAddition() {
		JavaAssign assign = assignment("x = a + b * c;");

		JavaBinary sum = assertInstanceOf(JavaBinary.class, assign.value());
		assertEquals("+", sum.op());
		assertInstanceOf(JavaName.class, sum.left());
		JavaBinary product = assertInstanceOf(JavaBinary.class, sum.right());
		assertEquals("*", product.op());
	}

	@Test
	void subtractionIsLeftAssociative() {
		JavaAssign assign = assignment("x = a - b - c;");

		JavaBinary outer = assertInstanceOf(JavaBinary.class, assign.value());
		assertEquals("c", assertInstanceOf(JavaName.class, outer.right()).name());
		JavaBinary inner = assertInstanceOf(JavaBinary.class, outer.left());
		assertEquals("a", assertInstanceOf(JavaName.class, inner.left()).name());
	}

	@Test
	void assignmentIsRightAssociative() {
		JavaAssign assign = assignment("a = b = 1;");

		assertInstanceOf(JavaAssign.class, assign.value());
	}

	@Test
	void logicalAndBindsTighterThanOr() {
		JavaAssign assign = assignment("ok = a || b && !c;");

		JavaBinary or = assertInstanceOf(JavaBinary.class, assign.value());
		assertEquals("||", or.op());
		JavaBinary and = assertInstanceOf(JavaBinary.class, or.right());
		assertEquals("&&", and.op());
		assertEquals("!", assertInstanceOf(JavaUnary.class, and.right()).op());
	}

	@Test
	void distinguishesEnhancedForFromCountingFor() {
		List<JavaStmt> decls = parse("for (int v : values) { }\nfor (int i = 0; i < 3; i++) { }")
				.program().orElseThrow().declarations();

		JavaForEach each = assertInstanceOf(JavaForEach.class, decls.get(0));
		assertEquals("v", each.variable());
		assertEquals("values", assertInstanceOf(JavaName.class, each.iterable()).name());

		JavaFor loop = assertInstanceOf(JavaFor.class, decls.get(1));
		assertEquals(1, loop.init().size());
		assertInstanceOf(JavaBinary.class, loop.condition());
		assertTrue(assertInstanceOf(JavaUnary.class, loop.update().get(0)).postfix());
	}

	@Test
	void forWithEmptyHeader() {
		JavaFor loop = assertInstanceOf(JavaFor.class, single("for (;;) { break; }"));

		assertTrue(loop.init().isEmpty());
		assertNull(loop.condition());
		assertTrue(loop.update().isEmpty());
	}

	@Test
	void elseBindsToNearestIf() {
		JavaIf outer = assertInstanceOf(JavaIf.class, single("if (a) if (b) x = 1; else x = 2;"));

		assertNull(outer.elseBranch());
		JavaIf inner = assertInstanceOf(JavaIf.class, outer.thenBranch());
		assertInstanceOf(JavaExprStmt.class, inner.elseBranch());
	}

	@Test
	void parsesSwitchCasesWithFallThrough() {
		JavaSwitch sw = assertInstanceOf(JavaSwitch.class, single(
				"switch (day) { case 1: case 7: x = 0; break; default: x = 1; }"));

		assertEquals(3, sw.cases().size());
		assertTrue(sw.cases().get(0).body().isEmpty());
		assertEquals(2, sw.cases().get(1).body().size());
		assertTrue(sw.cases().get(2).isDefault());
	}

	@Test
	void splitsMultipleDeclarators() {
		List<JavaStmt> decls = parse("int a, b = 2, c[];").program().orElseThrow().declarations();

		assertEquals(3, decls.size());
		assertNull(((JavaVarDecl) decls.get(0)).initializer());
		assertEquals("b", ((JavaVarDecl) decls.get(1)).name());
		assertEquals(1, ((JavaVarDecl) decls.get(2)).type().dimensions());
	}

	@Test
	void parsesClassMembers() {
		String source = "package demo;\n" +
				"import java.util.List;\n" +
				"@SuppressWarnings(\"unused\")\n" +
				"public class Point extends Shape implements Comparable<Point>, Cloneable {\n" +
				"\tprivate int x, y;\n" +
				"\tpublic Point(int x) { this.x = x; }\n" +
				"\t@Override\n" +
				"\tpublic int compareTo(Point other) { return x - other.x; }\n" +
				"\tstatic List<String> names(String... parts) throws Exception { return null; }\n" +
				"}\n";

		ParseResult result = parse(source);

		assertTrue(result.diagnostics().isEmpty(), result.diagnostics().toString());
		JavaClassDecl cls = assertInstanceOf(JavaClassDecl.class, result.program().orElseThrow().declarations().get(0));
		assertEquals("Point", cls.name());
		assertEquals("Shape", cls.superClass());
		assertEquals(5, cls.members().size());
		JavaMethodDecl ctor = assertInstanceOf(JavaMethodDecl.class, cls.members().get(2));
		assertTrue(ctor.isConstructor());
		JavaMethodDecl compare = assertInstanceOf(JavaMethodDecl.class, cls.members().get(3));
		assertFalse(compare.isConstructor());
		assertEquals("int", compare.returnType().name());
		JavaMethodDecl names = assertInstanceOf(JavaMethodDecl.class, cls.members().get(4));
		assertEquals(1, names.params().get(0).type().dimensions());
		assertTrue(names.isStatic());
	}

	@Test
	void recognisesMainMethod() {
		JavaClassDecl cls = assertInstanceOf(JavaClassDecl.class,
				single("class App { public static void main(String[] args) { } }"));

		assertTrue(assertInstanceOf(JavaMethodDecl.class, cls.members().get(0)).isMain());
	}

	@Test
	void keepsCommentsBetweenStatements() {
		List<JavaStmt> decls = parse("// first\nx = 1;\n/* second */").program().orElseThrow().declarations();

		assertEquals(3, decls.size());
		assertEquals("// first", assertInstanceOf(JavaComment.class, decls.get(0)).text());
		assertInstanceOf(JavaExprStmt.class, decls.get(1));
		assertInstanceOf(JavaComment.class, decls.get(2));
	}

	@Test
	void parsesQualifiedCallChains() {
		JavaExprStmt stmt = assertInstanceOf(JavaExprStmt.class, single("System.out.println(a, 1);"));

		JavaMethodCall call = assertInstanceOf(JavaMethodCall.class, stmt.expr());
		assertEquals("println", call.name());
		assertTrue(call.hasTarget());
		assertEquals(2, call.args().size());
	}

	@Test
	void recoversAfterSyntaxError() {
		ParseResult result = parse("int x = ;\nint y = 2;");

		assertEquals(1, result.diagnostics().size());
		assertEquals(DiagnosticKind.SYNTAX, result.diagnostics().get(0).kind());
		assertEquals("Expected an expression but found ';'", result.diagnostics().get(0).message());
		assertEquals(1, result.diagnostics().get(0).line());
		assertEquals(9, result.diagnostics().get(0).column());

		List<JavaStmt> decls = result.program().orElseThrow().declarations();
		assertEquals(1, decls.size());
		assertEquals("y", assertInstanceOf(JavaVarDecl.class, decls.get(0)).name());
	}

	@Test
	void recoversInsideBlockAndKeepsSiblings() {
		ParseResult result = parse("void f() {\n  x = ;\n  y = 1;\n}");

		assertEquals(1, result.diagnostics().size());
		assertEquals(2, result.diagnostics().get(0).line());
		JavaMethodDecl method = assertInstanceOf(JavaMethodDecl.class, result.program().orElseThrow().declarations().get(0));
		assertEquals(1, method.body().stmts().size());
	}

	@Test
	void reportsMissingSemicolon() {
		ParseResult result = parse("x = 1\ny = 2;");

		assertFalse(result.diagnostics().isEmpty());
		assertTrue(result.diagnostics().get(0).message().startsWith("Expected ';' after expression"));
	}

	@Test
	void rejectsExcessiveNesting() {
		String source = "x = " + "(".repeat(300) + "1" + ")".repeat(300) + ";";

		ParseResult result = parse(source);

		assertEquals(1, result.diagnostics().size());
		assertTrue(result.diagnostics().get(0).message().startsWith("Nesting is too deep"));
		assertTrue(result.program().isPresent());
	}

	@Test
	void rejectsDeeplyNestedArrayInitializer() {
		String source = "int[] a = " + "{".repeat(5000) + "}".repeat(5000) + ";";

		ParseResult result = parse(source);

		assertTrue(result.program().isPresent());
		assertTrue(result.diagnostics().get(0).message().startsWith("Nesting is too deep"));
	}

	@Test
	void parsesLongOperatorChainWithoutNesting() {
		String source = "int x = " + "1 + ".repeat(20000) + "1;";

		ParseResult result = parse(source);

		assertTrue(result.diagnostics().isEmpty());
		JavaVarDecl decl = assertInstanceOf(JavaVarDecl.class, result.program().orElseThrow().declarations().get(0));
		assertInstanceOf(JavaBinary.class, decl.initializer());
	}

	@Test
	void acceptsModerateNesting() {
		String source = "if (a) { ".repeat(15) + "x = 1;" + " }".repeat(15);

		ParseResult result = parse(source);

		assertTrue(result.diagnostics().isEmpty());
		assertInstanceOf(JavaIf.class, result.program().orElseThrow().declarations().get(0));
	}

	@Test
	void emptyInputGivesEmptyProgram() {
		ParseResult result = new JavaParser().parse(List.of());

		assertTrue(result.program().orElseThrow().declarations().isEmpty());
		assertTrue(result.diagnostics().isEmpty());
	}

	@Test
	void emptyStatementIsEmptyBlock() {
		assertInstanceOf(JavaBlock.class, single(";"));
	}

	private static ParseResult parse(String source) {
		return new JavaParser().parse(new JavaLexer().lex(source).tokens());
	}

	private static JavaStmt single(String source) {
		ParseResult result = parse(source);
		assertTrue(result.diagnostics().isEmpty(), result.diagnostics().toString());
		List<JavaStmt> decls = result.program().orElseThrow().declarations();
		assertEquals(1, decls.size());
		return decls.get(0);
	}

	private static JavaAssign assignment(String source) {
		JavaExprStmt stmt = assertInstanceOf(JavaExprStmt.class, single(source));
		return assertInstanceOf(JavaAssign.class, stmt.expr());
	}
}
