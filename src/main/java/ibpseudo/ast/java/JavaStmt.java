package ibpseudo.ast.java;

/**
 * Statements and declarations. Class and method declarations are statements too, so the same
 * list type serves a program, a class body and a block.
 */
public sealed interface JavaStmt extends JavaNode
		permits JavaClassDecl, JavaMethodDecl, JavaVarDecl, JavaBlock, JavaExprStmt, JavaIf, JavaWhile,
		JavaDoWhile, JavaFor, JavaForEach, JavaSwitch, JavaBreak, JavaContinue, JavaReturn, JavaComment {

	<R> R accept(Visitor<R> visitor);

	interface Visitor<R> {
		R visitClass(JavaClassDecl decl);

		R visitMethod(JavaMethodDecl decl);

		R visitVariable(JavaVarDecl decl);

		R visitBlock(JavaBlock block);

		R visitExpression(JavaExprStmt stmt);

		R visitIf(JavaIf stmt);

		R visitWhile(JavaWhile stmt);

		R visitDoWhile(JavaDoWhile stmt);

		R visitFor(JavaFor stmt);

		R visitForEach(JavaForEach stmt);

		R visitSwitch(JavaSwitch stmt);

		R visitBreak(JavaBreak stmt);

		R visitContinue(JavaContinue stmt);

		R visitReturn(JavaReturn stmt);

		R visitComment(JavaComment comment);
	}
}
