package ibpseudo.ast.java;

public sealed interface JavaExpr extends JavaNode
		permits JavaAssign, JavaBinary, JavaUnary, JavaMethodCall, JavaFieldAccess, JavaArrayAccess, JavaArrayInit,
		JavaNewObject, JavaNewArray, JavaCast, JavaParens, JavaName, JavaLiteral {

	<R> R accept(Visitor<R> visitor);

	interface Visitor<R> {
		R visitAssign(JavaAssign expr);

		R visitBinary(JavaBinary expr);

		R visitUnary(JavaUnary expr);

		R visitMethodCall(JavaMethodCall expr);

		R visitFieldAccess(JavaFieldAccess expr);

		R visitArrayAccess(JavaArrayAccess expr);

		R visitArrayInit(JavaArrayInit expr);

		R visitNewObject(JavaNewObject expr);

		R visitNewArray(JavaNewArray expr);

		R visitCast(JavaCast expr);

		R visitParens(JavaParens expr);

		R visitName(JavaName expr);

		R visitLiteral(JavaLiteral expr);
	}
}
