package ibpseudo.ast.java;

import ibpseudo.ast.SourceLocation;

import java.util.Objects;

public record JavaExprStmt(JavaExpr expr, SourceLocation location) implements JavaStmt {
	public JavaExprStmt {
		Objects.requireNonNull(expr, "expr");
	}

	@Override
	public <R> R accept(Visitor<R> visitor) {
		return visitor.visitExpression(this);
	}
}
