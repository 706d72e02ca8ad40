package ibpseudo.ast.java;

import ibpseudo.ast.SourceLocation;

import java.util.Objects;

public record JavaDoWhile(JavaStmt body, JavaExpr condition, SourceLocation location) implements JavaStmt {
	public JavaDoWhile {
		Objects.requireNonNull(body, "body");
		Objects.requireNonNull(condition, "condition");
	}

	@Override
	public <R> R accept(Visitor<R> visitor) {
		return visitor.visitDoWhile(this);
	}
}
