package ibpseudo.ast.java;

import ibpseudo.ast.SourceLocation;

import java.util.Objects;

public record JavaWhile(JavaExpr condition, JavaStmt body, SourceLocation location) implements JavaStmt {
	public JavaWhile {
		Objects.requireNonNull(condition, "condition");
		Objects.requireNonNull(body, "body");
	}

	@Override
	public <R> R accept(Visitor<R> visitor) {
		return visitor.visitWhile(this);
	}
}
