package ibpseudo.ast.java;

import ibpseudo.ast.SourceLocation;

import java.util.Objects;

public record JavaForEach(JavaTypeRef type, String variable, JavaExpr iterable, JavaStmt body, SourceLocation location) implements JavaStmt {
	public JavaForEach {
		Objects.requireNonNull(variable, "variable");
		Objects.requireNonNull(iterable, "iterable");
		Objects.requireNonNull(body, "body");
	}

	@Override
	public <R> R accept(Visitor<R> visitor) {
		return visitor.visitForEach(this);
	}
}
