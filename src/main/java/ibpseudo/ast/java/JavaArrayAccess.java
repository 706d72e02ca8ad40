package ibpseudo.ast.java;

import ibpseudo.ast.SourceLocation;

public record JavaArrayAccess(JavaExpr array, JavaExpr index, SourceLocation location) implements JavaExpr {
	@Override
	public <R> R accept(Visitor<R> visitor) {
		return visitor.visitArrayAccess(this);
	}
}
