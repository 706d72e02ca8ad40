package ibpseudo.ast.java;

import ibpseudo.ast.SourceLocation;

public record JavaFieldAccess(JavaExpr target, String name, SourceLocation location) implements JavaExpr {
	@Override
	public <R> R accept(Visitor<R> visitor) {
		return visitor.visitFieldAccess(this);
	}
}
