package ibpseudo.ast.java;

import ibpseudo.ast.SourceLocation;

public record JavaParens(JavaExpr inner, SourceLocation location) implements JavaExpr {
	@Override
	public <R> R accept(Visitor<R> visitor) {
		return visitor.visitParens(this);
	}
}
