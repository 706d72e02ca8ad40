package ibpseudo.ast.java;

import ibpseudo.ast.SourceLocation;

public record JavaBinary(JavaExpr left, String op, JavaExpr right, SourceLocation location) implements JavaExpr {
	@Override
	public <R> R accept(Visitor<R> visitor) {
		return visitor.visitBinary(this);
	}
}
