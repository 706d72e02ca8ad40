package ibpseudo.ast.java;

import ibpseudo.ast.SourceLocation;

public record JavaCast(JavaTypeRef type, JavaExpr operand, SourceLocation location) implements JavaExpr {
	@Override
	public <R> R accept(Visitor<R> visitor) {
		return visitor.visitCast(this);
	}
}
