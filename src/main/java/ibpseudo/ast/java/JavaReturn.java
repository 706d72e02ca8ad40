package ibpseudo.ast.java;

import ibpseudo.ast.SourceLocation;

public record JavaReturn(JavaExpr value, SourceLocation location) implements JavaStmt {
	public boolean hasValue() {
		return value != null;
	}

	@Override
	public <R> R accept(Visitor<R> visitor) {
		return visitor.visitReturn(this);
	}
}
