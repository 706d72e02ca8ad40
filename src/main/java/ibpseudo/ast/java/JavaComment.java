package ibpseudo.ast.java;

import ibpseudo.ast.SourceLocation;

public record JavaComment(String text, SourceLocation location) implements JavaStmt {
	@Override
	public <R> R accept(Visitor<R> visitor) {
		return visitor.visitComment(this);
	}
}
