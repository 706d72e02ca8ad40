package ibpseudo.ast.java;

import ibpseudo.ast.SourceLocation;

public record JavaBreak(SourceLocation location) implements JavaStmt {
	@Override
	public <R> R accept(Visitor<R> visitor) {
		return visitor.visitBreak(this);
	}
}
