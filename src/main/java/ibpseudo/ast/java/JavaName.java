package ibpseudo.ast.java;

import ibpseudo.ast.SourceLocation;

public record JavaName(String name, SourceLocation location) implements JavaExpr {
	public boolean isThis() {
		return name.equals("this");
	}

	@Override
	public <R> R accept(Visitor<R> visitor) {
		return visitor.visitName(this);
	}
}
