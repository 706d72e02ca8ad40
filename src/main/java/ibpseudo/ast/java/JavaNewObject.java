package ibpseudo.ast.java;

import ibpseudo.ast.SourceLocation;

import java.util.List;

public record JavaNewObject(String type, List<JavaExpr> args, SourceLocation location) implements JavaExpr {
	public JavaNewObject {
		args = List.copyOf(args);
	}

	@Override
	public <R> R accept(Visitor<R> visitor) {
		return visitor.visitNewObject(this);
	}
}
