package ibpseudo.ast.java;

import ibpseudo.ast.SourceLocation;

import java.util.List;

public record JavaArrayInit(List<JavaExpr> elements, SourceLocation location) implements JavaExpr {
	public JavaArrayInit {
		elements = List.copyOf(elements);
	}

	@Override
	public <R> R accept(Visitor<R> visitor) {
		return visitor.visitArrayInit(this);
	}
}
