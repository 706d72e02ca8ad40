package ibpseudo.ast.java;

import ibpseudo.ast.SourceLocation;

import java.util.List;

/**
 * Either {@code new int[3][4]} (sized dimensions, no initializer) or {@code new int[] {1, 2}}
 * (no sized dimensions, initializer present).
 */
public record JavaNewArray(String elementType, List<JavaExpr> dimensions, JavaArrayInit initializer, SourceLocation location) implements JavaExpr {
	public JavaNewArray {
		dimensions = List.copyOf(dimensions);
	}

	@Override
	public <R> R accept(Visitor<R> visitor) {
		return visitor.visitNewArray(this);
	}
}
