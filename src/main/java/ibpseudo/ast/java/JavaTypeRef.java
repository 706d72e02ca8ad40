package ibpseudo.ast.java;

import ibpseudo.ast.SourceLocation;

import java.util.Set;

/**
 * A (possibly dotted) type name with array dimensions, e.g. {@code int[][]} or {@code java.util.Scanner}.
 */
public record JavaTypeRef(String name, int dimensions, SourceLocation location) implements JavaNode {
	private static final Set<String> REAL_TYPES = Set.of("double", "float", "Double", "Float");

	public boolean isVoid() {
		return dimensions == 0 && name.equals("void");
	}

	public boolean isArray() {
		return dimensions > 0;
	}

	/** A scalar floating-point type. */
	public boolean isReal() {
		return dimensions == 0 && REAL_TYPES.contains(name);
	}

	/** Last segment of a dotted name: {@code java.util.Scanner} is {@code Scanner}. */
	public String simpleName() {
		int dot = name.lastIndexOf('.');
		return dot < 0 ? name : name.substring(dot + 1);
	}

	@Override
	public String toString() {
		return name + "[]".repeat(dimensions);
	}
}
