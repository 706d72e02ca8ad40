package ibpseudo.transform;

import ibpseudo.ast.java.JavaTypeRef;

/**
 * A declared variable, field or parameter with its pseudocode name computed once at the
 * declaration. {@code type} is null only for names that were never declared in the source.
 */
public record VariableInfo(String originalName, String pseudocodeName, JavaTypeRef type, Scope.Kind declaredIn) {
	public boolean isReal() {
		return type != null && type.isReal();
	}

	/** An array whose elements are floating point, e.g. {@code double[]}. */
	public boolean hasRealElements() {
		return type != null && type.isArray()
				&& new JavaTypeRef(type.name(), 0, type.location()).isReal();
	}
}
