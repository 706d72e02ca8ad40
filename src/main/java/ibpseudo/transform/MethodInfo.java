package ibpseudo.transform;

import ibpseudo.ast.java.JavaTypeRef;

import java.util.List;

public record MethodInfo(String originalName, String pseudocodeName, JavaTypeRef returnType, List<String> parameters,
		boolean isVoid, boolean isStatic) {
	public MethodInfo {
		parameters = List.copyOf(parameters);
	}

	public boolean returnsReal() {
		return returnType != null && returnType.isReal();
	}
}
