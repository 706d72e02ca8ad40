package ibpseudo.ast.java;

import ibpseudo.ast.SourceLocation;

import java.util.List;
import java.util.Objects;

public record JavaMethodDecl(List<String> modifiers, JavaTypeRef returnType, String name, List<JavaParam> params, JavaBlock body, SourceLocation location) implements JavaStmt {
	public JavaMethodDecl {
		modifiers = List.copyOf(modifiers);
		params = List.copyOf(params);
		Objects.requireNonNull(name, "name");
		Objects.requireNonNull(body, "body");
	}

	/** Constructors have no return type. */
	public boolean isConstructor() {
		return returnType == null;
	}

	public boolean isVoid() {
		return returnType == null || returnType.isVoid();
	}

	public boolean isStatic() {
		return modifiers.contains("static");
	}

	/** {@code public static void main(String[] args)}, give or take the parameter name. */
	public boolean isMain() {
		return name.equals("main") && isStatic() && isVoid() && !isConstructor() && params.size() == 1
				&& params.get(0).type().simpleName().equals("String") && params.get(0).type().dimensions() == 1;
	}

	@Override
	public <R> R accept(Visitor<R> visitor) {
		return visitor.visitMethod(this);
	}
}
