package ibpseudo.ast.java;

import ibpseudo.ast.SourceLocation;

import java.util.List;
import java.util.Objects;

public record JavaVarDecl(List<String> modifiers, JavaTypeRef type, String name, JavaExpr initializer, SourceLocation location) implements JavaStmt {
	public JavaVarDecl {
		modifiers = List.copyOf(modifiers);
		Objects.requireNonNull(type, "type");
		Objects.requireNonNull(name, "name");
	}

	public boolean hasInitializer() {
		return initializer != null;
	}

	@Override
	public <R> R accept(Visitor<R> visitor) {
		return visitor.visitVariable(this);
	}
}
