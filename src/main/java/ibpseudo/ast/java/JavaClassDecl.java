package ibpseudo.ast.java;

import ibpseudo.ast.SourceLocation;

import java.util.List;

public record JavaClassDecl(List<String> modifiers, String name, String superClass, List<JavaStmt> members, SourceLocation location) implements JavaStmt {
	public JavaClassDecl {
		modifiers = List.copyOf(modifiers);
		members = List.copyOf(members);
	}

	public boolean hasSuperClass() {
		return superClass != null;
	}

	@Override
	public <R> R accept(Visitor<R> visitor) {
		return visitor.visitClass(this);
	}
}
