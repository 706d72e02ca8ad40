package ibpseudo.ast.java;

import ibpseudo.ast.SourceLocation;

import java.util.List;

/**
 * Root of a parse. Top-level declarations may be classes, methods, fields or bare statements, so
 * that snippets convert as well as whole compilation units.
 */
public record JavaProgram(List<JavaStmt> declarations, SourceLocation location) implements JavaNode {
	public JavaProgram {
		declarations = List.copyOf(declarations);
	}
}
