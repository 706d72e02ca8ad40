package ibpseudo.ast.java;

import ibpseudo.ast.SourceLocation;

import java.util.List;

/**
 * One {@code case} label and the statements up to the next label. A {@code null} label is {@code default}.
 */
public record JavaSwitchCase(JavaExpr label, List<JavaStmt> body, SourceLocation location) implements JavaNode {
	public JavaSwitchCase {
		body = List.copyOf(body);
	}

	public boolean isDefault() {
		return label == null;
	}
}
