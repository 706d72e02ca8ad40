package ibpseudo.ast.java;

import ibpseudo.ast.SourceLocation;

import java.util.List;

/**
 * {@code target} is {@code null} for an unqualified call such as {@code add(1, 2)}.
 */
public record JavaMethodCall(JavaExpr target, String name, List<JavaExpr> args, SourceLocation location) implements JavaExpr {
	public JavaMethodCall {
		args = List.copyOf(args);
	}

	public boolean hasTarget() {
		return target != null;
	}

	@Override
	public <R> R accept(Visitor<R> visitor) {
		return visitor.visitMethodCall(this);
	}
}
