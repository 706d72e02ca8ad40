package ibpseudo.ast.java;

import ibpseudo.ast.SourceLocation;

import java.util.List;
import java.util.Objects;

public record JavaFor(List<JavaStmt> init, JavaExpr condition, List<JavaExpr> update, JavaStmt body, SourceLocation location) implements JavaStmt {
	/**
	 * All three clauses are optional: {@code init} and {@code update} may be empty and
	 * {@code condition} may be {@code null}.
	 */
	public JavaFor {
		init = List.copyOf(init);
		update = List.copyOf(update);
		Objects.requireNonNull(body, "body");
	}

	@Override
	public <R> R accept(Visitor<R> visitor) {
		return visitor.visitFor(this);
	}
}
