package ibpseudo.ast.java;

import ibpseudo.ast.SourceLocation;

import java.util.Objects;

public record JavaIf(JavaExpr condition, JavaStmt thenBranch, JavaStmt elseBranch, SourceLocation location) implements JavaStmt {
	public JavaIf {
		Objects.requireNonNull(condition, "condition");
		Objects.requireNonNull(thenBranch, "thenBranch");
	}

	public boolean hasElse() {
		return elseBranch != null;
	}

	@Override
	public <R> R accept(Visitor<R> visitor) {
		return visitor.visitIf(this);
	}
}
