package ibpseudo.ast.java;

import ibpseudo.ast.SourceLocation;

import java.util.List;

public record JavaBlock(List<JavaStmt> stmts, SourceLocation location) implements JavaStmt {
	public JavaBlock {
		stmts = List.copyOf(stmts);
	}

	@Override
	public <R> R accept(Visitor<R> visitor) {
		return visitor.visitBlock(this);
	}
}
