package ibpseudo.ast.java;

import ibpseudo.ast.SourceLocation;

public record JavaUnary(String op, JavaExpr operand, boolean postfix, SourceLocation location) implements JavaExpr {
	public boolean isIncrementOrDecrement() {
		return op.equals("++") || op.equals("--");
	}

	@Override
	public <R> R accept(Visitor<R> visitor) {
		return visitor.visitUnary(this);
	}
}
