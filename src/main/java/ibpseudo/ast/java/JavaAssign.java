package ibpseudo.ast.java;

import ibpseudo.ast.SourceLocation;

public record JavaAssign(JavaExpr target, String op, JavaExpr value, SourceLocation location) implements JavaExpr {
	/** {@code =} or one of the compound forms {@code += -= *= /= %=}. */
	public boolean isCompound() {
		return !op.equals("=");
	}

	/** The arithmetic operator a compound assignment applies, e.g. {@code +} for {@code +=}. */
	public String baseOperator() {
		return op.substring(0, op.length() - 1);
	}

	@Override
	public <R> R accept(Visitor<R> visitor) {
		return visitor.visitAssign(this);
	}
}
