package ibpseudo.ast.java;

import ibpseudo.ast.SourceLocation;

public record JavaLiteral(Kind kind, String text, SourceLocation location) implements JavaExpr {
	public enum Kind {
		NUMBER,
		STRING,
		CHAR,
		BOOLEAN,
		NULL
	}

	/** Integer literal without a floating-point marker, e.g. {@code 10} or {@code 0x1F} but not {@code 1.5}. */
	public boolean isIntegral() {
		if (kind != Kind.NUMBER) {
			return false;
		}
		String t = text.toLowerCase(java.util.Locale.ROOT);
		if (t.startsWith("0x")) {
			return true;
		}
		return !(t.contains(".") || t.contains("e") || t.endsWith("f") || t.endsWith("d"));
	}

	@Override
	public <R> R accept(Visitor<R> visitor) {
		return visitor.visitLiteral(this);
	}
}
