package ibpseudo.parse.java;

import ibpseudo.ast.SourceLocation;

/**
 * One lexeme. {@code text} is exactly what appeared in the source, quotes and escapes included.
 */
public record JavaToken(JavaTokenType type, String text, SourceLocation location) {
	public boolean is(JavaTokenType type, String text) {
		return this.type == type && this.text.equals(text);
	}

	public int endOffset() {
		return location.offset() + text.length();
	}
}
