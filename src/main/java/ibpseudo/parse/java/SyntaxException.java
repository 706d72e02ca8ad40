package ibpseudo.parse.java;

import ibpseudo.ast.SourceLocation;

/**
 * Thrown by the parser when the token stream does not match the grammar. Caught at declaration and
 * statement granularity and turned into a diagnostic.
 */
public final class SyntaxException extends RuntimeException {
	private final SourceLocation location;

	public SyntaxException(String message, SourceLocation location) {
		super(message);
		this.location = location;
	}

	public SourceLocation location() {
		return location;
	}
}
