package ibpseudo.transform;

import ibpseudo.ast.SourceLocation;

/**
 * A transformation rule could not be applied to a structurally valid node. The transformer turns
 * it into a diagnostic and carries on with the node's siblings.
 */
public final class ConversionException extends RuntimeException {
	private final SourceLocation location;

	public ConversionException(String message, SourceLocation location) {
		super(message);
		this.location = location;
	}

	public SourceLocation location() {
		return location;
	}
}
