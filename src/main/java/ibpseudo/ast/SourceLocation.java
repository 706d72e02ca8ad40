package ibpseudo.ast;

/**
 * Source position for diagnostics.
 *
 * Line and column are 1-based; offset is the 0-based character index into the original source text.
 */
public record SourceLocation(int line, int column, int offset) {
	public static final SourceLocation START = new SourceLocation(1, 1, 0);

	@Override
	public String toString() {
		return line + ":" + column;
	}
}
