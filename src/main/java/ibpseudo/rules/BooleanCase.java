package ibpseudo.rules;

/**
 * How {@code true}/{@code false} are written in the output.
 */
public enum BooleanCase {
	UPPER,
	LOWER
}
