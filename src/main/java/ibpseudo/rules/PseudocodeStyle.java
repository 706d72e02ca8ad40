package ibpseudo.rules;

import java.util.Objects;

/**
 * Output conventions that differ between IB course materials.
 *
 * @param booleanCase     {@code TRUE} or {@code true}
 * @param notEqualsSymbol {@code ≠} or the ASCII {@code <>}
 * @param flatElseIf      write {@code else if C then} chains under one {@code end if} instead of
 *                        nesting each {@code if} inside the previous {@code else}
 */
public record PseudocodeStyle(BooleanCase booleanCase, String notEqualsSymbol, boolean flatElseIf) {
	public static final String NOT_EQUALS = "≠";
	public static final String ASCII_NOT_EQUALS = "<>";

	public PseudocodeStyle {
		Objects.requireNonNull(booleanCase, "booleanCase");
		Objects.requireNonNull(notEqualsSymbol, "notEqualsSymbol");
	}

	public static PseudocodeStyle defaults() {
		return new PseudocodeStyle(BooleanCase.UPPER, NOT_EQUALS, false);
	}

	public PseudocodeStyle withBooleanCase(BooleanCase booleanCase) {
		return new PseudocodeStyle(booleanCase, notEqualsSymbol, flatElseIf);
	}

	public PseudocodeStyle withAsciiNotEquals() {
		return new PseudocodeStyle(booleanCase, ASCII_NOT_EQUALS, flatElseIf);
	}

	public PseudocodeStyle withFlatElseIf(boolean flatElseIf) {
		return new PseudocodeStyle(booleanCase, notEqualsSymbol, flatElseIf);
	}
}
