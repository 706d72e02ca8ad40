package ibpseudo;

import ibpseudo.rules.PseudocodeStyle;

import java.util.Objects;

/**
 * @param preserveComments keep source comments in the output
 * @param indentSize       indent characters per nesting level
 * @param indentChar       usually a space or a tab
 * @param style            output conventions, see {@link PseudocodeStyle}
 */
public record ConversionOptions(boolean preserveComments, int indentSize, char indentChar, PseudocodeStyle style) {
	public ConversionOptions {
		if (indentSize < 0) {
			throw new IllegalArgumentException("indentSize must not be negative: " + indentSize);
		}
		Objects.requireNonNull(style, "style");
	}

	public static ConversionOptions defaults() {
		return new ConversionOptions(true, 2, ' ', PseudocodeStyle.defaults());
	}

	public ConversionOptions withPreserveComments(boolean preserveComments) {
		return new ConversionOptions(preserveComments, indentSize, indentChar, style);
	}

	public ConversionOptions withIndent(int indentSize, char indentChar) {
		return new ConversionOptions(preserveComments, indentSize, indentChar, style);
	}

	public ConversionOptions withStyle(PseudocodeStyle style) {
		return new ConversionOptions(preserveComments, indentSize, indentChar, style);
	}
}
