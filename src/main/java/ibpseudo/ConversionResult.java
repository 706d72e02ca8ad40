package ibpseudo;

import ibpseudo.diag.Diagnostic;

import java.util.List;

/**
 * Outcome of one conversion. {@code pseudocode} is never null: a failed conversion carries the
 * partial output, or a one-line placeholder when nothing could be generated.
 *
 * @param errors   diagnostics of severity ERROR
 * @param warnings diagnostics of severity WARNING and INFO
 */
public record ConversionResult(String pseudocode, boolean success, List<Diagnostic> errors, List<Diagnostic> warnings,
		ConversionMetadata metadata) {
	public ConversionResult {
		errors = List.copyOf(errors);
		warnings = List.copyOf(warnings);
	}
}
