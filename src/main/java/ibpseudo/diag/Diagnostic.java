package ibpseudo.diag;

import ibpseudo.ast.SourceLocation;

import java.util.Locale;

/**
 * A located message produced by one of the pipeline stages.
 */
public record Diagnostic(DiagnosticKind kind, String message, int line, int column, Severity severity) {
	public static Diagnostic error(DiagnosticKind kind, String message, SourceLocation at) {
		return new Diagnostic(kind, message, at.line(), at.column(), Severity.ERROR);
	}

	public static Diagnostic warning(DiagnosticKind kind, String message, SourceLocation at) {
		return new Diagnostic(kind, message, at.line(), at.column(), Severity.WARNING);
	}

	public static Diagnostic info(DiagnosticKind kind, String message, SourceLocation at) {
		return new Diagnostic(kind, message, at.line(), at.column(), Severity.INFO);
	}

	public boolean isError() {
		return severity == Severity.ERROR;
	}

	/**
	 * Renders as {@code line:column: severity kind: message}, e.g.
	 * {@code 3:14: error syntax: Expected ';' after expression}.
	 */
	public String format() {
		return line + ":" + column + ": "
				+ severity.name().toLowerCase(Locale.ROOT) + " "
				+ kind.name().toLowerCase(Locale.ROOT) + ": "
				+ message;
	}
}
