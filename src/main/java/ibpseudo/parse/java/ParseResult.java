package ibpseudo.parse.java;

import ibpseudo.ast.java.JavaProgram;
import ibpseudo.diag.Diagnostic;

import java.util.List;
import java.util.Optional;

/**
 * The program is empty only when parsing failed outright; syntax errors that were recovered from
 * still produce a (partial) program.
 */
public record ParseResult(Optional<JavaProgram> program, List<Diagnostic> diagnostics) {
	public ParseResult {
		diagnostics = List.copyOf(diagnostics);
	}
}
