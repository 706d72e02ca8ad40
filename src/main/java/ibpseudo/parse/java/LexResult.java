package ibpseudo.parse.java;

import ibpseudo.diag.Diagnostic;

import java.util.List;

public record LexResult(List<JavaToken> tokens, List<Diagnostic> diagnostics) {
}
