package ibpseudo.diag;

public enum DiagnosticKind {
	LEXICAL,
	SYNTAX,
	/** Reserved; nothing in the pipeline reports semantic problems yet. */
	SEMANTIC,
	CONVERSION
}
