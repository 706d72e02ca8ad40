package ibpseudo.diag;

public enum Severity {
	ERROR,
	WARNING,
	INFO
}
