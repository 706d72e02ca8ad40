package ibpseudo.ast.pseudo;

public enum PseudocodeNodeKind {
	STATEMENT,
	BLOCK,
	EXPRESSION,
	COMMENT
}
