package ibpseudo.parse.java;

public enum JavaTokenType {
	KEYWORD,
	IDENTIFIER,
	NUMBER,
	STRING,
	CHAR,
	BOOLEAN,
	OPERATOR,
	PUNCTUATION,
	COMMENT,
	EOF;

	public boolean isLiteral() {
		return this == NUMBER || this == STRING || this == CHAR || this == BOOLEAN;
	}
}
