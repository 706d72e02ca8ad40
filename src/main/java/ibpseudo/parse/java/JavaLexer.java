package ibpseudo.parse.java;

import ibpseudo.ast.SourceLocation;
import ibpseudo.diag.Diagnostic;
import ibpseudo.diag.DiagnosticKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Lexer for the Java subset the converter understands.
 *
 * Notes:
 * - Whitespace is consumed, never emitted.
 * - Comments are emitted as {@link JavaTokenType#COMMENT} tokens so the parser can keep the ones
 * that sit between statements.
 * - A bad character or an unterminated literal is reported and skipped over; lexing always
 * reaches the end of the input and finishes with a single EOF token.
 * - Does NOT implement Java text blocks ("""..."""), unicode escapes or char/string templates.
 */
public final class JavaLexer {
	static final Set<String> KEYWORDS = Set.of(
			"abstract", "assert", "boolean", "break", "byte", "case", "catch", "char",
			"class", "const", "continue", "default", "do", "double", "else", "enum",
			"extends", "final", "finally", "float", "for", "goto", "if", "implements",
			"import", "instanceof", "int", "interface", "long", "native", "new", "null",
			"package", "private", "protected", "public", "return", "short", "static",
			"strictfp", "super", "switch", "synchronized", "this", "throw", "throws",
			"transient", "try", "void", "volatile", "while", "var");

	// longest first: the first match wins
	private static final List<String> OPERATORS = List.of(
			">>>=",
			"<<=", ">>=", ">>>",
			"==", "!=", "<=", ">=", "&&", "||", "++", "--", "+=", "-=", "*=", "/=", "%=",
			"&=", "|=", "^=", "<<", ">>", "->", "::",
			"=", "+", "-", "*", "/", "%", "<", ">", "!", "&", "|", "^", "~", "?", ":");

	private static final String PUNCTUATION = "(){}[];,.@";

	public LexResult lex(String input) {
		Source src = new Source(input);
		List<JavaToken> tokens = new ArrayList<>();
		List<Diagnostic> diagnostics = new ArrayList<>();

		while (!src.isAtEnd()) {
			char c = src.peek();

			// whitespace
			if (Character.isWhitespace(c)) {
				src.advance();
				continue;
			}

			SourceLocation start = src.location();

			// comments (must be checked before operators)
			if (c == '/' && src.peek(1) == '/') {
				while (!src.isAtEnd() && src.peek() != '\n' && src.peek() != '\r') {
					src.advance();
				}
				tokens.add(src.token(JavaTokenType.COMMENT, start));
				continue;
			}
			if (c == '/' && src.peek(1) == '*') {
				src.advance();
				src.advance();
				boolean closed = false;
				while (!src.isAtEnd()) {
					if (src.peek() == '*' && src.peek(1) == '/') {
						src.advance();
						src.advance();
						closed = true;
						break;
					}
					src.advance();
				}
				if (!closed) {
					diagnostics.add(Diagnostic.warning(DiagnosticKind.LEXICAL,
							"Unterminated block comment. Missing closing '*/' before end of file.", start));
				}
				tokens.add(src.token(JavaTokenType.COMMENT, start));
				continue;
			}

			// string literal
			if (c == '"') {
				src.advance();
				if (!consumeQuoted(src, '"')) {
					diagnostics.add(Diagnostic.error(DiagnosticKind.LEXICAL,
							"Unterminated string literal. Missing closing quote (\") before end of line.", start));
				}
				tokens.add(src.token(JavaTokenType.STRING, start));
				continue;
			}

			// char literal
			if (c == '\'') {
				src.advance();
				if (!consumeChar(src)) {
					diagnostics.add(Diagnostic.error(DiagnosticKind.LEXICAL,
							"Unterminated character literal. Missing closing single quote (') or invalid character sequence.",
							start));
				}
				tokens.add(src.token(JavaTokenType.CHAR, start));
				continue;
			}

			// number
			if (Character.isDigit(c)) {
				consumeNumber(src);
				tokens.add(src.token(JavaTokenType.NUMBER, start));
				continue;
			}

			// identifier, keyword or boolean literal
			if (Character.isLetter(c) || c == '_' || c == '$') {
				while (!src.isAtEnd() && isIdentifierPart(src.peek())) {
					src.advance();
				}
				String word = src.textFrom(start);
				JavaTokenType type;
				if (word.equals("true") || word.equals("false")) {
					type = JavaTokenType.BOOLEAN;
				} else if (KEYWORDS.contains(word)) {
					type = JavaTokenType.KEYWORD;
				} else {
					type = JavaTokenType.IDENTIFIER;
				}
				tokens.add(new JavaToken(type, word, start));
				continue;
			}

			// operators, greedily
			String op = matchOperator(src);
			if (op != null) {
				for (int k = 0; k < op.length(); k++) {
					src.advance();
				}
				tokens.add(new JavaToken(JavaTokenType.OPERATOR, op, start));
				continue;
			}

			if (PUNCTUATION.indexOf(c) >= 0) {
				src.advance();
				tokens.add(new JavaToken(JavaTokenType.PUNCTUATION, String.valueOf(c), start));
				continue;
			}

			diagnostics.add(Diagnostic.error(DiagnosticKind.LEXICAL,
					"Unexpected character '" + c + "' (Unicode: " + (int) c + "). Only valid Java characters are allowed.",
					start));
			src.advance();
		}

		tokens.add(new JavaToken(JavaTokenType.EOF, "", src.location()));
		return new LexResult(List.copyOf(tokens), List.copyOf(diagnostics));
	}

	private static boolean isIdentifierPart(char c) {
		return Character.isLetterOrDigit(c) || c == '_' || c == '$';
	}

	private static String matchOperator(Source src) {
		for (String op : OPERATORS) {
			if (src.startsWith(op)) {
				return op;
			}
		}
		return null;
	}

	/**
	 * Consumes up to and including the closing quote. Stops without consuming a line break.
	 *
	 * @return false when the literal is unterminated
	 */
	private static boolean consumeQuoted(Source src, char quote) {
		while (!src.isAtEnd()) {
			char c = src.peek();
			if (c == '\n' || c == '\r') {
				return false;
			}
			if (c == '\\') {
				// escaped character is taken verbatim
				src.advance();
				if (!src.isAtEnd() && src.peek() != '\n' && src.peek() != '\r') {
					src.advance();
				}
				continue;
			}
			src.advance();
			if (c == quote) {
				return true;
			}
		}
		return false;
	}

	private static boolean consumeChar(Source src) {
		if (!src.isAtEnd() && src.peek() == '\\') {
			src.advance();
			if (!src.isAtEnd() && src.peek() != '\n' && src.peek() != '\r') {
				src.advance();
			}
		} else if (!src.isAtEnd() && src.peek() != '\'' && src.peek() != '\n' && src.peek() != '\r') {
			src.advance();
		}
		if (!src.isAtEnd() && src.peek() == '\'') {
			src.advance();
			return true;
		}
		return false;
	}

	private static void consumeNumber(Source src) {
		if (src.peek() == '0' && (src.peek(1) == 'x' || src.peek(1) == 'X')) {
			src.advance();
			src.advance();
			while (!src.isAtEnd() && (Character.digit(src.peek(), 16) >= 0 || src.peek() == '_')) {
				src.advance();
			}
			if (src.peek() == 'l' || src.peek() == 'L') {
				src.advance();
			}
			return;
		}

		consumeDigits(src);
		if (src.peek() == '.' && Character.isDigit(src.peek(1))) {
			src.advance();
			consumeDigits(src);
		}
		if (src.peek() == 'e' || src.peek() == 'E') {
			int sign = (src.peek(1) == '+' || src.peek(1) == '-') ? 1 : 0;
			if (Character.isDigit(src.peek(1 + sign))) {
				src.advance();
				if (sign == 1) {
					src.advance();
				}
				consumeDigits(src);
			}
		}
		if ("fFdDlL".indexOf(src.peek()) >= 0) {
			src.advance();
		}
	}

	private static void consumeDigits(Source src) {
		while (!src.isAtEnd() && (Character.isDigit(src.peek()) || src.peek() == '_')) {
			src.advance();
		}
	}

	/**
	 * Character cursor that keeps line and column in step with every advance.
	 */
	private static final class Source {
		private final String input;
		private int pos;
		private int line = 1;
		private int column = 1;

		Source(String input) {
			this.input = input;
		}

		boolean isAtEnd() {
			return pos >= input.length();
		}

		char peek() {
			return peek(0);
		}

		char peek(int ahead) {
			int i = pos + ahead;
			return i < input.length() ? input.charAt(i) : '\0';
		}

		boolean startsWith(String text) {
			return input.startsWith(text, pos);
		}

		void advance() {
			char c = input.charAt(pos++);
			if (c == '\n') {
				line++;
				column = 1;
			} else {
				column++;
			}
		}

		SourceLocation location() {
			return new SourceLocation(line, column, pos);
		}

		String textFrom(SourceLocation start) {
			return input.substring(start.offset(), pos);
		}

		JavaToken token(JavaTokenType type, SourceLocation start) {
			return new JavaToken(type, textFrom(start), start);
		}
	}
}
