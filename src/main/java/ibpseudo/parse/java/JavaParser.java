package ibpseudo.parse.java;

import ibpseudo.ast.SourceLocation;
import ibpseudo.ast.java.JavaArrayAccess;
import ibpseudo.ast.java.JavaArrayInit;
import ibpseudo.ast.java.JavaAssign;
import ibpseudo.ast.java.JavaBinary;
import ibpseudo.ast.java.JavaBlock;
import ibpseudo.ast.java.JavaBreak;
import ibpseudo.ast.java.JavaCast;
import ibpseudo.ast.java.JavaClassDecl;
import ibpseudo.ast.java.JavaComment;
import ibpseudo.ast.java.JavaContinue;
import ibpseudo.ast.java.JavaDoWhile;
import ibpseudo.ast.java.JavaExpr;
import ibpseudo.ast.java.JavaExprStmt;
import ibpseudo.ast.java.JavaFieldAccess;
import ibpseudo.ast.java.JavaFor;
import ibpseudo.ast.java.JavaForEach;
import ibpseudo.ast.java.JavaIf;
import ibpseudo.ast.java.JavaLiteral;
import ibpseudo.ast.java.JavaMethodCall;
import ibpseudo.ast.java.JavaMethodDecl;
import ibpseudo.ast.java.JavaName;
import ibpseudo.ast.java.JavaNewArray;
import ibpseudo.ast.java.JavaNewObject;
import ibpseudo.ast.java.JavaParam;
import ibpseudo.ast.java.JavaParens;
import ibpseudo.ast.java.JavaProgram;
import ibpseudo.ast.java.JavaReturn;
import ibpseudo.ast.java.JavaStmt;
import ibpseudo.ast.java.JavaSwitch;
import ibpseudo.ast.java.JavaSwitchCase;
import ibpseudo.ast.java.JavaTypeRef;
import ibpseudo.ast.java.JavaUnary;
import ibpseudo.ast.java.JavaVarDecl;
import ibpseudo.ast.java.JavaWhile;
import ibpseudo.diag.Diagnostic;
import ibpseudo.diag.DiagnosticKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Recursive-descent parser for the Java subset the converter understands.
 *
 * Expressions use precedence climbing; every binary level is left-associative and assignment is
 * right-associative. A syntax error inside a declaration or statement is recorded and the parser
 * resynchronises at the next statement boundary, so one mistake does not hide the rest of the file.
 */
public final class JavaParser {
	private static final Logger LOG = LoggerFactory.getLogger(JavaParser.class);

	static final int MAX_NESTING = 64;

	private static final Set<String> MODIFIERS = Set.of(
			"public", "private", "protected", "static", "final", "abstract",
			"synchronized", "transient", "volatile", "native", "strictfp");

	private static final Set<String> PRIMITIVES = Set.of(
			"int", "long", "short", "byte", "char", "boolean", "double", "float", "void", "var");

	private static final Set<String> RESYNC_KEYWORDS = Set.of(
			"class", "public", "private", "static", "if", "while", "for", "return");

	private static final Set<String> ASSIGNMENT_OPS = Set.of(
			"=", "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "<<=", ">>=", ">>>=");

	// lowest to highest, between assignment and unary
	private static final List<Set<String>> BINARY_LEVELS = List.of(
			Set.of("||"),
			Set.of("&&"),
			Set.of("|"),
			Set.of("^"),
			Set.of("&"),
			Set.of("==", "!="),
			Set.of("<", ">", "<=", ">="),
			Set.of("<<", ">>", ">>>"),
			Set.of("+", "-"),
			Set.of("*", "/", "%"));

	private final List<Diagnostic> diagnostics = new ArrayList<>();
	private int depth;

	public ParseResult parse(List<JavaToken> tokens) {
		diagnostics.clear();
		depth = 0;
		Cursor c = new Cursor(tokens);
		try {
			List<JavaStmt> declarations = new ArrayList<>();
			while (true) {
				addComments(c, declarations);
				if (c.isAtEnd()) {
					break;
				}
				if (c.peekIsKeyword("package") || c.peekIsKeyword("import")) {
					skipPastSemicolon(c);
					continue;
				}
				int start = c.mark();
				try {
					declarations.addAll(parseMember(c, null));
				} catch (SyntaxException e) {
					report(e);
					recover(c, start);
				}
			}
			return new ParseResult(Optional.of(new JavaProgram(declarations, SourceLocation.START)), diagnostics);
		} catch (RuntimeException | StackOverflowError e) {
			LOG.warn("Parser failed unexpectedly", e);
			String reason = e instanceof StackOverflowError ? "input is nested too deeply" : e.getMessage();
			diagnostics.add(Diagnostic.error(DiagnosticKind.SYNTAX,
					"Unable to parse input: " + reason, c.peek().location()));
			return new ParseResult(Optional.empty(), diagnostics);
		}
	}

	private void report(SyntaxException e) {
		diagnostics.add(Diagnostic.error(DiagnosticKind.SYNTAX, e.getMessage(), e.location()));
	}

	/**
	 * Panic mode: consume at least one token, then skip up to and including the next ';', or up to
	 * a token that starts a new declaration or closes the enclosing block.
	 */
	private static void recover(Cursor c, int start) {
		if (c.mark() == start && !c.isAtEnd()) {
			if (c.next().is(JavaTokenType.PUNCTUATION, ";")) {
				return;
			}
		}
		while (!c.isAtEnd()) {
			JavaToken t = c.peek();
			if (t.is(JavaTokenType.PUNCTUATION, ";")) {
				c.next();
				return;
			}
			if (t.is(JavaTokenType.PUNCTUATION, "}")
					|| (t.type() == JavaTokenType.KEYWORD && RESYNC_KEYWORDS.contains(t.text()))) {
				return;
			}
			c.next();
		}
	}

	private static void skipPastSemicolon(Cursor c) {
		while (!c.isAtEnd()) {
			if (c.next().is(JavaTokenType.PUNCTUATION, ";")) {
				return;
			}
		}
	}

	private static void addComments(Cursor c, List<? super JavaComment> out) {
		for (JavaToken t : c.takeComments()) {
			out.add(new JavaComment(t.text(), t.location()));
		}
	}

	private void enter(JavaToken at) {
		if (++depth > MAX_NESTING) {
			throw new SyntaxException("Nesting is too deep (more than " + MAX_NESTING + " levels)", at.location());
		}
	}

	private void exit() {
		depth--;
	}

	// ---- declarations ----

	/**
	 * A class, method, constructor, field or (outside a class body) a plain statement. Several
	 * declarators in one declaration come back as several nodes.
	 */
	private List<JavaStmt> parseMember(Cursor c, String className) {
		JavaToken start = c.peek();
		List<String> modifiers = parseModifiers(c);

		if (c.peekIsKeyword("class")) {
			return List.of(parseClass(c, modifiers, start));
		}
		if (className != null && c.peek().is(JavaTokenType.IDENTIFIER, className) && c.peek(1).is(JavaTokenType.PUNCTUATION, "(")) {
			JavaToken name = c.next();
			return List.of(parseMethodRest(c, modifiers, null, name, start));
		}
		if (looksLikeDeclaration(c)) {
			JavaTypeRef type = tryParseType(c);
			JavaToken name = c.expect(JavaTokenType.IDENTIFIER, "name");
			if (c.peekIsPunct("(")) {
				return List.of(parseMethodRest(c, modifiers, type, name, start));
			}
			List<JavaStmt> vars = parseDeclaratorsRest(c, modifiers, type, name, start);
			c.expectPunct(";", "after variable declaration");
			return vars;
		}
		if (!modifiers.isEmpty()) {
			if (c.peekIsPunct("{")) {
				// static initializer
				return List.of(parseBlock(c));
			}
			throw unexpected(c.peek(), "a declaration after modifiers");
		}
		if (className != null && c.peekIsPunct(";")) {
			c.next();
			return List.of();
		}
		return parseBlockStatement(c);
	}

	private static List<String> parseModifiers(Cursor c) {
		List<String> modifiers = new ArrayList<>();
		while (true) {
			JavaToken t = c.peek();
			if (t.type() == JavaTokenType.KEYWORD && MODIFIERS.contains(t.text())) {
				modifiers.add(c.next().text());
				continue;
			}
			if (t.is(JavaTokenType.PUNCTUATION, "@") && c.peek(1).type() == JavaTokenType.IDENTIFIER) {
				skipAnnotation(c);
				continue;
			}
			return modifiers;
		}
	}

	private static void skipAnnotation(Cursor c) {
		c.next(); // @
		c.next();
		while (c.peekIsPunct(".") && c.peek(1).type() == JavaTokenType.IDENTIFIER) {
			c.next();
			c.next();
		}
		if (c.peekIsPunct("(")) {
			int parens = 0;
			do {
				JavaToken t = c.next();
				if (t.is(JavaTokenType.PUNCTUATION, "(")) {
					parens++;
				} else if (t.is(JavaTokenType.PUNCTUATION, ")")) {
					parens--;
				}
			} while (parens > 0 && !c.isAtEnd());
		}
	}

	private JavaClassDecl parseClass(Cursor c, List<String> modifiers, JavaToken start) {
		c.expectKeyword("class");
		JavaToken name = c.expect(JavaTokenType.IDENTIFIER, "class name");
		String superClass = null;
		if (c.peekIsKeyword("extends")) {
			c.next();
			superClass = requireType(c).toString();
		}
		if (c.peekIsKeyword("implements")) {
			c.next();
			requireType(c);
			while (c.peekIsPunct(",")) {
				c.next();
				requireType(c);
			}
		}
		c.expectPunct("{", "to open class body");

		List<JavaStmt> members = new ArrayList<>();
		enter(name);
		try {
			while (true) {
				addComments(c, members);
				if (c.isAtEnd() || c.peekIsPunct("}")) {
					break;
				}
				int memberStart = c.mark();
				try {
					members.addAll(parseMember(c, name.text()));
				} catch (SyntaxException e) {
					report(e);
					recover(c, memberStart);
				}
			}
		} finally {
			exit();
		}
		c.expectPunct("}", "to close class " + name.text());
		return new JavaClassDecl(modifiers, name.text(), superClass, members, start.location());
	}

	private JavaMethodDecl parseMethodRest(Cursor c, List<String> modifiers, JavaTypeRef returnType, JavaToken name,
			JavaToken start) {
		c.expectPunct("(", "after method name");
		List<JavaParam> params = new ArrayList<>();
		if (!c.peekIsPunct(")")) {
			while (true) {
				params.add(parseParam(c));
				if (c.peekIsPunct(",")) {
					c.next();
					continue;
				}
				break;
			}
		}
		c.expectPunct(")", "to close parameter list");
		if (c.peekIsKeyword("throws")) {
			c.next();
			requireType(c);
			while (c.peekIsPunct(",")) {
				c.next();
				requireType(c);
			}
		}

		JavaBlock body;
		if (c.peekIsPunct(";")) {
			// abstract or native: no body
			JavaToken semi = c.next();
			body = new JavaBlock(List.of(), semi.location());
		} else {
			body = parseBlock(c);
		}
		return new JavaMethodDecl(modifiers, returnType, name.text(), params, body, start.location());
	}

	private JavaParam parseParam(Cursor c) {
		parseModifiers(c);
		JavaTypeRef type = requireType(c);
		if (c.peekIsPunct(".") && c.peek(1).is(JavaTokenType.PUNCTUATION, ".") && c.peek(2).is(JavaTokenType.PUNCTUATION, ".")) {
			// varargs
			c.next();
			c.next();
			c.next();
			type = new JavaTypeRef(type.name(), type.dimensions() + 1, type.location());
		}
		JavaToken name = c.expect(JavaTokenType.IDENTIFIER, "parameter name");
		int extra = parseDims(c);
		if (extra > 0) {
			type = new JavaTypeRef(type.name(), type.dimensions() + extra, type.location());
		}
		return new JavaParam(type, name.text(), type.location());
	}

	/** Continues after {@code Type name}, up to but not including the terminating ';'. */
	private List<JavaStmt> parseDeclaratorsRest(Cursor c, List<String> modifiers, JavaTypeRef type, JavaToken name,
			JavaToken start) {
		List<JavaStmt> vars = new ArrayList<>();
		SourceLocation at = start.location();
		while (true) {
			int extra = parseDims(c);
			JavaTypeRef varType = extra == 0 ? type : new JavaTypeRef(type.name(), type.dimensions() + extra, type.location());
			JavaExpr init = null;
			if (c.peekIsOperator("=")) {
				c.next();
				init = c.peekIsPunct("{") ? parseArrayInit(c) : parseExpression(c);
			}
			vars.add(new JavaVarDecl(modifiers, varType, name.text(), init, at));
			if (!c.peekIsPunct(",")) {
				return vars;
			}
			c.next();
			name = c.expect(JavaTokenType.IDENTIFIER, "variable name");
			at = name.location();
		}
	}

	private static int parseDims(Cursor c) {
		int dims = 0;
		while (c.peekIsPunct("[") && c.peek(1).is(JavaTokenType.PUNCTUATION, "]")) {
			c.next();
			c.next();
			dims++;
		}
		return dims;
	}

	// ---- types ----

	/**
	 * Speculatively checks for {@code Type name} followed by one of {@code ( = ; , [ :}. The cursor
	 * is left where it was.
	 */
	private static boolean looksLikeDeclaration(Cursor c) {
		int mark = c.mark();
		try {
			JavaTypeRef type = tryParseType(c);
			if (type == null || c.peek().type() != JavaTokenType.IDENTIFIER) {
				return false;
			}
			JavaToken after = c.peek(1);
			return after.is(JavaTokenType.PUNCTUATION, "(")
					|| after.is(JavaTokenType.OPERATOR, "=")
					|| after.is(JavaTokenType.PUNCTUATION, ";")
					|| after.is(JavaTokenType.PUNCTUATION, ",")
					|| after.is(JavaTokenType.PUNCTUATION, "[")
					|| after.is(JavaTokenType.OPERATOR, ":");
		} finally {
			c.reset(mark);
		}
	}

	private static JavaTypeRef requireType(Cursor c) {
		JavaTypeRef type = tryParseType(c);
		if (type == null) {
			throw unexpected(c.peek(), "a type");
		}
		return type;
	}

	/** Returns null and leaves the cursor untouched when no type starts here. */
	private static JavaTypeRef tryParseType(Cursor c) {
		int mark = c.mark();
		JavaToken first = c.peek();
		String name;
		if (first.type() == JavaTokenType.KEYWORD && PRIMITIVES.contains(first.text())) {
			name = c.next().text();
		} else if (first.type() == JavaTokenType.IDENTIFIER) {
			StringBuilder sb = new StringBuilder(c.next().text());
			while (c.peekIsPunct(".") && c.peek(1).type() == JavaTokenType.IDENTIFIER) {
				c.next();
				sb.append('.').append(c.next().text());
			}
			if (c.peekIsOperator("<") && !skipTypeArguments(c)) {
				c.reset(mark);
				return null;
			}
			name = sb.toString();
		} else {
			return null;
		}
		return new JavaTypeRef(name, parseDims(c), first.location());
	}

	/** Skips {@code <...>}; generic arguments are not kept. */
	private static boolean skipTypeArguments(Cursor c) {
		int angle = 0;
		do {
			JavaToken t = c.next();
			switch (t.text()) {
				case "<" -> angle++;
				case ">" -> angle--;
				case ">>" -> angle -= 2;
				case ">>>" -> angle -= 3;
				default -> {
					boolean allowed = t.type() == JavaTokenType.IDENTIFIER
							|| (t.type() == JavaTokenType.KEYWORD && (PRIMITIVES.contains(t.text())
									|| t.text().equals("extends") || t.text().equals("super")))
							|| t.is(JavaTokenType.PUNCTUATION, ",")
							|| t.is(JavaTokenType.PUNCTUATION, ".")
							|| t.is(JavaTokenType.PUNCTUATION, "[")
							|| t.is(JavaTokenType.PUNCTUATION, "]")
							|| t.is(JavaTokenType.OPERATOR, "?");
					if (!allowed) {
						return false;
					}
				}
			}
		} while (angle > 0 && !c.isAtEnd());
		return angle == 0;
	}

	// ---- statements ----

	private JavaBlock parseBlock(Cursor c) {
		JavaToken open = c.expectPunct("{", "to open block");
		List<JavaStmt> stmts = new ArrayList<>();
		enter(open);
		try {
			while (true) {
				addComments(c, stmts);
				if (c.isAtEnd() || c.peekIsPunct("}")) {
					break;
				}
				int start = c.mark();
				try {
					stmts.addAll(parseBlockStatement(c));
				} catch (SyntaxException e) {
					report(e);
					recover(c, start);
				}
			}
		} finally {
			exit();
		}
		c.expectPunct("}", "to close block");
		return new JavaBlock(stmts, open.location());
	}

	/** A statement or a local variable declaration. */
	private List<JavaStmt> parseBlockStatement(Cursor c) {
		int mark = c.mark();
		JavaToken start = c.peek();
		List<String> modifiers = parseModifiers(c);
		if (looksLikeDeclaration(c)) {
			JavaTypeRef type = tryParseType(c);
			JavaToken name = c.expect(JavaTokenType.IDENTIFIER, "variable name");
			List<JavaStmt> vars = parseDeclaratorsRest(c, modifiers, type, name, start);
			c.expectPunct(";", "after variable declaration");
			return vars;
		}
		c.reset(mark);
		return List.of(parseStatement(c));
	}

	private JavaStmt parseStatement(Cursor c) {
		JavaToken t = c.peek();
		enter(t);
		try {
			if (t.is(JavaTokenType.PUNCTUATION, "{")) {
				return parseBlock(c);
			}
			if (t.is(JavaTokenType.PUNCTUATION, ";")) {
				c.next();
				return new JavaBlock(List.of(), t.location());
			}
			if (t.type() == JavaTokenType.KEYWORD) {
				switch (t.text()) {
					case "if" -> {
						return parseIf(c);
					}
					case "while" -> {
						return parseWhile(c);
					}
					case "do" -> {
						return parseDoWhile(c);
					}
					case "for" -> {
						return parseFor(c);
					}
					case "switch" -> {
						return parseSwitch(c);
					}
					case "break" -> {
						c.next();
						skipLabel(c);
						c.expectPunct(";", "after break");
						return new JavaBreak(t.location());
					}
					case "continue" -> {
						c.next();
						skipLabel(c);
						c.expectPunct(";", "after continue");
						return new JavaContinue(t.location());
					}
					case "return" -> {
						c.next();
						JavaExpr value = c.peekIsPunct(";") ? null : parseExpression(c);
						c.expectPunct(";", "after return");
						return new JavaReturn(value, t.location());
					}
					default -> {
						// expression statement
					}
				}
			}
			JavaExpr expr = parseExpression(c);
			c.expectPunct(";", "after expression");
			return new JavaExprStmt(expr, t.location());
		} finally {
			exit();
		}
	}

	private static void skipLabel(Cursor c) {
		if (c.peek().type() == JavaTokenType.IDENTIFIER) {
			c.next();
		}
	}

	private JavaIf parseIf(Cursor c) {
		JavaToken start = c.expectKeyword("if");
		JavaExpr condition = parseCondition(c, "if");
		JavaStmt thenBranch = parseStatement(c);
		JavaStmt elseBranch = null;
		if (c.peekIsKeyword("else")) {
			c.next();
			elseBranch = parseStatement(c);
		}
		return new JavaIf(condition, thenBranch, elseBranch, start.location());
	}

	private JavaWhile parseWhile(Cursor c) {
		JavaToken start = c.expectKeyword("while");
		JavaExpr condition = parseCondition(c, "while");
		return new JavaWhile(condition, parseStatement(c), start.location());
	}

	private JavaDoWhile parseDoWhile(Cursor c) {
		JavaToken start = c.expectKeyword("do");
		JavaStmt body = parseStatement(c);
		c.expectKeyword("while");
		JavaExpr condition = parseCondition(c, "while");
		c.expectPunct(";", "after do-while condition");
		return new JavaDoWhile(body, condition, start.location());
	}

	private JavaExpr parseCondition(Cursor c, String keyword) {
		c.expectPunct("(", "after '" + keyword + "'");
		JavaExpr condition = parseExpression(c);
		c.expectPunct(")", "to close '" + keyword + "' condition");
		return condition;
	}

	private JavaStmt parseFor(Cursor c) {
		JavaToken start = c.expectKeyword("for");
		c.expectPunct("(", "after 'for'");

		// enhanced for is tried first
		int mark = c.mark();
		parseModifiers(c);
		JavaTypeRef type = tryParseType(c);
		if (type != null && c.peek().type() == JavaTokenType.IDENTIFIER && c.peek(1).is(JavaTokenType.OPERATOR, ":")) {
			String variable = c.next().text();
			c.next();
			JavaExpr iterable = parseExpression(c);
			c.expectPunct(")", "to close 'for' header");
			return new JavaForEach(type, variable, iterable, parseStatement(c), start.location());
		}
		c.reset(mark);

		List<JavaStmt> init = new ArrayList<>();
		if (!c.peekIsPunct(";")) {
			JavaToken initStart = c.peek();
			List<String> modifiers = parseModifiers(c);
			if (looksLikeDeclaration(c)) {
				JavaTypeRef varType = tryParseType(c);
				JavaToken name = c.expect(JavaTokenType.IDENTIFIER, "loop variable name");
				init.addAll(parseDeclaratorsRest(c, modifiers, varType, name, initStart));
			} else {
				for (JavaExpr e : parseExpressionList(c)) {
					init.add(new JavaExprStmt(e, e.location()));
				}
			}
		}
		c.expectPunct(";", "after 'for' initializer");

		JavaExpr condition = c.peekIsPunct(";") ? null : parseExpression(c);
		c.expectPunct(";", "after 'for' condition");

		List<JavaExpr> update = c.peekIsPunct(")") ? List.of() : parseExpressionList(c);
		c.expectPunct(")", "to close 'for' header");

		return new JavaFor(init, condition, update, parseStatement(c), start.location());
	}

	private List<JavaExpr> parseExpressionList(Cursor c) {
		List<JavaExpr> exprs = new ArrayList<>();
		exprs.add(parseExpression(c));
		while (c.peekIsPunct(",")) {
			c.next();
			exprs.add(parseExpression(c));
		}
		return exprs;
	}

	private JavaSwitch parseSwitch(Cursor c) {
		JavaToken start = c.expectKeyword("switch");
		JavaExpr selector = parseCondition(c, "switch");
		c.expectPunct("{", "to open switch body");

		List<JavaSwitchCase> cases = new ArrayList<>();
		List<JavaComment> leading = new ArrayList<>();
		addComments(c, leading);
		while (!c.isAtEnd() && !c.peekIsPunct("}")) {
			JavaToken label = c.peek();
			JavaExpr value = null;
			if (c.peekIsKeyword("case")) {
				c.next();
				value = parseExpression(c);
			} else if (c.peekIsKeyword("default")) {
				c.next();
			} else {
				throw unexpected(label, "'case' or 'default'");
			}
			if (!c.peekIsOperator(":")) {
				throw unexpected(c.peek(), "':' after case label");
			}
			c.next();

			List<JavaStmt> body = new ArrayList<>(leading);
			leading.clear();
			while (true) {
				addComments(c, body);
				if (c.isAtEnd() || c.peekIsPunct("}") || c.peekIsKeyword("case") || c.peekIsKeyword("default")) {
					break;
				}
				int stmtStart = c.mark();
				try {
					body.addAll(parseBlockStatement(c));
				} catch (SyntaxException e) {
					report(e);
					recover(c, stmtStart);
				}
			}
			cases.add(new JavaSwitchCase(value, body, label.location()));
		}
		c.expectPunct("}", "to close switch body");
		return new JavaSwitch(selector, cases, start.location());
	}

	// ---- expressions ----

	JavaExpr parseExpression(Cursor c) {
		return parseAssignment(c);
	}

	private JavaExpr parseAssignment(Cursor c) {
		JavaExpr left = parseBinary(c, 0);
		JavaToken t = c.peek();
		if (t.type() == JavaTokenType.OPERATOR && ASSIGNMENT_OPS.contains(t.text())) {
			if (!(left instanceof JavaName || left instanceof JavaFieldAccess || left instanceof JavaArrayAccess)) {
				throw new SyntaxException("Invalid assignment target before '" + t.text() + "'", t.location());
			}
			c.next();
			JavaExpr value = c.peekIsPunct("{") ? parseArrayInit(c) : parseAssignment(c);
			return new JavaAssign(left, t.text(), value, left.location());
		}
		return left;
	}

	private JavaExpr parseBinary(Cursor c, int level) {
		if (level == BINARY_LEVELS.size()) {
			return parseUnary(c);
		}
		Set<String> ops = BINARY_LEVELS.get(level);
		JavaExpr left = parseBinary(c, level + 1);
		while (c.peek().type() == JavaTokenType.OPERATOR && ops.contains(c.peek().text())) {
			String op = c.next().text();
			JavaExpr right = parseBinary(c, level + 1);
			left = new JavaBinary(left, op, right, left.location());
		}
		return left;
	}

	private JavaExpr parseUnary(Cursor c) {
		JavaToken t = c.peek();
		enter(t);
		try {
			if (t.type() == JavaTokenType.OPERATOR
					&& (t.text().equals("!") || t.text().equals("-") || t.text().equals("+")
							|| t.text().equals("++") || t.text().equals("--") || t.text().equals("~"))) {
				c.next();
				return new JavaUnary(t.text(), parseUnary(c), false, t.location());
			}
			if (t.is(JavaTokenType.PUNCTUATION, "(") && isPrimitiveCast(c)) {
				c.next();
				JavaTypeRef type = requireType(c);
				c.expectPunct(")", "to close cast");
				return new JavaCast(type, parseUnary(c), t.location());
			}
			return parsePostfix(c);
		} finally {
			exit();
		}
	}

	private static boolean isPrimitiveCast(Cursor c) {
		JavaToken type = c.peek(1);
		if (type.type() != JavaTokenType.KEYWORD || !PRIMITIVES.contains(type.text())) {
			return false;
		}
		int k = 2;
		while (c.peek(k).is(JavaTokenType.PUNCTUATION, "[") && c.peek(k + 1).is(JavaTokenType.PUNCTUATION, "]")) {
			k += 2;
		}
		return c.peek(k).is(JavaTokenType.PUNCTUATION, ")");
	}

	private JavaExpr parsePostfix(Cursor c) {
		JavaExpr expr = parsePrimary(c);
		while (true) {
			JavaToken t = c.peek();
			if (t.is(JavaTokenType.PUNCTUATION, "[")) {
				c.next();
				JavaExpr index = parseExpression(c);
				c.expectPunct("]", "to close array index");
				expr = new JavaArrayAccess(expr, index, expr.location());
				continue;
			}
			if (t.is(JavaTokenType.PUNCTUATION, ".")) {
				c.next();
				JavaToken name = c.next();
				if (name.type() != JavaTokenType.IDENTIFIER && name.type() != JavaTokenType.KEYWORD) {
					throw unexpected(name, "a member name after '.'");
				}
				if (c.peekIsPunct("(")) {
					expr = new JavaMethodCall(expr, name.text(), parseArguments(c), expr.location());
				} else {
					expr = new JavaFieldAccess(expr, name.text(), expr.location());
				}
				continue;
			}
			if (t.is(JavaTokenType.PUNCTUATION, "(") && expr instanceof JavaName callee) {
				expr = new JavaMethodCall(null, callee.name(), parseArguments(c), callee.location());
				continue;
			}
			if (t.is(JavaTokenType.OPERATOR, "++") || t.is(JavaTokenType.OPERATOR, "--")) {
				c.next();
				expr = new JavaUnary(t.text(), expr, true, expr.location());
				continue;
			}
			return expr;
		}
	}

	private List<JavaExpr> parseArguments(Cursor c) {
		c.expectPunct("(", "to open argument list");
		List<JavaExpr> args = new ArrayList<>();
		if (!c.peekIsPunct(")")) {
			args.addAll(parseExpressionList(c));
		}
		c.expectPunct(")", "to close argument list");
		return args;
	}

	private JavaExpr parsePrimary(Cursor c) {
		JavaToken t = c.peek();
		return switch (t.type()) {
			case NUMBER -> literal(c, JavaLiteral.Kind.NUMBER);
			case STRING -> literal(c, JavaLiteral.Kind.STRING);
			case CHAR -> literal(c, JavaLiteral.Kind.CHAR);
			case BOOLEAN -> literal(c, JavaLiteral.Kind.BOOLEAN);
			case IDENTIFIER -> new JavaName(c.next().text(), t.location());
			case KEYWORD -> switch (t.text()) {
				case "null" -> literal(c, JavaLiteral.Kind.NULL);
				case "this", "super" -> new JavaName(c.next().text(), t.location());
				case "new" -> parseNew(c);
				default -> throw unexpected(t, "an expression");
			};
			case PUNCTUATION -> {
				if (t.text().equals("(")) {
					c.next();
					JavaExpr inner = parseExpression(c);
					c.expectPunct(")", "to close parenthesized expression");
					yield new JavaParens(inner, t.location());
				}
				if (t.text().equals("{")) {
					yield parseArrayInit(c);
				}
				throw unexpected(t, "an expression");
			}
			default -> throw unexpected(t, "an expression");
		};
	}

	private static JavaLiteral literal(Cursor c, JavaLiteral.Kind kind) {
		JavaToken t = c.next();
		return new JavaLiteral(kind, t.text(), t.location());
	}

	private JavaArrayInit parseArrayInit(Cursor c) {
		JavaToken open = c.expectPunct("{", "to open array initializer");
		enter(open);
		try {
			List<JavaExpr> elements = new ArrayList<>();
			while (!c.peekIsPunct("}")) {
				elements.add(c.peekIsPunct("{") ? parseArrayInit(c) : parseExpression(c));
				if (!c.peekIsPunct(",")) {
					break;
				}
				c.next();
			}
			c.expectPunct("}", "to close array initializer");
			return new JavaArrayInit(elements, open.location());
		} finally {
			exit();
		}
	}

	private JavaExpr parseNew(Cursor c) {
		JavaToken start = c.expectKeyword("new");
		JavaToken typeStart = c.peek();
		StringBuilder type = new StringBuilder();
		if (typeStart.type() == JavaTokenType.KEYWORD && PRIMITIVES.contains(typeStart.text())) {
			type.append(c.next().text());
		} else {
			type.append(c.expect(JavaTokenType.IDENTIFIER, "type after 'new'").text());
			while (c.peekIsPunct(".") && c.peek(1).type() == JavaTokenType.IDENTIFIER) {
				c.next();
				type.append('.').append(c.next().text());
			}
			if (c.peekIsOperator("<")) {
				// diamond or explicit type arguments
				if (c.peek(1).is(JavaTokenType.OPERATOR, ">")) {
					c.next();
					c.next();
				} else if (!skipTypeArguments(c)) {
					throw unexpected(c.peek(), "type arguments");
				}
			}
		}

		if (c.peekIsPunct("[")) {
			List<JavaExpr> dims = new ArrayList<>();
			while (c.peekIsPunct("[")) {
				c.next();
				if (c.peekIsPunct("]")) {
					c.next();
					continue;
				}
				dims.add(parseExpression(c));
				c.expectPunct("]", "to close array dimension");
			}
			JavaArrayInit init = c.peekIsPunct("{") ? parseArrayInit(c) : null;
			if (dims.isEmpty() && init == null) {
				throw unexpected(c.peek(), "an array size or initializer");
			}
			return new JavaNewArray(type.toString(), dims, init, start.location());
		}
		return new JavaNewObject(type.toString(), parseArguments(c), start.location());
	}

	private static SyntaxException unexpected(JavaToken t, String expected) {
		return new SyntaxException("Expected " + expected + " but found " + describe(t), t.location());
	}

	private static String describe(JavaToken t) {
		return t.type() == JavaTokenType.EOF ? "end of input" : "'" + t.text() + "'";
	}

	/**
	 * Index into an immutable token list. Comments are invisible to {@link #peek()} and
	 * {@link #next()}; statement loops collect them explicitly with {@link #takeComments()}.
	 */
	static final class Cursor {
		private final List<JavaToken> tokens;
		private int pos;

		Cursor(List<JavaToken> tokens) {
			if (tokens.isEmpty() || tokens.get(tokens.size() - 1).type() != JavaTokenType.EOF) {
				List<JavaToken> withEof = new ArrayList<>(tokens);
				SourceLocation end = tokens.isEmpty() ? SourceLocation.START : tokens.get(tokens.size() - 1).location();
				withEof.add(new JavaToken(JavaTokenType.EOF, "", end));
				tokens = withEof;
			}
			this.tokens = List.copyOf(tokens);
		}

		int mark() {
			return pos;
		}

		void reset(int mark) {
			pos = mark;
		}

		boolean isAtEnd() {
			return peek().type() == JavaTokenType.EOF;
		}

		JavaToken peek() {
			return peek(0);
		}

		/** The {@code ahead}-th non-comment token from here; EOF once past the end. */
		JavaToken peek(int ahead) {
			int i = pos;
			int seen = 0;
			while (i < tokens.size()) {
				JavaToken t = tokens.get(i);
				if (t.type() != JavaTokenType.COMMENT) {
					if (seen == ahead || t.type() == JavaTokenType.EOF) {
						return t;
					}
					seen++;
				}
				i++;
			}
			return tokens.get(tokens.size() - 1);
		}

		JavaToken next() {
			while (tokens.get(pos).type() == JavaTokenType.COMMENT) {
				pos++;
			}
			JavaToken t = tokens.get(pos);
			if (t.type() != JavaTokenType.EOF) {
				pos++;
			}
			return t;
		}

		List<JavaToken> takeComments() {
			List<JavaToken> comments = new ArrayList<>();
			while (tokens.get(pos).type() == JavaTokenType.COMMENT) {
				comments.add(tokens.get(pos++));
			}
			return comments;
		}

		boolean peekIsKeyword(String text) {
			return peek().is(JavaTokenType.KEYWORD, text);
		}

		boolean peekIsPunct(String text) {
			return peek().is(JavaTokenType.PUNCTUATION, text);
		}

		boolean peekIsOperator(String text) {
			return peek().is(JavaTokenType.OPERATOR, text);
		}

		JavaToken expectKeyword(String text) {
			JavaToken t = peek();
			if (!t.is(JavaTokenType.KEYWORD, text)) {
				throw unexpected(t, "'" + text + "'");
			}
			return next();
		}

		JavaToken expectPunct(String text, String context) {
			JavaToken t = peek();
			if (!t.is(JavaTokenType.PUNCTUATION, text)) {
				throw unexpected(t, "'" + text + "' " + context);
			}
			return next();
		}

		JavaToken expect(JavaTokenType type, String what) {
			JavaToken t = peek();
			if (t.type() != type) {
				throw unexpected(t, what);
			}
			return next();
		}
	}
}
