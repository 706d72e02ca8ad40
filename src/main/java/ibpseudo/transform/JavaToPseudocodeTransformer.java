package ibpseudo.transform;

import ibpseudo.ast.SourceLocation;
import ibpseudo.ast.java.JavaAssign;
import ibpseudo.ast.java.JavaBinary;
import ibpseudo.ast.java.JavaBlock;
import ibpseudo.ast.java.JavaBreak;
import ibpseudo.ast.java.JavaClassDecl;
import ibpseudo.ast.java.JavaComment;
import ibpseudo.ast.java.JavaContinue;
import ibpseudo.ast.java.JavaDoWhile;
import ibpseudo.ast.java.JavaExpr;
import ibpseudo.ast.java.JavaExprStmt;
import ibpseudo.ast.java.JavaFor;
import ibpseudo.ast.java.JavaForEach;
import ibpseudo.ast.java.JavaIf;
import ibpseudo.ast.java.JavaLiteral;
import ibpseudo.ast.java.JavaMethodCall;
import ibpseudo.ast.java.JavaMethodDecl;
import ibpseudo.ast.java.JavaName;
import ibpseudo.ast.java.JavaParam;
import ibpseudo.ast.java.JavaProgram;
import ibpseudo.ast.java.JavaReturn;
import ibpseudo.ast.java.JavaStmt;
import ibpseudo.ast.java.JavaSwitch;
import ibpseudo.ast.java.JavaSwitchCase;
import ibpseudo.ast.java.JavaUnary;
import ibpseudo.ast.java.JavaVarDecl;
import ibpseudo.ast.java.JavaWhile;
import ibpseudo.ast.pseudo.PseudocodeNode;
import ibpseudo.rules.RuleTable;

import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites a Java AST into pseudocode nodes.
 *
 * Every statement is transformed on its own: when a rule fails with a {@link ConversionException}
 * the error is recorded, that statement produces nothing and its siblings are still converted.
 */
public final class JavaToPseudocodeTransformer implements JavaStmt.Visitor<List<PseudocodeNode>> {
	static final String MAIN_EXTRACTED = "// Main program logic extracted from main method";

	private final RuleTable rules;
	private TransformationContext context;
	private ExpressionRenderer expressions;

	public JavaToPseudocodeTransformer(RuleTable rules) {
		this.rules = rules;
	}

	public TransformResult transform(JavaProgram program) {
		context = new TransformationContext(rules);
		expressions = new ExpressionRenderer(context);
		registerMethods(program.declarations());
		List<PseudocodeNode> nodes = transformAll(program.declarations());
		return new TransformResult(nodes, context.diagnostics());
	}

	List<PseudocodeNode> transformAll(List<JavaStmt> stmts) {
		List<PseudocodeNode> out = new ArrayList<>();
		for (JavaStmt stmt : stmts) {
			out.addAll(transformStatement(stmt));
		}
		return out;
	}

	private List<PseudocodeNode> transformStatement(JavaStmt stmt) {
		try {
			return stmt.accept(this);
		} catch (ConversionException e) {
			context.error(e.getMessage(), e.location());
			return List.of();
		}
	}

	/** Methods are registered up front so calls resolve regardless of declaration order. */
	private void registerMethods(List<JavaStmt> members) {
		for (JavaStmt member : members) {
			if (member instanceof JavaMethodDecl method && !method.isConstructor()) {
				List<String> params = new ArrayList<>();
				for (JavaParam p : method.params()) {
					params.add(rules.convertName(p.name()));
				}
				context.registerMethod(new MethodInfo(method.name(), rules.convertName(method.name()),
						method.returnType(), params, method.isVoid(), method.isStatic()));
			}
		}
	}

	private PseudocodeNode line(String content, SourceLocation location) {
		return PseudocodeNode.statement(content, context.indentLevel(), location);
	}

	/**
	 * A header line with the body one level deeper. The body is produced inside a fresh block scope.
	 */
	private PseudocodeNode block(String header, SourceLocation location, JavaStmt body) {
		int level = context.indentLevel();
		context.indent();
		context.pushScope(Scope.Kind.BLOCK, header);
		try {
			return PseudocodeNode.block(header, level, transformBody(body), location);
		} finally {
			context.popScope();
			context.dedent();
		}
	}

	private List<PseudocodeNode> transformBody(JavaStmt body) {
		if (body instanceof JavaBlock block) {
			return transformAll(block.stmts());
		}
		return transformStatement(body);
	}

	// ---- declarations ----

	@Override
	public List<PseudocodeNode> visitClass(JavaClassDecl decl) {
		String previousClass = context.currentClass();
		context.setCurrentClass(decl.name());
		context.pushScope(Scope.Kind.CLASS, decl.name());
		try {
			registerMethods(decl.members());
			for (JavaStmt member : decl.members()) {
				if (member instanceof JavaVarDecl field) {
					context.declareVariable(field.name(), field.type());
				}
			}
			if (isMainOnly(decl)) {
				return extractMain(decl);
			}

			List<PseudocodeNode> out = new ArrayList<>();
			String name = rules.convertName(decl.name());
			String header = "// CLASS " + name;
			if (decl.hasSuperClass()) {
				header += " INHERITS FROM " + rules.convertName(simpleName(decl.superClass()));
			}
			out.add(line(header, decl.location()));

			boolean fieldsMarked = false;
			for (JavaStmt member : decl.members()) {
				if (member instanceof JavaVarDecl && !fieldsMarked) {
					out.add(line("// Class fields", member.location()));
					fieldsMarked = true;
				}
				if (member instanceof JavaMethodDecl method && method.isStatic()) {
					out.add(line("// Static method", member.location()));
				}
				out.addAll(transformStatement(member));
			}
			out.add(line("// END CLASS " + name, decl.location()));
			return out;
		} finally {
			context.popScope();
			context.setCurrentClass(previousClass);
		}
	}

	private static boolean isMainOnly(JavaClassDecl decl) {
		int methods = 0;
		boolean main = false;
		for (JavaStmt member : decl.members()) {
			if (member instanceof JavaComment) {
				continue;
			}
			if (member instanceof JavaMethodDecl method && method.isMain()) {
				main = true;
			}
			methods++;
		}
		return main && methods == 1;
	}

	private List<PseudocodeNode> extractMain(JavaClassDecl decl) {
		List<PseudocodeNode> out = new ArrayList<>();
		out.add(line(MAIN_EXTRACTED, decl.location()));
		for (JavaStmt member : decl.members()) {
			if (member instanceof JavaMethodDecl main) {
				context.pushScope(Scope.Kind.METHOD, main.name());
				try {
					for (JavaParam p : main.params()) {
						context.declareVariable(p.name(), p.type());
					}
					out.addAll(transformAll(main.body().stmts()));
				} finally {
					context.popScope();
				}
			} else {
				out.addAll(transformStatement(member));
			}
		}
		return out;
	}

	private static String simpleName(String type) {
		int dot = type.lastIndexOf('.');
		return dot < 0 ? type : type.substring(dot + 1);
	}

	@Override
	public List<PseudocodeNode> visitMethod(JavaMethodDecl decl) {
		String name;
		if (decl.isConstructor()) {
			name = rules.convertName(context.currentClass() == null ? decl.name() : context.currentClass());
		} else {
			name = context.lookupMethod(decl.name())
					.map(MethodInfo::pseudocodeName)
					.orElseGet(() -> rules.convertName(decl.name()));
		}

		context.pushScope(Scope.Kind.METHOD, decl.name());
		try {
			List<String> params = new ArrayList<>();
			for (JavaParam p : decl.params()) {
				params.add(context.declareVariable(p.name(), p.type()).pseudocodeName());
			}
			boolean procedure = decl.isVoid();
			String header = procedure ? rules.procedureHeader(name, params) : rules.functionHeader(name, params);

			int level = context.indentLevel();
			context.indent();
			List<PseudocodeNode> body;
			try {
				body = transformAll(decl.body().stmts());
			} finally {
				context.dedent();
			}
			return List.of(
					PseudocodeNode.block(header, level, body, decl.location()),
					line(procedure ? "end PROCEDURE" : "end FUNCTION", decl.location()));
		} finally {
			context.popScope();
		}
	}

	@Override
	public List<PseudocodeNode> visitVariable(JavaVarDecl decl) {
		if (rules.isScannerType(decl.type().simpleName())) {
			context.declareVariable(decl.name(), decl.type());
			return List.of();
		}
		// the initializer is rendered before the name is declared: int x = x + 1 reads the outer x
		String value = null;
		boolean input = false;
		if (decl.hasInitializer()) {
			if (isInputCall(decl.initializer())) {
				input = true;
			} else {
				value = expressions.render(decl.initializer());
			}
		}
		String name = context.declareVariable(decl.name(), decl.type()).pseudocodeName();
		if (input) {
			return List.of(line(rules.input(name), decl.location()));
		}
		return List.of(line(value == null ? name : name + " = " + value, decl.location()));
	}

	// ---- simple statements ----

	@Override
	public List<PseudocodeNode> visitBlock(JavaBlock block) {
		context.pushScope(Scope.Kind.BLOCK, "block");
		try {
			return transformAll(block.stmts());
		} finally {
			context.popScope();
		}
	}

	@Override
	public List<PseudocodeNode> visitExpression(JavaExprStmt stmt) {
		JavaExpr expr = stmt.expr();
		if (expr instanceof JavaAssign assign) {
			return List.of(line(assignment(assign), stmt.location()));
		}
		if (expr instanceof JavaUnary unary && unary.isIncrementOrDecrement()) {
			String target = expressions.render(unary.operand());
			String op = unary.op().equals("++") ? "+" : "-";
			return List.of(line(target + " = " + target + " " + op + " 1", stmt.location()));
		}
		if (expr instanceof JavaMethodCall call) {
			if (isScannerClose(call)) {
				return List.of();
			}
			String text = expressions.render(call);
			if (isOutputCall(call)) {
				return List.of(line(text, stmt.location()));
			}
			// a bare call: its value, if any, is discarded
			return List.of(PseudocodeNode.expression(text, context.indentLevel(), stmt.location()));
		}
		throw new ConversionException("Expression statement has no effect and cannot be converted", stmt.location());
	}

	private String assignment(JavaAssign assign) {
		String target = expressions.render(assign.target());
		if (!assign.isCompound()) {
			if (isInputCall(assign.value())) {
				return rules.input(target);
			}
			return target + " = " + expressions.render(assign.value());
		}
		String base = assign.baseOperator();
		String op = base.equals("/") && (expressions.isReal(assign.target()) || expressions.isReal(assign.value()))
				? rules.realDivision()
				: rules.convertOperator(base);
		String value = expressions.render(assign.value());
		if (needsParens(base, assign.value())) {
			value = "(" + value + ")";
		}
		return target + " = " + target + " " + op + " " + value;
	}

	/**
	 * {@code x -= a + b} must become {@code X = X - (A + B)} and {@code x *= a / b} becomes
	 * {@code X = X * (A div B)}, while {@code x += a * b} needs none.
	 */
	private static boolean needsParens(String op, JavaExpr value) {
		if (!(value instanceof JavaBinary binary)) {
			return false;
		}
		int outer = precedence(op);
		int inner = precedence(binary.op());
		if (inner != outer) {
			return inner < outer;
		}
		boolean associative = op.equals("+") && (binary.op().equals("+") || binary.op().equals("-"))
				|| op.equals("*") && binary.op().equals("*");
		return !associative;
	}

	private static int precedence(String op) {
		return switch (op) {
			case "*", "/", "%" -> 3;
			case "+", "-" -> 2;
			default -> 1;
		};
	}

	private boolean isInputCall(JavaExpr expr) {
		return expr instanceof JavaMethodCall call && call.hasTarget() && call.args().isEmpty()
				&& rules.isInputCall(call.name());
	}

	private boolean isOutputCall(JavaMethodCall call) {
		if (!call.hasTarget()) {
			return false;
		}
		String receiver = ExpressionRenderer.qualifiedName(call.target());
		return receiver != null && rules.isOutputCall(receiver, call.name());
	}

	private boolean isScannerClose(JavaMethodCall call) {
		if (!call.name().equals("close") || !(call.target() instanceof JavaName target)) {
			return false;
		}
		return context.lookupVariable(target.name())
				.map(v -> v.type() != null && rules.isScannerType(v.type().simpleName()))
				.orElse(false);
	}

	@Override
	public List<PseudocodeNode> visitReturn(JavaReturn stmt) {
		if (!stmt.hasValue()) {
			return List.of(line("return", stmt.location()));
		}
		return List.of(line("return " + expressions.render(stmt.value()), stmt.location()));
	}

	@Override
	public List<PseudocodeNode> visitBreak(JavaBreak stmt) {
		if (!context.breaksOutOfSwitch()) {
			context.info("'break' has no IB pseudocode equivalent and was kept as written", stmt.location());
		}
		return List.of(line("break", stmt.location()));
	}

	@Override
	public List<PseudocodeNode> visitContinue(JavaContinue stmt) {
		context.info("'continue' has no IB pseudocode equivalent and was kept as written", stmt.location());
		return List.of(line("continue", stmt.location()));
	}

	@Override
	public List<PseudocodeNode> visitComment(JavaComment comment) {
		List<PseudocodeNode> out = new ArrayList<>();
		for (String text : commentLines(comment.text())) {
			out.add(PseudocodeNode.comment(text, context.indentLevel(), comment.location()));
		}
		return out;
	}

	/** Line comments are kept as written; block comments become one {@code //} line per non-blank line. */
	static List<String> commentLines(String raw) {
		if (raw.startsWith("//")) {
			return List.of(raw.stripTrailing());
		}
		String body = raw.startsWith("/**") ? raw.substring(3) : raw.substring(2);
		if (body.endsWith("*/")) {
			body = body.substring(0, body.length() - 2);
		}
		List<String> lines = new ArrayList<>();
		for (String l : body.split("\r?\n|\r")) {
			String text = l.strip();
			if (text.startsWith("*")) {
				text = text.substring(1).strip();
			}
			if (!text.isEmpty()) {
				lines.add("// " + text);
			}
		}
		return lines;
	}

	// ---- control flow ----

	@Override
	public List<PseudocodeNode> visitIf(JavaIf stmt) {
		List<PseudocodeNode> out = new ArrayList<>();
		out.add(block("if " + expressions.render(stmt.condition()) + " then", stmt.location(), stmt.thenBranch()));

		JavaStmt elseBranch = stmt.elseBranch();
		if (rules.style().flatElseIf()) {
			while (elseBranch instanceof JavaIf elseIf) {
				out.add(block("else if " + expressions.render(elseIf.condition()) + " then", elseIf.location(),
						elseIf.thenBranch()));
				elseBranch = elseIf.elseBranch();
			}
		}
		if (elseBranch != null) {
			out.add(block("else", stmt.location(), elseBranch));
		}
		out.add(line("end if", stmt.location()));
		return out;
	}

	@Override
	public List<PseudocodeNode> visitWhile(JavaWhile stmt) {
		String header = "loop while " + expressions.render(stmt.condition());
		return List.of(loopBlock(header, stmt.location(), stmt.body()), line("end loop", stmt.location()));
	}

	@Override
	public List<PseudocodeNode> visitDoWhile(JavaDoWhile stmt) {
		PseudocodeNode body = loopBlock("repeat", stmt.location(), stmt.body());
		String condition = expressions.render(stmt.condition());
		return List.of(body, line("until NOT (" + condition + ")", stmt.location()));
	}

	private PseudocodeNode loopBlock(String header, SourceLocation location, JavaStmt body) {
		context.enterLoop();
		try {
			return block(header, location, body);
		} finally {
			context.exitBreakTarget();
		}
	}

	@Override
	public List<PseudocodeNode> visitForEach(JavaForEach stmt) {
		String iterable = expressions.render(stmt.iterable());
		context.pushScope(Scope.Kind.BLOCK, "for");
		try {
			String variable = context.declareVariable(stmt.variable(), stmt.type()).pseudocodeName();
			String header = "loop " + variable + " in " + iterable;
			return List.of(loopBlock(header, stmt.location(), stmt.body()), line("end loop", stmt.location()));
		} finally {
			context.popScope();
		}
	}

	@Override
	public List<PseudocodeNode> visitFor(JavaFor stmt) {
		context.pushScope(Scope.Kind.BLOCK, "for");
		try {
			CountingLoop counting = CountingLoop.match(stmt);
			if (counting != null) {
				return countingLoop(stmt, counting);
			}
			return whileLoop(stmt);
		} finally {
			context.popScope();
		}
	}

	private List<PseudocodeNode> countingLoop(JavaFor stmt, CountingLoop loop) {
		String start = expressions.render(loop.init().initializer());
		String end = loop.end(expressions);
		String variable = context.declareVariable(loop.init().name(), loop.init().type()).pseudocodeName();
		String header = rules.countingLoop(variable, start, end, loop.stepText());
		return List.of(loopBlock(header, stmt.location(), stmt.body()), line("end loop", stmt.location()));
	}

	private List<PseudocodeNode> whileLoop(JavaFor stmt) {
		List<PseudocodeNode> out = new ArrayList<>(transformAll(stmt.init()));
		String condition = stmt.condition() == null
				? rules.booleanLiteral(true)
				: expressions.render(stmt.condition());
		String header = "loop while " + condition;

		int level = context.indentLevel();
		context.enterLoop();
		context.indent();
		context.pushScope(Scope.Kind.BLOCK, header);
		try {
			List<PseudocodeNode> body = new ArrayList<>(transformBody(stmt.body()));
			for (JavaExpr update : stmt.update()) {
				body.addAll(transformStatement(new JavaExprStmt(update, update.location())));
			}
			out.add(PseudocodeNode.block(header, level, body, stmt.location()));
		} finally {
			context.popScope();
			context.dedent();
			context.exitBreakTarget();
		}
		out.add(line("end loop", stmt.location()));
		return out;
	}

	@Override
	public List<PseudocodeNode> visitSwitch(JavaSwitch stmt) {
		String selector = expressions.render(stmt.selector());
		int level = context.indentLevel();
		List<PseudocodeNode> labels = new ArrayList<>();

		context.enterSwitch();
		context.indent();
		try {
			List<String> pending = new ArrayList<>();
			for (JavaSwitchCase c : stmt.cases()) {
				pending.add(c.isDefault() ? "default" : expressions.render(c.label()));
				if (hasNoStatements(c.body())) {
					continue;
				}
				labels.add(caseBlock(String.join(", ", pending) + ":", c));
				pending.clear();
			}
			if (!pending.isEmpty()) {
				JavaSwitchCase last = stmt.cases().get(stmt.cases().size() - 1);
				labels.add(caseBlock(String.join(", ", pending) + ":", last));
			}
		} finally {
			context.dedent();
			context.exitBreakTarget();
		}
		return List.of(
				PseudocodeNode.block("case " + selector + " of", level, labels, stmt.location()),
				line("end case", stmt.location()));
	}

	private PseudocodeNode caseBlock(String header, JavaSwitchCase c) {
		List<JavaStmt> body = new ArrayList<>(c.body());
		for (int i = body.size() - 1; i >= 0; i--) {
			JavaStmt s = body.get(i);
			if (s instanceof JavaBreak) {
				body.remove(i);
				break;
			}
			if (!(s instanceof JavaComment)) {
				break;
			}
		}
		return block(header, c.location(), new JavaBlock(body, c.location()));
	}

	private static boolean hasNoStatements(List<JavaStmt> body) {
		for (JavaStmt s : body) {
			if (!(s instanceof JavaComment)) {
				return false;
			}
		}
		return true;
	}

	/**
	 * {@code for (T i = a; i < b; i++)} and its variants: a single declared counter, compared
	 * against a bound and stepped by a positive integer literal in the matching direction.
	 */
	record CountingLoop(JavaVarDecl init, JavaBinary condition, boolean ascending, long step) {
		static CountingLoop match(JavaFor loop) {
			if (loop.init().size() != 1 || !(loop.init().get(0) instanceof JavaVarDecl init) || !init.hasInitializer()
					|| init.type().isArray()) {
				return null;
			}
			if (!(loop.condition() instanceof JavaBinary cond) || !(cond.left() instanceof JavaName counter)
					|| !counter.name().equals(init.name())) {
				return null;
			}
			if (loop.update().size() != 1) {
				return null;
			}
			Long step = stepOf(loop.update().get(0), init.name());
			if (step == null) {
				return null;
			}
			boolean ascending = step > 0;
			boolean boundOk = ascending
					? cond.op().equals("<") || cond.op().equals("<=")
					: cond.op().equals(">") || cond.op().equals(">=");
			return boundOk ? new CountingLoop(init, cond, ascending, Math.abs(step)) : null;
		}

		/** Signed step of {@code i++}, {@code --i}, {@code i += 2}, ..., or null for anything else. */
		private static Long stepOf(JavaExpr update, String counter) {
			if (update instanceof JavaUnary unary && unary.isIncrementOrDecrement()
					&& unary.operand() instanceof JavaName name && name.name().equals(counter)) {
				return unary.op().equals("++") ? 1L : -1L;
			}
			if (update instanceof JavaAssign assign && assign.target() instanceof JavaName name
					&& name.name().equals(counter)
					&& (assign.op().equals("+=") || assign.op().equals("-="))) {
				Long k = integerValue(assign.value());
				if (k == null || k <= 0) {
					return null;
				}
				return assign.op().equals("+=") ? k : -k;
			}
			return null;
		}

		String stepText() {
			if (ascending) {
				return step == 1 ? null : Long.toString(step);
			}
			return "-" + step;
		}

		/** The inclusive bound: {@code i < 10} ends at 9, {@code i > 0} at 1, {@code i <= n} at N. */
		String end(ExpressionRenderer expressions) {
			JavaExpr bound = condition.right();
			long adjust = switch (condition.op()) {
				case "<" -> -1;
				case ">" -> 1;
				default -> 0;
			};
			if (adjust == 0) {
				return expressions.render(bound);
			}
			Long literal = integerValue(bound);
			if (literal != null) {
				return Long.toString(literal + adjust);
			}
			if (bound instanceof JavaBinary binary && (binary.op().equals("+") || binary.op().equals("-"))) {
				Long k = integerValue(binary.right());
				if (k != null) {
					long offset = (binary.op().equals("+") ? k : -k) + adjust;
					String left = expressions.render(binary.left());
					if (offset == 0) {
						return left;
					}
					return left + (offset > 0 ? " + " : " - ") + Math.abs(offset);
				}
			}
			return expressions.render(bound) + (adjust < 0 ? " - 1" : " + 1");
		}

		/** A plain decimal integer literal, or null. */
		private static Long integerValue(JavaExpr expr) {
			if (!(expr instanceof JavaLiteral literal) || !literal.isIntegral()) {
				return null;
			}
			String text = ExpressionRenderer.numberText(literal.text());
			if (text.startsWith("0x") || text.startsWith("0X")) {
				return null;
			}
			try {
				return Long.parseLong(text);
			} catch (NumberFormatException e) {
				// out of range for a long: not foldable
				return null;
			}
		}
	}
}
