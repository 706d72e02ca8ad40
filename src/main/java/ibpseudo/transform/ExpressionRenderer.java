package ibpseudo.transform;

import ibpseudo.ast.java.JavaArrayAccess;
import ibpseudo.ast.java.JavaArrayInit;
import ibpseudo.ast.java.JavaAssign;
import ibpseudo.ast.java.JavaBinary;
import ibpseudo.ast.java.JavaCast;
import ibpseudo.ast.java.JavaExpr;
import ibpseudo.ast.java.JavaFieldAccess;
import ibpseudo.ast.java.JavaLiteral;
import ibpseudo.ast.java.JavaMethodCall;
import ibpseudo.ast.java.JavaName;
import ibpseudo.ast.java.JavaNewArray;
import ibpseudo.ast.java.JavaNewObject;
import ibpseudo.ast.java.JavaParens;
import ibpseudo.ast.java.JavaUnary;
import ibpseudo.rules.RuleTable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;

/**
 * Renders expressions to single-line pseudocode text.
 */
public final class ExpressionRenderer implements JavaExpr.Visitor<String> {
	private static final Set<String> ARITHMETIC = Set.of("+", "-", "*", "/", "%");

	private final TransformationContext context;
	private final RuleTable rules;

	public ExpressionRenderer(TransformationContext context) {
		this.context = context;
		this.rules = context.rules();
	}

	public String render(JavaExpr expr) {
		return expr.accept(this);
	}

	public List<String> renderAll(List<JavaExpr> exprs) {
		List<String> out = new ArrayList<>(exprs.size());
		for (JavaExpr e : exprs) {
			out.add(render(e));
		}
		return out;
	}

	@Override
	public String visitAssign(JavaAssign expr) {
		throw new ConversionException("Assignment used as a value cannot be expressed in pseudocode", expr.location());
	}

	@Override
	public String visitBinary(JavaBinary expr) {
		// Left-deep chains such as a + b + c + ... are walked with a loop so their length is unbounded.
		Deque<JavaBinary> chain = new ArrayDeque<>();
		JavaExpr leftmost = expr;
		while (leftmost instanceof JavaBinary binary) {
			chain.push(binary);
			leftmost = binary.left();
		}
		StringBuilder out = new StringBuilder(render(leftmost));
		boolean leftReal = isReal(leftmost);
		for (JavaBinary binary : chain) {
			boolean rightReal = isReal(binary.right());
			String op = binary.op().equals("/") && (leftReal || rightReal)
					? rules.realDivision()
					: rules.convertOperator(binary.op());
			out.append(' ').append(op).append(' ').append(render(binary.right()));
			leftReal = ARITHMETIC.contains(binary.op()) && (leftReal || rightReal);
		}
		return out.toString();
	}

	@Override
	public String visitUnary(JavaUnary expr) {
		if (expr.isIncrementOrDecrement()) {
			context.warning("'" + expr.op() + "' inside an expression has no pseudocode equivalent; the update was dropped",
					expr.location());
			return render(expr.operand());
		}
		if (expr.op().equals("!")) {
			String operand = render(expr.operand());
			return needsParensUnderNot(expr.operand()) ? "NOT (" + operand + ")" : "NOT " + operand;
		}
		return expr.op() + render(expr.operand());
	}

	private static boolean needsParensUnderNot(JavaExpr operand) {
		if (operand instanceof JavaBinary) {
			return true;
		}
		return operand instanceof JavaMethodCall call && call.hasTarget() && call.args().size() == 1
				&& (call.name().equals("equals") || call.name().equals("equalsIgnoreCase"));
	}

	@Override
	public String visitMethodCall(JavaMethodCall expr) {
		List<JavaExpr> args = expr.args();
		if (!expr.hasTarget()) {
			String name = context.lookupMethod(expr.name())
					.map(MethodInfo::pseudocodeName)
					.orElseGet(() -> rules.convertName(expr.name()));
			return name + "(" + String.join(", ", renderAll(args)) + ")";
		}

		String receiver = qualifiedName(expr.target());
		if (receiver != null && rules.isOutputCall(receiver, expr.name())) {
			return rules.output(renderAll(args));
		}

		String target = render(expr.target());
		String function = rules.stringFunction(expr.name());
		if (function != null && args.isEmpty()) {
			return function + "(" + target + ")";
		}
		switch (expr.name()) {
			case "equals" -> {
				if (args.size() == 1) {
					return target + " = " + render(args.get(0));
				}
			}
			case "equalsIgnoreCase" -> {
				if (args.size() == 1) {
					return "UPPER(" + target + ") = UPPER(" + render(args.get(0)) + ")";
				}
			}
			case "substring" -> {
				if (args.size() == 1 || args.size() == 2) {
					return "SUBSTRING(" + target + ", " + String.join(", ", renderAll(args)) + ")";
				}
			}
			case "charAt" -> {
				if (args.size() == 1) {
					return target + "[" + render(args.get(0)) + "]";
				}
			}
			case "indexOf" -> {
				if (args.size() == 1) {
					return "POSITION(" + render(args.get(0)) + ", " + target + ")";
				}
			}
			default -> {
				// plain call below
			}
		}
		return target + "." + rules.convertName(expr.name()) + "(" + String.join(", ", renderAll(args)) + ")";
	}

	@Override
	public String visitFieldAccess(JavaFieldAccess expr) {
		if (expr.target() instanceof JavaName name && name.isThis()) {
			return context.resolveName(expr.name());
		}
		if (expr.name().equals("length")) {
			return rules.arraySize(render(expr.target()));
		}
		return render(expr.target()) + "." + rules.convertName(expr.name());
	}

	@Override
	public String visitArrayAccess(JavaArrayAccess expr) {
		return render(expr.array()) + "[" + render(expr.index()) + "]";
	}

	@Override
	public String visitArrayInit(JavaArrayInit expr) {
		return "[" + String.join(", ", renderAll(expr.elements())) + "]";
	}

	@Override
	public String visitNewObject(JavaNewObject expr) {
		String type = expr.type();
		int dot = type.lastIndexOf('.');
		String simple = dot < 0 ? type : type.substring(dot + 1);
		return "new " + simple + "(" + String.join(", ", renderAll(expr.args())) + ")";
	}

	@Override
	public String visitNewArray(JavaNewArray expr) {
		if (expr.initializer() != null) {
			return render(expr.initializer());
		}
		return "new Array(" + String.join(", ", renderAll(expr.dimensions())) + ")";
	}

	@Override
	public String visitCast(JavaCast expr) {
		return render(expr.operand());
	}

	@Override
	public String visitParens(JavaParens expr) {
		return "(" + render(expr.inner()) + ")";
	}

	@Override
	public String visitName(JavaName expr) {
		if (expr.isThis()) {
			return "THIS";
		}
		return context.resolveName(expr.name());
	}

	@Override
	public String visitLiteral(JavaLiteral expr) {
		return switch (expr.kind()) {
			case NUMBER -> numberText(expr.text());
			case BOOLEAN -> rules.booleanLiteral(Boolean.parseBoolean(expr.text()));
			case NULL -> rules.nullLiteral();
			case STRING, CHAR -> expr.text();
		};
	}

	/** Drops digit separators and type suffixes: {@code 1_000L} is {@code 1000}, {@code 2.5f} is {@code 2.5}. */
	static String numberText(String text) {
		String t = text.replace("_", "");
		boolean hex = t.startsWith("0x") || t.startsWith("0X");
		String suffixes = hex ? "lL" : "lLfFdD";
		if (t.length() > 1 && suffixes.indexOf(t.charAt(t.length() - 1)) >= 0) {
			t = t.substring(0, t.length() - 1);
		}
		return t;
	}

	/**
	 * {@code System.out} for {@code System.out}, {@code a.b.c} for a chain of names, otherwise null.
	 */
	static String qualifiedName(JavaExpr expr) {
		if (expr instanceof JavaName name) {
			return name.name();
		}
		if (expr instanceof JavaFieldAccess field) {
			String target = qualifiedName(field.target());
			return target == null ? null : target + "." + field.name();
		}
		return null;
	}

	/**
	 * Whether the expression is known to produce a floating-point value. Unknown names and calls
	 * count as integral, so {@code /} defaults to {@code div}.
	 */
	public boolean isReal(JavaExpr expr) {
		if (expr instanceof JavaLiteral literal) {
			return literal.kind() == JavaLiteral.Kind.NUMBER && !literal.isIntegral();
		}
		if (expr instanceof JavaName name) {
			return context.lookupVariable(name.name()).map(VariableInfo::isReal).orElse(false);
		}
		if (expr instanceof JavaCast cast) {
			return cast.type().isReal();
		}
		if (expr instanceof JavaParens parens) {
			return isReal(parens.inner());
		}
		if (expr instanceof JavaUnary unary) {
			return !unary.op().equals("!") && isReal(unary.operand());
		}
		if (expr instanceof JavaBinary) {
			JavaExpr current = expr;
			while (current instanceof JavaBinary binary) {
				if (!ARITHMETIC.contains(binary.op())) {
					return false;
				}
				if (isReal(binary.right())) {
					return true;
				}
				current = binary.left();
			}
			return isReal(current);
		}
		if (expr instanceof JavaMethodCall call) {
			if (!call.hasTarget()) {
				return context.lookupMethod(call.name()).map(MethodInfo::returnsReal).orElse(false);
			}
			return rules.isRealValuedMethod(call.name());
		}
		if (expr instanceof JavaFieldAccess field) {
			if (field.target() instanceof JavaName target && target.isThis()) {
				return context.lookupVariable(field.name()).map(VariableInfo::isReal).orElse(false);
			}
			return "Math".equals(qualifiedName(field.target())) && (field.name().equals("PI") || field.name().equals("E"));
		}
		if (expr instanceof JavaArrayAccess access && access.array() instanceof JavaName array) {
			return context.lookupVariable(array.name()).map(VariableInfo::hasRealElements).orElse(false);
		}
		return false;
	}
}
