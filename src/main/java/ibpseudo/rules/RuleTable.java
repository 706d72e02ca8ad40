package ibpseudo.rules;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Pure mappings from Java lexical conventions to IB pseudocode ones. All tables are immutable, so
 * one instance can be shared between threads.
 */
public final class RuleTable {
	private static final Pattern LOWER_TO_UPPER = Pattern.compile("([a-z])([A-Z])");
	private static final Pattern DIGIT_TO_UPPER = Pattern.compile("([0-9])([A-Z])");

	private static final Map<String, String> OPERATORS = Map.of(
			"==", "=",
			"&&", "AND",
			"||", "OR",
			"!", "NOT",
			"%", "mod",
			"/", "div");

	/** One-argument string methods that become a built-in applied to the receiver. */
	private static final Map<String, String> STRING_FUNCTIONS = Map.of(
			"length", "LENGTH",
			"toUpperCase", "UPPER",
			"toLowerCase", "LOWER");

	private static final Set<String> OUTPUT_METHODS = Set.of("print", "println", "printf");

	// calls whose result is known to be floating point, keyed by method name
	private static final Set<String> REAL_METHODS = Set.of(
			"sqrt", "pow", "random", "sin", "cos", "tan", "log", "log10", "exp", "cbrt", "hypot",
			"nextDouble", "nextFloat", "parseDouble", "parseFloat", "doubleValue", "floatValue");

	private static final List<String> SCANNER_TYPES = List.of("Scanner", "java.util.Scanner");

	private final PseudocodeStyle style;

	public RuleTable() {
		this(PseudocodeStyle.defaults());
	}

	public RuleTable(PseudocodeStyle style) {
		this.style = Objects.requireNonNull(style, "style");
	}

	public PseudocodeStyle style() {
		return style;
	}

	/**
	 * camelCase to UPPER_SNAKE_CASE. An underscore goes in at each lowercase-to-uppercase and
	 * digit-to-uppercase boundary, so {@code test123Variable} becomes {@code TEST123_VARIABLE}.
	 * Applying it to its own output changes nothing.
	 */
	public String convertName(String javaName) {
		if (javaName.chars().noneMatch(Character::isLowerCase)) {
			// already constant-style
			return javaName;
		}
		String split = LOWER_TO_UPPER.matcher(javaName).replaceAll("$1_$2");
		split = DIGIT_TO_UPPER.matcher(split).replaceAll("$1_$2");
		return split.toUpperCase(Locale.ROOT);
	}

	/**
	 * Maps a binary or prefix operator. {@code /} always maps to {@code div} here; callers that
	 * know the division is real use {@link #realDivision()} instead.
	 */
	public String convertOperator(String javaOperator) {
		if (javaOperator.equals("!=")) {
			return style.notEqualsSymbol();
		}
		return OPERATORS.getOrDefault(javaOperator, javaOperator);
	}

	public String realDivision() {
		return "/";
	}

	public String booleanLiteral(boolean value) {
		String text = value ? "TRUE" : "FALSE";
		return style.booleanCase() == BooleanCase.UPPER ? text : text.toLowerCase(Locale.ROOT);
	}

	public String nullLiteral() {
		return "NULL";
	}

	public boolean isOutputCall(String receiver, String method) {
		return receiver.equals("System.out") && OUTPUT_METHODS.contains(method);
	}

	/** {@code nextInt}, {@code nextLine} and friends, on any receiver. */
	public boolean isInputCall(String method) {
		return method.length() > "next".length() && method.startsWith("next")
				&& Character.isUpperCase(method.charAt("next".length()));
	}

	public boolean isScannerType(String typeName) {
		return SCANNER_TYPES.contains(typeName);
	}

	public boolean isRealValuedMethod(String method) {
		return REAL_METHODS.contains(method);
	}

	/** The built-in for a no-argument string method, or null. */
	public String stringFunction(String method) {
		return STRING_FUNCTIONS.get(method);
	}

	public String output(List<String> arguments) {
		return arguments.isEmpty() ? "output" : "output " + String.join(", ", arguments);
	}

	public String input(String variable) {
		return "input " + variable;
	}

	public String arraySize(String array) {
		return "SIZE(" + array + ")";
	}

	public String countingLoop(String variable, String start, String end, String step) {
		String header = "loop " + variable + " from " + start + " to " + end;
		return step == null || step.equals("1") ? header : header + " step " + step;
	}

	public String procedureHeader(String name, List<String> params) {
		return "PROCEDURE " + name + "(" + String.join(", ", params) + ")";
	}

	public String functionHeader(String name, List<String> params) {
		return "FUNCTION " + name + "(" + String.join(", ", params) + ")";
	}
}
