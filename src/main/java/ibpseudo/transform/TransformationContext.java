package ibpseudo.transform;

import ibpseudo.ast.SourceLocation;
import ibpseudo.ast.java.JavaTypeRef;
import ibpseudo.diag.Diagnostic;
import ibpseudo.diag.DiagnosticKind;
import ibpseudo.rules.RuleTable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Mutable state for one transformation: the scope chain, the known methods, the current indent
 * level and the diagnostics collected so far. Created per call and then discarded.
 */
public final class TransformationContext {
	private final RuleTable rules;
	private final Map<String, MethodInfo> methods = new HashMap<>();
	private final List<Diagnostic> diagnostics = new ArrayList<>();
	private Scope scope = new Scope(Scope.Kind.GLOBAL, "global", null);
	private int indentLevel;
	// innermost first; true for a switch, false for a loop
	private final Deque<Boolean> breakTargets = new ArrayDeque<>();
	private String currentClass;

	public TransformationContext(RuleTable rules) {
		this.rules = rules;
	}

	public RuleTable rules() {
		return rules;
	}

	public Scope scope() {
		return scope;
	}

	public void pushScope(Scope.Kind kind, String name) {
		scope = new Scope(kind, name, scope);
	}

	public void popScope() {
		if (scope.parent() == null) {
			throw new IllegalStateException("cannot pop the global scope");
		}
		scope = scope.parent();
	}

	public int indentLevel() {
		return indentLevel;
	}

	public void indent() {
		indentLevel++;
	}

	public void dedent() {
		if (indentLevel == 0) {
			throw new IllegalStateException("indent level is already 0");
		}
		indentLevel--;
	}

	public VariableInfo declareVariable(String name, JavaTypeRef type) {
		VariableInfo info = new VariableInfo(name, rules.convertName(name), type, scope.kind());
		scope.declare(info);
		return info;
	}

	public Optional<VariableInfo> lookupVariable(String name) {
		return scope.lookup(name);
	}

	/** The cached rendering when the name was declared, otherwise a fresh conversion. */
	public String resolveName(String name) {
		return scope.lookup(name)
				.map(VariableInfo::pseudocodeName)
				.orElseGet(() -> rules.convertName(name));
	}

	public void registerMethod(MethodInfo method) {
		methods.put(method.originalName(), method);
	}

	public Optional<MethodInfo> lookupMethod(String name) {
		return Optional.ofNullable(methods.get(name));
	}

	public String currentClass() {
		return currentClass;
	}

	public void setCurrentClass(String currentClass) {
		this.currentClass = currentClass;
	}

	public void enterSwitch() {
		breakTargets.push(Boolean.TRUE);
	}

	public void enterLoop() {
		breakTargets.push(Boolean.FALSE);
	}

	public void exitBreakTarget() {
		breakTargets.pop();
	}

	/** Whether a {@code break} here leaves a switch rather than a loop. */
	public boolean breaksOutOfSwitch() {
		return !breakTargets.isEmpty() && breakTargets.peek();
	}

	public void warning(String message, SourceLocation at) {
		diagnostics.add(Diagnostic.warning(DiagnosticKind.CONVERSION, message, at));
	}

	public void info(String message, SourceLocation at) {
		diagnostics.add(Diagnostic.info(DiagnosticKind.CONVERSION, message, at));
	}

	public void error(String message, SourceLocation at) {
		diagnostics.add(Diagnostic.error(DiagnosticKind.CONVERSION, message, at));
	}

	public List<Diagnostic> diagnostics() {
		return List.copyOf(diagnostics);
	}
}
