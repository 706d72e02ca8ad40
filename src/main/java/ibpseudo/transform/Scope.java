package ibpseudo.transform;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * One link of the scope chain. Lookups walk outward through the parents.
 */
public final class Scope {
	public enum Kind {
		GLOBAL,
		CLASS,
		METHOD,
		BLOCK
	}

	private final Kind kind;
	private final String name;
	private final Scope parent;
	private final Map<String, VariableInfo> variables = new LinkedHashMap<>();

	public Scope(Kind kind, String name, Scope parent) {
		this.kind = kind;
		this.name = name;
		this.parent = parent;
	}

	public Kind kind() {
		return kind;
	}

	public String name() {
		return name;
	}

	public Scope parent() {
		return parent;
	}

	public void declare(VariableInfo variable) {
		variables.put(variable.originalName(), variable);
	}

	public Optional<VariableInfo> lookup(String originalName) {
		for (Scope s = this; s != null; s = s.parent) {
			VariableInfo found = s.variables.get(originalName);
			if (found != null) {
				return Optional.of(found);
			}
		}
		return Optional.empty();
	}
}
