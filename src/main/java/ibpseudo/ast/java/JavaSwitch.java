package ibpseudo.ast.java;

import ibpseudo.ast.SourceLocation;

import java.util.List;
import java.util.Objects;

public record JavaSwitch(JavaExpr selector, List<JavaSwitchCase> cases, SourceLocation location) implements JavaStmt {
	public JavaSwitch {
		Objects.requireNonNull(selector, "selector");
		cases = List.copyOf(cases);
	}

	@Override
	public <R> R accept(Visitor<R> visitor) {
		return visitor.visitSwitch(this);
	}
}
