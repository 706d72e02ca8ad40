package ibpseudo.ast.java;

import ibpseudo.ast.SourceLocation;

public sealed interface JavaNode permits JavaProgram, JavaStmt, JavaExpr, JavaParam, JavaSwitchCase, JavaTypeRef {
	SourceLocation location();
}
