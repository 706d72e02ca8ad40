package ibpseudo.ast.java;

import ibpseudo.ast.SourceLocation;

public record JavaParam(JavaTypeRef type, String name, SourceLocation location) implements JavaNode {
}
