package ibpseudo.ast.pseudo;

import ibpseudo.ast.SourceLocation;

import java.util.List;
import java.util.Objects;

/**
 * One already-rendered line of pseudocode at a nesting depth. A {@link PseudocodeNodeKind#BLOCK}
 * carries its header in {@code content} and its body in {@code children}, one level deeper; every
 * other kind is a leaf.
 */
public record PseudocodeNode(PseudocodeNodeKind kind, String content, int indentLevel, List<PseudocodeNode> children,
		SourceLocation location) {
	public PseudocodeNode {
		Objects.requireNonNull(kind, "kind");
		Objects.requireNonNull(content, "content");
		if (indentLevel < 0) {
			throw new IllegalArgumentException("indentLevel must not be negative: " + indentLevel);
		}
		children = List.copyOf(children);
		if (kind != PseudocodeNodeKind.BLOCK && !children.isEmpty()) {
			throw new IllegalArgumentException(kind + " nodes cannot have children");
		}
	}

	public static PseudocodeNode statement(String content, int indentLevel, SourceLocation location) {
		return new PseudocodeNode(PseudocodeNodeKind.STATEMENT, content, indentLevel, List.of(), location);
	}

	public static PseudocodeNode comment(String content, int indentLevel, SourceLocation location) {
		return new PseudocodeNode(PseudocodeNodeKind.COMMENT, content, indentLevel, List.of(), location);
	}

	public static PseudocodeNode expression(String content, int indentLevel, SourceLocation location) {
		return new PseudocodeNode(PseudocodeNodeKind.EXPRESSION, content, indentLevel, List.of(), location);
	}

	public static PseudocodeNode block(String header, int indentLevel, List<PseudocodeNode> children,
			SourceLocation location) {
		return new PseudocodeNode(PseudocodeNodeKind.BLOCK, header, indentLevel, children, location);
	}

	public boolean isComment() {
		return kind == PseudocodeNodeKind.COMMENT;
	}
}
