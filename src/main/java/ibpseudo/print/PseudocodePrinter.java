package ibpseudo.print;

import ibpseudo.ast.pseudo.PseudocodeNode;
import ibpseudo.ast.pseudo.PseudocodeNodeKind;

import java.util.ArrayList;
import java.util.List;

/**
 * Serializes pseudocode nodes to text: one line per node, indented by its level, joined with
 * {@code \n} and no trailing newline.
 */
public final class PseudocodePrinter {
	private final String indentUnit;
	private final boolean preserveComments;

	public PseudocodePrinter(int indentSize, char indentChar, boolean preserveComments) {
		if (indentSize < 0) {
			throw new IllegalArgumentException("indentSize must not be negative: " + indentSize);
		}
		this.indentUnit = String.valueOf(indentChar).repeat(indentSize);
		this.preserveComments = preserveComments;
	}

	public String print(List<PseudocodeNode> nodes) {
		List<String> lines = new ArrayList<>();
		for (PseudocodeNode node : nodes) {
			emit(node, lines);
		}
		return String.join("\n", lines);
	}

	private void emit(PseudocodeNode node, List<String> lines) {
		if (node.isComment() && !preserveComments) {
			return;
		}
		if (node.kind() != PseudocodeNodeKind.BLOCK || !node.content().isEmpty()) {
			lines.add(indentUnit.repeat(node.indentLevel()) + node.content());
		}
		for (PseudocodeNode child : node.children()) {
			emit(child, lines);
		}
	}
}
