package ibpseudo.transform;

import ibpseudo.ast.pseudo.PseudocodeNode;
import ibpseudo.diag.Diagnostic;

import java.util.List;

public record TransformResult(List<PseudocodeNode> nodes, List<Diagnostic> diagnostics) {
	public TransformResult {
		nodes = List.copyOf(nodes);
		diagnostics = List.copyOf(diagnostics);
	}
}
