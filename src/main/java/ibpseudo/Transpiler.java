package ibpseudo;

import ibpseudo.ast.SourceLocation;
import ibpseudo.ast.java.JavaProgram;
import ibpseudo.diag.Diagnostic;
import ibpseudo.diag.DiagnosticKind;
import ibpseudo.parse.java.JavaLexer;
import ibpseudo.parse.java.JavaParser;
import ibpseudo.parse.java.LexResult;
import ibpseudo.parse.java.ParseResult;
import ibpseudo.print.PseudocodePrinter;
import ibpseudo.rules.RuleTable;
import ibpseudo.transform.JavaToPseudocodeTransformer;
import ibpseudo.transform.TransformResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Public entrypoint for Java -> IB pseudocode conversion.
 *
 * Each call builds its own lexer, parser, transformer and printer, so one instance may be shared
 * by several threads.
 */
public final class Transpiler {
	private static final Logger LOG = LoggerFactory.getLogger(Transpiler.class);

	static final String NOTHING_GENERATED = "No pseudocode could be generated from the input";

	public ConversionResult convert(String javaSource) {
		return convert(javaSource, ConversionOptions.defaults());
	}

	public ConversionResult convert(String javaSource, ConversionOptions options) {
		List<Diagnostic> diagnostics = new ArrayList<>();

		LexResult lexed = new JavaLexer().lex(javaSource);
		diagnostics.addAll(lexed.diagnostics());
		LOG.debug("Lexed {} tokens, {} diagnostics", lexed.tokens().size(), lexed.diagnostics().size());

		ParseResult parsed = new JavaParser().parse(lexed.tokens());
		diagnostics.addAll(parsed.diagnostics());
		LOG.debug("Parsed, {} diagnostics", parsed.diagnostics().size());

		String text = "";
		Optional<JavaProgram> program = parsed.program();
		if (program.isPresent()) {
			try {
				TransformResult transformed = new JavaToPseudocodeTransformer(new RuleTable(options.style()))
						.transform(program.get());
				diagnostics.addAll(transformed.diagnostics());
				LOG.debug("Transformed into {} nodes, {} diagnostics", transformed.nodes().size(),
						transformed.diagnostics().size());
				text = new PseudocodePrinter(options.indentSize(), options.indentChar(), options.preserveComments())
						.print(transformed.nodes());
			} catch (RuntimeException | StackOverflowError e) {
				LOG.error("Transformation failed unexpectedly", e);
				String reason = e instanceof StackOverflowError ? "input is nested too deeply" : e.getMessage();
				diagnostics.add(Diagnostic.error(DiagnosticKind.CONVERSION,
						"Unable to transform input: " + reason, SourceLocation.START));
			}
		}

		if (text.isBlank()) {
			diagnostics.add(Diagnostic.error(DiagnosticKind.CONVERSION, NOTHING_GENERATED, SourceLocation.START));
		}

		List<Diagnostic> errors = new ArrayList<>();
		List<Diagnostic> warnings = new ArrayList<>();
		for (Diagnostic d : diagnostics) {
			if (d.isError()) {
				errors.add(d);
			} else {
				warnings.add(d);
			}
		}
		boolean success = errors.isEmpty();
		if (text.isBlank()) {
			text = "// Conversion failed: " + errors.get(0).message();
		}
		LOG.debug("Conversion finished: success={}, {} errors, {} warnings", success, errors.size(), warnings.size());
		return new ConversionResult(text, success, errors, warnings,
				new ConversionMetadata(countLines(javaSource), countLines(text)));
	}

	static int countLines(String text) {
		if (text.isEmpty()) {
			return 0;
		}
		return text.split("\r\n|\r|\n", -1).length;
	}
}
