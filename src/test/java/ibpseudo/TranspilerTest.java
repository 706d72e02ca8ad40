package ibpseudo;

import ibpseudo.diag.Diagnostic;
import ibpseudo.diag.DiagnosticKind;
import ibpseudo.diag.Severity;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TranspilerTest {
	private final Transpiler transpiler = new Transpiler();

	@Test
	void convertsSimpleDeclarations() {
		ConversionResult result = transpiler.convert("int x = 5;\nboolean flag = true;");

		assertTrue(result.success());
		assertEquals("X = 5\nFLAG = TRUE", result.pseudocode());
		assertTrue(result.errors().isEmpty());
		assertEquals(2, result.metadata().originalLines());
		assertEquals(2, result.metadata().convertedLines());
	}

	@Test
	void convertsLoopWithNestedIf() {
		String java = "for (int i = 0; i < 5; i++) {\n" +
				"    if (i % 2 == 0) {\n" +
				"        System.out.println(i);\n" +
				"    }\n" +
				"}\n";

		ConversionResult result = transpiler.convert(java);

		assertEquals("loop I from 0 to 4\n" +
				"  if I mod 2 = 0 then\n" +
				"    output I\n" +
				"  end if\n" +
				"end loop", result.pseudocode());
		assertEquals(6, result.metadata().originalLines());
		assertEquals(5, result.metadata().convertedLines());
	}

	@Test
	void voidMethodsAreProceduresAndOthersFunctions() {
		String java = "void show(int v) { System.out.println(v); }\n" +
				"boolean isEven(int v) { return v % 2 == 0; }";

		String out = transpiler.convert(java).pseudocode();

		assertTrue(out.startsWith("PROCEDURE SHOW(V)\n  output V\nend PROCEDURE\n"));
		assertTrue(out.endsWith("FUNCTION IS_EVEN(V)\n  return V mod 2 = 0\nend FUNCTION"));
	}

	@Test
	void emptyInputFails() {
		ConversionResult result = transpiler.convert("");

		assertFalse(result.success());
		assertEquals("// Conversion failed: " + Transpiler.NOTHING_GENERATED, result.pseudocode());
		assertEquals(1, result.errors().size());
		assertEquals(0, result.metadata().originalLines());
		assertEquals(1, result.metadata().convertedLines());
	}

	@Test
	void syntaxErrorKeepsTheRestOfTheOutput() {
		ConversionResult result = transpiler.convert("int x = ;\nint y = 2;");

		assertFalse(result.success());
		assertEquals("Y = 2", result.pseudocode());
		Diagnostic error = result.errors().get(0);
		assertEquals(DiagnosticKind.SYNTAX, error.kind());
		assertEquals("1:9: error syntax: Expected an expression but found ';'", error.format());
	}

	@Test
	void onlyBrokenInputReportsFirstErrorAsPlaceholder() {
		ConversionResult result = transpiler.convert("int x = ;");

		assertFalse(result.success());
		assertEquals("// Conversion failed: Expected an expression but found ';'", result.pseudocode());
		assertEquals(2, result.errors().size());
	}

	@Test
	void lexicalWarningDoesNotFailConversion() {
		ConversionResult result = transpiler.convert("int x = 1; /* open");

		assertTrue(result.success());
		assertEquals("X = 1\n// open", result.pseudocode());
		assertEquals(1, result.warnings().size());
		assertEquals(Severity.WARNING, result.warnings().get(0).severity());
		assertEquals(DiagnosticKind.LEXICAL, result.warnings().get(0).kind());
	}

	@Test
	void badCharacterIsAnError() {
		ConversionResult result = transpiler.convert("int x = 1; #");

		assertFalse(result.success());
		assertEquals("X = 1", result.pseudocode());
		assertEquals(DiagnosticKind.LEXICAL, result.errors().get(0).kind());
	}

	@Test
	void infoDiagnosticsGoToWarnings() {
		ConversionResult result = transpiler.convert("while (a) { continue; }");

		assertTrue(result.success());
		assertEquals(Severity.INFO, result.warnings().get(0).severity());
	}

	@Test
	void deepIfNestingClosesEveryLevel() {
		int depth = 10;
		String java = "if (a) { ".repeat(depth) + "x = 1;" + " }".repeat(depth);

		String out = transpiler.convert(java).pseudocode();

		String[] lines = out.split("\n");
		assertEquals(2 * depth + 1, lines.length);
		assertEquals("end if", lines[lines.length - 1]);
		assertEquals("  ".repeat(depth) + "X = 1", lines[depth]);
	}

	@Test
	void longOperatorChainConverts() {
		String java = "int x = " + "1 + ".repeat(20000) + "1;";

		ConversionResult result = transpiler.convert(java);

		assertTrue(result.success());
		assertTrue(result.pseudocode().startsWith("X = 1 + 1 + 1"));
		assertTrue(result.pseudocode().endsWith("+ 1"));
	}

	@Test
	void longDivisionChainStaysInteger() {
		String java = "int x = " + "8 / ".repeat(5000) + "2;";

		ConversionResult result = transpiler.convert(java);

		assertTrue(result.success());
		assertTrue(result.pseudocode().startsWith("X = 8 div 8 div"));
	}

	@Test
	void deeplyNestedArrayInitializerFailsCleanly() {
		String java = "int[] a = " + "{".repeat(5000) + "}".repeat(5000) + ";";

		ConversionResult result = transpiler.convert(java);

		assertFalse(result.success());
		assertTrue(result.errors().get(0).message().startsWith("Nesting is too deep"));
	}

	@Test
	void deeplyNestedParenthesesFailCleanly() {
		String java = "x = " + "(".repeat(300) + "1" + ")".repeat(300) + ";";

		ConversionResult result = transpiler.convert(java);

		assertFalse(result.success());
		assertTrue(result.errors().get(0).message().startsWith("Nesting is too deep"));
	}

	@Test
	void honoursOptions() {
		ConversionOptions options = ConversionOptions.defaults()
				.withIndent(1, '\t')
				.withPreserveComments(false);

		String out = transpiler.convert("// gone\nwhile (a) { b = 1; }", options).pseudocode();

		assertEquals("loop while A\n\tB = 1\nend loop", out);
	}

	@Test
	void countsLinesAcrossLineEndings() {
		assertEquals(0, Transpiler.countLines(""));
		assertEquals(1, Transpiler.countLines("a"));
		assertEquals(3, Transpiler.countLines("a\r\nb\rc"));
		assertEquals(2, Transpiler.countLines("a\n"));
	}

	@Test
	void concurrentConversionsAreIndependent() throws Exception {
		List<String> sources = List.of(
				"int x = 5;",
				"for (int i = 0; i < 3; i++) { total += i; }",
				"if (a != b) { System.out.println(a); } else { b = a; }",
				"switch (d) { case 1: x = 2; break; default: x = 3; }");
		List<String> expected = new ArrayList<>();
		for (String s : sources) {
			expected.add(transpiler.convert(s).pseudocode());
		}

		ExecutorService pool = Executors.newFixedThreadPool(4);
		try {
			List<Future<String>> futures = new ArrayList<>();
			for (int round = 0; round < 25; round++) {
				for (String s : sources) {
					futures.add(pool.submit(() -> transpiler.convert(s).pseudocode()));
				}
			}
			for (int i = 0; i < futures.size(); i++) {
				assertEquals(expected.get(i % sources.size()), futures.get(i).get());
			}
		} finally {
			pool.shutdownNow();
		}
	}
}
