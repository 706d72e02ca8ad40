package ibpseudo.cli;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class MainTest {
	private final StringWriter out = new StringWriter();
	private final StringWriter err = new StringWriter();

	private int run(String... args) {
		CommandLine cmd = Main.commandLine();
		cmd.setOut(new PrintWriter(out));
		cmd.setErr(new PrintWriter(err));
		return cmd.execute(args);
	}

	@Test
	void convertsFileToStdout(@TempDir Path dir) throws Exception {
		Path file = dir.resolve("A.java");
		Files.writeString(file, "int x = 5;\nwhile (x > 0) { x--; }");

		int code = run(file.toString());

		assertEquals(Main.EXIT_OK, code);
		assertEquals("X = 5\nloop while X > 0\n  X = X - 1\nend loop", out.toString().strip().replace("\r\n", "\n"));
		assertEquals("", err.toString());
	}

	@Test
	void writesOutputFileWithOptions(@TempDir Path dir) throws Exception {
		Path file = dir.resolve("A.java");
		Files.writeString(file, "// comment\nif (a != b) { ok = true; }");
		Path target = dir.resolve(Path.of("out", "A.ib"));

		int code = run("--tabs", "--indent-size", "1", "--no-comments", "--ascii-not-equals", "--lowercase-booleans",
				"-o", target.toString(), file.toString());

		assertEquals(Main.EXIT_OK, code);
		assertEquals("if A <> B then\n\tOK = true\nend if", Files.readString(target));
		assertEquals("", out.toString());
	}

	@Test
	void reportsConversionErrors(@TempDir Path dir) throws Exception {
		Path file = dir.resolve("Bad.java");
		Files.writeString(file, "int x = ;\nint y = 2;");

		int code = run(file.toString());

		assertEquals(Main.EXIT_CONVERSION_FAILED, code);
		assertTrue(out.toString().contains("Y = 2"));
		assertTrue(err.toString().contains("1:9: error syntax: Expected an expression but found ';'"));
	}

	@Test
	void convertsDirectory(@TempDir Path dir) throws Exception {
		Path src = dir.resolve("src");
		Files.createDirectories(src);
		Files.writeString(src.resolve("One.java"), "int a = 1;");
		Files.writeString(src.resolve("Two.java"), "int b = 2;");
		Path dest = dir.resolve("dest");

		int code = run(src.toString(), "-o", dest.toString());

		assertEquals(Main.EXIT_OK, code);
		assertTrue(out.toString().startsWith("Converted 2 file(s) into "));
		assertEquals("B = 2", Files.readString(dest.resolve("Two.ib")));
	}

	@Test
	void directoryWithBrokenFileFails(@TempDir Path dir) throws Exception {
		Path src = dir.resolve("src");
		Files.createDirectories(src);
		Files.writeString(src.resolve("Good.java"), "int a = 1;");
		Files.writeString(src.resolve("Broken.java"), "int x = ;");
		Path dest = dir.resolve("dest");

		int code = run(src.toString(), "-o", dest.toString());

		assertEquals(Main.EXIT_CONVERSION_FAILED, code);
		assertTrue(out.toString().startsWith("Converted 2 file(s) into "));
		assertTrue(err.toString().contains("1 of 2 file(s) failed to convert"));
		assertEquals("A = 1", Files.readString(dest.resolve("Good.ib")));
	}

	@Test
	void directoryHonoursMaxInputSize(@TempDir Path dir) throws Exception {
		Path src = dir.resolve("src");
		Files.createDirectories(src);
		Files.writeString(src.resolve("Big.java"), "int total = 123456789;");
		Path dest = dir.resolve("dest");

		int code = run("--max-input-size", "10", src.toString(), "-o", dest.toString());

		assertEquals(Main.EXIT_CONVERSION_FAILED, code);
		assertTrue(Files.readString(dest.resolve("Big.ib")).startsWith("// Conversion failed:"));
	}

	@Test
	void directoryNeedsOutput(@TempDir Path dir) {
		int code = run(dir.toString());

		assertEquals(Main.EXIT_USAGE, code);
		assertTrue(err.toString().startsWith("Usage error: --output is required"));
	}

	@Test
	void missingFileIsAnIoError(@TempDir Path dir) {
		int code = run(dir.resolve("Nope.java").toString());

		assertEquals(Main.EXIT_USAGE, code);
		assertTrue(err.toString().startsWith("I/O error: "));
	}

	@Test
	void rejectsOversizedInput(@TempDir Path dir) throws Exception {
		Path file = dir.resolve("Big.java");
		Files.writeString(file, "int x = 1;\n".repeat(10));

		int code = run("--max-input-size", "16", file.toString());

		assertEquals(Main.EXIT_USAGE, code);
		assertTrue(err.toString().contains("--max-input-size"));
	}

	@Test
	void unknownOptionIsUsageError() {
		int code = run("--bogus", "x.java");

		assertEquals(Main.EXIT_USAGE, code);
		assertFalse(err.toString().isEmpty());
	}

	@Test
	void negativeIndentIsRejected(@TempDir Path dir) throws Exception {
		Path file = dir.resolve("A.java");
		Files.writeString(file, "int x = 1;");

		assertEquals(Main.EXIT_USAGE, run("--indent-size", "-1", file.toString()));
	}

	@Test
	void buildsOptionsFromFlags() {
		Main main = new Main();
		new CommandLine(main).parseArgs("--flat-else-if", "--indent-size", "4", "in.java");

		assertTrue(main.options().style().flatElseIf());
		assertEquals(4, main.options().indentSize());
		assertTrue(main.options().preserveComments());
	}
}
