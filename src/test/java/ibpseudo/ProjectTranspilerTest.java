package ibpseudo;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ProjectTranspilerTest {
	@Test
	void mirrorsSourceTreeAsIbFiles(@TempDir Path dir) throws Exception {
		Path javaRoot = dir.resolve("java");
		Path outRoot = dir.resolve("ib");

		Path counterJava = javaRoot.resolve(Path.of("school", "loops", "Counter.java"));
		Path gradesJava = javaRoot.resolve(Path.of("school", "Grades.java"));
		Files.createDirectories(counterJava.getParent());

		Files.writeString(counterJava, "package school.loops;\n" +
				"class Counter { public static void main(String[] args) { for (int i = 0; i < 3; i++) { System.out.println(i); } } }\n");
		Files.writeString(gradesJava, "package school;\nint best = 0;\n");
		Files.writeString(javaRoot.resolve("notes.txt"), "not java");

		ProjectTranspiler.Summary summary = new ProjectTranspiler().transpileTree(javaRoot, outRoot);

		assertEquals(2, summary.files());
		assertTrue(summary.success());
		Path counterIb = outRoot.resolve(Path.of("school", "loops", "Counter.ib"));
		Path gradesIb = outRoot.resolve(Path.of("school", "Grades.ib"));
		assertTrue(Files.exists(counterIb), "expected Counter.ib to be generated");
		assertTrue(Files.exists(gradesIb), "expected Grades.ib to be generated");
		assertFalse(Files.exists(outRoot.resolve("notes.ib")));
		assertEquals("BEST = 0", Files.readString(gradesIb));
		assertTrue(Files.readString(counterIb).contains("loop I from 0 to 2"));
	}

	@Test
	void writesPlaceholderForBrokenFile(@TempDir Path dir) throws Exception {
		Path javaRoot = dir.resolve("java");
		Files.createDirectories(javaRoot);
		Files.writeString(javaRoot.resolve("Broken.java"), "int x = ;");

		ProjectTranspiler.Summary summary = new ProjectTranspiler().transpileTree(javaRoot, dir.resolve("out"));

		assertEquals(1, summary.files());
		assertEquals(1, summary.failed());
		assertTrue(Files.readString(dir.resolve(Path.of("out", "Broken.ib"))).startsWith("// Conversion failed:"));
	}

	@Test
	void skipsFilesOverTheSizeLimit(@TempDir Path dir) throws Exception {
		Path javaRoot = dir.resolve("java");
		Files.createDirectories(javaRoot);
		Files.writeString(javaRoot.resolve("Big.java"), "int total = 123456789;");
		Files.writeString(javaRoot.resolve("Small.java"), "int a = 1;");

		ProjectTranspiler.Summary summary = new ProjectTranspiler(ConversionOptions.defaults(), 12)
				.transpileTree(javaRoot, dir.resolve("out"));

		assertEquals(2, summary.files());
		assertEquals(1, summary.failed());
		assertFalse(summary.success());
		assertTrue(Files.readString(dir.resolve(Path.of("out", "Big.ib"))).startsWith("// Conversion failed: input is 22 bytes"));
		assertEquals("A = 1", Files.readString(dir.resolve(Path.of("out", "Small.ib"))));
	}
}
