package ibpseudo;

import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class GoldenTranspileTest {
	@Test
	void convertsSampleJavaToExpectedPseudocode() throws Exception {
		Path javaSourcePath = Path.of("src", "test", "resources", "golden", "Sample.java");
		Path expectedPath = Path.of("src", "test", "resources", "golden", "Sample.ib");

		String javaSource = Files.readString(javaSourcePath);
		String expected = Files.readString(expectedPath);
		ConversionResult result = new Transpiler().convert(javaSource);

		assertTrue(result.success(), result.errors().toString());
		assertEquals(normalize(expected), normalize(result.pseudocode()));
	}

	private static String normalize(String s) {
		String normalized = s.replace("\r\n", "\n");
		if (!normalized.endsWith("\n")) {
			normalized += "\n";
		}
		return normalized;
	}
}
