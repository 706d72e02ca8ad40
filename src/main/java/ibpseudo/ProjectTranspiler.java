package ibpseudo;

import ibpseudo.diag.Diagnostic;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Converts a tree of Java source files to a parallel tree of .ib files.
 *
 * Each input file produces one output file, even when its conversion fails; the failure is logged
 * and the best-effort text is written. Files over the size limit are not read and get a placeholder.
 */
public final class ProjectTranspiler {
	private static final Logger LOG = LoggerFactory.getLogger(ProjectTranspiler.class);

	private final Transpiler transpiler = new Transpiler();
	private final ConversionOptions options;
	private final long maxInputSize;

	/** Outcome of one tree conversion. */
	public record Summary(int files, int failed) {
		public boolean success() {
			return failed == 0;
		}
	}

	public ProjectTranspiler() {
		this(ConversionOptions.defaults());
	}

	public ProjectTranspiler(ConversionOptions options) {
		this(options, Long.MAX_VALUE);
	}

	public ProjectTranspiler(ConversionOptions options, long maxInputSize) {
		this.options = options;
		this.maxInputSize = maxInputSize;
	}

	public Summary transpileTree(Path javaRoot, Path outRoot) throws IOException {
		List<Path> sources;
		try (Stream<Path> paths = Files.walk(javaRoot)) {
			sources = paths
					.filter(Files::isRegularFile)
					.filter(p -> p.getFileName().toString().endsWith(".java"))
					.sorted()
					.collect(Collectors.toList());
		} catch (UncheckedIOException ex) {
			throw ex.getCause();
		}

		int failed = 0;
		for (Path javaFile : sources) {
			if (!transpileOne(javaRoot, outRoot, javaFile)) {
				failed++;
			}
		}
		return new Summary(sources.size(), failed);
	}

	private boolean transpileOne(Path javaRoot, Path outRoot, Path javaFile) throws IOException {
		Path rel = javaRoot.relativize(javaFile);
		String fileName = rel.getFileName().toString();
		String base = fileName.substring(0, fileName.length() - ".java".length());
		Path outRel = rel.getParent() == null ? Path.of(base + ".ib") : rel.getParent().resolve(base + ".ib");
		Path outFile = outRoot.resolve(outRel);

		Files.createDirectories(outFile.getParent());
		long size = Files.size(javaFile);
		if (size > maxInputSize) {
			LOG.warn("Skipped {}: {} bytes is over the limit of {}", rel, size, maxInputSize);
			Files.writeString(outFile, "// Conversion failed: input is " + size + " bytes, larger than the limit of "
					+ maxInputSize);
			return false;
		}
		ConversionResult result = transpiler.convert(Files.readString(javaFile), options);
		Files.writeString(outFile, result.pseudocode());

		if (result.success()) {
			LOG.info("Converted {} -> {}", rel, outRel);
		} else {
			LOG.warn("Converted {} -> {} with {} error(s); first: {}", rel, outRel, result.errors().size(),
					result.errors().stream().findFirst().map(Diagnostic::format).orElse("none"));
		}
		return result.success();
	}
}
