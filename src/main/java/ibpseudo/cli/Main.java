package ibpseudo.cli;

import ibpseudo.ConversionOptions;
import ibpseudo.ConversionResult;
import ibpseudo.ProjectTranspiler;
import ibpseudo.Transpiler;
import ibpseudo.diag.Diagnostic;
import ibpseudo.rules.BooleanCase;
import ibpseudo.rules.PseudocodeStyle;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Command-line front end.
 * <p>
 * Usage:
 * ibpseudo [options] &lt;file-or-directory | -&gt;
 * <p>
 * Exit codes: 0 converted, 1 conversion failed, 2 usage or I/O error.
 */
@Command(name = "ibpseudo", mixinStandardHelpOptions = true, version = "ibpseudo 1.0.0",
		description = "Converts Java source into IB Computer Science pseudocode")
public class Main implements Callable<Integer> {
	static final int EXIT_OK = 0;
	static final int EXIT_CONVERSION_FAILED = 1;
	static final int EXIT_USAGE = 2;

	@Spec
	private CommandSpec spec;

	@Parameters(index = "0", paramLabel = "<input>", description = "A .java file, a directory of them, or - for stdin")
	private String input;

	@Option(names = {"-o", "--output"}, paramLabel = "<path>",
			description = "Output file, or output directory when the input is a directory")
	private Path output;

	@Option(names = "--indent-size", paramLabel = "<n>", description = "Indent characters per level (default: 2)")
	private int indentSize = 2;

	@Option(names = "--tabs", description = "Indent with tabs instead of spaces")
	private boolean tabs;

	@Option(names = "--no-comments", description = "Drop source comments")
	private boolean noComments;

	@Option(names = "--lowercase-booleans", description = "Write true/false instead of TRUE/FALSE")
	private boolean lowercaseBooleans;

	@Option(names = "--ascii-not-equals", description = "Write <> instead of ≠")
	private boolean asciiNotEquals;

	@Option(names = "--flat-else-if", description = "Write else-if chains under a single end if")
	private boolean flatElseIf;

	@Option(names = "--max-input-size", paramLabel = "<bytes>", description = "Largest accepted input (default: 1048576)")
	private long maxInputSize = 1024 * 1024;

	@Override
	public Integer call() throws IOException {
		if (indentSize < 0) {
			throw new IllegalArgumentException("--indent-size must not be negative, got: " + indentSize);
		}
		ConversionOptions options = options();

		if (!input.equals("-") && Files.isDirectory(Path.of(input))) {
			if (output == null) {
				throw new IllegalArgumentException("--output is required when the input is a directory");
			}
			ProjectTranspiler.Summary summary = new ProjectTranspiler(options, maxInputSize)
					.transpileTree(Path.of(input), output);
			spec.commandLine().getOut().println("Converted " + summary.files() + " file(s) into " + output);
			if (!summary.success()) {
				PrintWriter err = spec.commandLine().getErr();
				err.println(summary.failed() + " of " + summary.files() + " file(s) failed to convert");
				err.flush();
				return EXIT_CONVERSION_FAILED;
			}
			return EXIT_OK;
		}

		String source = input.equals("-") ? readStdin() : readFile(Path.of(input));
		ConversionResult result = new Transpiler().convert(source, options);

		if (output != null) {
			Path parent = output.toAbsolutePath().getParent();
			if (parent != null) {
				Files.createDirectories(parent);
			}
			Files.writeString(output, result.pseudocode());
		} else {
			spec.commandLine().getOut().println(result.pseudocode());
		}

		PrintWriter err = spec.commandLine().getErr();
		for (Diagnostic d : result.errors()) {
			err.println(d.format());
		}
		for (Diagnostic d : result.warnings()) {
			err.println(d.format());
		}
		err.flush();
		return result.success() ? EXIT_OK : EXIT_CONVERSION_FAILED;
	}

	ConversionOptions options() {
		PseudocodeStyle style = PseudocodeStyle.defaults()
				.withBooleanCase(lowercaseBooleans ? BooleanCase.LOWER : BooleanCase.UPPER)
				.withFlatElseIf(flatElseIf);
		if (asciiNotEquals) {
			style = style.withAsciiNotEquals();
		}
		return ConversionOptions.defaults()
				.withPreserveComments(!noComments)
				.withIndent(indentSize, tabs ? '\t' : ' ')
				.withStyle(style);
	}

	private String readFile(Path file) throws IOException {
		long size = Files.size(file);
		if (size > maxInputSize) {
			throw new IllegalArgumentException("Input is " + size + " bytes, larger than --max-input-size " + maxInputSize);
		}
		return Files.readString(file);
	}

	private String readStdin() throws IOException {
		InputStream in = System.in;
		byte[] bytes = in.readNBytes((int) Math.min(Integer.MAX_VALUE - 8, maxInputSize + 1));
		if (bytes.length > maxInputSize) {
			throw new IllegalArgumentException("Input is larger than --max-input-size " + maxInputSize);
		}
		return new String(bytes, StandardCharsets.UTF_8);
	}

	static CommandLine commandLine() {
		CommandLine cmd = new CommandLine(new Main());
		cmd.setExecutionExceptionHandler((ex, commandLine, parseResult) -> {
			if (ex instanceof IllegalArgumentException) {
				commandLine.getErr().println("Usage error: " + ex.getMessage());
				return EXIT_USAGE;
			}
			if (ex instanceof IOException) {
				commandLine.getErr().println("I/O error: " + ex.getMessage());
				return EXIT_USAGE;
			}
			throw ex;
		});
		cmd.setParameterExceptionHandler((ex, args) -> {
			CommandLine c = ex.getCommandLine();
			c.getErr().println(ex.getMessage());
			CommandLine.UnmatchedArgumentException.printSuggestions(ex, c.getErr());
			c.getErr().print(c.getUsageMessage());
			return EXIT_USAGE;
		});
		return cmd;
	}

	public static void main(String[] args) {
		System.exit(commandLine().execute(args));
	}
}
