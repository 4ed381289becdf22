package verilite;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Command line entry point: {@code verilite <input.vlt|dir> [output.v|dir]}.
 */
public final class Main {
	private static final Logger logger = LogManager.getLogger();

	private Main() {
	}

	public static void main(String[] args) {
		System.exit(run(args));
	}

	static int run(String[] args) {
		if (args.length < 1 || args.length > 2) {
			System.err.println("Usage: verilite <input.vlt|dir> [output.v|dir]");
			return 2;
		}
		Path input = Path.of(args[0]);
		ProjectCompiler project = new ProjectCompiler(new Compiler());
		try {
			if (Files.isDirectory(input)) {
				Path output = args.length == 2 ? Path.of(args[1]) : input;
				int count = project.compileTree(input, output);
				logger.info("Compiled {} file(s) into {}", count, output);
			} else {
				Path output = args.length == 2 ? Path.of(args[1]) : input.resolveSibling(ProjectCompiler.targetName(input));
				project.compileFile(input, output);
			}
			return 0;
		} catch (CompileException e) {
			// already reported by ProjectCompiler
			return 1;
		} catch (IOException e) {
			logger.error("I/O failure: {}", e.getMessage());
			return 1;
		}
	}
}
