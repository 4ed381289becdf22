package verilite;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Compiles a tree of .vlt sources to a parallel tree of .v files.
 *
 * Important: this does NOT merge modules; each input file produces one output file.
 */
public final class ProjectCompiler {
	private static final Logger logger = LogManager.getLogger();

	public static final String SOURCE_EXTENSION = ".vlt";
	public static final String TARGET_EXTENSION = ".v";

	private final Compiler compiler;

	public ProjectCompiler(Compiler compiler) {
		this.compiler = compiler;
	}

	/** Returns the number of files compiled. */
	public int compileTree(Path sourceRoot, Path outRoot) throws IOException, CompileException {
		List<Path> sources;
		try (Stream<Path> paths = Files.walk(sourceRoot)) {
			sources = paths
					.filter(Files::isRegularFile)
					.filter(p -> p.getFileName().toString().endsWith(SOURCE_EXTENSION))
					.sorted()
					.collect(Collectors.toList());
		}
		for (Path source : sources) {
			Path rel = sourceRoot.relativize(source);
			Path outRel = rel.getParent() == null ? Path.of(targetName(rel)) : rel.getParent().resolve(targetName(rel));
			compileFile(source, outRoot.resolve(outRel));
		}
		return sources.size();
	}

	public void compileFile(Path source, Path target) throws IOException, CompileException {
		String text = Files.readString(source);
		String verilog;
		try {
			verilog = compiler.compile(text);
		} catch (CompileException e) {
			logger.error("{}: {}", source, e.getMessage());
			throw e;
		}
		if (target.getParent() != null) {
			Files.createDirectories(target.getParent());
		}
		Files.writeString(target, verilog);
		logger.info("Compiled {} -> {}", source, target);
	}

	static String targetName(Path source) {
		String fileName = source.getFileName().toString();
		String base = fileName.endsWith(SOURCE_EXTENSION)
				? fileName.substring(0, fileName.length() - SOURCE_EXTENSION.length())
				: fileName;
		return base + TARGET_EXTENSION;
	}
}
