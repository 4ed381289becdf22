package verilite;

import java.util.List;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import verilite.preprocess.Preprocessor;
import verilite.transform.LineTransformer;

/**
 * Public entrypoint for Verilite -> Verilog compilation.
 *
 * Every call runs on a fresh {@link CompilationSession}, so one instance can
 * compile any number of independent sources.
 */
public final class Compiler {
	private static final Logger logger = LogManager.getLogger();

	private final CompilerOptions options;

	public Compiler() {
		this(CompilerOptions.load());
	}

	public Compiler(CompilerOptions options) {
		this.options = options;
	}

	public String compile(String source) throws CompileException {
		if (source == null) {
			throw new IllegalArgumentException("source is required");
		}
		CompilationSession session = new CompilationSession(options);
		String expanded = new Preprocessor(session).preprocess(source);
		List<String> lines = new LineTransformer(session, expanded).transformAll();
		logger.debug("Compiled {} lines, {} module(s)", lines.size(), session.symbols().moduleCount());
		return String.join("\n", lines) + "\n";
	}
}
