package verilite;

/**
 * Base class of every failure raised while compiling a Verilite source.
 *
 * The line number is 1-based and refers to the expanded source; it is
 * attached by the stage that knows it, {@code 0} means unknown.
 */
public class CompileException extends Exception {
	private final ErrorKind kind;
	private int line;

	public CompileException(ErrorKind kind, String message) {
		super(message);
		this.kind = kind;
	}

	public ErrorKind kind() {
		return kind;
	}

	public int line() {
		return line;
	}

	public CompileException atLine(int line) {
		if (this.line == 0) {
			this.line = line;
		}
		return this;
	}

	@Override
	public String getMessage() {
		String base = kind + ": " + super.getMessage();
		return line > 0 ? "line " + line + ": " + base : base;
	}
}
