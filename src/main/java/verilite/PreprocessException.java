package verilite;

/**
 * Raised by constant resolution, expression evaluation and loop expansion.
 */
public class PreprocessException extends CompileException {
	public PreprocessException(ErrorKind kind, String message) {
		super(kind, message);
	}
}
