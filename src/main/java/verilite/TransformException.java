package verilite;

/**
 * Raised by the symbol table and the line rewrite rules.
 */
public class TransformException extends CompileException {
	public TransformException(ErrorKind kind, String message) {
		super(kind, message);
	}
}
