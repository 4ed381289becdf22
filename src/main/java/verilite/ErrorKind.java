package verilite;

/**
 * Fatal error categories. Every one of them aborts the compilation.
 */
public enum ErrorKind {
	UNMATCHED_LOOP_MARKER,
	UNDEFINED_CONSTANT,
	NAME_COLLISION,
	UNDEFINED_NAME,
	WRONG_KIND,
	MISSING_WIDTH,
	MISSING_TYPE,
	INVALID_EXPRESSION,
	UNKNOWN_MACRO,
	MALFORMED_INPUT
}
