package verilite.parse;

public enum LineTokenType {
	IDENT,
	NUMBER,
	STRING,
	/** {@code '0101}: apostrophe followed by a run of binary digits. */
	BIT_LITERAL,
	/** {@code #8}, {@code #integer} or a bare {@code #}. */
	ANNOTATION,
	/** {@code %!name}. */
	MACRO,
	COMMENT,
	SYMBOL,
	EOF
}
