package verilite.parse;

public record LineToken(LineTokenType type, String lexeme, SourceSpan span) {
	public boolean is(LineTokenType type, String lexeme) {
		return this.type == type && this.lexeme.equals(lexeme);
	}

	public boolean isSymbol(String lexeme) {
		return is(LineTokenType.SYMBOL, lexeme);
	}

	/** Payload of an annotation or macro token, without its prefix. */
	public String suffix() {
		return switch (type) {
			case ANNOTATION -> lexeme.substring(1);
			case MACRO -> lexeme.substring(2);
			case BIT_LITERAL -> lexeme.substring(1);
			default -> lexeme;
		};
	}

	public boolean isUnterminatedBlockComment() {
		return type == LineTokenType.COMMENT && lexeme.startsWith("/*")
				&& (lexeme.length() < 4 || !lexeme.endsWith("*/"));
	}
}
