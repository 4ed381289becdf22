package verilite.parse;

/**
 * Half-open character range of a token.
 *
 * Offsets are 0-based indices into the line the token was lexed from.
 */
public record SourceSpan(int startOffset, int endOffset) {
	public int length() {
		return endOffset - startOffset;
	}
}
