package verilite.transform;

import verilite.ErrorKind;
import verilite.TransformException;
import verilite.parse.SourceSpan;

final class Widths {
	private Widths() {
	}

	static int parse(String digits, String owner) throws TransformException {
		if (digits.isEmpty() || !digits.chars().allMatch(Character::isDigit)) {
			throw new TransformException(ErrorKind.MISSING_WIDTH, owner + " needs a #<width>, got '#" + digits + "'");
		}
		int width;
		try {
			width = Integer.parseInt(digits);
		} catch (NumberFormatException e) {
			throw new TransformException(ErrorKind.MISSING_WIDTH, owner + " width " + digits + " is too large");
		}
		if (width < 1) {
			throw new TransformException(ErrorKind.MISSING_WIDTH, owner + " width must be positive");
		}
		return width;
	}

	static String range(int width) {
		return "[" + (width - 1) + ":0]";
	}

	static boolean isDigits(String text) {
		return !text.isEmpty() && text.chars().allMatch(Character::isDigit);
	}

	/**
	 * {@code text} with a single space added on each side where the
	 * neighbouring character of {@code span} is not already whitespace.
	 */
	static String padded(String line, SourceSpan span, String text) {
		StringBuilder sb = new StringBuilder();
		if (span.startOffset() > 0 && !Character.isWhitespace(line.charAt(span.startOffset() - 1))) {
			sb.append(' ');
		}
		sb.append(text);
		if (span.endOffset() < line.length() && !Character.isWhitespace(line.charAt(span.endOffset()))) {
			sb.append(' ');
		}
		return sb.toString();
	}

	/** {@code span} widened to swallow the whitespace in front of it. */
	static SourceSpan withLeadingSpace(String line, SourceSpan span) {
		int start = span.startOffset();
		while (start > 0 && Character.isWhitespace(line.charAt(start - 1))) {
			start--;
		}
		return new SourceSpan(start, span.endOffset());
	}
}
