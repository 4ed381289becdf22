package verilite.parse;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Lexer for a single Verilite line, also used for constant and loop
 * expressions.
 *
 * Notes:
 * - Skips whitespace; spans let callers splice rewrites into the raw text.
 * - A block comment that does not close on the line runs to its end.
 * - String contents are opaque, so markers inside them are never rewritten.
 */
public final class LineLexer {
	private static final Set<String> TWO_CHAR_SYMBOLS = Set.of(
			":=", "<-", "->", "<|", "|>", "**", "<=", ">=", "==", "!=", "&&", "||", "<<", ">>");

	public List<LineToken> lex(String input) {
		List<LineToken> tokens = new ArrayList<>();
		int i = 0;
		while (i < input.length()) {
			char c = input.charAt(i);

			if (Character.isWhitespace(c)) {
				i++;
				continue;
			}

			// comments (must be checked before operators)
			if (c == '/' && i + 1 < input.length()) {
				char n = input.charAt(i + 1);
				if (n == '/') {
					tokens.add(token(LineTokenType.COMMENT, input, i, input.length()));
					i = input.length();
					continue;
				}
				if (n == '*') {
					int end = consumeBlockComment(input, i);
					tokens.add(token(LineTokenType.COMMENT, input, i, end));
					i = end;
					continue;
				}
			}

			if (c == '"') {
				int end = consumeQuoted(input, i);
				tokens.add(token(LineTokenType.STRING, input, i, end));
				i = end;
				continue;
			}

			if (c == '\'' && isBitStart(input, i)) {
				int end = i + 1;
				while (end < input.length() && isBit(input.charAt(end))) {
					end++;
				}
				tokens.add(token(LineTokenType.BIT_LITERAL, input, i, end));
				i = end;
				continue;
			}

			if (c == '#') {
				int end = i + 1;
				if (end < input.length() && Character.isDigit(input.charAt(end))) {
					while (end < input.length() && Character.isDigit(input.charAt(end))) {
						end++;
					}
				} else {
					end = consumeIdentifier(input, end);
				}
				tokens.add(token(LineTokenType.ANNOTATION, input, i, end));
				i = end;
				continue;
			}

			if (c == '%' && i + 2 < input.length() && input.charAt(i + 1) == '!'
					&& isIdentifierStart(input.charAt(i + 2))) {
				int end = consumeIdentifier(input, i + 2);
				tokens.add(token(LineTokenType.MACRO, input, i, end));
				i = end;
				continue;
			}

			if (isIdentifierStart(c)) {
				int end = consumeIdentifier(input, i);
				tokens.add(token(LineTokenType.IDENT, input, i, end));
				i = end;
				continue;
			}

			if (Character.isDigit(c)) {
				int end = i + 1;
				while (end < input.length() && Character.isDigit(input.charAt(end))) {
					end++;
				}
				tokens.add(token(LineTokenType.NUMBER, input, i, end));
				i = end;
				continue;
			}

			// multi-char symbols/operators
			if (input.startsWith("::=", i)) {
				tokens.add(token(LineTokenType.SYMBOL, input, i, i + 3));
				i += 3;
				continue;
			}
			String two = (i + 1 < input.length()) ? input.substring(i, i + 2) : "";
			if (TWO_CHAR_SYMBOLS.contains(two)) {
				tokens.add(token(LineTokenType.SYMBOL, input, i, i + 2));
				i += 2;
				continue;
			}

			tokens.add(token(LineTokenType.SYMBOL, input, i, i + 1));
			i++;
		}

		tokens.add(new LineToken(LineTokenType.EOF, "", new SourceSpan(input.length(), input.length())));
		return tokens;
	}

	private static LineToken token(LineTokenType type, String input, int start, int end) {
		return new LineToken(type, input.substring(start, end), new SourceSpan(start, end));
	}

	private static boolean isBitStart(String input, int i) {
		if (i + 1 >= input.length() || !isBit(input.charAt(i + 1))) {
			return false;
		}
		// 4'b0101 keeps its explicit size
		return i == 0 || !Character.isLetterOrDigit(input.charAt(i - 1));
	}

	private static boolean isBit(char c) {
		return c == '0' || c == '1';
	}

	private static boolean isIdentifierStart(char c) {
		return Character.isLetter(c) || c == '_' || c == '$';
	}

	private static int consumeIdentifier(String input, int start) {
		int i = start;
		while (i < input.length()) {
			char ch = input.charAt(i);
			if (Character.isLetterOrDigit(ch) || ch == '_' || ch == '$') {
				i++;
			} else {
				break;
			}
		}
		return i;
	}

	private static int consumeBlockComment(String input, int start) {
		int close = input.indexOf("*/", start + 2);
		return close < 0 ? input.length() : close + 2;
	}

	private static int consumeQuoted(String input, int start) {
		int i = start + 1;
		while (i < input.length()) {
			char c = input.charAt(i);
			if (c == '\\') {
				// skip escaped character if present
				i = Math.min(i + 2, input.length());
				continue;
			}
			if (c == '"') {
				return i + 1;
			}
			i++;
		}
		return i;
	}
}
