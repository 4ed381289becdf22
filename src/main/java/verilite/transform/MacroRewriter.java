package verilite.transform;

import java.util.ArrayList;
import java.util.List;

import verilite.ErrorKind;
import verilite.TransformException;
import verilite.parse.LineEditor;
import verilite.parse.LineLexer;
import verilite.parse.LineToken;
import verilite.parse.LineTokenType;
import verilite.parse.SourceSpan;

/**
 * Escape macros, {@code %!name(args)}:
 * {@code sleep(n)} is a delay statement, {@code display(...)} and
 * {@code finish()} map to the matching system tasks.
 */
final class MacroRewriter {
	String rewrite(String code) throws TransformException {
		List<LineToken> tokens = new LineLexer().lex(code);
		LineEditor editor = new LineEditor(code);
		for (int i = 0; i < tokens.size(); i++) {
			LineToken macro = tokens.get(i);
			if (macro.type() != LineTokenType.MACRO) {
				continue;
			}
			if (!tokens.get(i + 1).isSymbol("(")) {
				throw new TransformException(ErrorKind.UNKNOWN_MACRO, macro.lexeme() + " needs an argument list");
			}
			int close = matchingParen(tokens, i + 1);
			if (close < 0) {
				throw new TransformException(ErrorKind.MALFORMED_INPUT, "unclosed argument list of " + macro.lexeme());
			}
			int end = tokens.get(close).span().endOffset();
			if (tokens.get(close + 1).isSymbol(";")) {
				end = tokens.get(close + 1).span().endOffset();
			}
			String inner = code.substring(tokens.get(i + 1).span().endOffset(), tokens.get(close).span().startOffset());
			editor.replace(new SourceSpan(macro.span().startOffset(), end), expand(macro.suffix(), inner));
			i = close;
		}
		return editor.apply();
	}

	private static String expand(String name, String inner) throws TransformException {
		List<String> args = splitArguments(inner);
		switch (name) {
			case "sleep":
				requireArity(name, args, 1);
				return "#" + args.get(0) + ";";
			case "display":
				return "$display(" + String.join(", ", args) + ");";
			case "finish":
				requireArity(name, args, 0);
				return "$finish;";
			default:
				throw new TransformException(ErrorKind.UNKNOWN_MACRO, "unknown macro %!" + name);
		}
	}

	private static void requireArity(String name, List<String> args, int arity) throws TransformException {
		if (args.size() != arity) {
			throw new TransformException(ErrorKind.UNKNOWN_MACRO,
					"%!" + name + " takes " + arity + " argument(s), got " + args.size());
		}
	}

	private static int matchingParen(List<LineToken> tokens, int open) {
		int depth = 0;
		for (int j = open; j < tokens.size(); j++) {
			LineToken t = tokens.get(j);
			if (t.isSymbol("(")) {
				depth++;
			} else if (t.isSymbol(")")) {
				depth--;
				if (depth == 0) {
					return j;
				}
			}
		}
		return -1;
	}

	/** Top-level comma split; strings and nested parentheses stay intact. */
	private static List<String> splitArguments(String inner) {
		List<String> args = new ArrayList<>();
		if (inner.isBlank()) {
			return args;
		}
		int depth = 0;
		int start = 0;
		for (LineToken t : new LineLexer().lex(inner)) {
			if (t.isSymbol("(") || t.isSymbol("[") || t.isSymbol("{")) {
				depth++;
			} else if (t.isSymbol(")") || t.isSymbol("]") || t.isSymbol("}")) {
				depth--;
			} else if (t.isSymbol(",") && depth == 0) {
				args.add(inner.substring(start, t.span().startOffset()).strip());
				start = t.span().endOffset();
			}
		}
		args.add(inner.substring(start).strip());
		return args;
	}
}
