package verilite.transform;

import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import verilite.ErrorKind;
import verilite.TransformException;
import verilite.parse.LineLexer;
import verilite.parse.LineToken;
import verilite.parse.LineTokenType;
import verilite.symbols.Classification;
import verilite.symbols.SymbolTable;

/**
 * Declarations and the five assignment operators.
 *
 * <pre>
 * reg#8 q = 0      -&gt; reg [7:0] q = 0;
 * q &lt;- d           -&gt; q &lt;= d;
 * d -&gt; q           -&gt; q &lt;= d;
 * q = d            -&gt; q = d;
 * w := a &amp; b       -&gt; assign w = a &amp; b;
 * out ::= w        -&gt; assign out = w;
 * </pre>
 *
 * A statement may follow a case label, an inline {@code begin} or a control
 * header such as {@code if (en)}; an inline trailing {@code end} is kept. A
 * dialect operator whose statement cannot be parsed is an error; a plain
 * {@code =} line that does not parse is left alone as raw Verilog.
 */
final class AssignmentRewriter {
	private static final Set<String> OPERATORS = Set.of("<-", "->", "=", ":=", "::=");
	private static final Set<String> DECLARATION_KEYWORDS = Set.of("reg", "wire", "parameter");
	private static final Set<String> SIMPLE_PREFIXES = Set.of("else", "begin", "end");
	private static final Set<String> GUARDED_PREFIXES = Set.of("if", "while", "for", "repeat", "on");

	private static final String PREFIX = "(?<prefix>\\s*(?:.*\\bbegin\\s+|(?:default|[\\w']+)\\s*:\\s*)?)";
	private static final String TARGET = "(?<name>[A-Za-z_$][\\w$]*)(?<select>\\s*\\[[^\\]]*\\])?";
	private static final Pattern LEFT_TARGET = Pattern.compile("^" + PREFIX + TARGET + "\\s*$");
	private static final Pattern LEFT_EXPRESSION = Pattern.compile("^" + PREFIX + "(?<expr>.*?)\\s*$");
	private static final Pattern RIGHT_TARGET = Pattern.compile("^\\s*" + TARGET + "\\s*;?\\s*(?<end>\\bend)?\\s*$");
	private static final Pattern INLINE_END = Pattern.compile("^(?<expr>.*?)\\s*;?\\s*\\bend\\s*$");

	private final SymbolTable symbols;

	AssignmentRewriter(SymbolTable symbols) {
		this.symbols = symbols;
	}

	String rewrite(String code) throws TransformException {
		List<LineToken> tokens = new LineLexer().lex(code);
		String declared = rewriteDeclaration(code, tokens);
		if (declared != null) {
			return declared;
		}
		LineToken op = findOperator(tokens);
		if (op == null) {
			return code;
		}
		int start = statementStart(tokens, op);
		String prefix = code.substring(0, start);
		String left = code.substring(start, op.span().startOffset());
		String right = code.substring(op.span().endOffset());
		String rewritten;
		switch (op.lexeme()) {
			case "<-":
				rewritten = forward(left, right, " <= ");
				break;
			case "->":
				rewritten = reversed(left, right);
				break;
			case "=":
				rewritten = forward(left, right, " = ");
				break;
			default:
				rewritten = continuous(left, right, op.lexeme());
				break;
		}
		if (rewritten != null) {
			return prefix + rewritten;
		}
		// raw Verilog: a procedural '=' or an event trigger, -> ev;
		boolean trigger = op.lexeme().equals("->") && code.substring(0, op.span().startOffset()).isBlank();
		if (op.lexeme().equals("=") || trigger) {
			return code;
		}
		throw new TransformException(ErrorKind.MALFORMED_INPUT,
				"cannot parse the statement around '" + op.lexeme() + "': " + code.strip());
	}

	/**
	 * Offset where the assignment itself starts, past leading control
	 * constructs: {@code if (...)}, {@code else}, {@code on (...)},
	 * {@code begin}, {@code end} and inline comments.
	 */
	private static int statementStart(List<LineToken> tokens, LineToken op) {
		int pos = 0;
		while (tokens.get(pos) != op) {
			LineToken t = tokens.get(pos);
			if (t.type() == LineTokenType.COMMENT
					|| (t.type() == LineTokenType.IDENT && SIMPLE_PREFIXES.contains(t.lexeme()))) {
				pos++;
			} else if (t.type() == LineTokenType.IDENT && GUARDED_PREFIXES.contains(t.lexeme())
					&& tokens.get(pos + 1).isSymbol("(")) {
				int close = matchingParen(tokens, pos + 1);
				if (close < 0 || close >= tokens.indexOf(op)) {
					break;
				}
				pos = close + 1;
			} else if (t.is(LineTokenType.IDENT, "on") && tokens.get(pos + 1).type() == LineTokenType.NUMBER) {
				pos += 2;
			} else {
				break;
			}
		}
		return tokens.get(pos).span().startOffset();
	}

	private static int matchingParen(List<LineToken> tokens, int open) {
		int depth = 0;
		for (int j = open; j < tokens.size(); j++) {
			LineToken t = tokens.get(j);
			if (t.isSymbol("(")) {
				depth++;
			} else if (t.isSymbol(")") && --depth == 0) {
				return j;
			}
		}
		return -1;
	}

	/** {@code reg#8 name ...}, {@code wire#8 name ...}, {@code parameter#type name ...}; null otherwise. */
	private String rewriteDeclaration(String code, List<LineToken> tokens) throws TransformException {
		LineToken keyword = tokens.get(0);
		LineToken annotation = tokens.get(1);
		if ((keyword.is(LineTokenType.IDENT, "reg") || keyword.is(LineTokenType.IDENT, "wire"))
				&& annotation.type() == LineTokenType.IDENT && !annotation.lexeme().equals("signed")) {
			throw new TransformException(ErrorKind.MISSING_WIDTH,
					keyword.lexeme() + " '" + annotation.lexeme() + "' needs a #<width>");
		}
		if (keyword.type() != LineTokenType.IDENT || !DECLARATION_KEYWORDS.contains(keyword.lexeme())
				|| annotation.type() != LineTokenType.ANNOTATION
				|| annotation.span().startOffset() != keyword.span().endOffset()) {
			return null;
		}
		LineToken name = tokens.get(2);
		if (name.type() != LineTokenType.IDENT) {
			throw new TransformException(ErrorKind.MALFORMED_INPUT,
					"expected a name after " + keyword.lexeme() + annotation.lexeme());
		}
		String suffix = annotation.suffix();
		String type;
		switch (keyword.lexeme()) {
			case "reg": {
				int width = Widths.parse(suffix, "register '" + name.lexeme() + "'");
				symbols.declareRegister(name.lexeme(), width);
				type = Widths.range(width);
				break;
			}
			case "wire": {
				int width = Widths.parse(suffix, "wire '" + name.lexeme() + "'");
				symbols.declareWire(name.lexeme(), width);
				type = Widths.range(width);
				break;
			}
			default:
				if (suffix.isEmpty()) {
					throw new TransformException(ErrorKind.MISSING_TYPE,
							"parameter '" + name.lexeme() + "' needs a #<type> or #<width>");
				}
				type = Widths.isDigits(suffix) ? Widths.range(Widths.parse(suffix, "parameter '" + name.lexeme() + "'"))
						: suffix;
				symbols.declareParameter(name.lexeme(), suffix);
				break;
		}
		return code.substring(0, keyword.span().startOffset()) + keyword.lexeme() + " " + type + " "
				+ code.substring(name.span().startOffset());
	}

	private String forward(String left, String right, String operator) throws TransformException {
		Matcher target = LEFT_TARGET.matcher(left);
		if (!target.matches()) {
			return null;
		}
		requireDeclared(target.group("name"));
		return target.group("prefix") + target.group("name") + select(target) + operator + statement(right);
	}

	private String reversed(String left, String right) throws TransformException {
		Matcher target = RIGHT_TARGET.matcher(right);
		Matcher source = LEFT_EXPRESSION.matcher(left);
		if (!target.matches() || !source.matches() || source.group("expr").isEmpty()) {
			return null;
		}
		requireDeclared(target.group("name"));
		String tail = target.group("end") != null ? " end" : "";
		return source.group("prefix") + target.group("name") + select(target) + " <= " + source.group("expr") + ";"
				+ tail;
	}

	private String continuous(String left, String right, String operator) throws TransformException {
		Matcher target = LEFT_TARGET.matcher(left);
		if (!target.matches()) {
			return null;
		}
		String name = target.group("name");
		Classification c = symbols.classify(name);
		if (!c.isDefined()) {
			throw new TransformException(ErrorKind.UNDEFINED_NAME, "'" + name + "' is not declared");
		}
		if (!c.isWire()) {
			throw new TransformException(ErrorKind.WRONG_KIND,
					"'" + name + "' is a " + c.kind() + ", " + operator + " needs a wire");
		}
		return target.group("prefix") + "assign " + name + select(target) + " = " + statement(right);
	}

	private void requireDeclared(String name) throws TransformException {
		if (!symbols.classify(name).isDefined()) {
			throw new TransformException(ErrorKind.UNDEFINED_NAME, "'" + name + "' is not declared");
		}
	}

	/** Right-hand side closed by a terminator, keeping an inline {@code end}. */
	private static String statement(String right) {
		Matcher inline = INLINE_END.matcher(right);
		if (inline.matches()) {
			return inline.group("expr").strip() + "; end";
		}
		String expr = right.strip();
		if (expr.endsWith(";")) {
			expr = expr.substring(0, expr.length() - 1).strip();
		}
		return expr + ";";
	}

	private static String select(Matcher target) {
		String select = target.group("select");
		return select == null ? "" : select.strip();
	}

	/** First assignment operator outside any bracket pair. */
	private static LineToken findOperator(List<LineToken> tokens) {
		int depth = 0;
		for (LineToken t : tokens) {
			if (t.type() != LineTokenType.SYMBOL) {
				continue;
			}
			switch (t.lexeme()) {
				case "(":
				case "[":
				case "{":
					depth++;
					break;
				case ")":
				case "]":
				case "}":
					depth--;
					break;
				default:
					if (depth == 0 && OPERATORS.contains(t.lexeme())) {
						return t;
					}
					break;
			}
		}
		return null;
	}
}
