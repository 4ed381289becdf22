package verilite.transform;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import verilite.CompilationSession;
import verilite.ErrorKind;
import verilite.TransformException;
import verilite.parse.LineEditor;
import verilite.parse.LineLexer;
import verilite.parse.LineToken;
import verilite.parse.LineTokenType;
import verilite.symbols.SymbolTable;

/**
 * Rewrites the preprocessed source one line at a time.
 *
 * Each line runs through an ordered list of rules: passthrough and comment
 * tracking, statement termination, match and parameter keywords, module
 * headers and port lists, bit literals, braces, concatenations, assignments,
 * width annotations, timing blocks and escape macros. Lines must be fed in
 * source order; the transformer keeps nesting state and fills the session's
 * symbol table as declarations go by.
 */
public final class LineTransformer {
	public static final String PASSTHROUGH_MARKER = "%-%";

	private static final Pattern MODULE_HEADER = Pattern.compile("^\\s*module\\s+(?<name>[A-Za-z_]\\w*)(?<rest>.*)$");
	private static final Pattern MATCH_HEADER = Pattern.compile("^(?<indent>\\s*)match\\b\\s*(?<subject>.*?)\\s*(?<brace>\\{)?\\s*$");
	private static final Pattern PARAMETER_KEYWORD = Pattern.compile("^(\\s*)par(?=[#\\s])");
	private static final Set<String> OPEN_ENDED_KEYWORDS = Set.of(
			"module", "match", "case", "initial", "always", "begin", "end", "endcase", "endmodule");
	private static final Set<String> CONTROL_KEYWORDS = Set.of("if", "else", "for", "while", "repeat");

	private final SymbolTable symbols;
	private final boolean checkBalance;
	private final List<String> lines;
	private final CompilationContext context = new CompilationContext();
	private final PortDeclarationRewriter ports;
	private final BraceRewriter braces;
	private final AssignmentRewriter assignments;
	private final TimingRewriter timing;
	private final MacroRewriter macros = new MacroRewriter();
	private int nextLine;

	public LineTransformer(CompilationSession session, String expandedSource) {
		this.symbols = session.symbols();
		this.checkBalance = session.options().checkBalance();
		this.lines = List.of(expandedSource.split("\n", -1));
		DirectionOracle oracle = new DirectionOracle(lines, session.options().directionWindow());
		this.ports = new PortDeclarationRewriter(symbols, oracle);
		this.braces = new BraceRewriter(context);
		this.assignments = new AssignmentRewriter(symbols);
		this.timing = new TimingRewriter(symbols);
	}

	/** Transforms every line of the expanded source and checks the end state. */
	public List<String> transformAll() throws TransformException {
		List<String> out = new ArrayList<>(lines.size());
		for (String line : lines) {
			out.add(transformLine(line));
		}
		finish();
		return out;
	}

	public String transformLine(String line) throws TransformException {
		int index = nextLine++;
		try {
			return rewrite(line, index);
		} catch (TransformException e) {
			e.atLine(index + 1);
			throw e;
		}
	}

	/** Fails when a module, match, block, comment or passthrough region is still open. */
	public void finish() throws TransformException {
		if (!checkBalance || context.isBalanced()) {
			return;
		}
		String open;
		if (context.inPassthrough()) {
			open = "passthrough region";
		} else if (context.inComment()) {
			open = "block comment";
		} else if (context.inModuleHeader()) {
			open = "module port list";
		} else {
			open = context.innermost().name().toLowerCase() + " block";
		}
		TransformException e = new TransformException(ErrorKind.MALFORMED_INPUT, "unterminated " + open + " at end of input");
		e.atLine(nextLine);
		throw e;
	}

	public CompilationContext context() {
		return context;
	}

	private String rewrite(String line, int index) throws TransformException {
		String stripped = line.strip();
		if (stripped.equals(PASSTHROUGH_MARKER)) {
			context.togglePassthrough();
			return "";
		}
		if (context.inPassthrough()) {
			return line;
		}
		if (context.inComment()) {
			if (line.contains("*/")) {
				context.setInComment(false);
			}
			return line;
		}

		// split off the trailing comments; inline ones stay in the code as tokens
		List<LineToken> lineTokens = new LineLexer().lex(line);
		LineToken comment = trailingComment(lineTokens);
		int cut = comment == null ? line.length() : comment.span().startOffset();
		String code = stripTrailing(line.substring(0, cut));
		String tail = line.substring(code.length());
		boolean opensComment = comment != null && lineTokens.get(lineTokens.size() - 2).isUnterminatedBlockComment();
		if (code.isBlank()) {
			context.setInComment(opensComment);
			return line;
		}

		code = terminate(code);
		code = introduceMatch(code);
		code = PARAMETER_KEYWORD.matcher(code).replaceFirst("$1parameter");
		code = moduleHeader(code, index);
		code = bitLiterals(code);
		if (TimingRewriter.isHeader(code) && (code.contains("{") || TimingRewriter.isBareHeader(code))) {
			requireModule("on block");
			context.arm(FrameKind.CLOCKED);
		}
		code = braces.rewrite(code);
		code = concatenations(code);
		code = assignments.rewrite(code);
		code = annotations(code);
		code = timing.rewrite(code);
		code = macros.rewrite(code);

		context.setInComment(opensComment);
		return code + tail;
	}

	private String terminate(String code) {
		String stripped = code.strip();
		if (context.inModuleHeader() || stripped.startsWith("%") || stripped.startsWith("`")) {
			return code;
		}
		List<LineToken> tokens = new LineLexer().lex(stripped);
		for (LineToken t : tokens) {
			if (t.isSymbol(";")) {
				return code;
			}
		}
		char last = stripped.charAt(stripped.length() - 1);
		if ("{}([,:\\".indexOf(last) >= 0) {
			return code;
		}
		LineToken first = tokens.get(0);
		LineToken lastToken = tokens.get(tokens.size() - 2);
		if (first.type() == LineTokenType.IDENT) {
			if (OPEN_ENDED_KEYWORDS.contains(first.lexeme())) {
				return code;
			}
			if (CONTROL_KEYWORDS.contains(first.lexeme()) && last == ')') {
				return code;
			}
		}
		if (lastToken.is(LineTokenType.IDENT, "else") || TimingRewriter.isBareHeader(code)) {
			return code;
		}
		return code + ";";
	}

	private String introduceMatch(String code) throws TransformException {
		Matcher m = MATCH_HEADER.matcher(code);
		if (!m.matches()) {
			return code;
		}
		requireModule("match block");
		String subject = m.group("subject");
		if (!(subject.startsWith("(") && subject.endsWith(")"))) {
			subject = "(" + subject + ")";
		}
		context.arm(FrameKind.MATCH);
		return m.group("indent") + "case " + subject + (m.group("brace") != null ? " {" : "");
	}

	private String moduleHeader(String code, int index) throws TransformException {
		Matcher m = MODULE_HEADER.matcher(code);
		if (m.matches()) {
			if (context.isIn(FrameKind.MODULE) || context.inModuleHeader() || context.pending() == FrameKind.MODULE) {
				throw new TransformException(ErrorKind.MALFORMED_INPUT, "modules do not nest");
			}
			symbols.declareModule(m.group("name"));
			context.arm(FrameKind.MODULE);
			String rest = m.group("rest");
			int open = rest.indexOf('(');
			if (open >= 0 && rest.indexOf(')', open) < 0) {
				context.setInModuleHeader(true);
			}
			return code;
		}
		if (!context.inModuleHeader()) {
			return code;
		}

		int close = code.indexOf(')');
		String entry = close < 0 ? code : code.substring(0, close);
		String rest = close < 0 ? "" : code.substring(close);
		boolean last = close >= 0 || nextSignificantLineCloses(index);
		if (close >= 0) {
			context.setInModuleHeader(false);
		}
		if (entry.isBlank()) {
			return code;
		}
		return ports.rewrite(entry, index, last) + rest;
	}

	private boolean nextSignificantLineCloses(int index) {
		for (int i = index + 1; i < lines.size(); i++) {
			String s = lines.get(i).strip();
			if (s.isEmpty() || s.startsWith("//")) {
				continue;
			}
			return s.startsWith(")");
		}
		return false;
	}

	private static String bitLiterals(String code) {
		LineEditor editor = new LineEditor(code);
		for (LineToken t : new LineLexer().lex(code)) {
			if (t.type() == LineTokenType.BIT_LITERAL) {
				String bits = t.suffix();
				editor.replace(t.span(), bits.length() + "'b" + bits);
			}
		}
		return editor.isEmpty() ? code : editor.apply();
	}

	private static String concatenations(String code) {
		List<LineToken> tokens = new LineLexer().lex(code);
		boolean opens = tokens.stream().anyMatch(t -> t.isSymbol("<|"));
		boolean closes = tokens.stream().anyMatch(t -> t.isSymbol("|>"));
		if (!opens || !closes) {
			return code;
		}
		LineEditor editor = new LineEditor(code);
		for (LineToken t : tokens) {
			if (t.isSymbol("<|")) {
				editor.replace(t.span(), "{");
			} else if (t.isSymbol("|>")) {
				editor.replace(t.span(), "}");
			}
		}
		return editor.apply();
	}

	private static String annotations(String code) throws TransformException {
		LineEditor editor = new LineEditor(code);
		for (LineToken t : new LineLexer().lex(code)) {
			if (t.type() != LineTokenType.ANNOTATION) {
				continue;
			}
			String suffix = t.suffix();
			if (suffix.isEmpty()) {
				throw new TransformException(ErrorKind.MISSING_TYPE, "'#' must be followed by a width or a type");
			}
			String text = Widths.isDigits(suffix) ? Widths.range(Widths.parse(suffix, "annotation")) : suffix;
			editor.replace(t.span(), Widths.padded(code, t.span(), text));
		}
		return editor.isEmpty() ? code : editor.apply();
	}

	private void requireModule(String what) throws TransformException {
		if (!context.isIn(FrameKind.MODULE)) {
			throw new TransformException(ErrorKind.MALFORMED_INPUT, what + " outside of a module");
		}
	}

	/** First comment of the run of comments that ends the line, or null. */
	private static LineToken trailingComment(List<LineToken> tokens) {
		LineToken first = null;
		for (int i = tokens.size() - 2; i >= 0 && tokens.get(i).type() == LineTokenType.COMMENT; i--) {
			first = tokens.get(i);
		}
		return first;
	}

	private static String stripTrailing(String s) {
		int end = s.length();
		while (end > 0 && Character.isWhitespace(s.charAt(end - 1))) {
			end--;
		}
		return s.substring(0, end);
	}
}
