package verilite.preprocess;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import verilite.CompilationSession;
import verilite.ErrorKind;
import verilite.PreprocessException;
import verilite.symbols.SymbolTable;

/**
 * Whole-source pass run before any line is transformed.
 *
 * Phase 1 resolves constants: {@code %%NAME = text} stores text verbatim,
 * {@code %=NAME = expr} stores the evaluated result, and every other
 * {@code %%NAME} / {@code %=NAME} (optionally closed by {@code %}) is replaced
 * by the stored value. Phase 2 expands {@code %-=} loop marker pairs.
 */
public final class Preprocessor {
	private static final Logger logger = LogManager.getLogger();

	static final String LITERAL_MARKER = "%%";
	static final String EVALUATED_MARKER = "%=";
	static final String LOOP_MARKER = "%-=";

	private static final Pattern REFERENCE = Pattern.compile("%[%=]([A-Za-z_]\\w*)%?");
	private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_]\\w*");

	private final SymbolTable symbols;
	private final ConstantPolicy policy;
	private final Map<String, Value> evaluated = new HashMap<>();

	public Preprocessor(CompilationSession session) {
		this.symbols = session.symbols();
		this.policy = session.options().constantPolicy();
	}

	public String preprocess(String source) throws PreprocessException {
		List<String> lines = List.of(source.split("\\R", -1));
		List<String> resolved = resolveConstants(lines);
		List<String> expanded = expandLoops(resolved);
		return String.join("\n", expanded).strip();
	}

	List<String> resolveConstants(List<String> lines) throws PreprocessException {
		List<String> out = new ArrayList<>();
		for (int i = 0; i < lines.size(); i++) {
			String line = lines.get(i);
			try {
				if (tryDefine(line)) {
					continue;
				}
				String substituted = substitute(line);
				if (substituted.isBlank() && !line.isBlank()) {
					continue;
				}
				out.add(substituted);
			} catch (PreprocessException e) {
				e.atLine(i + 1);
				throw e;
			}
		}
		return out;
	}

	/** Returns true when {@code line} was a constant definition and must be dropped. */
	private boolean tryDefine(String line) throws PreprocessException {
		String stripped = line.strip();
		boolean literal = stripped.startsWith(LITERAL_MARKER);
		boolean evaluated = stripped.startsWith(EVALUATED_MARKER);
		int eq = stripped.indexOf('=', 2);
		if ((!literal && !evaluated) || eq < 0) {
			return false;
		}
		String name = stripped.substring(2, eq).strip();
		if (!IDENTIFIER.matcher(name).matches()) {
			return false;
		}
		String rhs = substitute(stripped.substring(eq + 1)).strip();
		Value result = literal ? null : evaluator().evaluate(rhs);
		String value = literal ? rhs : result.render();
		if (policy == ConstantPolicy.REJECT && symbols.hasConstant(name)) {
			throw new PreprocessException(ErrorKind.NAME_COLLISION, "constant '" + name + "' is already defined");
		}
		symbols.defineConstant(name, value);
		if (literal) {
			this.evaluated.remove(name);
		} else {
			this.evaluated.put(name, result);
		}
		logger.debug("Defined constant {} = {}", name, value);
		return true;
	}

	/** Evaluated constants resolve to their typed value, literal ones through their text. */
	private ExpressionEvaluator evaluator() {
		return new ExpressionEvaluator(symbols::constant, evaluated);
	}

	private String substitute(String line) throws PreprocessException {
		Matcher m = REFERENCE.matcher(line);
		StringBuilder out = new StringBuilder();
		while (m.find()) {
			String name = m.group(1);
			String value = symbols.constant(name).orElseThrow(
					() -> new PreprocessException(ErrorKind.UNDEFINED_CONSTANT, "undefined constant '" + name + "'"));
			m.appendReplacement(out, Matcher.quoteReplacement(value));
		}
		m.appendTail(out);
		return out.toString();
	}

	List<String> expandLoops(List<String> lines) throws PreprocessException {
		List<Integer> markers = new ArrayList<>();
		for (int i = 0; i < lines.size(); i++) {
			if (lines.get(i).strip().startsWith(LOOP_MARKER)) {
				markers.add(i);
			}
		}
		if (markers.size() % 2 != 0) {
			PreprocessException e = new PreprocessException(ErrorKind.UNMATCHED_LOOP_MARKER,
					markers.size() + " loop markers found, they must come in pairs");
			e.atLine(markers.get(markers.size() - 1) + 1);
			throw e;
		}

		List<String> out = new ArrayList<>();
		int cursor = 0;
		for (int k = 0; k < markers.size(); k += 2) {
			int open = markers.get(k);
			int close = markers.get(k + 1);
			out.addAll(lines.subList(cursor, open));
			try {
				out.addAll(expandLoop(lines.get(open), lines.get(close), lines.subList(open + 1, close)));
			} catch (PreprocessException e) {
				e.atLine(close + 1);
				throw e;
			}
			cursor = close + 1;
		}
		out.addAll(lines.subList(cursor, lines.size()));
		return out;
	}

	private List<String> expandLoop(String openLine, String closeLine, List<String> body) throws PreprocessException {
		String placeholder = openLine.strip().substring(LOOP_MARKER.length()).strip();
		if (!IDENTIFIER.matcher(placeholder).matches()) {
			throw new PreprocessException(ErrorKind.INVALID_EXPRESSION,
					"loop placeholder must be an identifier but was '" + placeholder + "'");
		}
		String expression = closeLine.strip().substring(LOOP_MARKER.length()).strip();
		List<Value> values = evaluator().evaluate(expression).iterate();

		String token = "%" + placeholder + "%";
		List<String> out = new ArrayList<>();
		for (Value value : values) {
			for (String line : body) {
				out.add(line.replace(token, value.text()));
			}
		}
		logger.debug("Expanded loop {} over {} values ({} lines)", placeholder, values.size(), out.size());
		return out;
	}
}
