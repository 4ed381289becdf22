package verilite.transform;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import verilite.ErrorKind;
import verilite.TransformException;
import verilite.symbols.SymbolTable;

/**
 * {@code on (clk@posedge, rst@negedge)} becomes
 * {@code always @(posedge clk or negedge rst)}; {@code on 10} and
 * {@code on (10)} become {@code always #10}; {@code on (*)} stays
 * combinational.
 */
final class TimingRewriter {
	private static final Pattern HEADER = Pattern
			.compile("^(?<indent>\\s*)on\\b\\s*(?:\\((?<args>[^)]*)\\)|(?<delay>\\d+)\\b)(?<rest>.*)$");
	private static final Pattern TRIGGER = Pattern.compile("^(?<signal>[A-Za-z_$][\\w$]*)\\s*(?:@\\s*(?<edge>\\w*))?$");

	private final SymbolTable symbols;

	TimingRewriter(SymbolTable symbols) {
		this.symbols = symbols;
	}

	static boolean isHeader(String code) {
		return HEADER.matcher(code).matches();
	}

	/** True for a bare {@code on (...)} / {@code on N} with its block on a later line. */
	static boolean isBareHeader(String code) {
		Matcher m = HEADER.matcher(code);
		return m.matches() && m.group("rest").isBlank();
	}

	String rewrite(String code) throws TransformException {
		Matcher m = HEADER.matcher(code);
		if (!m.matches()) {
			return code;
		}
		String indent = m.group("indent");
		String rest = m.group("rest");
		String delay = m.group("delay");
		String args = m.group("args") == null ? null : m.group("args").strip();
		if (delay == null && args != null && Widths.isDigits(args)) {
			delay = args;
		}
		if (delay != null) {
			return indent + "always #" + delay + rest;
		}
		if (args.equals("*")) {
			return indent + "always @(*)" + rest;
		}
		return indent + "always @(" + sensitivityList(args) + ")" + rest;
	}

	private String sensitivityList(String args) throws TransformException {
		if (args.isEmpty()) {
			throw new TransformException(ErrorKind.MALFORMED_INPUT, "empty sensitivity list");
		}
		List<String> items = new ArrayList<>();
		for (String raw : args.split(",")) {
			Matcher t = TRIGGER.matcher(raw.strip());
			if (!t.matches()) {
				throw new TransformException(ErrorKind.MALFORMED_INPUT, "bad trigger '" + raw.strip() + "'");
			}
			String signal = t.group("signal");
			if (!symbols.classify(signal).isDefined()) {
				throw new TransformException(ErrorKind.UNDEFINED_NAME, "trigger signal '" + signal + "' is not declared");
			}
			String edge = t.group("edge");
			if (edge == null || edge.isEmpty()) {
				items.add(signal);
			} else if (edge.equals("posedge") || edge.equals("negedge")) {
				items.add(edge + " " + signal);
			} else {
				throw new TransformException(ErrorKind.MALFORMED_INPUT,
						"unknown edge '" + edge + "', expected posedge or negedge");
			}
		}
		return String.join(" or ", items);
	}
}
