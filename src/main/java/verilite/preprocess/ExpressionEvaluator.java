package verilite.preprocess;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

import verilite.ErrorKind;
import verilite.PreprocessException;
import verilite.parse.LineLexer;
import verilite.parse.LineToken;
import verilite.parse.LineTokenType;

/**
 * Interpreter for the compile-time expression language of evaluated
 * constants and loop markers: 64-bit integer arithmetic, strings, sequences
 * and a handful of builtins ({@code range}, {@code len}, {@code min},
 * {@code max}, {@code clog2}).
 *
 * Bare identifiers resolve to previously defined constants: an evaluated
 * constant to the value it was given, a literal one by evaluating its text.
 */
public final class ExpressionEvaluator {
	private final Function<String, Optional<String>> constants;
	private final Map<String, Value> values;
	private final Set<String> resolving;

	public ExpressionEvaluator(Function<String, Optional<String>> constants) {
		this(constants, Map.of());
	}

	public ExpressionEvaluator(Function<String, Optional<String>> constants, Map<String, Value> values) {
		this(constants, values, new HashSet<>());
	}

	private ExpressionEvaluator(Function<String, Optional<String>> constants, Map<String, Value> values,
			Set<String> resolving) {
		this.constants = constants;
		this.values = values;
		this.resolving = resolving;
	}

	public Value evaluate(String expression) throws PreprocessException {
		List<LineToken> tokens = new LineLexer().lex(expression);
		Cursor c = new Cursor(tokens);
		if (c.isAtEnd()) {
			throw invalid("empty expression");
		}
		try {
			Value result = parseShift(c);
			if (!c.isAtEnd()) {
				throw invalid("unexpected '" + c.peek().lexeme() + "' in '" + expression + "'");
			}
			return result;
		} catch (ArithmeticException e) {
			throw invalid(e.getMessage() + " in '" + expression + "'");
		}
	}

	private Value parseShift(Cursor c) throws PreprocessException {
		Value left = parseAdditive(c);
		while (c.peekIsSymbol("<<") || c.peekIsSymbol(">>")) {
			String op = c.next().lexeme();
			long l = asInt(left, op);
			long r = asInt(parseAdditive(c), op);
			if (r < 0 || r >= Long.SIZE) {
				throw invalid("shift count " + r + " out of range 0.." + (Long.SIZE - 1));
			}
			left = new Value.Int(op.equals("<<") ? l << r : l >> r);
		}
		return left;
	}

	private Value parseAdditive(Cursor c) throws PreprocessException {
		Value left = parseTerm(c);
		while (c.peekIsSymbol("+") || c.peekIsSymbol("-")) {
			String op = c.next().lexeme();
			Value right = parseTerm(c);
			left = op.equals("+") ? add(left, right) : new Value.Int(Math.subtractExact(asInt(left, op), asInt(right, op)));
		}
		return left;
	}

	private Value parseTerm(Cursor c) throws PreprocessException {
		Value left = parseUnary(c);
		while (c.peekIsSymbol("*") || c.peekIsSymbol("/") || c.peekIsSymbol("%")) {
			String op = c.next().lexeme();
			long l = asInt(left, op);
			long r = asInt(parseUnary(c), op);
			switch (op) {
				case "*":
					left = new Value.Int(Math.multiplyExact(l, r));
					break;
				case "/":
					left = new Value.Int(Math.floorDiv(l, r));
					break;
				default:
					left = new Value.Int(Math.floorMod(l, r));
					break;
			}
		}
		return left;
	}

	private Value parseUnary(Cursor c) throws PreprocessException {
		if (c.peekIsSymbol("-")) {
			c.next();
			return new Value.Int(Math.negateExact(asInt(parseUnary(c), "-")));
		}
		return parsePower(c);
	}

	private Value parsePower(Cursor c) throws PreprocessException {
		Value base = parsePrimary(c);
		if (!c.peekIsSymbol("**")) {
			return base;
		}
		c.next();
		long b = asInt(base, "**");
		long e = asInt(parseUnary(c), "**");
		if (e < 0) {
			throw invalid("negative exponent " + e);
		}
		if (b == 0 || b == 1) {
			return new Value.Int(e == 0 ? 1 : b);
		}
		if (b == -1) {
			return new Value.Int(e % 2 == 0 ? 1 : -1);
		}
		// |b| >= 2 overflows within 63 rounds
		long result = 1;
		for (long i = 0; i < e; i++) {
			result = Math.multiplyExact(result, b);
		}
		return new Value.Int(result);
	}

	private Value parsePrimary(Cursor c) throws PreprocessException {
		LineToken t = c.next();
		switch (t.type()) {
			case NUMBER:
				try {
					return new Value.Int(Long.parseLong(t.lexeme()));
				} catch (NumberFormatException e) {
					throw invalid("integer literal out of range: " + t.lexeme());
				}
			case STRING:
				return new Value.Text(unquote(t.lexeme()));
			case IDENT:
				if (c.peekIsSymbol("(")) {
					return call(t.lexeme(), parseArguments(c, "(", ")"));
				}
				return resolve(t.lexeme());
			case SYMBOL:
				if (t.lexeme().equals("(")) {
					Value inner = parseShift(c);
					c.expectSymbol(")");
					return inner;
				}
				if (t.lexeme().equals("[")) {
					c.back();
					return new Value.Sequence(parseArguments(c, "[", "]"));
				}
				break;
			default:
				break;
		}
		throw invalid("unexpected '" + t.lexeme() + "'");
	}

	private List<Value> parseArguments(Cursor c, String open, String close) throws PreprocessException {
		c.expectSymbol(open);
		List<Value> args = new ArrayList<>();
		if (c.peekIsSymbol(close)) {
			c.next();
			return args;
		}
		while (true) {
			args.add(parseShift(c));
			if (c.peekIsSymbol(",")) {
				c.next();
				continue;
			}
			break;
		}
		c.expectSymbol(close);
		return args;
	}

	private Value resolve(String name) throws PreprocessException {
		Value value = values.get(name);
		if (value != null) {
			return value;
		}
		Optional<String> text = constants.apply(name);
		if (text.isEmpty()) {
			throw new PreprocessException(ErrorKind.UNDEFINED_CONSTANT, "undefined constant '" + name + "'");
		}
		if (!resolving.add(name)) {
			throw invalid("constant '" + name + "' refers to itself");
		}
		try {
			return new ExpressionEvaluator(constants, values, resolving).evaluate(text.get());
		} finally {
			resolving.remove(name);
		}
	}

	private Value call(String function, List<Value> args) throws PreprocessException {
		switch (function) {
			case "range":
				return range(args);
			case "len":
				requireArity(function, args, 1);
				Value v = args.get(0);
				if (v instanceof Value.Sequence s) {
					return new Value.Int(s.values().size());
				}
				if (v instanceof Value.Text t) {
					return new Value.Int(t.value().length());
				}
				throw invalid("len() of an integer");
			case "min":
			case "max":
				return extremum(function, args);
			case "clog2":
				requireArity(function, args, 1);
				long n = asInt(args.get(0), function);
				return new Value.Int(n <= 1 ? 0 : 64 - Long.numberOfLeadingZeros(n - 1));
			default:
				throw invalid("unknown function '" + function + "'");
		}
	}

	private Value range(List<Value> args) throws PreprocessException {
		if (args.isEmpty() || args.size() > 3) {
			throw invalid("range() takes 1 to 3 arguments");
		}
		long start = 0;
		long stop;
		long step = 1;
		if (args.size() == 1) {
			stop = asInt(args.get(0), "range");
		} else {
			start = asInt(args.get(0), "range");
			stop = asInt(args.get(1), "range");
			if (args.size() == 3) {
				step = asInt(args.get(2), "range");
			}
		}
		if (step == 0) {
			throw invalid("range() step must not be zero");
		}
		List<Value> values = new ArrayList<>();
		for (long i = start; step > 0 ? i < stop : i > stop; i += step) {
			values.add(new Value.Int(i));
		}
		return new Value.Sequence(values);
	}

	private Value extremum(String function, List<Value> args) throws PreprocessException {
		List<Value> items = args;
		if (args.size() == 1 && args.get(0) instanceof Value.Sequence s) {
			items = s.values();
		}
		if (items.isEmpty()) {
			throw invalid(function + "() of nothing");
		}
		long best = asInt(items.get(0), function);
		for (Value item : items) {
			long x = asInt(item, function);
			best = function.equals("min") ? Math.min(best, x) : Math.max(best, x);
		}
		return new Value.Int(best);
	}

	private Value add(Value left, Value right) throws PreprocessException {
		if (left instanceof Value.Sequence a && right instanceof Value.Sequence b) {
			List<Value> joined = new ArrayList<>(a.values());
			joined.addAll(b.values());
			return new Value.Sequence(joined);
		}
		if (left instanceof Value.Text a && right instanceof Value.Text b) {
			return new Value.Text(a.value() + b.value());
		}
		return new Value.Int(Math.addExact(asInt(left, "+"), asInt(right, "+")));
	}

	private static void requireArity(String function, List<Value> args, int arity) throws PreprocessException {
		if (args.size() != arity) {
			throw invalid(function + "() takes " + arity + " argument(s), got " + args.size());
		}
	}

	private static long asInt(Value value, String op) throws PreprocessException {
		if (value instanceof Value.Int i) {
			return i.value();
		}
		throw invalid("operator '" + op + "' expects an integer but got " + value.render());
	}

	private static String unquote(String lexeme) {
		String body = lexeme.length() >= 2 && lexeme.endsWith("\"") ? lexeme.substring(1, lexeme.length() - 1)
				: lexeme.substring(1);
		return body.replace("\\\"", "\"").replace("\\\\", "\\");
	}

	private static PreprocessException invalid(String message) {
		return new PreprocessException(ErrorKind.INVALID_EXPRESSION, message);
	}

	private static final class Cursor {
		private final List<LineToken> tokens;
		private int pos;

		Cursor(List<LineToken> tokens) {
			this.tokens = tokens;
			this.pos = 0;
		}

		boolean isAtEnd() {
			return peek().type() == LineTokenType.EOF;
		}

		LineToken peek() {
			return tokens.get(pos);
		}

		LineToken next() {
			LineToken t = tokens.get(pos);
			if (t.type() != LineTokenType.EOF) {
				pos++;
			}
			return t;
		}

		void back() {
			pos = Math.max(0, pos - 1);
		}

		boolean peekIsSymbol(String lexeme) {
			return peek().isSymbol(lexeme);
		}

		LineToken expectSymbol(String lexeme) throws PreprocessException {
			LineToken t = next();
			if (!t.isSymbol(lexeme)) {
				throw invalid("expected '" + lexeme + "' but got '" + t.lexeme() + "'");
			}
			return t;
		}
	}
}
