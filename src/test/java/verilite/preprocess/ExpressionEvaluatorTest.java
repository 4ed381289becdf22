package verilite.preprocess;

import org.junit.jupiter.api.Test;

import verilite.ErrorKind;
import verilite.PreprocessException;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class ExpressionEvaluatorTest {
	private static ExpressionEvaluator evaluator(Map<String, String> constants) {
		return new ExpressionEvaluator(name -> Optional.ofNullable(constants.get(name)));
	}

	private static Value eval(String expression) throws PreprocessException {
		return evaluator(Map.of()).evaluate(expression);
	}

	@Test
	void integerArithmeticFollowsPrecedence() throws Exception {
		assertEquals(new Value.Int(255), eval("2 ** 8 - 1"));
		assertEquals(new Value.Int(9), eval("(1 + 2) * 3"));
		assertEquals(new Value.Int(7), eval("1 + 2 * 3"));
		assertEquals(new Value.Int(16), eval("1 << 2 + 2"));
		assertEquals(new Value.Int(-8), eval("-2 ** 3"));
	}

	@Test
	void divisionFloors() throws Exception {
		assertEquals(new Value.Int(3), eval("7 / 2"));
		assertEquals(new Value.Int(-4), eval("-7 / 2"));
		assertEquals(new Value.Int(1), eval("-7 % 2"));
	}

	@Test
	void rangeBuildsSequences() throws Exception {
		assertEquals("[0, 1, 2]", eval("range(3)").render());
		assertEquals("[1, 3, 5]", eval("range(1, 7, 2)").render());
		assertEquals("[3, 2, 1]", eval("range(3, 0, -1)").render());
		assertEquals("[]", eval("range(0)").render());
	}

	@Test
	void plusConcatenatesSequencesAndStrings() throws Exception {
		assertEquals("[1, 2, 3]", eval("[1, 2] + [3]").render());
		assertEquals(new Value.Text("abcd"), eval("\"ab\" + \"cd\""));
	}

	@Test
	void builtins() throws Exception {
		assertEquals(new Value.Int(5), eval("len(range(5))"));
		assertEquals(new Value.Int(3), eval("len(\"abc\")"));
		assertEquals(new Value.Int(9), eval("max(3, 9, 4)"));
		assertEquals(new Value.Int(0), eval("min(range(4))"));
		assertEquals(new Value.Int(8), eval("clog2(256)"));
		assertEquals(new Value.Int(8), eval("clog2(255)"));
		assertEquals(new Value.Int(0), eval("clog2(1)"));
	}

	@Test
	void identifiersResolveThroughConstants() throws Exception {
		ExpressionEvaluator e = evaluator(Map.of("W", "8", "DOUBLE", "W * 2"));
		assertEquals(new Value.Int(17), e.evaluate("DOUBLE + 1"));
	}

	@Test
	void storedSequencesAreReparsable() throws Exception {
		String stored = eval("[\"a\", 1]").render();
		assertEquals("[\"a\", 1]", stored);

		Value again = evaluator(Map.of("PINS", stored)).evaluate("PINS");
		assertEquals(List.of(new Value.Text("a"), new Value.Int(1)), again.iterate());
	}

	@Test
	void integersIterateAsRange() throws Exception {
		assertEquals(List.of(new Value.Int(0), new Value.Int(1)), eval("2").iterate());
		assertEquals(List.of(new Value.Text("x")), eval("\"x\"").iterate());
	}

	@Test
	void trivialBasesTakeAnyExponent() throws Exception {
		assertEquals(new Value.Int(1), eval("1 ** 1000000000000"));
		assertEquals(new Value.Int(-1), eval("(-1) ** 1000000000001"));
		assertEquals(new Value.Int(1), eval("(-1) ** 1000000000000"));
		assertEquals(new Value.Int(0), eval("0 ** 5"));
		assertEquals(new Value.Int(1), eval("0 ** 0"));
	}

	@Test
	void shiftCountsUpToWordSize() throws Exception {
		assertEquals(new Value.Int(Long.MIN_VALUE), eval("1 << 63"));
		assertEquals(new Value.Int(0), eval("1 >> 63"));
	}

	@Test
	void typedValuesWinOverTheirText() throws Exception {
		ExpressionEvaluator e = new ExpressionEvaluator(name -> Optional.of("ab"), Map.of("S", new Value.Text("ab")));
		assertEquals(new Value.Text("abc"), e.evaluate("S + \"c\""));
	}

	@Test
	void unknownIdentifierIsUndefinedConstant() {
		PreprocessException e = assertThrows(PreprocessException.class, () -> eval("WIDTH + 1"));
		assertEquals(ErrorKind.UNDEFINED_CONSTANT, e.kind());
	}

	@Test
	void invalidExpressions() {
		for (String bad : List.of("1 / 0", "1 +", "", "(1", "\"a\" * 2", "len(3)", "nope(1)",
				"99999999999999999999", "2 ** -1", "range(1, 2, 0)",
				"1 << 64", "1 >> -1", "1 << 1000")) {
			PreprocessException e = assertThrows(PreprocessException.class, () -> eval(bad), bad);
			assertEquals(ErrorKind.INVALID_EXPRESSION, e.kind(), bad);
		}
	}

	@Test
	void selfReferenceIsRejected() {
		ExpressionEvaluator e = evaluator(Map.of("A", "B + 1", "B", "A"));
		PreprocessException ex = assertThrows(PreprocessException.class, () -> e.evaluate("A"));
		assertEquals(ErrorKind.INVALID_EXPRESSION, ex.kind());
	}
}
