package verilite.transform;

import org.junit.jupiter.api.Test;

import verilite.CompilationSession;
import verilite.CompilerOptions;
import verilite.ErrorKind;
import verilite.TransformException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class LineTransformerTest {
	private static List<String> transform(String... lines) throws TransformException {
		return transform(CompilerOptions.defaults(), lines);
	}

	private static List<String> transform(CompilerOptions options, String... lines) throws TransformException {
		CompilationSession session = new CompilationSession(options);
		return new LineTransformer(session, String.join("\n", lines)).transformAll();
	}

	private static ErrorKind failure(String... lines) {
		return assertThrows(TransformException.class, () -> transform(lines)).kind();
	}

	@Test
	void contextIsBalancedAfterCompleteModule() throws Exception {
		CompilationSession session = new CompilationSession(CompilerOptions.defaults());
		LineTransformer transformer = new LineTransformer(session, "module m {\n    on 5 {\n    }\n}");
		transformer.transformLine("module m {");
		transformer.transformLine("    on 5 {");
		assertEquals(FrameKind.CLOCKED, transformer.context().innermost());
		assertEquals(2, transformer.context().openFrames());
		transformer.transformLine("    }");
		transformer.transformLine("}");
		assertTrue(transformer.context().isBalanced());
		transformer.finish();
	}

	@Test
	void passthroughRegionIsCopiedVerbatim() throws Exception {
		assertEquals(List.of("", "foo <- bar {", ""), transform("%-%", "foo <- bar {", "%-%"));
	}

	@Test
	void blockCommentsAreCopiedVerbatim() throws Exception {
		List<String> lines = List.of("/* start", "   q <- d {", "*/");
		assertEquals(lines, transform(lines.toArray(new String[0])));
	}

	@Test
	void trailingCommentIsKeptAfterTheTerminator() throws Exception {
		assertEquals(
				List.of("module m;", "    reg [0:0] a = 1'b1; // init", "endmodule"),
				transform("module m {", "    reg#1 a = '1 // init", "}"));
	}

	@Test
	void explicitDirectionIsHonoured() throws Exception {
		assertEquals(
				List.of("module m(", "    output wire [3:0] data,", "    input wire [0:0] clk", ");", "endmodule"),
				transform("module m(", "    output #4 data,", "    #1 clk", ") {", "}"));
	}

	@Test
	void closingParenMayCarryTheLastPort() throws Exception {
		assertEquals(
				List.of("module m(", "    input wire [0:0] a,", "    input wire [1:0] b);", "endmodule"),
				transform("module m(", "    #1 a,", "    #2 b) {", "}"));
	}

	@Test
	void legacyWindowOnlySearchesBeforeFirstModule() throws Exception {
		String[] source = {
				"module a(", "    #1 led", ") {", "    led ::= 1", "}",
				"module b {", "}" };
		assertEquals("    output wire [0:0] led", transform(source).get(1));
		CompilerOptions legacy = CompilerOptions.defaults().withDirectionWindow(DirectionWindow.FIRST_MODULE_KEYWORD);
		assertEquals("    input wire [0:0] led", transform(legacy, source).get(1));
	}

	@Test
	void concatenationBecomesBraces() throws Exception {
		assertEquals("    assign w = {a, a};",
				transform("module m {", "    wire#4 w", "    reg#2 a", "    w := <|a, a|>", "}").get(3));
	}

	@Test
	void reversedAssignmentWithBitSelect() throws Exception {
		assertEquals("    q[3] <= d;",
				transform("module m {", "    reg#4 q", "    reg#1 d", "    d -> q[3]", "}").get(3));
	}

	@Test
	void timingHeaders() throws Exception {
		List<String> out = transform(
				"module m(",
				"    #1 a,",
				"    #1 b",
				") {",
				"    on (a, b) {",
				"    }",
				"    on (10) {",
				"    }",
				"    on (a@negedge)",
				"    {",
				"    }",
				"}");
		assertEquals("    always @(a or b) begin", out.get(4));
		assertEquals("    always #10 begin", out.get(6));
		assertEquals("    always @(negedge a)", out.get(8));
		assertEquals("    begin", out.get(9));
		assertEquals("    end", out.get(10));
	}

	@Test
	void macrosExpand() throws Exception {
		List<String> out = transform(
				"module tb {",
				"    initial {",
				"        %!display(\"v=%d\", 1 + 2)",
				"        %!sleep(10);",
				"        %!finish()",
				"    }",
				"}");
		assertEquals("        $display(\"v=%d\", 1 + 2);", out.get(2));
		assertEquals("        #10;", out.get(3));
		assertEquals("        $finish;", out.get(4));
	}

	@Test
	void rawVerilogPassesThrough() throws Exception {
		assertEquals("    assign x = y;", transform("module m {", "    assign x = y;", "}").get(1));
		assertEquals("    reg [7:0] mem;", transform("module m {", "    reg [7:0] mem", "}").get(1));
	}

	@Test
	void parameterKeywordAndTypes() throws Exception {
		List<String> out = transform("module m {", "    par#integer N = 4", "    par#8 MASK = 255", "}");
		assertEquals("    parameter integer N = 4;", out.get(1));
		assertEquals("    parameter [7:0] MASK = 255;", out.get(2));
	}

	@Test
	void assignmentAfterInlineCondition() throws Exception {
		List<String> out = transform(
				"module m(",
				"    #1 clk,",
				"    #1 en",
				") {",
				"    reg#1 q",
				"    on (clk@posedge) {",
				"        if (en) q <- ~q",
				"        else q <- q",
				"    }",
				"}");
		assertEquals("        if (en) q <= ~q;", out.get(6));
		assertEquals("        else q <= q;", out.get(7));
	}

	@Test
	void inlineConditionStillValidatesTheTarget() {
		assertEquals(ErrorKind.UNDEFINED_NAME, failure(
				"module m(", "    #1 en", ") {", "    initial {", "        if (en) ghost <- 1", "    }", "}"));
	}

	@Test
	void unparsableDialectAssignmentIsMalformed() {
		assertEquals(ErrorKind.MALFORMED_INPUT, failure("module m {", "    reg#1 q", "    q + 1 <- q", "}"));
		assertEquals(ErrorKind.MALFORMED_INPUT, failure("module m {", "    wire#2 w", "    w + 1 := 1", "}"));
	}

	@Test
	void eventTriggerPassesThrough() throws Exception {
		assertEquals("    -> done;", transform("module m {", "    -> done;", "}").get(1));
	}

	@Test
	void inlineBlockCommentStaysInsideTheStatement() throws Exception {
		List<String> out = transform(
				"module m {", "    wire#1 w", "    reg#1 a", "    reg#1 b", "    w := a /* note */ | b // tail", "}");
		assertEquals("    assign w = a /* note */ | b; // tail", out.get(4));
	}

	@Test
	void identifierStartingWithOnIsNotATimingHeader() throws Exception {
		CompilationSession session = new CompilationSession(CompilerOptions.defaults());
		LineTransformer transformer = new LineTransformer(session, "");
		transformer.transformLine("module m {");
		transformer.transformLine("    reg#1 on1");
		transformer.transformLine("    reg#1 x");
		assertEquals("    on1 = x;", transformer.transformLine("    on1 = x"));
		assertEquals(FrameKind.MODULE, transformer.context().innermost());
		assertEquals(1, transformer.context().openFrames());
	}

	@Test
	void declarationErrors() {
		assertEquals(ErrorKind.MISSING_WIDTH, failure("module m {", "    reg#0 a", "}"));
		assertEquals(ErrorKind.MISSING_WIDTH, failure("module m {", "    reg a", "}"));
		assertEquals(ErrorKind.MISSING_WIDTH, failure("module m {", "    wire#wide a", "}"));
		assertEquals(ErrorKind.MISSING_TYPE, failure("module m {", "    par# N = 1", "}"));
		assertEquals(ErrorKind.MISSING_TYPE, failure("module m {", "    x # y", "}"));
		assertEquals(ErrorKind.NAME_COLLISION, failure("module m {", "    reg#1 a", "    wire#1 a", "}"));
	}

	@Test
	void portErrors() {
		assertEquals(ErrorKind.MISSING_WIDTH, failure("module m(", "    data", ") {", "}"));
		assertEquals(ErrorKind.NAME_COLLISION, failure("module m(", "    #1 a,", "    #1 a", ") {", "}"));
	}

	@Test
	void assignmentErrors() {
		assertEquals(ErrorKind.UNDEFINED_NAME, failure("module m {", "    ghost = 1", "}"));
		assertEquals(ErrorKind.UNDEFINED_NAME, failure("module m {", "    1 -> ghost", "}"));
		assertEquals(ErrorKind.UNDEFINED_NAME, failure("module m {", "    ghost := 1", "}"));
		assertEquals(ErrorKind.WRONG_KIND, failure("module m {", "    reg#1 r", "    r := 1", "}"));
	}

	@Test
	void structuralErrors() {
		assertEquals(ErrorKind.MALFORMED_INPUT, failure("match (x) {", "}"));
		assertEquals(ErrorKind.MALFORMED_INPUT, failure("module a {", "module b {", "}", "}"));
		assertEquals(ErrorKind.MALFORMED_INPUT, failure("}"));
		assertEquals(ErrorKind.MALFORMED_INPUT, failure("%-%", "open"));
		assertEquals(ErrorKind.UNKNOWN_MACRO, failure("module m {", "    %!explode()", "}"));
		assertEquals(ErrorKind.UNDEFINED_NAME, failure("module m {", "    on (clk@posedge) {", "    }", "}"));
		assertEquals(ErrorKind.MALFORMED_INPUT,
				failure("module m(", "    #1 clk", ") {", "    on (clk@rising) {", "    }", "}"));
	}

	@Test
	void errorsCarryTheirLine() {
		TransformException e = assertThrows(TransformException.class,
				() -> transform("module m {", "", "    ghost <- 1", "}"));
		assertEquals(3, e.line());
	}

	@Test
	void unterminatedConstructIsReportedAtEnd() {
		TransformException e = assertThrows(TransformException.class,
				() -> transform("module m {", "    on 5 {"));
		assertEquals(ErrorKind.MALFORMED_INPUT, e.kind());
		assertEquals(2, e.line());
	}
}
