package verilite.transform;

/**
 * Tag of a brace-delimited frame on the {@link CompilationContext} stack.
 */
public enum FrameKind {
	MODULE("endmodule"),
	MATCH("endcase"),
	CLOCKED("end"),
	PLAIN("end");

	private final String closeToken;

	FrameKind(String closeToken) {
		this.closeToken = closeToken;
	}

	public String closeToken() {
		return closeToken;
	}
}
