package verilite.symbols;

public enum Direction {
	INPUT("input"),
	OUTPUT("output");

	private final String keyword;

	Direction(String keyword) {
		this.keyword = keyword;
	}

	/** Verilog keyword for this direction. */
	public String keyword() {
		return keyword;
	}
}
