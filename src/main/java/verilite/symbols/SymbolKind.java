package verilite.symbols;

public enum SymbolKind {
	CONSTANT,
	MODULE,
	/** Ports and wires share one classification. */
	PORT_OR_WIRE,
	REGISTER,
	UNDEFINED
}
