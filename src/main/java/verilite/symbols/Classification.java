package verilite.symbols;

/**
 * Result of {@link SymbolTable#classify(String)}. {@code width} is only
 * meaningful for {@link SymbolKind#PORT_OR_WIRE} and {@link SymbolKind#REGISTER}.
 */
public record Classification(SymbolKind kind, int width) {
	public static final Classification CONSTANT = new Classification(SymbolKind.CONSTANT, 0);
	public static final Classification MODULE = new Classification(SymbolKind.MODULE, 0);
	public static final Classification UNDEFINED = new Classification(SymbolKind.UNDEFINED, 0);

	public static Classification wire(int width) {
		return new Classification(SymbolKind.PORT_OR_WIRE, width);
	}

	public static Classification register(int width) {
		return new Classification(SymbolKind.REGISTER, width);
	}

	public boolean isDefined() {
		return kind != SymbolKind.UNDEFINED;
	}

	public boolean isWire() {
		return kind == SymbolKind.PORT_OR_WIRE;
	}
}
