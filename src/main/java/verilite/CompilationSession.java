package verilite;

import verilite.symbols.SymbolTable;

/**
 * State owned by exactly one compilation: the options and the symbol table
 * that the preprocessor and the line transformer share.
 */
public final class CompilationSession {
	private final CompilerOptions options;
	private final SymbolTable symbols = new SymbolTable();

	public CompilationSession(CompilerOptions options) {
		this.options = options;
	}

	public CompilerOptions options() {
		return options;
	}

	public SymbolTable symbols() {
		return symbols;
	}
}
