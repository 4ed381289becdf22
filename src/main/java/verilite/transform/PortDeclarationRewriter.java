package verilite.transform;

import java.util.List;

import verilite.ErrorKind;
import verilite.TransformException;
import verilite.parse.LineLexer;
import verilite.parse.LineToken;
import verilite.parse.LineTokenType;
import verilite.symbols.Direction;
import verilite.symbols.SymbolTable;

/**
 * Rewrites one entry of a module port list, {@code #8 data,}, into an explicit
 * Verilog declaration and registers the port.
 *
 * The direction comes from the {@link DirectionOracle} unless the entry names
 * one itself ({@code output #8 data}). Entries already written in Verilog
 * ({@code input wire [7:0] data,}) pass through untouched.
 */
final class PortDeclarationRewriter {
	private final SymbolTable symbols;
	private final DirectionOracle oracle;

	PortDeclarationRewriter(SymbolTable symbols, DirectionOracle oracle) {
		this.symbols = symbols;
		this.oracle = oracle;
	}

	String rewrite(String entry, int lineIndex, boolean last) throws TransformException {
		List<LineToken> tokens = new LineLexer().lex(entry);
		int pos = 0;
		Direction explicit = null;
		LineToken first = tokens.get(0);
		if (first.type() == LineTokenType.IDENT && (first.lexeme().equals("input") || first.lexeme().equals("output"))) {
			explicit = first.lexeme().equals("input") ? Direction.INPUT : Direction.OUTPUT;
			pos++;
		}

		LineToken annotation = tokens.get(pos);
		if (annotation.type() != LineTokenType.ANNOTATION) {
			if (explicit != null || annotation.type() == LineTokenType.EOF) {
				return entry;
			}
			throw new TransformException(ErrorKind.MISSING_WIDTH,
					"port '" + annotation.lexeme() + "' needs a leading #<width>");
		}
		LineToken name = tokens.get(pos + 1);
		if (name.type() != LineTokenType.IDENT) {
			throw new TransformException(ErrorKind.MALFORMED_INPUT, "expected a port name after " + annotation.lexeme());
		}
		int width = Widths.parse(annotation.suffix(), "port '" + name.lexeme() + "'");
		int rest = pos + 2;
		if (tokens.get(rest).isSymbol(",")) {
			rest++;
		}
		if (tokens.get(rest).type() != LineTokenType.EOF) {
			throw new TransformException(ErrorKind.MALFORMED_INPUT,
					"unexpected '" + tokens.get(rest).lexeme() + "' after port '" + name.lexeme() + "'");
		}

		if (symbols.isTaken(name.lexeme())) {
			throw new TransformException(ErrorKind.NAME_COLLISION, "port '" + name.lexeme() + "' is already declared");
		}
		Direction direction = explicit != null ? explicit : oracle.inferDirection(name.lexeme(), lineIndex);
		symbols.declarePort(name.lexeme(), width, direction);

		String indent = entry.substring(0, first.span().startOffset());
		return indent + direction.keyword() + " wire " + Widths.range(width) + " " + name.lexeme() + (last ? "" : ",");
	}
}
