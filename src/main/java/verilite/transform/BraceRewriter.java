package verilite.transform;

import verilite.TransformException;
import verilite.parse.LineEditor;
import verilite.parse.LineLexer;
import verilite.parse.LineToken;

/**
 * Maps braces to Verilog block delimiters.
 *
 * The brace that opens a module body turns the header into a statement, as
 * Verilog modules have no begin token. The brace that opens a match body
 * disappears; everything else becomes {@code begin}. Closing braces emit the
 * close token of the frame they pop.
 */
final class BraceRewriter {
	private final CompilationContext context;

	BraceRewriter(CompilationContext context) {
		this.context = context;
	}

	String rewrite(String code) throws TransformException {
		LineEditor editor = new LineEditor(code);
		for (LineToken t : new LineLexer().lex(code)) {
			if (t.isSymbol("{")) {
				FrameKind kind = context.open();
				boolean textAfter = t.span().endOffset() < code.length()
						&& !Character.isWhitespace(code.charAt(t.span().endOffset()));
				switch (kind) {
					case MODULE:
						editor.replace(Widths.withLeadingSpace(code, t.span()), textAfter ? "; " : ";");
						break;
					case MATCH:
						editor.replace(Widths.withLeadingSpace(code, t.span()), textAfter ? " " : "");
						break;
					default:
						editor.replace(t.span(), Widths.padded(code, t.span(), "begin"));
						break;
				}
			} else if (t.isSymbol("}")) {
				FrameKind kind = context.close();
				editor.replace(t.span(), Widths.padded(code, t.span(), kind.closeToken()));
			}
		}
		return editor.apply();
	}
}
