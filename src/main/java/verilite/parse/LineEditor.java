package verilite.parse;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Collects span replacements against one line and applies them in a single
 * pass. Replacements must not overlap.
 */
public final class LineEditor {
	private record Edit(SourceSpan span, String text) {
	}

	private final String line;
	private final List<Edit> edits = new ArrayList<>();

	public LineEditor(String line) {
		this.line = line;
	}

	public LineEditor replace(SourceSpan span, String text) {
		edits.add(new Edit(span, text));
		return this;
	}

	public boolean isEmpty() {
		return edits.isEmpty();
	}

	public String apply() {
		List<Edit> ordered = new ArrayList<>(edits);
		ordered.sort(Comparator.comparingInt((Edit e) -> e.span().startOffset()));
		StringBuilder out = new StringBuilder();
		int cursor = 0;
		for (Edit e : ordered) {
			out.append(line, cursor, e.span().startOffset());
			out.append(e.text());
			cursor = e.span().endOffset();
		}
		out.append(line.substring(cursor));
		return out.toString();
	}
}
