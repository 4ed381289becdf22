package verilite.transform;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumMap;
import java.util.Map;

import verilite.ErrorKind;
import verilite.TransformException;

/**
 * Nesting state of the line transformer.
 *
 * Braces push and pop tagged frames; a special construct (module, match,
 * clocked block) is recognised by arming a pending tag that the next opening
 * brace consumes. Block comment and passthrough regions are plain toggles.
 */
public final class CompilationContext {
	private final Deque<FrameKind> frames = new ArrayDeque<>();
	private final Map<FrameKind, Integer> depths = new EnumMap<>(FrameKind.class);
	private FrameKind pending;
	private boolean inModuleHeader;
	private boolean inComment;
	private boolean inPassthrough;

	public void arm(FrameKind kind) {
		pending = kind;
	}

	public FrameKind pending() {
		return pending;
	}

	public FrameKind open() throws TransformException {
		FrameKind kind = pending == null ? FrameKind.PLAIN : pending;
		pending = null;
		if ((kind == FrameKind.MATCH || kind == FrameKind.CLOCKED) && !isIn(FrameKind.MODULE)) {
			throw new TransformException(ErrorKind.MALFORMED_INPUT,
					kind.name().toLowerCase() + " block outside of a module");
		}
		if (kind == FrameKind.MODULE && isIn(FrameKind.MODULE)) {
			throw new TransformException(ErrorKind.MALFORMED_INPUT, "modules do not nest");
		}
		frames.push(kind);
		depths.merge(kind, 1, Integer::sum);
		return kind;
	}

	public FrameKind close() throws TransformException {
		if (frames.isEmpty()) {
			throw new TransformException(ErrorKind.MALFORMED_INPUT, "'}' without a matching '{'");
		}
		FrameKind kind = frames.pop();
		depths.merge(kind, -1, Integer::sum);
		return kind;
	}

	public boolean isIn(FrameKind kind) {
		return depth(kind) > 0;
	}

	public int depth(FrameKind kind) {
		return depths.getOrDefault(kind, 0);
	}

	public int openFrames() {
		return frames.size();
	}

	/** Innermost open frame, or {@code null} at top level. */
	public FrameKind innermost() {
		return frames.peek();
	}

	public boolean inModuleHeader() {
		return inModuleHeader;
	}

	public void setInModuleHeader(boolean inModuleHeader) {
		this.inModuleHeader = inModuleHeader;
	}

	public boolean inComment() {
		return inComment;
	}

	public void setInComment(boolean inComment) {
		this.inComment = inComment;
	}

	public boolean inPassthrough() {
		return inPassthrough;
	}

	public void togglePassthrough() {
		inPassthrough = !inPassthrough;
	}

	/** True when every construct opened so far has been closed. */
	public boolean isBalanced() {
		return frames.isEmpty() && !inModuleHeader && !inComment && !inPassthrough;
	}
}
