package verilite.transform;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import verilite.symbols.Direction;

/**
 * Infers a port's direction from how the rest of the source uses it: a port
 * driven through the output assignment operator ({@code name ::= expr}) is an
 * output, anything else is an input.
 */
public final class DirectionOracle {
	private static final Logger logger = LogManager.getLogger();

	private static final Pattern MODULE_KEYWORD = Pattern.compile("(?m)^[ \\t]*module\\b");

	private final List<String> lines;
	private final DirectionWindow window;
	private final List<Integer> moduleLines = new ArrayList<>();

	public DirectionOracle(List<String> lines, DirectionWindow window) {
		this.lines = List.copyOf(lines);
		this.window = window;
		for (int i = 0; i < this.lines.size(); i++) {
			if (MODULE_KEYWORD.matcher(this.lines.get(i)).lookingAt()) {
				moduleLines.add(i);
			}
		}
	}

	/**
	 * Direction of {@code portName}, declared on line {@code lineIndex}
	 * (0-based) of the source this oracle was built over.
	 */
	public Direction inferDirection(String portName, int lineIndex) {
		Direction direction;
		if (window == DirectionWindow.FIRST_MODULE_KEYWORD) {
			direction = inferDirection(portName, String.join("\n", lines));
		} else {
			int start = 0;
			int end = lines.size();
			for (int m : moduleLines) {
				if (m <= lineIndex) {
					start = m;
				} else {
					end = m;
					break;
				}
			}
			direction = isDriven(portName, String.join("\n", lines.subList(start, end))) ? Direction.OUTPUT
					: Direction.INPUT;
		}
		logger.debug("Inferred {} for port {}", direction, portName);
		return direction;
	}

	/**
	 * Searches the whole source when it holds at most one module keyword,
	 * otherwise only the text preceding the first one.
	 */
	public static Direction inferDirection(String portName, String fullSource) {
		Matcher m = MODULE_KEYWORD.matcher(fullSource);
		String searched = fullSource;
		if (m.find()) {
			int first = m.start();
			if (m.find()) {
				searched = fullSource.substring(0, first);
			}
		}
		return isDriven(portName, searched) ? Direction.OUTPUT : Direction.INPUT;
	}

	private static boolean isDriven(String portName, String text) {
		Pattern driver = Pattern.compile("(?:^|\\s)" + Pattern.quote(portName) + "\\s*::=");
		return driver.matcher(text).find();
	}
}
