package verilite.preprocess;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Result of evaluating a constant or loop expression.
 */
public sealed interface Value permits Value.Int, Value.Text, Value.Sequence {
	/** Text stored for a constant; sequences stay re-parsable. */
	String render();

	/** Text substituted for a loop placeholder. */
	default String text() {
		return render();
	}

	/** Values a loop iterates over. */
	List<Value> iterate();

	record Int(long value) implements Value {
		@Override
		public String render() {
			return Long.toString(value);
		}

		@Override
		public List<Value> iterate() {
			List<Value> out = new ArrayList<>();
			for (long i = 0; i < value; i++) {
				out.add(new Int(i));
			}
			return out;
		}
	}

	record Text(String value) implements Value {
		@Override
		public String render() {
			return value;
		}

		@Override
		public List<Value> iterate() {
			return List.of(this);
		}

		String quoted() {
			return "\"" + value.replace("\\", "\\\\").replace("\"", "\\\"") + "\"";
		}
	}

	record Sequence(List<Value> values) implements Value {
		public Sequence {
			values = List.copyOf(values);
		}

		@Override
		public String render() {
			return values.stream()
					.map(v -> v instanceof Text t ? t.quoted() : v.render())
					.collect(Collectors.joining(", ", "[", "]"));
		}

		@Override
		public List<Value> iterate() {
			return values;
		}
	}
}
