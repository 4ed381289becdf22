package verilite.symbols;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One hardware module being translated. Maps keep declaration order.
 */
public final class ModuleDefinition {
	private final String name;
	private final Map<String, Port> io = new LinkedHashMap<>();
	private final Map<String, Integer> wires = new LinkedHashMap<>();
	private final Map<String, Integer> registers = new LinkedHashMap<>();
	private final Map<String, String> parameters = new LinkedHashMap<>();

	ModuleDefinition(String name) {
		this.name = name;
	}

	public String name() {
		return name;
	}

	public Map<String, Port> io() {
		return Collections.unmodifiableMap(io);
	}

	public Map<String, Integer> wires() {
		return Collections.unmodifiableMap(wires);
	}

	public Map<String, Integer> registers() {
		return Collections.unmodifiableMap(registers);
	}

	public Map<String, String> parameters() {
		return Collections.unmodifiableMap(parameters);
	}

	boolean declares(String symbol) {
		return io.containsKey(symbol) || wires.containsKey(symbol) || registers.containsKey(symbol)
				|| parameters.containsKey(symbol);
	}

	void addPort(String symbol, Port port) {
		io.put(symbol, port);
	}

	void addWire(String symbol, int width) {
		wires.put(symbol, width);
	}

	void addRegister(String symbol, int width) {
		registers.put(symbol, width);
	}

	void addParameter(String symbol, String type) {
		parameters.put(symbol, type);
	}
}
