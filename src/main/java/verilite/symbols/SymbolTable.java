package verilite.symbols;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import verilite.ErrorKind;
import verilite.TransformException;

/**
 * Global constants and module registry, plus the declarations of each module.
 *
 * Lookup order in {@link #classify(String)} is constants, module names, then
 * the active module's ports, wires and registers; the first match wins.
 * Parameters are not classified but still collide with every other name.
 */
public final class SymbolTable {
	private static final Logger logger = LogManager.getLogger();

	private final Map<String, String> constants = new LinkedHashMap<>();
	private final Map<String, ModuleDefinition> modules = new LinkedHashMap<>();
	private ModuleDefinition active;

	public void defineConstant(String name, String value) {
		constants.put(name, value);
	}

	public Optional<String> constant(String name) {
		return Optional.ofNullable(constants.get(name));
	}

	public boolean hasConstant(String name) {
		return constants.containsKey(name);
	}

	public Map<String, String> constants() {
		return Collections.unmodifiableMap(constants);
	}

	public ModuleDefinition declareModule(String name) throws TransformException {
		if (constants.containsKey(name) || modules.containsKey(name)) {
			throw new TransformException(ErrorKind.NAME_COLLISION,
					"module name '" + name + "' is already declared as " + classify(name).kind());
		}
		ModuleDefinition module = new ModuleDefinition(name);
		modules.put(name, module);
		active = module;
		logger.debug("Declared module {}", name);
		return module;
	}

	public Optional<ModuleDefinition> module(String name) {
		return Optional.ofNullable(modules.get(name));
	}

	public int moduleCount() {
		return modules.size();
	}

	public Optional<ModuleDefinition> activeModule() {
		return Optional.ofNullable(active);
	}

	public void declarePort(String name, int width, Direction direction) throws TransformException {
		requireFree(name).addPort(name, new Port(width, direction));
	}

	public void declareWire(String name, int width) throws TransformException {
		requireFree(name).addWire(name, width);
	}

	public void declareRegister(String name, int width) throws TransformException {
		requireFree(name).addRegister(name, width);
	}

	public void declareParameter(String name, String type) throws TransformException {
		requireFree(name).addParameter(name, type);
	}

	public Classification classify(String name) {
		if (constants.containsKey(name)) {
			return Classification.CONSTANT;
		}
		if (modules.containsKey(name)) {
			return Classification.MODULE;
		}
		if (active == null) {
			return Classification.UNDEFINED;
		}
		Port port = active.io().get(name);
		if (port != null) {
			return Classification.wire(port.width());
		}
		Integer wire = active.wires().get(name);
		if (wire != null) {
			return Classification.wire(wire);
		}
		Integer reg = active.registers().get(name);
		if (reg != null) {
			return Classification.register(reg);
		}
		return Classification.UNDEFINED;
	}

	/** True when {@code name} would collide with an existing declaration. */
	public boolean isTaken(String name) {
		return classify(name).isDefined() || (active != null && active.declares(name));
	}

	private ModuleDefinition requireFree(String name) throws TransformException {
		if (active == null) {
			throw new TransformException(ErrorKind.MALFORMED_INPUT, "declaration of '" + name + "' outside of a module");
		}
		if (isTaken(name)) {
			Classification existing = classify(name);
			String what = existing.isDefined() ? existing.kind().toString() : "PARAMETER";
			throw new TransformException(ErrorKind.NAME_COLLISION,
					"'" + name + "' is already declared as " + what + " in module " + active.name());
		}
		return active;
	}
}
