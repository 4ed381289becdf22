package verilite;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Locale;
import java.util.Properties;

import verilite.preprocess.ConstantPolicy;
import verilite.transform.DirectionWindow;

/**
 * Knobs of a compilation.
 *
 * {@link #load()} reads {@code verilite.properties} from the classpath and lets
 * JVM system properties with the same keys override it.
 */
public record CompilerOptions(DirectionWindow directionWindow, ConstantPolicy constantPolicy, boolean checkBalance) {
	public static final String RESOURCE = "verilite.properties";
	public static final String DIRECTION_WINDOW = "verilite.direction.window";
	public static final String CONSTANT_POLICY = "verilite.constants.policy";
	public static final String CHECK_BALANCE = "verilite.check.balance";

	public static CompilerOptions defaults() {
		return new CompilerOptions(DirectionWindow.ENCLOSING_MODULE, ConstantPolicy.OVERWRITE, true);
	}

	public static CompilerOptions load() {
		Properties props = new Properties();
		try (InputStream in = CompilerOptions.class.getClassLoader().getResourceAsStream(RESOURCE)) {
			if (in != null) {
				props.load(in);
			}
		} catch (IOException e) {
			throw new UncheckedIOException("cannot read " + RESOURCE, e);
		}
		return fromProperties(props);
	}

	static CompilerOptions fromProperties(Properties props) {
		CompilerOptions d = defaults();
		String window = lookup(props, DIRECTION_WINDOW);
		String policy = lookup(props, CONSTANT_POLICY);
		String balance = lookup(props, CHECK_BALANCE);
		return new CompilerOptions(
				window == null ? d.directionWindow() : DirectionWindow.valueOf(normalize(window)),
				policy == null ? d.constantPolicy() : ConstantPolicy.valueOf(normalize(policy)),
				balance == null ? d.checkBalance() : Boolean.parseBoolean(balance.strip()));
	}

	public CompilerOptions withDirectionWindow(DirectionWindow window) {
		return new CompilerOptions(window, constantPolicy, checkBalance);
	}

	public CompilerOptions withConstantPolicy(ConstantPolicy policy) {
		return new CompilerOptions(directionWindow, policy, checkBalance);
	}

	public CompilerOptions withCheckBalance(boolean check) {
		return new CompilerOptions(directionWindow, constantPolicy, check);
	}

	private static String lookup(Properties props, String key) {
		String sys = System.getProperty(key);
		return sys != null ? sys : props.getProperty(key);
	}

	private static String normalize(String value) {
		return value.strip().toUpperCase(Locale.ROOT).replace('-', '_');
	}
}
