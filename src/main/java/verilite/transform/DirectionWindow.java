package verilite.transform;

/**
 * Region of the expanded source the {@link DirectionOracle} searches for
 * {@code port ::= ...} drivers.
 */
public enum DirectionWindow {
	/** From the header of the module declaring the port up to the next module header. */
	ENCLOSING_MODULE,
	/**
	 * Whole source when it holds a single module keyword, otherwise only the
	 * text before the first one.
	 */
	FIRST_MODULE_KEYWORD
}
