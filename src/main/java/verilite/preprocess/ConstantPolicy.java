package verilite.preprocess;

/**
 * What happens when a constant name is defined a second time.
 */
public enum ConstantPolicy {
	/** Last write wins; earlier references keep the value they were given. */
	OVERWRITE,
	/** The second definition fails with a name collision. */
	REJECT
}
