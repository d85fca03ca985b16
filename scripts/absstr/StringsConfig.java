package absstr;

/**
 * String analysis configuration.
 */
public class StringsConfig {
	/** Minimum level of log messages (TRACE, DEBUG, INFO, WARN or ERROR). */
	public static final String LOG_LEVEL = stringEnv("ABSSTR_LOG_LEVEL", "INFO");

	/** Longest string read from the memory image, in bytes. */
	public static final int MAX_STRING_LENGTH = intEnv("ABSSTR_MAX_STRING_LENGTH", 4096);

	/** Whether to track string literals found in read-only global memory. */
	public static final boolean TRACK_GLOBAL_STRINGS = !checkEnv("ABSSTR_NO_GLOBAL_STRINGS");

	/**
	 * Check if a setting has been enabled through an environment variable.
	 */
	private static boolean checkEnv(String var) {
		String value = System.getenv(var);
		return value != null && !value.isEmpty();
	}

	/**
	 * Get a string value from the environment.
	 */
	private static String stringEnv(String var, String def) {
		String value = System.getenv(var);
		if (value != null && !value.isEmpty()) {
			return value;
		} else {
			return def;
		}
	}

	/**
	 * Get an integer value from the environment.
	 */
	private static int intEnv(String var, int def) {
		String value = System.getenv(var);
		if (value != null && !value.isEmpty()) {
			return Integer.parseInt(value);
		} else {
			return def;
		}
	}
}
