package absstr;

import java.io.PrintStream;
import java.util.Map;

/**
 * Utilities for TTY formatting.
 */
public class Tty {
	/** Whether the process is attached to a terminal. */
	public static final boolean IS_A_TTY = System.console() != null;

	private static final Map<String, String> STYLES = Map.ofEntries(
		Map.entry("<b>", "\033[1m"),
		Map.entry("</b>", "\033[22m"),

		Map.entry("<i>", "\033[3m"),
		Map.entry("</i>", "\033[23m"),

		Map.entry("<fg=red>", "\033[31m"),
		Map.entry("<fg=yellow>", "\033[33m"),
		Map.entry("<fg=cyan>", "\033[36m"),
		Map.entry("<fg=gray>", "\033[90m"),
		Map.entry("</fg>", "\033[39m")
	);

	private Tty() {
	}

	/**
	 * Replace style tags with escape sequences, or remove them if colors are
	 * disabled.
	 */
	public static String style(String format, boolean colors) {
		for (var style : STYLES.entrySet()) {
			format = format.replace(style.getKey(), colors ? style.getValue() : "");
		}
		return format;
	}

	/**
	 * Print a styled, formatted message.
	 */
	public static void print(PrintStream out, String format, Object... args) {
		out.format(style(format, IS_A_TTY), args);
	}
}
