package absstr.util;

import absstr.Tty;
import absstr.util.Log.Level;

import com.google.common.base.Throwables;

import java.io.PrintStream;

/**
 * Logging backend that writes colored lines to standard error.
 */
public final class TtyErrorLogger {
	public static final TtyErrorLogger INSTANCE = new TtyErrorLogger(System.err);

	private final PrintStream out;

	TtyErrorLogger(PrintStream out) {
		this.out = out;
	}

	private static String color(Level level) {
		switch (level) {
		case INFO:
			return "cyan";
		case WARN:
			return "yellow";
		case ERROR:
			return "red";
		default:
			return "gray";
		}
	}

	private void header(Level level, String tag, String line) {
		var fg = color(level);
		Tty.print(this.out, "<fg=" + fg + "><b>%-5s</b> <i>%-20s</i></fg> %s\n", level, tag, line);
	}

	private void line(Level level, String line) {
		var fg = color(level);
		Tty.print(this.out, "<fg=" + fg + ">%s</fg>\n", line);
	}

	private void log(Level level, Object src, Object msg, Throwable e) {
		if (!level.isEnabled()) {
			return;
		}

		// Avoid interleaved lines
		synchronized (this) {
			String tag;
			if (src instanceof String s) {
				tag = s;
			} else if (src instanceof Class<?> c) {
				tag = c.getSimpleName();
			} else {
				tag = src.getClass().getSimpleName();
			}

			var str = String.valueOf(msg);
			if (str.contains("\n")) {
				header(level, tag, "");
				str.lines()
					.forEach(line -> line(level, line));
			} else {
				header(level, tag, str);
			}

			if (e != null) {
				Throwables.getStackTraceAsString(e)
					.lines()
					.forEach(line -> line(level, line));
			}
		}
	}

	public void trace(Object src, Object msg) {
		log(Level.TRACE, src, msg, null);
	}

	public void debug(Object src, Object msg) {
		log(Level.DEBUG, src, msg, null);
	}

	public void info(Object src, Object msg) {
		log(Level.INFO, src, msg, null);
	}

	public void warn(Object src, Object msg) {
		log(Level.WARN, src, msg, null);
	}

	public void warn(Object src, Object msg, Throwable e) {
		log(Level.WARN, src, msg, e);
	}

	public void error(Object src, Object msg) {
		log(Level.ERROR, src, msg, null);
	}

	public void error(Object src, Object msg, Throwable e) {
		log(Level.ERROR, src, msg, e);
	}
}
