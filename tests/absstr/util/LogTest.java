package absstr.util;

import static com.google.common.truth.Truth.assertThat;

import absstr.Tty;
import absstr.util.Log.Level;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/**
 * Tests for {@link Log} and {@link TtyErrorLogger}.
 */
@RunWith(JUnit4.class)
public class LogTest {
	@Test
	public void parseLevel() {
		assertThat(Log.parseLevel("debug")).isEqualTo(Level.DEBUG);
		assertThat(Log.parseLevel("WARN")).isEqualTo(Level.WARN);
		assertThat(Log.parseLevel("verbose")).isEqualTo(Level.INFO);
	}

	@Test
	public void errorsAreAlwaysEnabled() {
		assertThat(Level.ERROR.isEnabled()).isTrue();
	}

	@Test
	public void styleWithoutColors() {
		assertThat(Tty.style("<fg=red><b>x</b></fg>", false)).isEqualTo("x");
		assertThat(Tty.style("<b>x</b>", true)).isEqualTo("\033[1mx\033[22m");
	}

	@Test
	public void logLines() {
		var bytes = new ByteArrayOutputStream();
		var logger = new TtyErrorLogger(new PrintStream(bytes, true, StandardCharsets.UTF_8));

		logger.error(LogTest.class, "first\nsecond", new IllegalStateException("boom"));

		var output = bytes.toString(StandardCharsets.UTF_8);
		assertThat(output).contains("ERROR");
		assertThat(output).contains("LogTest");
		assertThat(output).contains("first");
		assertThat(output).contains("second");
		assertThat(output).contains("java.lang.IllegalStateException: boom");
	}
}
