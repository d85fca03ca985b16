package absstr.analysis.strings;

import static com.google.common.truth.Truth.assertThat;

import absstr.domain.AbstractIdentifier;
import absstr.domain.AbstractLocation;
import absstr.domain.CharacterInclusionDomain;
import absstr.domain.CharacterSet;
import absstr.ir.Tid;
import absstr.ir.Variable;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/**
 * Tests for {@link State}.
 */
@RunWith(JUnit4.class)
public class StateTest {
	private static final Tid MAIN = Tid.of("sub_main");
	private static final AbstractIdentifier RDI = new AbstractIdentifier(MAIN,
		AbstractLocation.register(Variable.register("RDI", 8)));
	private static final AbstractIdentifier RSI = new AbstractIdentifier(MAIN,
		AbstractLocation.register(Variable.register("RSI", 8)));
	private static final AbstractIdentifier STACK = new AbstractIdentifier(MAIN,
		AbstractLocation.pointer(Variable.register("RSP", 8), 8));

	private static CharacterInclusionDomain str(String string) {
		return CharacterInclusionDomain.fromString(string);
	}

	private static State<CharacterInclusionDomain> empty() {
		return State.empty();
	}

	@Test
	public void emptyIsTop() {
		assertThat(empty().isTop()).isTrue();
		assertThat(empty().get(RDI)).isEmpty();
		assertThat(empty().with(RDI, str("a")).isTop()).isFalse();
	}

	@Test
	public void withAndWithout() {
		var state = empty().with(RDI, str("abc")).with(RSI, str("def"));

		assertThat(state.get(RDI)).hasValue(str("abc"));
		assertThat(state.with(RDI, str("x")).get(RDI)).hasValue(str("x"));
		assertThat(state.without(RDI).isTracked(RDI)).isFalse();
		assertThat(state.without(RDI).get(RSI)).hasValue(str("def"));
		// Unchanged
		assertThat(state.get(RDI)).hasValue(str("abc"));
	}

	@Test
	public void settingTopStopsTracking() {
		var state = empty().with(RDI, str("abc"));

		assertThat(state.with(RDI, CharacterInclusionDomain.topValue())).isEqualTo(empty());
	}

	@Test
	public void getOrElse() {
		var state = empty().with(RDI, str("abc"));

		assertThat(state.getOrElse(RDI, id -> str(""))).isEqualTo(str("abc"));
		assertThat(state.getOrElse(RSI, id -> str(""))).isEqualTo(str(""));
	}

	@Test
	public void mergeIsPointwise() {
		var left = empty().with(RDI, str("abc")).with(RSI, str("x"));
		var right = empty().with(RDI, str("bcd")).with(STACK, str("y"));

		var merged = left.merge(right);

		// A location missing on one side is top there
		assertThat(merged.getStringsTracked().keySet()).containsExactly(RDI);
		assertThat(merged.get(RDI)).hasValue(CharacterInclusionDomain.of(CharacterSet.of("bc"), CharacterSet.of("abcd")));
		assertThat(right.merge(left)).isEqualTo(merged);
	}

	@Test
	public void mergeWithUnboundedPossibleSet() {
		var possiblyAnything = str("a").insertStringDomain(CharacterInclusionDomain.topValue());
		var left = empty().with(RDI, str("abc"));
		var right = empty().with(RDI, possiblyAnything);

		assertThat(right.get(RDI)).hasValue(possiblyAnything);
		assertThat(left.merge(right).get(RDI)).hasValue(
			CharacterInclusionDomain.of(CharacterSet.of("a"), CharacterSet.topValue()));
	}

	@Test
	public void mergeIsIdempotent() {
		var state = empty().with(RDI, str("abc")).with(STACK, str("y"));

		assertThat(state.merge(state)).isEqualTo(state);
		assertThat(state.merge(empty())).isEqualTo(empty());
	}

	@Test
	public void filter() {
		var state = empty().with(RDI, str("abc")).with(STACK, str("y"));

		var registers = state.filter((id, str) -> !id.getLocation().isMemory());
		assertThat(registers.getStringsTracked().keySet()).containsExactly(RDI);
		assertThat(state.filter((id, str) -> true)).isSameInstanceAs(state);
	}
}
