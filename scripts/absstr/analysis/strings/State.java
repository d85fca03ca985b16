package absstr.analysis.strings;

import absstr.domain.AbstractDomain;
import absstr.domain.AbstractIdentifier;
import absstr.domain.HasTop;
import absstr.domain.StringDomain;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Maps;

import java.util.Objects;
import java.util.Optional;
import java.util.function.BiPredicate;
import java.util.function.Function;

/**
 * Everything known about the strings of a program at one program point.
 *
 * A sparse map from locations to string values.  A location missing from the
 * map is implicitly top, so only locations constrained below top are stored.
 * States are immutable; transfer functions derive new ones.
 */
public final class State<T extends StringDomain<T>> implements AbstractDomain<State<T>>, HasTop<State<T>> {
	private final ImmutableMap<AbstractIdentifier, T> stringsTracked;

	private State(ImmutableMap<AbstractIdentifier, T> stringsTracked) {
		this.stringsTracked = stringsTracked;
	}

	/**
	 * @return The state that knows nothing, i.e. top.
	 */
	public static <U extends StringDomain<U>> State<U> empty() {
		return new State<U>(ImmutableMap.of());
	}

	/**
	 * @return The value tracked for the given location.  Empty means top.
	 */
	public Optional<T> get(AbstractIdentifier id) {
		return Optional.ofNullable(this.stringsTracked.get(id));
	}

	/**
	 * @return The value for the given location, or the result of the given
	 *         function if it is not tracked (top).
	 */
	public T getOrElse(AbstractIdentifier id, Function<? super AbstractIdentifier, ? extends T> func) {
		return get(id).orElseGet(() -> func.apply(id));
	}

	/**
	 * @return Whether a value below top is known for the location.
	 */
	public boolean isTracked(AbstractIdentifier id) {
		return this.stringsTracked.containsKey(id);
	}

	/**
	 * @return All tracked locations and their values.
	 */
	public ImmutableMap<AbstractIdentifier, T> getStringsTracked() {
		return this.stringsTracked;
	}

	/**
	 * @return This state with the location set to the given value.  Setting
	 *         top stops tracking the location.
	 */
	public State<T> with(AbstractIdentifier id, T value) {
		if (value.isTop()) {
			return without(id);
		}
		if (value.equals(this.stringsTracked.get(id))) {
			return this;
		}

		var map = ImmutableMap.<AbstractIdentifier, T>builderWithExpectedSize(this.stringsTracked.size() + 1);
		this.stringsTracked.forEach((k, v) -> {
			if (!k.equals(id)) {
				map.put(k, v);
			}
		});
		map.put(id, value);
		return new State<>(map.build());
	}

	/**
	 * @return This state with the location reset to top.
	 */
	public State<T> without(AbstractIdentifier id) {
		if (!isTracked(id)) {
			return this;
		}
		return filter((k, v) -> !k.equals(id));
	}

	/**
	 * @return This state, keeping only the entries matching the predicate.
	 */
	public State<T> filter(BiPredicate<? super AbstractIdentifier, ? super T> predicate) {
		var map = ImmutableMap.copyOf(Maps.filterEntries(this.stringsTracked,
			e -> predicate.test(e.getKey(), e.getValue())));
		if (map.size() == this.stringsTracked.size()) {
			return this;
		}
		return new State<>(map);
	}

	/**
	 * Pointwise merge.  A location tracked on one side only is merged with
	 * the implicit top of the other side, so it is dropped.
	 */
	@Override
	public State<T> merge(State<T> other) {
		if (this == other) {
			return this;
		}

		var map = ImmutableMap.<AbstractIdentifier, T>builder();
		this.stringsTracked.forEach((id, ours) -> {
			var theirs = other.stringsTracked.get(id);
			if (theirs == null) {
				return;
			}
			var merged = ours.merge(theirs);
			if (!merged.isTop()) {
				map.put(id, merged);
			}
		});
		return new State<>(map.build());
	}

	/**
	 * @return Whether no location is tracked.
	 */
	@Override
	public boolean isTop() {
		return this.stringsTracked.isEmpty();
	}

	@Override
	public State<T> top() {
		return empty();
	}

	@Override
	public boolean equals(Object obj) {
		if (obj == this) {
			return true;
		} else if (!(obj instanceof State)) {
			return false;
		}

		var other = (State<?>) obj;
		return this.stringsTracked.equals(other.stringsTracked);
	}

	@Override
	public int hashCode() {
		return Objects.hash(this.stringsTracked);
	}

	@Override
	public String toString() {
		if (isTop()) {
			return "⊤";
		} else {
			return this.stringsTracked.toString();
		}
	}
}
