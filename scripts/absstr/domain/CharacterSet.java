package absstr.domain;

import com.google.common.base.Verify;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;

import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A powerset lattice over characters, with an explicit top element standing
 * for the whole alphabet.
 */
public final class CharacterSet implements HasTop<CharacterSet> {
	private static final CharacterSet TOP = new CharacterSet(null);

	/** The characters, or null for top. */
	private final ImmutableSet<Character> chars;

	private CharacterSet(ImmutableSet<Character> chars) {
		this.chars = chars;
	}

	/**
	 * @return The top element (all characters).
	 */
	public static CharacterSet topValue() {
		return TOP;
	}

	/**
	 * @return A concrete set of characters.
	 */
	public static CharacterSet of(Set<Character> chars) {
		return new CharacterSet(ImmutableSet.copyOf(chars));
	}

	/**
	 * @return The set of unique characters in the given string.
	 */
	public static CharacterSet of(String string) {
		return new CharacterSet(string.chars()
			.mapToObj(c -> (char) c)
			.collect(ImmutableSet.toImmutableSet()));
	}

	/**
	 * @return The empty set.
	 */
	public static CharacterSet empty() {
		return new CharacterSet(ImmutableSet.of());
	}

	@Override
	public CharacterSet top() {
		return TOP;
	}

	/**
	 * @return Whether this is the top element.
	 */
	public boolean isTop() {
		return this.chars == null;
	}

	/**
	 * @return The concrete characters.
	 * @throws com.google.common.base.VerifyException
	 *             If this is top.
	 */
	public ImmutableSet<Character> unwrapValue() {
		Verify.verify(!isTop(), "Unexpected CharacterSet type.");
		return this.chars;
	}

	/**
	 * The intersection of two character sets.  Neither may be top, since an
	 * enclosing CharacterInclusionDomain would then be top itself, which
	 * callers check beforehand.
	 *
	 * @throws com.google.common.base.VerifyException
	 *             If either set is top.
	 */
	public CharacterSet intersection(CharacterSet other) {
		Verify.verify(!isTop() && !other.isTop(),
			"Unexpected Top Value for CharacterSet intersection.");
		return new CharacterSet(Sets.intersection(this.chars, other.chars).immutableCopy());
	}

	/**
	 * @return The union of two character sets, or top if either one is top.
	 */
	public CharacterSet union(CharacterSet other) {
		if (isTop() || other.isTop()) {
			return TOP;
		}
		return new CharacterSet(Sets.union(this.chars, other.chars).immutableCopy());
	}

	/**
	 * @return Whether this set contains every character of other.
	 */
	public boolean containsAll(CharacterSet other) {
		if (isTop()) {
			return true;
		} else if (other.isTop()) {
			return false;
		}
		return this.chars.containsAll(other.chars);
	}

	@Override
	public boolean equals(Object obj) {
		if (obj == this) {
			return true;
		} else if (!(obj instanceof CharacterSet)) {
			return false;
		}

		var other = (CharacterSet) obj;
		return Objects.equals(this.chars, other.chars);
	}

	@Override
	public int hashCode() {
		return Objects.hashCode(this.chars);
	}

	@Override
	public String toString() {
		if (isTop()) {
			return "⊤";
		} else {
			return this.chars.stream()
				.sorted()
				.map(String::valueOf)
				.collect(Collectors.joining(", ", "{", "}"));
		}
	}
}
