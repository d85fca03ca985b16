package absstr.domain;

import com.google.common.base.Preconditions;
import com.google.common.base.Verify;

import java.util.Objects;

/**
 * The character inclusion domain.
 *
 * A value is a pair of character sets: the characters certainly contained in
 * every represented string, and the characters possibly contained in at least
 * one of them.  The order of characters is not tracked.  Top stands for an
 * empty certain set and the whole alphabet as the possible set.
 *
 * For example:
 * <ul>
 * <li>"Hello, World!" starts out as ({H,e,l,o,',',' ',W,r,d,!}, same).</li>
 * <li>Concatenating "Hello, " and "World" takes the union of both sets.</li>
 * <li>Merging "Hello, " and "World" gives ({l,o}, {H,e,l,o,',',' ',W,r,d}).</li>
 * </ul>
 */
public final class CharacterInclusionDomain implements StringDomain<CharacterInclusionDomain> {
	private static final CharacterInclusionDomain TOP = new CharacterInclusionDomain(null, null);

	private final CharacterSet certain;
	private final CharacterSet possible;

	private CharacterInclusionDomain(CharacterSet certain, CharacterSet possible) {
		this.certain = certain;
		this.possible = possible;
	}

	/**
	 * @return The top element.
	 */
	public static CharacterInclusionDomain topValue() {
		return TOP;
	}

	/**
	 * @return The value with the given certain and possible sets.
	 * @throws IllegalArgumentException
	 *             If certain is top or not contained in possible.
	 */
	public static CharacterInclusionDomain of(CharacterSet certain, CharacterSet possible) {
		Objects.requireNonNull(certain);
		Objects.requireNonNull(possible);
		Preconditions.checkArgument(!certain.isTop() && possible.containsAll(certain),
			"Certain characters %s must be a subset of the possible characters %s", certain, possible);
		return new CharacterInclusionDomain(certain, possible);
	}

	/**
	 * @return The abstract value of a single concrete string.
	 */
	public static CharacterInclusionDomain fromString(String string) {
		var chars = CharacterSet.of(string);
		return new CharacterInclusionDomain(chars, chars);
	}

	/**
	 * @return The characters certainly contained.
	 * @throws com.google.common.base.VerifyException
	 *             If this is top.
	 */
	public CharacterSet certain() {
		Verify.verify(!isTop(), "Unexpected Character Inclusion type.");
		return this.certain;
	}

	/**
	 * @return The characters possibly contained.
	 * @throws com.google.common.base.VerifyException
	 *             If this is top.
	 */
	public CharacterSet possible() {
		Verify.verify(!isTop(), "Unexpected Character Inclusion type.");
		return this.possible;
	}

	/**
	 * Takes the intersection of the certain sets and the union of the
	 * possible sets, or top if either side is top.
	 */
	@Override
	public CharacterInclusionDomain merge(CharacterInclusionDomain other) {
		if (isTop() || other.isTop()) {
			return TOP;
		}
		return new CharacterInclusionDomain(
			this.certain.intersection(other.certain),
			this.possible.union(other.possible));
	}

	@Override
	public boolean isTop() {
		return this.certain == null;
	}

	@Override
	public CharacterInclusionDomain top() {
		return TOP;
	}

	@Override
	public CharacterInclusionDomain insertStringDomain(CharacterInclusionDomain other) {
		if (isTop()) {
			return TOP;
		} else if (other.isTop()) {
			// Anything may follow, but what we had is still there
			return new CharacterInclusionDomain(this.certain, CharacterSet.topValue());
		}
		return new CharacterInclusionDomain(
			this.certain.union(other.certain),
			this.possible.union(other.possible));
	}

	@Override
	public boolean equals(Object obj) {
		if (obj == this) {
			return true;
		} else if (!(obj instanceof CharacterInclusionDomain)) {
			return false;
		}

		var other = (CharacterInclusionDomain) obj;
		return Objects.equals(this.certain, other.certain)
			&& Objects.equals(this.possible, other.possible);
	}

	@Override
	public int hashCode() {
		return Objects.hash(this.certain, this.possible);
	}

	@Override
	public String toString() {
		if (isTop()) {
			return "⊤";
		} else {
			return String.format("(%s, %s)", this.certain, this.possible);
		}
	}
}
