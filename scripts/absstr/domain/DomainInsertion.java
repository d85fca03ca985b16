package absstr.domain;

/**
 * String domains that can model concatenation.
 */
public interface DomainInsertion<T> {
	/**
	 * Extend this string with another one that definitely occurs in the
	 * result, as opposed to merge(), which combines alternatives.
	 *
	 * Not required to be commutative.
	 *
	 * @return The abstract value of the concatenation.
	 */
	T insertStringDomain(T other);
}
