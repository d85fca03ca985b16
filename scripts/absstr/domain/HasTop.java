package absstr.domain;

/**
 * A domain with a maximal element.
 */
public interface HasTop<T> {
	/**
	 * @return The top element of this domain.
	 */
	T top();
}
