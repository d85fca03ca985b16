package absstr.domain;

import java.util.Collection;

/**
 * A join semi-lattice of abstract values.
 *
 * Implementations are immutable; every operation returns a new value.
 */
public interface AbstractDomain<T extends AbstractDomain<T>> {
	/**
	 * Calculate the join (least upper bound) of this and other.
	 *
	 * Must be commutative, idempotent and monotone.
	 *
	 * @return The merged value.
	 */
	T merge(T other);

	/**
	 * @return Whether this is the maximal (unconstrained) element.
	 */
	boolean isTop();

	/**
	 * @return The join of this and many others.
	 */
	@SuppressWarnings("unchecked")
	default T merge(Collection<T> others) {
		var ret = (T) this;
		for (var other : others) {
			ret = ret.merge(other);
		}
		return ret;
	}
}
