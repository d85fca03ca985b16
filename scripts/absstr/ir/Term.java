package absstr.ir;

import java.util.Objects;

/**
 * An IR object together with its unique term identifier.
 */
public final class Term<T> {
	private final Tid tid;
	private final T term;

	private Term(Tid tid, T term) {
		this.tid = Objects.requireNonNull(tid);
		this.term = Objects.requireNonNull(term);
	}

	public static <U> Term<U> of(Tid tid, U term) {
		return new Term<>(tid, term);
	}

	public Tid getTid() {
		return this.tid;
	}

	public T getTerm() {
		return this.term;
	}

	@Override
	public boolean equals(Object obj) {
		if (obj == this) {
			return true;
		} else if (!(obj instanceof Term)) {
			return false;
		}

		var other = (Term<?>) obj;
		return this.tid.equals(other.tid)
			&& this.term.equals(other.term);
	}

	@Override
	public int hashCode() {
		return Objects.hash(this.tid, this.term);
	}

	@Override
	public String toString() {
		return String.format("%s: %s", this.tid, this.term);
	}
}
