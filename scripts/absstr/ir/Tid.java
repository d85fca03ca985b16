package absstr.ir;

import java.util.Objects;

/**
 * A term identifier, with the address of the instruction it was lifted from.
 */
public final class Tid {
	/** Placeholder for terms without a known address. */
	public static final String UNKNOWN_ADDRESS = "UNKNOWN";

	private final String id;
	private final String address;

	private Tid(String id, String address) {
		this.id = Objects.requireNonNull(id);
		this.address = Objects.requireNonNull(address);
	}

	/**
	 * @return A new tid without a known address.
	 */
	public static Tid of(String id) {
		return new Tid(id, UNKNOWN_ADDRESS);
	}

	/**
	 * @return A new tid for the given instruction address.
	 */
	public static Tid of(String id, String address) {
		return new Tid(id, address);
	}

	/**
	 * @return The unique identifier.
	 */
	public String getId() {
		return this.id;
	}

	/**
	 * @return The instruction address.
	 */
	public String getAddress() {
		return this.address;
	}

	@Override
	public boolean equals(Object obj) {
		if (obj == this) {
			return true;
		} else if (!(obj instanceof Tid)) {
			return false;
		}

		var other = (Tid) obj;
		return this.id.equals(other.id)
			&& this.address.equals(other.address);
	}

	@Override
	public int hashCode() {
		return Objects.hash(this.id, this.address);
	}

	@Override
	public String toString() {
		return this.id;
	}
}
