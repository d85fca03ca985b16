package absstr.ir;

import com.google.common.base.Preconditions;

import java.util.Objects;

/**
 * A register or temporary variable of the IR.
 */
public final class Variable {
	private final String name;
	private final int size;
	private final boolean temp;

	private Variable(String name, int size, boolean temp) {
		Preconditions.checkArgument(size > 0, "Invalid variable size %s", size);
		this.name = Objects.requireNonNull(name);
		this.size = size;
		this.temp = temp;
	}

	/**
	 * @return A physical register of the given byte size.
	 */
	public static Variable register(String name, int size) {
		return new Variable(name, size, false);
	}

	/**
	 * @return A temporary variable of the given byte size.
	 */
	public static Variable temp(String name, int size) {
		return new Variable(name, size, true);
	}

	public String getName() {
		return this.name;
	}

	/**
	 * @return The size in bytes.
	 */
	public int getSize() {
		return this.size;
	}

	/**
	 * @return Whether this is a temporary introduced by lifting.
	 */
	public boolean isTemp() {
		return this.temp;
	}

	@Override
	public boolean equals(Object obj) {
		if (obj == this) {
			return true;
		} else if (!(obj instanceof Variable)) {
			return false;
		}

		var other = (Variable) obj;
		return this.name.equals(other.name)
			&& this.size == other.size
			&& this.temp == other.temp;
	}

	@Override
	public int hashCode() {
		return Objects.hash(this.name, this.size, this.temp);
	}

	@Override
	public String toString() {
		return String.format("%s:%d", this.name, this.size);
	}
}
