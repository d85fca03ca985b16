package absstr.ir;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * A function parameter or return value, passed in a register or on the stack.
 */
public final class Arg {
	private final Variable register;
	private final long stackOffset;
	private final int size;

	private Arg(Variable register, long stackOffset, int size) {
		this.register = register;
		this.stackOffset = stackOffset;
		this.size = size;
	}

	public static Arg register(Variable register) {
		return new Arg(Objects.requireNonNull(register), 0, register.getSize());
	}

	/**
	 * @param offset
	 *            The offset from the stack pointer at the call.
	 */
	public static Arg stack(long offset, int size) {
		return new Arg(null, offset, size);
	}

	/**
	 * @return The register, if passed in one.
	 */
	public Optional<Variable> getRegister() {
		return Optional.ofNullable(this.register);
	}

	/**
	 * @return The stack offset, if passed on the stack.
	 */
	public OptionalLong getStackOffset() {
		if (this.register != null) {
			return OptionalLong.empty();
		}
		return OptionalLong.of(this.stackOffset);
	}

	public int getSize() {
		return this.size;
	}

	@Override
	public boolean equals(Object obj) {
		if (obj == this) {
			return true;
		} else if (obj instanceof Arg other) {
			return Objects.equals(this.register, other.register)
				&& this.stackOffset == other.stackOffset
				&& this.size == other.size;
		} else {
			return false;
		}
	}

	@Override
	public int hashCode() {
		return Objects.hash(this.register, this.stackOffset, this.size);
	}

	@Override
	public String toString() {
		if (this.register != null) {
			return this.register.toString();
		}
		return String.format("[sp + %#x]:%d", this.stackOffset, this.size);
	}
}
