package absstr.domain;

import absstr.ir.Variable;

import java.util.Objects;

/**
 * A storage location: a register, a memory cell addressed relative to a
 * register, or a global memory cell.
 */
public final class AbstractLocation {
	/**
	 * The kinds of location.
	 */
	public enum Kind {
		REGISTER,
		POINTER,
		GLOBAL,
	}

	private final Kind kind;
	private final Variable var;
	private final long offset;

	private AbstractLocation(Kind kind, Variable var, long offset) {
		this.kind = kind;
		this.var = var;
		this.offset = offset;
	}

	/**
	 * @return The location of a register.
	 */
	public static AbstractLocation register(Variable var) {
		return new AbstractLocation(Kind.REGISTER, Objects.requireNonNull(var), 0);
	}

	/**
	 * @return The memory cell at {@code base + offset}.
	 */
	public static AbstractLocation pointer(Variable base, long offset) {
		return new AbstractLocation(Kind.POINTER, Objects.requireNonNull(base), offset);
	}

	/**
	 * @return The global memory cell at a fixed address.
	 */
	public static AbstractLocation global(long address) {
		return new AbstractLocation(Kind.GLOBAL, null, address);
	}

	public Kind getKind() {
		return this.kind;
	}

	/**
	 * @return The register, or the base register of a pointer.
	 */
	public Variable getVariable() {
		return Objects.requireNonNull(this.var, "Global locations have no variable");
	}

	/**
	 * @return The offset from the base register, or the global address.
	 */
	public long getOffset() {
		return this.offset;
	}

	/**
	 * @return Whether this is a memory cell.
	 */
	public boolean isMemory() {
		return this.kind != Kind.REGISTER;
	}

	/**
	 * @return Whether this location is named by the given register, as the
	 *         register itself or as the base of a pointer.
	 */
	public boolean dependsOn(Variable register) {
		return this.var != null && this.var.getName().equals(register.getName());
	}

	@Override
	public boolean equals(Object obj) {
		if (obj == this) {
			return true;
		} else if (!(obj instanceof AbstractLocation)) {
			return false;
		}

		var other = (AbstractLocation) obj;
		return this.kind == other.kind
			&& Objects.equals(this.var, other.var)
			&& this.offset == other.offset;
	}

	@Override
	public int hashCode() {
		return Objects.hash(this.kind, this.var, this.offset);
	}

	@Override
	public String toString() {
		switch (this.kind) {
		case REGISTER:
			return this.var.toString();
		case POINTER:
			return String.format("[%s + %#x]", this.var, this.offset);
		default:
			return String.format("[%#x]", this.offset);
		}
	}
}
