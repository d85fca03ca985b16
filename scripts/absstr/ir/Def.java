package absstr.ir;

import java.util.Objects;

/**
 * A straight-line IR statement.
 */
public abstract class Def {
	private Def() {
	}

	/**
	 * @return {@code var := [address]}
	 */
	public static Def load(Variable var, Expression address) {
		return new Load(var, address);
	}

	/**
	 * @return {@code [address] := value}
	 */
	public static Def store(Expression address, Expression value) {
		return new Store(address, value);
	}

	/**
	 * @return {@code var := value}
	 */
	public static Def assign(Variable var, Expression value) {
		return new Assign(var, value);
	}

	/**
	 * A memory read into a variable.
	 */
	public static final class Load extends Def {
		private final Variable var;
		private final Expression address;

		private Load(Variable var, Expression address) {
			this.var = Objects.requireNonNull(var);
			this.address = Objects.requireNonNull(address);
		}

		public Variable getVariable() {
			return this.var;
		}

		public Expression getAddress() {
			return this.address;
		}

		@Override
		public boolean equals(Object obj) {
			return obj instanceof Load other
				&& this.var.equals(other.var)
				&& this.address.equals(other.address);
		}

		@Override
		public int hashCode() {
			return Objects.hash(this.var, this.address);
		}

		@Override
		public String toString() {
			return String.format("%s := Load from %s", this.var, this.address);
		}
	}

	/**
	 * A memory write.
	 */
	public static final class Store extends Def {
		private final Expression address;
		private final Expression value;

		private Store(Expression address, Expression value) {
			this.address = Objects.requireNonNull(address);
			this.value = Objects.requireNonNull(value);
		}

		public Expression getAddress() {
			return this.address;
		}

		public Expression getValue() {
			return this.value;
		}

		@Override
		public boolean equals(Object obj) {
			return obj instanceof Store other
				&& this.address.equals(other.address)
				&& this.value.equals(other.value);
		}

		@Override
		public int hashCode() {
			return Objects.hash(this.address, this.value);
		}

		@Override
		public String toString() {
			return String.format("Store at %s := %s", this.address, this.value);
		}
	}

	/**
	 * A register assignment.
	 */
	public static final class Assign extends Def {
		private final Variable var;
		private final Expression value;

		private Assign(Variable var, Expression value) {
			this.var = Objects.requireNonNull(var);
			this.value = Objects.requireNonNull(value);
		}

		public Variable getVariable() {
			return this.var;
		}

		public Expression getValue() {
			return this.value;
		}

		@Override
		public boolean equals(Object obj) {
			return obj instanceof Assign other
				&& this.var.equals(other.var)
				&& this.value.equals(other.value);
		}

		@Override
		public int hashCode() {
			return Objects.hash(this.var, this.value);
		}

		@Override
		public String toString() {
			return String.format("%s := %s", this.var, this.value);
		}
	}
}
