package absstr.ir;

import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * A side-effect free IR expression.
 */
public abstract class Expression {
	/**
	 * Binary operations.
	 */
	public enum BinOpType {
		PIECE,
		INT_EQUAL,
		INT_NOTEQUAL,
		INT_LESS,
		INT_SLESS,
		INT_LESSEQUAL,
		INT_SLESSEQUAL,
		INT_ADD,
		INT_SUB,
		INT_XOR,
		INT_AND,
		INT_OR,
		INT_LEFT,
		INT_RIGHT,
		INT_MULT,
		BOOL_XOR,
		BOOL_AND,
		BOOL_OR;

		/**
		 * @return Whether the result is a single-byte boolean.
		 */
		public boolean isComparison() {
			switch (this) {
			case INT_EQUAL:
			case INT_NOTEQUAL:
			case INT_LESS:
			case INT_SLESS:
			case INT_LESSEQUAL:
			case INT_SLESSEQUAL:
			case BOOL_XOR:
			case BOOL_AND:
			case BOOL_OR:
				return true;
			default:
				return false;
			}
		}
	}

	/**
	 * Unary operations.
	 */
	public enum UnOpType {
		INT_NEGATE,
		INT_2COMP,
		BOOL_NEGATE,
	}

	/**
	 * Casts.
	 */
	public enum CastOpType {
		INT_ZEXT,
		INT_SEXT,
		INT2FLOAT,
		FLOAT2FLOAT,
		TRUNC,
		POPCOUNT,
	}

	private Expression() {
	}

	/**
	 * @return The byte size of the value of this expression.
	 */
	public abstract int getSize();

	/**
	 * Evaluate this expression if it only depends on constants.
	 *
	 * @return The value, masked to the size of the expression.
	 */
	public abstract OptionalLong evaluateConstant();

	/**
	 * Recognize expressions of the form {@code base + offset}.
	 *
	 * @return The base variable and offset, if this is one.
	 */
	public Optional<Pointer> asPointer() {
		return Optional.empty();
	}

	/**
	 * A register plus a constant byte offset.
	 */
	public static final class Pointer {
		private final Variable base;
		private final long offset;

		public Pointer(Variable base, long offset) {
			this.base = Objects.requireNonNull(base);
			this.offset = offset;
		}

		public Variable getBase() {
			return this.base;
		}

		public long getOffset() {
			return this.offset;
		}

		@Override
		public boolean equals(Object obj) {
			if (obj == this) {
				return true;
			} else if (obj instanceof Pointer other) {
				return this.base.equals(other.base) && this.offset == other.offset;
			} else {
				return false;
			}
		}

		@Override
		public int hashCode() {
			return Objects.hash(this.base, this.offset);
		}

		@Override
		public String toString() {
			return String.format("%s + %#x", this.base, this.offset);
		}
	}

	static long mask(long value, int size) {
		if (size >= Long.BYTES) {
			return value;
		}
		return value & ((1L << (8 * size)) - 1);
	}

	static long signExtend(long value, int size) {
		if (size >= Long.BYTES) {
			return value;
		}
		int shift = 64 - 8 * size;
		return (value << shift) >> shift;
	}

	public static Expression var(Variable var) {
		return new Var(var);
	}

	public static Expression constant(long value, int size) {
		return new Const(value, size);
	}

	public static Expression binOp(BinOpType op, Expression lhs, Expression rhs) {
		return new BinOp(op, lhs, rhs);
	}

	public static Expression unOp(UnOpType op, Expression arg) {
		return new UnOp(op, arg);
	}

	public static Expression cast(CastOpType op, int size, Expression arg) {
		return new Cast(op, size, arg);
	}

	public static Expression subpiece(int lowByte, int size, Expression arg) {
		return new Subpiece(lowByte, size, arg);
	}

	public static Expression unknown(String description, int size) {
		return new Unknown(description, size);
	}

	/**
	 * A variable read.
	 */
	public static final class Var extends Expression {
		private final Variable var;

		private Var(Variable var) {
			this.var = Objects.requireNonNull(var);
		}

		public Variable getVariable() {
			return this.var;
		}

		@Override
		public int getSize() {
			return this.var.getSize();
		}

		@Override
		public OptionalLong evaluateConstant() {
			return OptionalLong.empty();
		}

		@Override
		public Optional<Pointer> asPointer() {
			return Optional.of(new Pointer(this.var, 0));
		}

		@Override
		public boolean equals(Object obj) {
			return obj instanceof Var other && this.var.equals(other.var);
		}

		@Override
		public int hashCode() {
			return this.var.hashCode();
		}

		@Override
		public String toString() {
			return this.var.toString();
		}
	}

	/**
	 * A constant bitvector.
	 */
	public static final class Const extends Expression {
		private final long value;
		private final int size;

		private Const(long value, int size) {
			this.value = mask(value, size);
			this.size = size;
		}

		public long getValue() {
			return this.value;
		}

		@Override
		public int getSize() {
			return this.size;
		}

		@Override
		public OptionalLong evaluateConstant() {
			return OptionalLong.of(this.value);
		}

		@Override
		public boolean equals(Object obj) {
			return obj instanceof Const other
				&& this.value == other.value
				&& this.size == other.size;
		}

		@Override
		public int hashCode() {
			return Objects.hash(this.value, this.size);
		}

		@Override
		public String toString() {
			return String.format("%#x:%d", this.value, this.size);
		}
	}

	/**
	 * A binary operation.
	 */
	public static final class BinOp extends Expression {
		private final BinOpType op;
		private final Expression lhs;
		private final Expression rhs;

		private BinOp(BinOpType op, Expression lhs, Expression rhs) {
			this.op = Objects.requireNonNull(op);
			this.lhs = Objects.requireNonNull(lhs);
			this.rhs = Objects.requireNonNull(rhs);
		}

		public BinOpType getOp() {
			return this.op;
		}

		public Expression getLhs() {
			return this.lhs;
		}

		public Expression getRhs() {
			return this.rhs;
		}

		@Override
		public int getSize() {
			if (this.op.isComparison()) {
				return 1;
			} else if (this.op == BinOpType.PIECE) {
				return this.lhs.getSize() + this.rhs.getSize();
			} else {
				return this.lhs.getSize();
			}
		}

		@Override
		public OptionalLong evaluateConstant() {
			var l = this.lhs.evaluateConstant();
			var r = this.rhs.evaluateConstant();
			if (!l.isPresent() || !r.isPresent()) {
				return OptionalLong.empty();
			}

			long a = l.getAsLong();
			long b = r.getAsLong();
			int size = this.lhs.getSize();
			long result;
			switch (this.op) {
			case INT_EQUAL:
				result = a == b ? 1 : 0;
				break;
			case INT_NOTEQUAL:
				result = a != b ? 1 : 0;
				break;
			case INT_LESS:
				result = Long.compareUnsigned(a, b) < 0 ? 1 : 0;
				break;
			case INT_LESSEQUAL:
				result = Long.compareUnsigned(a, b) <= 0 ? 1 : 0;
				break;
			case INT_SLESS:
				result = signExtend(a, size) < signExtend(b, size) ? 1 : 0;
				break;
			case INT_SLESSEQUAL:
				result = signExtend(a, size) <= signExtend(b, size) ? 1 : 0;
				break;
			case INT_ADD:
				result = a + b;
				break;
			case INT_SUB:
				result = a - b;
				break;
			case INT_MULT:
				result = a * b;
				break;
			case INT_XOR:
			case BOOL_XOR:
				result = a ^ b;
				break;
			case INT_AND:
			case BOOL_AND:
				result = a & b;
				break;
			case INT_OR:
			case BOOL_OR:
				result = a | b;
				break;
			case INT_LEFT:
				result = b >= 64 ? 0 : a << b;
				break;
			case INT_RIGHT:
				result = b >= 64 ? 0 : a >>> b;
				break;
			case PIECE:
				if (getSize() > Long.BYTES) {
					return OptionalLong.empty();
				}
				result = (a << (8 * this.rhs.getSize())) | b;
				break;
			default:
				return OptionalLong.empty();
			}
			return OptionalLong.of(mask(result, getSize()));
		}

		@Override
		public Optional<Pointer> asPointer() {
			if (this.op != BinOpType.INT_ADD && this.op != BinOpType.INT_SUB) {
				return Optional.empty();
			}

			var offset = this.rhs.evaluateConstant();
			if (this.lhs instanceof Var var && offset.isPresent()) {
				long delta = signExtend(offset.getAsLong(), this.rhs.getSize());
				if (this.op == BinOpType.INT_SUB) {
					delta = -delta;
				}
				return Optional.of(new Pointer(var.getVariable(), delta));
			}

			offset = this.lhs.evaluateConstant();
			if (this.op == BinOpType.INT_ADD && this.rhs instanceof Var var && offset.isPresent()) {
				long delta = signExtend(offset.getAsLong(), this.lhs.getSize());
				return Optional.of(new Pointer(var.getVariable(), delta));
			}

			return Optional.empty();
		}

		@Override
		public boolean equals(Object obj) {
			return obj instanceof BinOp other
				&& this.op == other.op
				&& this.lhs.equals(other.lhs)
				&& this.rhs.equals(other.rhs);
		}

		@Override
		public int hashCode() {
			return Objects.hash(this.op, this.lhs, this.rhs);
		}

		@Override
		public String toString() {
			return String.format("%s(%s, %s)", this.op, this.lhs, this.rhs);
		}
	}

	/**
	 * A unary operation.
	 */
	public static final class UnOp extends Expression {
		private final UnOpType op;
		private final Expression arg;

		private UnOp(UnOpType op, Expression arg) {
			this.op = Objects.requireNonNull(op);
			this.arg = Objects.requireNonNull(arg);
		}

		public UnOpType getOp() {
			return this.op;
		}

		public Expression getArg() {
			return this.arg;
		}

		@Override
		public int getSize() {
			return this.arg.getSize();
		}

		@Override
		public OptionalLong evaluateConstant() {
			var value = this.arg.evaluateConstant();
			if (!value.isPresent()) {
				return value;
			}

			long a = value.getAsLong();
			switch (this.op) {
			case INT_NEGATE:
				return OptionalLong.of(mask(~a, getSize()));
			case INT_2COMP:
				return OptionalLong.of(mask(-a, getSize()));
			case BOOL_NEGATE:
				return OptionalLong.of(a == 0 ? 1 : 0);
			default:
				return OptionalLong.empty();
			}
		}

		@Override
		public boolean equals(Object obj) {
			return obj instanceof UnOp other
				&& this.op == other.op
				&& this.arg.equals(other.arg);
		}

		@Override
		public int hashCode() {
			return Objects.hash(this.op, this.arg);
		}

		@Override
		public String toString() {
			return String.format("%s(%s)", this.op, this.arg);
		}
	}

	/**
	 * A cast to a different size or number representation.
	 */
	public static final class Cast extends Expression {
		private final CastOpType op;
		private final int size;
		private final Expression arg;

		private Cast(CastOpType op, int size, Expression arg) {
			this.op = Objects.requireNonNull(op);
			this.size = size;
			this.arg = Objects.requireNonNull(arg);
		}

		public CastOpType getOp() {
			return this.op;
		}

		public Expression getArg() {
			return this.arg;
		}

		@Override
		public int getSize() {
			return this.size;
		}

		@Override
		public OptionalLong evaluateConstant() {
			var value = this.arg.evaluateConstant();
			if (!value.isPresent()) {
				return value;
			}

			switch (this.op) {
			case INT_ZEXT:
			case TRUNC:
				return OptionalLong.of(mask(value.getAsLong(), this.size));
			case INT_SEXT:
				return OptionalLong.of(mask(signExtend(value.getAsLong(), this.arg.getSize()), this.size));
			default:
				return OptionalLong.empty();
			}
		}

		@Override
		public boolean equals(Object obj) {
			return obj instanceof Cast other
				&& this.op == other.op
				&& this.size == other.size
				&& this.arg.equals(other.arg);
		}

		@Override
		public int hashCode() {
			return Objects.hash(this.op, this.size, this.arg);
		}

		@Override
		public String toString() {
			return String.format("%s:%d(%s)", this.op, this.size, this.arg);
		}
	}

	/**
	 * Extracts {@code size} bytes starting at {@code lowByte}.
	 */
	public static final class Subpiece extends Expression {
		private final int lowByte;
		private final int size;
		private final Expression arg;

		private Subpiece(int lowByte, int size, Expression arg) {
			this.lowByte = lowByte;
			this.size = size;
			this.arg = Objects.requireNonNull(arg);
		}

		public int getLowByte() {
			return this.lowByte;
		}

		public Expression getArg() {
			return this.arg;
		}

		@Override
		public int getSize() {
			return this.size;
		}

		@Override
		public OptionalLong evaluateConstant() {
			var value = this.arg.evaluateConstant();
			if (!value.isPresent() || this.lowByte >= Long.BYTES) {
				return OptionalLong.empty();
			}
			return OptionalLong.of(mask(value.getAsLong() >>> (8 * this.lowByte), this.size));
		}

		@Override
		public boolean equals(Object obj) {
			return obj instanceof Subpiece other
				&& this.lowByte == other.lowByte
				&& this.size == other.size
				&& this.arg.equals(other.arg);
		}

		@Override
		public int hashCode() {
			return Objects.hash(this.lowByte, this.size, this.arg);
		}

		@Override
		public String toString() {
			return String.format("(%s)[%d..%d]", this.arg, this.lowByte, this.lowByte + this.size);
		}
	}

	/**
	 * A value the lifter could not express.
	 */
	public static final class Unknown extends Expression {
		private final String description;
		private final int size;

		private Unknown(String description, int size) {
			this.description = Objects.requireNonNull(description);
			this.size = size;
		}

		public String getDescription() {
			return this.description;
		}

		@Override
		public int getSize() {
			return this.size;
		}

		@Override
		public OptionalLong evaluateConstant() {
			return OptionalLong.empty();
		}

		@Override
		public boolean equals(Object obj) {
			return obj instanceof Unknown other
				&& this.description.equals(other.description)
				&& this.size == other.size;
		}

		@Override
		public int hashCode() {
			return Objects.hash(this.description, this.size);
		}

		@Override
		public String toString() {
			return String.format("Unknown(%s)", this.description);
		}
	}
}
