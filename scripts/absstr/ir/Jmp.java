package absstr.ir;

import java.util.Objects;
import java.util.Optional;

/**
 * A control flow transfer at the end of a block.
 */
public abstract class Jmp {
	private Jmp() {
	}

	/**
	 * @return The block this jump continues at after a call, if any.
	 */
	public Optional<Tid> getReturnTarget() {
		return Optional.empty();
	}

	public static Jmp branch(Tid target) {
		return new Branch(target);
	}

	public static Jmp branchInd(Expression target) {
		return new BranchInd(target);
	}

	public static Jmp cbranch(Tid target, Expression condition) {
		return new CBranch(target, condition);
	}

	/**
	 * @param returnTo
	 *            The return block, or null if the callee does not return.
	 */
	public static Jmp call(Tid target, Tid returnTo) {
		return new Call(target, returnTo);
	}

	public static Jmp callInd(Expression target, Tid returnTo) {
		return new CallInd(target, returnTo);
	}

	public static Jmp ret(Expression target) {
		return new Return(target);
	}

	public static Jmp callOther(String description, Tid returnTo) {
		return new CallOther(description, returnTo);
	}

	/**
	 * A direct intraprocedural jump.
	 */
	public static final class Branch extends Jmp {
		private final Tid target;

		private Branch(Tid target) {
			this.target = Objects.requireNonNull(target);
		}

		public Tid getTarget() {
			return this.target;
		}

		@Override
		public boolean equals(Object obj) {
			return obj instanceof Branch other && this.target.equals(other.target);
		}

		@Override
		public int hashCode() {
			return this.target.hashCode();
		}

		@Override
		public String toString() {
			return "Jump to " + this.target;
		}
	}

	/**
	 * An indirect intraprocedural jump.
	 */
	public static final class BranchInd extends Jmp {
		private final Expression target;

		private BranchInd(Expression target) {
			this.target = Objects.requireNonNull(target);
		}

		public Expression getTarget() {
			return this.target;
		}

		@Override
		public boolean equals(Object obj) {
			return obj instanceof BranchInd other && this.target.equals(other.target);
		}

		@Override
		public int hashCode() {
			return this.target.hashCode();
		}

		@Override
		public String toString() {
			return "Jump to " + this.target;
		}
	}

	/**
	 * A conditional jump, taken if the condition is non-zero.
	 */
	public static final class CBranch extends Jmp {
		private final Tid target;
		private final Expression condition;

		private CBranch(Tid target, Expression condition) {
			this.target = Objects.requireNonNull(target);
			this.condition = Objects.requireNonNull(condition);
		}

		public Tid getTarget() {
			return this.target;
		}

		public Expression getCondition() {
			return this.condition;
		}

		@Override
		public boolean equals(Object obj) {
			return obj instanceof CBranch other
				&& this.target.equals(other.target)
				&& this.condition.equals(other.condition);
		}

		@Override
		public int hashCode() {
			return Objects.hash(this.target, this.condition);
		}

		@Override
		public String toString() {
			return String.format("If %s jump to %s", this.condition, this.target);
		}
	}

	/**
	 * A direct call.
	 */
	public static final class Call extends Jmp {
		private final Tid target;
		private final Tid returnTo;

		private Call(Tid target, Tid returnTo) {
			this.target = Objects.requireNonNull(target);
			this.returnTo = returnTo;
		}

		public Tid getTarget() {
			return this.target;
		}

		@Override
		public Optional<Tid> getReturnTarget() {
			return Optional.ofNullable(this.returnTo);
		}

		@Override
		public boolean equals(Object obj) {
			return obj instanceof Call other
				&& this.target.equals(other.target)
				&& Objects.equals(this.returnTo, other.returnTo);
		}

		@Override
		public int hashCode() {
			return Objects.hash(this.target, this.returnTo);
		}

		@Override
		public String toString() {
			return String.format("call %s ret %s", this.target, this.returnTo);
		}
	}

	/**
	 * An indirect call.
	 */
	public static final class CallInd extends Jmp {
		private final Expression target;
		private final Tid returnTo;

		private CallInd(Expression target, Tid returnTo) {
			this.target = Objects.requireNonNull(target);
			this.returnTo = returnTo;
		}

		public Expression getTarget() {
			return this.target;
		}

		@Override
		public Optional<Tid> getReturnTarget() {
			return Optional.ofNullable(this.returnTo);
		}

		@Override
		public boolean equals(Object obj) {
			return obj instanceof CallInd other
				&& this.target.equals(other.target)
				&& Objects.equals(this.returnTo, other.returnTo);
		}

		@Override
		public int hashCode() {
			return Objects.hash(this.target, this.returnTo);
		}

		@Override
		public String toString() {
			return String.format("call %s ret %s", this.target, this.returnTo);
		}
	}

	/**
	 * A return from the current function.
	 */
	public static final class Return extends Jmp {
		private final Expression target;

		private Return(Expression target) {
			this.target = Objects.requireNonNull(target);
		}

		public Expression getTarget() {
			return this.target;
		}

		@Override
		public boolean equals(Object obj) {
			return obj instanceof Return other && this.target.equals(other.target);
		}

		@Override
		public int hashCode() {
			return this.target.hashCode();
		}

		@Override
		public String toString() {
			return "ret " + this.target;
		}
	}

	/**
	 * A processor-specific operation the lifter models as an opaque call.
	 */
	public static final class CallOther extends Jmp {
		private final String description;
		private final Tid returnTo;

		private CallOther(String description, Tid returnTo) {
			this.description = Objects.requireNonNull(description);
			this.returnTo = returnTo;
		}

		public String getDescription() {
			return this.description;
		}

		@Override
		public Optional<Tid> getReturnTarget() {
			return Optional.ofNullable(this.returnTo);
		}

		@Override
		public boolean equals(Object obj) {
			return obj instanceof CallOther other
				&& this.description.equals(other.description)
				&& Objects.equals(this.returnTo, other.returnTo);
		}

		@Override
		public int hashCode() {
			return Objects.hash(this.description, this.returnTo);
		}

		@Override
		public String toString() {
			return String.format("call %s ret %s", this.description, this.returnTo);
		}
	}
}
