package absstr.ir;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A function imported from a library, whose body is not analyzed.
 */
public final class ExternSymbol {
	private final Tid tid;
	private final String name;
	private final String callingConvention;
	private final ImmutableList<Arg> parameters;
	private final ImmutableList<Arg> returnValues;
	private final boolean noReturn;
	private final boolean hasVarArgs;

	public ExternSymbol(Tid tid, String name, String callingConvention,
			List<Arg> parameters, List<Arg> returnValues,
			boolean noReturn, boolean hasVarArgs) {
		this.tid = Objects.requireNonNull(tid);
		this.name = Objects.requireNonNull(name);
		this.callingConvention = callingConvention;
		this.parameters = ImmutableList.copyOf(parameters);
		this.returnValues = ImmutableList.copyOf(returnValues);
		this.noReturn = noReturn;
		this.hasVarArgs = hasVarArgs;
	}

	/**
	 * @return A symbol using the project's default calling convention.
	 */
	public static ExternSymbol of(Tid tid, String name) {
		return new ExternSymbol(tid, name, null, List.of(), List.of(), false, false);
	}

	public Tid getTid() {
		return this.tid;
	}

	public String getName() {
		return this.name;
	}

	/**
	 * @return The name of the calling convention, if known.
	 */
	public Optional<String> getCallingConvention() {
		return Optional.ofNullable(this.callingConvention);
	}

	public ImmutableList<Arg> getParameters() {
		return this.parameters;
	}

	public ImmutableList<Arg> getReturnValues() {
		return this.returnValues;
	}

	public boolean isNoReturn() {
		return this.noReturn;
	}

	public boolean hasVarArgs() {
		return this.hasVarArgs;
	}

	@Override
	public boolean equals(Object obj) {
		if (obj == this) {
			return true;
		} else if (!(obj instanceof ExternSymbol)) {
			return false;
		}

		var other = (ExternSymbol) obj;
		return this.tid.equals(other.tid)
			&& this.name.equals(other.name)
			&& Objects.equals(this.callingConvention, other.callingConvention)
			&& this.parameters.equals(other.parameters)
			&& this.returnValues.equals(other.returnValues)
			&& this.noReturn == other.noReturn
			&& this.hasVarArgs == other.hasVarArgs;
	}

	@Override
	public int hashCode() {
		return Objects.hash(this.tid, this.name, this.callingConvention,
			this.parameters, this.returnValues, this.noReturn, this.hasVarArgs);
	}

	@Override
	public String toString() {
		return this.name;
	}
}
