package absstr.ir;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import java.util.List;
import java.util.Objects;

/**
 * The register usage of a calling convention.
 */
public final class CallingConvention {
	private final String name;
	private final ImmutableList<Variable> integerParameterRegisters;
	private final ImmutableList<Variable> integerReturnRegisters;
	private final ImmutableSet<String> calleeSavedRegisters;

	public CallingConvention(String name, List<Variable> integerParameterRegisters,
			List<Variable> integerReturnRegisters, List<String> calleeSavedRegisters) {
		this.name = Objects.requireNonNull(name);
		this.integerParameterRegisters = ImmutableList.copyOf(integerParameterRegisters);
		this.integerReturnRegisters = ImmutableList.copyOf(integerReturnRegisters);
		this.calleeSavedRegisters = ImmutableSet.copyOf(calleeSavedRegisters);
	}

	public String getName() {
		return this.name;
	}

	/**
	 * @return The integer parameter registers, in parameter order.
	 */
	public ImmutableList<Variable> getIntegerParameterRegisters() {
		return this.integerParameterRegisters;
	}

	public ImmutableList<Variable> getIntegerReturnRegisters() {
		return this.integerReturnRegisters;
	}

	/**
	 * @return The names of the registers a callee must preserve.
	 */
	public ImmutableSet<String> getCalleeSavedRegisters() {
		return this.calleeSavedRegisters;
	}

	/**
	 * @return Whether a callee preserves the given register.
	 */
	public boolean isCalleeSaved(Variable var) {
		return !var.isTemp() && this.calleeSavedRegisters.contains(var.getName());
	}

	/**
	 * @return Whether the given register carries a parameter.
	 */
	public boolean isParameterRegister(Variable var) {
		return this.integerParameterRegisters.stream()
			.anyMatch(reg -> reg.getName().equals(var.getName()));
	}

	/**
	 * @return Whether the given register carries a return value.
	 */
	public boolean isReturnRegister(Variable var) {
		return this.integerReturnRegisters.stream()
			.anyMatch(reg -> reg.getName().equals(var.getName()));
	}

	@Override
	public boolean equals(Object obj) {
		if (obj == this) {
			return true;
		} else if (!(obj instanceof CallingConvention)) {
			return false;
		}

		var other = (CallingConvention) obj;
		return this.name.equals(other.name)
			&& this.integerParameterRegisters.equals(other.integerParameterRegisters)
			&& this.integerReturnRegisters.equals(other.integerReturnRegisters)
			&& this.calleeSavedRegisters.equals(other.calleeSavedRegisters);
	}

	@Override
	public int hashCode() {
		return Objects.hash(this.name, this.integerParameterRegisters,
			this.integerReturnRegisters, this.calleeSavedRegisters);
	}

	@Override
	public String toString() {
		return this.name;
	}
}
