package absstr.ir;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * A lifted binary, with the architecture details needed to analyze it.
 */
public final class Project {
	private final Term<Program> program;
	private final String cpuArchitecture;
	private final Variable stackPointerRegister;
	private final ImmutableMap<String, CallingConvention> callingConventions;
	private final String defaultCallingConvention;

	public Project(Term<Program> program, String cpuArchitecture, Variable stackPointerRegister,
			List<CallingConvention> callingConventions, String defaultCallingConvention) {
		this.program = Objects.requireNonNull(program);
		this.cpuArchitecture = Objects.requireNonNull(cpuArchitecture);
		this.stackPointerRegister = Objects.requireNonNull(stackPointerRegister);
		this.callingConventions = callingConventions.stream()
			.collect(ImmutableMap.toImmutableMap(CallingConvention::getName, Function.identity()));
		Preconditions.checkArgument(this.callingConventions.containsKey(defaultCallingConvention),
			"Unknown default calling convention %s", defaultCallingConvention);
		this.defaultCallingConvention = defaultCallingConvention;
	}

	public Term<Program> getProgram() {
		return this.program;
	}

	public String getCpuArchitecture() {
		return this.cpuArchitecture;
	}

	public Variable getStackPointerRegister() {
		return this.stackPointerRegister;
	}

	/**
	 * @return The calling convention with the given name, if known.
	 */
	public Optional<CallingConvention> getCallingConvention(String name) {
		return Optional.ofNullable(this.callingConventions.get(name));
	}

	/**
	 * @return The calling convention used when nothing else is known.
	 */
	public CallingConvention getStandardCallingConvention() {
		return this.callingConventions.get(this.defaultCallingConvention);
	}

	/**
	 * @return The calling convention of an extern symbol, falling back to
	 *         the standard one.
	 */
	public CallingConvention getCallingConvention(ExternSymbol symbol) {
		return symbol.getCallingConvention()
			.flatMap(this::getCallingConvention)
			.orElseGet(this::getStandardCallingConvention);
	}

	@Override
	public boolean equals(Object obj) {
		if (obj == this) {
			return true;
		} else if (!(obj instanceof Project)) {
			return false;
		}

		var other = (Project) obj;
		return this.program.equals(other.program)
			&& this.cpuArchitecture.equals(other.cpuArchitecture)
			&& this.stackPointerRegister.equals(other.stackPointerRegister)
			&& this.callingConventions.equals(other.callingConventions)
			&& this.defaultCallingConvention.equals(other.defaultCallingConvention);
	}

	@Override
	public int hashCode() {
		return Objects.hash(this.program, this.cpuArchitecture, this.stackPointerRegister,
			this.callingConventions, this.defaultCallingConvention);
	}

	@Override
	public String toString() {
		return String.format("Project(%s)", this.cpuArchitecture);
	}
}
