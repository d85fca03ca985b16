package absstr.analysis.strings;

import absstr.StringsConfig;
import absstr.analysis.fixpoint.ForwardInterproceduralContext;
import absstr.domain.AbstractIdentifier;
import absstr.domain.AbstractLocation;
import absstr.domain.StringDomain;
import absstr.graph.Graph;
import absstr.graph.Node;
import absstr.graph.ProgramCfg;
import absstr.ir.Blk;
import absstr.ir.CallingConvention;
import absstr.ir.Def;
import absstr.ir.Expression;
import absstr.ir.ExternSymbol;
import absstr.ir.Jmp;
import absstr.ir.Project;
import absstr.ir.Term;
import absstr.ir.Tid;
import absstr.ir.Variable;
import absstr.memory.RuntimeMemoryImage;
import absstr.util.Log;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableMap;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * The transfer functions of the string analysis.
 *
 * <p>A tracked location holds a pointer, and its value is the abstract value
 * of the NUL-terminated string it points to.  Locations are registers, memory
 * cells addressed relative to a register, and global memory cells, all keyed
 * by the function they are observed in.  Aliasing between distinct locations
 * that point to the same buffer is not modeled.</p>
 *
 * <p>A context is built once per analysis run.  It only holds read-only
 * references, so all transfer functions are pure.</p>
 *
 * @param <T>
 *            The string domain.
 */
public final class Context<T extends StringDomain<T>> implements ForwardInterproceduralContext<State<T>> {
	/** The program control flow graph on which the fixpoint will be computed. */
	private final Graph graph;
	/** The binary being analyzed. */
	private final Project project;
	/** Global memory, for reading read-only strings.  Writeable memory is not tracked. */
	private final RuntimeMemoryImage runtimeMemoryImage;
	/** Creates the abstract value of a string literal. */
	private final Function<String, T> literal;
	/** The abstract value of the empty string. */
	private final T emptyString;
	/** Maps the tid of every block, def and jump to its function. */
	private final ImmutableMap<Tid, Tid> functionOfTerm;

	public Context(Project project, RuntimeMemoryImage runtimeMemoryImage, Function<String, T> literal) {
		this.project = Objects.requireNonNull(project);
		this.runtimeMemoryImage = Objects.requireNonNull(runtimeMemoryImage);
		this.literal = Objects.requireNonNull(literal);
		this.emptyString = literal.apply("");

		var program = project.getProgram().getTerm();
		this.graph = ProgramCfg.build(program, program.getExternSymbols().keySet());

		var functions = new HashMap<Tid, Tid>();
		for (var sub : program.getSubs()) {
			for (var blk : sub.getTerm().getBlocks()) {
				functions.put(blk.getTid(), sub.getTid());
				blk.getTerm().getDefs().forEach(def -> functions.put(def.getTid(), sub.getTid()));
				blk.getTerm().getJmps().forEach(jmp -> functions.put(jmp.getTid(), sub.getTid()));
			}
		}
		this.functionOfTerm = ImmutableMap.copyOf(functions);

		Log.info("String analysis context for %s: %s", project, this.graph);
	}

	public Project getProject() {
		return this.project;
	}

	public RuntimeMemoryImage getRuntimeMemoryImage() {
		return this.runtimeMemoryImage;
	}

	@Override
	public Graph getGraph() {
		return this.graph;
	}

	@Override
	public State<T> merge(State<T> state1, State<T> state2) {
		return state1.merge(state2);
	}

	/**
	 * @return The function containing the given term.
	 */
	private Tid functionOf(Tid term) {
		var sub = this.functionOfTerm.get(term);
		Preconditions.checkArgument(sub != null, "Term %s is not part of the program", term);
		return sub;
	}

	private static AbstractIdentifier registerId(Tid time, Variable var) {
		return new AbstractIdentifier(time, AbstractLocation.register(var));
	}

	/**
	 * @return The memory cell an address expression refers to, if it can be
	 *         named.
	 */
	private static Optional<AbstractLocation> memoryLocation(Expression address) {
		var constant = address.evaluateConstant();
		if (constant.isPresent()) {
			return Optional.of(AbstractLocation.global(constant.getAsLong()));
		}
		return address.asPointer()
			.map(ptr -> AbstractLocation.pointer(ptr.getBase(), ptr.getOffset()));
	}

	/**
	 * @return The string literal at a read-only global address, if any.
	 */
	private Optional<T> readGlobalString(long address) {
		if (!StringsConfig.TRACK_GLOBAL_STRINGS
			|| !this.runtimeMemoryImage.isGlobalMemoryAddress(address)
			|| this.runtimeMemoryImage.isAddressWriteable(address)) {
			return Optional.empty();
		}
		return this.runtimeMemoryImage.readStringUntilNullTerminator(address)
			.map(this.literal);
	}

	/**
	 * @return The string an expression points to, or empty for top.
	 */
	private Optional<T> evaluate(State<T> state, Tid time, Expression expr) {
		var constant = expr.evaluateConstant();
		if (constant.isPresent()) {
			return readGlobalString(constant.getAsLong());
		}

		if (expr instanceof Expression.Var var) {
			return state.get(registerId(time, var.getVariable()));
		}

		var pointer = expr.asPointer().orElse(null);
		if (pointer != null && pointer.getOffset() > 0) {
			// A suffix of a known string keeps what's possible, nothing is certain
			return state.get(registerId(time, pointer.getBase()))
				.map(str -> str.merge(this.emptyString))
				.filter(str -> !str.isTop());
		}

		return Optional.empty();
	}

	/**
	 * @return The state with a register overwritten.  Memory cells addressed
	 *         off the register are lost.
	 */
	private static <U extends StringDomain<U>> State<U> overwriteRegister(State<U> state, Tid time, Variable var) {
		return state.filter((id, str) -> !id.getTime().equals(time) || !id.getLocation().dependsOn(var));
	}

	/**
	 * @return The state with a register assigned.  If the new value is the
	 *         old one plus a constant, cells addressed off the register are
	 *         re-addressed instead of lost.
	 */
	private static <U extends StringDomain<U>> State<U> assignRegister(State<U> state, Tid time, Variable var, Expression value) {
		var result = overwriteRegister(state, time, var);
		var pointer = value.asPointer()
			.filter(ptr -> ptr.getBase().getName().equals(var.getName()))
			.orElse(null);
		if (pointer == null) {
			return result;
		}

		long delta = pointer.getOffset();
		for (var entry : state.getStringsTracked().entrySet()) {
			var id = entry.getKey();
			var location = id.getLocation();
			if (id.getTime().equals(time)
				&& location.getKind() == AbstractLocation.Kind.POINTER
				&& location.dependsOn(var)) {
				var moved = AbstractLocation.pointer(location.getVariable(), location.getOffset() - delta);
				result = result.with(new AbstractIdentifier(time, moved), entry.getValue());
			}
		}
		return result;
	}

	/**
	 * @return Whether a store to the given cell may overwrite the tracked cell.
	 */
	private static boolean mayAlias(AbstractLocation stored, int size, AbstractLocation tracked, int pointerSize) {
		if (!tracked.isMemory()) {
			return false;
		}

		boolean comparable = stored.getKind() == tracked.getKind()
			&& (stored.getKind() == AbstractLocation.Kind.GLOBAL
				|| stored.getVariable().getName().equals(tracked.getVariable().getName()));
		if (!comparable) {
			// Different bases may point anywhere
			return true;
		}

		long start = stored.getOffset();
		long other = tracked.getOffset();
		return start < other + pointerSize && other < start + size;
	}

	@Override
	public Optional<State<T>> updateDef(State<T> state, Term<Def> def) {
		var time = functionOf(def.getTid());
		var term = def.getTerm();

		if (term instanceof Def.Assign assign) {
			var var = assign.getVariable();
			var value = evaluate(state, time, assign.getValue());
			var result = assignRegister(state, time, var, assign.getValue());
			if (value.isPresent()) {
				result = result.with(registerId(time, var), value.get());
			}
			return Optional.of(result);
		} else if (term instanceof Def.Load load) {
			var var = load.getVariable();
			var value = loadValue(state, time, load.getAddress(), var.getSize());
			var result = overwriteRegister(state, time, var);
			if (value.isPresent()) {
				result = result.with(registerId(time, var), value.get());
			}
			return Optional.of(result);
		} else if (term instanceof Def.Store store) {
			return Optional.of(storeValue(state, time, store));
		}

		return Optional.of(state);
	}

	private Optional<T> loadValue(State<T> state, Tid time, Expression address, int size) {
		var location = memoryLocation(address).orElse(null);
		if (location == null) {
			return Optional.empty();
		}

		var tracked = state.get(new AbstractIdentifier(time, location));
		if (tracked.isPresent() || location.getKind() != AbstractLocation.Kind.GLOBAL) {
			return tracked;
		}

		// A pointer stored in read-only memory, e.g. a string table
		long cell = location.getOffset();
		if (this.runtimeMemoryImage.isAddressWriteable(cell)) {
			return Optional.empty();
		}
		var pointer = this.runtimeMemoryImage.readPointer(cell, size);
		if (!pointer.isPresent()) {
			Log.trace("Could not read a pointer at %#x", cell);
			return Optional.empty();
		}
		return readGlobalString(pointer.getAsLong());
	}

	private State<T> storeValue(State<T> state, Tid time, Def.Store store) {
		var value = evaluate(state, time, store.getValue());
		var location = memoryLocation(store.getAddress()).orElse(null);

		State<T> result;
		if (location == null) {
			// Unknown target, any cell may be overwritten
			result = state.filter((id, str) -> !id.getLocation().isMemory());
		} else {
			int size = store.getValue().getSize();
			int pointerSize = this.project.getStackPointerRegister().getSize();
			result = state.filter((id, str) -> !mayAlias(location, size, id.getLocation(), pointerSize));
		}

		if (value.isPresent()) {
			if (location != null) {
				result = result.with(new AbstractIdentifier(time, location), value.get());
			}
			return result;
		}

		// The target may lie inside any tracked string
		return truncateStrings(result, store.getValue());
	}

	/**
	 * @return The state after bytes with the given value were written into
	 *         an unknown position of every tracked string.  Certain
	 *         characters may be gone, and the written ones become possible.
	 */
	private State<T> truncateStrings(State<T> state, Expression written) {
		// Any other byte may replace a terminator and expose unknown memory
		if (!isTerminator(written)) {
			return State.empty();
		}

		State<T> result = State.empty();
		for (var entry : state.getStringsTracked().entrySet()) {
			result = result.with(entry.getKey(), entry.getValue().merge(this.emptyString));
		}
		return result;
	}

	/**
	 * @return Whether a value written to memory is known to be all NUL bytes.
	 */
	private static boolean isTerminator(Expression value) {
		var constant = value.evaluateConstant();
		return constant.isPresent() && constant.getAsLong() == 0;
	}

	@Override
	public Optional<State<T>> updateJump(State<T> state, Term<Jmp> jump, Term<Jmp> untakenConditional, Term<Blk> target) {
		// Conditions are handled by specializeConditional()
		return Optional.of(state);
	}

	@Override
	public Optional<State<T>> updateCall(State<T> state, Term<Jmp> call, Node target) {
		var caller = functionOf(call.getTid());
		var callee = target.getSub().getTid();
		var cc = this.project.getStandardCallingConvention();

		var entry = state.filter((id, str) -> id.getTime().equals(caller) && isVisibleToCallee(id.getLocation(), cc));
		return Optional.of(rebind(entry, callee));
	}

	/**
	 * @return Whether a callee can observe a caller location: parameter
	 *         registers, cells addressed off them, and global memory.
	 */
	private static boolean isVisibleToCallee(AbstractLocation location, CallingConvention cc) {
		switch (location.getKind()) {
		case REGISTER:
		case POINTER:
			return cc.isParameterRegister(location.getVariable());
		default:
			return true;
		}
	}

	/**
	 * @return The state with every location moved to a different function.
	 */
	private static <U extends StringDomain<U>> State<U> rebind(State<U> state, Tid time) {
		State<U> result = State.empty();
		for (var entry : state.getStringsTracked().entrySet()) {
			result = result.with(entry.getKey().withTime(time), entry.getValue());
		}
		return result;
	}

	@Override
	public Optional<State<T>> updateReturn(State<T> state, State<T> stateBeforeCall, Term<Jmp> callTerm, Term<Jmp> returnTerm) {
		if (state == null || stateBeforeCall == null) {
			return Optional.empty();
		}

		var caller = functionOf(callTerm.getTid());
		var callee = functionOf(returnTerm.getTid());
		var cc = this.project.getStandardCallingConvention();

		// The callee preserves these for us. Memory cells may have been
		// written through a pointer passed to the callee.
		var result = stateBeforeCall.filter((id, str) -> {
			var location = id.getLocation();
			return id.getTime().equals(caller)
				&& location.getKind() == AbstractLocation.Kind.REGISTER
				&& cc.isCalleeSaved(location.getVariable());
		});

		for (var entry : state.getStringsTracked().entrySet()) {
			var id = entry.getKey();
			var location = id.getLocation();
			if (!id.getTime().equals(callee)) {
				continue;
			}

			boolean returned = location.getKind() == AbstractLocation.Kind.GLOBAL
				|| (location.getKind() == AbstractLocation.Kind.REGISTER && cc.isReturnRegister(location.getVariable()));
			if (returned) {
				result = result.with(id.withTime(caller), entry.getValue());
			}
		}

		return Optional.of(result);
	}

	@Override
	public Optional<State<T>> updateCallStub(State<T> state, Term<Jmp> call) {
		var time = functionOf(call.getTid());
		var symbol = externSymbol(call.getTerm()).orElse(null);
		var cc = symbol == null
			? this.project.getStandardCallingConvention()
			: this.project.getCallingConvention(symbol);

		if (symbol != null && symbol.isNoReturn()) {
			return Optional.empty();
		}

		var function = symbol == null
			? Optional.<StringFunction>empty()
			: StringFunction.forName(symbol.getName());
		if (symbol == null) {
			Log.debug("Call %s has no known target", call.getTid());
		} else if (!function.isPresent()) {
			Log.debug("Call to %s is not modeled", symbol.getName());
		}

		var returned = function
			.map(fn -> evaluateStringFunction(state, time, fn, symbol, cc))
			.filter(str -> !str.isTop());

		State<T> result;
		if (function.isPresent() && function.get().writesDestination()) {
			// Any tracked pointer may refer to the destination buffer
			result = State.empty();
		} else {
			// Anything the callee may have written is lost
			result = state.filter((id, str) -> !id.getTime().equals(time)
				|| (id.getLocation().getKind() == AbstractLocation.Kind.REGISTER
					&& cc.isCalleeSaved(id.getLocation().getVariable())));
		}

		if (returned.isPresent()) {
			var register = returnRegister(symbol, cc);
			if (register.isPresent()) {
				result = result.with(registerId(time, register.get()), returned.get());
			}
		}

		return Optional.of(result);
	}

	private Optional<ExternSymbol> externSymbol(Jmp call) {
		if (call instanceof Jmp.Call direct) {
			return this.project.getProgram().getTerm().getExternSymbol(direct.getTarget());
		}
		return Optional.empty();
	}

	/**
	 * @return The registers holding the parameters of an extern function.
	 */
	private static List<Variable> parameterRegisters(ExternSymbol symbol, CallingConvention cc) {
		var registers = new ArrayList<Variable>();
		for (var param : symbol.getParameters()) {
			var register = param.getRegister().orElse(null);
			if (register == null) {
				// Stack parameters are not tracked
				break;
			}
			registers.add(register);
		}

		if (registers.isEmpty()) {
			registers.addAll(cc.getIntegerParameterRegisters());
		}
		return registers;
	}

	private static Optional<Variable> returnRegister(ExternSymbol symbol, CallingConvention cc) {
		var declared = symbol.getReturnValues().stream()
			.flatMap(arg -> arg.getRegister().stream())
			.findFirst();
		if (declared.isPresent()) {
			return declared;
		}
		return cc.getIntegerReturnRegisters().stream().findFirst();
	}

	private T evaluateStringFunction(State<T> state, Tid time, StringFunction function, ExternSymbol symbol, CallingConvention cc) {
		var registers = parameterRegisters(symbol, cc);
		var top = this.emptyString.top();
		var args = new ArrayList<T>();
		for (int i = 0; i < function.getArity(); ++i) {
			if (i < registers.size()) {
				args.add(state.get(registerId(time, registers.get(i))).orElse(top));
			} else {
				args.add(top);
			}
		}
		return function.evaluate(args, this.emptyString);
	}

	@Override
	public Optional<State<T>> specializeConditional(State<T> state, Expression condition, Term<Blk> blockBeforeCondition, boolean isTrue) {
		var constant = condition.evaluateConstant();
		if (constant.isPresent() && (constant.getAsLong() != 0) != isTrue) {
			Log.debug("Branch at the end of %s is unreachable", blockBeforeCondition.getTid());
			return Optional.empty();
		}
		return Optional.of(state);
	}
}
