package absstr.ir;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * The functions and imported symbols of a binary.
 */
public final class Program {
	private final ImmutableList<Term<Sub>> subs;
	private final ImmutableMap<Tid, ExternSymbol> externSymbols;
	private final ImmutableList<Tid> entryPoints;

	public Program(List<Term<Sub>> subs, List<ExternSymbol> externSymbols, List<Tid> entryPoints) {
		this.subs = ImmutableList.copyOf(subs);
		this.externSymbols = externSymbols.stream()
			.collect(ImmutableMap.toImmutableMap(ExternSymbol::getTid, Function.identity()));
		this.entryPoints = ImmutableList.copyOf(entryPoints);
	}

	public ImmutableList<Term<Sub>> getSubs() {
		return this.subs;
	}

	public ImmutableMap<Tid, ExternSymbol> getExternSymbols() {
		return this.externSymbols;
	}

	/**
	 * @return The extern symbol with the given tid, if any.
	 */
	public Optional<ExternSymbol> getExternSymbol(Tid tid) {
		return Optional.ofNullable(this.externSymbols.get(tid));
	}

	/**
	 * @return The function with the given tid, if any.
	 */
	public Optional<Term<Sub>> getSub(Tid tid) {
		return this.subs.stream()
			.filter(sub -> sub.getTid().equals(tid))
			.findFirst();
	}

	public ImmutableList<Tid> getEntryPoints() {
		return this.entryPoints;
	}

	@Override
	public boolean equals(Object obj) {
		if (obj == this) {
			return true;
		} else if (!(obj instanceof Program)) {
			return false;
		}

		var other = (Program) obj;
		return this.subs.equals(other.subs)
			&& this.externSymbols.equals(other.externSymbols)
			&& this.entryPoints.equals(other.entryPoints);
	}

	@Override
	public int hashCode() {
		return Objects.hash(this.subs, this.externSymbols, this.entryPoints);
	}

	@Override
	public String toString() {
		return String.format("Program(%d subs, %d externs)", this.subs.size(), this.externSymbols.size());
	}
}
