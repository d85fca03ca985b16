package absstr.ir;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;

/**
 * A basic block: a list of statements followed by one or two jumps.
 *
 * If there are two jumps, the first is a conditional jump and the second
 * is the fallthrough taken when the condition is false.
 */
public final class Blk {
	private final ImmutableList<Term<Def>> defs;
	private final ImmutableList<Term<Jmp>> jmps;
	private final ImmutableList<Tid> indirectJmpTargets;

	public Blk(List<Term<Def>> defs, List<Term<Jmp>> jmps, List<Tid> indirectJmpTargets) {
		this.defs = ImmutableList.copyOf(defs);
		this.jmps = ImmutableList.copyOf(jmps);
		this.indirectJmpTargets = ImmutableList.copyOf(indirectJmpTargets);
	}

	public Blk(List<Term<Def>> defs, List<Term<Jmp>> jmps) {
		this(defs, jmps, List.of());
	}

	public ImmutableList<Term<Def>> getDefs() {
		return this.defs;
	}

	public ImmutableList<Term<Jmp>> getJmps() {
		return this.jmps;
	}

	/**
	 * @return The possible targets of an indirect jump at the end of this block.
	 */
	public ImmutableList<Tid> getIndirectJmpTargets() {
		return this.indirectJmpTargets;
	}

	@Override
	public boolean equals(Object obj) {
		if (obj == this) {
			return true;
		} else if (!(obj instanceof Blk)) {
			return false;
		}

		var other = (Blk) obj;
		return this.defs.equals(other.defs)
			&& this.jmps.equals(other.jmps)
			&& this.indirectJmpTargets.equals(other.indirectJmpTargets);
	}

	@Override
	public int hashCode() {
		return Objects.hash(this.defs, this.jmps, this.indirectJmpTargets);
	}

	@Override
	public String toString() {
		return String.format("Blk(%d defs, %d jmps)", this.defs.size(), this.jmps.size());
	}
}
