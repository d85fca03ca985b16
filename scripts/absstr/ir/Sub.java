package absstr.ir;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;

/**
 * A function.  The first block is the entry point.
 */
public final class Sub {
	private final String name;
	private final ImmutableList<Term<Blk>> blocks;

	public Sub(String name, List<Term<Blk>> blocks) {
		this.name = Objects.requireNonNull(name);
		this.blocks = ImmutableList.copyOf(blocks);
	}

	public String getName() {
		return this.name;
	}

	public ImmutableList<Term<Blk>> getBlocks() {
		return this.blocks;
	}

	@Override
	public boolean equals(Object obj) {
		if (obj == this) {
			return true;
		} else if (!(obj instanceof Sub)) {
			return false;
		}

		var other = (Sub) obj;
		return this.name.equals(other.name)
			&& this.blocks.equals(other.blocks);
	}

	@Override
	public int hashCode() {
		return Objects.hash(this.name, this.blocks);
	}

	@Override
	public String toString() {
		return this.name;
	}
}
