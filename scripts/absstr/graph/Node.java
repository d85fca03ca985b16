package absstr.graph;

import absstr.ir.Blk;
import absstr.ir.Sub;
import absstr.ir.Term;

import java.util.Objects;
import java.util.Optional;

/**
 * A node of the interprocedural control flow graph.
 *
 * Every block has a start and an end node.  Call sites with a return target
 * get an extra CallReturn node, where the state from before the call meets
 * the state returned by the callee.
 */
public final class Node {
	/**
	 * The kinds of node.
	 */
	public enum Kind {
		BLK_START,
		BLK_END,
		CALL_RETURN,
	}

	private final Kind kind;
	private final Term<Blk> blk;
	private final Term<Sub> sub;
	private final Term<Blk> returnBlk;
	private final Term<Sub> callee;

	private Node(Kind kind, Term<Blk> blk, Term<Sub> sub, Term<Blk> returnBlk, Term<Sub> callee) {
		this.kind = kind;
		this.blk = Objects.requireNonNull(blk);
		this.sub = Objects.requireNonNull(sub);
		this.returnBlk = returnBlk;
		this.callee = callee;
	}

	public static Node blkStart(Term<Blk> blk, Term<Sub> sub) {
		return new Node(Kind.BLK_START, blk, sub, null, null);
	}

	public static Node blkEnd(Term<Blk> blk, Term<Sub> sub) {
		return new Node(Kind.BLK_END, blk, sub, null, null);
	}

	/**
	 * @param callBlk
	 *            The block ending with the call.
	 * @param returnBlk
	 *            The block the call returns to.
	 * @param caller
	 *            The function containing both blocks.
	 * @param callee
	 *            The called function.
	 */
	public static Node callReturn(Term<Blk> callBlk, Term<Blk> returnBlk, Term<Sub> caller, Term<Sub> callee) {
		return new Node(Kind.CALL_RETURN, callBlk, caller,
			Objects.requireNonNull(returnBlk), Objects.requireNonNull(callee));
	}

	public Kind getKind() {
		return this.kind;
	}

	/**
	 * @return The block, or the calling block of a CallReturn node.
	 */
	public Term<Blk> getBlk() {
		return this.blk;
	}

	/**
	 * @return The function containing the block.
	 */
	public Term<Sub> getSub() {
		return this.sub;
	}

	/**
	 * @return The block a CallReturn node returns to.
	 */
	public Optional<Term<Blk>> getReturnBlk() {
		return Optional.ofNullable(this.returnBlk);
	}

	/**
	 * @return The function called at a CallReturn node.
	 */
	public Optional<Term<Sub>> getCallee() {
		return Optional.ofNullable(this.callee);
	}

	// Nodes are compared by tid, comparing whole terms would be too slow

	@Override
	public boolean equals(Object obj) {
		if (obj == this) {
			return true;
		} else if (obj instanceof Node other) {
			return this.kind == other.kind
				&& this.blk.getTid().equals(other.blk.getTid())
				&& this.sub.getTid().equals(other.sub.getTid())
				&& Objects.equals(getReturnBlk().map(Term::getTid), other.getReturnBlk().map(Term::getTid))
				&& Objects.equals(getCallee().map(Term::getTid), other.getCallee().map(Term::getTid));
		} else {
			return false;
		}
	}

	@Override
	public int hashCode() {
		return Objects.hash(this.kind, this.blk.getTid(), this.sub.getTid(),
			getReturnBlk().map(Term::getTid), getCallee().map(Term::getTid));
	}

	@Override
	public String toString() {
		switch (this.kind) {
		case BLK_START:
			return String.format("BlkStart @ %s (%s)", this.blk.getTid(), this.sub.getTerm().getName());
		case BLK_END:
			return String.format("BlkEnd @ %s (%s)", this.blk.getTid(), this.sub.getTerm().getName());
		default:
			return String.format("CallReturn @ %s -> %s (%s calls %s)", this.blk.getTid(),
				this.returnBlk.getTid(), this.sub.getTerm().getName(), this.callee.getTerm().getName());
		}
	}
}
