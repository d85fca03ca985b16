package absstr.graph;

import absstr.ir.Jmp;
import absstr.ir.Term;

import java.util.Objects;
import java.util.Optional;

/**
 * An edge of the interprocedural control flow graph.
 *
 * Edges have identity semantics, since a network may hold several edges
 * between the same nodes.
 */
public final class Edge {
	/**
	 * The kinds of edge.
	 */
	public enum Kind {
		/** From the start to the end of a block, through its defs. */
		BLOCK,
		/** An intraprocedural jump. */
		JUMP,
		/** From a call site to the callee's entry block. */
		CALL,
		/** Around a call to a function without an analyzable body. */
		EXTERN_CALL_STUB,
		/** From a call site to its CallReturn node. */
		CR_CALL_STUB,
		/** From a CallReturn node to the return block. */
		CR_RETURN_STUB,
		/** From a return of the callee to a CallReturn node. */
		RETURN_COMBINE,
	}

	private final Kind kind;
	private final Term<Jmp> jmp;
	private final Term<Jmp> untakenConditional;

	private Edge(Kind kind, Term<Jmp> jmp, Term<Jmp> untakenConditional) {
		this.kind = kind;
		this.jmp = jmp;
		this.untakenConditional = untakenConditional;
	}

	public static Edge block() {
		return new Edge(Kind.BLOCK, null, null);
	}

	/**
	 * @param untakenConditional
	 *            The conditional jump that was not taken to reach this one,
	 *            or null.
	 */
	public static Edge jump(Term<Jmp> jmp, Term<Jmp> untakenConditional) {
		return new Edge(Kind.JUMP, Objects.requireNonNull(jmp), untakenConditional);
	}

	/**
	 * @param kind
	 *            One of the call or return kinds.
	 * @param jmp
	 *            The call, or the return for RETURN_COMBINE.
	 */
	public static Edge interprocedural(Kind kind, Term<Jmp> jmp) {
		if (kind == Kind.BLOCK || kind == Kind.JUMP) {
			throw new IllegalArgumentException("Not an interprocedural edge kind: " + kind);
		}
		return new Edge(kind, Objects.requireNonNull(jmp), null);
	}

	public Kind getKind() {
		return this.kind;
	}

	/**
	 * @return The jump this edge was built from, absent for BLOCK edges.
	 */
	public Optional<Term<Jmp>> getJmp() {
		return Optional.ofNullable(this.jmp);
	}

	/**
	 * @return The untaken conditional jump preceding a JUMP edge, if any.
	 */
	public Optional<Term<Jmp>> getUntakenConditional() {
		return Optional.ofNullable(this.untakenConditional);
	}

	@Override
	public String toString() {
		if (this.jmp == null) {
			return this.kind.toString();
		}
		return String.format("%s(%s)", this.kind, this.jmp.getTid());
	}
}
