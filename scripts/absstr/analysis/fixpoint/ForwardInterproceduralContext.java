package absstr.analysis.fixpoint;

import absstr.graph.Graph;
import absstr.graph.Node;
import absstr.ir.Blk;
import absstr.ir.Def;
import absstr.ir.Expression;
import absstr.ir.Jmp;
import absstr.ir.Term;

import java.util.Optional;

/**
 * The transfer functions a forward interprocedural fixpoint solver needs.
 *
 * <p>The solver walks the graph forward and calls the matching method for each
 * edge it visits, merging values that arrive at the same node with
 * {@link #merge(Object, Object)} until nothing changes.  Every method is a pure
 * function of its arguments.  An empty result means that no state reaches the
 * end of the edge, which is different from returning the input unchanged.</p>
 *
 * @param <V>
 *            The abstract state at a program point.
 */
public interface ForwardInterproceduralContext<V> {
	/**
	 * @return The graph the fixpoint is computed on.
	 */
	Graph getGraph();

	/**
	 * Join two states at a node with several incoming edges.
	 */
	V merge(V state1, V state2);

	/**
	 * Transfer function for a straight-line statement.
	 */
	Optional<V> updateDef(V state, Term<Def> def);

	/**
	 * Transfer function for an intraprocedural jump.
	 *
	 * @param untakenConditional
	 *            The conditional jump that was not taken to reach this jump,
	 *            or null.
	 * @param target
	 *            The block jumped to.
	 */
	Optional<V> updateJump(V state, Term<Jmp> jump, Term<Jmp> untakenConditional, Term<Blk> target);

	/**
	 * Transfer function from a call site to the entry of the callee.
	 *
	 * @param target
	 *            The start node of the callee's entry block.
	 */
	Optional<V> updateCall(V state, Term<Jmp> call, Node target);

	/**
	 * Transfer function combining a callee's return state with the caller's
	 * state from before the call.
	 *
	 * @param state
	 *            The state at the callee's return, or null if none reached it.
	 * @param stateBeforeCall
	 *            The state at the call site, or null if unknown.
	 */
	Optional<V> updateReturn(V state, V stateBeforeCall, Term<Jmp> callTerm, Term<Jmp> returnTerm);

	/**
	 * Transfer function for a call to a function without an analyzable body.
	 */
	Optional<V> updateCallStub(V state, Term<Jmp> call);

	/**
	 * Narrow a state with the knowledge that a conditional jump was taken (or
	 * not).
	 *
	 * @param blockBeforeCondition
	 *            The block ending with the conditional jump.
	 * @param isTrue
	 *            Whether the condition holds on this branch.
	 * @return The narrowed state, or empty if the branch is unreachable.
	 */
	Optional<V> specializeConditional(V state, Expression condition, Term<Blk> blockBeforeCondition, boolean isTrue);
}
