package absstr.graph;

import absstr.ir.Blk;
import absstr.ir.Jmp;
import absstr.ir.Program;
import absstr.ir.Sub;
import absstr.ir.Term;
import absstr.ir.Tid;
import absstr.util.Log;

import com.google.common.collect.ArrayListMultimap;
import com.google.common.collect.ListMultimap;
import com.google.common.graph.MutableNetwork;
import com.google.common.graph.NetworkBuilder;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Builds the interprocedural control flow graph of a program.
 */
public final class ProgramCfg {
	private final Program program;
	private final Set<Tid> externSymbols;
	private final MutableNetwork<Node, Edge> network;
	/** (sub, blk) -> block start node */
	private final Map<Tid, Map<Tid, Node>> blkStarts = new HashMap<>();
	/** (sub, blk) -> block end node */
	private final Map<Tid, Map<Tid, Node>> blkEnds = new HashMap<>();
	/** callee -> CallReturn nodes of its call sites */
	private final ListMultimap<Tid, Node> callReturns = ArrayListMultimap.create();

	private ProgramCfg(Program program, Set<Tid> externSymbols) {
		this.program = program;
		this.externSymbols = externSymbols;
		this.network = NetworkBuilder.directed()
			.allowsParallelEdges(true)
			.allowsSelfLoops(true)
			.build();
	}

	/**
	 * Build the control flow graph.  Calls to the given extern symbols, and
	 * calls without a known target, become EXTERN_CALL_STUB edges.
	 */
	public static Graph build(Program program, Set<Tid> externSymbols) {
		var cfg = new ProgramCfg(program, externSymbols);
		cfg.addBlocks();
		cfg.addJumps();
		cfg.addReturns();

		var graph = new Graph(cfg.network);
		Log.debug("Built %s", graph);
		return graph;
	}

	private void addBlocks() {
		for (var sub : this.program.getSubs()) {
			var starts = this.blkStarts.computeIfAbsent(sub.getTid(), k -> new HashMap<>());
			var ends = this.blkEnds.computeIfAbsent(sub.getTid(), k -> new HashMap<>());
			for (var blk : sub.getTerm().getBlocks()) {
				var start = Node.blkStart(blk, sub);
				var end = Node.blkEnd(blk, sub);
				this.network.addEdge(start, end, Edge.block());
				starts.put(blk.getTid(), start);
				ends.put(blk.getTid(), end);
			}
		}
	}

	private Node findStart(Term<Sub> sub, Tid blk, Term<Jmp> jmp) {
		var start = this.blkStarts.get(sub.getTid()).get(blk);
		if (start == null) {
			Log.warn("%s in %s jumps to unknown block %s", jmp.getTid(), sub.getTerm().getName(), blk);
		}
		return start;
	}

	private void addJumps() {
		for (var sub : this.program.getSubs()) {
			for (var blk : sub.getTerm().getBlocks()) {
				var end = this.blkEnds.get(sub.getTid()).get(blk.getTid());
				var jmps = blk.getTerm().getJmps();
				for (int i = 0; i < jmps.size(); ++i) {
					Term<Jmp> untaken = null;
					if (i > 0 && jmps.get(i - 1).getTerm() instanceof Jmp.CBranch) {
						untaken = jmps.get(i - 1);
					}
					addJump(sub, blk, end, jmps.get(i), untaken);
				}
			}
		}
	}

	private void addJump(Term<Sub> sub, Term<Blk> blk, Node end, Term<Jmp> jmp, Term<Jmp> untaken) {
		var term = jmp.getTerm();
		if (term instanceof Jmp.Branch branch) {
			var target = findStart(sub, branch.getTarget(), jmp);
			if (target != null) {
				this.network.addEdge(end, target, Edge.jump(jmp, untaken));
			}
		} else if (term instanceof Jmp.CBranch cbranch) {
			var target = findStart(sub, cbranch.getTarget(), jmp);
			if (target != null) {
				this.network.addEdge(end, target, Edge.jump(jmp, untaken));
			}
		} else if (term instanceof Jmp.BranchInd) {
			for (var targetTid : blk.getTerm().getIndirectJmpTargets()) {
				var target = findStart(sub, targetTid, jmp);
				if (target != null) {
					this.network.addEdge(end, target, Edge.jump(jmp, untaken));
				}
			}
		} else if (term instanceof Jmp.Call call) {
			var callee = this.program.getSub(call.getTarget())
				.filter(s -> !this.externSymbols.contains(s.getTid()))
				.filter(s -> !s.getTerm().getBlocks().isEmpty());
			if (callee.isPresent()) {
				addCall(sub, blk, end, jmp, callee.get());
			} else {
				addCallStub(sub, end, jmp);
			}
		} else if (term instanceof Jmp.CallInd || term instanceof Jmp.CallOther) {
			addCallStub(sub, end, jmp);
		}
		// Returns are connected once all call sites are known
	}

	private void addCall(Term<Sub> sub, Term<Blk> blk, Node end, Term<Jmp> jmp, Term<Sub> callee) {
		var entryBlk = callee.getTerm().getBlocks().get(0);
		var entry = this.blkStarts.get(callee.getTid()).get(entryBlk.getTid());
		this.network.addEdge(end, entry, Edge.interprocedural(Edge.Kind.CALL, jmp));

		var returnTid = jmp.getTerm().getReturnTarget().orElse(null);
		if (returnTid == null) {
			return;
		}
		var returnStart = findStart(sub, returnTid, jmp);
		if (returnStart == null) {
			return;
		}

		var callReturn = Node.callReturn(blk, returnStart.getBlk(), sub, callee);
		this.network.addEdge(end, callReturn, Edge.interprocedural(Edge.Kind.CR_CALL_STUB, jmp));
		this.network.addEdge(callReturn, returnStart, Edge.interprocedural(Edge.Kind.CR_RETURN_STUB, jmp));
		this.callReturns.put(callee.getTid(), callReturn);
	}

	private void addCallStub(Term<Sub> sub, Node end, Term<Jmp> jmp) {
		var returnTid = jmp.getTerm().getReturnTarget().orElse(null);
		if (returnTid == null) {
			return;
		}
		var returnStart = findStart(sub, returnTid, jmp);
		if (returnStart != null) {
			this.network.addEdge(end, returnStart, Edge.interprocedural(Edge.Kind.EXTERN_CALL_STUB, jmp));
		}
	}

	private void addReturns() {
		for (var sub : this.program.getSubs()) {
			var callSites = this.callReturns.get(sub.getTid());
			if (callSites.isEmpty()) {
				continue;
			}

			for (var blk : sub.getTerm().getBlocks()) {
				var end = this.blkEnds.get(sub.getTid()).get(blk.getTid());
				for (var jmp : blk.getTerm().getJmps()) {
					if (!(jmp.getTerm() instanceof Jmp.Return)) {
						continue;
					}
					for (var callReturn : callSites) {
						this.network.addEdge(end, callReturn, Edge.interprocedural(Edge.Kind.RETURN_COMBINE, jmp));
					}
				}
			}
		}
	}
}
