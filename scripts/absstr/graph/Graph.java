package absstr.graph;

import absstr.ir.Tid;

import com.google.common.collect.ImmutableSet;
import com.google.common.graph.ImmutableNetwork;
import com.google.common.graph.Network;

import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * The interprocedural control flow graph a fixpoint is computed on.
 */
public final class Graph {
	private final ImmutableNetwork<Node, Edge> network;

	public Graph(Network<Node, Edge> network) {
		this.network = ImmutableNetwork.copyOf(network);
	}

	/**
	 * @return The underlying Guava network.
	 */
	public ImmutableNetwork<Node, Edge> getNetwork() {
		return this.network;
	}

	public Set<Node> nodes() {
		return this.network.nodes();
	}

	public Set<Edge> edges() {
		return this.network.edges();
	}

	public Set<Edge> outEdges(Node node) {
		return this.network.outEdges(node);
	}

	public Set<Edge> inEdges(Node node) {
		return this.network.inEdges(node);
	}

	public Node source(Edge edge) {
		return this.network.incidentNodes(edge).source();
	}

	public Node target(Edge edge) {
		return this.network.incidentNodes(edge).target();
	}

	/**
	 * @return The edges of the given kind.
	 */
	public ImmutableSet<Edge> edges(Edge.Kind kind) {
		return this.network.edges().stream()
			.filter(edge -> edge.getKind() == kind)
			.collect(ImmutableSet.toImmutableSet());
	}

	/**
	 * @return The node of the given kind for a block of a function.
	 */
	public Optional<Node> findNode(Node.Kind kind, Tid blk, Tid sub) {
		return this.network.nodes().stream()
			.filter(node -> node.getKind() == kind
				&& node.getBlk().getTid().equals(blk)
				&& node.getSub().getTid().equals(sub))
			.findFirst();
	}

	@Override
	public boolean equals(Object obj) {
		if (obj == this) {
			return true;
		} else if (!(obj instanceof Graph)) {
			return false;
		}

		var other = (Graph) obj;
		return this.network.equals(other.network);
	}

	@Override
	public int hashCode() {
		return Objects.hashCode(this.network);
	}

	@Override
	public String toString() {
		return String.format("Graph(%d nodes, %d edges)", this.network.nodes().size(), this.network.edges().size());
	}
}
