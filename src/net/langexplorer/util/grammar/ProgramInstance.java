package net.langexplorer.util.grammar;

import java.io.ByteArrayOutputStream;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import net.langexplorer.api.grammar.BinarySerializable;

/**
 * A node of a generated program tree (i.e. an abstract syntax tree).
 * Every node owns its children; the parent is only referenced by id.
 * Ids are unique within one tree, but not across trees.
 */
public class ProgramInstance<T extends BinarySerializable, I> {

    public static final class Edge {

        private final long parent;
        private final long child;

        public Edge(long parent, long child) {
            this.parent = parent;
            this.child = child;
        }

        public String toString() {
            return parent + "->" + child;
        }

        public boolean equals(Object other) {
            if (! (other instanceof Edge)) return false;
            Edge eo = (Edge) other;
            return (parent == eo.parent && child == eo.child);
        }

        public int hashCode() {
            return Long.hashCode(parent) * 31 + Long.hashCode(child);
        }

        public long getParent() {
            return parent;
        }

        public long getChild() {
            return child;
        }

    }

    private final long id;
    private final Long parentId;
    private final Symbol<T, I> node;
    private List<ProgramInstance<T, I>> children;

    public ProgramInstance(Symbol<T, I> node, long id, Long parentId) {
        if (node == null)
            throw new NullPointerException(
                "ProgramInstance node may not be null");
        this.id = id;
        this.parentId = parentId;
        this.node = node;
        this.children = null;
    }
    public ProgramInstance(Symbol<T, I> node, long id) {
        this(node, id, null);
    }

    public long getId() {
        return id;
    }

    /**
     * The id of this node's parent, or null for the root of a tree.
     */
    public Long getParentId() {
        return parentId;
    }

    public Symbol<T, I> getNode() {
        return node;
    }

    public boolean isNonterminal() {
        return node.isNonterminal();
    }

    /**
     * Whether this node has been given its children.
     * Leaves created for terminals and epsilon count as unexpanded, as do
     * non-terminals still sitting on a frontier.
     */
    public boolean isExpanded() {
        return (children != null);
    }

    public List<ProgramInstance<T, I>> getChildren() {
        if (children == null) return Collections.emptyList();
        return children;
    }

    public int childCount() {
        return (children == null) ? 0 : children.size();
    }

    public ProgramInstance<T, I> childAt(int index) {
        return getChildren().get(index);
    }

    /**
     * Attach the children of this node.
     * Children may only be set once; subtrees are immutable afterwards.
     */
    public void setChildren(List<ProgramInstance<T, I>> newChildren) {
        if (newChildren == null)
            throw new NullPointerException(
                "ProgramInstance children may not be null");
        if (children != null)
            throw new IllegalStateException("Children of node " + id +
                " have already been set");
        children = Collections.unmodifiableList(
            new ArrayList<ProgramInstance<T, I>>(newChildren));
    }

    /**
     * The program text represented by this subtree.
     * Terminals contribute their bytes, non-terminals the concatenation of
     * their children's serializations, and epsilon nothing.
     */
    public byte[] serialize() {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        serializeInto(out);
        return out.toByteArray();
    }
    protected void serializeInto(ByteArrayOutputStream out) {
        switch (node.getKind()) {
            case TERMINAL:
                byte[] b = node.serialize();
                out.write(b, 0, b.length);
                break;
            case NONTERMINAL:
                for (ProgramInstance<T, I> child : getChildren()) {
                    child.serializeInto(out);
                }
                break;
            case EPSILON:
                break;
        }
    }

    /**
     * The bytes identifying this node alone (not its subtree).
     */
    public byte[] serializeNode() {
        if (node.isTerminal()) return node.serialize();
        return node.labelBytes();
    }

    /**
     * Canonical debug form of this subtree: the node's debug form followed
     * by those of all children, recursively.
     */
    public String toString() {
        StringBuilder sb = new StringBuilder();
        appendTo(sb);
        return sb.toString();
    }
    private void appendTo(StringBuilder sb) {
        sb.append(node);
        for (ProgramInstance<T, I> child : getChildren()) {
            child.appendTo(sb);
        }
    }

    /**
     * All nodes of this subtree in breadth-first order, starting with this
     * node.
     */
    public List<ProgramInstance<T, I>> getAllNodes() {
        List<ProgramInstance<T, I>> ret =
            new ArrayList<ProgramInstance<T, I>>();
        Deque<ProgramInstance<T, I>> queue =
            new ArrayDeque<ProgramInstance<T, I>>();
        queue.add(this);
        while (! queue.isEmpty()) {
            ProgramInstance<T, I> n = queue.poll();
            ret.add(n);
            queue.addAll(n.getChildren());
        }
        return ret;
    }

    public int nodeCount() {
        int ret = 1;
        for (ProgramInstance<T, I> child : getChildren()) {
            ret += child.nodeCount();
        }
        return ret;
    }

    /**
     * The number of nodes on the longest root-to-leaf path.
     */
    public int depth() {
        int ret = 0;
        for (ProgramInstance<T, I> child : getChildren()) {
            ret = Math.max(ret, child.depth());
        }
        return ret + 1;
    }

    /**
     * This subtree as a list of (parent id, child id) pairs.
     * A node's own edges are listed before those of its children.
     */
    public List<Edge> getEdgeList() {
        List<Edge> ret = new ArrayList<Edge>();
        collectEdges(ret);
        return ret;
    }
    private void collectEdges(List<Edge> drain) {
        List<ProgramInstance<T, I>> cl = getChildren();
        for (ProgramInstance<T, I> child : cl) {
            drain.add(new Edge(id, child.getId()));
        }
        for (ProgramInstance<T, I> child : cl) {
            child.collectEdges(drain);
        }
    }

    /**
     * Render this subtree as a Graphviz digraph.
     * Nodes are emitted breadth-first; terminals are red, non-terminals
     * blue, and epsilon nodes yellow.
     */
    public String toGraphviz() {
        StringBuilder sb = new StringBuilder("digraph { ");
        for (ProgramInstance<T, I> n : getAllNodes()) {
            sb.append('n').append(n.getId()).append(" [color=")
              .append(colorOf(n.getNode())).append(", label=\"")
              .append(escapeLabel(n.getNode().toString())).append("\"]; ");
            for (ProgramInstance<T, I> child : n.getChildren()) {
                sb.append('n').append(n.getId()).append(" -> n")
                  .append(child.getId()).append("; ");
            }
        }
        sb.append(" }");
        return sb.toString();
    }

    private static String colorOf(Symbol<?, ?> sym) {
        switch (sym.getKind()) {
            case TERMINAL:
                return "red";
            case NONTERMINAL:
                return "blue";
            default:
                return "yellow";
        }
    }

    private static String escapeLabel(String label) {
        return label.replace("\\", "\\\\").replace("\"", "\\\"");
    }

}
