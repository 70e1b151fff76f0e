package net.langexplorer.util.grammar;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import net.langexplorer.api.grammar.BinarySerializable;

/**
 * Owner of all nodes of a tree under construction.
 * Nodes are stored by id (the node with id n lives at index n - 1), so
 * that a frontier can be kept as a list of plain indices.
 */
class DerivationArena<T extends BinarySerializable, I> {

    private final List<ProgramInstance<T, I>> nodes;

    public DerivationArena() {
        nodes = new ArrayList<ProgramInstance<T, I>>();
    }

    public int size() {
        return nodes.size();
    }

    public ProgramInstance<T, I> get(int index) {
        return nodes.get(index);
    }

    public ProgramInstance<T, I> getRoot() {
        return nodes.get(0);
    }

    /**
     * Allocate a node with the next id and return its index.
     */
    public int allocate(Symbol<T, I> symbol, Long parentId) {
        int index = nodes.size();
        nodes.add(new ProgramInstance<T, I>(symbol, index + 1, parentId));
        return index;
    }

    /**
     * Expand the node at index into one child per symbol of rule.
     * Returns the indices of the new children, in order.
     */
    public List<Integer> expand(int index, ProductionRule<T, I> rule) {
        ProgramInstance<T, I> parent = nodes.get(index);
        List<Integer> ret = new ArrayList<Integer>(rule.size());
        List<ProgramInstance<T, I>> children =
            new ArrayList<ProgramInstance<T, I>>(rule.size());
        for (Symbol<T, I> sym : rule.getSymbols()) {
            int ci = allocate(sym, parent.getId());
            ret.add(ci);
            children.add(nodes.get(ci));
        }
        parent.setChildren(children);
        return ret;
    }

    /**
     * The symbols of the nodes referenced by frontier, in order.
     */
    public List<Symbol<T, I>> symbolsOf(List<Integer> frontier) {
        List<Symbol<T, I>> ret = new ArrayList<Symbol<T, I>>(frontier.size());
        for (Integer idx : frontier) ret.add(nodes.get(idx).getNode());
        return Collections.unmodifiableList(ret);
    }

}
