package net.langexplorer.util.grammar;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.langexplorer.api.NamedValue;
import net.langexplorer.api.grammar.BinarySerializable;
import net.langexplorer.api.grammar.GrammarException;
import net.langexplorer.api.grammar.InvalidGrammarException;
import net.langexplorer.api.grammar.NoRootProductionException;
import net.langexplorer.api.grammar.NoValidExpansionException;
import net.langexplorer.api.grammar.UnknownNonterminalException;
import net.langexplorer.expanders.Expander;
import net.langexplorer.util.RecordDigester;

/**
 * A set of productions with a root non-terminal.
 * A grammar is context-sensitive iff any of its left-hand sides carries a
 * prefix or suffix; the two cases are generated by different algorithms.
 * Grammars are immutable and may be shared between threads.
 */
public class Grammar<T extends BinarySerializable, I> implements NamedValue {

    private final I root;
    private final Map<LeftHandSide<T, I>, Production<T, I>> productions;
    private final boolean contextSensitive;
    private final String canonicalName;
    private String uuid;

    public Grammar(I root, Collection<Production<T, I>> productions,
                   String canonicalName) {
        if (root == null)
            throw new NullPointerException("Grammar root may not be null");
        if (productions == null)
            throw new NullPointerException(
                "Grammar productions may not be null");
        if (canonicalName == null)
            throw new NullPointerException("Grammar name may not be null");
        Map<LeftHandSide<T, I>, Production<T, I>> table =
            new LinkedHashMap<LeftHandSide<T, I>, Production<T, I>>();
        boolean cs = false;
        for (Production<T, I> p : productions) {
            table.put(p.getLhs(), p);
            cs |= p.getLhs().isContextSensitive();
        }
        this.root = root;
        this.productions = Collections.unmodifiableMap(table);
        this.contextSensitive = cs;
        this.canonicalName = canonicalName;
    }

    public String toString() {
        StringBuilder sb = new StringBuilder();
        for (Production<T, I> p : productions.values()) {
            sb.append(p.getLhs()).append(" -> ");
            boolean first = true;
            for (ProductionRule<T, I> r : p.getRules()) {
                if (! first) sb.append(" | ");
                first = false;
                sb.append(r);
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    public I getRoot() {
        return root;
    }

    public boolean isContextSensitive() {
        return contextSensitive;
    }

    public String getCanonicalName() {
        return canonicalName;
    }

    public Map<LeftHandSide<T, I>, Production<T, I>> getProductions() {
        return productions;
    }

    public Production<T, I> getProduction(LeftHandSide<T, I> lhs) {
        return productions.get(lhs);
    }

    /**
     * Every distinct symbol mentioned by any left-hand side or rule, in
     * order of first appearance.
     */
    public Set<Symbol<T, I>> getAllSymbols() {
        Set<Symbol<T, I>> ret = new LinkedHashSet<Symbol<T, I>>();
        for (Production<T, I> p : productions.values()) {
            ret.addAll(p.getLhs().getAllTokens());
            for (ProductionRule<T, I> r : p.getRules()) {
                ret.addAll(r.getSymbols());
            }
        }
        return ret;
    }

    /**
     * A lower-case hexadecimal SHA-256 digest of this grammar's productions.
     */
    public synchronized String generateUuid() {
        if (uuid == null) {
            RecordDigester d = RecordDigester.getInstance("grammar");
            for (Production<T, I> p : productions.values()) {
                d.addString(p.getLhs().toString());
                d.addLong(p.size());
                for (ProductionRule<T, I> r : p.getRules()) {
                    d.addString(r.toString());
                }
            }
            uuid = d.finishHex();
        }
        return uuid;
    }

    public String getName() {
        return canonicalName + "_" + generateUuid().substring(0, 16);
    }

    /**
     * Render this grammar in BNF, one production per paragraph, with the
     * productions of the root non-terminal first.
     */
    public String toBNF() {
        List<Production<T, I>> ordered = new ArrayList<Production<T, I>>();
        for (Production<T, I> p : productions.values()) {
            if (root.equals(p.getLhs().getReference())) ordered.add(p);
        }
        for (Production<T, I> p : productions.values()) {
            if (! root.equals(p.getLhs().getReference())) ordered.add(p);
        }
        StringBuilder sb = new StringBuilder();
        for (Production<T, I> p : ordered) {
            if (sb.length() != 0) sb.append("\n\n");
            sb.append(lhsToDisplayString(p.getLhs())).append(" ::= ")
              .append(p.toDisplayString());
        }
        return sb.toString();
    }

    private static String lhsToDisplayString(LeftHandSide<?, ?> lhs) {
        StringBuilder sb = new StringBuilder();
        for (Symbol<?, ?> s : lhs.getAllTokens()) {
            if (sb.length() != 0) sb.append(' ');
            sb.append(s.toDisplayString());
        }
        return sb.toString();
    }

    /**
     * Generate one program using expander for every decision.
     * Context-free grammars only ever throw InvalidGrammarException;
     * context-sensitive derivations may additionally get stuck, which is
     * signalled by NoValidExpansionException.
     */
    public ProgramInstance<T, I> generate(Expander<T, I> expander)
            throws GrammarException {
        if (contextSensitive) {
            return generateContextSensitive(expander);
        } else {
            return generateContextFree(expander);
        }
    }

    public ProgramInstance<T, I> generateContextFree(Expander<T, I> expander)
            throws InvalidGrammarException {
        Production<T, I> rootProd = productions.get(
            LeftHandSide.<T, I>contextFree(root));
        if (rootProd == null)
            throw new NoRootProductionException(
                "Grammar has no context-free production for root " + root);
        long[] counter = new long[] { 1 };
        ProgramInstance<T, I> ret = new ProgramInstance<T, I>(
            rootProd.getLhs().getNonterminal(), counter[0], null);
        expandContextFree(ret, rootProd, expander, counter);
        return ret;
    }

    private void expandContextFree(ProgramInstance<T, I> node,
            Production<T, I> production, Expander<T, I> expander,
            long[] counter) throws InvalidGrammarException {
        ProductionRule<T, I> rule = checkRule(production,
            expander.chooseRule(this, node, production));
        List<ProgramInstance<T, I>> children =
            new ArrayList<ProgramInstance<T, I>>(rule.size());
        for (Symbol<T, I> sym : rule.getSymbols()) {
            ProgramInstance<T, I> child = new ProgramInstance<T, I>(sym,
                ++counter[0], node.getId());
            if (sym.isNonterminal()) {
                I ref = ((Nonterminal<T, I>) sym).getReference();
                Production<T, I> next = productions.get(
                    LeftHandSide.<T, I>contextFree(ref));
                if (next == null)
                    throw new UnknownNonterminalException(
                        "No context-free production for non-terminal " +
                        ref);
                expandContextFree(child, next, expander, counter);
            }
            children.add(child);
        }
        node.setChildren(children);
    }

    public ProgramInstance<T, I> generateContextSensitive(
            Expander<T, I> expander) throws NoValidExpansionException {
        DerivationArena<T, I> arena = new DerivationArena<T, I>();
        List<Integer> frontier = new ArrayList<Integer>();
        frontier.add(arena.allocate(Symbol.<T, I>nonterminal(root), null));
        while (hasNonterminal(arena, frontier)) {
            List<Symbol<T, I>> form = arena.symbolsOf(frontier);
            List<Expander.Candidate<T, I>> candidates =
                new ArrayList<Expander.Candidate<T, I>>();
            for (Production<T, I> p : productions.values()) {
                List<Integer> hits = p.getLhs().getAllContextInstances(form);
                if (! hits.isEmpty())
                    candidates.add(new Expander.Candidate<T, I>(p.getLhs(),
                                                                hits));
            }
            if (candidates.isEmpty())
                throw new NoValidExpansionException(
                    "No production applies to sentential form " + form);
            Expander.Slot<T, I> slot = checkSlot(candidates,
                expander.chooseLhsAndSlot(this, arena.getRoot(), candidates));
            int position = slot.getIndex();
            Production<T, I> production = productions.get(slot.getLhs());
            ProductionRule<T, I> rule = checkRule(production,
                expander.chooseRule(this, arena.get(frontier.get(position)),
                                    production));
            int nodeIndex = frontier.remove(position);
            frontier.addAll(position, arena.expand(nodeIndex, rule));
        }
        return arena.getRoot();
    }

    private static boolean hasNonterminal(DerivationArena<?, ?> arena,
                                          List<Integer> frontier) {
        for (Integer idx : frontier) {
            if (arena.get(idx).isNonterminal()) return true;
        }
        return false;
    }

    private static <T extends BinarySerializable, I> ProductionRule<T, I>
            checkRule(Production<T, I> production,
                      ProductionRule<T, I> rule) {
        if (rule == null || ! production.getRules().contains(rule))
            throw new IllegalStateException("Expander chose rule " + rule +
                " not belonging to production " + production.getLhs());
        return rule;
    }

    private static <T extends BinarySerializable, I> Expander.Slot<T, I>
            checkSlot(List<Expander.Candidate<T, I>> candidates,
                      Expander.Slot<T, I> slot) {
        if (slot != null) {
            for (Expander.Candidate<T, I> c : candidates) {
                if (c.getLhs().equals(slot.getLhs()) &&
                        c.getIndices().contains(slot.getIndex()))
                    return slot;
            }
        }
        throw new IllegalStateException("Expander chose slot " + slot +
            " not among the candidates");
    }

}
