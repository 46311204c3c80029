/*
 * @LICENSE@
 */

/**
 * NFA: Nondeterministic Finite Automata.
 */
package org.fsmkit.automata;

import static org.fsmkit.automata.Misc.checkState;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.List;

/**
 * Nondeterministic finite automaton. Each state keeps its outgoing edges as an
 * ordered multiset: parallel edges with the same word, epsilon edges and
 * multi-character words are all allowed. Edges are enumerated in insertion
 * order; deleting an edge keeps the order of the remaining ones.
 */
public final class NFA implements Automaton {

    private int start = 0;
    private final BitSet terminals = new BitSet();
    private final List<List<Edge>> edges = new ArrayList<List<Edge>>();

    public NFA() {
    }

    /**
     * Creates an NFA with <code>stateCount</code> non-terminal states and
     * start state 0.
     */
    public NFA(int stateCount) {
        for (int i = 0; i < stateCount; ++i) {
            addState();
        }
    }

    /**
     * Deep copy of any automaton as an NFA: same state indices, terminal
     * flags, start state, and edges in the source's enumeration order.
     */
    public static NFA copyOf(Automaton fa) {
        NFA nfa = new NFA(fa.stateCount());
        for (int s = 0; s < fa.stateCount(); ++s) {
            nfa.setTerminal(s, fa.isTerminal(s));
            for (Edge edge : fa.edges(s)) {
                nfa.addEdge(edge);
            }
        }
        nfa.start = fa.start();
        return nfa;
    }

    public int stateCount() {
        return edges.size();
    }

    public int addState() {
        edges.add(new ArrayList<Edge>(2));
        return edges.size() - 1;
    }

    public int start() {
        return start;
    }

    public void setStart(int state) {
        start = checkState(this, state);
    }

    public boolean isTerminal(int state) {
        return terminals.get(checkState(this, state));
    }

    public void setTerminal(int state, boolean terminal) {
        terminals.set(checkState(this, state), terminal);
    }

    public List<Edge> edges(int state) {
        return Collections.unmodifiableList(
            new ArrayList<Edge>(edges.get(checkState(this, state))));
    }

    public void addEdge(Edge edge) {
        checkState(this, edge.to());
        edges.get(checkState(this, edge.from())).add(edge);
    }

    public boolean deleteEdge(Edge edge) {
        return edges.get(checkState(this, edge.from())).remove(edge);
    }

    /*
     * Zero-copy edge access for the algorithms in this package, which only
     * read the list while the automaton is not being modified.
     */
    List<Edge> edgeList(int state) {
        return edges.get(state);
    }

    @Override
    public String toString() {
        return "nfa " + Misc.dump(this);
    }
}
