/*
 * @LICENSE@
 */

package org.fsmkit.automata;

import static org.fsmkit.automata.Misc.checkState;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.logging.Level;
import java.util.logging.Logger;


/**
 * Deterministic finite automaton. Each state maps a symbol to at most one next
 * state: adding an edge for a symbol already in use at the source replaces
 * the previous destination. Every edge word is exactly one character long;
 * anything else handed to {@link #addEdge(Edge)} or {@link #deleteEdge(Edge)}
 * is a programming error and throws {@link IllegalArgumentException}. Edges
 * are enumerated in ascending symbol order.
 */
public final class DFA implements Automaton {

    private static final Logger logger = Logger.getLogger("org.fsmkit.automata");
    private static final Level level = Level.FINEST;

    private int start = 0;
    private final BitSet terminals = new BitSet();
    private final List<SortedMap<Character, Integer>> delta =
            new ArrayList<SortedMap<Character, Integer>>();

    public DFA() {
    }

    /**
     * Deep copy of an automaton which already satisfies the DFA rules
     * (single character words, at most one edge per symbol and state; a later
     * edge for the same symbol wins).
     *
     * @throws IllegalArgumentException
     *             if some edge word is not a single character.
     */
    public static DFA copyOf(Automaton fa) {
        DFA dfa = new DFA();
        for (int s = 0; s < fa.stateCount(); ++s) {
            dfa.setTerminal(dfa.addState(), fa.isTerminal(s));
        }
        for (int s = 0; s < fa.stateCount(); ++s) {
            for (Edge edge : fa.edges(s)) {
                dfa.addEdge(edge);
            }
        }
        dfa.start = fa.start();
        return dfa;
    }

    public int stateCount() {
        return delta.size();
    }

    public int addState() {
        delta.add(new TreeMap<Character, Integer>());
        return delta.size() - 1;
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
        SortedMap<Character, Integer> arcs = delta.get(checkState(this, state));
        List<Edge> ret = new ArrayList<Edge>(arcs.size());
        for (Map.Entry<Character, Integer> e : arcs.entrySet()) {
            ret.add(new Edge(state, e.getValue(), e.getKey()));
        }
        return Collections.unmodifiableList(ret);
    }

    public void addEdge(Edge edge) {
        char symbol = symbolOf(edge);
        checkState(this, edge.to());
        delta.get(checkState(this, edge.from())).put(symbol, edge.to());
    }

    public boolean deleteEdge(Edge edge) {
        char symbol = symbolOf(edge);
        SortedMap<Character, Integer> arcs = delta.get(checkState(this, edge.from()));
        Integer to = arcs.get(symbol);
        if (to == null || to != edge.to()) {
            return false;
        }
        arcs.remove(symbol);
        return true;
    }

    private static char symbolOf(Edge edge) {
        if (edge.word().length() != 1) {
            throw new IllegalArgumentException(
                "dfa edge word must be exactly one character: " + edge);
        }
        return edge.word().charAt(0);
    }

    /**
     * @return the destination of the edge labeled <code>symbol</code> leaving
     *         <code>state</code>, or <code>-1</code> if there is none.
     */
    public int next(int state, char symbol) {
        Integer to = delta.get(checkState(this, state)).get(symbol);
        return to == null ? -1 : to;
    }

    /**
     * Runs the automaton over <code>input</code> along its single path. A
     * missing edge rejects.
     */
    public boolean accepts(CharSequence input) {
        int state = start;
        for (int i = 0; i < input.length() && state != -1; ++i) {
            state = next(state, input.charAt(i));
        }
        return state != -1 && isTerminal(state);
    }

    /**
     * Makes the automaton total over <code>alphabet</code>: appends one
     * non-terminal sink state, then every state lacking an edge for some
     * alphabet symbol - the sink included - gets one to the sink. The sink is
     * added even when every state was already total.
     *
     * @return the index of the sink state.
     */
    public int makeComplete(char... alphabet) {
        final int sink = addState();
        for (SortedMap<Character, Integer> arcs : delta) {
            for (char c : alphabet) {
                if (!arcs.containsKey(c)) {
                    arcs.put(c, sink);
                }
            }
        }
        if (logger.isLoggable(level)) {
            logger.log(level, "completed with sink " + sink + ": " + toString());
        }
        return sink;
    }

    /**
     * Flips the terminal flag of every state. The result is the complement
     * only if the automaton is total over the alphabet of interest, which is
     * not checked (see {@link #makeComplete(char...)}).
     */
    public void complementInPlace() {
        terminals.flip(0, stateCount());
    }

    @Override
    public String toString() {
        return "dfa " + Misc.dump(this);
    }
}
