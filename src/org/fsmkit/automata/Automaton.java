/*
 * @LICENSE@
 */

package org.fsmkit.automata;

import java.util.List;

/**
 * The capability contract shared by {@link NFA} and {@link DFA}.
 * <p>
 * States are dense <code>int</code> indices in <code>[0, stateCount())</code>,
 * handed out by {@link #addState()} in creation order and never removed. An
 * automaton has exactly one start state (state 0 until changed), a terminal
 * flag per state and a set of {@link Edge}s per source state. Only edges can
 * be deleted.
 * <p>
 * Operations taking a state index throw {@link IllegalArgumentException} for
 * an index out of range.
 */
public interface Automaton {

    int stateCount();

    /**
     * Appends a non-terminal state without edges.
     *
     * @return the index of the new state.
     */
    int addState();

    int start();

    void setStart(int state);

    boolean isTerminal(int state);

    void setTerminal(int state, boolean terminal);

    /**
     * @param state
     *            a source state.
     * @return the edges leaving <code>state</code>, in the variant's
     *         enumeration order. The list is not backed by the automaton.
     */
    List<Edge> edges(int state);

    void addEdge(Edge edge);

    /**
     * Removes one edge equal to <code>edge</code>.
     *
     * @return <code>true</code> iff such an edge existed.
     */
    boolean deleteEdge(Edge edge);
}
