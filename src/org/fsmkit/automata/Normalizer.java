/*
 * @LICENSE@
 */

package org.fsmkit.automata;

import java.util.BitSet;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.fsmkit.automata.Misc.IntStack;

/**
 * Rewrites an automaton so that every edge carries exactly one symbol: long
 * words are split into chains of single character edges, then epsilon edges
 * are folded away through epsilon-closures. Both steps preserve the
 * recognized language and return a new {@link NFA}.
 */
final class Normalizer {

    private static final Logger logger = Logger.getLogger("org.fsmkit.automata");
    private static final Level level = Level.FINEST;

    private Normalizer() {
    } // never instantiated

    /**
     * Replaces every edge whose word has length L &gt; 1 by a chain of L single
     * character edges through L-1 fresh states. The states of
     * <code>fa</code> keep their indices and terminal flags; the fresh states
     * are appended after them, in edge enumeration order.
     */
    static NFA splitLongWords(Automaton fa) {
        NFA nfa = new NFA(fa.stateCount());
        for (int s = 0; s < fa.stateCount(); ++s) {
            nfa.setTerminal(s, fa.isTerminal(s));
        }
        nfa.setStart(fa.start());

        for (int s = 0; s < fa.stateCount(); ++s) {
            for (Edge edge : fa.edges(s)) {
                final String word = edge.word();
                if (word.length() <= 1) {
                    nfa.addEdge(edge);
                    continue;
                }
                int prev = edge.from();
                for (int i = 0; i < word.length(); ++i) {
                    int next = i + 1 < word.length() ? nfa.addState() : edge.to();
                    nfa.addEdge(new Edge(prev, next, word.charAt(i)));
                    prev = next;
                }
            }
        }
        if (logger.isLoggable(level)) {
            logger.log(level, "split: " + nfa);
        }
        return nfa;
    }

    /**
     * The set of states reachable from <code>from</code> through epsilon edges
     * only, <code>from</code> included. Epsilon cycles are fine.
     */
    static BitSet epsilonClosure(Automaton fa, int from) {
        final BitSet visited = new BitSet(fa.stateCount());
        final IntStack gray = new IntStack();
        visited.set(from);
        gray.push(from);
        while (!gray.isEmpty()) {
            for (Edge edge : fa.edges(gray.pop())) {
                if (edge.isEpsilon() && !visited.get(edge.to())) {
                    visited.set(edge.to());
                    gray.push(edge.to());
                }
            }
        }
        return visited;
    }

    /**
     * Folds epsilon edges away. For each state s and each state t of its
     * epsilon-closure, s becomes terminal if t is, and every non-epsilon edge
     * t-&gt;u gets a copy s-&gt;u. States and start are unchanged.
     *
     * @param fa
     *            an automaton whose words are at most one character long.
     */
    static NFA removeEpsilons(Automaton fa) {
        NFA nfa = new NFA(fa.stateCount());
        nfa.setStart(fa.start());

        for (int s = 0; s < fa.stateCount(); ++s) {
            BitSet closure = epsilonClosure(fa, s);
            for (int t = closure.nextSetBit(0); t >= 0; t = closure.nextSetBit(t + 1)) {
                if (fa.isTerminal(t)) {
                    nfa.setTerminal(s, true);
                }
                for (Edge edge : fa.edges(t)) {
                    assert edge.word().length() <= 1 : edge;
                    if (!edge.isEpsilon()) {
                        nfa.addEdge(new Edge(s, edge.to(), edge.word()));
                    }
                }
            }
        }
        if (logger.isLoggable(level)) {
            logger.log(level, "epsilon free: " + nfa);
        }
        return nfa;
    }

    static NFA normalize(Automaton fa) {
        return removeEpsilons(splitLongWords(fa));
    }
}
