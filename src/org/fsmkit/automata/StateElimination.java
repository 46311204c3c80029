/*
 * @LICENSE@
 */

package org.fsmkit.automata;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Automaton to regular expression conversion by state elimination (Kleene).
 * <p>
 * The expression grammar: literal input characters, <code>1</code> for the
 * empty word, <code>+</code> for alternation, postfix <code>*</code> for the
 * Kleene star, juxtaposition for concatenation and parentheses for grouping.
 * The empty language, which the grammar cannot spell, is rendered as the
 * empty string. Nothing is simplified and every fragment is parenthesized, so
 * the output is long; symbols which are themselves grammar characters are
 * not escaped.
 * <p>
 * Ordinary states are eliminated in ascending index order, which pins the
 * output text.
 */
final class StateElimination {

    private static final Logger logger = Logger.getLogger("org.fsmkit.automata");
    private static final Level level = Level.FINEST;

    static final String ONE = "1";
    static final char ALT = '+';
    static final char STAR = '*';
    static final String EMPTY_LANGUAGE = "";

    private StateElimination() {
    } // never instantiated

    /**
     * @return a regular expression for the language of <code>fa</code>, which
     *         is not modified.
     */
    static String toRegex(Automaton fa) {

        final NFA nfa = NFA.copyOf(fa);
        final int terminal = addSingleTerminal(nfa);
        final int start = nfa.start();

        for (int x = 0; x < terminal; ++x) {
            if (x != start) {
                eliminate(nfa, x);
                if (logger.isLoggable(level)) {
                    logger.log(level, "eliminated " + x + ": " + nfa);
                }
            }
        }

        final List<Edge> loopsStart = new ArrayList<Edge>();
        final List<Edge> startToTerminal = new ArrayList<Edge>();
        final List<Edge> loopsTerminal = new ArrayList<Edge>();
        final List<Edge> terminalToStart = new ArrayList<Edge>();
        for (Edge edge : nfa.edgeList(start)) {
            assert edge.to() == start || edge.to() == terminal : edge;
            (edge.to() == start ? loopsStart : startToTerminal).add(edge);
        }
        for (Edge edge : nfa.edgeList(terminal)) {
            assert edge.to() == start || edge.to() == terminal : edge;
            (edge.to() == terminal ? loopsTerminal : terminalToStart).add(edge);
        }

        String regex = assemble(
            alternation(loopsStart),
            alternation(startToTerminal),
            alternation(loopsTerminal),
            alternation(terminalToStart));
        logger.log(level, "regex: " + regex);
        return regex;
    }

    /**
     * Adds a fresh terminal state and moves every terminal flag onto it
     * through an epsilon edge. Afterwards the fresh state is the only terminal
     * one.
     *
     * @return the fresh state.
     */
    static int addSingleTerminal(NFA nfa) {
        final int n = nfa.stateCount();
        final int terminal = nfa.addState();
        for (int s = 0; s < n; ++s) {
            if (nfa.isTerminal(s)) {
                nfa.setTerminal(s, false);
                nfa.addEdge(Edge.epsilon(s, terminal));
            }
        }
        nfa.setTerminal(terminal, true);
        return terminal;
    }

    /*
     * Replaces every path p->x->r by a single edge p->r, then drops all edges
     * touching x.
     */
    private static void eliminate(NFA nfa, int x) {

        final List<Edge> loops = new ArrayList<Edge>();
        final Map<Integer, List<Edge>> in = new LinkedHashMap<Integer, List<Edge>>();
        final Map<Integer, List<Edge>> out = new LinkedHashMap<Integer, List<Edge>>();

        for (int s = 0; s < nfa.stateCount(); ++s) {
            for (Edge edge : nfa.edgeList(s)) {
                if (edge.from() == x && edge.to() == x) {
                    loops.add(edge);
                } else if (edge.to() == x) {
                    group(in, edge.from(), edge);
                } else if (edge.from() == x) {
                    group(out, edge.to(), edge);
                }
            }
        }

        final String loop = loops.isEmpty() ? ONE : alternation(loops);
        final Map<Integer, String> ins = reduce(nfa, in);
        final Map<Integer, String> outs = reduce(nfa, out);
        for (Edge edge : loops) {
            nfa.deleteEdge(edge);
        }

        for (Map.Entry<Integer, String> p : ins.entrySet()) {
            for (Map.Entry<Integer, String> r : outs.entrySet()) {
                nfa.addEdge(new Edge(p.getKey(), r.getKey(),
                    '(' + p.getValue() + loop + STAR + r.getValue() + ')'));
            }
        }
    }

    private static void group(Map<Integer, List<Edge>> groups, int key, Edge edge) {
        List<Edge> edges = groups.get(key);
        if (edges == null) {
            groups.put(key, edges = new ArrayList<Edge>());
        }
        edges.add(edge);
    }

    /*
     * Alternation per group; the reduced edges are removed from the automaton.
     */
    private static Map<Integer, String> reduce(NFA nfa, Map<Integer, List<Edge>> groups) {
        Map<Integer, String> ret = new LinkedHashMap<Integer, String>();
        for (Map.Entry<Integer, List<Edge>> e : groups.entrySet()) {
            ret.put(e.getKey(), alternation(e.getValue()));
            for (Edge edge : e.getValue()) {
                boolean deleted = nfa.deleteEdge(edge);
                assert deleted : edge;
            }
        }
        return ret;
    }

    /**
     * @return <code>(w1+w2+...)</code> with epsilon words written as
     *         <code>1</code>, or <code>null</code> for no edges at all.
     */
    static String alternation(List<Edge> edges) {
        if (edges.isEmpty()) {
            return null;
        }
        StringBuilder sb = new StringBuilder();
        for (Edge edge : edges) {
            sb.append(sb.length() == 0 ? '(' : ALT);
            sb.append(edge.isEpsilon() ? ONE : edge.word());
        }
        return sb.append(')').toString();
    }

    /**
     * Builds
     * <code>(loopStart* startToTerminal loopTerminal* terminalToStart)* loopStart* startToTerminal loopTerminal*</code>
     * from the fragments left on the two surviving states. A
     * <code>null</code> fragment stands for no edges: a missing loop is the
     * empty word <code>1</code>, a missing way back to the start drops the
     * round trip group, a missing way to the terminal state leaves the empty
     * language.
     */
    static String assemble(
            String loopStart, String startToTerminal,
            String loopTerminal, String terminalToStart) {

        if (startToTerminal == null) {
            return EMPTY_LANGUAGE;
        }
        final String ls = loopStart == null ? ONE : loopStart;
        final String lt = loopTerminal == null ? ONE : loopTerminal;

        StringBuilder sb = new StringBuilder();
        if (terminalToStart != null) {
            sb.append('(')
              .append(ls).append(STAR)
              .append(startToTerminal)
              .append(lt).append(STAR)
              .append(terminalToStart)
              .append(')').append(STAR);
        }
        sb.append(ls).append(STAR)
          .append(startToTerminal)
          .append(lt).append(STAR);
        return sb.toString();
    }
}
