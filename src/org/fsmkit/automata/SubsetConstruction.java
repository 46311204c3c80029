/*
 * @LICENSE@
 */

package org.fsmkit.automata;

import static org.fsmkit.automata.Misc.stringFrom;

import java.util.BitSet;
import java.util.HashMap;
import java.util.LinkedList;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * NFA to DFA conversion by subset construction. Each DFA state stands for the
 * set of NFA states - a {@link MetaState} - the NFA can be in after reading
 * the same input; only the sets reachable from <code>{start}</code> are ever
 * built.
 */
final class SubsetConstruction {

    private static final Logger logger = Logger.getLogger("org.fsmkit.automata");
    private static final Level level = Level.FINEST;

    private SubsetConstruction() {
    } // never instantiated

    /**
     * A set of NFA states and the DFA state assigned to it.
     */
    private static final class MetaState {

        final BitSet nfaStates;
        final int id;

        MetaState(BitSet nfaStates, int id) {
            this.nfaStates = nfaStates;
            this.id = id;
        }

        @Override
        public String toString() {
            return id + ":" + stringFrom(nfaStates);
        }
    }

    /**
     * Converts any automaton into an equivalent {@link DFA}. The input is
     * {@linkplain Normalizer#normalize(Automaton) normalized} first and is
     * not modified. DFA state 0 is the start state; the other states are
     * numbered in discovery order of a depth first exploration which visits
     * successors in ascending symbol order.
     */
    static DFA determinize(Automaton fa) {

        final NFA nfa = Normalizer.normalize(fa);
        final DFA dfa = new DFA();

        /*
         * Keyed by the membership vector itself, not by a digest of it: two
         * different sets never share a DFA state.
         */
        final Map<BitSet, MetaState> metaStates = new HashMap<BitSet, MetaState>();
        final LinkedList<MetaState> gray = new LinkedList<MetaState>();

        final BitSet init = new BitSet(nfa.stateCount());
        init.set(nfa.start());
        gray.addFirst(metaStateFrom(nfa, dfa, metaStates, init));

        final SortedMap<Character, BitSet> successors = new TreeMap<Character, BitSet>();
        while (!gray.isEmpty()) {
            final MetaState from = gray.removeFirst();

            successors.clear();
            for (int s = from.nfaStates.nextSetBit(0); s >= 0;
                    s = from.nfaStates.nextSetBit(s + 1)) {
                for (Edge edge : nfa.edgeList(s)) {
                    char c = edge.symbol();
                    BitSet to = successors.get(c);
                    if (to == null) {
                        successors.put(c, to = new BitSet(nfa.stateCount()));
                    }
                    to.set(edge.to());
                }
            }

            for (Map.Entry<Character, BitSet> e : successors.entrySet()) {
                MetaState to = metaStates.get(e.getValue());
                if (to == null) {
                    to = metaStateFrom(nfa, dfa, metaStates, e.getValue());
                    gray.addFirst(to);
                }
                dfa.addEdge(new Edge(from.id, to.id, e.getKey()));
            }
        }

        if (logger.isLoggable(level)) {
            logger.log(level, "subsets: " + metaStates.values());
            logger.log(level, "dfa: " + dfa);
        }
        return dfa;
    }

    private static MetaState metaStateFrom(
            NFA nfa, DFA dfa, Map<BitSet, MetaState> metaStates, BitSet nfaStates) {

        MetaState metaState = new MetaState(nfaStates, dfa.addState());
        for (int s = nfaStates.nextSetBit(0); s >= 0; s = nfaStates.nextSetBit(s + 1)) {
            if (nfa.isTerminal(s)) {
                dfa.setTerminal(metaState.id, true);
                break;
            }
        }
        metaStates.put(nfaStates, metaState);
        return metaState;
    }
}
