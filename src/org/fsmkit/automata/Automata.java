/*
 * @LICENSE@
 */

package org.fsmkit.automata;

import java.util.BitSet;

/**
 * Static entry points for the transformations of this package. Unless the
 * method name says otherwise ("InPlace", {@link #makeComplete(DFA, char...)})
 * every transformation returns a new automaton and leaves its argument
 * untouched.
 */
public final class Automata {

    private Automata() {
    } // never instantiated

    /**
     * Splits every multi-character edge into a chain of single character
     * edges through fresh intermediate states.
     */
    public static NFA splitLongWords(Automaton fa) {
        return Normalizer.splitLongWords(fa);
    }

    /**
     * Eliminates epsilon edges by epsilon-closure folding.
     *
     * @param fa
     *            an automaton without multi-character words; see
     *            {@link #splitLongWords(Automaton)}.
     */
    public static NFA removeEpsilons(Automaton fa) {
        return Normalizer.removeEpsilons(fa);
    }

    /**
     * {@link #splitLongWords(Automaton)} followed by
     * {@link #removeEpsilons(Automaton)}: every edge of the result carries
     * exactly one symbol.
     */
    public static NFA normalize(Automaton fa) {
        return Normalizer.normalize(fa);
    }

    /**
     * Subset construction. Only the state sets reachable from the start state
     * become DFA states; no sink is added.
     */
    public static DFA toDFA(Automaton fa) {
        return SubsetConstruction.determinize(fa);
    }

    /**
     * State elimination. The result uses <code>1</code> for the empty word,
     * <code>+</code> for alternation, postfix <code>*</code>, juxtaposition
     * and parentheses, and is the empty string for the empty language.
     */
    public static String toRegex(Automaton fa) {
        return StateElimination.toRegex(fa);
    }

    /**
     * @return the distinct characters of all edge words, ascending.
     */
    public static char[] alphabetOf(Automaton fa) {
        BitSet symbols = new BitSet();
        for (int s = 0; s < fa.stateCount(); ++s) {
            for (Edge edge : fa.edges(s)) {
                for (int i = 0; i < edge.word().length(); ++i) {
                    symbols.set(edge.word().charAt(i));
                }
            }
        }
        char[] ret = new char[symbols.cardinality()];
        int i = 0;
        for (int c = symbols.nextSetBit(0); c >= 0; c = symbols.nextSetBit(c + 1)) {
            ret[i++] = (char) c;
        }
        return ret;
    }

    /**
     * In place; see {@link DFA#makeComplete(char...)}.
     *
     * @return the sink state.
     */
    public static int makeComplete(DFA dfa, char... alphabet) {
        return dfa.makeComplete(alphabet);
    }

    /**
     * In place; see {@link DFA#complementInPlace()}. <code>dfa</code> must
     * already be total.
     */
    public static void complementInPlace(DFA dfa) {
        dfa.complementInPlace();
    }

    /**
     * @return a new DFA accepting exactly the strings over
     *         <code>alphabet</code> that <code>dfa</code> rejects.
     */
    public static DFA complement(DFA dfa, char... alphabet) {
        DFA ret = DFA.copyOf(dfa);
        ret.makeComplete(alphabet);
        ret.complementInPlace();
        return ret;
    }
}
