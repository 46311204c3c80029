/*
 * @LICENSE@
 */

package org.fsmkit.automata;

import java.util.Arrays;
import java.util.BitSet;
import java.util.NoSuchElementException;


/**
 * Static helpers shared by the automaton classes.
 */
final class Misc {

    private Misc() {
    } // never instantiated

    public static final String LS = System.getProperty("line.separator");

    /*
     * idiom suppression for clearing StringBuilders
     */
    public static void clear(StringBuilder sb) {
        sb.delete(0, sb.length());
    }

    static int checkState(Automaton fa, int state) {
        if (state < 0 || state >= fa.stateCount()) {
            throw new IllegalArgumentException(
                "state " + state + " out of range [0, " + fa.stateCount() + ")");
        }
        return state;
    }

    static String stringFrom(BitSet states) {
        StringBuilder sb = new StringBuilder();
        for (int s = states.nextSetBit(0); s >= 0; s = states.nextSetBit(s + 1)) {
            sb.append(sb.length() == 0 ? '{' : ',').append(s);
        }
        return sb.length() == 0 ? "{}" : sb.append('}').toString();
    }

    /*
     * Multi-line dump shared by the toString() of both automaton variants.
     */
    static String dump(Automaton fa) {
        int nEdges = 0;
        for (int s = 0; s < fa.stateCount(); ++s) {
            nEdges += fa.edges(s).size();
        }
        StringBuilder sb = new StringBuilder();
        sb
            .append("total states: ").append(fa.stateCount())
            .append(" total edges: ").append(nEdges)
            .append(LS);
        sb.append("Start: ").append(fa.start()).append(LS);
        sb.append("Terminals:");
        for (int s = 0; s < fa.stateCount(); ++s) {
            if (fa.isTerminal(s)) sb.append(' ').append(s);
        }
        sb.append(LS);
        for (int s = 0; s < fa.stateCount(); ++s) {
            for (Edge edge : fa.edges(s)) {
                sb.append("    ").append(edge).append(LS);
            }
        }
        return sb.toString();
    }

    /**
     * Growable stack of state indices; the work list for the depth first
     * traversals, which never recurse.
     */
    static final class IntStack {

        private int[] elements = new int[16];
        private int size = 0;

        void push(int i) {
            if (size == elements.length) {
                elements = Arrays.copyOf(elements, size << 1);
            }
            elements[size++] = i;
        }

        int pop() {
            if (size == 0) throw new NoSuchElementException();
            return elements[--size];
        }

        boolean isEmpty() {
            return size == 0;
        }
    }
}
