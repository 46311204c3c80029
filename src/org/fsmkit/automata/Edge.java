/*
 * @LICENSE@
 */

package org.fsmkit.automata;

/**
 * A labeled transition between two states of an {@link Automaton}. Edges are
 * immutable values: two edges are equal iff source, destination and word are
 * equal.
 * <p>
 * The word is the empty string for an epsilon (silent) transition, a single
 * character for an ordinary transition, or - in an {@link NFA} only - a
 * longer string standing for a chain of single character transitions.
 */
public final class Edge {

    /**
     * The word of an epsilon edge.
     */
    public static final String EPSILON = "";

    private final int from;
    private final int to;
    private final String word;

    public Edge(int from, int to, String word) {
        if (word == null) {
            throw new IllegalArgumentException("null word");
        }
        this.from = from;
        this.to = to;
        this.word = word;
    }

    public Edge(int from, int to, char symbol) {
        this(from, to, String.valueOf(symbol));
    }

    public static Edge epsilon(int from, int to) {
        return new Edge(from, to, EPSILON);
    }

    public int from() {
        return from;
    }

    public int to() {
        return to;
    }

    public String word() {
        return word;
    }

    public boolean isEpsilon() {
        return word.length() == 0;
    }

    /**
     * @return the only character of a single character word.
     * @throws IllegalStateException if the word is not exactly one character
     *         long.
     */
    public char symbol() {
        if (word.length() != 1) {
            throw new IllegalStateException("not a single symbol edge: " + this);
        }
        return word.charAt(0);
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = 1;
        result = prime * result + from;
        result = prime * result + to;
        result = prime * result + word.hashCode();
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (!(obj instanceof Edge))
            return false;
        final Edge other = (Edge) obj;
        return from == other.from && to == other.to && word.equals(other.word);
    }

    /*
     * Same shape as an edge line of the text format, minus the line end.
     */
    @Override
    public String toString() {
        return Integer.toString(from) + "->" + to + ' ' + word;
    }
}
