/*
 * @LICENSE@
 */

package org.fsmkit.automata;

import java.io.IOException;
import java.io.Reader;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

/**
 * The text format for automata.
 * <p>
 * <strong>Read</strong> format: whitespace separated tokens - the state count,
 * the start state, one boolean terminal flag per state in index order, the
 * edge count, then <code>from to word</code> for each edge. The word token
 * <code>eps</code> stands for the empty word; any other token is taken
 * verbatim, so words cannot contain whitespace. For example
 *
 * <pre>
 * 2 0
 * true false
 * 2
 * 0 1 ab
 * 1 0 eps
 * </pre>
 *
 * <strong>Write</strong> format: a <code>Start: &lt;id&gt;</code> line, a
 * <code>Terminals:</code> line listing the terminal states, then one
 * <code>&lt;from&gt;-&gt;&lt;to&gt; &lt;word&gt;</code> line per edge, epsilon
 * written as the empty word. The write format lacks the state count and
 * carries no non-terminal flags, so it cannot be read back.
 */
public final class AutomatonFormat {

    /**
     * Word token of an epsilon edge in the read format.
     */
    public static final String EPS = "eps";

    private static final Set<String> TRUE = new HashSet<String>(
        Arrays.asList("1", "t", "T", "TRUE", "true", "True"));
    private static final Set<String> FALSE = new HashSet<String>(
        Arrays.asList("0", "f", "F", "FALSE", "false", "False"));

    private AutomatonFormat() {
    } // never instantiated

    /*
     * Whitespace delimited tokens, counted for diagnostics.
     */
    private static final class Tokenizer {

        private final Reader in;
        private final StringBuilder sb = new StringBuilder();
        private int index = 0;

        Tokenizer(Reader in) {
            this.in = in;
        }

        String next() throws IOException {
            Misc.clear(sb);
            int c;
            while ((c = in.read()) != -1 && Character.isWhitespace(c))
                ;
            while (c != -1 && !Character.isWhitespace(c)) {
                sb.append((char) c);
                c = in.read();
            }
            if (sb.length() == 0) {
                throw new AutomatonFormatException("unexpected end of input", null, index);
            }
            ++index;
            return sb.toString();
        }

        int nextInt(String what, int lo, int hi) throws IOException {
            String token = next();
            int i;
            try {
                i = Integer.parseInt(token);
            } catch (NumberFormatException e) {
                throw new AutomatonFormatException(what + ": integer expected", token, index - 1);
            }
            if (i < lo || i >= hi) {
                throw new AutomatonFormatException(
                    what + " out of range [" + lo + ", " + hi + ")", token, index - 1);
            }
            return i;
        }

        boolean nextBoolean(String what) throws IOException {
            String token = next();
            if (TRUE.contains(token)) return true;
            if (FALSE.contains(token)) return false;
            throw new AutomatonFormatException(what + ": boolean expected", token, index - 1);
        }
    }

    /**
     * Reads one automaton. Tokens after the last edge are ignored.
     *
     * @throws AutomatonFormatException
     *             for a malformed or out of range token, a state count below
     *             1, or a premature end of input.
     * @throws IOException
     *             from <code>in</code>.
     */
    public static NFA read(Reader in) throws IOException {
        Tokenizer tokenizer = new Tokenizer(in);
        final int stateCount = tokenizer.nextInt("state count", 1, Integer.MAX_VALUE);
        final int start = tokenizer.nextInt("start state", 0, stateCount);
        NFA nfa = new NFA(stateCount);
        nfa.setStart(start);
        for (int s = 0; s < stateCount; ++s) {
            nfa.setTerminal(s, tokenizer.nextBoolean("terminal flag of state " + s));
        }
        final int edgeCount = tokenizer.nextInt("edge count", 0, Integer.MAX_VALUE);
        for (int i = 0; i < edgeCount; ++i) {
            int from = tokenizer.nextInt("edge source", 0, stateCount);
            int to = tokenizer.nextInt("edge destination", 0, stateCount);
            String word = tokenizer.next();
            nfa.addEdge(new Edge(from, to, word.equals(EPS) ? Edge.EPSILON : word));
        }
        return nfa;
    }

    /**
     * Writes <code>fa</code> in the write format; every line, the last one
     * included, ends with <code>'\n'</code>.
     */
    public static void write(Appendable out, Automaton fa) throws IOException {
        out.append("Start: ").append(Integer.toString(fa.start())).append('\n');
        out.append("Terminals:");
        for (int s = 0; s < fa.stateCount(); ++s) {
            if (fa.isTerminal(s)) {
                out.append(' ').append(Integer.toString(s));
            }
        }
        out.append('\n');
        for (int s = 0; s < fa.stateCount(); ++s) {
            for (Edge edge : fa.edges(s)) {
                out.append(edge.toString()).append('\n');
            }
        }
    }

    public static String toString(Automaton fa) {
        StringBuilder sb = new StringBuilder();
        try {
            write(sb, fa);
        } catch (IOException e) {
            throw new AssertionError(e);    // StringBuilder doesn't throw
        }
        return sb.toString();
    }
}
