/*
 * @LICENSE@
 */

package org.fsmkit.automata;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.Charset;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Command line filter: reads an automaton from standard input in the
 * {@linkplain AutomatonFormat read format}, splits its multi-character edges
 * and writes the result to standard output in the write format. There are no
 * options. Any failure prints a one line diagnostic to standard error and
 * exits with status 1; nothing is written to standard output in that case.
 */
public final class Main {

    private static final Logger logger = Logger.getLogger("org.fsmkit.automata");

    private Main() {
    } // never instantiated

    /**
     * The filter proper. Output is produced only after the whole input has
     * been read and transformed.
     */
    static void run(Reader in, Writer out) throws IOException {
        NFA nfa = AutomatonFormat.read(in);
        String result = AutomatonFormat.toString(Automata.splitLongWords(nfa));
        out.write(result);
        out.flush();
    }

    public static void main(String[] args) {
        Charset cs = Charset.defaultCharset();
        try {
            run(new BufferedReader(new InputStreamReader(System.in, cs)),
                new OutputStreamWriter(System.out, cs));
        } catch (IOException e) {
            fail(e);
        } catch (RuntimeException e) {
            fail(e);
        }
    }

    private static void fail(Exception e) {
        logger.log(Level.FINE, "filter failed", e);
        System.err.println("fsmkit: " + e.getMessage());
        System.exit(1);
    }
}
