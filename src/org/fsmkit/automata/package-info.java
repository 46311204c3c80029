/*
 * @LICENSE@
 */

/**
 * <h3><b>fsmkit</b> - classical finite automata constructions in Java.</h3>
 * <p>
 * <h4>Automata.</h4>
 * <p>
 * Two variants share the {@link org.fsmkit.automata.Automaton} contract. An
 * {@link org.fsmkit.automata.NFA} admits any number of edges per state and
 * symbol, epsilon edges, and edges labeled with whole words. A
 * {@link org.fsmkit.automata.DFA} admits at most one single-character edge per
 * state and symbol. States are plain <code>int</code> indices into per-state
 * arrays, so cyclic graphs need no object references between states.
 * <p>
 * <h4>Transformations.</h4>
 * <p>
 * The {@link org.fsmkit.automata.Automata} class gathers the algorithms:
 * <ul>
 * <li>word splitting and epsilon elimination, which leave exactly one symbol
 * on every edge;</li>
 * <li>subset construction, NFA to DFA;</li>
 * <li>state elimination, automaton to regular expression over the grammar
 * <code>1</code> (empty word), <code>+</code>, <code>*</code>, juxtaposition
 * and parentheses. The expression is not simplified;</li>
 * <li>completion of a DFA with a sink state, and complementation of a total
 * DFA.</li>
 * </ul>
 * All of them return new automata except completion and complementation, which
 * work in place. None of them parses regular expressions or minimizes DFAs.
 * <p>
 * <h4>Text format.</h4>
 * <p>
 * {@link org.fsmkit.automata.AutomatonFormat} reads and writes the text
 * format; {@link org.fsmkit.automata.Main} is a standard input to standard
 * output filter applying word splitting.
 * <p>
 * <h4>Logging.</h4>
 * <p>
 * The algorithms log their intermediate automata to the
 * <code>org.fsmkit.automata</code> {@link java.util.logging.Logger} at
 * <code>FINEST</code>.
 * <p>
 * <h4>References:</h4>
 * <ul>
 * <li>For the theory, see the first chapters of the <a
 * href="http://en.wikipedia.org/wiki/Compilers:_Principles,_Techniques,_and_Tools">Dragon
 * Book</a> and Hopcroft, Motwani and Ullman's <i>Introduction to Automata
 * Theory, Languages, and Computation</i>.</li>
 * </ul>
 */
package org.fsmkit.automata;
