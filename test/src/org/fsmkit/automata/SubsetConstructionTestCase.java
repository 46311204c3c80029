/* @LICENSE@
 */

package org.fsmkit.automata;

import static org.fsmkit.automata.AutomataAssert.*;

public class SubsetConstructionTestCase extends AbstractAutomataTestCase {

    public static void main(String[] args) {
        junit.textui.TestRunner.run(SubsetConstructionTestCase.class);
    }

    public SubsetConstructionTestCase(String name) {
        super(name);
    }

    /*
     * (a+b)*ab - the textbook example.
     */
    public void testEndsWithAB() {
        NFA nfa = nfa("3 0 false false true 4 0 0 a 0 0 b 0 1 a 1 2 b");
        DFA dfa = SubsetConstruction.determinize(nfa);
        assertEquals(3, dfa.stateCount());
        assertEquals(0, dfa.start());
        assertDeterministic(dfa);
        assertSameLanguage(nfa, dfa);
        assertTrue(dfa.accepts("aab"));
        assertFalse(dfa.accepts("aba"));
    }

    public void testDiscoveryOrder() {
        // {0} -a-> {1,2} -b-> {0}; {0} -b-> {2}
        NFA nfa = nfa("3 0 false true false 4 0 1 a 0 2 a 0 2 b 1 0 b");
        DFA dfa = SubsetConstruction.determinize(nfa);
        assertEquals("Start: 0\nTerminals: 1\n"
            + "0->1 a\n"
            + "0->2 b\n"
            + "1->0 b\n", text(dfa));
    }

    public void testNoEdges() {
        DFA dfa = SubsetConstruction.determinize(nfa("2 1 false true 0"));
        assertEquals(1, dfa.stateCount());
        assertTrue(dfa.isTerminal(0));
        assertTrue(dfa.edges(0).isEmpty());
        assertTrue(dfa.accepts(""));
        assertFalse(dfa.accepts("a"));
    }

    public void testEpsilonAndLongWords() {
        NFA nfa = nfa("3 0 false false true 4 0 1 eps 1 2 abc 2 0 eps 1 1 b");
        DFA dfa = SubsetConstruction.determinize(nfa);
        assertDeterministic(dfa);
        assertTrue(dfa.accepts("abc"));
        assertTrue(dfa.accepts("bbabcabc"));
        assertFalse(dfa.accepts("ab"));
        assertEquals(new Edge(1, 2, "abc"), nfa.edges(1).get(0));  // input untouched
    }

    /*
     * Third symbol from the end is an a: all eight subsets {0} + S, S of
     * {1, 2, 3}, are reachable and must stay apart.
     */
    public void testExponentialBlowup() {
        NFA nfa = nfa("4 0 false false false true 7 "
            + "0 0 a 0 0 b 0 1 a 1 2 a 1 2 b 2 3 a 2 3 b");
        DFA dfa = SubsetConstruction.determinize(nfa);
        assertEquals(8, dfa.stateCount());
        assertSameLanguage(nfa, dfa);
        assertTrue(dfa.accepts("babb"));
        assertFalse(dfa.accepts("abbb"));
    }

    public void testRandom() {
        for (int i = 0; i < 300; ++i) {
            NFA nfa = randomNFA(8, 16, true);
            DFA dfa = SubsetConstruction.determinize(nfa);
            assertDeterministic(dfa);
            assertSameLanguage(nfa, dfa);
        }
    }
}
