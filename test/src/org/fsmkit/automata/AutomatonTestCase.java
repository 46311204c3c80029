/* @LICENSE@
 */

package org.fsmkit.automata;

import java.util.Arrays;

public class AutomatonTestCase extends AbstractAutomataTestCase {

    public static void main(String[] args) {
        junit.textui.TestRunner.run(AutomatonTestCase.class);
    }

    public AutomatonTestCase(String name) {
        super(name);
    }

    public void testAddState() {
        for (Automaton fa : new Automaton[] {new NFA(), new DFA()}) {
            assertEquals(0, fa.stateCount());
            assertEquals(0, fa.addState());
            assertEquals(1, fa.addState());
            assertEquals(2, fa.addState());
            assertEquals(3, fa.stateCount());
            assertEquals(0, fa.start());
            for (int s = 0; s < 3; ++s) {
                assertFalse(fa.isTerminal(s));
                assertTrue(fa.edges(s).isEmpty());
            }
            fa.setStart(2);
            fa.setTerminal(1, true);
            assertEquals(2, fa.start());
            assertTrue(fa.isTerminal(1));
            fa.setTerminal(1, false);
            assertFalse(fa.isTerminal(1));
        }
    }

    public void testStateOutOfRange() {
        for (Automaton fa : new Automaton[] {new NFA(2), DFA.copyOf(new NFA(2))}) {
            try {
                fa.setStart(2);
                fail("should throw");
            } catch (IllegalArgumentException e) {}
            try {
                fa.isTerminal(-1);
                fail("should throw");
            } catch (IllegalArgumentException e) {}
            try {
                fa.addEdge(new Edge(0, 5, "a"));
                fail("should throw");
            } catch (IllegalArgumentException e) {}
        }
    }

    public void testNFAEdges() {
        NFA nfa = new NFA(3);
        Edge a = new Edge(0, 1, "a");
        Edge eps = Edge.epsilon(0, 2);
        Edge ab = new Edge(0, 0, "ab");
        nfa.addEdge(a);
        nfa.addEdge(eps);
        nfa.addEdge(ab);
        nfa.addEdge(a);     // parallel, identical
        assertEquals(Arrays.asList(a, eps, ab, a), nfa.edges(0));
        assertTrue(nfa.edges(1).isEmpty());

        assertTrue(nfa.deleteEdge(new Edge(0, 1, "a")));
        assertEquals(Arrays.asList(eps, ab, a), nfa.edges(0));
        assertTrue(nfa.deleteEdge(a));
        assertFalse(nfa.deleteEdge(a));
        assertFalse(nfa.deleteEdge(new Edge(0, 2, "a")));
        assertEquals(Arrays.asList(eps, ab), nfa.edges(0));
    }

    public void testEdgesIsSnapshot() {
        NFA nfa = new NFA(2);
        nfa.addEdge(new Edge(0, 1, "a"));
        try {
            nfa.edges(0).add(new Edge(0, 0, "b"));
            fail("should throw");
        } catch (UnsupportedOperationException e) {}
        assertEquals(1, nfa.edges(0).size());
    }

    public void testDFAOverwrite() {
        DFA dfa = DFA.copyOf(new NFA(3));
        dfa.addEdge(new Edge(0, 1, 'a'));
        dfa.addEdge(new Edge(0, 2, 'a'));
        assertEquals(Arrays.asList(new Edge(0, 2, 'a')), dfa.edges(0));
        assertEquals(2, dfa.next(0, 'a'));
        assertEquals(-1, dfa.next(0, 'b'));
    }

    public void testDFAEdgeOrder() {
        DFA dfa = DFA.copyOf(new NFA(2));
        dfa.addEdge(new Edge(0, 1, 'c'));
        dfa.addEdge(new Edge(0, 0, 'a'));
        dfa.addEdge(new Edge(0, 1, 'b'));
        assertEquals(Arrays.asList(
                new Edge(0, 0, 'a'), new Edge(0, 1, 'b'), new Edge(0, 1, 'c')),
            dfa.edges(0));
    }

    public void testDFADeleteEdge() {
        DFA dfa = DFA.copyOf(new NFA(2));
        dfa.addEdge(new Edge(0, 1, 'a'));
        assertFalse(dfa.deleteEdge(new Edge(0, 0, 'a')));   // other destination
        assertFalse(dfa.deleteEdge(new Edge(0, 1, 'b')));
        assertEquals(1, dfa.edges(0).size());
        assertTrue(dfa.deleteEdge(new Edge(0, 1, 'a')));
        assertTrue(dfa.edges(0).isEmpty());
        assertFalse(dfa.deleteEdge(new Edge(0, 1, 'a')));
    }

    public void testDFAWordContract() {
        DFA dfa = DFA.copyOf(new NFA(2));
        for (String word : new String[] {"", "ab"}) {
            try {
                dfa.addEdge(new Edge(0, 1, word));
                fail("should throw: \"" + word + "\"");
            } catch (IllegalArgumentException e) {}
            try {
                dfa.deleteEdge(new Edge(0, 1, word));
                fail("should throw: \"" + word + "\"");
            } catch (IllegalArgumentException e) {}
        }
        try {
            DFA.copyOf(nfa("2 0 false true 1 0 1 eps"));
            fail("should throw");
        } catch (IllegalArgumentException e) {}
    }

    public void testDFAAccepts() {
        // strings over {a, b} with an even number of a's
        DFA dfa = DFA.copyOf(nfa("2 0 true false 4 0 1 a 0 0 b 1 0 a 1 1 b"));
        assertTrue(dfa.accepts(""));
        assertTrue(dfa.accepts("bab" + "a"));
        assertFalse(dfa.accepts("ab"));
        assertFalse(dfa.accepts("c"));      // missing edge
    }

    public void testCopyOf() {
        NFA nfa = nfa("3 1 false false true 3 1 2 ab 2 0 eps 1 1 a");
        NFA copy = NFA.copyOf(nfa);
        assertEquals(text(nfa), text(copy));
        copy.addEdge(new Edge(0, 0, "b"));
        copy.setTerminal(0, true);
        assertTrue(nfa.edges(0).isEmpty());
        assertFalse(nfa.isTerminal(0));
    }

    public void testEdge() {
        Edge e = new Edge(3, 4, "xy");
        assertEquals("3->4 xy", e.toString());
        assertEquals("1->2 ", Edge.epsilon(1, 2).toString());
        assertTrue(Edge.epsilon(1, 2).isEpsilon());
        assertEquals(new Edge(1, 2, 'x'), new Edge(1, 2, "x"));
        assertEquals(new Edge(1, 2, 'x').hashCode(), new Edge(1, 2, "x").hashCode());
        assertFalse(new Edge(1, 2, "x").equals(new Edge(2, 1, "x")));
        assertEquals('x', new Edge(1, 2, "x").symbol());
        try {
            e.symbol();
            fail("should throw");
        } catch (IllegalStateException ex) {}
    }

    public void testToString() {
        NFA nfa = nfa("2 0 false true 1 0 1 a");
        String s = nfa.toString();
        assertTrue(s, s.startsWith("nfa total states: 2 total edges: 1"));
        assertTrue(s, s.contains("0->1 a"));
    }
}
