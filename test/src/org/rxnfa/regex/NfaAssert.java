/*@LICENSE@
 */

package org.rxnfa.regex;

import static junit.framework.Assert.*;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Assertions over compiled automata, plus the small epsilon-closure simulator
 * they need. Where the regex syntax coincides with {@link java.util.regex}
 * (literals over a small alphabet and <code>( ) | * + ?</code>), the standard
 * package serves as the reference definition of the language.
 */
public final class NfaAssert {

    private NfaAssert() {}   // not instantiable.

    /*
     * simulation
     */
    public static Set<Integer> closure(Nfa nfa, Set<Integer> states) {
        Set<Integer> ret = new HashSet<Integer>(states);
        Deque<Integer> todo = new ArrayDeque<Integer>(states);
        while (!todo.isEmpty()) {
            for (int next : nfa.transitionsFrom(todo.pop(), Nfa.EPSILON)) {
                if (ret.add(next)) {
                    todo.push(next);
                }
            }
        }
        return ret;
    }

    public static boolean accepts(Nfa nfa, CharSequence input) {
        Set<Integer> current = new HashSet<Integer>();
        current.add(nfa.start());
        current = closure(nfa, current);
        for (int i = 0; i < input.length() && !current.isEmpty(); ++i) {
            Set<Integer> next = new HashSet<Integer>();
            for (int s : current) {
                next.addAll(nfa.transitionsFrom(s, input.charAt(i)));
            }
            current = closure(nfa, next);
        }
        return current.contains(nfa.accept());
    }

    /**
     * @return every string over <code>alphabet</code> of length at most
     *         <code>maxLength</code>, shortest first, the empty string
     *         included.
     */
    public static List<String> strings(String alphabet, int maxLength) {
        List<String> ret = new ArrayList<String>();
        ret.add("");
        int from = 0;
        for (int len = 1; len <= maxLength; ++len) {
            int to = ret.size();
            for (int i = from; i < to; ++i) {
                for (char c : alphabet.toCharArray()) {
                    ret.add(ret.get(i) + c);
                }
            }
            from = to;
        }
        return ret;
    }

    /*
     * language assertions
     */
    public static void assertAccepts(String regex, String... inputs) {
        Nfa nfa = Nfa.compile(regex);
        for (String input : inputs) {
            assertTrue(regex + " should accept \"" + input + '"', accepts(nfa, input));
        }
    }

    public static void assertRejects(String regex, String... inputs) {
        Nfa nfa = Nfa.compile(regex);
        for (String input : inputs) {
            assertFalse(regex + " should reject \"" + input + '"', accepts(nfa, input));
        }
    }

    /**
     * Compares the language of <code>regex</code> with that of the standard
     * package, on every string over <code>alphabet</code> up to
     * <code>maxLength</code> long.
     */
    public static void assertJavaLanguage(String regex, String alphabet, int maxLength) {
        Nfa nfa = Nfa.compile(regex);
        java.util.regex.Pattern p = java.util.regex.Pattern.compile(regex);
        for (String s : strings(alphabet, maxLength)) {
            assertEquals(regex + " on \"" + s + '"', p.matcher(s).matches(), accepts(nfa, s));
        }
    }

    public static void assertSameLanguage(String lhs, String rhs, String alphabet, int maxLength) {
        Nfa l = Nfa.compile(lhs);
        Nfa r = Nfa.compile(rhs);
        for (String s : strings(alphabet, maxLength)) {
            assertEquals(lhs + " vs " + rhs + " on \"" + s + '"', accepts(l, s), accepts(r, s));
        }
    }

    /**
     * Structural invariants of a Thompson automaton: ids in range, a single
     * start and accept that differ, no transitions out of the accept state, at
     * most one destination per (state, symbol).
     */
    public static void assertWellFormed(Nfa nfa) {
        int n = nfa.stateCount();
        assertTrue(0 <= nfa.start() && nfa.start() < n);
        assertTrue(0 <= nfa.accept() && nfa.accept() < n);
        assertTrue(nfa.start() != nfa.accept());
        assertTrue(nfa.symbolsFrom(nfa.accept()).isEmpty());
        assertTrue(nfa.epsilonTransitionsFrom(nfa.accept()).isEmpty());
        Set<Character> alphabet = new TreeSet<Character>();
        for (int s = 0; s < n; ++s) {
            for (char c : nfa.symbolsFrom(s)) {
                alphabet.add(c);
                Set<Integer> to = nfa.transitionsFrom(s, c);
                assertEquals(1, to.size());
                assertInRange(n, to);
            }
            assertInRange(n, nfa.epsilonTransitionsFrom(s));
        }
        assertEquals(alphabet, nfa.alphabet());
    }

    private static void assertInRange(int n, Set<Integer> states) {
        for (int s : states) {
            assertTrue("dangling transition to " + s, 0 <= s && s < n);
        }
    }

    /*
     * error assertions
     */
    public static RegexSyntaxException assertSyntaxError(
            String regex, RegexSyntaxException.Kind kind, int index) {
        return assertSyntaxError(regex, 0, kind, index);
    }

    public static RegexSyntaxException assertSyntaxError(
            String regex, int flags, RegexSyntaxException.Kind kind, int index) {
        try {
            Nfa.compile(regex, flags);
            fail("should throw: " + regex);
            return null;
        } catch (RegexSyntaxException e) {
            assertEquals(e.getMessage(), kind, e.getKind());
            assertEquals(e.getMessage(), index, e.getIndex());
            assertEquals(regex, e.getPattern());
            if (index >= 0) {
                assertEquals(regex.charAt(index), e.getOffendingChar());
            } else {
                assertEquals(-1, e.getOffendingChar());
            }
            return e;
        }
    }

    public static ConstructionException assertMalformed(Postfix postfix, int tokenIndex) {
        try {
            Nfa.fromPostfix(postfix);
            fail("should throw: " + postfix);
            return null;
        } catch (ConstructionException e) {
            assertEquals(e.getMessage(), tokenIndex, e.getTokenIndex());
            return e;
        }
    }
}
