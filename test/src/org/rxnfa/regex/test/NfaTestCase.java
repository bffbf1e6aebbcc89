/* @LICENSE@
 */

package org.rxnfa.regex.test;

import static org.rxnfa.regex.NfaAssert.*;

import java.util.Arrays;
import java.util.TreeSet;

import org.rxnfa.regex.AbstractRxTestCase;
import org.rxnfa.regex.Nfa;
import org.rxnfa.regex.RegexSyntaxException;

public class NfaTestCase extends AbstractRxTestCase {

    public NfaTestCase(String name) {
        super(name);
    }

    private static String repeat(String s, int n) {
        StringBuilder sb = new StringBuilder(s.length() * n);
        for (int i = 0; i < n; ++i) {
            sb.append(s);
        }
        return sb.toString();
    }

    public void testLiteral() {
        assertAccepts("a", "a");
        assertRejects("a", "", "b", "aa");
        assertAccepts("abc", "abc");
        assertRejects("abc", "ab", "abcc", "cba");
    }

    public void testUnion() {
        assertAccepts("a|b", "a", "b");
        assertRejects("a|b", "", "ab", "c");
        assertAccepts("ab|cd", "ab", "cd");
        assertRejects("ab|cd", "abd", "acd");
    }

    public void testQuantifiers() {
        assertAccepts("a*", "", "a", "aaaa");
        assertRejects("a*", "b", "ab");
        assertAccepts("a+", "a", "aaa");
        assertRejects("a+", "", "b");
        assertAccepts("a?", "", "a");
        assertRejects("a?", "aa");
        assertAccepts("(ab)+", "ab", "abab");
        assertRejects("(ab)+", "", "aba");
    }

    public void testDragonBook() {
        assertAccepts("(a|b)*abb", "abb", "aabb", "babb", "ababb", "bbbabb");
        assertRejects("(a|b)*abb", "", "ab", "abba", "abab");
        for (String s : strings("ab", 7)) {
            assertEquals(s, s.endsWith("abb"), accepts(Nfa.compile("(a|b)*abb"), s));
        }
    }

    public void testJavaLanguage() {
        for (String regex : new String[] {
                "a", "ab", "a|b", "a*", "a+", "a?",
                "(a|b)*abb", "(ab|b)*a?", "a(b|c)*", "((a|b)(c|a))+",
                "(a*)*", "(a?)+", "(a|b)?c|b+", "a*b*c*", "c(a+|b?)*c" }) {
            assertJavaLanguage(regex, "abc", 6);
        }
    }

    public void testStackedQuantifiers() {
        // java.util.regex reads these as possessive or reluctant
        assertSameLanguage("a**", "a*", "ab", 5);
        assertSameLanguage("a+?", "a*", "ab", 5);
        assertSameLanguage("a?+", "a*", "ab", 5);
        assertSameLanguage("a?*", "a*", "ab", 5);
        assertSameLanguage("(ab)*+", "(ab)*", "ab", 6);
    }

    public void testUnionAssociativity() {
        assertSameLanguage("a|b|c", "(a|b)|c", "abc", 3);
        assertSameLanguage("a|b|c", "a|(b|c)", "abc", 3);
        assertSameLanguage("ab(c)", "(ab)c", "abc", 4);
    }

    public void testEscapes() {
        assertAccepts("\\*\\|", "*|");
        assertAccepts("a\\.b", "a.b");
        assertRejects("a\\.b", "axb", "ab");
        assertAccepts("\\(a\\)+", "(a)", "(a)))");
        assertAccepts("\\\\", "\\");
    }

    public void testLiteralFlag() {
        Nfa nfa = logged(Nfa.compile("(a|b)*.", Nfa.LITERAL));
        assertTrue(accepts(nfa, "(a|b)*."));
        assertFalse(accepts(nfa, "a"));
        assertEquals(7, nfa.alphabet().size());
    }

    public void testNoEscapesFlag() {
        Nfa nfa = Nfa.compile("a\\b*", Nfa.X_NO_ESCAPES);
        assertTrue(accepts(nfa, "a\\"));
        assertTrue(accepts(nfa, "a\\bbb"));
        assertFalse(accepts(nfa, "ab"));
    }

    public void testAsciiOnlyFlag() {
        assertTrue(accepts(Nfa.compile("x~", Nfa.X_ASCII_ONLY), "x~"));
        assertSyntaxError("é", Nfa.X_ASCII_ONLY, RegexSyntaxException.Kind.INVALID_TOKEN, 0);
        assertTrue(accepts(Nfa.compile("é+"), "éé"));
    }

    public void testAlphabet() {
        assertEquals(new TreeSet<Character>(Arrays.asList('a', 'b')),
            Nfa.compile("(a|b)*abb").alphabet());
        assertEquals(new TreeSet<Character>(Arrays.asList('*', 'x')),
            Nfa.compile("\\*x").alphabet());
    }

    public void testErrorsStopCompilation() {
        assertSyntaxError("", RegexSyntaxException.Kind.EMPTY_PATTERN, -1);
        assertSyntaxError("(ab", RegexSyntaxException.Kind.UNBALANCED_PARENTHESIS, 0);
        assertSyntaxError("ab)", RegexSyntaxException.Kind.UNBALANCED_PARENTHESIS, 2);
        assertSyntaxError("a|*b", RegexSyntaxException.Kind.INVALID_TOKEN, 2);
        assertSyntaxError("a.b", RegexSyntaxException.Kind.INVALID_TOKEN, 1);
    }

    public void testLongConcatenation() {
        String s = repeat("a", 2000);
        Nfa nfa = Nfa.compile(s);
        assertEquals(4000, nfa.stateCount());
        assertTrue(accepts(nfa, s));
        assertFalse(accepts(nfa, s.substring(1)));
        assertWellFormed(nfa);
    }

    public void testDeepNesting() {
        Nfa nfa = Nfa.compile(repeat("(", 5000) + "a" + repeat(")", 5000));
        assertEquals(2, nfa.stateCount());
        assertEquals("a", nfa.postfix().toString());

        nfa = Nfa.compile(repeat("(", 1000) + "a" + repeat(")*", 1000));
        assertEquals(2 + 2 * 1000, nfa.stateCount());
        assertTrue(accepts(nfa, ""));
        assertTrue(accepts(nfa, "aaa"));
        assertFalse(accepts(nfa, "b"));
        assertWellFormed(nfa);
    }
}
