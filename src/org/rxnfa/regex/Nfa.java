/*
 * @LICENSE@
 */

package org.rxnfa.regex;

import static org.rxnfa.regex.Misc.LS;

import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.rxnfa.regex.Misc.FlagMgr;

/**
 * A nondeterministic finite automaton built from a regular expression by
 * Thompson's construction. There is exactly one start state and exactly one
 * accept state; states are the integers <code>0 .. stateCount() - 1</code>.
 * <p>
 * Instances are immutable and thread safe. They are a read-only handle for
 * downstream consumers such as a simulator or a subset construction, and
 * expose no way to change the automaton.
 * <p>
 * <strong>Syntax:</strong> the regex is a string over literal characters and
 * the metacharacters <code>( ) | * + ?</code>, with the usual meaning and
 * precedence (quantifiers bind tightest, then concatenation, then
 * alternation). Concatenation is written by juxtaposition. A backslash makes
 * the character after it a literal. The character <code>'.'</code> is
 * reserved as the concatenation marker of the {@linkplain Postfix postfix}
 * form and is rejected unless escaped; it is <em>not</em> a wildcard.
 * Character classes, anchors and bounded repetition are not supported.
 * <p>
 * <strong>Construction:</strong> every state id is allocated by the build
 * that uses it, starting from 0, so building the same regex twice gives two
 * equal automata and builds on different threads never interfere.
 */
public final class Nfa {

    private static final Logger logger = Logger.getLogger("org.rxnfa.regex");
    private static final Level level = Level.FINEST;

    /**
     * The symbol value denoting an epsilon (empty) transition in
     * {@link #transitionsFrom(int, int)}. Real symbols are <code>char</code>
     * values, so they never collide with it.
     */
    public static final int EPSILON = -1;

    private static final FlagMgr flagMgr = new FlagMgr();

    /**
     * Every character of the regex is a literal; metacharacters and backslash
     * included.
     */
    public static final int LITERAL = flagMgr.next("LITERAL");

    /**
     * Backslash is an ordinary literal instead of an escape. This is a
     * nonstandard flag.
     */
    public static final int X_NO_ESCAPES = flagMgr.next("X_NO_ESCAPES");

    /**
     * Restricts the alphabet to printable ASCII (<code>0x20-0x7E</code>);
     * anything else is rejected as an invalid token. Without this flag every
     * character except the ISO control characters is allowed. This is a
     * nonstandard flag.
     */
    public static final int X_ASCII_ONLY = flagMgr.next("X_ASCII_ONLY");

    static {
        flagMgr.setImplemented(LITERAL | X_NO_ESCAPES | X_ASCII_ONLY).freezeAndCount();
    }

    static void checkFlags(int flags) {
        flagMgr.check(flags);
    }

    private final Postfix postfix;
    private final int start;
    private final int accept;
    private final TransitionTable table;
    private final SortedSet<Character> alphabet;

    Nfa(Postfix postfix, int start, int accept, TransitionTable table) {
        assert table.isState(start) && table.isState(accept);
        assert start != accept;
        assert table.isDeadEnd(accept);
        this.postfix = postfix;
        this.start = start;
        this.accept = accept;
        this.table = table;
        final SortedSet<Character> alphabet = new TreeSet<Character>();
        for (int s = 0; s < table.size(); ++s) {
            alphabet.addAll(table.symbols(s));
        }
        this.alphabet = Collections.unmodifiableSortedSet(alphabet);
    }

    /**
     * Compiles <code>regex</code> with default flags.
     *
     * @throws RegexSyntaxException
     *             if the regex is malformed.
     */
    public static Nfa compile(String regex) {
        return compile(regex, 0);
    }

    /**
     * Compiles <code>regex</code>: converts it to {@linkplain Postfix postfix}
     * form, then builds the automaton from that. If the first step fails the
     * second is never run.
     *
     * @param flags
     *            any combination of {@link #LITERAL}, {@link #X_NO_ESCAPES}
     *            and {@link #X_ASCII_ONLY}.
     * @throws RegexSyntaxException
     *             if the regex is malformed.
     * @throws IllegalArgumentException
     *             if <code>flags</code> holds an unknown flag.
     */
    public static Nfa compile(String regex, int flags) {
        checkFlags(flags);
        logger.log(level, "regex: " + Misc.Esc.RX.esc(regex == null ? "null" : regex)
            + ", flags: " + flagMgr.stringFrom(flags));
        return fromPostfix(Postfix.parse(regex, flags));
    }

    /**
     * Builds the automaton for a postfix sequence.
     *
     * @throws ConstructionException
     *             if the sequence is not well formed: an operator without
     *             enough operands, a parenthesis token, or anything other than
     *             exactly one operand left at the end. Sequences made by
     *             {@link Postfix#parse(String)} are always well formed.
     */
    public static Nfa fromPostfix(Postfix postfix) {
        if (postfix == null) {
            throw new NullPointerException("postfix");
        }
        return ThompsonBuilder.build(postfix);
    }

    public int start() {
        return start;
    }

    public int accept() {
        return accept;
    }

    /**
     * @return the number of states; ids run from 0 to one less than this.
     */
    public int stateCount() {
        return table.size();
    }

    /**
     * @return every literal character that labels some transition, sorted.
     */
    public SortedSet<Character> alphabet() {
        return alphabet;
    }

    /**
     * @return the postfix sequence this automaton was built from.
     */
    public Postfix postfix() {
        return postfix;
    }

    /**
     * The transition relation. For a real symbol the result has at most one
     * element; for {@link #EPSILON} it may have several.
     *
     * @param state
     *            a state id.
     * @param symbol
     *            a <code>char</code> value, or {@link #EPSILON}.
     * @return the destination states, possibly empty. The set is unmodifiable.
     * @throws IllegalArgumentException
     *             if <code>state</code> is not a state of this automaton, or
     *             <code>symbol</code> is neither a char nor EPSILON.
     */
    public Set<Integer> transitionsFrom(int state, int symbol) {
        if (symbol == EPSILON) {
            return table.epsilonDestinations(state);
        }
        if (symbol != (char) symbol) {
            throw new IllegalArgumentException("not a symbol: " + symbol);
        }
        return table.destinations(state, (char) symbol);
    }

    public Set<Integer> epsilonTransitionsFrom(int state) {
        return table.epsilonDestinations(state);
    }

    /**
     * @return the symbols with a transition out of <code>state</code>.
     */
    public Set<Character> symbolsFrom(int state) {
        return table.symbols(state);
    }

    /**
     * Lists the transitions one per line, as <code>from --c--&gt; [to]</code>,
     * with epsilon transitions written <code>--ε--&gt;</code>.
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append("postfix: ").append(postfix).append(LS);
        sb.append("start: ").append(start).append(LS);
        sb.append("accept: ").append(accept).append(LS);
        sb.append("transitions:").append(LS);
        for (int s = 0; s < table.size(); ++s) {
            for (Map.Entry<Character, Integer> arc : table.arcs(s).entrySet()) {
                sb.append("  ").append(s).append(" --").append(Misc.Esc.RX.esc(arc.getKey()))
                    .append("--> [").append(arc.getValue()).append(']').append(LS);
            }
            final Set<Integer> eps = table.epsilonDestinations(s);
            if (!eps.isEmpty()) {
                sb.append("  ").append(s).append(" --ε--> ")
                    .append(new TreeSet<Integer>(eps)).append(LS);
            }
        }
        return sb.toString();
    }
}
