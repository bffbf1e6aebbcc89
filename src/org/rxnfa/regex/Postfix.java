/* @LICENSE@
 */
package org.rxnfa.regex;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * A regular expression in postfix (reverse Polish) order: every operator
 * follows its operands, concatenation is an explicit
 * {@linkplain Token.Operator.Kind#CONCAT operator}, and there are no
 * parentheses. Iteration order is evaluation order. This is the only thing
 * that passes between the regex parser and the NFA builder.
 * <p>
 * Instances are immutable and thread safe.
 * <p>
 * The string form writes concatenation as <code>'.'</code> and escapes any
 * literal that would otherwise read as syntax, so <code>"(a|b)*c"</code>
 * renders as <code>ab|*c.</code> and a literal <code>'*'</code> as
 * <code>\*</code>.
 */
public final class Postfix implements Iterable<Token> {

    private final List<Token> tokens;

    private Postfix(List<Token> tokens) {
        this.tokens = tokens;
    }

    /**
     * Converts <code>regex</code> to postfix form with default flags.
     *
     * @throws RegexSyntaxException
     *             if the regex is malformed.
     */
    public static Postfix parse(String regex) {
        return parse(regex, 0);
    }

    /**
     * Converts <code>regex</code> to postfix form.
     *
     * @param flags
     *            any combination of {@link Nfa#LITERAL},
     *            {@link Nfa#X_NO_ESCAPES} and {@link Nfa#X_ASCII_ONLY}.
     * @throws RegexSyntaxException
     *             if the regex is malformed.
     * @throws IllegalArgumentException
     *             if <code>flags</code> holds an unknown flag.
     */
    public static Postfix parse(String regex, int flags) {
        Nfa.checkFlags(flags);
        return new Postfix(new PostfixConverter().convert(regex, flags));
    }

    /**
     * Wraps a hand-built token sequence. Nothing is validated here; an
     * ill-formed sequence is reported by {@link Nfa#fromPostfix(Postfix)}.
     */
    public static Postfix of(List<? extends Token> tokens) {
        for (Token t : tokens) {
            if (t == null) throw new NullPointerException("null token");
        }
        return new Postfix(Collections.unmodifiableList(new ArrayList<Token>(tokens)));
    }

    public static Postfix of(Token... tokens) {
        return of(Arrays.asList(tokens));
    }

    public int size() {
        return tokens.size();
    }

    public Token get(int index) {
        return tokens.get(index);
    }

    /**
     * @return the tokens, as an unmodifiable list.
     */
    public List<Token> tokens() {
        return tokens;
    }

    public Iterator<Token> iterator() {
        return tokens.iterator();
    }

    static String stringFrom(Iterable<? extends Token> tokens) {
        StringBuilder sb = new StringBuilder();
        for (Token t : tokens) {
            sb.append(t);
        }
        return sb.toString();
    }

    @Override
    public int hashCode() {
        return tokens.hashCode();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Postfix))
            return false;
        return tokens.equals(((Postfix) o).tokens);
    }

    @Override
    public String toString() {
        return stringFrom(tokens);
    }
}
