/* @LICENSE@
 */
package org.rxnfa.regex;

import static org.rxnfa.regex.Misc.isSet;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.rxnfa.regex.Token.Operator;
import org.rxnfa.regex.Token.Paren;

/**
 * Rewrites an infix regex into postfix order in two passes: a scan that
 * tokenizes the regex and makes concatenation explicit, then a shunting-yard
 * pass over the tokens. Instances hold per-call scanning state and are not
 * thread safe; use one per conversion.
 */
final class PostfixConverter {

    private static final Logger logger = Logger.getLogger("org.rxnfa.regex");
    private static final Level level = Level.FINER;

    /*
     * fields to hold parameters and derived parameters
     */
    private String regex;
    private boolean literal;
    private boolean escapes;
    private boolean asciiOnly;

    /*
     * state for nextToken()
     */
    private int iNext;
    private int iCurrent;

    private void init(String regex, int flags) {
        this.regex = regex;
        this.literal = isSet(flags, Nfa.LITERAL);
        this.escapes = !literal && !isSet(flags, Nfa.X_NO_ESCAPES);
        this.asciiOnly = isSet(flags, Nfa.X_ASCII_ONLY);
        iNext = 0;
        iCurrent = -1;
    }

    /**
     * @return the tokens of <code>regex</code> in postfix order, parentheses
     *         removed.
     * @throws RegexSyntaxException
     *             if the regex is empty, holds a token that cannot appear
     *             where it does, or has unbalanced parentheses.
     */
    List<Token> convert(String regex, int flags) {
        final List<Token> infix = explicit(regex, flags);
        logger.log(level, "explicit: " + Postfix.stringFrom(infix));
        final List<Token> postfix = shuntingYard(infix);
        logger.log(level, "postfix: " + Postfix.stringFrom(postfix));
        return postfix;
    }

    /*
     * First pass: tokens in source order, with a CONCAT inserted between
     * every token that ends an operand and the next one that begins an
     * operand.
     */
    List<Token> explicit(String regex, int flags) {
        if (regex == null) {
            throw new NullPointerException("regex");
        }
        init(regex, flags);
        if (regex.length() == 0) {
            throw RegexSyntaxException.emptyPattern(regex);
        }
        final List<Token> tokens = new ArrayList<Token>(2 * regex.length());
        Token prev = null;
        while (iNext < regex.length()) {
            final Token t = nextToken();
            if (prev != null && prev.endsOperand() && t.beginsOperand()) {
                tokens.add(Token.operator(Operator.Kind.CONCAT, t.position));
            }
            tokens.add(t);
            prev = t;
        }
        return tokens;
    }

    private Token nextToken() {
        iCurrent = iNext;
        final char c = regex.charAt(iNext++);
        if (literal) {
            return literalAt(iCurrent);
        }
        if (escapes && c == '\\') {
            if (iNext == regex.length()) {
                syntaxError("dangling escape at end of pattern");
            }
            return literalAt(iNext++);
        }
        switch (c) {
        case '(':
            return Token.open(iCurrent);
        case ')':
            return Token.close(iCurrent);
        case '.':
            syntaxError("'.' is reserved as the concatenation marker; escape it as \\. to match a dot");
        }
        final Operator.Kind kind = Operator.Kind.forGlyph(c);
        return kind != null ? Token.operator(kind, iCurrent) : literalAt(iCurrent);
    }

    private Token literalAt(int position) {
        final char c = regex.charAt(position);
        if (!inAlphabet(c)) {
            throw RegexSyntaxException.invalidToken(
                "character " + Misc.Esc.RX.esc(c) + " is outside the alphabet", regex, position);
        }
        return Token.literal(c, position);
    }

    private boolean inAlphabet(char c) {
        return asciiOnly ? (0x20 <= c && c <= 0x7e) : !Character.isISOControl(c);
    }

    /*
     * Second pass. Binary operators are left associative: an incoming operator
     * first pops every stacked operator of greater or equal precedence. The
     * postfix quantifiers go through the same comparison; with the highest
     * precedence they only ever displace each other.
     *
     * expectOperand tracks whether the next token must begin an operand, which
     * catches operators missing an operand before they reach the builder.
     */
    List<Token> shuntingYard(List<Token> infix) {
        final List<Token> output = new ArrayList<Token>(infix.size());
        final Deque<Token> stack = new ArrayDeque<Token>();
        boolean expectOperand = true;
        Token last = null;

        for (Token t : infix) {
            switch (t.type()) {
            case LITERAL:
                assert expectOperand : t;
                output.add(t);
                expectOperand = false;
                break;

            case PAREN:
                if (((Paren) t).open) {
                    assert expectOperand : t;
                    stack.push(t);
                } else {
                    while (!stack.isEmpty() && stack.peek().type() != Token.Type.PAREN) {
                        output.add(stack.pop());
                    }
                    if (stack.isEmpty()) {
                        throw RegexSyntaxException.unbalanced("no matching '('", regex, t.position);
                    }
                    if (expectOperand) {
                        throw RegexSyntaxException.invalidToken(
                            "missing operand before ')'", regex, t.position);
                    }
                    stack.pop();
                }
                break;

            case OPERATOR:
                final Operator op = (Operator) t;
                if (expectOperand) {
                    throw RegexSyntaxException.invalidToken(
                        "missing operand for '" + op.kind.glyph + "'", regex, t.position);
                }
                while (!stack.isEmpty()
                        && stack.peek().type() == Token.Type.OPERATOR
                        && ((Operator) stack.peek()).kind.precedence >= op.kind.precedence) {
                    output.add(stack.pop());
                }
                stack.push(op);
                expectOperand = op.kind.arity == 2;
                break;

            default:
                throw new AssertionError(t.type());
            }
            last = t;
        }

        for (Token t : stack) {
            if (t.type() == Token.Type.PAREN) {
                throw RegexSyntaxException.unbalanced("unclosed '('", regex, t.position);
            }
        }
        if (expectOperand) {
            assert last != null && last.type() == Token.Type.OPERATOR : last;
            throw RegexSyntaxException.invalidToken(
                "missing operand after '" + ((Operator) last).kind.glyph + "'", regex, last.position);
        }
        while (!stack.isEmpty()) {
            output.add(stack.pop());
        }
        return Collections.unmodifiableList(output);
    }

    private void syntaxError(String msg) {
        throw RegexSyntaxException.invalidToken(msg, regex, iCurrent);
    }
}
