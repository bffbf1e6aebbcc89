/* @LICENSE@
 */
package org.rxnfa.regex;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.rxnfa.regex.Token.Literal;
import org.rxnfa.regex.Token.Operator;

/**
 * Thompson's construction over a postfix token sequence. The builder is a
 * stack machine: each literal pushes a two state fragment, each operator pops
 * its operands and pushes the combined fragment. Nothing recurses, so nesting
 * depth is bounded only by the heap.
 * <p>
 * One builder instance serves one build. It owns the state counter and the
 * transition table, so concurrent builds share nothing.
 */
final class ThompsonBuilder {

    private static final Logger logger = Logger.getLogger("org.rxnfa.regex");
    private static final Level level = Level.FINER;

    /**
     * An NFA under construction: a single entry and a single exit. The accept
     * state of a fragment has no outgoing transitions until the fragment is
     * wired into an enclosing one.
     */
    static final class Fragment {

        final int start;
        final int accept;

        Fragment(int start, int accept) {
            this.start = start;
            this.accept = accept;
        }

        @Override
        public String toString() {
            return "[" + start + "->" + accept + "]";
        }
    }

    private final Postfix postfix;
    private final TransitionTable table = new TransitionTable();
    private final Deque<Fragment> stack = new ArrayDeque<Fragment>();

    private ThompsonBuilder(Postfix postfix) {
        this.postfix = postfix;
    }

    /**
     * @throws ConstructionException
     *             if <code>postfix</code> does not reduce to exactly one
     *             fragment.
     */
    static Nfa build(Postfix postfix) {
        return new ThompsonBuilder(postfix).run();
    }

    private Nfa run() {
        for (int i = 0; i < postfix.size(); ++i) {
            final Token t = postfix.get(i);
            switch (t.type()) {
            case LITERAL:
                literal(((Literal) t).c);
                break;
            case OPERATOR:
                apply(((Operator) t).kind, i);
                break;
            case PAREN:
                throw new ConstructionException("parenthesis in postfix sequence", i);
            default:
                throw new AssertionError(t.type());
            }
        }
        if (stack.size() != 1) {
            throw new ConstructionException(
                "postfix sequence reduced to " + stack.size() + " fragments, not 1", -1);
        }
        final Fragment f = stack.pop();
        logger.log(level, "postfix: " + postfix + ", states: " + table.size() + ", nfa: " + f);
        return new Nfa(postfix, f.start, f.accept, table.freeze());
    }

    private void literal(char c) {
        final int s0 = table.newState();
        final int s1 = table.newState();
        table.addSymbol(s0, c, s1);
        stack.push(new Fragment(s0, s1));
    }

    private void apply(Operator.Kind kind, int index) {
        if (stack.size() < kind.arity) {
            throw new ConstructionException(
                "'" + kind.glyph + "' needs " + kind.arity + " operand(s), found " + stack.size(),
                index);
        }
        switch (kind) {
        case CONCAT:
            concat();
            break;
        case UNION:
            union();
            break;
        case STAR:
            star();
            break;
        case PLUS:
            plus();
            break;
        case OPTION:
            option();
            break;
        default:
            throw new AssertionError(kind);
        }
    }

    private Fragment pop() {
        final Fragment f = stack.pop();
        assert table.isDeadEnd(f.accept) : f;
        return f;
    }

    /*
     * The right operand was pushed last, so it is popped first.
     */
    private void concat() {
        final Fragment f2 = pop();
        final Fragment f1 = pop();
        table.addEpsilon(f1.accept, f2.start);
        stack.push(new Fragment(f1.start, f2.accept));
    }

    private void union() {
        final Fragment f2 = pop();
        final Fragment f1 = pop();
        final int start = table.newState();
        final int accept = table.newState();
        table.addEpsilon(start, f1.start);
        table.addEpsilon(start, f2.start);
        table.addEpsilon(f1.accept, accept);
        table.addEpsilon(f2.accept, accept);
        stack.push(new Fragment(start, accept));
    }

    private void star() {
        final Fragment f = pop();
        final int start = table.newState();
        final int accept = table.newState();
        table.addEpsilon(start, f.start);
        table.addEpsilon(start, accept);        // skip
        table.addEpsilon(f.accept, f.start);    // repeat
        table.addEpsilon(f.accept, accept);     // exit
        stack.push(new Fragment(start, accept));
    }

    /*
     * No new start state: entry is through f, so at least one pass is forced.
     */
    private void plus() {
        final Fragment f = pop();
        final int accept = table.newState();
        table.addEpsilon(f.accept, f.start);
        table.addEpsilon(f.accept, accept);
        stack.push(new Fragment(f.start, accept));
    }

    private void option() {
        final Fragment f = pop();
        final int start = table.newState();
        final int accept = table.newState();
        table.addEpsilon(start, f.start);
        table.addEpsilon(start, accept);
        table.addEpsilon(f.accept, accept);
        stack.push(new Fragment(start, accept));
    }
}
