/* @LICENSE@
 */
package org.rxnfa.regex;

/**
 * One unit of a regular expression as seen by the postfix converter and the
 * NFA builder. A token is a literal character, an operator, or one side of a
 * parenthesis pair. The set of subclasses is closed: the only instances are
 * those made by the static factory methods of this class.
 * <p>
 * Tokens are immutable. Each records the index in the source regex it was read
 * from; a synthetic {@linkplain Operator.Kind#CONCAT concatenation} records
 * the index of its right hand operand. Position takes no part in
 * {@link #equals(Object)}: two tokens are equal when they denote the same
 * thing.
 */
public abstract class Token {

    /**
     * Discriminator for the token variants.
     */
    public enum Type {
        LITERAL, OPERATOR, PAREN;
    }

    final int position;

    // closed hierarchy: no subclasses outside this file
    private Token(int position) {
        this.position = position;
    }

    public abstract Type type();

    /**
     * @return index in the source regex, or -1 if the token was not read from
     *         a regex (e.g. it was made by hand for {@link Postfix#of}).
     */
    public final int position() {
        return position;
    }

    /**
     * @return true if a token of this kind may end an operand: a literal, a
     *         closing parenthesis, or a postfix quantifier.
     */
    abstract boolean endsOperand();

    /**
     * @return true if a token of this kind may begin an operand: a literal
     *         or an opening parenthesis.
     */
    abstract boolean beginsOperand();

    public static Literal literal(char c) {
        return literal(c, -1);
    }

    public static Literal literal(char c, int position) {
        return new Literal(c, position);
    }

    public static Operator operator(Operator.Kind kind) {
        return operator(kind, -1);
    }

    public static Operator operator(Operator.Kind kind, int position) {
        if (kind == null) throw new NullPointerException("kind");
        return new Operator(kind, position);
    }

    public static Paren open() {
        return new Paren(true, -1);
    }

    public static Paren open(int position) {
        return new Paren(true, position);
    }

    public static Paren close() {
        return new Paren(false, -1);
    }

    public static Paren close(int position) {
        return new Paren(false, position);
    }

    /**
     * A single literal character, matched by exactly one symbol transition.
     */
    public static final class Literal extends Token {

        final char c;

        private Literal(char c, int position) {
            super(position);
            this.c = c;
        }

        public char value() {
            return c;
        }

        @Override
        public Type type() {
            return Type.LITERAL;
        }

        @Override
        boolean endsOperand() {
            return true;
        }

        @Override
        boolean beginsOperand() {
            return true;
        }

        @Override
        public int hashCode() {
            return 31 * Type.LITERAL.ordinal() + c;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o)
                return true;
            if (!(o instanceof Literal))
                return false;
            return c == ((Literal) o).c;
        }

        @Override
        public String toString() {
            return Misc.Esc.RXP.esc(c);
        }
    }

    public static final class Operator extends Token {

        /**
         * The regular operators. Precedence runs from {@link #UNION} (lowest)
         * through {@link #CONCAT} to the postfix quantifiers (highest).
         */
        public enum Kind {
            UNION('|', 1, 2),
            CONCAT('.', 2, 2),
            STAR('*', 3, 1),
            PLUS('+', 3, 1),
            OPTION('?', 3, 1);

            final char glyph;
            final int precedence;
            final int arity;

            Kind(char glyph, int precedence, int arity) {
                this.glyph = glyph;
                this.precedence = precedence;
                this.arity = arity;
            }

            public char glyph() {
                return glyph;
            }

            public int precedence() {
                return precedence;
            }

            /**
             * @return number of operands consumed: 2 for union and
             *         concatenation, 1 for the postfix quantifiers.
             */
            public int arity() {
                return arity;
            }

            /**
             * @return the operator written as <code>glyph</code> in a regex,
             *         or null. {@link #CONCAT} is never written, so its glyph
             *         does not map back to it.
             */
            static Kind forGlyph(char glyph) {
                switch (glyph) {
                case '|': return UNION;
                case '*': return STAR;
                case '+': return PLUS;
                case '?': return OPTION;
                default:  return null;
                }
            }
        }

        final Kind kind;

        private Operator(Kind kind, int position) {
            super(position);
            this.kind = kind;
        }

        public Kind kind() {
            return kind;
        }

        @Override
        public Type type() {
            return Type.OPERATOR;
        }

        @Override
        boolean endsOperand() {
            return kind.arity == 1;
        }

        @Override
        boolean beginsOperand() {
            return false;
        }

        @Override
        public int hashCode() {
            return 31 * Type.OPERATOR.ordinal() + kind.ordinal();
        }

        @Override
        public boolean equals(Object o) {
            if (this == o)
                return true;
            if (!(o instanceof Operator))
                return false;
            return kind == ((Operator) o).kind;
        }

        @Override
        public String toString() {
            return String.valueOf(kind.glyph);
        }
    }

    public static final class Paren extends Token {

        final boolean open;

        private Paren(boolean open, int position) {
            super(position);
            this.open = open;
        }

        public boolean isOpen() {
            return open;
        }

        @Override
        public Type type() {
            return Type.PAREN;
        }

        @Override
        boolean endsOperand() {
            return !open;
        }

        @Override
        boolean beginsOperand() {
            return open;
        }

        @Override
        public int hashCode() {
            return 31 * Type.PAREN.ordinal() + (open ? 1 : 0);
        }

        @Override
        public boolean equals(Object o) {
            if (this == o)
                return true;
            if (!(o instanceof Paren))
                return false;
            return open == ((Paren) o).open;
        }

        @Override
        public String toString() {
            return open ? "(" : ")";
        }
    }
}
