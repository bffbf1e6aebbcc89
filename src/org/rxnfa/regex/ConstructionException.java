/* @LICENSE@
 */
package org.rxnfa.regex;

/**
 * A runtime exception thrown when a postfix sequence cannot be reduced to a
 * single NFA: an operator finds fewer operands than it needs, a parenthesis
 * turns up in the sequence, or more (or less) than one fragment is left at the
 * end. A postfix sequence made by {@link Postfix#parse(String)} never causes
 * this, so seeing it means a hand-built or corrupted sequence, not a bad regex.
 */
public final class ConstructionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int tokenIndex;

    ConstructionException(String msg, int tokenIndex) {
        super(tokenIndex < 0 ? msg : msg + " at postfix index " + tokenIndex);
        this.tokenIndex = tokenIndex;
    }

    /**
     * @return index into the postfix sequence of the token that could not be
     *         applied, or -1 if the failure was found at the end of the
     *         sequence.
     */
    public int getTokenIndex() {
        return tokenIndex;
    }
}
