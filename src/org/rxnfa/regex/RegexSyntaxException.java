/* @LICENSE@
 */
package org.rxnfa.regex;

import java.util.regex.PatternSyntaxException;

/**
 * Thrown when a regular expression cannot be converted to postfix form. The
 * {@link #getKind() kind} says what went wrong; {@link #getIndex()} and
 * {@link #getOffendingChar()} locate it in the source regex where that makes
 * sense, so a diagnostic can be reported without re-scanning the input.
 */
public class RegexSyntaxException extends PatternSyntaxException {

    private static final long serialVersionUID = 1L;

    public enum Kind {
        /** The regex is the empty string. */
        EMPTY_PATTERN("Empty pattern"),
        /**
         * A character outside the alphabet, a reserved character, a dangling
         * escape, or an operator with a missing operand.
         */
        INVALID_TOKEN("Invalid token"),
        /** A ')' with no matching '(' or a '(' never closed. */
        UNBALANCED_PARENTHESIS("Unbalanced parenthesis");

        final String description;

        Kind(String description) {
            this.description = description;
        }
    }

    private final Kind kind;
    private final int offendingChar;

    RegexSyntaxException(Kind kind, String detail, String regex, int index, int offendingChar) {
        super(detail == null ? kind.description : kind.description + ": " + detail, regex, index);
        this.kind = kind;
        this.offendingChar = offendingChar;
    }

    static RegexSyntaxException emptyPattern(String regex) {
        return new RegexSyntaxException(Kind.EMPTY_PATTERN, null, regex, -1, -1);
    }

    static RegexSyntaxException invalidToken(String detail, String regex, int index) {
        return new RegexSyntaxException(Kind.INVALID_TOKEN, detail, regex, index, regex.charAt(index));
    }

    static RegexSyntaxException unbalanced(String detail, String regex, int index) {
        return new RegexSyntaxException(Kind.UNBALANCED_PARENTHESIS, detail, regex, index, regex.charAt(index));
    }

    public Kind getKind() {
        return kind;
    }

    /**
     * @return the character at {@link #getIndex()}, or -1 if the error is not
     *         tied to a position.
     */
    public int getOffendingChar() {
        return offendingChar;
    }
}
