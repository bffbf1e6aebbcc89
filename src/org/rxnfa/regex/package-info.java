/*
 * @LICENSE@
 */

/**
 * <h3><b>rxnfa</b> - regular expressions to Thompson NFAs.</h3>
 * <p>
 * <h4>Pipeline.</h4>
 * <p>
 * Compilation runs in two stages which share nothing but a
 * {@link org.rxnfa.regex.Postfix} value:
 * <ol>
 * <li>The regex is scanned into {@linkplain org.rxnfa.regex.Token tokens},
 * concatenation is made explicit, and the shunting-yard algorithm reorders
 * the tokens into postfix form. Malformed input is reported here as a
 * {@link org.rxnfa.regex.RegexSyntaxException}, a
 * {@link java.util.regex.PatternSyntaxException} that also carries a
 * {@linkplain org.rxnfa.regex.RegexSyntaxException.Kind kind}.</li>
 * <li>Thompson's construction turns the postfix sequence into an
 * {@link org.rxnfa.regex.Nfa} with one start and one accept state. A
 * hand-built sequence that does not reduce to one automaton raises
 * {@link org.rxnfa.regex.ConstructionException}.</li>
 * </ol>
 * <p>
 * <h4>Syntax.</h4>
 * <p>
 * <table border="1">
 * <tr><th>Construct</th><th>Matches</th><th>Precedence</th></tr>
 * <tr><td><i>x</i></td><td>the character <i>x</i></td><td></td></tr>
 * <tr><td>\<i>x</i></td><td>the character <i>x</i>, even a metachar</td><td></td></tr>
 * <tr><td><i>X</i>*</td><td><i>X</i>, zero or more times</td><td>3</td></tr>
 * <tr><td><i>X</i>+</td><td><i>X</i>, one or more times</td><td>3</td></tr>
 * <tr><td><i>X</i>?</td><td><i>X</i>, once or not at all</td><td>3</td></tr>
 * <tr><td><i>XY</i></td><td><i>X</i> followed by <i>Y</i></td><td>2</td></tr>
 * <tr><td><i>X</i>|<i>Y</i></td><td>either <i>X</i> or <i>Y</i></td><td>1</td></tr>
 * <tr><td>(<i>X</i>)</td><td><i>X</i>, grouped</td><td></td></tr>
 * </table>
 * <p>
 * Binary operators are left associative. Quantifiers stack, so
 * <code>a+?</code> is <code>(a+)?</code> and not a reluctant quantifier. An
 * unescaped <code>'.'</code> is rejected: it is the concatenation marker of the
 * postfix form, not a wildcard. Character classes, anchors, bounded
 * repetition, capture groups and the empty regex are not supported.
 * <p>
 * <h4>Flags.</h4>
 * <p>
 * {@link org.rxnfa.regex.Nfa#LITERAL} treats the whole regex as literal text.
 * The nonstandard flags, prefixed with <code>X_</code>, are
 * {@link org.rxnfa.regex.Nfa#X_NO_ESCAPES} and
 * {@link org.rxnfa.regex.Nfa#X_ASCII_ONLY}.
 * <p>
 * <h4>Logging.</h4>
 * <p>
 * The package logs to the <code>java.util.logging</code> logger named
 * <code>org.rxnfa.regex</code>: the regex and flags at FINEST, the explicit
 * and postfix token sequences and the size of each automaton at FINER.
 */
package org.rxnfa.regex;
