/*
 * @LICENSE@
 */

/**
 * <h3><b>rejex</b> - regular expression matching over expression trees.</h3>
 * <p>
 * <h4>What it is.</h4>
 * <p>
 * <b>rejex</b> matches strings against regular expressions that are built
 * directly as trees of {@link org.rejex.regex.Expression} nodes. There is no
 * regex syntax and no parser: the caller assembles the tree from the four
 * operations that generate the regular languages - a literal symbol,
 * concatenation, alternation (union) and repetition (Kleene star) - and asks
 * a {@link org.rejex.regex.Pattern} whether a string belongs to the language.
 * <blockquote><pre>
 *  import static org.rejex.regex.Expression.*;
 *
 *  // [he]*
 *  Expression he = star(alt(literal('h'), literal('e')));
 *  Pattern.isMatch("heheh", he);   // true
 *  Pattern.isMatch("hefeh", he);   // false
 * </pre></blockquote>
 * Matching is anchored: the whole input must be consumed. Input is split at
 * Unicode code point granularity, so a supplementary character is a single
 * symbol.
 * <p>
 * <h4>Matching algorithms.</h4>
 * <p>
 * Two algorithms are provided, selected through
 * {@link org.rejex.regex.EngineStyle}:
 * <ul>
 * <li>{@link org.rejex.regex.EngineStyle#GREEDY GREEDY} walks the tree once,
 * each node committing to a single {@link org.rejex.regex.MatchResult}. It is
 * the textbook recursive definition with two refinements: alternation prefers
 * the branch that consumes more, and repetition stops as soon as its child
 * stops making progress. It does not backtrack across a concatenation, so it
 * rejects some strings that belong to the language (<code>a*a</code> against
 * <code>"aaa"</code>).</li>
 * <li>{@link org.rejex.regex.EngineStyle#EXHAUSTIVE EXHAUSTIVE} carries the
 * set of all feasible remainders through the tree, and accepts exactly the
 * language of the tree. This is the default.</li>
 * </ul>
 * <p>
 * <h4>Errors.</h4>
 * <p>
 * "No match" is an ordinary result, never an exception. A malformed tree (a
 * literal that is not exactly one symbol, a missing child) is refused when it
 * is built, with {@link org.rejex.regex.ConstructionException}. A tree deeper
 * than the configured limit is refused with
 * {@link org.rejex.regex.RecursionLimitExceededException}.
 * <p>
 * Diagnostics are logged through <code>java.util.logging</code> to the
 * <code>org.rejex.regex</code> logger, almost all of it at
 * <code>FINEST</code>.
 */
package org.rejex.regex;
