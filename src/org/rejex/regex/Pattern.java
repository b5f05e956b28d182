/*
 * @LICENSE@
 */

package org.rejex.regex;

import static org.rejex.regex.Misc.LS;

import java.util.IdentityHashMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

import org.rejex.regex.Expression.Alternation;
import org.rejex.regex.Expression.CharMatch;
import org.rejex.regex.Expression.Concat;
import org.rejex.regex.Expression.Repetition;

/**
 * A compiled, reusable form of an {@link Expression} tree bound to a matching
 * algorithm; loosely analogous to {@link java.util.regex.Pattern}, without the
 * syntax. Instances are immutable and thread safe: any number of threads may
 * match against the same Pattern at once.
 * <p>
 * Matching is always anchored at both ends. {@link #matches(CharSequence)}
 * is true only when the whole input is consumed; there is no search mode.
 * The input is split into symbols at Unicode code point granularity.
 * <p>
 * <strong>Depth limit:</strong> evaluation recurses once per tree level, so
 * every Pattern carries a maximum tree depth. A deeper tree is refused with
 * {@link RecursionLimitExceededException} at compile time.
 * <p>
 * <strong>Defaults:</strong> the JVM system properties
 * <code>org.rejex.regex.maxDepth</code> and
 * <code>org.rejex.regex.engineStyle</code>, read once when this class is
 * loaded, override the built in depth limit (1000) and engine style
 * ({@link EngineStyle#EXHAUSTIVE}).
 */
public final class Pattern {

    private static final Logger logger = Logger.getLogger("org.rejex.regex");
    private static final Level level = Level.FINEST;

    public static final String MAX_DEPTH_PROPERTY = "org.rejex.regex.maxDepth";
    public static final String ENGINE_STYLE_PROPERTY = "org.rejex.regex.engineStyle";

    public static final int DEFAULT_MAX_DEPTH =
        Misc.positiveIntProperty(MAX_DEPTH_PROPERTY, 1000);

    public static final EngineStyle DEFAULT_ENGINE_STYLE =
        EngineStyle.forName(System.getProperty(
            ENGINE_STYLE_PROPERTY, EngineStyle.EXHAUSTIVE.name()));

    private final Expression root;
    private final int maxDepth;
    private final Engine engine;

    private Pattern(Expression root, EngineStyle style, int maxDepth) {
        if (root == null) {
            throw new ConstructionException("root expression must not be null");
        }
        if (style == null) {
            throw new ConstructionException("engine style must not be null");
        }
        if (maxDepth <= 0) {
            throw new IllegalArgumentException("maxDepth must be positive: " + maxDepth);
        }
        int depth = checkDepth(root, maxDepth);
        this.root = root;
        this.maxDepth = maxDepth;
        this.engine = style.newEngine(root, maxDepth);

        if (logger.isLoggable(level)) {
            logger.log(level, "expression: " + root);
            logger.log(level, "tree:" + LS + root.toTreeString());
        }
        logger.log(level, "engine: " + engine + ", depth " + depth);
    }

    public static Pattern compile(Expression root) {
        return new Pattern(root, DEFAULT_ENGINE_STYLE, DEFAULT_MAX_DEPTH);
    }

    public static Pattern compile(Expression root, EngineStyle style) {
        return new Pattern(root, style, DEFAULT_MAX_DEPTH);
    }

    public static Pattern compile(Expression root, EngineStyle style, int maxDepth) {
        return new Pattern(root, style, maxDepth);
    }

    /**
     * True if <code>expr</code> accepts the whole of <code>input</code>,
     * using the default engine style and depth limit.
     *
     * @throws RecursionLimitExceededException if <code>expr</code> is deeper
     *             than {@link #DEFAULT_MAX_DEPTH}.
     */
    public static boolean isMatch(CharSequence input, Expression expr) {
        return compile(expr).matches(input);
    }

    /**
     * @return true if the root accepts all of <code>input</code>.
     */
    public boolean matches(CharSequence input) {
        Symbols symbols = Symbols.of(input);
        try {
            return engine.matches(symbols);
        } catch (StackOverflowError e) {
            throw stackExhausted(e);
        }
    }

    /**
     * Matches the root against a prefix of <code>input</code> and reports
     * what was left over. Not anchored; mostly useful for diagnosing why
     * {@link #matches(CharSequence)} said no.
     */
    public MatchResult match(CharSequence input) {
        Symbols symbols = Symbols.of(input);
        try {
            return engine.match(symbols);
        } catch (StackOverflowError e) {
            throw stackExhausted(e);
        }
    }

    public Expression root() {
        return root;
    }

    public EngineStyle style() {
        return engine.style;
    }

    public int maxDepth() {
        return maxDepth;
    }

    @Override
    public String toString() {
        return root.toString();
    }

    private RecursionLimitExceededException stackExhausted(StackOverflowError e) {
        logger.log(Level.FINE, "stack exhausted matching " + engine.style
            + " pattern, depth limit " + maxDepth, e);
        return new RecursionLimitExceededException(maxDepth, e);
    }

    /*
     * Height of the tree, refusing anything deeper than the limit before
     * the recursion gets there. Shared subtrees are measured once, so the
     * depth counter can miss a deep path; the measured height is checked too.
     */
    private static int checkDepth(Expression root, int maxDepth) {
        final Map<Expression, Integer> seen = new IdentityHashMap<Expression, Integer>();
        try {
            int depth = new Engine.Evaluator<Void, Integer>(maxDepth) {
                private int measure(Expression node) {
                    Integer d = seen.get(node);
                    if (d == null) {
                        d = visit(node, null);
                        seen.put(node, d);
                    }
                    return d;
                }
                @Override
                protected Integer visit(CharMatch node, Void arg) {
                    return 1;
                }
                @Override
                protected Integer visit(Concat node, Void arg) {
                    return 1 + Math.max(measure(node.first), measure(node.second));
                }
                @Override
                protected Integer visit(Alternation node, Void arg) {
                    return 1 + Math.max(measure(node.first), measure(node.second));
                }
                @Override
                protected Integer visit(Repetition node, Void arg) {
                    return 1 + measure(node.child);
                }
            }.visit(root, null);
            if (depth > maxDepth) {
                throw new RecursionLimitExceededException(maxDepth);
            }
            return depth;
        } catch (RecursionLimitExceededException e) {
            logger.log(Level.FINE, "refusing expression deeper than " + maxDepth);
            throw e;
        } catch (StackOverflowError e) {
            logger.log(Level.FINE, "stack exhausted measuring expression", e);
            throw new RecursionLimitExceededException(maxDepth, e);
        }
    }
}
