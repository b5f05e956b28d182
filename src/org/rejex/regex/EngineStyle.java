/* @LICENSE@
 */
package org.rejex.regex;

import java.util.Locale;

/**
 * Represents each implemented matching algorithm. Internally, this enum
 * class is used as a factory to create matcher "Engine"s.
 * <p>
 * The two styles accept the same language for every tree in which no
 * {@link Expression.Concat} has a first child that can stop at more than one
 * place. They differ when it can: <code>a*a</code> against <code>"aaa"</code>
 * is rejected by {@link #GREEDY} and accepted by {@link #EXHAUSTIVE}.
 */
public enum EngineStyle {

    /**
     * Every node commits to a single remainder. Alternation prefers the branch
     * that consumed more (the first branch on a tie), Repetition consumes as
     * much as it can, and Concat never backtracks into its first child.
     */
    GREEDY {
        @Override
        Engine newEngine(Expression root, int maxDepth) {
            return new GreedyEngine(root, maxDepth);
        }
    },

    /**
     * Every node yields all of its feasible remainders; an anchored match
     * succeeds if any of them is empty. Accepts exactly the regular language
     * of the tree. The default style.
     */
    EXHAUSTIVE {
        @Override
        Engine newEngine(Expression root, int maxDepth) {
            return new ExhaustiveEngine(root, maxDepth);
        }
    };

    abstract Engine newEngine(Expression root, int maxDepth);

    /**
     * Case insensitive {@link #valueOf(String)}.
     *
     * @throws ConstructionException if <code>name</code> names no style.
     */
    public static EngineStyle forName(String name) {
        if (name != null) {
            for (EngineStyle style : values()) {
                if (style.name().equals(name.trim().toUpperCase(Locale.ROOT))) {
                    return style;
                }
            }
        }
        throw new ConstructionException("no such EngineStyle: " + name);
    }
}
