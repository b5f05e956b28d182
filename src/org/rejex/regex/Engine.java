/* @LICENSE@
 */
package org.rejex.regex;

abstract class Engine {

    final EngineStyle style;
    final Expression root;
    final int maxDepth;

    protected Engine(EngineStyle style, Expression root, int maxDepth) {
        assert root != null && maxDepth > 0;
        this.style = style;
        this.root = root;
        this.maxDepth = maxDepth;
    }

    /**
     * Matches the root against a prefix of <code>input</code>. Never anchored:
     * an accepted result may leave symbols over.
     */
    abstract MatchResult match(Symbols input);

    /**
     * Anchored match: true only if the root can consume all of
     * <code>input</code>.
     */
    boolean matches(Symbols input) {
        return match(input).isComplete();
    }

    @Override
    public final String toString() {
        return style + ": " + doToString();
    }

    protected String doToString() {
        return getClass().getName() + "@" + Integer.toHexString(hashCode());
    }

    /**
     * A tree walk that fails with {@link RecursionLimitExceededException}
     * once it is nested more than <code>maxDepth</code> nodes deep. One
     * instance per walk; the depth counter is its only state.
     */
    static abstract class Evaluator<A, R> extends Expression.Visitor<A, R> {

        private final int maxDepth;
        private int depth = 0;

        protected Evaluator(int maxDepth) {
            this.maxDepth = maxDepth;
        }

        @Override
        protected final R visit(Expression node, A arg) {
            if (++depth > maxDepth) {
                throw new RecursionLimitExceededException(maxDepth);
            }
            try {
                return super.visit(node, arg);
            } finally {
                --depth;
            }
        }
    }
}
