/* @LICENSE@
 */
package org.rejex.regex;

import static org.rejex.regex.Misc.LS;
import static org.rejex.regex.Misc.clear;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Map;

/**
 * A node of a regular expression tree. Trees are built by the caller, either
 * with the constructors of the four node classes or with the static factories
 * of convenience below, and are handed to {@link Pattern} for matching.
 * <p>
 * There are exactly four kinds of node:
 * <ul>
 * <li>{@link CharMatch} - matches one literal symbol (Unicode code point).</li>
 * <li>{@link Concat} - matches <code>first</code> immediately followed by
 * <code>second</code>.</li>
 * <li>{@link Alternation} - matches <code>first</code> or
 * <code>second</code>.</li>
 * <li>{@link Repetition} - matches <code>child</code> zero or more times.</li>
 * </ul>
 * Instances are immutable and may be shared between trees and threads.
 * Matching never modifies a tree.
 * <blockquote><pre>
 *  // h[e3]l*o|wo[r4]ld
 *  Expression hello = cat(literal('h'), oneOf("e3"), star(literal('l')), literal('o'));
 *  Expression world = cat(string("wo"), oneOf("r4"), string("ld"));
 *  assertTrue(Pattern.isMatch("h3llo", alt(hello, world)));
 * </pre></blockquote>
 */
public abstract class Expression {

    private Expression() {}   // the four subclasses below are the only kinds

    /**
     * The equals relation is always the identity relation for all Expression
     * subclasses.
     */
    @Override
    public final boolean equals(Object o) {
        return super.equals(o);
    }

    @Override
    public final int hashCode() {
        return super.hashCode();
    }

    /**
     * Renders the tree in conventional regex notation. Informational only:
     * there is no parser for the result.
     * <p>
     * Recurses once per level, so a tree deep enough to exhaust the thread
     * stack throws <code>StackOverflowError</code> here; {@link Pattern}
     * reports the same tree with a {@link RecursionLimitExceededException}.
     */
    @Override
    public final String toString() {
        return new RegexPrinter().print(this);
    }

    /**
     * @return an indented outline of the tree, one node per line. Recurses
     *         once per level, like {@link #toString()}.
     */
    public final String toTreeString() {
        return new TreePrinter().print(this);
    }

    /**
     * Iterative, and each shared subtree is measured once, so any tree can
     * be measured whatever its depth.
     *
     * @return the height of the tree rooted here; a {@link CharMatch} has
     *         depth 1.
     */
    public final int depth() {
        Visitor<Void, Expression[]> children = new Visitor<Void, Expression[]>() {
            @Override
            protected Expression[] visit(CharMatch node, Void arg) {
                return new Expression[0];
            }
            @Override
            protected Expression[] visit(Concat node, Void arg) {
                return new Expression[] {node.first, node.second};
            }
            @Override
            protected Expression[] visit(Alternation node, Void arg) {
                return new Expression[] {node.first, node.second};
            }
            @Override
            protected Expression[] visit(Repetition node, Void arg) {
                return new Expression[] {node.child};
            }
        };
        Map<Expression, Integer> heights = new IdentityHashMap<Expression, Integer>();
        Deque<Expression> pending = new ArrayDeque<Expression>();
        pending.push(this);
        while (!pending.isEmpty()) {
            Expression node = pending.peek();
            if (heights.containsKey(node)) {
                pending.pop();
                continue;
            }
            int height = 0;
            boolean ready = true;
            for (Expression child : children.visit(node, null)) {
                Integer h = heights.get(child);
                if (h == null) {
                    pending.push(child);
                    ready = false;
                } else {
                    height = Math.max(height, h);
                }
            }
            if (ready) {
                pending.pop();
                heights.put(node, 1 + height);
            }
        }
        return heights.get(this);
    }

    /**
     * Matches exactly one literal symbol.
     */
    public static final class CharMatch extends Expression {

        final int symbol;

        /**
         * @param symbol a string holding exactly one code point.
         * @throws ConstructionException if <code>symbol</code> is null, empty,
         *             or holds more than one code point.
         */
        public CharMatch(String symbol) {
            this(codePointOf(symbol));
        }

        /**
         * @param symbol a Unicode code point; a <code>char</code> widens to
         *            this constructor.
         * @throws ConstructionException if <code>symbol</code> is not a valid
         *             code point.
         */
        public CharMatch(int symbol) {
            if (!Character.isValidCodePoint(symbol)) {
                throw new ConstructionException(
                    "not a code point: 0x" + Integer.toHexString(symbol));
            }
            this.symbol = symbol;
        }

        public int symbol() {
            return symbol;
        }

        private static int codePointOf(String s) {
            if (s == null) {
                throw new ConstructionException("literal must not be null");
            }
            if (s.isEmpty() || s.codePointCount(0, s.length()) != 1) {
                throw new ConstructionException(
                    "literal must be exactly one symbol: \"" + s + '"');
            }
            return s.codePointAt(0);
        }
    }

    static abstract class Binary extends Expression {

        final Expression first, second;

        private Binary(Expression first, Expression second) {
            this.first = checked(first);
            this.second = checked(second);
        }

        public final Expression first() {
            return first;
        }

        public final Expression second() {
            return second;
        }
    }

    /**
     * Matches <code>first</code> immediately followed by <code>second</code>.
     */
    public static final class Concat extends Binary {

        public Concat(Expression first, Expression second) {
            super(first, second);
        }
    }

    /**
     * Matches <code>first</code> or <code>second</code> (set union).
     */
    public static final class Alternation extends Binary {

        public Alternation(Expression first, Expression second) {
            super(first, second);
        }
    }

    /**
     * Matches <code>child</code> zero or more times (Kleene star).
     */
    public static final class Repetition extends Expression {

        final Expression child;

        public Repetition(Expression child) {
            this.child = checked(child);
        }

        public Expression child() {
            return child;
        }
    }

    private static Expression checked(Expression child) {
        if (child == null) {
            throw new ConstructionException("child expression must not be null");
        }
        return child;
    }

    /**
     * Walks a tree, returning a value of type <code>R</code> per node and
     * passing an argument of type <code>A</code> down. Subclasses recurse by
     * calling {@link #visit(Expression, Object)} on children.
     */
    public static abstract class Visitor<A, R> {

        /*
         * "instanceof" dispatch is ugly but it's only in one place - here.
         */
        protected R visit(Expression node, A arg) {
            if (node instanceof CharMatch) {
                return visit((CharMatch) node, arg);
            } else if (node instanceof Concat) {
                return visit((Concat) node, arg);
            } else if (node instanceof Alternation) {
                return visit((Alternation) node, arg);
            } else if (node instanceof Repetition) {
                return visit((Repetition) node, arg);
            }
            throw new AssertionError("unknown node type " + node.getClass());
        }

        protected abstract R visit(CharMatch node, A arg);
        protected abstract R visit(Concat node, A arg);
        protected abstract R visit(Alternation node, A arg);
        protected abstract R visit(Repetition node, A arg);
    }

    /*
     * Regex notation. The argument is the precedence of the enclosing
     * context: 0 top level, 1 inside a Concat, 2 under a star.
     */
    private static final class RegexPrinter extends Visitor<Integer, Void> {

        private static final String META = "\\|*+?()[]{}.^$";

        private final StringBuilder sb = new StringBuilder();

        String print(Expression root) {
            clear(sb);
            visit(root, 0);
            return sb.toString();
        }

        @Override
        protected Void visit(CharMatch node, Integer context) {
            if (node.symbol < 0x80 && META.indexOf(node.symbol) >= 0) {
                sb.append('\\');
            }
            sb.appendCodePoint(node.symbol);
            return null;
        }

        @Override
        protected Void visit(Concat node, Integer context) {
            boolean paren = context > 1;
            sb.append(paren ? "(?:" : "");
            visit(node.first, 1);
            visit(node.second, 1);
            sb.append(paren ? ")" : "");
            return null;
        }

        @Override
        protected Void visit(Alternation node, Integer context) {
            boolean paren = context > 0;
            sb.append(paren ? "(?:" : "");
            visit(node.first, 0);
            sb.append('|');
            visit(node.second, 0);
            sb.append(paren ? ")" : "");
            return null;
        }

        @Override
        protected Void visit(Repetition node, Integer context) {
            boolean paren = context > 1;
            sb.append(paren ? "(?:" : "");
            visit(node.child, 2);
            sb.append('*');
            sb.append(paren ? ")" : "");
            return null;
        }
    }

    private static final class TreePrinter extends Visitor<Integer, Void> {

        private final StringBuilder sb = new StringBuilder();

        String print(Expression root) {
            clear(sb);
            visit(root, 0);
            return sb.toString();
        }

        private void line(int nspace, String label) {
            for (int i = 0; i < nspace; ++i) {
                sb.append(' ');
            }
            sb.append(label).append(LS);
        }

        @Override
        protected Void visit(CharMatch node, Integer nspace) {
            line(nspace, "'" + new String(Character.toChars(node.symbol)) + "'");
            return null;
        }

        @Override
        protected Void visit(Concat node, Integer nspace) {
            line(nspace, "&");
            visit(node.first, nspace + 4);
            visit(node.second, nspace + 4);
            return null;
        }

        @Override
        protected Void visit(Alternation node, Integer nspace) {
            line(nspace, "|");
            visit(node.first, nspace + 4);
            visit(node.second, nspace + 4);
            return null;
        }

        @Override
        protected Void visit(Repetition node, Integer nspace) {
            line(nspace, "*");
            visit(node.child, nspace + 4);
            return null;
        }
    }

    /*
     * static factories of convenience for callers and testing
     */

    public static CharMatch literal(int symbol) {
        return new CharMatch(symbol);
    }

    public static CharMatch literal(String symbol) {
        return new CharMatch(symbol);
    }

    /**
     * @return the concatenation of the code points of <code>s</code>, nested
     *         to the left.
     * @throws ConstructionException if <code>s</code> is null or empty.
     */
    public static Expression string(String s) {
        return cat(literals(s));
    }

    /**
     * @return the alternation of the code points of <code>s</code>, i.e. the
     *         character class <code>[s]</code>.
     * @throws ConstructionException if <code>s</code> is null or empty.
     */
    public static Expression oneOf(String s) {
        return alt(literals(s));
    }

    /**
     * @return the operands concatenated, nested to the left; a single
     *         operand is returned as is.
     * @throws ConstructionException if there are no operands or one is null.
     */
    public static Expression cat(Expression... nodes) {
        checkOperands(nodes);
        Expression root = null;
        for (Expression node : nodes) {
            root = root == null ? checked(node) : new Concat(root, node);
        }
        return root;
    }

    /**
     * @return the alternation of the operands, nested to the left; a single
     *         operand is returned as is.
     * @throws ConstructionException if there are no operands or one is null.
     */
    public static Expression alt(Expression... nodes) {
        checkOperands(nodes);
        Expression root = null;
        for (Expression node : nodes) {
            root = root == null ? checked(node) : new Alternation(root, node);
        }
        return root;
    }

    public static Repetition star(Expression child) {
        return new Repetition(child);
    }

    /**
     * One or more: <code>cat(child, star(child))</code>.
     */
    public static Expression plus(Expression child) {
        return new Concat(child, new Repetition(child));
    }

    private static void checkOperands(Expression[] nodes) {
        if (nodes == null || nodes.length == 0) {
            throw new ConstructionException("at least one operand required");
        }
    }

    private static Expression[] literals(String s) {
        if (s == null || s.isEmpty()) {
            throw new ConstructionException("string must not be empty");
        }
        Expression[] ret = new Expression[s.codePointCount(0, s.length())];
        for (int i = 0, j = 0; i < s.length(); ++j) {
            int cp = s.codePointAt(i);
            ret[j] = new CharMatch(cp);
            i += Character.charCount(cp);
        }
        return ret;
    }
}
