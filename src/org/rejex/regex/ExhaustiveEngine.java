/* @LICENSE@
 */
package org.rejex.regex;

import java.util.ArrayDeque;
import java.util.BitSet;
import java.util.Deque;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.Map;

import org.rejex.regex.Expression.Alternation;
import org.rejex.regex.Expression.CharMatch;
import org.rejex.regex.Expression.Concat;
import org.rejex.regex.Expression.Repetition;

/**
 * Evaluation over sets of remainders. Each node maps a start position to the
 * set of every position at which a match of that node can end, held as a
 * {@link BitSet} of offsets into the input. Concat tries its second child
 * from every end of its first, so no split is ever missed, and the anchored
 * match succeeds if any complete parse exists.
 * <p>
 * Each node is evaluated at most once per start position within one match;
 * later requests get a copy of the remembered set. Without this, nested
 * stars and chains of stars cost exponential time in the nesting.
 */
final class ExhaustiveEngine extends Engine {

    ExhaustiveEngine(Expression root, int maxDepth) {
        super(EngineStyle.EXHAUSTIVE, root, maxDepth);
    }

    /**
     * @return the longest accepted prefix, reported as the shortest feasible
     *         remainder.
     */
    @Override
    MatchResult match(Symbols input) {
        BitSet ends = ends(input);
        if (ends.isEmpty()) {
            return MatchResult.reject(input);
        }
        return MatchResult.accept(input.from(ends.length() - 1));
    }

    @Override
    boolean matches(Symbols input) {
        return ends(input).get(input.end());
    }

    private BitSet ends(Symbols input) {
        return new Walker(input, maxDepth).visit(root, input.offset());
    }

    /*
     * Every visit returns a fresh BitSet the caller may modify. Children are
     * reached through endsAt, never visited directly.
     */
    private static final class Walker extends Evaluator<Integer, BitSet> {

        private final Symbols input;
        private final Map<Expression, Map<Integer, BitSet>> memo =
            new IdentityHashMap<Expression, Map<Integer, BitSet>>();

        Walker(Symbols input, int maxDepth) {
            super(maxDepth);
            this.input = input;
        }

        private BitSet endsAt(Expression node, int position) {
            Map<Integer, BitSet> byPosition = memo.get(node);
            if (byPosition == null) {
                byPosition = new HashMap<Integer, BitSet>();
                memo.put(node, byPosition);
            }
            BitSet ends = byPosition.get(position);
            if (ends == null) {
                ends = visit(node, position);
                byPosition.put(position, ends);
            }
            return (BitSet) ends.clone();
        }

        @Override
        protected BitSet visit(CharMatch node, Integer position) {
            BitSet ret = new BitSet();
            if (position < input.end() && input.at(position) == node.symbol) {
                ret.set(position + 1);
            }
            return ret;
        }

        @Override
        protected BitSet visit(Concat node, Integer position) {
            BitSet ret = new BitSet();
            BitSet mid = endsAt(node.first, position);
            for (int p = mid.nextSetBit(0); p >= 0; p = mid.nextSetBit(p + 1)) {
                ret.or(endsAt(node.second, p));
            }
            return ret;
        }

        @Override
        protected BitSet visit(Alternation node, Integer position) {
            BitSet ret = endsAt(node.first, position);
            ret.or(endsAt(node.second, position));
            return ret;
        }

        /*
         * Closure over the child: the start itself (zero repetitions) plus
         * every end reachable by chaining child matches. A child match that
         * ends where it started reaches nothing new, which is what ends the
         * loop.
         */
        @Override
        protected BitSet visit(Repetition node, Integer position) {
            BitSet reached = new BitSet();
            reached.set(position);
            Deque<Integer> pending = new ArrayDeque<Integer>();
            pending.push(position);
            while (!pending.isEmpty()) {
                int p = pending.pop();
                BitSet ends = endsAt(node.child, p);
                for (int e = ends.nextSetBit(p + 1); e >= 0; e = ends.nextSetBit(e + 1)) {
                    if (!reached.get(e)) {
                        reached.set(e);
                        pending.push(e);
                    }
                }
            }
            return reached;
        }
    }
}
