/* @LICENSE@
 */
package org.rejex.regex;

import static org.rejex.regex.MatchResult.accept;
import static org.rejex.regex.MatchResult.reject;

import org.rejex.regex.Expression.Alternation;
import org.rejex.regex.Expression.CharMatch;
import org.rejex.regex.Expression.Concat;
import org.rejex.regex.Expression.Repetition;

/**
 * Single pass evaluation: every node commits to one remainder. A Concat
 * never revisits the split chosen by its first child, so e.g.
 * <code>a*a</code> rejects <code>"aaa"</code> - the star takes all three
 * symbols and leaves nothing for the trailing literal.
 */
final class GreedyEngine extends Engine {

    GreedyEngine(Expression root, int maxDepth) {
        super(EngineStyle.GREEDY, root, maxDepth);
    }

    @Override
    MatchResult match(Symbols input) {
        return new Walker(maxDepth).visit(root, input);
    }

    private static final class Walker extends Evaluator<Symbols, MatchResult> {

        Walker(int maxDepth) {
            super(maxDepth);
        }

        @Override
        protected MatchResult visit(CharMatch node, Symbols input) {
            if (!input.isEmpty() && input.first() == node.symbol) {
                return accept(input.rest());
            }
            return reject(input);
        }

        @Override
        protected MatchResult visit(Concat node, Symbols input) {
            MatchResult first = visit(node.first, input);
            if (!first.accepted()) {
                return reject(input);
            }
            MatchResult second = visit(node.second, first.remainder());
            if (!second.accepted()) {
                return reject(input);
            }
            return second;
        }

        /*
         * Both branches see the same input. If both accept, the one that
         * consumed more wins; on a tie the first branch wins.
         */
        @Override
        protected MatchResult visit(Alternation node, Symbols input) {
            MatchResult first = visit(node.first, input);
            MatchResult second = visit(node.second, input);
            if (first.accepted() && second.accepted()) {
                return second.remainder().length() < first.remainder().length()
                    ? second : first;
            } else if (first.accepted()) {
                return first;
            } else if (second.accepted()) {
                return second;
            }
            return reject(input);
        }

        /*
         * Stops at the first rejection, or at the first accepted match that
         * consumed nothing: a child that matches empty would otherwise loop
         * forever.
         */
        @Override
        protected MatchResult visit(Repetition node, Symbols input) {
            Symbols current = input;
            while (!current.isEmpty()) {
                MatchResult r = visit(node.child, current);
                if (!r.accepted() || r.remainder().length() >= current.length()) {
                    break;
                }
                current = r.remainder();
            }
            return accept(current);
        }
    }
}
