/* @LICENSE@
 */

package org.rejex.regex;

import static org.rejex.regex.Expression.*;
import static org.rejex.regex.RegexAssert.assertAccepts;
import static org.rejex.regex.RegexAssert.assertRejects;

public class ExhaustiveEngineTestCase extends AbstractRxTestCase {

    public static void main(String[] args) {
        junit.textui.TestRunner.run(ExhaustiveEngineTestCase.class);
    }

    public ExhaustiveEngineTestCase(String name) {
        super(name);
    }

    private static ExhaustiveEngine engine(Expression root) {
        return new ExhaustiveEngine(root, Pattern.DEFAULT_MAX_DEPTH);
    }

    public void testBacktracksIntoConcat() {
        ExhaustiveEngine e = engine(cat(star(literal('a')), literal('a')));
        assertTrue(e.matches(Symbols.of("a")));
        assertTrue(e.matches(Symbols.of("aaa")));
        assertFalse(e.matches(Symbols.EMPTY));
        assertFalse(e.matches(Symbols.of("aab")));
    }

    public void testAlternationWithSharedPrefix() {
        // (a|ab)c: "ac" needs the short branch, "abc" the long one
        ExhaustiveEngine e = engine(cat(alt(literal('a'), string("ab")), literal('c')));
        assertTrue(e.matches(Symbols.of("ac")));
        assertTrue(e.matches(Symbols.of("abc")));
        assertFalse(e.matches(Symbols.of("abbc")));
    }

    public void testStarThenSameClass() {
        // (a|b)*b(a|b)
        ExhaustiveEngine e = engine(cat(star(oneOf("ab")), literal('b'), oneOf("ab")));
        assertTrue(e.matches(Symbols.of("ba")));
        assertTrue(e.matches(Symbols.of("aabba")));
        assertTrue(e.matches(Symbols.of("aaaba")));
        assertFalse(e.matches(Symbols.of("aaab")));
    }

    public void testMatchReportsLongestPrefix() {
        ExhaustiveEngine e = engine(cat(star(literal('a')), literal('a')));
        assertAccepts(e.match(Symbols.of("aab")), "b");
        assertAccepts(e.match(Symbols.of("aaa")), "");
        Symbols b = Symbols.of("b");
        assertRejects(e.match(b), b);
    }

    public void testRepetitionOfEmptyMatchTerminates() {
        ExhaustiveEngine e = engine(star(alt(literal('h'), star(literal('e')))));
        assertTrue(e.matches(Symbols.of("hheehe")));
        assertTrue(e.matches(Symbols.EMPTY));
        assertFalse(e.matches(Symbols.of("hhex")));
        assertTrue(engine(star(star(star(literal('a'))))).matches(Symbols.of("aaaa")));
    }

    public void testSuffixInput() {
        // offsets are absolute in the shared array; a suffix must still work
        Symbols in = Symbols.of("xxhe").suffix(2);
        assertTrue(engine(string("he")).matches(in));
        assertAccepts(engine(literal('h')).match(in), "e");
    }

    public void testEvaluationDepthLimit() {
        try {
            new ExhaustiveEngine(star(star(literal('a'))), 2).matches(Symbols.of("a"));
            fail("depth limit not enforced");
        } catch (RecursionLimitExceededException ex) {
            assertEquals(2, ex.limit());
        }
    }

    public void testStarsBeforeLiteralBacktrack() {
        // (a*){12}a: every split of the run between the stars is a parse
        Expression expr = literal('a');
        for (int i = 0; i < 12; ++i) {
            expr = new Concat(star(literal('a')), expr);
        }
        ExhaustiveEngine e = engine(expr);
        assertTrue(e.matches(Symbols.of(repeat('a', 30))));
        assertFalse(e.matches(Symbols.of(repeat('a', 30) + "b")));
        assertFalse(e.matches(Symbols.EMPTY));
        assertAccepts(e.match(Symbols.of(repeat('a', 30) + "b")), "b");
    }
}
