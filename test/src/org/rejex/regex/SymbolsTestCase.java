/* @LICENSE@
 */

package org.rejex.regex;

import junit.framework.TestCase;

public class SymbolsTestCase extends TestCase {

    public static void main(String[] args) {
        junit.textui.TestRunner.run(SymbolsTestCase.class);
    }

    public SymbolsTestCase(String arg0) {
        super(arg0);
    }

    public void testEmpty() {
        Symbols s = Symbols.of("");
        assertSame(Symbols.EMPTY, s);
        assertTrue(s.isEmpty());
        assertEquals(0, s.length());
        assertEquals("", s.toString());
    }

    public void testCodePoints() {
        Symbols s = Symbols.of("a\uD83D\uDE00b");
        assertEquals(3, s.length());
        assertEquals('a', s.first());
        assertEquals(0x1F600, s.rest().first());
        assertEquals("b", s.suffix(2).toString());
        assertEquals("\uD83D\uDE00b", s.rest().toString());
    }

    public void testUnpairedSurrogate() {
        Symbols s = Symbols.of("\uD83Dx");
        assertEquals(2, s.length());
        assertEquals(0xD83D, s.first());
    }

    public void testSuffixSharesInput() {
        Symbols s = Symbols.of("hello");
        Symbols t = s.suffix(2);
        assertEquals(3, t.length());
        assertEquals(2, t.offset());
        assertEquals("lo", t.rest().toString());
        assertSame(s, s.suffix(0));
        assertTrue(s.suffix(5).isEmpty());
    }

    public void testEquality() {
        assertEquals(Symbols.of("llo"), Symbols.of("hello").suffix(2));
        assertEquals(Symbols.of("llo").hashCode(),
            Symbols.of("hello").suffix(2).hashCode());
        assertFalse(Symbols.of("lo").equals(Symbols.of("hello").suffix(2)));
        assertEquals(Symbols.EMPTY, Symbols.of("ab").suffix(2));
    }

    public void testBounds() {
        try {
            Symbols.EMPTY.first();
            fail();
        } catch (IllegalStateException e) {
            // expected
        }
        try {
            Symbols.EMPTY.rest();
            fail();
        } catch (IllegalStateException e) {
            // expected
        }
        try {
            Symbols.of("ab").suffix(3);
            fail();
        } catch (IllegalStateException e) {
            // expected
        }
        try {
            Symbols.of(null);
            fail();
        } catch (IllegalArgumentException e) {
            // expected
        }
    }
}
