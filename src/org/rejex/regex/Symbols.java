/* @LICENSE@
 */
package org.rejex.regex;

import java.util.Arrays;

/**
 * An immutable sequence of symbols (Unicode code points), the input to the
 * matching engines. A suffix shares the backing array of the sequence it was
 * taken from, so dropping matched symbols costs nothing.
 */
public final class Symbols {

    private static final int[] NONE = new int[0];

    public static final Symbols EMPTY = new Symbols(NONE, 0);

    private final int[] cps;
    private final int offset;

    private Symbols(int[] cps, int offset) {
        this.cps = cps;
        this.offset = offset;
    }

    /**
     * Splits <code>cs</code> into code points; a surrogate pair is one
     * symbol, an unpaired surrogate is a symbol of its own.
     */
    public static Symbols of(CharSequence cs) {
        if (cs == null) {
            throw new IllegalArgumentException("input must not be null");
        }
        int[] cps = new int[Character.codePointCount(cs, 0, cs.length())];
        for (int i = 0, j = 0; i < cs.length(); ++j) {
            int cp = Character.codePointAt(cs, i);
            cps[j] = cp;
            i += Character.charCount(cp);
        }
        return cps.length == 0 ? EMPTY : new Symbols(cps, 0);
    }

    public int length() {
        return cps.length - offset;
    }

    public boolean isEmpty() {
        return offset == cps.length;
    }

    /**
     * @return the first symbol.
     * @throws IllegalStateException if the sequence is empty.
     */
    public int first() {
        if (isEmpty()) {
            throw new IllegalStateException("no symbols");
        }
        return cps[offset];
    }

    /**
     * @return the sequence without its first symbol.
     * @throws IllegalStateException if the sequence is empty.
     */
    public Symbols rest() {
        return suffix(1);
    }

    /**
     * @return the sequence without its first <code>n</code> symbols.
     */
    public Symbols suffix(int n) {
        if (n < 0 || n > length()) {
            throw new IllegalStateException(
                "cannot drop " + n + " of " + length() + " symbols");
        }
        return n == 0 ? this : new Symbols(cps, offset + n);
    }

    /**
     * @return the number of symbols dropped from the sequence this one was
     *         derived from by {@link #of(CharSequence)}.
     */
    public int offset() {
        return offset;
    }

    /*
     * absolute access for the engines, which work with offsets
     */
    int at(int position) {
        return cps[position];
    }

    int end() {
        return cps.length;
    }

    Symbols from(int position) {
        return suffix(position - offset);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Symbols)) return false;
        Symbols that = (Symbols) o;
        return Arrays.equals(cps, offset, cps.length,
            that.cps, that.offset, that.cps.length);
    }

    @Override
    public int hashCode() {
        int h = 1;
        for (int i = offset; i < cps.length; ++i) {
            h = 31 * h + cps[i];
        }
        return h;
    }

    @Override
    public String toString() {
        return new String(cps, offset, length());
    }
}
