/* @LICENSE@
 */
package org.rejex.regex;

/**
 * The outcome of matching one node against a sequence of symbols. When
 * {@link #accepted()} the {@link #remainder()} is the suffix of the input left
 * unconsumed; otherwise the remainder is the input itself, unchanged, so the
 * caller can try another interpretation from the same place.
 */
public final class MatchResult {

    private final boolean accepted;
    private final Symbols remainder;

    private MatchResult(boolean accepted, Symbols remainder) {
        assert remainder != null;
        this.accepted = accepted;
        this.remainder = remainder;
    }

    static MatchResult accept(Symbols remainder) {
        return new MatchResult(true, remainder);
    }

    static MatchResult reject(Symbols input) {
        return new MatchResult(false, input);
    }

    public boolean accepted() {
        return accepted;
    }

    public Symbols remainder() {
        return remainder;
    }

    /**
     * @return true if accepted with nothing left over.
     */
    public boolean isComplete() {
        return accepted && remainder.isEmpty();
    }

    @Override
    public String toString() {
        return (accepted ? "accept" : "reject") + "[" + remainder + ']';
    }
}
