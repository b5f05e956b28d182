/* @LICENSE@
 */
package org.rejex.regex;

/**
 * A runtime exception thrown when an {@link Expression} tree or a
 * {@link Pattern} cannot be built as requested: a literal that is not exactly
 * one symbol, a missing child, or an engine style that cannot be constructed.
 * Never thrown while matching.
 */
public final class ConstructionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ConstructionException(String msg) {
        super(msg);
    }
}
