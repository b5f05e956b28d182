/* @LICENSE@
 */
package org.rejex.regex;

/**
 * A runtime exception thrown when matching would recurse deeper than a
 * {@link Pattern} allows. Evaluation depth follows tree depth, so the fix is
 * a shallower tree or a larger {@linkplain Pattern#maxDepth() limit}.
 */
public final class RecursionLimitExceededException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int limit;

    public RecursionLimitExceededException(int limit) {
        super("expression tree deeper than " + limit);
        this.limit = limit;
    }

    public RecursionLimitExceededException(int limit, Throwable cause) {
        super("stack exhausted matching within depth limit " + limit, cause);
        this.limit = limit;
    }

    /**
     * @return the depth limit in force when the exception was thrown.
     */
    public int limit() {
        return limit;
    }
}
