/* @LICENSE@
 */

package org.rejex.regex;

import java.util.logging.Level;
import java.util.logging.Logger;

import junit.framework.TestCase;

public abstract class AbstractRxTestCase extends TestCase {

    protected static final Logger logger = Logger.getLogger("org.rejex.regex.test");
    protected static final Level level = Level.FINEST;

    static {
        boolean assertsEnabled = false;
        assert assertsEnabled = true; // Intentional side effect!!!
        if (!assertsEnabled){
            throw new RuntimeException("Asserts must be enabled!!!");
        }
    }

    public AbstractRxTestCase(String name) {
        super(name);
    }

    protected void setUp() throws Exception {
        super.setUp();
        logger.entering(getClass().getSimpleName(), getName());
    }

    protected void tearDown() throws Exception {
        logger.exiting(getClass().getSimpleName(), getName());
        super.tearDown();
    }

    /**
     * Logs the outline of <code>root</code> under the test logger, if
     * anybody is listening.
     */
    protected static void logTree(String label, Expression root) {
        if (logger.isLoggable(level)) {
            logger.log(level, label + ": " + root + Misc.LS + root.toTreeString());
        }
    }

    /*
     * wrapper for package private functions needed by subclasses outside
     * the package
     */
    protected static MatchResult greedyMatch(Expression root, String input) {
        return new GreedyEngine(root, Pattern.DEFAULT_MAX_DEPTH).match(Symbols.of(input));
    }

    protected static String repeat(char c, int n) {
        StringBuilder sb = new StringBuilder(n);
        for (int i = 0; i < n; ++i) {
            sb.append(c);
        }
        return sb.toString();
    }
}
