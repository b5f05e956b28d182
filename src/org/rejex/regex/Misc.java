/*
 * @LICENSE@
 */

package org.rejex.regex;

/**
 * Miscellaneous static helpers shared by the package.
 */
final class Misc {

    private Misc() {
    } // never instantiated

    public static final String LS = System.getProperty("line.separator");

    /*
     * idiom suppression for clearing StringBuilders
     */
    public static void clear(StringBuilder sb) {
        sb.delete(0, sb.length());
    }

    /*
     * Integer.getInteger(), except that a malformed or non-positive value is
     * an error rather than a silent fallback to the default.
     */
    static int positiveIntProperty(String key, int def) {
        String value = System.getProperty(key);
        if (value == null) {
            return def;
        }
        int ret;
        try {
            ret = Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                "system property " + key + " is not an integer: " + value, e);
        }
        if (ret <= 0) {
            throw new IllegalStateException(
                "system property " + key + " must be positive: " + value);
        }
        return ret;
    }
}
