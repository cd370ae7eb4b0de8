package org.x500canon.util;

/**
 * Escapes strings so that they are safe to print to a terminal or log.
 * <p>
 * Backslash becomes <tt>\\</tt>, and tab, line feed and carriage return
 * become <tt>\t</tt>, <tt>\n</tt> and <tt>\r</tt>. Any other non-printable
 * code point becomes <tt>\xhh</tt>, <tt>&#92;uhhhh</tt> or <tt>\Uhhhhhhhh</tt>
 * depending on its size, with lowercase hex digits. A single quote becomes
 * <tt>\'</tt> only when the string also holds a double quote; everything
 * else is kept as is.
 */
public final class DebugStrings {

    private DebugStrings() {
    }

    /**
     * Escapes the given string.
     *
     * @param s
     *            the string.
     * @return the escaped string.
     */
    public static String escape(String s) {
        StringBuilder sb = new StringBuilder(s.length());
        boolean escapeQuote = s.indexOf('\'') >= 0 && s.indexOf('"') >= 0;
        int i = 0;
        while (i < s.length()) {
            int cp = s.codePointAt(i);
            i += Character.charCount(cp);
            switch (cp) {
            case '\\':
                sb.append("\\\\");
                break;
            case '\t':
                sb.append("\\t");
                break;
            case '\n':
                sb.append("\\n");
                break;
            case '\r':
                sb.append("\\r");
                break;
            case '\'':
                sb.append(escapeQuote ? "\\'" : "'");
                break;
            default:
                if (isPrintable(cp)) {
                    sb.appendCodePoint(cp);
                } else if (cp < 0x100) {
                    sb.append("\\x").append(hex(cp, 2));
                } else if (cp < 0x10000) {
                    sb.append("\\u").append(hex(cp, 4));
                } else {
                    sb.append("\\U").append(hex(cp, 8));
                }
            }
        }
        return sb.toString();
    }

    /**
     * Returns whether the code point prints as itself. Control, format,
     * surrogate, private use and unassigned code points do not, and neither
     * do separators other than the space character.
     *
     * @param cp
     *            the code point.
     * @return <tt>true</tt> if the code point is printable.
     */
    public static boolean isPrintable(int cp) {
        if (cp == ' ') {
            return true;
        }
        switch (Character.getType(cp)) {
        case Character.CONTROL:
        case Character.FORMAT:
        case Character.SURROGATE:
        case Character.PRIVATE_USE:
        case Character.UNASSIGNED:
        case Character.LINE_SEPARATOR:
        case Character.PARAGRAPH_SEPARATOR:
        case Character.SPACE_SEPARATOR:
            return false;
        default:
            return true;
        }
    }

    private static String hex(int cp, int digits) {
        String hex = Integer.toHexString(cp);
        StringBuilder sb = new StringBuilder(digits);
        for (int i = hex.length(); i < digits; i++) {
            sb.append('0');
        }
        return sb.append(hex).toString();
    }
}
