package fun.fengwk.wikitext.core.service.article.support;

import java.util.regex.Pattern;

/**
 * Whitespace helpers shared by the article text components.
 *
 * <p>Unlike {@link String#strip()}, these treat no-break spaces as whitespace.
 *
 * @author fengwk
 */
public final class TextSupport {

    private static final Pattern HORIZONTAL_SPACES = Pattern.compile("[ \\t\\u00A0]+");

    private TextSupport() {
    }

    public static boolean isWhitespace(char ch) {
        return Character.isWhitespace(ch) || Character.isSpaceChar(ch);
    }

    public static boolean isAsciiAlphanumeric(char ch) {
        return (ch >= 'a' && ch <= 'z') || (ch >= 'A' && ch <= 'Z') || (ch >= '0' && ch <= '9');
    }

    public static String strip(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        int start = 0;
        int end = value.length();
        while (start < end && isWhitespace(value.charAt(start))) {
            start++;
        }
        while (end > start && isWhitespace(value.charAt(end - 1))) {
            end--;
        }
        return value.substring(start, end);
    }

    /**
     * Strips the value and collapses runs of spaces, tabs and no-break spaces into one space.
     */
    public static String squeeze(String value) {
        return HORIZONTAL_SPACES.matcher(strip(value)).replaceAll(" ");
    }

    public static int length(String value) {
        return value.codePointCount(0, value.length());
    }

}
