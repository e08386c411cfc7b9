package fun.fengwk.wikitext.core.service.article.parser;

import fun.fengwk.wikitext.core.service.article.support.TextSupport;

/**
 * Accumulates text fragments, inserting one space only between two ASCII alphanumerics.
 *
 * <p>Empty fragments are ignored and leave the boundary state untouched.
 *
 * @author fengwk
 */
public class JoinedTextBuilder {

    private final StringBuilder builder = new StringBuilder();
    private boolean lastAlphanumeric;

    public static String join(Iterable<String> fragments) {
        JoinedTextBuilder builder = new JoinedTextBuilder();
        for (String fragment : fragments) {
            builder.appendFragment(TextSupport.strip(fragment));
        }
        return builder.build();
    }

    public JoinedTextBuilder appendFragment(String fragment) {
        if (fragment == null || fragment.isEmpty()) {
            return this;
        }
        boolean currentAlphanumeric = TextSupport.isAsciiAlphanumeric(fragment.charAt(0));
        if (builder.length() > 0 && lastAlphanumeric && currentAlphanumeric) {
            builder.append(' ');
        }
        builder.append(fragment);
        lastAlphanumeric = TextSupport.isAsciiAlphanumeric(fragment.charAt(fragment.length() - 1));
        return this;
    }

    /**
     * A line break inside running text becomes a single space.
     */
    public JoinedTextBuilder appendBreak() {
        builder.append(' ');
        lastAlphanumeric = false;
        return this;
    }

    public JoinedTextBuilder appendBlock(String block) {
        if (block == null || block.isEmpty()) {
            return this;
        }
        builder.append(block);
        lastAlphanumeric = false;
        return this;
    }

    public String build() {
        return builder.toString();
    }

}
