package fun.fengwk.wikitext.core.service.article.support;

import fun.fengwk.wikitext.core.service.article.parser.RedirectResolver;

import java.net.URI;
import java.util.regex.Pattern;

/**
 * @author fengwk
 */
public final class ArticleTitles {

    private static final Pattern UNSAFE_FILENAME_CHARACTERS = Pattern.compile("[\\\\/*?:\"<>|]");
    private static final int MAX_FILENAME_LENGTH = 200;

    private ArticleTitles() {
    }

    /**
     * Takes the last path segment of an article URL, percent-decoded.
     */
    public static String fromUrl(String url) {
        String path;
        try {
            path = URI.create(url.strip()).getRawPath();
        } catch (IllegalArgumentException ex) {
            path = url.strip();
        }
        if (path == null) {
            return "";
        }
        String segment = path.substring(path.lastIndexOf('/') + 1);
        return RedirectResolver.decodeTitle(segment);
    }

    public static String safeFilename(String title) {
        String name = UNSAFE_FILENAME_CHARACTERS.matcher(title).replaceAll("_");
        return name.length() > MAX_FILENAME_LENGTH ? name.substring(0, MAX_FILENAME_LENGTH) : name;
    }

}
