package fun.fengwk.wikitext.core.service.article.parser;

import fun.fengwk.wikitext.core.service.article.support.TextSupport;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Detects redirect pages, either from the rendered text or from the page markup.
 *
 * @author fengwk
 */
@Component
public class RedirectResolver {

    private static final List<Pattern> TEXT_MARKERS = List.of(
        Pattern.compile("重定向到：\\s*•\\s*([^\\n•]+)", Pattern.CASE_INSENSITIVE),
        Pattern.compile("重新導向至：\\s*•\\s*([^\\n•]+)", Pattern.CASE_INSENSITIVE),
        Pattern.compile("#REDIRECT\\s*\\[\\[([^\\]]+)\\]\\]", Pattern.CASE_INSENSITIVE),
        Pattern.compile("#重定向\\s*\\[\\[([^\\]]+)\\]\\]", Pattern.CASE_INSENSITIVE)
    );

    private static final Pattern PIPE_SUFFIX = Pattern.compile("\\|.*$");

    private static final String REDIRECT_PAGE_MARKER = "Special:Redirect";
    private static final String WIKI_PATH = "/wiki/";
    private static final Pattern SITE_NAME_SUFFIX = Pattern.compile("\\s*[-–]\\s*[^-–]*维基百科[^-–]*$");
    private static final String GENERIC_REDIRECT_TITLE = "重定向";

    /**
     * Finds a redirect target in assembled article text.
     */
    public Optional<String> detectInText(String text) {
        if (text == null || text.isEmpty()) {
            return Optional.empty();
        }
        for (Pattern pattern : TEXT_MARKERS) {
            Matcher matcher = pattern.matcher(text);
            if (matcher.find()) {
                String target = PIPE_SUFFIX.matcher(TextSupport.strip(matcher.group(1))).replaceAll("");
                if (!target.isEmpty()) {
                    return Optional.of(target);
                }
            }
        }
        return Optional.empty();
    }

    /**
     * Finds a redirect target in the raw markup of a dedicated redirect page.
     */
    public Optional<String> detectInMarkup(String html) {
        if (html == null || !html.contains(REDIRECT_PAGE_MARKER)) {
            return Optional.empty();
        }
        Document document = Jsoup.parse(html);
        Element versionLink = document.selectFirst("link[rel=dc:isVersionOf]");
        if (versionLink != null) {
            String href = versionLink.attr("href");
            int index = href.lastIndexOf(WIKI_PATH);
            if (index >= 0) {
                String encoded = href.substring(index + WIKI_PATH.length());
                return Optional.of(decodeTitle(encoded)).filter(title -> !title.isEmpty());
            }
        }
        Element titleTag = document.selectFirst("title");
        if (titleTag != null) {
            String title = SITE_NAME_SUFFIX.matcher(TextSupport.strip(titleTag.text())).replaceAll("");
            if (!title.isEmpty() && !GENERIC_REDIRECT_TITLE.equals(title)) {
                return Optional.of(title);
            }
        }
        return Optional.empty();
    }

    /**
     * Percent-decodes a path segment. A literal {@code +} stays a plus sign.
     */
    public static String decodeTitle(String encoded) {
        try {
            return URLDecoder.decode(encoded.replace("+", "%2B"), StandardCharsets.UTF_8);
        } catch (IllegalArgumentException ex) {
            return encoded;
        }
    }

}
