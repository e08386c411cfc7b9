package fun.fengwk.wikitext.core.service.article.parser;

import fun.fengwk.wikitext.core.service.article.model.ImageRecord;
import fun.fengwk.wikitext.core.service.article.support.TextSupport;
import org.apache.commons.lang3.StringUtils;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Collects the main images of infoboxes. Must run before {@link NoiseFilter} drops them.
 *
 * @author fengwk
 */
@Component
public class InfoboxImageExtractor {

    private static final String SITE_ORIGIN = "https://zh.wikipedia.org";

    private static final List<String> IMAGE_CELL_SELECTORS = List.of(
        "td.infobox-image",
        ".infobox-image",
        ".ib-settlement-cols-cell",
        "td.maptable",
        ".infobox-full-data",
        ".tmulti",
        ".thumb",
        ".tsingle"
    );

    /**
     * Icons, templates and map tiles.
     */
    private static final List<String> IGNORED_URL_KEYWORDS = List.of(
        "edit", "icon", "20px", "commons/thumb/8/8a/ooj",
        "emblem_of_the_kuomintang", "independent_candidate_icon", "disambig_gray", "information_icon4",
        "40px-", "60px-", "chinese_characters", "characters", "phonetic", "template",
        "maps.wikimedia.org", "osm-intl", "maplink", "mapframe"
    );

    private static final List<String> KNOWN_EXTENSIONS = List.of("jpg", "jpeg", "png", "gif", "webp", "svg");
    private static final String DEFAULT_EXTENSION = "jpg";

    static final int MIN_DIMENSION = 80;
    static final int MAX_CAPTION_LENGTH = 100;
    static final String DEFAULT_CAPTION = "圖片";

    public List<ImageRecord> extract(Document document, String title, String sourceUrl) {
        List<ImageRecord> records = new ArrayList<>();
        Set<String> seenUrls = new LinkedHashSet<>();
        for (Element infobox : document.select("table.infobox")) {
            for (String selector : IMAGE_CELL_SELECTORS) {
                for (Element cell : infobox.select(selector)) {
                    Element img = cell.selectFirst("img");
                    if (img == null) {
                        continue;
                    }
                    String src = absolutize(StringUtils.defaultIfEmpty(img.attr("src"), img.attr("data-src")));
                    if (src.isEmpty() || isIgnored(src, img)) {
                        continue;
                    }
                    String imageUrl = originalUrl(src);
                    if (!seenUrls.add(imageUrl)) {
                        continue;
                    }
                    records.add(ImageRecord.builder()
                        .title(title)
                        .imageUrl(imageUrl)
                        .sourceUrl(sourceUrl)
                        .imageFilename(filename(imageUrl))
                        .caption(caption(infobox, img))
                        .build());
                }
            }
        }
        return records;
    }

    static String absolutize(String src) {
        if (src == null || src.isEmpty()) {
            return "";
        }
        if (src.startsWith("//")) {
            return "https:" + src;
        }
        if (src.startsWith("/")) {
            return SITE_ORIGIN + src;
        }
        return src;
    }

    private boolean isIgnored(String src, Element img) {
        String lower = src.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".svg") || lower.contains(".svg/")) {
            return true;
        }
        if (IGNORED_URL_KEYWORDS.stream().anyMatch(lower::contains)) {
            return true;
        }
        int width = dimension(img.attr("width"));
        int height = dimension(img.attr("height"));
        if ((width > 0 && width < MIN_DIMENSION) || (height > 0 && height < MIN_DIMENSION)) {
            return true;
        }
        // wide and narrow images are usually rendered text
        return width > 0 && height > 0 && (double) width / height > 3 && width < 300;
    }

    private int dimension(String value) {
        String digits = value.replace("px", "").strip();
        if (digits.isEmpty() || !StringUtils.isNumeric(digits)) {
            return 0;
        }
        try {
            return Integer.parseInt(digits);
        } catch (NumberFormatException ex) {
            return 0;
        }
    }

    /**
     * Maps {@code .../thumb/a/ab/File.jpg/250px-File.jpg} to {@code .../a/ab/File.jpg}.
     */
    static String originalUrl(String src) {
        int thumb = src.indexOf("/thumb/");
        if (thumb < 0 || !src.contains("px-") || src.indexOf("/thumb/", thumb + 1) >= 0) {
            return src;
        }
        String filePart = src.substring(thumb + "/thumb/".length());
        int lastSlash = filePart.lastIndexOf('/');
        if (lastSlash < 0) {
            return src;
        }
        return src.substring(0, thumb) + "/" + filePart.substring(0, lastSlash);
    }

    static String filename(String imageUrl) {
        String hash = DigestUtils.md5DigestAsHex(imageUrl.getBytes(StandardCharsets.UTF_8)).substring(0, 12);
        return hash + "." + extension(imageUrl);
    }

    private static String extension(String imageUrl) {
        String path = imageUrl;
        int cut = StringUtils.indexOfAny(path, '?', '#');
        if (cut >= 0) {
            path = path.substring(0, cut);
        }
        String lower = path.toLowerCase(Locale.ROOT);
        for (String extension : KNOWN_EXTENSIONS) {
            if (lower.endsWith("." + extension)) {
                return extension;
            }
        }
        return DEFAULT_EXTENSION;
    }

    private String caption(Element infobox, Element img) {
        String caption = "";
        Element single = img.closest("div.tsingle");
        if (single != null) {
            Element thumbCaption = single.selectFirst("div.thumbcaption");
            if (thumbCaption != null) {
                caption = TextSupport.strip(thumbCaption.text());
            }
        }
        if (caption.isEmpty()) {
            caption = infobox.select("div.infobox-caption").stream()
                .map(element -> TextSupport.strip(element.text()))
                .filter(text -> !text.isEmpty())
                .findFirst()
                .orElse("");
        }
        String alt = img.attr("alt");
        Element parent = img.parent();
        if (caption.isEmpty() && parent != null && ("td".equals(parent.normalName()) || "th".equals(parent.normalName()))) {
            String cellText = TextSupport.strip(parent.text());
            caption = !alt.isEmpty() && cellText.contains(alt) ? TextSupport.strip(cellText.replace(alt, "")) : cellText;
        }
        if (caption.isEmpty()) {
            caption = StringUtils.firstNonEmpty(img.attr("title"), alt, DEFAULT_CAPTION);
        }
        caption = caption.replaceAll("\\s+", " ").strip();
        if (caption.length() > MAX_CAPTION_LENGTH) {
            caption = caption.substring(0, MAX_CAPTION_LENGTH) + "...";
        }
        return caption;
    }

}
