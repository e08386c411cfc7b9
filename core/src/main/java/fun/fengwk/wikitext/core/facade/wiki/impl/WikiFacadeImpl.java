package fun.fengwk.wikitext.core.facade.wiki.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fun.fengwk.wikitext.core.facade.wiki.WikiFacade;
import fun.fengwk.wikitext.core.facade.wiki.WikiFetchException;
import fun.fengwk.wikitext.core.facade.wiki.mediawiki.MediaWikiClient;
import fun.fengwk.wikitext.core.facade.wiki.mediawiki.MediaWikiClientResponse;
import fun.fengwk.wikitext.core.facade.wiki.mediawiki.MediaWikiProperties;
import fun.fengwk.wikitext.core.facade.wiki.model.WikiPage;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Fetches pages through the action API first and the REST endpoint second.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class WikiFacadeImpl implements WikiFacade {

    static final String SOURCE_ACTION = "action";
    static final String SOURCE_REST = "rest";

    private final MediaWikiClient client;
    private final MediaWikiProperties properties;
    private final ObjectMapper objectMapper;
    private final List<PageStrategy> pageStrategies;

    public WikiFacadeImpl(MediaWikiClient client, MediaWikiProperties properties, ObjectMapper objectMapper) {
        this.client = client;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.pageStrategies = List.of(this::fetchFromActionApi, this::fetchFromRestApi);
    }

    @Override
    public WikiPage fetchPage(String title) {
        if (StringUtils.isBlank(title)) {
            throw new WikiFetchException(title, "title is blank");
        }
        StringBuilder errors = new StringBuilder();
        for (PageStrategy strategy : pageStrategies) {
            Optional<WikiPage> page = strategy.fetch(title, errors);
            if (page.isPresent()) {
                return page.get();
            }
        }
        throw new WikiFetchException(title, "fetch failed for " + title + ": " + errors);
    }

    private Optional<WikiPage> fetchFromActionApi(String title, StringBuilder errors) {
        Map<String, String> params = new LinkedHashMap<>();
        params.put("action", "parse");
        params.put("page", title);
        params.put("prop", "text|displaytitle");
        params.put("format", "json");
        params.put("variant", properties.getVariant());
        params.put("maxlag", String.valueOf(properties.getMaxlag()));

        MediaWikiClientResponse response = client.action(params, properties.getTimeoutMs());
        if (response.hasError()) {
            appendError(errors, SOURCE_ACTION, response.getError().getMessage());
            log.debug("action api fetch failed, title={}, error={}", title, response.getError().getMessage());
            return Optional.empty();
        }
        try {
            JsonNode parse = objectMapper.readTree(response.getBody()).path("parse");
            JsonNode text = parse.path("text").path("*");
            if (!text.isTextual()) {
                appendError(errors, SOURCE_ACTION, "parse missing content");
                log.debug("action api returned no content, title={}", title);
                return Optional.empty();
            }
            String displayTitle = cleanDisplayTitle(parse.path("displaytitle").asText(""));
            if (displayTitle.isEmpty()) {
                displayTitle = parse.path("title").asText(title);
            }
            return Optional.of(WikiPage.builder()
                .requestedTitle(title)
                .displayTitle(displayTitle)
                .html(text.asText())
                .source(SOURCE_ACTION)
                .build());
        } catch (Exception ex) {
            appendError(errors, SOURCE_ACTION, ex.getMessage());
            log.debug("action api response unreadable, title={}, error={}", title, ex.getMessage());
            return Optional.empty();
        }
    }

    private Optional<WikiPage> fetchFromRestApi(String title, StringBuilder errors) {
        MediaWikiClientResponse response = client.restHtml(title, properties.getTimeoutMs());
        if (response.hasError() || StringUtils.isBlank(response.getBody())) {
            String error = response.hasError() ? response.getError().getMessage() : "empty response body";
            appendError(errors, SOURCE_REST, error);
            log.debug("rest api fetch failed, title={}, error={}", title, error);
            return Optional.empty();
        }
        String html = response.getBody();
        String displayTitle = extractDisplayTitle(html);
        return Optional.of(WikiPage.builder()
            .requestedTitle(title)
            .displayTitle(displayTitle.isEmpty() ? title : displayTitle)
            .html(html)
            .source(SOURCE_REST)
            .build());
    }

    @Override
    public Optional<String> fetchLangLinkTitle(String title, String languageCode) {
        if (StringUtils.isAnyBlank(title, languageCode)) {
            return Optional.empty();
        }
        Map<String, String> params = new LinkedHashMap<>();
        params.put("action", "query");
        params.put("prop", "langlinks");
        params.put("titles", title);
        params.put("lllang", languageCode);
        params.put("format", "json");

        MediaWikiClientResponse response = client.action(params, properties.getLangLinksTimeoutMs());
        if (response.hasError()) {
            log.debug("langlinks lookup failed, title={}, lang={}, error={}",
                title, languageCode, response.getError().getMessage());
            return Optional.empty();
        }
        try {
            JsonNode pages = objectMapper.readTree(response.getBody()).path("query").path("pages");
            for (JsonNode page : pages) {
                for (JsonNode link : page.path("langlinks")) {
                    if (languageCode.equals(link.path("lang").asText())) {
                        String value = StringUtils.firstNonBlank(link.path("*").asText(null), link.path("title").asText(null));
                        return Optional.ofNullable(value);
                    }
                }
            }
        } catch (Exception ex) {
            log.debug("langlinks response unreadable, title={}, lang={}, error={}", title, languageCode, ex.getMessage());
        }
        return Optional.empty();
    }

    @Override
    public String articleUrl(String title) {
        return properties.getArticleBaseUrl() + MediaWikiClient.encode(title);
    }

    static String cleanDisplayTitle(String displayTitleHtml) {
        if (StringUtils.isBlank(displayTitleHtml)) {
            return "";
        }
        return Jsoup.parse(displayTitleHtml).text().strip();
    }

    static String extractDisplayTitle(String html) {
        Document document = Jsoup.parse(html);
        Element meta = document.selectFirst("meta[property=mw:displaytitle]");
        if (meta != null && StringUtils.isNotBlank(meta.attr("content"))) {
            return meta.attr("content").strip();
        }
        Element heading = document.selectFirst("#firstHeading");
        if (heading != null) {
            return heading.text().strip();
        }
        Element titleTag = document.selectFirst("title");
        return titleTag == null ? "" : titleTag.text().strip();
    }

    private static void appendError(StringBuilder errors, String source, String message) {
        if (!errors.isEmpty()) {
            errors.append("; ");
        }
        errors.append(source).append(": ").append(message);
    }

    @FunctionalInterface
    private interface PageStrategy {

        Optional<WikiPage> fetch(String title, StringBuilder errors);

    }

}
