package fun.fengwk.wikitext.core.service.article.impl;

import fun.fengwk.wikitext.core.facade.wiki.WikiFacade;
import fun.fengwk.wikitext.core.facade.wiki.WikiFetchException;
import fun.fengwk.wikitext.core.facade.wiki.model.WikiPage;
import fun.fengwk.wikitext.core.service.article.ArticleProperties;
import fun.fengwk.wikitext.core.service.article.ArticleTextService;
import fun.fengwk.wikitext.core.service.article.EmptyArticleTextException;
import fun.fengwk.wikitext.core.service.article.RedirectFetchException;
import fun.fengwk.wikitext.core.service.article.model.ArticleRequest;
import fun.fengwk.wikitext.core.service.article.model.ArticleResponse;
import fun.fengwk.wikitext.core.service.article.parser.ArticleConversion;
import fun.fengwk.wikitext.core.service.article.parser.ArticleConverter;
import fun.fengwk.wikitext.core.service.article.parser.LabelValueRepairer;
import fun.fengwk.wikitext.core.service.article.parser.RedirectResolver;
import fun.fengwk.wikitext.core.service.article.parser.TextNormalizer;
import fun.fengwk.wikitext.core.service.article.support.ArticleTitles;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Article conversion pipeline: fetch, redirect, convert, language-link repair, normalize.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ArticleTextServiceImpl implements ArticleTextService {

    private final WikiFacade wikiFacade;
    private final ArticleProperties articleProperties;
    private final ArticleConverter articleConverter;
    private final RedirectResolver redirectResolver;
    private final LabelValueRepairer labelValueRepairer;
    private final TextNormalizer textNormalizer;

    @Override
    public ArticleResponse convert(ArticleRequest request) {
        long startAt = System.currentTimeMillis();
        String requestedTitle = null;
        try {
            requestedTitle = resolveRequestedTitle(request);
            List<String> excludeSections = request.getExcludeSections() == null
                ? articleProperties.getExcludeSections()
                : request.getExcludeSections();
            boolean extractImages = request.getExtractImages() == null
                ? articleProperties.isExtractImages()
                : request.getExtractImages();

            ArticleResponse response = process(requestedTitle, request.getUrl(), excludeSections, extractImages);
            response.setElapsedMs(System.currentTimeMillis() - startAt);
            return response;
        } catch (IllegalArgumentException ex) {
            log.warn("article request invalid, title={}, error={}", requestedTitle, ex.getMessage());
            return failure(400, requestedTitle, ex, startAt);
        } catch (EmptyArticleTextException ex) {
            log.warn("article text empty, title={}", requestedTitle);
            return failure(422, requestedTitle, ex, startAt);
        } catch (WikiFetchException ex) {
            log.warn("article fetch failed, title={}, error={}", requestedTitle, ex.getMessage());
            return failure(502, requestedTitle, ex, startAt);
        } catch (Exception ex) {
            log.warn("article conversion failed, title={}, error={}", requestedTitle, ex.getMessage(), ex);
            return failure(500, requestedTitle, ex, startAt);
        }
    }

    private ArticleResponse process(String requestedTitle, String requestUrl,
                                    List<String> excludeSections, boolean extractImages) {
        WikiPage page = wikiFacade.fetchPage(requestedTitle);
        String redirectedFrom = null;

        // a single redirect hop is shared by the markup check and the text check
        Optional<String> target = redirectResolver.detectInMarkup(page.getHtml())
            .filter(candidate -> isNewTarget(candidate, requestedTitle, page));
        WikiPage current = page;
        if (target.isPresent()) {
            current = fetchRedirectTarget(requestedTitle, target.get());
            redirectedFrom = requestedTitle;
        }

        String sourceUrl = sourceUrl(requestUrl, current, redirectedFrom);
        ArticleConversion conversion = articleConverter.convert(
            current.getHtml(), current.getDisplayTitle(), sourceUrl, excludeSections, extractImages);

        if (redirectedFrom == null) {
            WikiPage fetched = current;
            target = redirectResolver.detectInText(conversion.text())
                .filter(candidate -> isNewTarget(candidate, requestedTitle, fetched));
            if (target.isPresent()) {
                current = fetchRedirectTarget(requestedTitle, target.get());
                redirectedFrom = requestedTitle;
                sourceUrl = sourceUrl(requestUrl, current, redirectedFrom);
                conversion = articleConverter.convert(
                    current.getHtml(), current.getDisplayTitle(), sourceUrl, excludeSections, extractImages);
            }
        }

        String title = StringUtils.defaultIfBlank(current.getDisplayTitle(), requestedTitle);
        String text = labelValueRepairer.repairWithLangLinks(
            conversion.text(), languageCode -> wikiFacade.fetchLangLinkTitle(title, languageCode));
        text = textNormalizer.normalize(text);
        if (StringUtils.isBlank(text)) {
            throw new EmptyArticleTextException(title);
        }

        return ArticleResponse.builder()
            .statusCode(200)
            .requestedTitle(requestedTitle)
            .title(title)
            .sourceUrl(sourceUrl)
            .redirectedFrom(redirectedFrom)
            .text(text)
            .images(conversion.images())
            .build();
    }

    private WikiPage fetchRedirectTarget(String requestedTitle, String target) {
        log.info("following redirect, from={}, to={}", requestedTitle, target);
        try {
            return wikiFacade.fetchPage(target);
        } catch (WikiFetchException ex) {
            throw new RedirectFetchException(requestedTitle, target, ex);
        }
    }

    private boolean isNewTarget(String candidate, String requestedTitle, WikiPage page) {
        return !Objects.equals(candidate, requestedTitle) && !Objects.equals(candidate, page.getDisplayTitle());
    }

    private String sourceUrl(String requestUrl, WikiPage page, String redirectedFrom) {
        if (redirectedFrom == null && StringUtils.isNotBlank(requestUrl)) {
            return requestUrl.strip();
        }
        return wikiFacade.articleUrl(StringUtils.defaultIfBlank(page.getDisplayTitle(), page.getRequestedTitle()));
    }

    private String resolveRequestedTitle(ArticleRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request is null");
        }
        if (StringUtils.isNotBlank(request.getTitle())) {
            return request.getTitle().strip();
        }
        if (StringUtils.isBlank(request.getUrl())) {
            throw new IllegalArgumentException("title and url are both blank");
        }
        String title = ArticleTitles.fromUrl(request.getUrl());
        if (StringUtils.isBlank(title)) {
            throw new IllegalArgumentException("no title in url: " + request.getUrl());
        }
        return title;
    }

    private ArticleResponse failure(int statusCode, String requestedTitle, Exception ex, long startAt) {
        return ArticleResponse.builder()
            .statusCode(statusCode)
            .requestedTitle(requestedTitle)
            .error(ex.getMessage())
            .elapsedMs(System.currentTimeMillis() - startAt)
            .build();
    }

}
