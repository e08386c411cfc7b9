package fun.fengwk.wikitext.core.service.article.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Article conversion response.
 *
 * @author fengwk
 */
@Data
@Builder
public class ArticleResponse {

    /**
     * 200 on success, 400 invalid request, 422 empty text, 502 fetch failure, 500 otherwise.
     */
    private int statusCode;

    /**
     * Title derived from the request.
     */
    private String requestedTitle;

    /**
     * Resolved display title, the redirect target's when a redirect was followed.
     */
    private String title;

    private String sourceUrl;

    /**
     * Requested title when a redirect was followed, otherwise null.
     */
    private String redirectedFrom;

    private String text;

    private List<ImageRecord> images;

    private long elapsedMs;

    private String error;

}
