package fun.fengwk.wikitext.core.service.article.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Article conversion request. Either {@code title} or {@code url} is required.
 *
 * @author fengwk
 */
@Data
@Builder
public class ArticleRequest {

    private String title;

    /**
     * Article URL, the title is taken from its last path segment.
     */
    private String url;

    /**
     * Excluded level-2 heading keywords, configured defaults when null.
     */
    private List<String> excludeSections;

    /**
     * Collect infobox image records, configured default when null.
     */
    private Boolean extractImages;

}
