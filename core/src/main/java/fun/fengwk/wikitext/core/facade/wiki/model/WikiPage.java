package fun.fengwk.wikitext.core.facade.wiki.model;

import lombok.Builder;
import lombok.Data;

/**
 * Rendered article markup.
 *
 * @author fengwk
 */
@Data
@Builder
public class WikiPage {

    /**
     * Title that was requested.
     */
    private String requestedTitle;

    /**
     * Display title reported by the wiki, falls back to the requested title.
     */
    private String displayTitle;

    private String html;

    /**
     * Endpoint that produced the page: {@code action} or {@code rest}.
     */
    private String source;

}
