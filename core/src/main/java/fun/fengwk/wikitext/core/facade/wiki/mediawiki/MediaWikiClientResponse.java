package fun.fengwk.wikitext.core.facade.wiki.mediawiki;

import lombok.Builder;
import lombok.Data;

/**
 * Raw response from a MediaWiki endpoint.
 *
 * @author fengwk
 */
@Data
@Builder
public class MediaWikiClientResponse {

    private int statusCode;
    private String body;
    private Throwable error;

    /**
     * Attempts made, including the successful one.
     */
    private int attempts;

    public boolean hasError() {
        return error != null;
    }

}
