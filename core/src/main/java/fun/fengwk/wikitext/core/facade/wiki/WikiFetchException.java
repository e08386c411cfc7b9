package fun.fengwk.wikitext.core.facade.wiki;

import lombok.Getter;

/**
 * Article markup could not be retrieved.
 *
 * @author fengwk
 */
@Getter
public class WikiFetchException extends RuntimeException {

    private final String title;

    public WikiFetchException(String title, String message) {
        super(message);
        this.title = title;
    }

    public WikiFetchException(String title, String message, Throwable cause) {
        super(message, cause);
        this.title = title;
    }

}
