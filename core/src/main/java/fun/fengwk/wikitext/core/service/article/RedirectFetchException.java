package fun.fengwk.wikitext.core.service.article;

import fun.fengwk.wikitext.core.facade.wiki.WikiFetchException;
import lombok.Getter;

/**
 * The target of a redirect page could not be fetched.
 *
 * @author fengwk
 */
@Getter
public class RedirectFetchException extends WikiFetchException {

    private final String target;

    public RedirectFetchException(String title, String target, Throwable cause) {
        super(title, "redirect target fetch failed, from=" + title + ", to=" + target + ", hop=1: "
            + (cause == null ? "" : cause.getMessage()), cause);
        this.target = target;
    }

}
