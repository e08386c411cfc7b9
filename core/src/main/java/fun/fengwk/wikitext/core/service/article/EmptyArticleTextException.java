package fun.fengwk.wikitext.core.service.article;

import lombok.Getter;

/**
 * The article produced no non-blank line after normalization.
 *
 * @author fengwk
 */
@Getter
public class EmptyArticleTextException extends RuntimeException {

    private final String title;

    public EmptyArticleTextException(String title) {
        super("article text is empty: " + title);
        this.title = title;
    }

}
