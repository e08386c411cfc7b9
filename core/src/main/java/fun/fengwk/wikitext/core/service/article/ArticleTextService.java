package fun.fengwk.wikitext.core.service.article;

import fun.fengwk.wikitext.core.service.article.model.ArticleRequest;
import fun.fengwk.wikitext.core.service.article.model.ArticleResponse;

/**
 * @author fengwk
 */
public interface ArticleTextService {

    /**
     * Fetches an article and converts it to plain text. Never throws; failures are
     * reported through the response status code and error.
     */
    ArticleResponse convert(ArticleRequest request);

}
