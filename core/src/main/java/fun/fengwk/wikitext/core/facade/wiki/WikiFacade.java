package fun.fengwk.wikitext.core.facade.wiki;

import fun.fengwk.wikitext.core.facade.wiki.model.WikiPage;

import java.util.Optional;

/**
 * @author fengwk
 */
public interface WikiFacade {

    /**
     * Fetches rendered article markup.
     *
     * @throws WikiFetchException when every endpoint failed
     */
    WikiPage fetchPage(String title);

    /**
     * Looks up the title of the same article in another language.
     *
     * @return empty when there is no such link or the lookup failed
     */
    Optional<String> fetchLangLinkTitle(String title, String languageCode);

    String articleUrl(String title);

}
