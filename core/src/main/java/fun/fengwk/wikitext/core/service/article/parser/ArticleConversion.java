package fun.fengwk.wikitext.core.service.article.parser;

import fun.fengwk.wikitext.core.service.article.model.ImageRecord;

import java.util.List;

/**
 * Assembled article text and the image records collected along the way.
 *
 * @author fengwk
 */
public record ArticleConversion(String text, List<ImageRecord> images) {

    public ArticleConversion {
        text = text == null ? "" : text;
        images = images == null ? List.of() : List.copyOf(images);
    }

}
