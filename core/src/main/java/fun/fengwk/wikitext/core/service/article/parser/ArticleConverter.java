package fun.fengwk.wikitext.core.service.article.parser;

import fun.fengwk.wikitext.core.service.article.model.ImageRecord;
import fun.fengwk.wikitext.core.service.article.parser.block.Block;
import lombok.RequiredArgsConstructor;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.List;

/**
 * Converts article markup into plain text lines.
 *
 * <p>Infobox images are read before {@link NoiseFilter} detaches the infoboxes. The walk
 * after filtering does not mutate the tree.
 *
 * @author fengwk
 */
@Component
@RequiredArgsConstructor
public class ArticleConverter {

    private final InfoboxImageExtractor infoboxImageExtractor;
    private final NoiseFilter noiseFilter;
    private final SectionWalker sectionWalker;
    private final LineAssembler lineAssembler;
    private final ArticleTextPostProcessor postProcessor;

    /**
     * @param html article markup
     * @param title resolved display title, recorded on image records
     * @param sourceUrl article URL, recorded on image records
     * @param excludedSections level-2 heading keywords whose sections are dropped
     * @param extractImages whether infobox images are collected
     */
    public ArticleConversion convert(String html, String title, String sourceUrl,
                                     Collection<String> excludedSections, boolean extractImages) {
        if (html == null || html.isBlank()) {
            return new ArticleConversion("", List.of());
        }
        Document document = Jsoup.parse(html);
        List<ImageRecord> images = extractImages
            ? infoboxImageExtractor.extract(document, title, sourceUrl)
            : List.of();

        noiseFilter.clean(document);
        List<Block> blocks = sectionWalker.walk(contentRoot(document), excludedSections);
        List<String> lines = lineAssembler.assemble(blocks);
        String text = postProcessor.process(String.join("\n", lines).strip());
        return new ArticleConversion(text, images);
    }

    static Element contentRoot(Document document) {
        Element root = document.selectFirst("#mw-content-text .mw-parser-output");
        if (root == null) {
            root = document.selectFirst("div.mw-parser-output");
        }
        return root == null ? document.body() : root;
    }

}
