package fun.fengwk.wikitext.core.service.article.parser;

/**
 * Wires the parser components without a Spring context.
 *
 * @author fengwk
 */
public final class ArticleParserFixtures {

    private ArticleParserFixtures() {
    }

    public static ArticleConverter articleConverter() {
        ListRenderer listRenderer = new ListRenderer();
        InlineTextJoiner inlineTextJoiner = new InlineTextJoiner(listRenderer);
        SectionWalker sectionWalker = new SectionWalker(
            inlineTextJoiner, listRenderer, new TableFlattener(inlineTextJoiner, listRenderer), new LabelValueRepairer());
        return new ArticleConverter(
            new InfoboxImageExtractor(), new NoiseFilter(), sectionWalker, new LineAssembler(), new ArticleTextPostProcessor());
    }

}
