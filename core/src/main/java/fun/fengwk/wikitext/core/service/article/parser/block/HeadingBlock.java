package fun.fengwk.wikitext.core.service.article.parser.block;

/**
 * @author fengwk
 */
public record HeadingBlock(int level, String text) implements Block {

}
