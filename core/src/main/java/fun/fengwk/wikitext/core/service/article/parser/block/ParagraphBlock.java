package fun.fengwk.wikitext.core.service.article.parser.block;

/**
 * Paragraph text. A pseudo heading is a short unpunctuated paragraph kept as a bare line.
 *
 * @author fengwk
 */
public record ParagraphBlock(String text, boolean pseudoHeading) implements Block {

}
