package fun.fengwk.wikitext.core.service.article.parser.block;

/**
 * A classified structural unit of an article, in document order.
 *
 * @author fengwk
 */
public interface Block {

}
