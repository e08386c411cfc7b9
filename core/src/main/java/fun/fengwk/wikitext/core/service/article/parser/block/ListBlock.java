package fun.fengwk.wikitext.core.service.article.parser.block;

import java.util.List;

/**
 * Rendered list items, already carrying their number or bullet.
 *
 * @author fengwk
 */
public record ListBlock(boolean ordered, List<String> items) implements Block {

    public ListBlock {
        items = List.copyOf(items);
    }

}
