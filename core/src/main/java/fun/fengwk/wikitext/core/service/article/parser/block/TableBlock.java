package fun.fengwk.wikitext.core.service.article.parser.block;

import java.util.List;

/**
 * @author fengwk
 */
public record TableBlock(List<String> rows) implements Block {

    public TableBlock {
        rows = List.copyOf(rows);
    }

}
