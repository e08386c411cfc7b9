package fun.fengwk.wikitext.core.service.article.parser.block;

import java.util.List;

/**
 * Terms and bodies of a definition list in source order.
 *
 * @author fengwk
 */
public record DefinitionBlock(List<Entry> entries) implements Block {

    public DefinitionBlock {
        entries = List.copyOf(entries);
    }

    public record Entry(boolean term, String text) {

        public static Entry term(String text) {
            return new Entry(true, text);
        }

        public static Entry body(String text) {
            return new Entry(false, text);
        }

    }

}
