package fun.fengwk.wikitext.core.service.article.parser;

import fun.fengwk.wikitext.core.service.article.parser.block.Block;
import fun.fengwk.wikitext.core.service.article.parser.block.DefinitionBlock;
import fun.fengwk.wikitext.core.service.article.parser.block.HeadingBlock;
import fun.fengwk.wikitext.core.service.article.parser.block.ListBlock;
import fun.fengwk.wikitext.core.service.article.parser.block.ParagraphBlock;
import fun.fengwk.wikitext.core.service.article.parser.block.TableBlock;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns classified blocks into output lines.
 *
 * <p>A level-2 heading gets exactly one blank line on each side, a level-3 heading a
 * blank line before it. A heading text is emitted only the first time it appears.
 *
 * @author fengwk
 */
@Component
public class LineAssembler {

    static final String SECTION_PREFIX = "## ";
    static final String SUBSECTION_PREFIX = "### ";

    public List<String> assemble(List<Block> blocks) {
        List<String> lines = new ArrayList<>();
        Set<String> seenHeadings = new HashSet<>();
        for (Block block : blocks) {
            if (block instanceof HeadingBlock heading) {
                String prefix = heading.level() <= 2 ? SECTION_PREFIX : SUBSECTION_PREFIX;
                if (addHeadingIfNew(lines, seenHeadings, heading.text(), prefix) && heading.level() <= 2) {
                    lines.add("");
                }
            } else if (block instanceof ParagraphBlock paragraph) {
                lines.add(paragraph.text());
            } else if (block instanceof ListBlock list) {
                lines.addAll(list.items());
            } else if (block instanceof DefinitionBlock definitions) {
                for (DefinitionBlock.Entry entry : definitions.entries()) {
                    lines.add(entry.term() ? SUBSECTION_PREFIX + entry.text() : entry.text());
                }
            } else if (block instanceof TableBlock table) {
                lines.addAll(table.rows());
            }
        }
        return lines;
    }

    private boolean addHeadingIfNew(List<String> lines, Set<String> seenHeadings, String text, String prefix) {
        if (text == null || text.isEmpty()) {
            return false;
        }
        String normalized = normalizeHeading(text);
        if (!seenHeadings.add(normalized)) {
            return false;
        }
        if (!lines.isEmpty() && !lines.get(lines.size() - 1).isEmpty()) {
            lines.add("");
        }
        lines.add(prefix + text);
        return true;
    }

    static String normalizeHeading(String text) {
        return text.replace("###", "").replace("##", "").strip();
    }

}
