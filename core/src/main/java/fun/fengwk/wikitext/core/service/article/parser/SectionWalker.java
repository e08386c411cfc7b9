package fun.fengwk.wikitext.core.service.article.parser;

import fun.fengwk.wikitext.core.service.article.parser.block.Block;
import fun.fengwk.wikitext.core.service.article.parser.block.DefinitionBlock;
import fun.fengwk.wikitext.core.service.article.parser.block.HeadingBlock;
import fun.fengwk.wikitext.core.service.article.parser.block.ListBlock;
import fun.fengwk.wikitext.core.service.article.parser.block.ParagraphBlock;
import fun.fengwk.wikitext.core.service.article.parser.block.TableBlock;
import fun.fengwk.wikitext.core.service.article.support.TextSupport;
import lombok.RequiredArgsConstructor;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Walks a cleaned article in source order and classifies its blocks.
 *
 * <p>A level-2 heading whose text contains an excluded keyword starts a skipped section;
 * everything up to the next level-2 heading is dropped without processing.
 *
 * @author fengwk
 */
@Component
@RequiredArgsConstructor
public class SectionWalker {

    private static final String BLOCK_SELECTOR = "h2, h3, p, ul, ol, dl, table";
    private static final Pattern BRACKETED = Pattern.compile("\\[.*?\\]");
    private static final int PSEUDO_HEADING_MAX_LENGTH = 50;
    private static final String SENTENCE_END = "。.！!？?";
    private static final String CLAUSE_PUNCTUATION = "，,、；;:：";
    private static final List<String> SKIPPED_TABLE_CLASSES = List.of("infobox", "navbox", "ambox", "mbox", "messagebox");

    private final InlineTextJoiner inlineTextJoiner;
    private final ListRenderer listRenderer;
    private final TableFlattener tableFlattener;
    private final LabelValueRepairer labelValueRepairer;

    public List<Block> walk(Element root, Collection<String> excludedSections) {
        List<String> keywords = excludedSections == null ? List.of() : excludedSections.stream()
            .filter(keyword -> keyword != null && !keyword.isBlank())
            .toList();
        List<Block> blocks = new ArrayList<>();
        boolean skipping = false;

        for (Element element : root.select(BLOCK_SELECTOR)) {
            String name = element.normalName();
            if ("h2".equals(name)) {
                String title = headingText(element);
                skipping = keywords.stream().anyMatch(title::contains);
                if (!skipping) {
                    blocks.add(new HeadingBlock(2, title));
                }
                continue;
            }
            if (skipping) {
                continue;
            }
            switch (name) {
                case "h3" -> walkSubHeading(element, blocks);
                case "p" -> walkParagraph(element, blocks);
                case "ul", "ol" -> walkList(element, blocks);
                case "dl" -> walkDefinitions(element, blocks);
                case "table" -> walkTable(element, blocks);
                default -> {
                }
            }
        }
        return blocks;
    }

    private void walkSubHeading(Element heading, List<Block> blocks) {
        Element table = closestAncestor(heading, "table");
        if (table != null && TableFlattener.isMultiColumn(table)) {
            return;
        }
        blocks.add(new HeadingBlock(3, headingText(heading)));
    }

    private void walkParagraph(Element paragraph, List<Block> blocks) {
        if (isConsumedByContainer(paragraph) || closestAncestor(paragraph, "li") != null) {
            return;
        }
        String text = TextSupport.squeeze(inlineTextJoiner.join(paragraph));
        if (text.isEmpty()) {
            return;
        }
        if (isPseudoHeading(text)) {
            blocks.add(new ParagraphBlock(text, true));
        } else {
            blocks.add(new ParagraphBlock(labelValueRepairer.repair(paragraph, text), false));
        }
    }

    private void walkList(Element list, List<Block> blocks) {
        if (isConsumedByContainer(list)) {
            return;
        }
        List<String> items = listRenderer.renderLines(list);
        if (!items.isEmpty()) {
            blocks.add(new ListBlock(ListRenderer.isOrdered(list), items));
        }
    }

    private void walkDefinitions(Element definitionList, List<Block> blocks) {
        if (isConsumedByContainer(definitionList)) {
            return;
        }
        List<DefinitionBlock.Entry> entries = new ArrayList<>();
        for (Element child : definitionList.children()) {
            String name = child.normalName();
            if ("dt".equals(name)) {
                String term = TextSupport.squeeze(inlineTextJoiner.join(child));
                if (!term.isEmpty()) {
                    entries.add(DefinitionBlock.Entry.term(term));
                }
            } else if ("dd".equals(name)) {
                // tables inside a body are emitted by the table path
                if (child.selectFirst("table") != null) {
                    continue;
                }
                String body = TextSupport.squeeze(inlineTextJoiner.join(child));
                if (!body.isEmpty()) {
                    entries.add(DefinitionBlock.Entry.body(body));
                }
            }
        }
        if (!entries.isEmpty()) {
            blocks.add(new DefinitionBlock(entries));
        }
    }

    private void walkTable(Element table, List<Block> blocks) {
        if (closestAncestor(table, "table") != null) {
            return;
        }
        String classes = table.className().toLowerCase(Locale.ROOT);
        if (SKIPPED_TABLE_CLASSES.stream().anyMatch(classes::contains)) {
            return;
        }
        List<String> rows = tableFlattener.flatten(table);
        if (!rows.isEmpty()) {
            blocks.add(new TableBlock(rows));
        }
    }

    /**
     * Content inside a table, or inside a definition body that was flattened whole, has
     * already been emitted by its container.
     */
    private boolean isConsumedByContainer(Element element) {
        if (closestAncestor(element, "table") != null) {
            return true;
        }
        Element body = closestAncestor(element, "dd");
        return body != null && body.selectFirst("table") == null;
    }

    private String headingText(Element heading) {
        String text = inlineTextJoiner.join(heading);
        return TextSupport.strip(BRACKETED.matcher(text).replaceAll(""));
    }

    static boolean isPseudoHeading(String text) {
        if (TextSupport.length(text) >= PSEUDO_HEADING_MAX_LENGTH) {
            return false;
        }
        char last = text.charAt(text.length() - 1);
        if (SENTENCE_END.indexOf(last) >= 0) {
            return false;
        }
        for (int i = 0; i < text.length(); i++) {
            if (CLAUSE_PUNCTUATION.indexOf(text.charAt(i)) >= 0) {
                return false;
            }
        }
        return true;
    }

    private Element closestAncestor(Element element, String tagName) {
        for (Element parent = element.parent(); parent != null; parent = parent.parent()) {
            if (tagName.equals(parent.normalName())) {
                return parent;
            }
        }
        return null;
    }

}
