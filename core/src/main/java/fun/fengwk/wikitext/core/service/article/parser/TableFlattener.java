package fun.fengwk.wikitext.core.service.article.parser;

import fun.fengwk.wikitext.core.service.article.support.TextSupport;
import lombok.RequiredArgsConstructor;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Flattens content tables into text lines.
 *
 * <p>Regular tables become one {@code "• a | b | c"} line per logical row, with row and
 * column spans expanded through {@link TableGrid}. Tables marked {@code multicol} hold a
 * heading and list structure per cell and are emitted as headings plus item lines.
 *
 * @author fengwk
 */
@Component
@RequiredArgsConstructor
public class TableFlattener {

    public static final String MULTI_COLUMN_CLASS = "multicol";

    private static final String CELL_SEPARATOR = " | ";
    private static final int MAX_COLSPAN = 1000;
    private static final int MAX_ROWSPAN = 65534;

    private final InlineTextJoiner inlineTextJoiner;
    private final ListRenderer listRenderer;

    public static boolean isMultiColumn(Element table) {
        return table.hasClass(MULTI_COLUMN_CLASS);
    }

    public List<String> flatten(Element table) {
        if (isMultiColumn(table)) {
            return flattenMultiColumn(table);
        }
        return flattenGrid(table);
    }

    List<String> flattenGrid(Element table) {
        List<String> lines = new ArrayList<>();
        Element caption = findCaption(table);
        if (caption != null) {
            String captionText = TextSupport.squeeze(inlineTextJoiner.join(caption));
            if (!captionText.isEmpty()) {
                lines.add(captionText);
            }
        }

        TableGrid grid = new TableGrid();
        for (Element row : table.select("tr")) {
            if (nearestTable(row) != table) {
                continue;
            }
            grid.startRow();
            for (Element cell : row.children()) {
                String name = cell.normalName();
                if (!"td".equals(name) && !"th".equals(name)) {
                    continue;
                }
                String text = cellText(cell);
                int colspan = Math.min(parseSpan(cell.attr("colspan")), MAX_COLSPAN);
                int rowspan = Math.min(parseSpan(cell.attr("rowspan")), MAX_ROWSPAN);
                grid.placeCell(text, colspan, rowspan);
            }
            grid.endRow();
        }

        for (List<String> row : grid.rows()) {
            String line = String.join(CELL_SEPARATOR, row);
            if (!line.isBlank()) {
                lines.add(ListRenderer.BULLET + line);
            }
        }
        return lines;
    }

    List<String> flattenMultiColumn(Element table) {
        List<String> lines = new ArrayList<>();
        for (Element cell : table.select("td")) {
            if (nearestTable(cell) != table) {
                continue;
            }
            for (Element element : cell.select("h3, h4, h5, h6, dl, ul, ol")) {
                String name = element.normalName();
                if (name.startsWith("h")) {
                    addHeading(lines, TextSupport.squeeze(inlineTextJoiner.join(element)));
                } else if ("dl".equals(name)) {
                    for (Element term : element.select("dt")) {
                        String title = TextSupport.squeeze(inlineTextJoiner.join(term));
                        if (!title.isEmpty()) {
                            addHeading(lines, "### " + title);
                        }
                    }
                } else {
                    lines.addAll(listRenderer.renderLines(element));
                }
            }
        }
        return lines;
    }

    private void addHeading(List<String> lines, String title) {
        if (title.isEmpty()) {
            return;
        }
        if (!lines.isEmpty() && !lines.get(lines.size() - 1).isEmpty()) {
            lines.add("");
        }
        lines.add(title);
    }

    private String cellText(Element cell) {
        String text = inlineTextJoiner.join(cell).replace('\n', ' ');
        return TextSupport.squeeze(text);
    }

    private Element findCaption(Element table) {
        for (Element child : table.children()) {
            if ("caption".equals(child.normalName())) {
                return child;
            }
        }
        return null;
    }

    private Element nearestTable(Element element) {
        Element parent = element.parent();
        while (parent != null && !"table".equals(parent.normalName())) {
            parent = parent.parent();
        }
        return parent;
    }

    static int parseSpan(String value) {
        if (value == null || value.isBlank()) {
            return 1;
        }
        try {
            return Math.max(Integer.parseInt(value.trim()), 1);
        } catch (NumberFormatException ex) {
            return 1;
        }
    }

}
