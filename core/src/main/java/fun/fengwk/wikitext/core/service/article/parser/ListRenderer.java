package fun.fengwk.wikitext.core.service.article.parser;

import fun.fengwk.wikitext.core.service.article.support.TextSupport;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders ordered and unordered lists into numbered or bulleted item lines.
 *
 * <p>Item text never includes the text of nested list items; nested lists are rendered
 * on their own when the caller reaches them.
 *
 * @author fengwk
 */
@Component
public class ListRenderer {

    public static final String BULLET = "• ";

    public static boolean isList(Element element) {
        String name = element.normalName();
        return "ol".equals(name) || "ul".equals(name);
    }

    public static boolean isOrdered(Element element) {
        return "ol".equals(element.normalName());
    }

    /**
     * One line per direct {@code <li>} child with non-empty text.
     * Ordered items are numbered by their position among the direct children.
     */
    public List<String> renderLines(Element list) {
        boolean ordered = isOrdered(list);
        List<String> lines = new ArrayList<>();
        int position = 0;
        for (Element child : list.children()) {
            if (!"li".equals(child.normalName())) {
                continue;
            }
            position++;
            String text = TextSupport.squeeze(itemText(child));
            if (text.isEmpty()) {
                continue;
            }
            lines.add(ordered ? position + ". " + text : BULLET + text);
        }
        return lines;
    }

    /**
     * Inline form used inside running text: the item lines joined with a space.
     */
    public String renderInline(Element list) {
        return String.join(" ", renderLines(list));
    }

    public String itemText(Element item) {
        JoinedTextBuilder builder = new JoinedTextBuilder();
        collectItemText(item, builder);
        return builder.build();
    }

    private void collectItemText(Element element, JoinedTextBuilder builder) {
        for (Node child : element.childNodes()) {
            if (child instanceof TextNode textNode) {
                builder.appendFragment(TextSupport.strip(textNode.getWholeText()));
            } else if (child instanceof Element childElement) {
                String name = childElement.normalName();
                if ("li".equals(name)) {
                    // owned by a nested list
                    continue;
                }
                if ("br".equals(name)) {
                    builder.appendBreak();
                    continue;
                }
                collectItemText(childElement, builder);
            }
        }
    }

}
