package fun.fengwk.wikitext.core.service.article.parser;

import fun.fengwk.wikitext.core.service.article.support.TextSupport;
import lombok.RequiredArgsConstructor;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.springframework.stereotype.Component;

/**
 * Flattens a subtree into one line of text.
 *
 * <p>Text nodes are trimmed and concatenated. A space is inserted only when both sides
 * of the boundary are ASCII letters or digits, so English words stay apart while CJK
 * text is joined without spaces. Nested lists are rendered inline by {@link ListRenderer}.
 *
 * @author fengwk
 */
@Component
@RequiredArgsConstructor
public class InlineTextJoiner {

    private final ListRenderer listRenderer;

    public String join(Element element) {
        if (element == null) {
            return "";
        }
        if (ListRenderer.isList(element)) {
            return listRenderer.renderInline(element);
        }
        JoinedTextBuilder builder = new JoinedTextBuilder();
        for (Node child : element.childNodes()) {
            if (child instanceof TextNode textNode) {
                builder.appendFragment(TextSupport.strip(textNode.getWholeText()));
            } else if (child instanceof Element childElement) {
                if (ListRenderer.isList(childElement)) {
                    builder.appendBlock(listRenderer.renderInline(childElement));
                } else if ("br".equals(childElement.normalName())) {
                    builder.appendBreak();
                } else {
                    builder.appendFragment(join(childElement));
                }
            }
        }
        return builder.build();
    }

}
