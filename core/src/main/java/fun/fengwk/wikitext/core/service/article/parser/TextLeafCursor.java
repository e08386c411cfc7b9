package fun.fengwk.wikitext.core.service.article.parser;

import fun.fengwk.wikitext.core.service.article.support.TextSupport;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;

import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Cursor over the text leaves of a tree in document order.
 *
 * <p>The tree is flattened once into text nodes and line breaks, so scans that collect
 * text across node boundaries do not depend on live sibling navigation.
 *
 * @author fengwk
 */
public class TextLeafCursor {

    private final List<Leaf> leaves = new ArrayList<>();
    private final Map<Node, Integer> firstLeafIndex = new IdentityHashMap<>();
    private int position;

    public TextLeafCursor(Node root) {
        flatten(root);
    }

    private void flatten(Node node) {
        firstLeafIndex.put(node, leaves.size());
        if (node instanceof TextNode textNode) {
            leaves.add(new Leaf(textNode, textNode.getWholeText(), false));
            return;
        }
        if (node instanceof Element element && "br".equals(element.normalName())) {
            leaves.add(new Leaf(element, "", true));
            return;
        }
        for (Node child : node.childNodes()) {
            flatten(child);
        }
    }

    /**
     * Positions the cursor right after {@code node} in document order. For an element
     * this is its first descendant leaf, for a text node the leaf that follows it.
     *
     * @return false if the node is not part of the flattened tree
     */
    public boolean seekAfter(Node node) {
        Integer index = firstLeafIndex.get(node);
        if (index == null) {
            return false;
        }
        position = node instanceof TextNode ? index + 1 : index;
        return true;
    }

    public boolean hasNext() {
        return position < leaves.size();
    }

    public Leaf next() {
        return leaves.get(position++);
    }

    /**
     * Text of all descendant text nodes, each stripped, concatenated without separators.
     */
    public static String strippedText(Node node) {
        StringBuilder builder = new StringBuilder();
        appendStrippedText(node, builder);
        return builder.toString();
    }

    private static void appendStrippedText(Node node, StringBuilder builder) {
        if (node instanceof TextNode textNode) {
            builder.append(TextSupport.strip(textNode.getWholeText()));
            return;
        }
        for (Node child : node.childNodes()) {
            appendStrippedText(child, builder);
        }
    }

    public record Leaf(Node node, String text, boolean lineBreak) {

    }

}
