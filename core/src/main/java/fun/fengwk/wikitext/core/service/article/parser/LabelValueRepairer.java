package fun.fengwk.wikitext.core.service.article.parser;

import fun.fengwk.wikitext.core.service.article.support.TextSupport;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;

/**
 * Restores values of {@code <label>：} pairs that were lost while flattening a block.
 *
 * <p>Typical source markup is {@code <a>學名</a>：<i>Oncorhynchus masou formosanus</i>},
 * where the value sits in markup that the flattened text dropped. Local strategies scan
 * the block's tree; {@link #repairWithLangLinks} is the document-level last resort.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class LabelValueRepairer {

    static final int MAX_VALUE_LENGTH = 120;

    private final LabelVocabulary vocabulary;
    private final List<LabelValueStrategy> localStrategies;

    public LabelValueRepairer() {
        this(LabelVocabulary.DEFAULT);
    }

    public LabelValueRepairer(LabelVocabulary vocabulary) {
        this.vocabulary = vocabulary;
        this.localStrategies = List.of(this::collectAfterLabel, this::collectAfterMarker);
    }

    /**
     * Fills every value-less label in {@code text} from the tree of {@code block}.
     * Labels that cannot be resolved are left as they are.
     */
    public String repair(Element block, String text) {
        Matcher matcher = vocabulary.missingValuePattern().matcher(text);
        return matcher.replaceAll(match -> {
            String label = match.group(1);
            for (LabelValueStrategy strategy : localStrategies) {
                Optional<String> value = strategy.resolve(block, label);
                if (value.isPresent()) {
                    return Matcher.quoteReplacement(label + "：" + value.get());
                }
            }
            log.debug("label value not found in block, label={}", label);
            return Matcher.quoteReplacement(match.group());
        });
    }

    /**
     * Fills remaining value-less language labels with the article title in that language.
     *
     * @param langLinkLookup language code to the interlanguage title, empty when unknown
     */
    public String repairWithLangLinks(String text, Function<String, Optional<String>> langLinkLookup) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        Map<String, Optional<String>> resolved = new HashMap<>();
        Matcher matcher = vocabulary.missingValuePattern().matcher(text);
        return matcher.replaceAll(match -> {
            String label = match.group(1);
            Optional<String> name = vocabulary.languageCode(label)
                .flatMap(code -> resolved.computeIfAbsent(code, langLinkLookup));
            return Matcher.quoteReplacement(name.map(value -> label + "：" + value).orElse(match.group()));
        });
    }

    /**
     * Finds a node whose whole text is the label, skips to the first colon after it and
     * collects text up to a stop character or a line break.
     */
    Optional<String> collectAfterLabel(Element block, String label) {
        Node anchor = findLabelAnchor(block, label);
        if (anchor == null) {
            return Optional.empty();
        }
        TextLeafCursor cursor = new TextLeafCursor(block.root());
        if (!cursor.seekAfter(anchor)) {
            return Optional.empty();
        }

        List<String> parts = new ArrayList<>();
        boolean sawColon = false;
        while (cursor.hasNext()) {
            TextLeafCursor.Leaf leaf = cursor.next();
            if (leaf.lineBreak()) {
                break;
            }
            String text = leaf.text();
            if (!sawColon) {
                int colon = text.indexOf('：');
                if (colon < 0) {
                    colon = text.indexOf(':');
                }
                if (colon < 0) {
                    continue;
                }
                text = text.substring(colon + 1);
                sawColon = true;
            }
            Chunk chunk = cutAtStop(text);
            if (!chunk.text().isEmpty()) {
                parts.add(chunk.text());
            }
            if (chunk.stopped() || totalLength(parts) > MAX_VALUE_LENGTH * 2) {
                break;
            }
        }
        return toValue(parts);
    }

    /**
     * Fallback when label and colon share one text node: takes the rest of the first text
     * node containing {@code "<label>："} plus the following text, up to a stop character.
     */
    Optional<String> collectAfterMarker(Element block, String label) {
        String marker = label + "：";
        TextNode needle = findTextContaining(block, marker);
        if (needle == null) {
            return Optional.empty();
        }

        List<String> parts = new ArrayList<>();
        String text = needle.getWholeText();
        String tail = text.substring(text.indexOf(marker) + marker.length());
        Chunk first = cutAtStop(tail);
        if (!first.text().isEmpty()) {
            parts.add(first.text());
        }
        if (first.stopped()) {
            return toValue(parts);
        }

        TextLeafCursor cursor = new TextLeafCursor(block.root());
        if (cursor.seekAfter(needle)) {
            while (cursor.hasNext()) {
                TextLeafCursor.Leaf leaf = cursor.next();
                if (leaf.lineBreak()) {
                    continue;
                }
                Chunk chunk = cutAtStop(leaf.text());
                if (!chunk.text().isEmpty()) {
                    parts.add(chunk.text());
                }
                if (chunk.stopped() || totalLength(parts) > MAX_VALUE_LENGTH * 3 / 2) {
                    break;
                }
            }
        }
        return toValue(parts);
    }

    private Node findLabelAnchor(Element block, String label) {
        for (Node child : block.childNodes()) {
            Node anchor = findLabelAnchorIn(child, label);
            if (anchor != null) {
                return anchor;
            }
        }
        return null;
    }

    private Node findLabelAnchorIn(Node node, String label) {
        if (node instanceof TextNode textNode) {
            return TextSupport.strip(textNode.getWholeText()).equals(label) ? textNode : null;
        }
        if (!(node instanceof Element)) {
            return null;
        }
        if (TextLeafCursor.strippedText(node).equals(label)) {
            return node;
        }
        for (Node child : node.childNodes()) {
            Node anchor = findLabelAnchorIn(child, label);
            if (anchor != null) {
                return anchor;
            }
        }
        return null;
    }

    private TextNode findTextContaining(Node node, String marker) {
        for (Node child : node.childNodes()) {
            if (child instanceof TextNode textNode) {
                if (textNode.getWholeText().contains(marker)) {
                    return textNode;
                }
            } else {
                TextNode found = findTextContaining(child, marker);
                if (found != null) {
                    return found;
                }
            }
        }
        return null;
    }

    private Chunk cutAtStop(String value) {
        String text = TextSupport.strip(value);
        for (int i = 0; i < text.length(); i++) {
            if (LabelVocabulary.isStopCharacter(text.charAt(i))) {
                return new Chunk(text.substring(0, i), true);
            }
        }
        return new Chunk(text, false);
    }

    private int totalLength(List<String> parts) {
        int length = 0;
        for (String part : parts) {
            length += part.length();
        }
        return length;
    }

    private Optional<String> toValue(List<String> parts) {
        String value = TextSupport.strip(String.join(" ", parts));
        if (value.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(value.length() > MAX_VALUE_LENGTH ? value.substring(0, MAX_VALUE_LENGTH) : value);
    }

    @FunctionalInterface
    interface LabelValueStrategy {

        Optional<String> resolve(Element block, String label);

    }

    private record Chunk(String text, boolean stopped) {

    }

}
