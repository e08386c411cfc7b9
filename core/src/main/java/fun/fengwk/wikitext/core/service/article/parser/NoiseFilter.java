package fun.fengwk.wikitext.core.service.article.parser;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Detaches non-content subtrees from a parsed article in place.
 *
 * @author fengwk
 */
@Component
public class NoiseFilter {

    private static final List<String> NOISE_SELECTORS = List.of(
        "style",
        "script",
        "noscript",
        "sup.reference",
        "span.mw-editsection",
        ".mw-editsection",
        "table.infobox",
        "div.infobox",
        ".infobox",
        "table.navbox",
        "div.navbox",
        ".vertical-navbox",
        "div.reflist",
        "ol.references",
        ".mw-references-wrap",
        "div.metadata",
        "div.ambox",
        "table.ambox",
        "div.mbox-small",
        "div.messagebox",
        "div.hatnote",
        "div.dablink",
        "div.rellink",
        ".shortdescription",
        "table.sidebar",
        "div.sidebar",
        ".sidebar",
        "#toc",
        ".toc",
        ".catlinks",
        ".mw-authority-control",
        ".printfooter"
    );

    private static final String COLLAPSIBLE_SELECTOR = "div.mw-collapsible";
    private static final String NAVIGATION_CLASS = "navbox";

    public void clean(Document document) {
        for (String selector : NOISE_SELECTORS) {
            document.select(selector).remove();
        }
        for (Element collapsible : document.select(COLLAPSIBLE_SELECTOR)) {
            if (collapsible.hasClass(NAVIGATION_CLASS) || hasAncestor(collapsible, "div", NAVIGATION_CLASS)) {
                collapsible.remove();
            } else if (hasAncestor(collapsible, "table", null)) {
                // collapsed content tables such as track listings stay, expanded
                collapsible.removeClass("mw-collapsed").removeClass("mw-collapsible");
            }
        }
    }

    private boolean hasAncestor(Element element, String tagName, String className) {
        for (Element parent = element.parent(); parent != null; parent = parent.parent()) {
            if (tagName.equals(parent.normalName()) && (className == null || parent.hasClass(className))) {
                return true;
            }
        }
        return false;
    }

}
