package fun.fengwk.wikitext.core.service.article.parser;

import fun.fengwk.wikitext.core.service.article.support.TextSupport;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Pattern;

/**
 * Final tidy pass over the article text. Applying it to its own output changes nothing.
 *
 * @author fengwk
 */
@Component
public class TextNormalizer {

    /**
     * Residual math markup, applied in order.
     */
    private static final List<Pattern> MATH_FRAGMENTS = List.of(
        Pattern.compile("\\{\\\\displaystyle[^{}]*(?:\\{[^{}]*\\}[^{}]*)*\\}"),
        Pattern.compile("\\{\\\\[a-zA-Z]+[^}]*\\}"),
        Pattern.compile("\\{\\\\displaystyle.*?(?=\\n|$)"),
        Pattern.compile("\\\\begin\\{[^}]+\\}.*?\\\\end\\{[^}]+\\}", Pattern.DOTALL),
        Pattern.compile("\\\\[a-zA-Z]+\\{[^}]*\\}"),
        Pattern.compile("\\\\[a-zA-Z]+"),
        Pattern.compile("\\{[^{}]*\\}"),
        Pattern.compile("[{}\\\\]+")
    );

    private static final Pattern HORIZONTAL_SPACE = Pattern.compile("[ \\t\\u00A0]+");

    private static final List<Pattern> BRACKET_PAIRS = List.of(
        bracketPair("《", "》"),
        bracketPair("〈", "〉"),
        bracketPair("「", "」"),
        bracketPair("『", "』"),
        bracketPair("（", "）")
    );

    private static final Pattern SPACE_BEFORE_CLOSING = Pattern.compile("\\s+([，。、；：！？》）」』])");

    private static final Pattern FULL_DATE = Pattern.compile("(\\d{1,4})\\s*年\\s*(\\d{1,2})\\s*月\\s*(\\d{1,2})\\s*日");
    private static final Pattern YEAR_MONTH = Pattern.compile("(\\d{1,4})\\s*年\\s*(\\d{1,2})\\s*月");

    private static final Pattern DOUBLE_DASH = Pattern.compile("\\s*——\\s*");
    private static final Pattern SINGLE_DASH = Pattern.compile("\\s*—\\s*");
    private static final Pattern ENUMERATION_COMMA = Pattern.compile("\\s*、\\s*");

    private static final String CJK = "\\u4E00-\\u9FFF\\u3400-\\u4DBF";
    private static final Pattern SPACE_BETWEEN_CJK = Pattern.compile("(?<=[" + CJK + "])[ \\t\\u00A0]+(?=[" + CJK + "])");

    private static final int HEADING_LIKE_MAX_LENGTH = 30;
    private static final String SENTENCE_PUNCTUATION = "。，！？";

    private static final Pattern EXCESS_NEWLINES = Pattern.compile("\\n{3,}");

    public String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String normalized = text;
        for (Pattern pattern : MATH_FRAGMENTS) {
            normalized = pattern.matcher(normalized).replaceAll("");
        }
        normalized = HORIZONTAL_SPACE.matcher(normalized).replaceAll(" ");
        for (Pattern pattern : BRACKET_PAIRS) {
            normalized = pattern.matcher(normalized).replaceAll("$1$2$3");
        }
        normalized = SPACE_BEFORE_CLOSING.matcher(normalized).replaceAll("$1");
        normalized = FULL_DATE.matcher(normalized).replaceAll("$1年$2月$3日");
        normalized = YEAR_MONTH.matcher(normalized).replaceAll("$1年$2月");
        normalized = DOUBLE_DASH.matcher(normalized).replaceAll("——");
        normalized = SINGLE_DASH.matcher(normalized).replaceAll("—");
        normalized = ENUMERATION_COMMA.matcher(normalized).replaceAll("、");
        normalized = joinCjkRuns(normalized);
        return EXCESS_NEWLINES.matcher(normalized).replaceAll("\n\n");
    }

    private String joinCjkRuns(String text) {
        String[] lines = text.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            String stripped = TextSupport.strip(lines[i]);
            if (stripped.isEmpty() || isHeadingLike(stripped)) {
                continue;
            }
            lines[i] = SPACE_BETWEEN_CJK.matcher(stripped).replaceAll("");
        }
        return String.join("\n", lines);
    }

    private boolean isHeadingLike(String line) {
        if (TextSupport.length(line) >= HEADING_LIKE_MAX_LENGTH) {
            return false;
        }
        for (int i = 0; i < line.length(); i++) {
            if (SENTENCE_PUNCTUATION.indexOf(line.charAt(i)) >= 0) {
                return false;
            }
        }
        return true;
    }

    private static Pattern bracketPair(String left, String right) {
        return Pattern.compile("(" + Pattern.quote(left) + ")\\s*(.*?)\\s*(" + Pattern.quote(right) + ")", Pattern.DOTALL);
    }

}
