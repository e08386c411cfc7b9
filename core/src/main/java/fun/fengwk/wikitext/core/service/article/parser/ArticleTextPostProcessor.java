package fun.fengwk.wikitext.core.service.article.parser;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Cleans assembled article text before normalization.
 *
 * @author fengwk
 */
@Component
public class ArticleTextPostProcessor {

    /**
     * Headings that some templates render glued together.
     */
    private static final List<HeadingPair> CONCATENATED_HEADINGS = List.of(
        new HeadingPair("影音作品", "其他音樂錄影帶"),
        new HeadingPair("個人生活", "感情狀況"),
        new HeadingPair("演藝經歷", "音樂作品"),
        new HeadingPair("作品列表", "音樂作品"),
        new HeadingPair("獲獎記錄", "個人榮譽")
    );

    private static final List<Pattern> ARCHIVE_NOTES = List.of(
        Pattern.compile("（\\s*頁面存檔備份\\s*，\\s*存於\\s*網際網路檔案館\\s*）"),
        Pattern.compile("\\(\\s*頁面存檔備份\\s*，\\s*存於\\s*網際網路檔案館\\s*\\)")
    );

    private static final Pattern EXCESS_BLANK_LINES = Pattern.compile("\\n\\s*\\n\\s*\\n");
    private static final Pattern SPACE_RUNS = Pattern.compile(" +");

    public String process(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String processed = removeDuplicateHeadings(text);
        processed = separateConcatenatedHeadings(processed);
        return removeArchiveNotes(processed);
    }

    /**
     * Collapses runs of the same heading. Any non-blank, non-heading line ends a run.
     */
    String removeDuplicateHeadings(String text) {
        StringBuilder builder = new StringBuilder();
        String lastHeading = null;
        boolean first = true;
        for (String line : text.split("\n", -1)) {
            String stripped = line.strip();
            if (stripped.startsWith("##")) {
                String normalized = LineAssembler.normalizeHeading(stripped);
                if (Objects.equals(normalized, lastHeading)) {
                    continue;
                }
                lastHeading = normalized;
            } else if (!stripped.isEmpty()) {
                lastHeading = null;
            }
            if (!first) {
                builder.append('\n');
            }
            builder.append(line);
            first = false;
        }
        return builder.toString();
    }

    String separateConcatenatedHeadings(String text) {
        String separated = text;
        for (HeadingPair pair : CONCATENATED_HEADINGS) {
            separated = separated.replace(pair.first() + pair.second(), pair.first() + "\n\n" + pair.second());
        }
        return separated;
    }

    String removeArchiveNotes(String text) {
        String cleaned = text;
        for (Pattern pattern : ARCHIVE_NOTES) {
            cleaned = pattern.matcher(cleaned).replaceAll("");
        }
        cleaned = EXCESS_BLANK_LINES.matcher(cleaned).replaceAll("\n\n");
        return SPACE_RUNS.matcher(cleaned).replaceAll(" ");
    }

    private record HeadingPair(String first, String second) {

    }

}
