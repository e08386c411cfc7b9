package fun.fengwk.wikitext.core.service.article.parser;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * @author fengwk
 */
public class LabelValueRepairerTest {

    private final LabelValueRepairer labelValueRepairer = new LabelValueRepairer();

    @Test
    public void shouldRestoreValueAfterLabelAnchor() {
        Element p = paragraph("<p><a href=\"#\">學名</a>：<i>Oncorhynchus masou formosanus</i>，台灣特有亞種</p>");

        String repaired = labelValueRepairer.repair(p, "學名：，台灣特有亞種");

        assertThat(repaired).isEqualTo("學名：Oncorhynchus masou formosanus，台灣特有亞種");
    }

    @Test
    public void shouldJoinValuePartsAcrossNodes() {
        Element p = paragraph("<p>（<span>英語</span>：<i>Jolin</i> <i>Tsai</i>）</p>");

        Optional<String> value = labelValueRepairer.collectAfterLabel(p, "英語");

        assertThat(value).contains("Jolin Tsai");
    }

    @Test
    public void shouldStopAtLineBreak() {
        Element p = paragraph("<p><b>本名</b>：蔡依林<br>出生：臺北</p>");

        assertThat(labelValueRepairer.collectAfterLabel(p, "本名")).contains("蔡依林");
    }

    @Test
    public void shouldRestoreValueFromMarkerText() {
        Element p = paragraph("<p>英語：Jolin Tsai，台灣歌手</p>");

        String repaired = labelValueRepairer.repair(p, "英語：，台灣歌手");

        assertThat(repaired).isEqualTo("英語：Jolin Tsai，台灣歌手");
    }

    @Test
    public void shouldLeaveUnresolvedLabelUntouched() {
        Element p = paragraph("<p>日語：，歌手</p>");

        assertThat(labelValueRepairer.repair(p, "日語：，歌手")).isEqualTo("日語：，歌手");
    }

    @Test
    public void shouldIgnoreLabelsWithValues() {
        Element p = paragraph("<p>英語：Jolin Tsai，歌手</p>");

        assertThat(labelValueRepairer.repair(p, "英語：Jolin Tsai，歌手")).isEqualTo("英語：Jolin Tsai，歌手");
    }

    @Test
    public void shouldTruncateLongValues() {
        String longValue = "a".repeat(200);
        Element p = paragraph("<p>英語：" + longValue + "，歌手</p>");

        assertThat(labelValueRepairer.collectAfterMarker(p, "英語"))
            .hasValueSatisfying(value -> assertThat(value).hasSize(LabelValueRepairer.MAX_VALUE_LENGTH));
    }

    @Test
    public void shouldFillLanguageLabelsFromLangLinksOncePerLanguage() {
        List<String> lookups = new ArrayList<>();
        Function<String, Optional<String>> lookup = code -> {
            lookups.add(code);
            return "en".equals(code) ? Optional.of("Jolin Tsai") : Optional.empty();
        };

        String repaired = labelValueRepairer.repairWithLangLinks(
            "蔡依林（英語：，1980年）。英文：，本名：，日語：）", lookup);

        assertThat(repaired).isEqualTo("蔡依林（英語：Jolin Tsai，1980年）。英文：Jolin Tsai，本名：，日語：）");
        assertThat(lookups).containsExactly("en", "ja");
    }

    private Element paragraph(String html) {
        return Jsoup.parse(html).selectFirst("p");
    }

}
