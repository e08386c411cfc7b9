package fun.fengwk.wikitext.core.service.article.parser;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * @author fengwk
 */
public class InlineTextJoinerTest {

    private final InlineTextJoiner inlineTextJoiner = new InlineTextJoiner(new ListRenderer());

    @Test
    public void shouldSeparateAsciiWords() {
        assertThat(JoinedTextBuilder.join(List.of("Jolin", "Tsai"))).isEqualTo("Jolin Tsai");
    }

    @Test
    public void shouldJoinCjkWithoutSpace() {
        assertThat(JoinedTextBuilder.join(List.of("歌手", "身分"))).isEqualTo("歌手身分");
    }

    @Test
    public void shouldIgnoreEmptyFragments() {
        assertThat(JoinedTextBuilder.join(List.of("Jolin", " ", "", "Tsai"))).isEqualTo("Jolin Tsai");
    }

    @Test
    public void shouldJoinMixedMarkup() {
        Element p = paragraph("<p><a href=\"#\">Jolin</a><b>Tsai</b>是<a href=\"#\">歌手</a>身分</p>");

        assertThat(inlineTextJoiner.join(p)).isEqualTo("Jolin Tsai是歌手身分");
    }

    @Test
    public void shouldKeepPunctuationAttached() {
        Element p = paragraph("<p>Hello <i>world</i>, 2024</p>");

        assertThat(inlineTextJoiner.join(p)).isEqualTo("Hello world, 2024");
    }

    @Test
    public void shouldTurnLineBreakIntoSpace() {
        Element p = paragraph("<p>第一行<br>第二行</p>");

        assertThat(inlineTextJoiner.join(p)).isEqualTo("第一行 第二行");
    }

    @Test
    public void shouldRenderNestedListInline() {
        Element div = Jsoup.parse("<div>成員<ul><li>甲</li><li>乙</li></ul></div>").selectFirst("div");

        assertThat(inlineTextJoiner.join(div)).isEqualTo("成員• 甲 • 乙");
    }

    @Test
    public void shouldReturnEmptyForNull() {
        assertThat(inlineTextJoiner.join(null)).isEmpty();
    }

    private Element paragraph(String html) {
        return Jsoup.parse(html).selectFirst("p");
    }

}
