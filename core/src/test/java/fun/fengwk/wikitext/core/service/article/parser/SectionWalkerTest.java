package fun.fengwk.wikitext.core.service.article.parser;

import fun.fengwk.wikitext.core.service.article.parser.block.Block;
import fun.fengwk.wikitext.core.service.article.parser.block.DefinitionBlock;
import fun.fengwk.wikitext.core.service.article.parser.block.HeadingBlock;
import fun.fengwk.wikitext.core.service.article.parser.block.ListBlock;
import fun.fengwk.wikitext.core.service.article.parser.block.ParagraphBlock;
import fun.fengwk.wikitext.core.service.article.parser.block.TableBlock;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * @author fengwk
 */
public class SectionWalkerTest {

    private static final List<String> EXCLUDED = List.of("參考資料", "外部連結");

    private final ListRenderer listRenderer = new ListRenderer();
    private final InlineTextJoiner inlineTextJoiner = new InlineTextJoiner(listRenderer);
    private final SectionWalker sectionWalker = new SectionWalker(
        inlineTextJoiner, listRenderer, new TableFlattener(inlineTextJoiner, listRenderer), new LabelValueRepairer());

    @Test
    public void shouldSkipExcludedSectionUntilNextSection() {
        List<Block> blocks = walk("""
            <h2>參考資料</h2>
            <p>來源一。</p><p>來源二。</p><p>來源三。</p>
            <h3>書籍</h3>
            <ul><li>某書</li></ul>
            <h2>個人生活</h2>
            <p>她喜歡畫畫。</p>""");

        assertThat(blocks).containsExactly(
            new HeadingBlock(2, "個人生活"),
            new ParagraphBlock("她喜歡畫畫。", false));
    }

    @Test
    public void shouldMatchExcludedKeywordAsSubstring() {
        List<Block> blocks = walk("<h2>外部連結與延伸</h2><p>連結。</p>");

        assertThat(blocks).isEmpty();
    }

    @Test
    public void shouldStripCitationMarkersFromHeadings() {
        List<Block> blocks = walk("<h2>早年生活[編輯]</h2><h3>家庭 [1]</h3>");

        assertThat(blocks).containsExactly(new HeadingBlock(2, "早年生活"), new HeadingBlock(3, "家庭"));
    }

    @Test
    public void shouldClassifyPseudoHeadings() {
        List<Block> blocks = walk("<p>早期生涯</p><p>她在1998年參加比賽。</p><p>出生地：臺北</p>");

        assertThat(blocks).containsExactly(
            new ParagraphBlock("早期生涯", true),
            new ParagraphBlock("她在1998年參加比賽。", false),
            new ParagraphBlock("出生地：臺北", false));
    }

    @Test
    public void shouldNotEmitTableContentTwice() {
        List<Block> blocks = walk("""
            <table><tr><td><p>格內段落。</p><ul><li>格內清單</li></ul></td></tr></table>""");

        assertThat(blocks).hasSize(1);
        assertThat(blocks.get(0)).isInstanceOf(TableBlock.class);
        assertThat(((TableBlock) blocks.get(0)).rows()).hasSize(1);
    }

    @Test
    public void shouldSkipInfoboxAndNestedTables() {
        List<Block> blocks = walk("""
            <table class="infobox vcard"><tr><td>資訊</td></tr></table>
            <table><tr><td>外<table><tr><td>內</td></tr></table></td></tr></table>""");

        assertThat(blocks).containsExactly(new TableBlock(List.of("• 外內")));
    }

    @Test
    public void shouldSkipHeadingsInsideMultiColumnTables() {
        List<Block> blocks = walk("""
            <table class="multicol"><tr><td><h3>錄音室專輯</h3><ul><li>A</li></ul></td></tr></table>""");

        assertThat(blocks).containsExactly(new TableBlock(List.of("錄音室專輯", "• A")));
    }

    @Test
    public void shouldEmitListsAndNestedListsSeparately() {
        List<Block> blocks = walk("<ol><li>專輯<ul><li>單曲</li></ul></li></ol>");

        assertThat(blocks).containsExactly(
            new ListBlock(true, List.of("1. 專輯")),
            new ListBlock(false, List.of("• 單曲")));
    }

    @Test
    public void shouldEmitDefinitionTermsAndBodies() {
        List<Block> blocks = walk("<dl><dt>獎項</dt><dd>金曲獎<p>最佳女歌手。</p></dd></dl>");

        assertThat(blocks).containsExactly(new DefinitionBlock(List.of(
            DefinitionBlock.Entry.term("獎項"),
            DefinitionBlock.Entry.body("金曲獎最佳女歌手。"))));
    }

    private List<Block> walk(String html) {
        Element root = Jsoup.parse("<div class=\"mw-parser-output\">" + html + "</div>").selectFirst("div.mw-parser-output");
        return sectionWalker.walk(root, EXCLUDED);
    }

}
