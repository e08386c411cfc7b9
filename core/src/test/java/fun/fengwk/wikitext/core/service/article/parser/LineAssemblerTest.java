package fun.fengwk.wikitext.core.service.article.parser;

import fun.fengwk.wikitext.core.service.article.parser.block.DefinitionBlock;
import fun.fengwk.wikitext.core.service.article.parser.block.HeadingBlock;
import fun.fengwk.wikitext.core.service.article.parser.block.ListBlock;
import fun.fengwk.wikitext.core.service.article.parser.block.ParagraphBlock;
import fun.fengwk.wikitext.core.service.article.parser.block.TableBlock;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * @author fengwk
 */
public class LineAssemblerTest {

    private final LineAssembler lineAssembler = new LineAssembler();

    @Test
    public void shouldSurroundSectionHeadingsWithOneBlankLine() {
        List<String> lines = lineAssembler.assemble(List.of(
            new ParagraphBlock("導言。", false),
            new HeadingBlock(2, "生平"),
            new ParagraphBlock("內容。", false),
            new HeadingBlock(3, "早年"),
            new ListBlock(false, List.of("• 一", "• 二"))));

        assertThat(lines).containsExactly("導言。", "", "## 生平", "", "內容。", "", "### 早年", "• 一", "• 二");
    }

    @Test
    public void shouldNotAddBlankLineAfterBlankLine() {
        List<String> lines = lineAssembler.assemble(List.of(
            new HeadingBlock(2, "生平"),
            new HeadingBlock(3, "早年")));

        assertThat(lines).containsExactly("## 生平", "", "### 早年");
    }

    @Test
    public void shouldEmitEachHeadingOnce() {
        List<String> lines = lineAssembler.assemble(List.of(
            new HeadingBlock(2, "作品"),
            new ParagraphBlock("甲。", false),
            new HeadingBlock(3, "作品"),
            new ParagraphBlock("乙。", false)));

        assertThat(lines).containsExactly("## 作品", "", "甲。", "乙。");
    }

    @Test
    public void shouldRenderDefinitionTermsAsSubHeadings() {
        List<String> lines = lineAssembler.assemble(List.of(
            new DefinitionBlock(List.of(DefinitionBlock.Entry.term("獎項"), DefinitionBlock.Entry.body("金曲獎"))),
            new TableBlock(List.of("• a | b"))));

        assertThat(lines).containsExactly("### 獎項", "金曲獎", "• a | b");
    }

}
