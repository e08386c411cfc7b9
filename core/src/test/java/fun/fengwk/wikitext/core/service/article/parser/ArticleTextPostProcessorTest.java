package fun.fengwk.wikitext.core.service.article.parser;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * @author fengwk
 */
public class ArticleTextPostProcessorTest {

    private final ArticleTextPostProcessor postProcessor = new ArticleTextPostProcessor();

    @Test
    public void shouldCollapseRepeatedHeadings() {
        String text = "## 生平\n\n## 生平\n內容\n## 生平";

        assertThat(postProcessor.process(text)).isEqualTo("## 生平\n\n內容\n## 生平");
    }

    @Test
    public void shouldSeparateConcatenatedHeadings() {
        assertThat(postProcessor.process("個人生活感情狀況")).isEqualTo("個人生活\n\n感情狀況");
    }

    @Test
    public void shouldRemoveArchiveNotes() {
        String text = "官方網站（頁面存檔備份，存於網際網路檔案館）與 ( 頁面存檔備份，存於網際網路檔案館 ) 連結";

        assertThat(postProcessor.process(text)).isEqualTo("官方網站與 連結");
    }

    @Test
    public void shouldCollapseBlankLinesAndSpaces() {
        assertThat(postProcessor.process("a\n\n\n\nb  c")).isEqualTo("a\n\nb c");
    }

    @Test
    public void shouldReturnEmptyForNull() {
        assertThat(postProcessor.process(null)).isEmpty();
    }

}
