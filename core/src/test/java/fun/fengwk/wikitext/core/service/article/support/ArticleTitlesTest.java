package fun.fengwk.wikitext.core.service.article.support;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * @author fengwk
 */
public class ArticleTitlesTest {

    @Test
    public void shouldDecodeTitleFromUrl() {
        assertThat(ArticleTitles.fromUrl("https://zh.wikipedia.org/wiki/%E8%94%A1%E4%BE%9D%E6%9E%97")).isEqualTo("蔡依林");
        assertThat(ArticleTitles.fromUrl(" https://zh.wikipedia.org/zh-tw/C%2B%2B ")).isEqualTo("C++");
        assertThat(ArticleTitles.fromUrl("https://zh.wikipedia.org/wiki/A_B?action=view")).isEqualTo("A_B");
    }

    @Test
    public void shouldReplaceUnsafeFilenameCharacters() {
        assertThat(ArticleTitles.safeFilename("a\\b/c*d?e:f\"g<h>i|j")).isEqualTo("a_b_c_d_e_f_g_h_i_j");
        assertThat(ArticleTitles.safeFilename("甲".repeat(250))).hasSize(200);
    }

}
