package fun.fengwk.wikitext.core.service.article;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Article conversion configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "wikitext.article")
public class ArticleProperties {

    /**
     * Level-2 heading keywords whose sections are dropped, matched as substrings.
     */
    private List<String> excludeSections = new ArrayList<>(List.of(
        "引用資料", "參考書目", "相關學術研究書目", "參考", "參考來源", "參考資料", "外部連結", "相關條目",
        "擴展閱讀", "延伸閱讀", "參見", "參考文獻", "腳註", "註釋", "註解", "注解", "備註", "關聯項目",
        "資料來源", "注釋", "註腳", "注腳", "關連項目", "備注"
    ));

    /**
     * Collect infobox image records.
     */
    private boolean extractImages = true;

}
