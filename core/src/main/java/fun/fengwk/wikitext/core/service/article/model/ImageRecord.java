package fun.fengwk.wikitext.core.service.article.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;

/**
 * Description of one infobox image, consumed by an external downloader.
 *
 * @author fengwk
 */
@Data
@Builder
public class ImageRecord {

    /**
     * Title of the article the image belongs to.
     */
    private String title;

    /**
     * Original (non-thumbnail) image URL.
     */
    @JsonProperty("image_url")
    private String imageUrl;

    /**
     * Article URL.
     */
    @JsonProperty("source_url")
    private String sourceUrl;

    /**
     * Local filename the downloader should use.
     */
    @JsonProperty("image_filename")
    private String imageFilename;

    private String caption;

}
