package fun.fengwk.wikitext.core.service.batch.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One line of {@code all_data.jsonl}.
 *
 * @author fengwk
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ArticleRecord {

    private String title;

    @JsonProperty("original_query")
    private String originalQuery;

    @JsonProperty("source_url")
    private String sourceUrl;

    private String variant;

    @JsonProperty("text_length")
    private int textLength;

    private String text;

    /**
     * Text file path relative to the output directory.
     */
    @JsonProperty("out_file")
    private String outFile;

    @JsonProperty("source_file")
    private String sourceFile;

    @JsonProperty("redirected_from")
    private String redirectedFrom;

    @JsonProperty("redirected_to")
    private String redirectedTo;

    @JsonProperty("images_count")
    private Integer imagesCount;

    private List<ImageRef> images;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ImageRef {

        private String filename;
        private String caption;

    }

}
