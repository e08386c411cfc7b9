package fun.fengwk.wikitext.core.service.batch.model;

import lombok.Builder;
import lombok.Data;

import java.nio.file.Path;
import java.util.List;

/**
 * @author fengwk
 */
@Data
@Builder
public class BatchCrawlRequest {

    /**
     * Target list file or directory of list files.
     */
    private Path targets;

    private Path outDir;

    /**
     * Re-convert articles whose text file already exists.
     */
    private boolean force;

    /**
     * Pause between two articles in milliseconds.
     */
    private long sleepMs;

    /**
     * Excluded section keywords, configured defaults when null.
     */
    private List<String> excludeSections;

}
