package fun.fengwk.wikitext.core.service.batch;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Batch crawler defaults, overridable from the command line.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "wikitext.batch")
public class BatchProperties {

    private String outDir = "out";

    /**
     * Pause between two articles in milliseconds.
     */
    private long sleepMs = 500;

    private boolean force = false;

}
