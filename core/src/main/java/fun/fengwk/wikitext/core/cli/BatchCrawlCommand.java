package fun.fengwk.wikitext.core.cli;

import fun.fengwk.wikitext.core.service.batch.BatchCrawlService;
import fun.fengwk.wikitext.core.service.batch.BatchProperties;
import fun.fengwk.wikitext.core.service.batch.model.BatchCrawlRequest;
import fun.fengwk.wikitext.core.service.batch.model.BatchSummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

/**
 * Batch crawl command runner, active when {@code --targets} is given.
 *
 * <pre>
 * --targets=list.txt [--out-dir=out] [--sleep-ms=500] [--force] [--exclude-sections=參考資料,外部連結]
 * </pre>
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BatchCrawlCommand implements ApplicationRunner {

    static final String OPTION_TARGETS = "targets";
    static final String OPTION_OUT_DIR = "out-dir";
    static final String OPTION_SLEEP_MS = "sleep-ms";
    static final String OPTION_FORCE = "force";
    static final String OPTION_EXCLUDE_SECTIONS = "exclude-sections";

    private final BatchCrawlService batchCrawlService;
    private final BatchProperties batchProperties;

    @Override
    public void run(ApplicationArguments args) throws IOException {
        if (!args.containsOption(OPTION_TARGETS)) {
            return;
        }
        String targets = firstValue(args, OPTION_TARGETS);
        if (StringUtils.isBlank(targets) || !Files.exists(Path.of(targets))) {
            log.warn("target path does not exist, targets={}", targets);
            return;
        }
        BatchCrawlRequest request = BatchCrawlRequest.builder()
            .targets(Path.of(targets))
            .outDir(Path.of(StringUtils.defaultIfBlank(firstValue(args, OPTION_OUT_DIR), batchProperties.getOutDir())))
            .sleepMs(resolveSleepMs(args))
            .force(args.containsOption(OPTION_FORCE) || batchProperties.isForce())
            .excludeSections(resolveExcludeSections(args))
            .build();
        BatchSummary summary = batchCrawlService.crawl(request);
        log.info("batch summary, total={}, succeeded={}, skipped={}, failed={}",
            summary.total(), summary.succeeded(), summary.skipped(), summary.failed());
    }

    private long resolveSleepMs(ApplicationArguments args) {
        String value = firstValue(args, OPTION_SLEEP_MS);
        if (StringUtils.isBlank(value)) {
            return batchProperties.getSleepMs();
        }
        try {
            return Math.max(0, Long.parseLong(value.strip()));
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException("invalid --sleep-ms: " + value, ex);
        }
    }

    private List<String> resolveExcludeSections(ApplicationArguments args) {
        String value = firstValue(args, OPTION_EXCLUDE_SECTIONS);
        if (value == null) {
            return null;
        }
        return Arrays.stream(value.split(","))
            .map(String::strip)
            .filter(section -> !section.isEmpty())
            .toList();
    }

    private static String firstValue(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        return values == null || values.isEmpty() ? null : values.get(0);
    }

}
