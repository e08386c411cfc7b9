package fun.fengwk.wikitext.core.service.batch;

import com.fasterxml.jackson.databind.ObjectMapper;
import fun.fengwk.wikitext.core.facade.wiki.mediawiki.MediaWikiProperties;
import fun.fengwk.wikitext.core.service.article.ArticleTextService;
import fun.fengwk.wikitext.core.service.article.model.ArticleRequest;
import fun.fengwk.wikitext.core.service.article.model.ArticleResponse;
import fun.fengwk.wikitext.core.service.article.model.ImageRecord;
import fun.fengwk.wikitext.core.service.article.support.ArticleTitles;
import fun.fengwk.wikitext.core.service.batch.model.ArticleRecord;
import fun.fengwk.wikitext.core.service.batch.model.ArticleTarget;
import fun.fengwk.wikitext.core.service.batch.model.BatchCrawlRequest;
import fun.fengwk.wikitext.core.service.batch.model.BatchSummary;
import fun.fengwk.wikitext.core.service.batch.model.TargetKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Converts every article of a target list and writes the results to an output directory.
 * Articles are processed one after another with a pause in between.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BatchCrawlService {

    private final TargetListReader targetListReader;
    private final ArticleTextService articleTextService;
    private final MediaWikiProperties mediaWikiProperties;
    private final ObjectMapper objectMapper;

    public BatchSummary crawl(BatchCrawlRequest request) throws IOException {
        List<ArticleTarget> targets = targetListReader.read(request.getTargets());
        BatchOutputStore store = new BatchOutputStore(request.getOutDir(), objectMapper);
        log.info("batch started, targets={}, total={}, outDir={}", request.getTargets(), targets.size(), request.getOutDir());

        int succeeded = 0;
        int skipped = 0;
        int failed = 0;
        for (int i = 0; i < targets.size(); i++) {
            ArticleTarget target = targets.get(i);
            String progress = (i + 1) + "/" + targets.size();
            try {
                Outcome outcome = crawlOne(target, request, store);
                switch (outcome) {
                    case SUCCEEDED -> {
                        succeeded++;
                        log.info("[{}] converted, target={}", progress, target.raw());
                    }
                    case SKIPPED -> {
                        skipped++;
                        log.info("[{}] skipped, output exists, target={}", progress, target.raw());
                    }
                    default -> failed++;
                }
            } catch (IOException ex) {
                failed++;
                log.warn("[{}] output write failed, target={}, error={}", progress, target.raw(), ex.getMessage());
                recordFailure(store, target, ex.getMessage());
            }
            if (i + 1 < targets.size() && !pause(request.getSleepMs())) {
                log.warn("batch interrupted, processed={}", i + 1);
                break;
            }
        }

        BatchSummary summary = new BatchSummary(succeeded, skipped, failed);
        log.info("batch finished, succeeded={}, skipped={}, failed={}, outDir={}",
            summary.succeeded(), summary.skipped(), summary.failed(), request.getOutDir().toAbsolutePath());
        return summary;
    }

    private Outcome crawlOne(ArticleTarget target, BatchCrawlRequest request, BatchOutputStore store) throws IOException {
        boolean isUrl = target.kind() == TargetKind.URL;
        String title = isUrl ? ArticleTitles.fromUrl(target.raw()) : target.raw();
        if (!request.isForce() && store.hasText(title)) {
            return Outcome.SKIPPED;
        }

        ArticleResponse response = articleTextService.convert(ArticleRequest.builder()
            .title(title)
            .url(isUrl ? target.raw() : null)
            .excludeSections(request.getExcludeSections())
            .build());
        if (response.getStatusCode() != 200) {
            log.warn("article failed, target={}, status={}, error={}", target.raw(), response.getStatusCode(), response.getError());
            recordFailure(store, target, response.getError());
            return Outcome.FAILED;
        }

        String finalTitle = response.getTitle();
        if (!request.isForce() && store.hasText(finalTitle)) {
            return Outcome.SKIPPED;
        }

        String outFile = store.writeText(finalTitle, response.getText());
        store.appendImages(response.getImages());
        store.saveRecord(toRecord(response, target, outFile), request.isForce());
        return Outcome.SUCCEEDED;
    }

    private ArticleRecord toRecord(ArticleResponse response, ArticleTarget target, String outFile) {
        List<ImageRecord> images = response.getImages();
        boolean redirected = response.getRedirectedFrom() != null;
        return ArticleRecord.builder()
            .title(response.getTitle())
            .originalQuery(response.getRequestedTitle())
            .sourceUrl(response.getSourceUrl())
            .variant(mediaWikiProperties.getVariant())
            .textLength(response.getText().codePointCount(0, response.getText().length()))
            .text(response.getText())
            .outFile(outFile)
            .sourceFile(target.sourceFile())
            .redirectedFrom(redirected ? response.getRedirectedFrom() : null)
            .redirectedTo(redirected ? response.getTitle() : null)
            .imagesCount(images == null || images.isEmpty() ? null : images.size())
            .images(images == null || images.isEmpty() ? null : images.stream()
                .map(image -> new ArticleRecord.ImageRef(image.getImageFilename(), image.getCaption()))
                .toList())
            .build();
    }

    private void recordFailure(BatchOutputStore store, ArticleTarget target, String error) {
        Map<String, String> failure = new LinkedHashMap<>();
        failure.put("raw", target.raw());
        failure.put("kind", target.kind().value());
        failure.put("source_file", target.sourceFile());
        failure.put("error", error == null ? "" : error);
        try {
            store.appendFailure(failure);
        } catch (IOException ex) {
            log.warn("failure record write failed, target={}, error={}", target.raw(), ex.getMessage());
        }
    }

    private boolean pause(long sleepMs) {
        if (sleepMs <= 0) {
            return true;
        }
        try {
            Thread.sleep(sleepMs);
            return true;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private enum Outcome {
        SUCCEEDED,
        SKIPPED,
        FAILED
    }

}
