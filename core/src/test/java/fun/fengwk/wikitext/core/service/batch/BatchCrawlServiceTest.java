package fun.fengwk.wikitext.core.service.batch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fun.fengwk.wikitext.core.facade.wiki.mediawiki.MediaWikiProperties;
import fun.fengwk.wikitext.core.service.article.ArticleTextService;
import fun.fengwk.wikitext.core.service.article.model.ArticleRequest;
import fun.fengwk.wikitext.core.service.article.model.ArticleResponse;
import fun.fengwk.wikitext.core.service.article.model.ImageRecord;
import fun.fengwk.wikitext.core.service.batch.model.BatchCrawlRequest;
import fun.fengwk.wikitext.core.service.batch.model.BatchSummary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * @author fengwk
 */
@ExtendWith(MockitoExtension.class)
public class BatchCrawlServiceTest {

    @TempDir
    Path tempDir;

    @Mock
    private ArticleTextService articleTextService;

    private final ObjectMapper objectMapper = new ObjectMapper();

    private BatchCrawlService batchCrawlService;

    @BeforeEach
    void setUp() {
        batchCrawlService = new BatchCrawlService(
            new TargetListReader(objectMapper), articleTextService, new MediaWikiProperties(), objectMapper);
    }

    @Test
    public void shouldWriteArticleOutputs() throws Exception {
        Path targets = writeTargets("蔡依林\n");
        when(articleTextService.convert(any())).thenReturn(ArticleResponse.builder()
            .statusCode(200)
            .requestedTitle("蔡依林")
            .title("蔡依林")
            .sourceUrl("https://zh.wikipedia.org/wiki/x")
            .text("蔡依林是臺灣女歌手。")
            .images(List.of(ImageRecord.builder().title("蔡依林").imageFilename("abc.jpg").caption("蔡依林").build()))
            .build());

        BatchSummary summary = batchCrawlService.crawl(request(targets, false));

        assertThat(summary).isEqualTo(new BatchSummary(1, 0, 0));
        Path outDir = tempDir.resolve("out");
        assertThat(Files.readString(outDir.resolve("txt/蔡依林.txt"), StandardCharsets.UTF_8)).isEqualTo("蔡依林是臺灣女歌手。");
        assertThat(Files.exists(outDir.resolve(BatchOutputStore.IMAGES_INFO))).isTrue();

        JsonNode record = objectMapper.readTree(Files.readString(outDir.resolve(BatchOutputStore.ALL_DATA), StandardCharsets.UTF_8));
        assertThat(record.path("title").asText()).isEqualTo("蔡依林");
        assertThat(record.path("original_query").asText()).isEqualTo("蔡依林");
        assertThat(record.path("variant").asText()).isEqualTo("zh-tw");
        assertThat(record.path("text_length").asInt()).isEqualTo(10);
        assertThat(record.path("out_file").asText()).isEqualTo("txt/蔡依林.txt");
        assertThat(record.path("images_count").asInt()).isEqualTo(1);
        assertThat(record.path("images").get(0).path("filename").asText()).isEqualTo("abc.jpg");
        assertThat(record.has("redirected_from")).isFalse();
    }

    @Test
    public void shouldRecordRedirect() throws Exception {
        Path targets = writeTargets("https://zh.wikipedia.org/wiki/Jolin\n");
        when(articleTextService.convert(any())).thenReturn(ArticleResponse.builder()
            .statusCode(200)
            .requestedTitle("Jolin")
            .title("蔡依林")
            .redirectedFrom("Jolin")
            .text("正文。")
            .build());

        batchCrawlService.crawl(request(targets, false));

        ArgumentCaptor<ArticleRequest> captor = ArgumentCaptor.forClass(ArticleRequest.class);
        verify(articleTextService).convert(captor.capture());
        assertThat(captor.getValue().getTitle()).isEqualTo("Jolin");
        assertThat(captor.getValue().getUrl()).isEqualTo("https://zh.wikipedia.org/wiki/Jolin");

        JsonNode record = objectMapper.readTree(Files.readString(
            tempDir.resolve("out").resolve(BatchOutputStore.ALL_DATA), StandardCharsets.UTF_8));
        assertThat(record.path("redirected_from").asText()).isEqualTo("Jolin");
        assertThat(record.path("redirected_to").asText()).isEqualTo("蔡依林");
        assertThat(record.has("images_count")).isFalse();
    }

    @Test
    public void shouldSkipExistingOutputUnlessForced() throws Exception {
        Path targets = writeTargets("蔡依林\n");
        Path txt = tempDir.resolve("out/txt/蔡依林.txt");
        Files.createDirectories(txt.getParent());
        Files.writeString(txt, "舊", StandardCharsets.UTF_8);

        BatchSummary summary = batchCrawlService.crawl(request(targets, false));

        assertThat(summary).isEqualTo(new BatchSummary(0, 1, 0));
        verify(articleTextService, never()).convert(any());
    }

    @Test
    public void shouldOverwriteWhenForced() throws Exception {
        Path targets = writeTargets("蔡依林\n");
        Path txt = tempDir.resolve("out/txt/蔡依林.txt");
        Files.createDirectories(txt.getParent());
        Files.writeString(txt, "舊", StandardCharsets.UTF_8);
        when(articleTextService.convert(any())).thenReturn(ArticleResponse.builder()
            .statusCode(200).requestedTitle("蔡依林").title("蔡依林").text("新").build());

        BatchSummary summary = batchCrawlService.crawl(request(targets, true));

        assertThat(summary.succeeded()).isEqualTo(1);
        assertThat(Files.readString(txt, StandardCharsets.UTF_8)).isEqualTo("新");
    }

    @Test
    public void shouldRecordFailureAndContinue() throws Exception {
        Path targets = writeTargets("不存在\n蔡依林\n");
        when(articleTextService.convert(any())).thenAnswer(invocation -> {
            ArticleRequest request = invocation.getArgument(0);
            if ("不存在".equals(request.getTitle())) {
                return ArticleResponse.builder().statusCode(502).requestedTitle("不存在").error("fetch failed").build();
            }
            return ArticleResponse.builder().statusCode(200).requestedTitle("蔡依林").title("蔡依林").text("正文。").build();
        });

        BatchSummary summary = batchCrawlService.crawl(request(targets, false));

        assertThat(summary).isEqualTo(new BatchSummary(1, 0, 1));
        assertThat(summary.total()).isEqualTo(2);
        JsonNode failure = objectMapper.readTree(Files.readString(
            tempDir.resolve("out").resolve(BatchOutputStore.FAILURES), StandardCharsets.UTF_8));
        assertThat(failure.path("raw").asText()).isEqualTo("不存在");
        assertThat(failure.path("kind").asText()).isEqualTo("title");
        assertThat(failure.path("error").asText()).isEqualTo("fetch failed");
    }

    private Path writeTargets(String content) throws Exception {
        Path file = tempDir.resolve("targets.txt");
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }

    private BatchCrawlRequest request(Path targets, boolean force) {
        return BatchCrawlRequest.builder()
            .targets(targets)
            .outDir(tempDir.resolve("out"))
            .force(force)
            .sleepMs(0)
            .build();
    }

}
