package fun.fengwk.wikitext.core.cli;

import fun.fengwk.wikitext.core.service.batch.BatchCrawlService;
import fun.fengwk.wikitext.core.service.batch.BatchProperties;
import fun.fengwk.wikitext.core.service.batch.model.BatchCrawlRequest;
import fun.fengwk.wikitext.core.service.batch.model.BatchSummary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * @author fengwk
 */
@ExtendWith(MockitoExtension.class)
public class BatchCrawlCommandTest {

    @TempDir
    Path tempDir;

    @Mock
    private BatchCrawlService batchCrawlService;

    private BatchCrawlCommand command;

    @BeforeEach
    void setUp() {
        command = new BatchCrawlCommand(batchCrawlService, new BatchProperties());
    }

    @Test
    public void shouldRunBatchWithOptions() throws Exception {
        Path targets = Files.writeString(tempDir.resolve("list.txt"), "蔡依林\n");
        when(batchCrawlService.crawl(any())).thenReturn(new BatchSummary(1, 0, 0));

        command.run(new DefaultApplicationArguments(
            "--targets=" + targets,
            "--out-dir=" + tempDir.resolve("result"),
            "--sleep-ms=10",
            "--force",
            "--exclude-sections=參考資料, 外部連結,"));

        ArgumentCaptor<BatchCrawlRequest> captor = ArgumentCaptor.forClass(BatchCrawlRequest.class);
        verify(batchCrawlService).crawl(captor.capture());
        BatchCrawlRequest request = captor.getValue();
        assertThat(request.getTargets()).isEqualTo(targets);
        assertThat(request.getOutDir()).isEqualTo(tempDir.resolve("result"));
        assertThat(request.getSleepMs()).isEqualTo(10);
        assertThat(request.isForce()).isTrue();
        assertThat(request.getExcludeSections()).containsExactly("參考資料", "外部連結");
    }

    @Test
    public void shouldUseConfiguredDefaults() throws Exception {
        Path targets = Files.writeString(tempDir.resolve("list.txt"), "蔡依林\n");
        when(batchCrawlService.crawl(any())).thenReturn(new BatchSummary(0, 1, 0));

        command.run(new DefaultApplicationArguments("--targets=" + targets));

        ArgumentCaptor<BatchCrawlRequest> captor = ArgumentCaptor.forClass(BatchCrawlRequest.class);
        verify(batchCrawlService).crawl(captor.capture());
        assertThat(captor.getValue().getOutDir()).isEqualTo(Path.of("out"));
        assertThat(captor.getValue().getSleepMs()).isEqualTo(500);
        assertThat(captor.getValue().isForce()).isFalse();
        assertThat(captor.getValue().getExcludeSections()).isNull();
    }

    @Test
    public void shouldIgnoreMissingTargets() throws Exception {
        command.run(new DefaultApplicationArguments());
        command.run(new DefaultApplicationArguments("--targets=" + tempDir.resolve("missing.txt")));

        verifyNoInteractions(batchCrawlService);
    }

    @Test
    public void shouldRejectInvalidSleep() throws Exception {
        Path targets = Files.writeString(tempDir.resolve("list.txt"), "蔡依林\n");

        assertThatThrownBy(() -> command.run(new DefaultApplicationArguments("--targets=" + targets, "--sleep-ms=abc")))
            .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(batchCrawlService);
    }

}
