package fun.fengwk.wikitext.core.service.batch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fun.fengwk.wikitext.core.service.article.model.ImageRecord;
import fun.fengwk.wikitext.core.service.article.support.ArticleTitles;
import fun.fengwk.wikitext.core.service.batch.model.ArticleRecord;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Output directory of a batch run.
 *
 * <pre>
 * txt/&lt;safe title&gt;.txt
 * jsonl/all_data.jsonl
 * images/images_info.jsonl
 * _failures.jsonl
 * </pre>
 *
 * @author fengwk
 */
@Slf4j
public class BatchOutputStore {

    static final String TXT_DIR = "txt";
    static final String ALL_DATA = "jsonl/all_data.jsonl";
    static final String IMAGES_INFO = "images/images_info.jsonl";
    static final String FAILURES = "_failures.jsonl";

    private final Path outDir;
    private final ObjectMapper objectMapper;

    public BatchOutputStore(Path outDir, ObjectMapper objectMapper) {
        this.outDir = outDir;
        this.objectMapper = objectMapper;
    }

    public Path textPath(String title) {
        return outDir.resolve(TXT_DIR).resolve(ArticleTitles.safeFilename(title) + ".txt");
    }

    public boolean hasText(String title) {
        return Files.exists(textPath(title));
    }

    /**
     * @return path of the written file relative to the output directory
     */
    public String writeText(String title, String text) throws IOException {
        Path path = textPath(title);
        Files.createDirectories(path.getParent());
        Files.writeString(path, text, StandardCharsets.UTF_8);
        return TXT_DIR + "/" + path.getFileName();
    }

    public void appendImages(List<ImageRecord> images) throws IOException {
        if (images == null || images.isEmpty()) {
            return;
        }
        List<String> lines = new ArrayList<>(images.size());
        for (ImageRecord image : images) {
            lines.add(objectMapper.writeValueAsString(image));
        }
        appendLines(outDir.resolve(IMAGES_INFO), lines);
    }

    /**
     * Appends an article record. With {@code replace}, earlier records of the same title
     * are dropped first.
     */
    public void saveRecord(ArticleRecord record, boolean replace) throws IOException {
        Path path = outDir.resolve(ALL_DATA);
        String line = objectMapper.writeValueAsString(record);
        if (!replace || !Files.exists(path)) {
            appendLines(path, List.of(line));
            return;
        }
        List<String> kept = new ArrayList<>();
        for (String existing : Files.readAllLines(path, StandardCharsets.UTF_8)) {
            if (existing.isBlank()) {
                continue;
            }
            try {
                JsonNode node = objectMapper.readTree(existing);
                if (Objects.equals(node.path("title").asText(null), record.getTitle())) {
                    continue;
                }
                kept.add(existing);
            } catch (JsonProcessingException ex) {
                log.warn("malformed record dropped, file={}, error={}", path, ex.getOriginalMessage());
            }
        }
        kept.add(line);
        Files.write(path, kept, StandardCharsets.UTF_8);
    }

    public void appendFailure(Map<String, String> failure) throws IOException {
        appendLines(outDir.resolve(FAILURES), List.of(objectMapper.writeValueAsString(failure)));
    }

    private void appendLines(Path path, List<String> lines) throws IOException {
        Files.createDirectories(path.getParent());
        Files.write(path, lines, StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
    }

}
