package fun.fengwk.wikitext.core.service.batch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fun.fengwk.wikitext.core.service.batch.model.ArticleTarget;
import fun.fengwk.wikitext.core.service.batch.model.TargetKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * Reads target lists: {@code .txt} (one URL or title per line) or {@code .jsonl}
 * ({@code url} or {@code title} per object), or a directory holding such files.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TargetListReader {

    private static final String TXT = ".txt";
    private static final String JSONL = ".jsonl";

    private final ObjectMapper objectMapper;

    public List<ArticleTarget> read(Path path) throws IOException {
        if (!Files.isDirectory(path)) {
            return readFile(path);
        }
        List<Path> files;
        try (Stream<Path> stream = Files.list(path)) {
            files = stream
                .filter(Files::isRegularFile)
                .filter(file -> isTxt(file) || isJsonl(file))
                .sorted(Comparator.comparing((Path file) -> isJsonl(file)).thenComparing(Path::toString))
                .toList();
        }
        if (files.isEmpty()) {
            log.warn("no target list found in directory, path={}", path);
        }
        List<ArticleTarget> targets = new ArrayList<>();
        for (Path file : files) {
            targets.addAll(readFile(file));
        }
        return targets;
    }

    private List<ArticleTarget> readFile(Path file) throws IOException {
        String sourceFile = file.toString();
        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        List<ArticleTarget> targets = new ArrayList<>();
        if (isJsonl(file)) {
            for (int i = 0; i < lines.size(); i++) {
                String line = lines.get(i).strip();
                if (line.isEmpty()) {
                    continue;
                }
                try {
                    JsonNode node = objectMapper.readTree(line);
                    String url = node.path("url").asText("");
                    String title = node.path("title").asText("");
                    if (StringUtils.isNotBlank(url)) {
                        targets.add(new ArticleTarget(url.strip(), TargetKind.URL, sourceFile));
                    } else if (StringUtils.isNotBlank(title)) {
                        targets.add(new ArticleTarget(title.strip(), TargetKind.TITLE, sourceFile));
                    }
                } catch (JsonProcessingException ex) {
                    log.warn("malformed target line skipped, file={}, line={}, error={}", file, i + 1, ex.getOriginalMessage());
                }
            }
            return targets;
        }
        for (String line : lines) {
            String value = line.strip();
            if (value.isEmpty() || value.startsWith("#")) {
                continue;
            }
            targets.add(ArticleTarget.of(value, sourceFile));
        }
        return targets;
    }

    private static boolean isTxt(Path file) {
        return file.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(TXT);
    }

    private static boolean isJsonl(Path file) {
        return file.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(JSONL);
    }

}
