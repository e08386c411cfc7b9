package fun.fengwk.wikitext.core.mcp;

import fun.fengwk.wikitext.core.service.article.ArticleTextService;
import fun.fengwk.wikitext.core.service.article.model.ArticleRequest;
import fun.fengwk.wikitext.core.service.article.model.ArticleResponse;
import fun.fengwk.wikitext.core.utils.StringToolCallResultConverter;
import lombok.RequiredArgsConstructor;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * @author fengwk
 */
@Component
@RequiredArgsConstructor
public class WikiTextMcp {

    static final String RESULT_TEMPLATE = "wiki_text_result.ftl";

    private final ArticleTextService articleTextService;
    private final McpFormatter mcpFormatter;

    @Tool(name = "wiki_text",
        description = """
            Fetch a Chinese Wikipedia article (Traditional Chinese, zh-tw) and return its plain text.
            Section headings are prefixed with '## ' or '### ', list items and table rows with '• '.
            Reference, external link and see-also sections are dropped by default.
            Return format: title, source url and the article text; or an error message.""",
        resultConverter = StringToolCallResultConverter.class)
    public String wikiText(
        @ToolParam(description = "article title, e.g. 蔡依林, or a full zh.wikipedia.org article url") String title,
        @ToolParam(description = "level-2 heading keywords to drop, replaces the defaults when given", required = false)
        List<String> excludeSections
    ) {
        boolean isUrl = title != null && (title.startsWith("http://") || title.startsWith("https://"));
        ArticleResponse response = articleTextService.convert(ArticleRequest.builder()
            .title(isUrl ? null : title)
            .url(isUrl ? title : null)
            .excludeSections(excludeSections == null || excludeSections.isEmpty() ? null : excludeSections)
            .extractImages(false)
            .build());
        return mcpFormatter.format(RESULT_TEMPLATE, response);
    }

}
