package fun.fengwk.wikitext.cli.mcp;

import fun.fengwk.wikitext.core.mcp.WikiTextMcp;
import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.context.annotation.Bean;

/**
 * @author fengwk
 */
@SpringBootApplication(scanBasePackages = "fun.fengwk.wikitext")
public class CliMcpApplication {

    public static void main(String[] args) {
        SpringApplication.run(CliMcpApplication.class, args);
    }

    @Bean
    public ToolCallbackProvider wikiTextTools(WikiTextMcp wikiTextMcp) {
        return MethodToolCallbackProvider.builder()
            .toolObjects(wikiTextMcp)
            .build();
    }

}
