package fun.fengwk.wikitext.core.configuration;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.ClassUtils;

/**
 * @author fengwk
 */
@Configuration
public class FreeMarkerConfiguration {

    public static final String MCP_TEMPLATE_PATH = "/mcp/templates/";

    @Bean(name = "mcpTemplateConfiguration")
    public freemarker.template.Configuration mcpTemplateConfiguration() {
        return createMcpTemplateConfiguration();
    }

    public static freemarker.template.Configuration createMcpTemplateConfiguration() {
        freemarker.template.Configuration cfg = new freemarker.template.Configuration(
            freemarker.template.Configuration.VERSION_2_3_34);
        cfg.setClassLoaderForTemplateLoading(ClassUtils.getDefaultClassLoader(), MCP_TEMPLATE_PATH);
        cfg.setDefaultEncoding("UTF-8");
        return cfg;
    }

}
