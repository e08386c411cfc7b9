package fun.fengwk.wikitext.core.facade.wiki.mediawiki;

import lombok.Data;
import org.apache.commons.lang3.StringUtils;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.Optional;

/**
 * MediaWiki endpoint configuration.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "wikitext.mediawiki")
public class MediaWikiProperties {

    /**
     * Action API endpoint.
     */
    private String actionApiUrl = "https://zh.wikipedia.org/w/api.php";

    /**
     * REST html endpoint, {@code {title}} is replaced by the encoded title.
     */
    private String restHtmlUrl = "https://zh.wikipedia.org/api/rest_v1/page/html/{title}";

    /**
     * Prefix of article URLs.
     */
    private String articleBaseUrl = "https://zh.wikipedia.org/wiki/";

    /**
     * Language variant requested from the action API.
     */
    private String variant = "zh-tw";

    private String acceptLanguage = "zh-tw";

    private String userAgent = "wiki-text/1.0 (https://github.com/fengwk; text extraction)";

    /**
     * Page request timeout in milliseconds.
     */
    private int timeoutMs = 30000;

    /**
     * Interlanguage link request timeout in milliseconds.
     */
    private int langLinksTimeoutMs = 20000;

    /**
     * Retries after the first attempt.
     */
    private int retries = 3;

    /**
     * First backoff delay, doubled on every retry.
     */
    private long backoffBaseMs = 1000;

    /**
     * Replication lag tolerance sent as {@code maxlag}.
     */
    private int maxlag = 5;

    /**
     * HTTP proxy, e.g. http://host:port or host:port.
     */
    private String proxy;

    public Optional<InetSocketAddress> proxyAddress() {
        if (StringUtils.isBlank(proxy)) {
            return Optional.empty();
        }
        String value = proxy.strip();
        try {
            URI uri = new URI(value.contains("://") ? value : "http://" + value);
            if (uri.getHost() == null) {
                throw new IllegalArgumentException("invalid proxy: " + proxy);
            }
            int port = uri.getPort() == -1 ? 80 : uri.getPort();
            return Optional.of(InetSocketAddress.createUnresolved(uri.getHost(), port));
        } catch (URISyntaxException ex) {
            throw new IllegalArgumentException("invalid proxy: " + proxy, ex);
        }
    }

}
