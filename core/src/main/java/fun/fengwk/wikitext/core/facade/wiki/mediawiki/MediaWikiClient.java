package fun.fengwk.wikitext.core.facade.wiki.mediawiki;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.ProxySelector;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.StringJoiner;

/**
 * MediaWiki HTTP client with exponential backoff.
 *
 * <p>Throttling (429/503), replication-lag errors and transport failures are retried.
 * The client never throws; failures are reported through {@link MediaWikiClientResponse#getError()}.
 *
 * @author fengwk
 */
@Slf4j
@Component
public class MediaWikiClient {

    private final MediaWikiProperties properties;
    private final HttpClient httpClient;

    public MediaWikiClient(MediaWikiProperties properties) {
        this.properties = properties;
        HttpClient.Builder builder = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofMillis(properties.getTimeoutMs()));
        properties.proxyAddress().ifPresent(address -> {
            builder.proxy(ProxySelector.of(address));
            log.info("mediawiki proxy configured: {}", properties.getProxy());
        });
        this.httpClient = builder.build();
    }

    /**
     * Calls the action API with the given query parameters.
     */
    public MediaWikiClientResponse action(Map<String, String> params, int timeoutMs) {
        return get(URI.create(properties.getActionApiUrl() + "?" + buildQuery(params)), timeoutMs);
    }

    /**
     * Fetches rendered page html from the REST endpoint.
     */
    public MediaWikiClientResponse restHtml(String title, int timeoutMs) {
        String url = properties.getRestHtmlUrl().replace("{title}", encode(title));
        return get(URI.create(url), timeoutMs);
    }

    MediaWikiClientResponse get(URI uri, int timeoutMs) {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(uri)
            .timeout(Duration.ofMillis(timeoutMs))
            .header("User-Agent", properties.getUserAgent())
            .header("Accept-Language", properties.getAcceptLanguage())
            .GET()
            .build();

        int maxAttempts = Math.max(0, properties.getRetries()) + 1;
        int statusCode = 0;
        String body = null;
        Throwable lastError = null;
        for (int attempt = 0; attempt < maxAttempts; attempt++) {
            try {
                HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
                statusCode = response.statusCode();
                body = response.body();
                lastError = retryableError(statusCode, body);
                if (lastError == null) {
                    return MediaWikiClientResponse.builder()
                        .statusCode(statusCode)
                        .body(body)
                        .attempts(attempt + 1)
                        .build();
                }
            } catch (IOException ex) {
                lastError = ex;
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
                lastError = ex;
                break;
            }

            if (attempt + 1 < maxAttempts) {
                long delay = properties.getBackoffBaseMs() << attempt;
                log.debug("mediawiki request failed, retrying, uri={}, attempt={}, delayMs={}, error={}",
                    uri, attempt + 1, delay, lastError.getMessage());
                if (!sleep(delay)) {
                    break;
                }
            }
        }

        log.warn("mediawiki request failed, uri={}, error={}", uri, lastError.getMessage());
        return MediaWikiClientResponse.builder()
            .statusCode(statusCode)
            .body(body)
            .error(lastError)
            .attempts(maxAttempts)
            .build();
    }

    private Throwable retryableError(int statusCode, String body) {
        if (statusCode == 429 || statusCode == 503) {
            return new IOException("HTTP " + statusCode);
        }
        if (statusCode == 200 && body != null) {
            String lower = body.toLowerCase(Locale.ROOT);
            if (lower.contains("maxlag") && lower.contains("error")) {
                return new IOException("server under high replication lag (maxlag)");
            }
        }
        if (statusCode < 200 || statusCode >= 300) {
            return new IOException("HTTP " + statusCode);
        }
        return null;
    }

    private boolean sleep(long delayMs) {
        try {
            Thread.sleep(delayMs);
            return true;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private String buildQuery(Map<String, String> params) {
        StringJoiner joiner = new StringJoiner("&");
        for (Map.Entry<String, String> entry : params.entrySet()) {
            if (entry.getKey() == null || entry.getValue() == null) {
                continue;
            }
            joiner.add(encode(entry.getKey()) + "=" + encode(entry.getValue()));
        }
        return joiner.toString();
    }

    /**
     * Percent-encodes a URL component, spaces as {@code %20}.
     */
    public static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
    }

}
