package in.tickbridge.infrastructure.broker.instrument;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import in.tickbridge.domain.feed.SymbolIdentity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Resolves wire tokens through the PiConnect {@code SearchScrip} REST call.
 *
 * Request: {@code jData={"uid":..,"stext":"TCS","exch":"NSE"}&jKey=<session token>}.
 * The first result whose {@code tsym} is {@code TCS-EQ}, {@code TCS} or
 * {@code TCS-BL} wins.
 */
public final class FlattradeSymbolResolver implements SymbolResolver {
    private static final Logger log = LoggerFactory.getLogger(FlattradeSymbolResolver.class);

    private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(15);

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final HttpClient httpClient;
    private final String baseUrl;
    private final String userId;

    public FlattradeSymbolResolver(String baseUrl, String userId) {
        this(HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(), baseUrl, userId);
    }

    public FlattradeSymbolResolver(HttpClient httpClient, String baseUrl, String userId) {
        this.httpClient = httpClient;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.userId = userId;
    }

    @Override
    public Optional<String> resolve(String credential, String humanSymbol, String exchange) {
        String base = SymbolIdentity.stripSeries(humanSymbol.toUpperCase(Locale.ROOT));

        try {
            ObjectNode jData = objectMapper.createObjectNode();
            jData.put("uid", userId);
            jData.put("stext", base);
            jData.put("exch", exchange);

            HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl + "/SearchScrip"))
                .timeout(REQUEST_TIMEOUT)
                .header("Content-Type", "application/x-www-form-urlencoded")
                .POST(HttpRequest.BodyPublishers.ofString("jData=" + jData + "&jKey=" + credential))
                .build();

            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                log.error("[RESOLVER] SearchScrip HTTP {} for {}:{}", response.statusCode(), exchange, humanSymbol);
                return Optional.empty();
            }

            JsonNode body = objectMapper.readTree(response.body());
            if (!"Ok".equals(body.path("stat").asText()) || !body.path("values").isArray()
                    || body.path("values").isEmpty()) {
                log.error("[RESOLVER] No scrip info for {}:{} ({})", exchange, humanSymbol,
                    body.path("emsg").asText("no values"));
                return Optional.empty();
            }

            List<String> variations = List.of(base + "-EQ", base, base + "-BL");
            for (JsonNode item : body.path("values")) {
                if (variations.contains(item.path("tsym").asText())) {
                    String token = item.path("token").asText("");
                    if (!token.isEmpty()) {
                        log.info("[RESOLVER] Resolved {}:{} -> {}", exchange, humanSymbol, token);
                        return Optional.of(token);
                    }
                }
            }

            log.error("[RESOLVER] Could not find token for {}:{}", exchange, humanSymbol);
            return Optional.empty();

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[RESOLVER] Interrupted resolving {}:{}", exchange, humanSymbol);
            return Optional.empty();
        } catch (IOException | IllegalArgumentException e) {
            log.error("[RESOLVER] Failed to resolve {}:{}: {}", exchange, humanSymbol, e.getMessage());
            return Optional.empty();
        }
    }
}
