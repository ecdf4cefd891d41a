package com.delta.searchsync.sync.index;

import com.delta.searchsync.config.SearchSyncProperties;
import com.delta.searchsync.sync.model.BulkResponseSummary;
import com.delta.searchsync.sync.model.IndexHit;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.function.Consumer;

@Service
public class SearchIndexClient {
    private static final Logger log = LoggerFactory.getLogger(SearchIndexClient.class);
    private static final String JSON = "application/json";
    private static final String NDJSON = "application/x-ndjson";
    private static final String REFRESH_DISABLED = "-1";

    private final SearchSyncProperties properties;
    private final ObjectMapper objectMapper;
    private final HttpClient client;

    public SearchIndexClient(
        SearchSyncProperties properties,
        ObjectMapper objectMapper,
        @Qualifier("indexHttpExecutor") ExecutorService httpExecutor
    ) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.client = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.getIndex().getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
    }

    public void scrollBatches(String index, int batchSize, Consumer<List<IndexHit>> consumer) {
        String keepAlive = properties.getIndex().getScrollKeepAlive();
        ObjectNode query = objectMapper.createObjectNode();
        query.put("size", Math.max(1, batchSize));
        query.put("_source", false);
        query.putArray("sort").add("_doc");

        JsonNode page = readJson(send("POST", "/" + encode(index) + "/_search?scroll=" + encode(keepAlive), write(query), JSON));
        String scrollId = page.path("_scroll_id").asText(null);
        try {
            List<IndexHit> hits = hitsOf(page);
            while (!hits.isEmpty()) {
                consumer.accept(hits);
                if (scrollId == null) {
                    break;
                }
                ObjectNode next = objectMapper.createObjectNode()
                    .put("scroll", keepAlive)
                    .put("scroll_id", scrollId);
                page = readJson(send("POST", "/_search/scroll", write(next), JSON));
                scrollId = page.path("_scroll_id").asText(scrollId);
                hits = hitsOf(page);
            }
        } finally {
            if (scrollId != null) {
                clearScroll(scrollId);
            }
        }
    }

    public BulkResponseSummary bulk(String ndjsonBody) {
        JsonNode response = readJson(send("POST", "/_bulk", ndjsonBody, NDJSON));
        int items = 0;
        int failed = 0;
        for (JsonNode item : response.path("items")) {
            items++;
            JsonNode action = item.elements().hasNext() ? item.elements().next() : null;
            if (action != null && action.hasNonNull("error")) {
                failed++;
            }
        }
        if (failed > 0) {
            log.warn("Bulk request finished with {} failed items out of {}", failed, items);
        }
        return new BulkResponseSummary(items, failed, response.path("took").asLong(0));
    }

    public JsonNode settings(String index) {
        JsonNode response = readJson(send("GET", "/" + encode(index) + "/_settings", null, JSON));
        return response.path(index).path("settings");
    }

    public void putSettings(String index, Map<String, Object> settings) {
        send("PUT", "/" + encode(index) + "/_settings", write(Map.of("index", settings)), JSON);
    }

    public void disableRefresh(String index) {
        putSettings(index, Map.of("refresh_interval", REFRESH_DISABLED));
    }

    public void restoreRefresh(String index, String refreshInterval) {
        putSettings(index, Map.of("refresh_interval", refreshInterval));
    }

    private void clearScroll(String scrollId) {
        ObjectNode body = objectMapper.createObjectNode();
        body.putArray("scroll_id").add(scrollId);
        try {
            send("DELETE", "/_search/scroll", write(body), JSON);
        } catch (SearchIndexException e) {
            log.warn("Unable to clear scroll context; it will expire on its own", e);
        }
    }

    private List<IndexHit> hitsOf(JsonNode page) {
        List<IndexHit> hits = new ArrayList<>();
        for (JsonNode hit : page.path("hits").path("hits")) {
            String id = hit.path("_id").asText(null);
            if (id != null) {
                hits.add(new IndexHit(id));
            }
        }
        return hits;
    }

    private String send(String method, String path, String body, String contentType) {
        URI uri = URI.create(baseUrl() + path);
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
            .timeout(Duration.ofSeconds(properties.getIndex().getRequestTimeoutSeconds()))
            .header("Accept", JSON);
        if (body == null) {
            builder.method(method, HttpRequest.BodyPublishers.noBody());
        } else {
            builder.header("Content-Type", contentType)
                .method(method, HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8));
        }

        HttpResponse<String> response;
        try {
            response = client.send(builder.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new SearchIndexException(method + " " + uri + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SearchIndexException(method + " " + uri + " interrupted", e);
        }
        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new SearchIndexException(
                method + " " + uri + " returned " + status + ": " + abbreviate(response.body()),
                status
            );
        }
        return response.body();
    }

    private String baseUrl() {
        String base = properties.getIndex().getBaseUrl();
        while (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return base;
    }

    private JsonNode readJson(String body) {
        try {
            return objectMapper.readTree(body == null || body.isBlank() ? "{}" : body);
        } catch (JsonProcessingException e) {
            throw new SearchIndexException("Unparseable response from search index: " + abbreviate(body), e);
        }
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unable to serialize request body", e);
        }
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() <= 500 ? body : body.substring(0, 500) + "...";
    }
}
