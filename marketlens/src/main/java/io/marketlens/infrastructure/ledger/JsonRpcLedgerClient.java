package io.marketlens.infrastructure.ledger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.marketlens.domain.asset.CallbackEvent;
import io.marketlens.domain.error.UpstreamUnavailableException;
import io.marketlens.domain.ledger.LedgerService;
import io.marketlens.domain.ledger.LedgerStatus;
import io.marketlens.domain.market.Order;
import io.marketlens.domain.market.OrderFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

/**
 * LedgerService over the ledger daemon's JSON-RPC 2.0 HTTP API.
 *
 * Every failure (transport, non-200, RPC error object) surfaces as
 * UpstreamUnavailableException. Nothing is retried here.
 */
public final class JsonRpcLedgerClient implements LedgerService {
    private static final Logger log = LoggerFactory.getLogger(JsonRpcLedgerClient.class);

    private static final String UPSTREAM = "ledger";

    private final URI endpoint;
    private final String authorization;
    private final Duration requestTimeout;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final AtomicLong requestIds = new AtomicLong();

    public JsonRpcLedgerClient(String url, String user, String password, Duration requestTimeout,
                               ObjectMapper objectMapper) {
        this.endpoint = URI.create(url);
        this.authorization = user == null || user.isBlank()
            ? null
            : "Basic " + Base64.getEncoder().encodeToString((user + ":" + password).getBytes(StandardCharsets.UTF_8));
        this.requestTimeout = requestTimeout;
        this.objectMapper = objectMapper;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(requestTimeout)
            .build();
    }

    @Override
    public List<Order> getOpenOrders(List<OrderFilter> filters) {
        ObjectNode params = objectMapper.createObjectNode();
        params.set("filters", filtersNode(filters));
        params.put("filterop", "and");
        params.put("show_expired", false);
        params.put("order_by", "block_index");
        params.put("order_dir", "asc");

        return parseOrders(call("get_orders", params));
    }

    @Override
    public List<CallbackEvent> getCallbacks(String asset) {
        ObjectNode params = objectMapper.createObjectNode();
        params.set("filters", filtersNode(List.of(OrderFilter.eq("asset", asset))));
        params.put("order_by", "block_index");
        params.put("order_dir", "asc");

        return parseCallbacks(call("get_callbacks", params));
    }

    @Override
    public long getXcpSupply() {
        JsonNode result = call("get_xcp_supply", objectMapper.createObjectNode());
        if (!result.canConvertToLong()) {
            throw new UpstreamUnavailableException(UPSTREAM, "get_xcp_supply returned " + result);
        }
        return result.asLong();
    }

    @Override
    public LedgerStatus getStatus() {
        return parseStatus(call("get_running_info", objectMapper.createObjectNode()));
    }

    /**
     * Sends one request and returns its {@code result} member.
     */
    JsonNode call(String method, ObjectNode params) {
        long id = requestIds.incrementAndGet();
        ObjectNode payload = objectMapper.createObjectNode();
        payload.put("jsonrpc", "2.0");
        payload.put("id", id);
        payload.put("method", method);
        payload.set("params", params);

        HttpRequest.Builder builder = HttpRequest.newBuilder(endpoint)
            .timeout(requestTimeout)
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(payload.toString()));
        if (authorization != null) {
            builder.header("Authorization", authorization);
        }

        HttpResponse<String> response;
        try {
            response = httpClient.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            log.error("[LEDGER] {} failed: {}", method, e.getMessage());
            throw new UpstreamUnavailableException(UPSTREAM, method + " failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new UpstreamUnavailableException(UPSTREAM, method + " interrupted", e);
        }

        if (response.statusCode() != 200) {
            log.error("[LEDGER] {} returned HTTP {}", method, response.statusCode());
            throw new UpstreamUnavailableException(UPSTREAM, method + " returned HTTP " + response.statusCode());
        }

        return extractResult(method, response.body());
    }

    JsonNode extractResult(String method, String body) {
        JsonNode root;
        try {
            root = objectMapper.readTree(body);
        } catch (IOException e) {
            throw new UpstreamUnavailableException(UPSTREAM, method + " returned malformed JSON", e);
        }
        JsonNode error = root.get("error");
        if (error != null && !error.isNull()) {
            log.error("[LEDGER] {} error: {}", method, error);
            throw new UpstreamUnavailableException(UPSTREAM, method + " error: " + error.path("message").asText(error.toString()));
        }
        JsonNode result = root.get("result");
        if (result == null) {
            throw new UpstreamUnavailableException(UPSTREAM, method + " response has no result");
        }
        log.debug("[LEDGER] {} ok", method);
        return result;
    }

    private ArrayNode filtersNode(List<OrderFilter> filters) {
        ArrayNode array = objectMapper.createArrayNode();
        for (OrderFilter filter : filters) {
            ObjectNode node = array.addObject();
            node.put("field", filter.field());
            node.put("op", filter.op());
            node.set("value", objectMapper.valueToTree(filter.value()));
        }
        return array;
    }

    static List<Order> parseOrders(JsonNode result) {
        List<Order> orders = new ArrayList<>();
        for (JsonNode node : result) {
            orders.add(new Order(
                node.path("tx_hash").asText(),
                node.path("source").asText(),
                node.path("give_asset").asText(),
                node.path("give_quantity").asLong(),
                node.path("get_asset").asText(),
                node.path("get_quantity").asLong(),
                node.path("give_remaining").asLong(),
                node.path("get_remaining").asLong(),
                node.path("fee_required").asLong(),
                node.path("fee_provided").asLong(),
                node.path("block_index").asLong(),
                node.path("expiration").asLong(),
                node.path("status").asText("open")
            ));
        }
        return orders;
    }

    static List<CallbackEvent> parseCallbacks(JsonNode result) {
        List<CallbackEvent> callbacks = new ArrayList<>();
        for (JsonNode node : result) {
            callbacks.add(new CallbackEvent(
                node.path("asset").asText(),
                node.path("fraction").decimalValue(),
                node.path("block_index").asLong()
            ));
        }
        return callbacks;
    }

    static LedgerStatus parseStatus(JsonNode result) {
        JsonNode lastBlock = result.path("last_block");
        long blockIndex = lastBlock.isObject() ? lastBlock.path("block_index").asLong(0L) : 0L;
        return new LedgerStatus(
            result.path("db_caught_up").asBoolean(false),
            blockIndex,
            result.path("last_message_index").asLong(-1L)
        );
    }
}
