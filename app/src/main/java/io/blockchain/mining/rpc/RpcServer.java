package io.blockchain.mining.rpc;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import io.blockchain.mining.error.ErrorCode;
import io.blockchain.mining.error.MiningException;
import io.blockchain.mining.metrics.HttpMetrics;
import io.blockchain.mining.metrics.MiningMetrics;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * JSON-RPC 1.0/2.0 over HTTP POST on {@code /}, plus a {@code /metrics} scrape endpoint.
 */
public final class RpcServer {
    private static final Logger LOG = Logger.getLogger(RpcServer.class.getName());

    private final MiningRpcMethods methods;
    private final String bindAddress;
    private final int port;
    private final String authToken;
    private final ObjectMapper mapper = new ObjectMapper();
    private HttpServer server;
    private ExecutorService executor;

    public RpcServer(MiningRpcMethods methods, String bindAddress, int port, String authToken) {
        this.methods = methods;
        this.bindAddress = (bindAddress == null || bindAddress.isBlank()) ? "127.0.0.1" : bindAddress;
        this.port = port;
        this.authToken = (authToken == null || authToken.isBlank()) ? null : authToken;
    }

    public void start() throws IOException {
        if (server != null) {
            throw new IllegalStateException("RPC server already running");
        }
        server = HttpServer.create(new InetSocketAddress(bindAddress, port), 0);
        server.createContext("/", new JsonRpcHandler());
        server.createContext("/metrics", new MetricsHandler());
        AtomicInteger seq = new AtomicInteger();
        executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "mining-rpc-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        server.setExecutor(executor);
        server.start();
        LOG.info(() -> "RPC server listening on http://" + bindAddress + ':' + boundPort()
                + (authToken != null ? " (auth required)" : ""));
    }

    public void stop() {
        if (server != null) {
            server.stop(0);
            server = null;
            executor.shutdownNow();
            executor = null;
        }
    }

    /** The listening port; differs from the configured one when that was 0. */
    public int boundPort() {
        if (server == null) {
            throw new IllegalStateException("RPC server not running");
        }
        return server.getAddress().getPort();
    }

    private boolean isAuthorized(HttpExchange exchange) {
        if (authToken == null) {
            return true;
        }
        List<String> authHeaders = exchange.getRequestHeaders().get("Authorization");
        if (authHeaders != null) {
            for (String header : authHeaders) {
                if (header != null && header.equals("Bearer " + authToken)) {
                    return true;
                }
            }
        }
        String apiKey = exchange.getRequestHeaders().getFirst("X-API-Key");
        return apiKey != null && apiKey.equals(authToken);
    }

    final class JsonRpcHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            var sample = HttpMetrics.start();
            String rpcMethod = exchange.getHttpContext().getPath();
            int status = 500;
            try {
                if (!"/".equals(exchange.getRequestURI().getPath())) {
                    status = sendText(exchange, 404, "Not found");
                    return;
                }
                if (!"POST".equalsIgnoreCase(exchange.getRequestMethod())) {
                    status = sendText(exchange, 405, "JSONRPC server handles only POST requests");
                    return;
                }
                if (!isAuthorized(exchange)) {
                    exchange.getResponseHeaders().set("WWW-Authenticate", "Bearer");
                    status = sendText(exchange, 401, "Missing or invalid credentials");
                    return;
                }
                JsonNode request;
                try {
                    request = mapper.readTree(exchange.getRequestBody());
                } catch (JsonProcessingException e) {
                    status = sendJson(exchange, 400, reply(NullNode.instance, null,
                            new MiningException(ErrorCode.INVALID_REQUEST, "Parse error")));
                    return;
                }
                if (request == null || !request.isObject()) {
                    status = sendJson(exchange, 400, reply(NullNode.instance, null,
                            new MiningException(ErrorCode.INVALID_REQUEST, "Invalid Request object")));
                    return;
                }
                JsonNode id = request.hasNonNull("id") ? request.get("id") : NullNode.instance;
                JsonNode methodNode = request.get("method");
                if (methodNode == null || !methodNode.isTextual()) {
                    status = sendJson(exchange, 400, reply(id, null,
                            new MiningException(ErrorCode.INVALID_REQUEST, "Method must be a string")));
                    return;
                }
                rpcMethod = methodNode.asText();
                String logged = rpcMethod;
                LOG.fine(() -> "RPC call " + logged);
                try {
                    Object result = methods.call(rpcMethod, request.get("params"));
                    status = sendJson(exchange, 200, reply(id, result, null));
                } catch (MiningException e) {
                    status = sendJson(exchange, httpStatus(e.code()), reply(id, null, e));
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    status = sendJson(exchange, 500, reply(id, null,
                            new MiningException(ErrorCode.MISC_ERROR, "Shutting down")));
                } catch (RuntimeException e) {
                    LOG.log(Level.WARNING, "RPC method " + rpcMethod + " failed", e);
                    status = sendJson(exchange, 500, reply(id, null,
                            new MiningException(ErrorCode.INTERNAL_ERROR, "Internal error")));
                }
            } finally {
                HttpMetrics.stop(sample, rpcMethod, status);
                exchange.close();
            }
        }
    }

    final class MetricsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            var sample = HttpMetrics.start();
            String path = exchange.getHttpContext().getPath();
            int status = 500;
            try {
                if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                    status = sendText(exchange, 405, "Use GET for this endpoint");
                    return;
                }
                if (!isAuthorized(exchange)) {
                    exchange.getResponseHeaders().set("WWW-Authenticate", "Bearer");
                    status = sendText(exchange, 401, "Missing or invalid credentials");
                    return;
                }
                exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4");
                status = send(exchange, 200, MiningMetrics.scrapeMetrics().getBytes(StandardCharsets.UTF_8));
            } finally {
                HttpMetrics.stop(sample, path, status);
                exchange.close();
            }
        }
    }

    /** METHOD_NOT_FOUND and INVALID_REQUEST get their own HTTP status; every other error is a 500. */
    static int httpStatus(ErrorCode code) {
        switch (code) {
            case METHOD_NOT_FOUND: return 404;
            case INVALID_REQUEST: return 400;
            default: return 500;
        }
    }

    private ObjectNode reply(JsonNode id, Object result, MiningException error) {
        ObjectNode node = mapper.createObjectNode();
        node.set("result", result == null ? NullNode.instance : mapper.valueToTree(result));
        if (error == null) {
            node.set("error", NullNode.instance);
        } else {
            node.putObject("error")
                    .put("code", error.code().code())
                    .put("message", error.getMessage());
        }
        node.set("id", id);
        return node;
    }

    private int sendJson(HttpExchange exchange, int status, JsonNode body) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        return send(exchange, status, mapper.writeValueAsBytes(body));
    }

    private int sendText(HttpExchange exchange, int status, String body) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", "text/plain");
        return send(exchange, status, body.getBytes(StandardCharsets.UTF_8));
    }

    private static int send(HttpExchange exchange, int status, byte[] payload) throws IOException {
        exchange.sendResponseHeaders(status, payload.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(payload);
        }
        return status;
    }
}
