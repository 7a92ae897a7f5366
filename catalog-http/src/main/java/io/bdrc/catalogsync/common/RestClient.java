package io.bdrc.catalogsync.common;

import javax.net.ssl.SSLEngine;
import javax.net.ssl.SSLException;
import javax.net.ssl.SSLParameters;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import io.bdrc.catalogsync.common.http.ConnectionContext;
import io.bdrc.catalogsync.common.http.HttpResponse;

import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelOption;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaders;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.ssl.SslContext;
import io.netty.handler.ssl.SslContextBuilder;
import io.netty.handler.ssl.util.InsecureTrustManagerFactory;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;
import reactor.netty.tcp.SslProvider;

/**
 * Thin asynchronous JSON-over-HTTP client for the catalog's OpenSearch cluster.  Non-2xx responses are
 * returned as values; callers decide which status codes are errors.
 */
@Slf4j
public class RestClient {
    @Getter
    private final ConnectionContext connectionContext;
    private final HttpClient client;

    private static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(5);
    // Longer than the default OpenSearch request timeout of 1 minute
    private static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(65);

    private static final String USER_AGENT_HEADER_NAME = HttpHeaderNames.USER_AGENT.toString();
    private static final String CONTENT_TYPE_HEADER_NAME = HttpHeaderNames.CONTENT_TYPE.toString();
    private static final String HOST_HEADER_NAME = HttpHeaderNames.HOST.toString();

    private static final String USER_AGENT = "CatalogSync-1.0";
    private static final String JSON_CONTENT_TYPE = "application/json";
    public static final String NDJSON_CONTENT_TYPE = "application/x-ndjson";

    public RestClient(ConnectionContext connectionContext) {
        this(connectionContext, HttpClient.create());
    }

    protected RestClient(ConnectionContext connectionContext, HttpClient httpClient) {
        this.connectionContext = connectionContext;
        var configured = httpClient
            .baseUrl(connectionContext.getUri().toString())
            .disableRetry(false) // Enable one retry on connection reset with no delay
            .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) DEFAULT_CONNECT_TIMEOUT.toMillis())
            .responseTimeout(DEFAULT_REQUEST_TIMEOUT)
            .keepAlive(true);
        if (ConnectionContext.Protocol.HTTPS.equals(connectionContext.getProtocol())) {
            configured = configured.secure(connectionContext.isInsecure()
                ? getInsecureSslProvider()
                : SslProvider.defaultClientProvider());
        }
        this.client = configured;
    }

    public static String getHostHeaderValue(ConnectionContext connectionContext) {
        String host = connectionContext.getUri().getHost();
        int port = connectionContext.getUri().getPort();
        ConnectionContext.Protocol protocol = connectionContext.getProtocol();

        if (ConnectionContext.Protocol.HTTP.equals(protocol)) {
            if (port == -1 || port == 80) {
                return host;
            }
        } else if (ConnectionContext.Protocol.HTTPS.equals(protocol)) {
            if (port == -1 || port == 443) {
                return host;
            }
        } else {
            throw new IllegalArgumentException("Unexpected protocol" + protocol);
        }
        return host + ":" + port;
    }

    public Mono<HttpResponse> asyncRequest(HttpMethod method, String path, String body, String contentType) {
        Map<String, List<String>> headers = new HashMap<>();
        headers.put(USER_AGENT_HEADER_NAME, List.of(USER_AGENT));
        headers.put(HOST_HEADER_NAME, List.of(getHostHeaderValue(connectionContext)));
        if (body != null) {
            headers.put(CONTENT_TYPE_HEADER_NAME, List.of(contentType != null ? contentType : JSON_CONTENT_TYPE));
        }
        var transformedHeaders = connectionContext.getRequestTransformer()
            .transformHeaders(method.name(), path, headers);
        var payload = Mono.justOrEmpty(body)
            .map(b -> Unpooled.wrappedBuffer(b.getBytes(StandardCharsets.UTF_8)));

        log.atTrace().setMessage("{} /{}").addArgument(method).addArgument(path).log();
        return client
            .headers(h -> transformedHeaders.forEach(h::add))
            .request(method)
            .uri("/" + path)
            .send(payload)
            .responseSingle((response, bytes) -> bytes.asString(StandardCharsets.UTF_8)
                .singleOptional()
                .map(bodyOp -> new HttpResponse(
                    response.status().code(),
                    response.status().reasonPhrase(),
                    extractHeaders(response.responseHeaders()),
                    bodyOp.orElse(null))));
    }

    private static Map<String, String> extractHeaders(HttpHeaders headers) {
        return headers.entries().stream()
            .collect(Collectors.toMap(Map.Entry::getKey, Map.Entry::getValue, (v1, v2) -> v1 + "," + v2));
    }

    public Mono<HttpResponse> getAsync(String path) {
        return asyncRequest(HttpMethod.GET, path, null, null);
    }

    public Mono<HttpResponse> postAsync(String path, String body) {
        return asyncRequest(HttpMethod.POST, path, body, null);
    }

    public Mono<HttpResponse> postAsync(String path, String body, String contentType) {
        return asyncRequest(HttpMethod.POST, path, body, contentType);
    }

    public Mono<HttpResponse> putAsync(String path, String body) {
        return asyncRequest(HttpMethod.PUT, path, body, null);
    }

    private static SslProvider getInsecureSslProvider() {
        try {
            SslContext sslContext = SslContextBuilder.forClient()
                .trustManager(InsecureTrustManagerFactory.INSTANCE)
                .build();

            return SslProvider.builder()
                .sslContext(sslContext)
                .handlerConfigurator(sslHandler -> {
                    SSLEngine engine = sslHandler.engine();
                    SSLParameters sslParameters = engine.getSSLParameters();
                    sslParameters.setEndpointIdentificationAlgorithm(null);
                    engine.setSSLParameters(sslParameters);
                })
                .build();
        } catch (SSLException e) {
            throw new IllegalStateException("Unable to construct SslProvider", e);
        }
    }
}
