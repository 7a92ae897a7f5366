package io.bdrc.catalogsync.trigger;

import java.util.List;
import java.util.concurrent.ExecutorService;

import io.bdrc.catalogsync.CatalogSyncJob;
import io.bdrc.catalogsync.common.ObjectMapperFactory;
import io.bdrc.catalogsync.model.RecordType;
import io.bdrc.catalogsync.sync.SyncOptions;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultFullHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.codec.http.QueryStringDecoder;
import lombok.extern.slf4j.Slf4j;

/**
 * Answers {@code POST /import/sync-catalog} right away and hands the run to the background executor.
 */
@Slf4j
public class SyncTriggerHandler extends SimpleChannelInboundHandler<FullHttpRequest> {
    public static final String SYNC_PATH = "/import/sync-catalog";

    private static final ObjectMapper OBJECT_MAPPER = ObjectMapperFactory.createDefaultMapper();

    private final SyncRunner runner;
    private final ExecutorService executor;

    public SyncTriggerHandler(SyncRunner runner, ExecutorService executor) {
        this.runner = runner;
        this.executor = executor;
    }

    @Override
    protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest request) {
        var decoder = new QueryStringDecoder(request.uri());
        if (!SYNC_PATH.equals(decoder.path())) {
            respond(ctx, request, HttpResponseStatus.NOT_FOUND, errorBody("Not found: " + decoder.path()));
            return;
        }
        if (!HttpMethod.POST.equals(request.method())) {
            respond(ctx, request, HttpResponseStatus.METHOD_NOT_ALLOWED,
                errorBody("Method not allowed: " + request.method()));
            return;
        }

        var force = Boolean.parseBoolean(firstParameter(decoder, "force", "false"));
        var type = firstParameter(decoder, "type", CatalogSyncJob.ALL_TYPES);
        final List<RecordType> types;
        try {
            types = CatalogSyncJob.typesFor(type);
        } catch (IllegalArgumentException e) {
            respond(ctx, request, HttpResponseStatus.BAD_REQUEST, errorBody(e.getMessage()));
            return;
        }

        var options = SyncOptions.builder().force(force).build();
        executor.submit(() -> runInBackground(types, options));
        log.atInfo().setMessage("Queued catalog sync (force={}, type={})").addArgument(force).addArgument(type).log();

        ObjectNode body = OBJECT_MAPPER.createObjectNode()
            .put("status", "accepted")
            .put("message", "Catalog sync queued")
            .put("force", force)
            .put("type", type);
        respond(ctx, request, HttpResponseStatus.ACCEPTED, body);
    }

    private void runInBackground(List<RecordType> types, SyncOptions options) {
        try {
            runner.run(types, options);
        } catch (Exception e) {
            log.atError().setCause(e).setMessage("Background catalog sync failed").log();
        }
    }

    private static String firstParameter(QueryStringDecoder decoder, String name, String defaultValue) {
        var values = decoder.parameters().get(name);
        return values == null || values.isEmpty() ? defaultValue : values.get(0);
    }

    private static ObjectNode errorBody(String detail) {
        return OBJECT_MAPPER.createObjectNode().put("detail", detail);
    }

    private static void respond(ChannelHandlerContext ctx, FullHttpRequest request, HttpResponseStatus status,
                                ObjectNode body) {
        byte[] bytes;
        try {
            bytes = OBJECT_MAPPER.writeValueAsBytes(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize response body", e);
        }
        var response = new DefaultFullHttpResponse(HttpVersion.HTTP_1_1, status, Unpooled.wrappedBuffer(bytes));
        response.headers()
            .set(HttpHeaderNames.CONTENT_TYPE, HttpHeaderValues.APPLICATION_JSON)
            .setInt(HttpHeaderNames.CONTENT_LENGTH, bytes.length);
        var keepAlive = HttpUtil.isKeepAlive(request);
        if (keepAlive) {
            response.headers().set(HttpHeaderNames.CONNECTION, HttpHeaderValues.KEEP_ALIVE);
            ctx.writeAndFlush(response);
        } else {
            ctx.writeAndFlush(response).addListener(ChannelFutureListener.CLOSE);
        }
    }

    @Override
    public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
        log.atWarn().setCause(cause).setMessage("Closing trigger connection after an error").log();
        ctx.close();
    }
}
