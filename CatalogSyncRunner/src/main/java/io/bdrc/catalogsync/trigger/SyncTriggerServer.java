package io.bdrc.catalogsync.trigger;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Small HTTP endpoint that queues catalog syncs.  Runs go through a single background thread, so two
 * triggered runs never overlap within one process.
 */
@Slf4j
public class SyncTriggerServer implements AutoCloseable {
    private static final int MAX_CONTENT_LENGTH = 16 * 1024;
    private static final long SHUTDOWN_WAIT_SECONDS = 10;

    @Getter
    private final int port;
    private final SyncRunner runner;
    private final ExecutorService syncExecutor;
    private EventLoopGroup bossGroup;
    private EventLoopGroup workerGroup;
    private Channel serverChannel;

    public SyncTriggerServer(int port, SyncRunner runner) {
        this.port = port;
        this.runner = runner;
        this.syncExecutor = Executors.newSingleThreadExecutor(r -> new Thread(r, "catalog-sync"));
    }

    public SyncTriggerServer start() throws InterruptedException {
        bossGroup = new NioEventLoopGroup(1);
        workerGroup = new NioEventLoopGroup();
        var bootstrap = new ServerBootstrap();
        bootstrap.group(bossGroup, workerGroup)
            .channel(NioServerSocketChannel.class)
            .childHandler(new ChannelInitializer<SocketChannel>() {
                @Override
                protected void initChannel(SocketChannel ch) {
                    ch.pipeline().addLast(new HttpServerCodec());
                    ch.pipeline().addLast(new HttpObjectAggregator(MAX_CONTENT_LENGTH));
                    ch.pipeline().addLast(new SyncTriggerHandler(runner, syncExecutor));
                }
            });
        serverChannel = bootstrap.bind(port).sync().channel();
        log.atInfo().setMessage("Sync trigger listening on port {}").addArgument(port).log();
        return this;
    }

    public void awaitTermination() throws InterruptedException {
        serverChannel.closeFuture().sync();
    }

    @Override
    public void close() {
        try {
            if (serverChannel != null) {
                serverChannel.close().sync();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } finally {
            if (bossGroup != null) {
                bossGroup.shutdownGracefully();
            }
            if (workerGroup != null) {
                workerGroup.shutdownGracefully();
            }
            syncExecutor.shutdown();
            try {
                if (!syncExecutor.awaitTermination(SHUTDOWN_WAIT_SECONDS, TimeUnit.SECONDS)) {
                    log.atWarn().setMessage("A catalog sync was still running at shutdown").log();
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }
}
