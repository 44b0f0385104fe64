/*
 * Copyright kafkawire Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.kafkawire.server;

import java.net.InetSocketAddress;
import java.util.Objects;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.MultiThreadIoEventLoopGroup;
import io.netty.channel.nio.NioIoHandler;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.LengthFieldPrepender;

import io.kafkawire.config.NettySettings;
import io.kafkawire.config.ServerSettings;
import io.kafkawire.internal.FrameLoggingHandler;
import io.kafkawire.internal.KafkaServerHandler;
import io.kafkawire.internal.codec.KafkaFrameDecoder;
import io.kafkawire.internal.codec.KafkaRequestDecoder;
import io.kafkawire.internal.codec.KafkaResponseEncoder;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Serves the Kafka protocol. Each accepted connection gets its own {@link RequestHandler}
 * from the supplier, which is closed when the connection closes.
 */
public final class KafkaServer implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(KafkaServer.class);

    private final ServerSettings serverSettings;
    private final NettySettings nettySettings;
    private final Supplier<RequestHandler> handlerFactory;

    private @Nullable Channel channel;
    private @Nullable EventLoopGroup bossGroup;
    private @Nullable EventLoopGroup workerGroup;

    public KafkaServer(ServerSettings serverSettings, NettySettings nettySettings, Supplier<RequestHandler> handlerFactory) {
        this.serverSettings = Objects.requireNonNull(serverSettings);
        this.nettySettings = Objects.requireNonNull(nettySettings);
        this.handlerFactory = Objects.requireNonNull(handlerFactory);
    }

    /**
     * Start the server
     *
     * @return the port bound to
     */
    public synchronized int start() {
        if (channel != null) {
            throw new IllegalStateException("This server is already started");
        }
        bossGroup = new MultiThreadIoEventLoopGroup(1, NioIoHandler.newFactory());
        workerGroup = new MultiThreadIoEventLoopGroup(nettySettings.activeWorkerThreadCount(), NioIoHandler.newFactory());
        ServerBootstrap b = new ServerBootstrap();
        b.group(bossGroup, workerGroup)
                .channel(NioServerSocketChannel.class)
                .option(ChannelOption.SO_BACKLOG, 100)
                .childOption(ChannelOption.TCP_NODELAY, true)
                .childHandler(new ChannelInitializer<SocketChannel>() {
                    @Override
                    public void initChannel(SocketChannel ch) {
                        ChannelPipeline p = ch.pipeline();
                        p.addLast("frameDecoder", new KafkaFrameDecoder(serverSettings.activeMaxFrameSizeBytes()));
                        p.addLast("requestDecoder", new KafkaRequestDecoder());
                        p.addLast("frameEncoder", new LengthFieldPrepender(KafkaFrameDecoder.FRAME_SIZE_LENGTH));
                        p.addLast("responseEncoder", new KafkaResponseEncoder());
                        serverSettings.activeFrameLogLevel()
                                .ifPresent(level -> p.addLast("frameLogger", new FrameLoggingHandler("io.kafkawire.server.frameLogger", level)));
                        p.addLast("serverHandler", new KafkaServerHandler(handlerFactory.get()));
                    }
                });

        ChannelFuture f;
        try {
            f = serverSettings.bindAddress()
                    .map(address -> b.bind(address, serverSettings.port()))
                    .orElseGet(() -> b.bind(serverSettings.port()))
                    .sync();
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            shutdownGroups();
            throw new IllegalStateException(e);
        }
        channel = f.channel();
        InetSocketAddress localAddress = (InetSocketAddress) channel.localAddress();
        LOGGER.info("Kafka protocol server listening on {}", localAddress);
        return localAddress.getPort();
    }

    /**
     * @return the port the server is listening on.
     * @throws IllegalStateException if the server is not started
     */
    public synchronized int port() {
        if (channel == null) {
            throw new IllegalStateException("This server is not started");
        }
        return ((InetSocketAddress) channel.localAddress()).getPort();
    }

    @Override
    public synchronized void close() {
        if (channel == null) {
            return;
        }
        try {
            channel.close().sync();
        }
        catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(ie);
        }
        finally {
            channel = null;
            shutdownGroups();
        }
        LOGGER.info("Kafka protocol server stopped");
    }

    private void shutdownGroups() {
        if (bossGroup != null) {
            bossGroup.shutdownGracefully();
            bossGroup = null;
        }
        if (workerGroup != null) {
            workerGroup.shutdownGracefully();
            workerGroup = null;
        }
    }
}
