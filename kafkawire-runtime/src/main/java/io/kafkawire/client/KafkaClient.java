/*
 * Copyright kafkawire Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kafkawire.client;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.netty.bootstrap.Bootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.ChannelPipeline;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.MultiThreadIoEventLoopGroup;
import io.netty.channel.nio.NioIoHandler;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioSocketChannel;
import io.netty.handler.codec.LengthFieldPrepender;
import io.netty.util.concurrent.DefaultThreadFactory;

import io.kafkawire.config.ClientSettings;
import io.kafkawire.internal.FrameLoggingHandler;
import io.kafkawire.internal.KafkaClientHandler;
import io.kafkawire.internal.codec.CorrelationManager;
import io.kafkawire.internal.codec.FetchResponseSplitter;
import io.kafkawire.internal.codec.KafkaFrameDecoder;
import io.kafkawire.internal.codec.KafkaRequestEncoder;
import io.kafkawire.internal.codec.KafkaResponseDecoder;
import io.kafkawire.internal.codec.StreamResponseDecoder;
import io.kafkawire.protocol.NilResponse;
import io.kafkawire.protocol.Request;
import io.kafkawire.protocol.Response;
import io.kafkawire.protocol.StreamFetchResponse;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * A pipelined connection to a Kafka broker.
 * <p>
 * The connection is made on the first {@link #send(Request)}. Requests may be sent without waiting for earlier
 * responses; responses are matched to requests in the order the requests were sent. If the connection fails,
 * or a response cannot be matched, every outstanding request fails and the client is no longer usable.
 * </p>
 * <p>
 * With {@link ClientSettings#isStreamingFetch() streaming fetch} enabled, fetch requests complete with a
 * {@link StreamFetchResponse} as soon as the response header arrives. Its streams are fed by the connection's
 * event loop, which stops reading while a stream's consumer is behind.
 * </p>
 * <p>
 * Returned futures complete on a callback thread of this client, never on the event loop, so a callback may
 * wait on a response's streams or on another request.
 * </p>
 */
public final class KafkaClient implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(KafkaClient.class);

    private final ClientSettings settings;
    private final AtomicReference<CompletableFuture<Channel>> connected = new AtomicReference<>();
    private final AtomicInteger correlationId = new AtomicInteger(0);

    private final EventLoopGroup group;
    private final ExecutorService callbackExecutor;
    private final CorrelationManager correlationManager;
    private final KafkaClientHandler kafkaClientHandler;

    public KafkaClient(ClientSettings settings) {
        this.settings = Objects.requireNonNull(settings);
        this.group = new MultiThreadIoEventLoopGroup(1, NioIoHandler.newFactory());
        this.callbackExecutor = Executors.newCachedThreadPool(new DefaultThreadFactory("kafkawire-client-callback", true));
        this.correlationManager = new CorrelationManager();
        this.kafkaClientHandler = new KafkaClientHandler();
    }

    /**
     * @return a correlation id not yet handed out by this client.
     */
    public int nextCorrelationId() {
        return correlationId.incrementAndGet();
    }

    /**
     * @return the client id configured for this client, for use in request headers.
     */
    public @Nullable String clientId() {
        return settings.clientId().orElse(null);
    }

    /**
     * Send a request, connecting first if necessary.
     * @param request request to send
     * @return a future completed with the response, or with a {@link NilResponse} once a request
     * that expects no response has been written.
     */
    public CompletableFuture<Response> send(Request request) {
        return ensureChannel()
                .thenApply(KafkaClient::checkChannelOpen)
                .thenCompose(c -> kafkaClientHandler.sendRequest(request))
                .thenApplyAsync(response -> response, callbackExecutor);
    }

    /**
     * Send a request and wait for its response.
     * @param request request to send
     * @param timeout maximum time to wait
     * @param unit unit of the timeout
     * @return the response
     */
    public Response sendSync(Request request, long timeout, TimeUnit unit) {
        try {
            return send(request).get(timeout, unit);
        }
        catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException(ie);
        }
        catch (Exception e) {
            throw new IllegalStateException("Request with correlation id " + request.correlationId() + " failed", e);
        }
    }

    private CompletableFuture<Channel> ensureChannel() {
        var candidate = new CompletableFuture<Channel>();

        if (connected.compareAndSet(null, candidate)) {
            Bootstrap b = new Bootstrap();
            b.group(group)
                    .channel(NioSocketChannel.class)
                    .option(ChannelOption.TCP_NODELAY, true)
                    .handler(new ChannelInitializer<SocketChannel>() {
                        @Override
                        public void initChannel(SocketChannel ch) {
                            ChannelPipeline p = ch.pipeline();
                            int maxFrameSize = settings.activeMaxFrameSizeBytes();
                            if (settings.isStreamingFetch()) {
                                p.addLast("fetchSplitter", new FetchResponseSplitter(correlationManager, maxFrameSize));
                                p.addLast("responseDecoder", new StreamResponseDecoder());
                            }
                            else {
                                p.addLast("frameDecoder", new KafkaFrameDecoder(maxFrameSize));
                                p.addLast("responseDecoder", new KafkaResponseDecoder(correlationManager));
                            }
                            p.addLast("frameEncoder", new LengthFieldPrepender(KafkaFrameDecoder.FRAME_SIZE_LENGTH));
                            p.addLast("requestEncoder", new KafkaRequestEncoder(correlationManager));
                            settings.activeFrameLogLevel()
                                    .ifPresent(level -> p.addLast("frameLogger", new FrameLoggingHandler("io.kafkawire.client.frameLogger", level)));
                            p.addLast("clientHandler", kafkaClientHandler);
                        }
                    });

            ChannelFuture connect = b.connect(settings.host(), settings.port());
            connect.addListener((ChannelFutureListener) channelFuture -> {
                if (channelFuture.isSuccess()) {
                    LOGGER.debug("Connected to {}:{}", settings.host(), settings.port());
                    candidate.complete(channelFuture.channel());
                }
                else {
                    LOGGER.warn("Failed to connect to {}:{}", settings.host(), settings.port(), channelFuture.cause());
                    candidate.completeExceptionally(channelFuture.cause());
                }
            });
            return candidate;
        }
        else {
            return connected.get();
        }
    }

    public boolean isOpen() {
        CompletableFuture<Channel> channelCompletableFuture = connected.get();
        if (channelCompletableFuture == null) {
            return false;
        }
        else {
            Channel now = channelCompletableFuture.getNow(null);
            return now != null && now.isOpen();
        }
    }

    @Override
    public void close() {
        CompletableFuture<Channel> channelCompletableFuture = connected.get();
        if (channelCompletableFuture != null) {
            channelCompletableFuture.thenApply(Channel::close);
        }
        group.shutdownGracefully();
        callbackExecutor.shutdown();
    }

    private static Channel checkChannelOpen(Channel c) {
        if (!c.isOpen()) {
            throw new IllegalStateException("Channel is already closed");
        }
        return c;
    }
}
