/*
 * Copyright kafkawire Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kafkawire.internal;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelOutboundHandlerAdapter;
import io.netty.channel.ChannelPromise;
import io.netty.channel.embedded.EmbeddedChannel;

import io.kafkawire.internal.codec.OpaqueRequestFrame;
import io.kafkawire.protocol.ConsumerMetadataRequest;
import io.kafkawire.protocol.ConsumerMetadataResponse;
import io.kafkawire.protocol.ConsumerMetadataResult;
import io.kafkawire.protocol.KafkaError;
import io.kafkawire.protocol.NilResponse;
import io.kafkawire.protocol.Response;
import io.kafkawire.server.RejectedRequestException;
import io.kafkawire.server.RequestHandler;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class KafkaServerHandlerTest {

    @Mock
    RequestHandler requestHandler;

    private EmbeddedChannel channel;

    @BeforeEach
    void setUp() {
        channel = new EmbeddedChannel(new KafkaServerHandler(requestHandler));
    }

    @AfterEach
    void tearDown() {
        channel.finishAndReleaseAll();
    }

    private static ConsumerMetadataRequest request(int correlationId) {
        return new ConsumerMetadataRequest(correlationId, "client", "group");
    }

    private static ConsumerMetadataResponse response(int correlationId) {
        return new ConsumerMetadataResponse(correlationId, new ConsumerMetadataResult(KafkaError.NONE, 1, "broker-1", 9092));
    }

    @Test
    void dispatchesOneRequestAtATime() {
        CompletableFuture<Response> first = new CompletableFuture<>();
        CompletableFuture<Response> second = new CompletableFuture<>();
        when(requestHandler.handle(request(1))).thenReturn(first);
        when(requestHandler.handle(request(2))).thenReturn(second);

        channel.writeInbound(request(1), request(2));

        verify(requestHandler).handle(request(1));
        verify(requestHandler, never()).handle(request(2));

        first.complete(response(1));
        channel.runPendingTasks();

        assertThat((Object) channel.readOutbound()).isEqualTo(response(1));
        verify(requestHandler).handle(request(2));
        assertThat((Object) channel.readOutbound()).isNull();

        second.complete(response(2));
        channel.runPendingTasks();

        assertThat((Object) channel.readOutbound()).isEqualTo(response(2));
    }

    @Test
    void writesNothingForNilResponse() {
        when(requestHandler.handle(request(1))).thenReturn(CompletableFuture.completedFuture(new NilResponse(1)));
        when(requestHandler.handle(request(2))).thenReturn(CompletableFuture.completedFuture(response(2)));

        channel.writeInbound(request(1), request(2));
        channel.runPendingTasks();

        assertThat((Object) channel.readOutbound()).isEqualTo(response(2));
        assertThat((Object) channel.readOutbound()).isNull();
        assertThat(channel.isOpen()).isTrue();
    }

    @Test
    void reportsValueThatIsNotARequest() {
        when(requestHandler.handle(request(1))).thenReturn(CompletableFuture.completedFuture(response(1)));

        channel.writeInbound("not a request", request(1));
        channel.runPendingTasks();

        ArgumentCaptor<RejectedRequestException> rejected = ArgumentCaptor.forClass(RejectedRequestException.class);
        verify(requestHandler).rejected(rejected.capture());
        assertThat(rejected.getValue().correlationId()).isEmpty();
        assertThat((Object) channel.readOutbound()).isEqualTo(response(1));
        assertThat(channel.isOpen()).isTrue();
    }

    @Test
    void reportsUnsupportedRequestInTurn() {
        CompletableFuture<Response> first = new CompletableFuture<>();
        when(requestHandler.handle(request(1))).thenReturn(first);

        channel.writeInbound(request(1), new OpaqueRequestFrame((short) 99, (short) 0, 2, "client", 0));
        verify(requestHandler, never()).rejected(any());

        first.complete(response(1));
        channel.runPendingTasks();

        ArgumentCaptor<RejectedRequestException> rejected = ArgumentCaptor.forClass(RejectedRequestException.class);
        verify(requestHandler).rejected(rejected.capture());
        assertThat(rejected.getValue().correlationId()).hasValue(2);
        assertThat(rejected.getValue()).hasMessageContaining("api key 99");
        assertThat((Object) channel.readOutbound()).isEqualTo(response(1));
        assertThat((Object) channel.readOutbound()).isNull();
        assertThat(channel.isOpen()).isTrue();
    }

    @Test
    void throwingRejectionClosesConnection() {
        doThrow(new IllegalStateException("boom")).when(requestHandler).rejected(any());

        channel.writeInbound("not a request", request(1));

        assertThat(channel.isOpen()).isFalse();
        verify(requestHandler, never()).handle(request(1));
    }

    @Test
    void nextRequestWaitsForResponseToBeWritten() {
        List<ChannelPromise> writes = heldWrites();
        when(requestHandler.handle(request(1))).thenReturn(CompletableFuture.completedFuture(response(1)));
        when(requestHandler.handle(request(2))).thenReturn(CompletableFuture.completedFuture(response(2)));

        channel.writeInbound(request(1), request(2));
        channel.runPendingTasks();

        assertThat(writes).hasSize(1);
        verify(requestHandler, never()).handle(request(2));

        writes.get(0).setSuccess();
        channel.runPendingTasks();

        verify(requestHandler).handle(request(2));
        assertThat(writes).hasSize(2);
    }

    @Test
    void failedWriteClosesConnection() {
        List<ChannelPromise> writes = heldWrites();
        when(requestHandler.handle(request(1))).thenReturn(CompletableFuture.completedFuture(response(1)));

        channel.writeInbound(request(1), request(2));
        channel.runPendingTasks();
        writes.get(0).setFailure(new IOException("connection reset"));
        channel.runPendingTasks();

        assertThat(channel.isOpen()).isFalse();
        verify(requestHandler, never()).handle(request(2));
    }

    /**
     * Replaces the channel with one whose writes complete only when the test completes their promises.
     */
    private List<ChannelPromise> heldWrites() {
        channel.finishAndReleaseAll();
        List<ChannelPromise> writes = new ArrayList<>();
        channel = new EmbeddedChannel(new ChannelOutboundHandlerAdapter() {
            @Override
            public void write(ChannelHandlerContext ctx, Object msg, ChannelPromise promise) {
                writes.add(promise);
            }
        }, new KafkaServerHandler(requestHandler));
        return writes;
    }

    @Test
    void failedHandlerClosesConnection() {
        when(requestHandler.handle(request(1))).thenReturn(CompletableFuture.failedFuture(new IllegalStateException("boom")));

        channel.writeInbound(request(1), request(2));
        channel.runPendingTasks();

        assertThat(channel.isOpen()).isFalse();
        assertThat((Object) channel.readOutbound()).isNull();
        verify(requestHandler, never()).handle(request(2));
        verify(requestHandler).close();
    }

    @Test
    void throwingHandlerClosesConnection() {
        when(requestHandler.handle(request(1))).thenThrow(new IllegalStateException("boom"));

        channel.writeInbound(request(1));
        channel.runPendingTasks();

        assertThat(channel.isOpen()).isFalse();
    }

    @Test
    void closeCancelsInFlightRequestAndClosesHandler() {
        CompletableFuture<Response> inFlight = new CompletableFuture<>();
        when(requestHandler.handle(request(1))).thenReturn(inFlight);
        channel.writeInbound(request(1), request(2));

        channel.close();

        assertThat(inFlight).isCancelled();
        verify(requestHandler).close();
        verify(requestHandler, never()).handle(request(2));
    }

    @Test
    void answersRequestsPipelinedBehindEachOther() {
        when(requestHandler.handle(request(1))).thenReturn(CompletableFuture.completedFuture(response(1)));
        when(requestHandler.handle(request(2))).thenReturn(CompletableFuture.completedFuture(response(2)));
        when(requestHandler.handle(request(3))).thenReturn(CompletableFuture.completedFuture(response(3)));

        channel.writeInbound(request(1), request(2), request(3));
        channel.runPendingTasks();

        assertThat(List.<Object> of(channel.readOutbound(), channel.readOutbound(), channel.readOutbound()))
                .containsExactly(response(1), response(2), response(3));
    }
}
