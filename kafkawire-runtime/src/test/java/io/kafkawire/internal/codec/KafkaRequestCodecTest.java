/*
 * Copyright kafkawire Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kafkawire.internal.codec;

import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import io.netty.buffer.ByteBuf;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFuture;
import io.netty.channel.embedded.EmbeddedChannel;
import io.netty.handler.codec.DecoderException;

import io.kafkawire.protocol.ApiKey;
import io.kafkawire.protocol.ConsumerMetadataRequest;
import io.kafkawire.protocol.FetchRequest;
import io.kafkawire.protocol.MetadataRequest;
import io.kafkawire.protocol.OffsetCommitRequest;
import io.kafkawire.protocol.OffsetFetchRequest;
import io.kafkawire.protocol.OffsetRequest;
import io.kafkawire.protocol.ProduceRequest;
import io.kafkawire.protocol.Request;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class KafkaRequestCodecTest {

    private final CorrelationManager correlationManager = new CorrelationManager();
    private final EmbeddedChannel clientChannel = new EmbeddedChannel(new KafkaRequestEncoder(correlationManager));
    private final EmbeddedChannel serverChannel = new EmbeddedChannel(new KafkaRequestDecoder());

    @AfterEach
    void tearDown() {
        clientChannel.finishAndReleaseAll();
        serverChannel.finishAndReleaseAll();
    }

    static Stream<Request> requests() {
        return Stream.of(
                new ProduceRequest(1, "client", (short) 1, 1500,
                        ResponseFixtures.topic("orders", 0, ResponseFixtures.messages(0, "a", "b"))),
                new FetchRequest(2, "client", FetchRequest.CONSUMER_REPLICA_ID, 100, 1,
                        ResponseFixtures.topic("orders", 0, new FetchRequest.FetchOffset(10L, 1 << 20))),
                new OffsetRequest(3, null, FetchRequest.CONSUMER_REPLICA_ID,
                        ResponseFixtures.topic("orders", 1, new OffsetRequest.OffsetQuery(OffsetRequest.EARLIEST_TIME, 1))),
                new MetadataRequest(4, "client", List.of("orders", "payments")),
                new MetadataRequest(5, "client", List.of()),
                new OffsetCommitRequest(6, "client", "group",
                        ResponseFixtures.topic("orders", 0, new OffsetCommitRequest.CommitOffset(99L, null))),
                new OffsetFetchRequest(7, "client", "group", Map.of("orders", List.of(0, 1, 2))),
                new ConsumerMetadataRequest(8, "client", "group"));
    }

    @ParameterizedTest
    @MethodSource("requests")
    void decodesEncodedRequest(Request request) {
        clientChannel.writeOutbound(request);
        ByteBuf encoded = clientChannel.readOutbound();

        serverChannel.writeInbound(encoded);

        assertThat((Object) serverChannel.readInbound()).isEqualTo(request);
    }

    @ParameterizedTest
    @MethodSource("requests")
    void registersRequestThatExpectsResponse(Request request) {
        clientChannel.writeOutbound(request);
        ((ByteBuf) clientChannel.readOutbound()).release();

        assertThat(correlationManager.resolve(request.correlationId())).isEqualTo(request.apiKey());
    }

    @Test
    void headerLayout() {
        clientChannel.writeOutbound(new MetadataRequest(0x01020304, "c", List.of()));
        ByteBuf encoded = clientChannel.readOutbound();
        try {
            assertThat(encoded.readShort()).isEqualTo(ApiKey.METADATA.id());
            assertThat(encoded.readShort()).isEqualTo(RequestBodyEncoder.API_VERSION);
            assertThat(encoded.readInt()).isEqualTo(0x01020304);
            assertThat(encoded.readShort()).isEqualTo((short) 1);
            assertThat(encoded.readByte()).isEqualTo((byte) 'c');
            assertThat(encoded.readInt()).isZero();
            assertThat(encoded.isReadable()).isFalse();
        }
        finally {
            encoded.release();
        }
    }

    @Test
    void produceWithoutAcksIsNotRegistered() {
        ProduceRequest request = new ProduceRequest(9, "client", (short) 0, 1500, ResponseFixtures.topic("orders", 0, ResponseFixtures.messages(0, "a")));

        clientChannel.writeOutbound(request);
        ((ByteBuf) clientChannel.readOutbound()).release();

        assertThat(request.expectsResponse()).isFalse();
        assertThat(correlationManager.tryResolve(9)).isEmpty();
    }

    @Test
    void duplicateOutstandingCorrelationIdFailsTheWrite() {
        clientChannel.writeOutbound(new MetadataRequest(10, "client", List.of()));
        ((ByteBuf) clientChannel.readOutbound()).release();

        ChannelFuture second = clientChannel.writeOneOutbound(new ConsumerMetadataRequest(10, "client", "group"));
        clientChannel.flushOutbound();

        assertThat(second.isSuccess()).isFalse();
        assertThat(second.cause()).hasRootCauseInstanceOf(IllegalStateException.class);
        assertThat(correlationManager.resolve(10)).isEqualTo(ApiKey.METADATA);
    }

    @Test
    void unknownApiKeyBecomesOpaqueFrame() {
        ByteBuf frame = Unpooled.buffer();
        frame.writeShort(18); // ApiVersions
        frame.writeShort(0);
        frame.writeInt(21);
        frame.writeShort(-1);
        frame.writeBytes(new byte[]{ 1, 2, 3 });

        serverChannel.writeInbound(frame);

        assertThat((Object) serverChannel.readInbound()).isEqualTo(new OpaqueRequestFrame((short) 18, (short) 0, 21, null, 3));
    }

    @Test
    void unsupportedVersionBecomesOpaqueFrame() {
        ByteBuf frame = Unpooled.buffer();
        frame.writeShort(ApiKey.METADATA.id());
        frame.writeShort(1);
        frame.writeInt(22);
        frame.writeShort(-1);
        frame.writeInt(0);

        serverChannel.writeInbound(frame);

        assertThat((Object) serverChannel.readInbound()).isEqualTo(new OpaqueRequestFrame(ApiKey.METADATA.id(), (short) 1, 22, null, 4));
    }

    @Test
    void truncatedRequestFails() {
        ByteBuf frame = Unpooled.buffer();
        frame.writeShort(ApiKey.METADATA.id());
        frame.writeShort(0);
        frame.writeInt(23);
        frame.writeShort(-1);
        frame.writeInt(2);
        frame.writeShort(100);

        assertThatThrownBy(() -> serverChannel.writeInbound(frame))
                .isInstanceOf(DecoderException.class)
                .hasCauseInstanceOf(KafkaCodecException.class);
    }
}
