/*
 * Copyright kafkawire Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kafkawire.client;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import io.kafkawire.config.ClientSettings;
import io.kafkawire.config.NettySettings;
import io.kafkawire.config.ServerSettings;
import io.kafkawire.protocol.Broker;
import io.kafkawire.protocol.ConsumerMetadataRequest;
import io.kafkawire.protocol.FetchRequest;
import io.kafkawire.protocol.FetchResponse;
import io.kafkawire.protocol.FetchResult;
import io.kafkawire.protocol.FetchedMessage;
import io.kafkawire.protocol.KafkaError;
import io.kafkawire.protocol.Message;
import io.kafkawire.protocol.MessageAndOffset;
import io.kafkawire.protocol.MessageSet;
import io.kafkawire.protocol.MetadataRequest;
import io.kafkawire.protocol.MetadataResponse;
import io.kafkawire.protocol.NilResponse;
import io.kafkawire.protocol.PartitionMetadata;
import io.kafkawire.protocol.PartitionStatus;
import io.kafkawire.protocol.ProduceRequest;
import io.kafkawire.protocol.ProduceResponse;
import io.kafkawire.protocol.ProduceResult;
import io.kafkawire.protocol.Request;
import io.kafkawire.protocol.Response;
import io.kafkawire.protocol.StreamFetchResponse;
import io.kafkawire.protocol.TopicMetadata;
import io.kafkawire.server.KafkaServer;
import io.kafkawire.server.RequestHandler;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Runs a client against a server over loopback, the server answering from a small in-memory log.
 */
class KafkaClientServerTest {

    private static final Broker BROKER = new Broker(0, "localhost", 9092);

    private final List<Message> log = new ArrayList<>();
    private KafkaServer server;
    private KafkaClient client;

    @BeforeEach
    void setUp() {
        for (int i = 0; i < 3; i++) {
            log.add(new Message(null, ("message-" + i).getBytes(StandardCharsets.UTF_8)));
        }
        server = new KafkaServer(new ServerSettings(Optional.of("127.0.0.1"), 0, Optional.empty(), Optional.of("DEBUG")),
                new NettySettings(Optional.of(1)), InMemoryHandler::new);
        server.start();
    }

    @AfterEach
    void tearDown() {
        if (client != null) {
            client.close();
        }
        server.close();
    }

    private KafkaClient connect(boolean streamingFetch) {
        ClientSettings settings = new ClientSettings("127.0.0.1", server.port(), Optional.of("loopback"), Optional.empty(),
                Optional.of(streamingFetch), Optional.of("DEBUG"));
        client = new KafkaClient(settings);
        return client;
    }

    private final class InMemoryHandler implements RequestHandler {

        @Override
        public CompletionStage<Response> handle(Request request) {
            if (request instanceof MetadataRequest metadata) {
                List<TopicMetadata> topics = metadata.topics().stream()
                        .map(topic -> topic.equals("orders")
                                ? new TopicMetadata(KafkaError.NONE, topic,
                                        List.of(new PartitionMetadata(KafkaError.NONE, 0, Optional.of(BROKER), List.of(BROKER), List.of(BROKER))))
                                : new TopicMetadata(KafkaError.UNKNOWN_TOPIC_OR_PARTITION, topic, List.of()))
                        .toList();
                return CompletableFuture.completedFuture(new MetadataResponse(metadata.correlationId(), List.of(BROKER), topics));
            }
            else if (request instanceof ProduceRequest produce) {
                if (produce.requiredAcks() == 0) {
                    return CompletableFuture.completedFuture(new NilResponse(produce.correlationId()));
                }
                return CompletableFuture.supplyAsync(() -> new ProduceResponse(produce.correlationId(),
                        Map.of("orders", Map.of(0, new ProduceResult(KafkaError.NONE, log.size())))));
            }
            else if (request instanceof FetchRequest fetch) {
                Map<String, Map<Integer, FetchResult>> results = new LinkedHashMap<>();
                fetch.topics().forEach((topic, partitions) -> {
                    Map<Integer, FetchResult> partitionResults = new LinkedHashMap<>();
                    partitions.forEach((partition, offset) -> partitionResults.put(partition, topic.equals("orders") && partition == 0
                            ? new FetchResult(KafkaError.NONE, log.size(), messagesFrom(offset.offset()))
                            : new FetchResult(KafkaError.UNKNOWN_TOPIC_OR_PARTITION, -1L, MessageSet.EMPTY)));
                    results.put(topic, partitionResults);
                });
                return CompletableFuture.completedFuture(new FetchResponse(fetch.correlationId(), results));
            }
            return CompletableFuture.failedFuture(new UnsupportedOperationException(request.apiKey().toString()));
        }

        private MessageSet messagesFrom(long offset) {
            List<MessageAndOffset> entries = new ArrayList<>();
            for (long i = offset; i < log.size(); i++) {
                entries.add(new MessageAndOffset(i, log.get((int) i)));
            }
            return MessageSet.of(entries);
        }
    }

    private static Map<String, Map<Integer, FetchRequest.FetchOffset>> fetchFrom(long offset) {
        Map<String, Map<Integer, FetchRequest.FetchOffset>> topics = new LinkedHashMap<>();
        Map<Integer, FetchRequest.FetchOffset> partitions = new LinkedHashMap<>();
        partitions.put(0, new FetchRequest.FetchOffset(offset, 1 << 20));
        partitions.put(7, new FetchRequest.FetchOffset(0L, 1 << 20));
        topics.put("orders", partitions);
        return topics;
    }

    @ParameterizedTest
    @ValueSource(booleans = { false, true })
    void metadataRoundTrip(boolean streamingFetch) {
        KafkaClient kafkaClient = connect(streamingFetch);

        Response response = kafkaClient.sendSync(new MetadataRequest(kafkaClient.nextCorrelationId(), kafkaClient.clientId(), List.of("orders", "missing")),
                10, TimeUnit.SECONDS);

        assertThat(response).isInstanceOfSatisfying(MetadataResponse.class, metadata -> {
            assertThat(metadata.brokers()).containsExactly(BROKER);
            assertThat(metadata.topics()).extracting(TopicMetadata::error)
                    .containsExactly(KafkaError.NONE, KafkaError.UNKNOWN_TOPIC_OR_PARTITION);
            assertThat(metadata.topics().get(0).partitions().get(0).leader()).contains(BROKER);
        });
        assertThat(kafkaClient.isOpen()).isTrue();
    }

    @Test
    void pipelinedRequestsAreAnsweredInOrder() throws Exception {
        KafkaClient kafkaClient = connect(false);
        List<CompletableFuture<Response>> futures = new ArrayList<>();
        List<Integer> correlationIds = new ArrayList<>();

        for (int i = 0; i < 10; i++) {
            int correlationId = kafkaClient.nextCorrelationId();
            correlationIds.add(correlationId);
            Request request = i % 2 == 0
                    ? new MetadataRequest(correlationId, kafkaClient.clientId(), List.of("orders"))
                    : new ProduceRequest(correlationId, kafkaClient.clientId(), (short) 1, 1000,
                            Map.of("orders", Map.of(0, MessageSet.of(new MessageAndOffset(0L, log.get(0))))));
            futures.add(kafkaClient.send(request));
        }

        CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0])).get(10, TimeUnit.SECONDS);
        for (int i = 0; i < futures.size(); i++) {
            Response response = futures.get(i).get();
            assertThat(response.correlationId()).isEqualTo(correlationIds.get(i));
            assertThat(response).isInstanceOf(i % 2 == 0 ? MetadataResponse.class : ProduceResponse.class);
        }
    }

    @Test
    void produceWithoutAcksCompletesWithNilResponse() throws Exception {
        KafkaClient kafkaClient = connect(false);
        int correlationId = kafkaClient.nextCorrelationId();

        Response produced = kafkaClient.send(new ProduceRequest(correlationId, kafkaClient.clientId(), (short) 0, 1000,
                Map.of("orders", Map.of(0, MessageSet.EMPTY)))).get(10, TimeUnit.SECONDS);
        Response metadata = kafkaClient.sendSync(new MetadataRequest(kafkaClient.nextCorrelationId(), kafkaClient.clientId(), List.of()),
                10, TimeUnit.SECONDS);

        assertThat(produced).isEqualTo(new NilResponse(correlationId));
        assertThat(metadata).isInstanceOf(MetadataResponse.class);
    }

    @Test
    void batchFetchDecodesWholeResponse() {
        KafkaClient kafkaClient = connect(false);

        Response response = kafkaClient.sendSync(new FetchRequest(kafkaClient.nextCorrelationId(), kafkaClient.clientId(),
                FetchRequest.CONSUMER_REPLICA_ID, 100, 1, fetchFrom(1L)), 10, TimeUnit.SECONDS);

        assertThat(response).isInstanceOfSatisfying(FetchResponse.class, fetch -> {
            FetchResult result = fetch.results().get("orders").get(0);
            assertThat(result.highwaterMarkOffset()).isEqualTo(3L);
            assertThat(result.messages().entries()).extracting(MessageAndOffset::offset).containsExactly(1L, 2L);
            assertThat(fetch.results().get("orders").get(7).error()).isEqualTo(KafkaError.UNKNOWN_TOPIC_OR_PARTITION);
        });
    }

    @Test
    void streamingFetchDeliversMessagesAsTheyArrive() throws Exception {
        KafkaClient kafkaClient = connect(true);

        Response response = kafkaClient.send(new FetchRequest(kafkaClient.nextCorrelationId(), kafkaClient.clientId(),
                FetchRequest.CONSUMER_REPLICA_ID, 100, 1, fetchFrom(0L))).get(10, TimeUnit.SECONDS);

        assertThat(response).isInstanceOf(StreamFetchResponse.class);
        StreamFetchResponse stream = (StreamFetchResponse) response;
        CompletableFuture<List<PartitionStatus>> partitions = CompletableFuture.supplyAsync(() -> {
            try {
                return stream.partitions().drain();
            }
            catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new IllegalStateException(e);
            }
        });
        List<FetchedMessage> messages = stream.messages().drain();

        assertThat(messages).extracting(FetchedMessage::offset).containsExactly(0L, 1L, 2L);
        assertThat(messages).extracting(FetchedMessage::payload).containsExactlyElementsOf(log);
        assertThat(partitions.get(10, TimeUnit.SECONDS)).containsExactly(
                new PartitionStatus("orders", 0, KafkaError.NONE, 3L),
                new PartitionStatus("orders", 7, KafkaError.UNKNOWN_TOPIC_OR_PARTITION, -1L));
        stream.complete().toCompletableFuture().get(10, TimeUnit.SECONDS);

        Response metadata = kafkaClient.sendSync(new MetadataRequest(kafkaClient.nextCorrelationId(), kafkaClient.clientId(), List.of()),
                10, TimeUnit.SECONDS);
        assertThat(metadata).isInstanceOf(MetadataResponse.class);
    }

    @Test
    void streamingFetchCanBeDrainedInResponseCallback() throws Exception {
        KafkaClient kafkaClient = connect(true);

        CompletableFuture<List<FetchedMessage>> drained = kafkaClient.send(new FetchRequest(kafkaClient.nextCorrelationId(), kafkaClient.clientId(),
                FetchRequest.CONSUMER_REPLICA_ID, 100, 1, fetchFrom(0L)))
                .thenApply(response -> {
                    StreamFetchResponse stream = (StreamFetchResponse) response;
                    stream.partitions().discard();
                    try {
                        return stream.messages().drain();
                    }
                    catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        throw new IllegalStateException(e);
                    }
                });

        assertThat(drained.get(10, TimeUnit.SECONDS)).extracting(FetchedMessage::offset).containsExactly(0L, 1L, 2L);
        Response metadata = kafkaClient.sendSync(new MetadataRequest(kafkaClient.nextCorrelationId(), kafkaClient.clientId(), List.of()),
                10, TimeUnit.SECONDS);
        assertThat(metadata).isInstanceOf(MetadataResponse.class);
    }

    @Test
    void unsupportedRequestClosesConnection() {
        KafkaClient kafkaClient = connect(false);

        CompletableFuture<Response> future = kafkaClient.send(new ConsumerMetadataRequest(kafkaClient.nextCorrelationId(),
                kafkaClient.clientId(), "group"));

        assertThatThrownBy(() -> future.get(10, TimeUnit.SECONDS)).isInstanceOf(ExecutionException.class);
    }

    @Test
    void serverReportsItsPort() {
        assertThat(server.port()).isPositive();
        assertThatThrownBy(server::start).isInstanceOf(IllegalStateException.class);
    }
}
