package io.addresswatcher.engine.consumer;

import static io.addresswatcher.engine.testutil.EnvelopeFixtures.bytes;
import static io.addresswatcher.engine.testutil.EnvelopeFixtures.valid;

import io.addresswatcher.engine.event.ChangeEvent;
import io.addresswatcher.engine.event.Operation;
import io.addresswatcher.engine.testutil.FakeBrokerConnector;
import io.addresswatcher.engine.testutil.RecordingSleeper;
import io.addresswatcher.engine.testutil.ScriptedRecordStream;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.apache.kafka.common.KafkaException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class StreamReaderTest {

    private static final Duration FETCH_RETRY_DELAY = Duration.ofMillis(10);

    private final ExecutorService executor = Executors.newSingleThreadExecutor();
    private final Cancellation cancellation = new Cancellation();
    private final List<ChangeEvent> delivered = new CopyOnWriteArrayList<>();
    private final AtomicInteger opens = new AtomicInteger();
    private ConnectionManager manager;

    @BeforeEach
    void createManager() {
        manager = ConnectionManager.builder(ConnectionConfig.of("localhost:9092", "users", 0))
                .connector(FakeBrokerConnector.healthy())
                .sleeper(new RecordingSleeper())
                .build();
    }

    @AfterEach
    void cleanUp() {
        cancellation.cancel();
        executor.shutdownNow();
        manager.close();
    }

    @Test
    void skipsMalformedRecordsAndSurvivesHandlerFailures() throws Exception {
        ScriptedRecordStream stream = new ScriptedRecordStream()
                .thenValue(bytes("{\"payload\": {\"op\": "))
                .thenValue(bytes(valid("c")))
                .thenValue(bytes(valid("u")));
        EventHandler handler = event -> {
            delivered.add(event);
            if (event.operation() == Operation.UPDATE) {
                throw new IllegalStateException("notification service unavailable");
            }
        };

        Future<?> reading = start(stream, handler);

        Assertions.assertTrue(stream.awaitExhausted(5, TimeUnit.SECONDS), "reader stopped fetching");
        Assertions.assertEquals(4, stream.fetches());
        Assertions.assertEquals(
                List.of(Operation.CREATE, Operation.UPDATE),
                delivered.stream().map(ChangeEvent::operation).toList());

        cancellation.cancel();
        assertCancelled(reading);
        Assertions.assertTrue(stream.isClosed());
    }

    @Test
    void retriesFailedFetches() throws Exception {
        ScriptedRecordStream stream = new ScriptedRecordStream()
                .thenFailure(new KafkaException("broker disconnected"))
                .thenFailure(new KafkaException("broker disconnected"))
                .thenValue(bytes(valid("c")));

        Future<?> reading = start(stream, delivered::add);

        Assertions.assertTrue(stream.awaitExhausted(5, TimeUnit.SECONDS));
        Assertions.assertEquals(1, delivered.size());

        cancellation.cancel();
        assertCancelled(reading);
    }

    @Test
    void deliversEventsInFetchOrder() throws Exception {
        ScriptedRecordStream stream = new ScriptedRecordStream()
                .thenValue(bytes(valid("r")))
                .thenValue(bytes(valid("c")))
                .thenValue(bytes(valid("u")))
                .thenValue(bytes(valid("d")));

        Future<?> reading = start(stream, delivered::add);

        Assertions.assertTrue(stream.awaitExhausted(5, TimeUnit.SECONDS));
        Assertions.assertEquals(
                List.of(Operation.READ, Operation.CREATE, Operation.UPDATE, Operation.DELETE),
                delivered.stream().map(ChangeEvent::operation).toList());

        cancellation.cancel();
        assertCancelled(reading);
    }

    @Test
    void skipsTombstones() throws Exception {
        ScriptedRecordStream stream = new ScriptedRecordStream()
                .thenValue(bytes(valid("d")))
                .thenValue(null)
                .thenValue(bytes(valid("c")));

        Future<?> reading = start(stream, delivered::add);

        Assertions.assertTrue(stream.awaitExhausted(5, TimeUnit.SECONDS));
        Assertions.assertEquals(2, delivered.size());

        cancellation.cancel();
        assertCancelled(reading);
    }

    @Test
    void cancellationInterruptsBlockedFetch() throws Exception {
        ScriptedRecordStream stream = new ScriptedRecordStream();

        Future<?> reading = start(stream, delivered::add);
        Assertions.assertTrue(stream.awaitExhausted(5, TimeUnit.SECONDS));

        cancellation.cancel();

        assertCancelled(reading);
        Assertions.assertEquals(1, stream.fetches());
    }

    @Test
    void alreadyCancelledReadDoesNotFetch() {
        ScriptedRecordStream stream = new ScriptedRecordStream();
        cancellation.cancel();

        Assertions.assertThrows(
                CancellationException.class,
                () -> reader(stream).read(cancellation, manager, delivered::add));

        Assertions.assertEquals(0, opens.get());
        Assertions.assertEquals(0, stream.fetches());
    }

    @Test
    void rejectsMissingArguments() {
        StreamReader reader = reader(new ScriptedRecordStream());

        Assertions.assertThrows(IllegalArgumentException.class, () -> reader.read(cancellation, null, delivered::add));
        Assertions.assertThrows(IllegalArgumentException.class, () -> reader.read(cancellation, manager, null));
        Assertions.assertThrows(IllegalArgumentException.class, () -> reader.read(null, manager, delivered::add));
        Assertions.assertEquals(0, opens.get());
    }

    @Test
    void closedManagerFailsBeforeSubscribing() {
        manager.close();

        Assertions.assertThrows(
                ManagerClosedException.class,
                () -> reader(new ScriptedRecordStream()).read(cancellation, manager, delivered::add));
        Assertions.assertEquals(0, opens.get());
    }

    @Test
    void cancellationStopsReconnectBeforeSubscribing() throws Exception {
        manager.close();
        FakeBrokerConnector connector = FakeBrokerConnector.healthy();
        manager = ConnectionManager.builder(ConnectionConfig.of("localhost:9092", "users", 0)
                        .withRetries(5, Duration.ofMillis(500)))
                .connector(connector)
                .build();
        connector.failNext(Integer.MAX_VALUE);
        connector.lastConnection().kill();

        Future<?> reading = start(new ScriptedRecordStream(), delivered::add);
        Thread.sleep(100);
        long cancelledAt = System.nanoTime();
        cancellation.cancel("shutdown");

        assertCancelled(reading);
        Assertions.assertTrue(Duration.ofNanos(System.nanoTime() - cancelledAt).compareTo(Duration.ofSeconds(2)) < 0,
                "reconnect kept backing off after cancellation");
        Assertions.assertTrue(connector.attempts() < 6, "reconnect used every attempt");
        Assertions.assertEquals(0, opens.get());
    }

    private Future<?> start(ScriptedRecordStream stream, EventHandler handler) {
        StreamReader reader = reader(stream);
        return executor.submit(() -> reader.read(cancellation, manager, handler));
    }

    private StreamReader reader(ScriptedRecordStream stream) {
        return new StreamReader((config, groupId) -> {
            opens.incrementAndGet();
            Assertions.assertEquals(StreamReader.GROUP_ID, groupId);
            return stream;
        }, FETCH_RETRY_DELAY);
    }

    private static void assertCancelled(Future<?> reading) throws Exception {
        ExecutionException e = Assertions.assertThrows(ExecutionException.class, () -> reading.get(5, TimeUnit.SECONDS));
        Assertions.assertInstanceOf(CancellationException.class, e.getCause());
    }
}
