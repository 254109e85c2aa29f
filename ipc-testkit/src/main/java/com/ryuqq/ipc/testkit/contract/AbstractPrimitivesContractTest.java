package com.ryuqq.ipc.testkit.contract;

import com.ryuqq.ipc.core.cache.Cache;
import com.ryuqq.ipc.core.cache.CacheConfig;
import com.ryuqq.ipc.core.codec.Utf8StringCodec;
import com.ryuqq.ipc.core.error.CursorExpiredException;
import com.ryuqq.ipc.core.error.IpcTimeoutException;
import com.ryuqq.ipc.core.model.ClientId;
import com.ryuqq.ipc.core.model.QueueMessage;
import com.ryuqq.ipc.core.model.StreamCursor;
import com.ryuqq.ipc.core.model.StreamEvent;
import com.ryuqq.ipc.core.poll.BlockingPoller;
import com.ryuqq.ipc.core.poll.PollingConfig;
import com.ryuqq.ipc.core.queue.QueueConfig;
import com.ryuqq.ipc.core.queue.ReadQueue;
import com.ryuqq.ipc.core.queue.WriteQueue;
import com.ryuqq.ipc.core.spi.ConnectionPool;
import com.ryuqq.ipc.core.stream.EventStream;
import com.ryuqq.ipc.core.stream.StartPosition;
import com.ryuqq.ipc.core.stream.StreamConfig;
import com.ryuqq.ipc.core.stream.StreamReader;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract suite every {@link ConnectionPool} adapter must pass.
 *
 * <p>The tests drive the real primitives ({@link Cache}, {@link WriteQueue}, {@link ReadQueue},
 * {@link EventStream}) against the pool returned by {@link #createPool()}, so an adapter proves
 * that its store commands give the primitives the semantics they promise.</p>
 *
 * <p><strong>Covered Properties:</strong></p>
 * <ul>
 *   <li>Cache: read-your-write, TTL expiry, blocking read, exists/delete</li>
 *   <li>Queue: FIFO exactly-once delivery, self-produced item exclusion, mutual exclusivity
 *       of concurrent consumers, blocking pop timeout bounds</li>
 *   <li>Stream: ordered gap-free reads, oldest-first trimming, cursor expiry, paging,
 *       blocking read, reader start positions and resync</li>
 * </ul>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class InMemoryPrimitivesContractTest extends AbstractPrimitivesContractTest {
 *     {@literal @}Override
 *     protected ConnectionPool createPool() {
 *         return new InMemoryConnectionPool(new InMemoryRemoteStore());
 *     }
 * }
 * </pre>
 *
 * <p>Every structure name is suffixed with a random id, so the suite can run against a shared
 * server without cleaning it.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public abstract class AbstractPrimitivesContractTest {

    /**
     * Slack for scheduler and network jitter on wall-clock assertions.
     */
    protected static final Duration TIMING_SLACK = Duration.ofMillis(500);

    protected ConnectionPool pool;
    protected PollingConfig polling;

    /**
     * Creates the pool under test. Called before every test; closed after it.
     *
     * @return a fresh pool
     */
    protected abstract ConnectionPool createPool();

    /**
     * Polling settings used by the primitives under test. Short slices keep the suite fast.
     *
     * @return polling settings
     */
    protected PollingConfig pollingConfig() {
        return new PollingConfig(Duration.ofMillis(20), Duration.ofMillis(200));
    }

    @BeforeEach
    void setUpPool() {
        polling = pollingConfig();
        pool = createPool();
    }

    @AfterEach
    void tearDownPool() {
        if (pool != null) {
            pool.close();
        }
    }

    // ============================================================
    // Cache
    // ============================================================

    @Test
    void cache_setThenGet_ReturnsValueUntilTtlElapses() {
        // Given
        Cache<String> cache = cache("session");

        // When
        cache.set("u1", "profile", Duration.ofMillis(300));

        // Then
        assertEquals(Optional.of("profile"), cache.get("u1"));
        sleep(Duration.ofMillis(700));
        assertEquals(Optional.empty(), cache.get("u1"));
    }

    @Test
    void cache_getBlocking_PresentValueReturnedImmediately() {
        // Given
        Cache<String> cache = cache("session");
        cache.set("u1", "profile", Duration.ofSeconds(2));

        // When
        long start = System.nanoTime();
        String value = cache.getBlocking("u1", Duration.ofSeconds(5));

        // Then
        assertEquals("profile", value);
        assertTrue(elapsedSince(start).compareTo(Duration.ofSeconds(1)) < 0,
            "present value should not wait for the timeout");
    }

    @Test
    void cache_getBlocking_ValueWrittenLaterIsReturned() throws Exception {
        // Given
        Cache<String> cache = cache("session");
        ExecutorService writer = Executors.newSingleThreadExecutor();

        try {
            // When
            writer.submit(() -> {
                sleep(Duration.ofMillis(150));
                cache.set("u1", "late");
            });
            String value = cache.getBlocking("u1", Duration.ofSeconds(3));

            // Then
            assertEquals("late", value);
        } finally {
            shutdown(writer);
        }
    }

    @Test
    void cache_getBlocking_AbsentKeyTimesOutWithinBounds() {
        // Given
        Cache<String> cache = cache("session");
        Duration timeout = Duration.ofMillis(300);

        // When
        long start = System.nanoTime();
        assertThrows(IpcTimeoutException.class, () -> cache.getBlocking("missing", timeout));
        Duration elapsed = elapsedSince(start);

        // Then
        assertTrue(elapsed.compareTo(timeout) >= 0, "returned before the timeout: " + elapsed);
        assertTrue(elapsed.compareTo(timeout.plus(polling.pollInterval()).plus(TIMING_SLACK)) <= 0,
            "overshot the timeout: " + elapsed);
    }

    @Test
    void cache_setWithoutTtl_ReplacesEarlierExpiry() {
        // Given
        Cache<String> cache = cache("session");
        cache.set("u1", "v1", Duration.ofMillis(200));

        // When
        cache.set("u1", "v2", null);
        sleep(Duration.ofMillis(500));

        // Then
        assertEquals(Optional.of("v2"), cache.get("u1"));
    }

    @Test
    void cache_existsAndDelete() {
        // Given
        Cache<String> cache = cache("session");
        cache.set("u1", "profile");

        // When & Then
        assertTrue(cache.exists("u1"));
        assertTrue(cache.delete("u1"));
        assertFalse(cache.exists("u1"));
        assertFalse(cache.delete("u1"));
        assertEquals(Optional.empty(), cache.getEntry("u1"));
    }

    @Test
    void cache_NamesSharingPrefixNeverShareEntries() {
        // Given
        String base = unique("app");
        Cache<String> users = new Cache<>(pool, CacheConfig.of(base), Utf8StringCodec.instance(),
            new BlockingPoller(polling), Clock.systemUTC());
        Cache<String> sessions = new Cache<>(pool, CacheConfig.of(base + ":user"), Utf8StringCodec.instance(),
            new BlockingPoller(polling), Clock.systemUTC());

        // When
        users.set("user:1", "alice-profile");
        sessions.set("1", "session-token");

        // Then
        assertEquals(Optional.of("alice-profile"), users.get("user:1"));
        assertEquals(Optional.of("session-token"), sessions.get("1"));
        assertTrue(sessions.delete("1"));
        assertEquals(Optional.of("alice-profile"), users.get("user:1"));
    }

    // ============================================================
    // Queue
    // ============================================================

    @Test
    void queue_OtherIdentityPopsItemsInPushOrderThenNothing() {
        // Given
        String name = unique("jobs");
        WriteQueue<String> producer = writeQueue(name, ClientId.of("P1"));
        ReadQueue<String> consumer = readQueue(QueueConfig.of(name)
            .withClientId(ClientId.of("P2"))
            .withExcludeOwnMessages(true));

        // When
        producer.push("A");
        producer.push("B");

        // Then
        assertEquals(Optional.of("A"), consumer.pop());
        assertEquals(Optional.of("B"), consumer.pop());
        assertEquals(Optional.empty(), consumer.pop());
    }

    @Test
    void queue_EveryPushedItemPoppedExactlyOnceInOrder() {
        // Given
        String name = unique("jobs");
        WriteQueue<String> producer = writeQueue(name, ClientId.of("P1"));
        ReadQueue<String> consumer = readQueue(QueueConfig.of(name));
        List<String> pushed = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            pushed.add("item-" + i);
            producer.push("item-" + i);
        }

        // When
        List<String> popped = new ArrayList<>();
        Optional<String> next;
        while ((next = consumer.pop()).isPresent()) {
            popped.add(next.get());
        }

        // Then
        assertEquals(pushed, popped);
        assertEquals(0L, consumer.size());
    }

    @Test
    void queue_MessageCarriesIdAndProducer() {
        // Given
        String name = unique("jobs");
        WriteQueue<String> producer = writeQueue(name, ClientId.of("P1"));
        String id = producer.push("A");

        // When
        QueueMessage<String> message = readQueue(QueueConfig.of(name)).popMessage().orElseThrow();

        // Then
        assertEquals(id, message.id());
        assertEquals(Optional.of(ClientId.of("P1")), message.producerId());
        assertEquals("A", message.content());
    }

    @Test
    void queue_OwnItemsSkippedButLeftForOtherConsumers() {
        // Given
        String name = unique("jobs");
        ClientId self = ClientId.of("self");
        writeQueue(name, self).push("own-1");
        writeQueue(name, ClientId.of("other")).push("foreign-1");
        writeQueue(name, self).push("own-2");
        ReadQueue<String> selfConsumer = readQueue(QueueConfig.of(name)
            .withClientId(self)
            .withExcludeOwnMessages(true));

        // When
        Optional<String> first = selfConsumer.pop();
        Optional<String> second = selfConsumer.pop();

        // Then
        assertEquals(Optional.of("foreign-1"), first);
        assertEquals(Optional.empty(), second);
        ReadQueue<String> anyConsumer = readQueue(QueueConfig.of(name));
        assertEquals(Optional.of("own-1"), anyConsumer.pop());
        assertEquals(Optional.of("own-2"), anyConsumer.pop());
    }

    @Test
    void queue_OwnItemsOnly_BlockingPopTimesOutAndKeepsThem() {
        // Given
        String name = unique("jobs");
        ClientId self = ClientId.of("self");
        writeQueue(name, self).push("own-1");
        ReadQueue<String> selfConsumer = readQueue(QueueConfig.of(name)
            .withClientId(self)
            .withExcludeOwnMessages(true));

        // When & Then
        assertThrows(IpcTimeoutException.class, () -> selfConsumer.popBlocking(Duration.ofMillis(200)));
        assertEquals(1L, selfConsumer.size());
    }

    @Test
    void queue_PopBlockingOnEmptyQueueTimesOutWithinBounds() {
        // Given
        ReadQueue<String> consumer = readQueue(QueueConfig.of(unique("jobs")));
        Duration timeout = Duration.ofMillis(500);

        // When
        long start = System.nanoTime();
        assertThrows(IpcTimeoutException.class, () -> consumer.popBlocking(timeout));
        Duration elapsed = elapsedSince(start);

        // Then
        assertTrue(elapsed.compareTo(timeout) >= 0, "returned before the timeout: " + elapsed);
        assertTrue(elapsed.compareTo(timeout.plus(polling.pollInterval()).plus(TIMING_SLACK)) <= 0,
            "overshot the timeout: " + elapsed);
    }

    @Test
    void queue_PopBlockingZeroTimeoutIsSingleNonBlockingPop() {
        // Given
        String name = unique("jobs");
        ReadQueue<String> consumer = readQueue(QueueConfig.of(name));

        // When & Then
        assertThrows(IpcTimeoutException.class, () -> consumer.popBlocking(Duration.ZERO));
        writeQueue(name, null).push("A");
        assertEquals("A", consumer.popBlocking(Duration.ZERO));
    }

    @Test
    void queue_PopBlockingReceivesItemPushedLater() throws Exception {
        // Given
        String name = unique("jobs");
        ReadQueue<String> consumer = readQueue(QueueConfig.of(name));
        WriteQueue<String> producer = writeQueue(name, ClientId.of("P1"));
        ExecutorService writer = Executors.newSingleThreadExecutor();

        try {
            // When
            writer.submit(() -> {
                sleep(Duration.ofMillis(300));
                producer.push("late");
            });
            String item = consumer.popBlocking(Duration.ofSeconds(3));

            // Then
            assertEquals("late", item);
        } finally {
            shutdown(writer);
        }
    }

    @Test
    void queue_ConcurrentConsumersNeverReceiveSameItem() throws Exception {
        // Given
        String name = unique("jobs");
        WriteQueue<String> producer = writeQueue(name, ClientId.of("P1"));
        int itemCount = 200;
        for (int i = 0; i < itemCount; i++) {
            producer.push("item-" + i);
        }
        ReadQueue<String> first = readQueue(QueueConfig.of(name).withClientId(ClientId.of("C1")));
        ReadQueue<String> second = readQueue(QueueConfig.of(name).withClientId(ClientId.of("C2")));
        ConcurrentLinkedQueue<String> received = new ConcurrentLinkedQueue<>();
        CountDownLatch start = new CountDownLatch(1);
        ExecutorService consumers = Executors.newFixedThreadPool(2);

        try {
            // When
            List<Future<?>> futures = new ArrayList<>();
            for (ReadQueue<String> consumer : List.of(first, second)) {
                futures.add(consumers.submit(() -> {
                    await(start);
                    Optional<String> next;
                    while ((next = consumer.pop()).isPresent()) {
                        received.add(next.get());
                    }
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }

            // Then
            Set<String> unique = new HashSet<>(received);
            assertEquals(itemCount, received.size(), "every item delivered once");
            assertEquals(itemCount, unique.size(), "no item delivered twice");
        } finally {
            shutdown(consumers);
        }
    }

    // ============================================================
    // Stream
    // ============================================================

    @Test
    void stream_ReadFromBeginningReturnsAllEventsInOrderAcrossPages() {
        // Given
        EventStream<String> stream = stream(StreamConfig.of(unique("log"), 100).withPageSize(3));
        List<String> appended = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            appended.add("e" + i);
            stream.append("e" + i);
        }

        // When
        List<String> read = contents(stream.readFrom(StreamCursor.beginning()));

        // Then
        assertEquals(appended, read);
    }

    @Test
    void stream_TrimmedEntriesAreEvictedAndTheirCursorExpires() {
        // Given
        EventStream<String> stream = stream(StreamConfig.of(unique("log"), 2));
        StreamCursor e1 = stream.append("e1");
        stream.append("e2");
        stream.append("e3");

        // When
        List<String> read = contents(stream.readFrom(StreamCursor.beginning()));

        // Then
        assertEquals(List.of("e2", "e3"), read);
        CursorExpiredException expired = assertThrows(CursorExpiredException.class, () -> stream.readFrom(e1));
        assertEquals(e1, expired.getStaleCursor());
        assertThrows(CursorExpiredException.class, () -> stream.readNextBlocking(e1, Duration.ZERO));
    }

    @Test
    void stream_ResumeFromReturnedCursorContinuesWithoutGaps() {
        // Given
        EventStream<String> stream = stream(StreamConfig.of(unique("log"), 100));
        stream.append("e1");
        StreamCursor e2 = stream.append("e2");
        stream.append("e3");

        // When
        List<String> rest = contents(stream.readFrom(e2));

        // Then
        assertEquals(List.of("e3"), rest);
        assertEquals(List.of(), contents(stream.readFrom(stream.last().orElseThrow().cursor())));
    }

    @Test
    void stream_ReadFromIsBoundedByLastEntryAtCallTime() {
        // Given
        EventStream<String> stream = stream(StreamConfig.of(unique("log"), 100).withPageSize(2));
        for (int i = 0; i < 5; i++) {
            stream.append("old-" + i);
        }

        // When
        List<String> read;
        try (Stream<StreamEvent<String>> events = stream.readFrom(StreamCursor.beginning())) {
            stream.append("new-0");
            stream.append("new-1");
            read = events.map(StreamEvent::content).collect(Collectors.toList());
        }

        // Then
        assertEquals(List.of("old-0", "old-1", "old-2", "old-3", "old-4"), read);
    }

    @Test
    void stream_LastWritersBoundWins() {
        // Given
        EventStream<String> stream = stream(StreamConfig.of(unique("log"), 5));
        for (int i = 0; i < 5; i++) {
            stream.append("e" + i);
        }

        // When
        stream.append("e5", 2);

        // Then
        assertEquals(2L, stream.length());
        assertEquals(List.of("e4", "e5"), contents(stream.readFrom(StreamCursor.beginning())));
    }

    @Test
    void stream_ReadNextBlockingReceivesLaterAppend() throws Exception {
        // Given
        EventStream<String> stream = stream(StreamConfig.of(unique("log"), 10));
        StreamCursor cursor = stream.append("e1");
        ExecutorService writer = Executors.newSingleThreadExecutor();

        try {
            // When
            writer.submit(() -> {
                sleep(Duration.ofMillis(300));
                stream.append("e2");
            });
            StreamEvent<String> next = stream.readNextBlocking(cursor, Duration.ofSeconds(3));

            // Then
            assertEquals("e2", next.content());
            assertTrue(cursor.isBefore(next.cursor()));
        } finally {
            shutdown(writer);
        }
    }

    @Test
    void stream_ReadNextBlockingTimesOutWithinBounds() {
        // Given
        EventStream<String> stream = stream(StreamConfig.of(unique("log"), 10));
        StreamCursor cursor = stream.append("e1");
        Duration timeout = Duration.ofMillis(500);

        // When
        long start = System.nanoTime();
        assertThrows(IpcTimeoutException.class, () -> stream.readNextBlocking(cursor, timeout));
        Duration elapsed = elapsedSince(start);

        // Then
        assertTrue(elapsed.compareTo(timeout) >= 0, "returned before the timeout: " + elapsed);
        assertTrue(elapsed.compareTo(timeout.plus(polling.pollInterval()).plus(TIMING_SLACK)) <= 0,
            "overshot the timeout: " + elapsed);
    }

    @Test
    void stream_ReaderFromLatestSeesOnlyNewEvents() {
        // Given
        EventStream<String> stream = stream(StreamConfig.of(unique("log"), 10)
            .withStartPosition(StartPosition.LATEST));
        stream.append("before");
        StreamReader<String> reader = stream.reader();
        assertEquals(Optional.empty(), reader.next());

        // When
        stream.append("after-1");
        stream.append("after-2");

        // Then
        assertEquals(List.of("after-1", "after-2"),
            reader.poll().stream().map(StreamEvent::content).collect(Collectors.toList()));
        assertEquals(List.of(), reader.poll());
    }

    @Test
    void stream_ReaderResyncAfterExpiryRestartsAtOldestRetained() {
        // Given
        EventStream<String> stream = stream(StreamConfig.of(unique("log"), 2));
        StreamReader<String> reader = stream.reader();
        stream.append("e1");
        assertEquals("e1", reader.next().orElseThrow().content());
        StreamCursor stale = reader.cursor().orElseThrow();
        stream.append("e2");
        stream.append("e3");
        stream.append("e4");

        // When
        assertThrows(CursorExpiredException.class, reader::next);
        StreamCursor abandoned = reader.resync();

        // Then
        assertEquals(stale, abandoned);
        assertEquals("e3", reader.nextBlocking(Duration.ZERO).content());
        assertEquals("e4", reader.next().orElseThrow().content());
    }

    @Test
    void stream_LastAndLengthOnEmptyAndFilledStream() {
        // Given
        EventStream<String> stream = stream(StreamConfig.of(unique("log"), 10));

        // When & Then
        assertEquals(Optional.empty(), stream.last());
        assertEquals(0L, stream.length());
        StreamCursor last = null;
        for (int i = 0; i < 3; i++) {
            last = stream.append("e" + i);
        }
        StreamEvent<String> latest = stream.last().orElseThrow();
        assertEquals(last, latest.cursor());
        assertEquals("e2", latest.content());
        assertEquals(3L, stream.length());
    }

    // ============================================================
    // Helpers
    // ============================================================

    /**
     * Returns {@code base} suffixed with a random id, isolating structures between tests.
     *
     * @param base readable prefix
     * @return unique structure name
     */
    protected String unique(String base) {
        return base + "-" + UUID.randomUUID();
    }

    protected Cache<String> cache(String base) {
        return new Cache<>(pool, CacheConfig.of(unique(base)), Utf8StringCodec.instance(),
            new BlockingPoller(polling), Clock.systemUTC());
    }

    protected WriteQueue<String> writeQueue(String name, ClientId producer) {
        return new WriteQueue<>(pool, QueueConfig.of(name).withClientId(producer), Utf8StringCodec.instance());
    }

    protected ReadQueue<String> readQueue(QueueConfig config) {
        return new ReadQueue<>(pool, config, Utf8StringCodec.instance(), polling);
    }

    protected EventStream<String> stream(StreamConfig config) {
        return new EventStream<>(pool, config, Utf8StringCodec.instance(), polling);
    }

    protected static List<String> contents(Stream<StreamEvent<String>> events) {
        try (events) {
            return events.map(StreamEvent::content).collect(Collectors.toList());
        }
    }

    protected static Duration elapsedSince(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    /**
     * Sleeps for the specified duration. Used for timing-sensitive tests.
     *
     * @param duration how long to sleep
     */
    protected static void sleep(Duration duration) {
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Sleep interrupted", e);
        }
    }

    private static void await(CountDownLatch latch) {
        try {
            latch.await();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeException("Interrupted while waiting to start", e);
        }
    }

    private static void shutdown(ExecutorService executor) throws InterruptedException {
        executor.shutdownNow();
        executor.awaitTermination(5, TimeUnit.SECONDS);
    }
}
