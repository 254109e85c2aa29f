package com.ryuqq.ipc.core.spi;

import com.ryuqq.ipc.core.model.StreamCursor;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * Remote store command SPI.
 *
 * <p>This interface lists the primitive remote operations the cache, queue and stream
 * primitives are built on. It says nothing about the wire protocol: the Redis adapter maps
 * each method to one command (or one server-side script), the in-memory adapter to a locked
 * data structure.</p>
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Key/value: get, set with expiry, delete, exists</li>
 *   <li>List: push to tail, pop from head (plain, blocking, and excluding a tag prefix)</li>
 *   <li>Stream: append with exact max-size trimming, range reads after a cursor, blocking read</li>
 * </ul>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Atomic pops: an element removed by any pop method is handed to exactly one caller</li>
 *   <li>Atomic append-and-trim: no reader observes the stream above {@code maxSize}</li>
 *   <li>Stream ids strictly increase in append order</li>
 *   <li>Every failure is raised as {@link com.ryuqq.ipc.core.error.StoreException};
 *       "nothing there" is always an empty result, never an exception</li>
 * </ul>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface StoreConnection {

    // ---------------------------------------------------------------- key/value

    /**
     * Reads a key.
     *
     * @param key the key
     * @return the value, or empty when the key is absent or expired
     */
    Optional<byte[]> get(String key);

    /**
     * Writes a key, replacing the value and the expiry.
     *
     * @param key the key
     * @param value the value
     * @param ttl time to live; null or zero stores the key without expiry
     */
    void set(String key, byte[] value, Duration ttl);

    /**
     * Deletes a key.
     *
     * @param key the key
     * @return true if a key was removed
     */
    boolean delete(String key);

    /**
     * Checks whether a key is present and not expired.
     *
     * @param key the key
     * @return true if present
     */
    boolean exists(String key);

    // ---------------------------------------------------------------- list

    /**
     * Appends an element to the tail of a list, creating the list if needed.
     *
     * @param key list key
     * @param value element
     */
    void pushTail(String key, byte[] value);

    /**
     * Removes and returns the head element.
     *
     * @param key list key
     * @return the head element, or empty when the list is empty
     */
    Optional<byte[]> popHead(String key);

    /**
     * Removes and returns the head element, waiting on the server side up to {@code timeout}.
     *
     * <p>The connection is occupied for the whole wait, so callers keep {@code timeout} short
     * and loop.</p>
     *
     * @param key list key
     * @param timeout positive wait bound
     * @return the head element, or empty when the wait elapsed
     * @throws IllegalArgumentException if timeout is null, zero or negative
     */
    Optional<byte[]> popHeadBlocking(String key, Duration timeout);

    /**
     * Removes and returns the first element (from the head) that does not start with
     * {@code excludedPrefix}. Scan and removal happen atomically on the store.
     *
     * @param key list key
     * @param excludedPrefix byte prefix of elements to skip
     * @return the first eligible element, or empty when there is none
     */
    Optional<byte[]> popHeadExcluding(String key, byte[] excludedPrefix);

    /**
     * @param key list key
     * @return number of elements, 0 when the list does not exist
     */
    long listLength(String key);

    // ---------------------------------------------------------------- stream

    /**
     * Appends an entry and trims the stream to at most {@code maxSize} entries, oldest first.
     *
     * @param key stream key
     * @param value entry payload
     * @param maxSize upper bound on the number of retained entries (at least 1)
     * @return id of the new entry
     */
    StreamCursor append(String key, byte[] value, long maxSize);

    /**
     * Reads entries with id strictly greater than {@code after}, in id order.
     *
     * @param key stream key
     * @param after exclusive lower bound
     * @param until inclusive upper bound, or null for no upper bound
     * @param limit maximum number of entries returned (at least 1)
     * @return entries, empty when there are none
     */
    List<StreamRecord> rangeAfter(String key, StreamCursor after, StreamCursor until, int limit);

    /**
     * @param key stream key
     * @return id of the oldest retained entry, or empty when the stream holds no entries
     */
    Optional<StreamCursor> firstId(String key);

    /**
     * @param key stream key
     * @return the newest entry, or empty when the stream holds no entries
     */
    Optional<StreamRecord> last(String key);

    /**
     * Waits on the server side up to {@code timeout} for the first entry after {@code after}.
     *
     * @param key stream key
     * @param after exclusive lower bound
     * @param timeout positive wait bound
     * @return the entry, or empty when the wait elapsed
     * @throws IllegalArgumentException if timeout is null, zero or negative
     */
    Optional<StreamRecord> readAfterBlocking(String key, StreamCursor after, Duration timeout);

    /**
     * @param key stream key
     * @return number of retained entries
     */
    long streamLength(String key);
}
