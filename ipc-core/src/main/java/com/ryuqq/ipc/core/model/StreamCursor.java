package com.ryuqq.ipc.core.model;

/**
 * Event stream 읽기 위치를 나타내는 cursor.
 *
 * <p>값은 원격 저장소의 entry id 형식 {@code <millis>-<sequence>}를 따르며,
 * 해당 entry "이후"부터 읽는다는 의미를 가집니다. {@link #beginning()}은
 * 모든 entry보다 앞선 위치입니다.</p>
 *
 * <p>Cursor는 시스템이 영속화하지 않습니다. 프로세스 재시작 후에도 이어 읽으려면
 * 호출자가 {@link #getValue()}를 직접 저장해야 합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class StreamCursor implements Comparable<StreamCursor> {

    private static final StreamCursor BEGINNING = new StreamCursor(0L, 0L);

    private final long millis;
    private final long sequence;

    private StreamCursor(long millis, long sequence) {
        if (millis < 0 || sequence < 0) {
            throw new IllegalArgumentException(
                "StreamCursor parts must be non-negative (millis: " + millis + ", sequence: " + sequence + ")");
        }
        this.millis = millis;
        this.sequence = sequence;
    }

    /**
     * Entry id 문자열로부터 cursor 생성.
     *
     * @param entryId {@code <millis>-<sequence>} 형식의 id
     * @return StreamCursor 인스턴스
     * @throws IllegalArgumentException 형식이 올바르지 않은 경우
     */
    public static StreamCursor of(String entryId) {
        if (entryId == null || entryId.isBlank()) {
            throw new IllegalArgumentException("entryId cannot be null or blank");
        }
        int dash = entryId.indexOf('-');
        if (dash <= 0 || dash == entryId.length() - 1) {
            throw new IllegalArgumentException("entryId must be '<millis>-<sequence>' (current: " + entryId + ")");
        }
        try {
            return new StreamCursor(
                Long.parseLong(entryId.substring(0, dash)),
                Long.parseLong(entryId.substring(dash + 1)));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("entryId must be '<millis>-<sequence>' (current: " + entryId + ")", e);
        }
    }

    /**
     * 모든 entry보다 앞선 위치.
     *
     * @return 시작 cursor ({@code 0-0})
     */
    public static StreamCursor beginning() {
        return BEGINNING;
    }

    public boolean isBeginning() {
        return millis == 0L && sequence == 0L;
    }

    public String getValue() {
        return millis + "-" + sequence;
    }

    /**
     * Entry id에 포함된 append 시각 (epoch millis).
     *
     * @return append 시각
     */
    public long getMillis() {
        return millis;
    }

    public long getSequence() {
        return sequence;
    }

    @Override
    public int compareTo(StreamCursor other) {
        int byMillis = Long.compare(millis, other.millis);
        return byMillis != 0 ? byMillis : Long.compare(sequence, other.sequence);
    }

    public boolean isBefore(StreamCursor other) {
        return compareTo(other) < 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        StreamCursor that = (StreamCursor) o;
        return millis == that.millis && sequence == that.sequence;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(millis) * 31 + Long.hashCode(sequence);
    }

    @Override
    public String toString() {
        return "StreamCursor{" + getValue() + '}';
    }
}
