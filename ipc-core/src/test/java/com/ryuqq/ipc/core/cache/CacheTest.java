package com.ryuqq.ipc.core.cache;

import com.ryuqq.ipc.core.codec.Utf8StringCodec;
import com.ryuqq.ipc.core.error.DecodeException;
import com.ryuqq.ipc.core.error.IpcTimeoutException;
import com.ryuqq.ipc.core.error.StoreException;
import com.ryuqq.ipc.core.model.CacheEntry;
import com.ryuqq.ipc.core.poll.BlockingPoller;
import com.ryuqq.ipc.core.spi.ConnectionPool;
import com.ryuqq.ipc.core.spi.ScopedConnection;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

/**
 * Cache 유닛 테스트.
 *
 * <p>저장 키 형식, 값 frame, 커넥션 반환을 검증합니다. 실제 저장소 동작은
 * adapter 모듈의 contract test에서 검증합니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class CacheTest {

    private static final long NOW = 1_700_000_000_000L;

    @Mock
    private ConnectionPool pool;

    @Mock
    private ScopedConnection connection;

    private Cache<String> cache;

    @BeforeEach
    void setUp() {
        lenient().when(pool.execute(any())).thenCallRealMethod();
        lenient().when(pool.acquire()).thenReturn(connection);

        cache = new Cache<>(pool,
            CacheConfig.of("sessions").withTtl(Duration.ofMinutes(5)),
            Utf8StringCodec.instance(),
            new BlockingPoller(),
            Clock.fixed(Instant.ofEpochMilli(NOW), ZoneOffset.UTC));
    }

    @Test
    void set_기본_TTL과_timestamp_frame으로_저장() {
        // when
        cache.set("u1", "token");

        // then
        ArgumentCaptor<byte[]> frame = ArgumentCaptor.forClass(byte[].class);
        verify(connection).set(eq("sessions#u1"), frame.capture(), eq(Duration.ofMinutes(5)));
        verify(connection).close();

        CacheFrame decoded = CacheFrame.decode(frame.getValue());
        assertThat(decoded.writtenAtMillis()).isEqualTo(NOW);
        assertThat(new String(decoded.payload(), StandardCharsets.UTF_8)).isEqualTo("token");
    }

    @Test
    void set_지정한_TTL_null이면_만료_없음() {
        cache.set("u1", "token", null);

        verify(connection).set(eq("sessions#u1"), any(byte[].class), isNull());
    }

    @Test
    void set_음수_TTL은_거부() {
        assertThatThrownBy(() -> cache.set("u1", "token", Duration.ofSeconds(-1)))
            .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(connection);
    }

    @Test
    void get_저장된_값을_decode() {
        // given
        when(connection.get("sessions#u1"))
            .thenReturn(Optional.of(CacheFrame.encode(NOW, "token".getBytes(StandardCharsets.UTF_8))));

        // when
        Optional<CacheEntry<String>> entry = cache.getEntry("u1");

        // then
        assertThat(entry).isPresent();
        assertThat(entry.get().content()).isEqualTo("token");
        assertThat(entry.get().writtenAt()).isEqualTo(Instant.ofEpochMilli(NOW));
        verify(connection).close();
    }

    @Test
    void get_없는_키는_empty() {
        when(connection.get(anyString())).thenReturn(Optional.empty());

        assertThat(cache.get("missing")).isEmpty();
    }

    @Test
    void get_손상된_값은_DecodeException() {
        when(connection.get("sessions#u1")).thenReturn(Optional.of(new byte[]{1, 2, 3}));

        assertThatThrownBy(() -> cache.get("u1")).isInstanceOf(DecodeException.class);
    }

    @Test
    void get_저장소_오류는_전파되고_커넥션은_반환() {
        when(connection.get("sessions#u1")).thenThrow(new StoreException("connection reset"));

        assertThatThrownBy(() -> cache.get("u1")).isInstanceOf(StoreException.class);
        verify(connection).close();
    }

    @Test
    void getBlocking_timeout_0이고_값이_없으면_1회_조회_후_Timeout() {
        when(connection.get("sessions#u1")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> cache.getBlocking("u1", Duration.ZERO))
            .isInstanceOf(IpcTimeoutException.class);
        verify(connection, times(1)).get("sessions#u1");
    }

    @Test
    void exists_and_delete_위임() {
        when(connection.exists("sessions#u1")).thenReturn(true);
        when(connection.delete("sessions#u1")).thenReturn(true);

        assertThat(cache.exists("u1")).isTrue();
        assertThat(cache.delete("u1")).isTrue();
        verify(connection, times(2)).close();
    }

    @Test
    void config_이름_없으면_거부() {
        assertThatThrownBy(() -> new CacheConfig(null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CacheConfig.of("c").withReadTimeout(Duration.ofMillis(-5)))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
