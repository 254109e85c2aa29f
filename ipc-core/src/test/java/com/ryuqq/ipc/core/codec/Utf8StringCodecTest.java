package com.ryuqq.ipc.core.codec;

import com.ryuqq.ipc.core.error.DecodeException;
import com.ryuqq.ipc.core.error.IpcErrorKind;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class Utf8StringCodecTest {

    private final Utf8StringCodec codec = Utf8StringCodec.instance();

    @Test
    void encode_UsesUtf8Bytes() {
        assertThat(codec.encode("주문")).isEqualTo("주문".getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void decode_InvalidUtf8_ThrowsDecodeException() {
        byte[] invalid = {(byte) 0xC3, (byte) 0x28};

        assertThatThrownBy(() -> codec.decode(invalid))
            .isInstanceOf(DecodeException.class)
            .satisfies(e -> assertThat(((DecodeException) e).kind()).isEqualTo(IpcErrorKind.DECODE));
    }

    @Test
    void encode_Null_ThrowsIllegalArgument() {
        assertThatThrownBy(() -> codec.encode(null)).isInstanceOf(IllegalArgumentException.class);
    }
}
