package com.ryuqq.ipc.core.codec;

import com.ryuqq.ipc.core.error.DecodeException;
import com.ryuqq.ipc.core.spi.PayloadCodec;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * Plain-text codec: a String payload is stored as its UTF-8 bytes.
 *
 * <p>Decoding is strict, so bytes that are not valid UTF-8 raise {@link DecodeException}
 * instead of being replaced silently.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class Utf8StringCodec implements PayloadCodec<String> {

    private static final Utf8StringCodec INSTANCE = new Utf8StringCodec();

    private Utf8StringCodec() {
    }

    public static Utf8StringCodec instance() {
        return INSTANCE;
    }

    @Override
    public byte[] encode(String value) {
        if (value == null) {
            throw new IllegalArgumentException("value cannot be null");
        }
        return value.getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public String decode(byte[] bytes) {
        if (bytes == null) {
            throw new DecodeException("Cannot decode null bytes");
        }
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
            .onMalformedInput(CodingErrorAction.REPORT)
            .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            return decoder.decode(ByteBuffer.wrap(bytes)).toString();
        } catch (CharacterCodingException e) {
            throw new DecodeException("Payload is not valid UTF-8 (" + bytes.length + " bytes)", e);
        }
    }
}
