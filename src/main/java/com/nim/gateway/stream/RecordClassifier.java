package com.nim.gateway.stream;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;

/**
 * SSE 行分类器
 * <p>
 * 不是合法 UTF-8 的行一律视为 OPAQUE，保证原始字节透传
 */
public final class RecordClassifier {

    public static final String DATA_PREFIX = "data: ";
    public static final String DONE_LINE = "data: [DONE]";

    private RecordClassifier() {
    }

    public static SseRecord classify(String line) {
        return classify(line.getBytes(StandardCharsets.UTF_8));
    }

    public static SseRecord classify(byte[] raw) {
        String line = decode(raw);
        if (line == null) {
            return new SseRecord(SseRecord.Type.OPAQUE, raw, new String(raw, StandardCharsets.UTF_8), null);
        }
        String trimmed = line.trim();
        if (trimmed.isEmpty()) {
            return new SseRecord(SseRecord.Type.BLANK, raw, line, null);
        }
        if (DONE_LINE.equals(trimmed)) {
            return new SseRecord(SseRecord.Type.TERMINATOR, raw, line, null);
        }
        if (trimmed.startsWith(DATA_PREFIX)) {
            return new SseRecord(SseRecord.Type.DATA, raw, line, trimmed.substring(DATA_PREFIX.length()));
        }
        return new SseRecord(SseRecord.Type.OPAQUE, raw, line, null);
    }

    private static String decode(byte[] raw) {
        // CharsetDecoder 有状态，每次新建
        CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        try {
            return decoder.decode(ByteBuffer.wrap(raw)).toString();
        } catch (CharacterCodingException e) {
            return null;
        }
    }
}
