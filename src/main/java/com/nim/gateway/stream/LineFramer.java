package com.nim.gateway.stream;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * 按行切分字节流
 * <p>
 * 上游 chunk 与行边界无关：一行可能跨多个 chunk，一个 chunk 也可能包含多行。
 * 缓冲区只保存最后一段未结束的行。输出原始字节，解码交给调用方，
 * 跨 chunk 的多字节字符不会被截断，透传时也能保持逐字节一致。
 */
public class LineFramer {

    private static final byte LF = '\n';

    private byte[] buffer = new byte[1024];
    private int length = 0;

    /**
     * 追加一个 chunk，返回其中所有完整的行（原始字节，不含换行符）
     */
    public List<byte[]> feed(byte[] chunk) {
        if (chunk == null || chunk.length == 0) {
            return List.of();
        }
        ensureCapacity(length + chunk.length);
        // 新数据之前的部分已确认不含换行
        int scanFrom = length;
        System.arraycopy(chunk, 0, buffer, length, chunk.length);
        length += chunk.length;

        List<byte[]> lines = new ArrayList<>();
        int lineStart = 0;
        for (int i = scanFrom; i < length; i++) {
            if (buffer[i] == LF) {
                lines.add(Arrays.copyOfRange(buffer, lineStart, i));
                lineStart = i + 1;
            }
        }

        // 压缩剩余数据
        if (lineStart > 0) {
            System.arraycopy(buffer, lineStart, buffer, 0, length - lineStart);
            length -= lineStart;
        }
        return lines;
    }

    /**
     * 流结束：未以换行结尾的残留数据无法补全，直接丢弃
     *
     * @return 丢弃的字节数
     */
    public int finish() {
        int dropped = length;
        length = 0;
        return dropped;
    }

    /**
     * 当前缓冲的未完成行字节数
     */
    public int pending() {
        return length;
    }

    private void ensureCapacity(int required) {
        if (required <= buffer.length) {
            return;
        }
        int newSize = Math.max(buffer.length * 2, required);
        byte[] grown = new byte[newSize];
        System.arraycopy(buffer, 0, grown, 0, length);
        buffer = grown;
    }
}
