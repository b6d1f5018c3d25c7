package com.nim.gateway.stream;

/**
 * 一行 SSE 记录的分类结果
 *
 * @param type    记录类型
 * @param raw     原始字节（不含换行符），透传时原样输出
 * @param line    解码后的行文本
 * @param payload data 记录去掉前缀后的 JSON 文本，其他类型为 null
 */
public record SseRecord(Type type, byte[] raw, String line, String payload) {

    public enum Type {
        /** 空行（记录分隔符） */
        BLANK,
        /** data: [DONE] */
        TERMINATOR,
        /** data: {json} */
        DATA,
        /** 其他行，原样透传 */
        OPAQUE
    }
}
