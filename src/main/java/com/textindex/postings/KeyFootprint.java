package com.textindex.postings;

import java.nio.charset.StandardCharsets;

/**
 * 主键内存占用估算。
 */
final class KeyFootprint {
    private KeyFootprint() {
    }

    /**
     * 估算主键占用的字节数：文本按 UTF-8 字节长度，定长数值按其宽度，其他对象按引用宽度。
     *
     * @param key 主键
     * @return 估算字节数
     */
    static long of(Object key) {
        if (key == null) {
            return 0L;
        }
        if (key instanceof CharSequence text) {
            return text.toString().getBytes(StandardCharsets.UTF_8).length;
        }
        if (key instanceof Long || key instanceof Double) {
            return Long.BYTES;
        }
        if (key instanceof Integer || key instanceof Float) {
            return Integer.BYTES;
        }
        if (key instanceof Short || key instanceof Character) {
            return Short.BYTES;
        }
        if (key instanceof Byte || key instanceof Boolean) {
            return Byte.BYTES;
        }
        return Long.BYTES;
    }
}
