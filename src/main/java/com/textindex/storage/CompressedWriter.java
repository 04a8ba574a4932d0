package com.textindex.storage;

import java.io.IOException;

/**
 * 压缩流写入端，按顺序写入无符号整数与浮点数。
 *
 * <p>具体的字节级压缩方案由实现决定，调用方只依赖写入顺序。
 */
public interface CompressedWriter {

    /**
     * 写入一个无符号64位整数。
     *
     * @param value 按无符号解释的值
     * @throws IOException 写入失败时抛出
     */
    void writeUnsigned(long value) throws IOException;

    /**
     * 写入一个双精度浮点数。
     *
     * @param value 浮点值
     * @throws IOException 写入失败时抛出
     */
    void writeDouble(double value) throws IOException;
}
