package com.textindex.storage;

import java.io.IOException;

/**
 * 压缩流读取端，读取顺序必须与写入顺序一致。
 */
public interface CompressedReader {

    /**
     * 读取下一个无符号64位整数。
     *
     * @return 按无符号解释的值
     * @throws IOException 读取失败或流提前结束时抛出
     */
    long readUnsigned() throws IOException;

    /**
     * 读取下一个双精度浮点数。
     *
     * @return 浮点值
     * @throws IOException 读取失败或流提前结束时抛出
     */
    double readDouble() throws IOException;
}
