package com.textindex.storage;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;

/**
 * {@link VarIntCompressedWriter} 对应的读取器。
 */
public final class VarIntCompressedReader implements CompressedReader {
    private final InputStream in;

    /**
     * 包装输入流。流的生命周期由调用方管理。
     *
     * @param in 源输入流
     */
    public VarIntCompressedReader(InputStream in) {
        if (in == null) {
            throw new IllegalArgumentException("输入流不能为null");
        }
        this.in = in;
    }

    @Override
    public long readUnsigned() throws IOException {
        return VarIntCodec.readVarLong(in);
    }

    @Override
    public double readDouble() throws IOException {
        long bits = 0L;
        for (int index = 0; index < Double.BYTES; index++) {
            int b = in.read();
            if (b == -1) {
                throw new EOFException("读取 double 时遇到 EOF，已读取 " + index + " 字节");
            }
            bits = (bits << 8) | b;
        }
        return Double.longBitsToDouble(bits);
    }
}
