package com.textindex.storage;

import java.io.IOException;
import java.io.OutputStream;

/**
 * 基于 VarLong 的压缩写入器：整数写为 VarLong，浮点数写为 8 字节大端 IEEE-754。
 */
public final class VarIntCompressedWriter implements CompressedWriter {
    private final OutputStream out;
    private long bytesWritten;

    /**
     * 包装输出流。流的生命周期由调用方管理。
     *
     * @param out 目标输出流
     */
    public VarIntCompressedWriter(OutputStream out) {
        if (out == null) {
            throw new IllegalArgumentException("输出流不能为null");
        }
        this.out = out;
    }

    @Override
    public void writeUnsigned(long value) throws IOException {
        VarIntCodec.writeVarLong(value, out);
        bytesWritten += VarIntCodec.varLongSize(value);
    }

    @Override
    public void writeDouble(double value) throws IOException {
        long bits = Double.doubleToLongBits(value);
        for (int shift = 56; shift >= 0; shift -= 8) {
            out.write((int) (bits >>> shift) & 0xFF);
        }
        bytesWritten += Double.BYTES;
    }

    /**
     * 返回自创建以来写入的字节数。
     *
     * @return 已写入字节数
     */
    public long bytesWritten() {
        return bytesWritten;
    }
}
