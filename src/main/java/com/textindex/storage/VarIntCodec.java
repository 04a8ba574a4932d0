package com.textindex.storage;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;

/**
 * VarLong变长整数编解码器
 *
 * 编码规则：每字节7位有效数据，最高位为续接标志
 * - 最高位为1：表示后续还有字节
 * - 最高位为0：表示这是最后一个字节
 *
 * 值按无符号64位整数处理，负数的long表示2^63以上的无符号值，最多占用10字节。
 */
public final class VarIntCodec {

    private VarIntCodec() {
        // 工具类，禁止实例化
    }

    /**
     * 将无符号long值编码为VarLong并写入输出流
     *
     * @param value 无符号64位整数
     * @param out 输出流
     * @throws IOException IO异常
     */
    public static void writeVarLong(long value, OutputStream out) throws IOException {
        // 无符号右移保证高位为1的值也能终止循环
        while ((value & ~0x7FL) != 0) {
            out.write((int) ((value & 0x7F) | 0x80));
            value >>>= 7;
        }
        out.write((int) (value & 0x7F));
    }

    /**
     * 从输入流读取VarLong并解码为无符号long
     *
     * @param in 输入流
     * @return 解码后的值
     * @throws EOFException 流在值读取完整之前结束
     * @throws IOException IO异常或编码超过64位
     */
    public static long readVarLong(InputStream in) throws IOException {
        long result = 0;
        int shift = 0;

        while (shift < 64) {
            int b = in.read();
            if (b == -1) {
                throw new EOFException(shift == 0 ? "流意外结束，无法读取VarLong" : "流意外结束，VarLong不完整");
            }

            result |= (long) (b & 0x7F) << shift;

            if ((b & 0x80) == 0) {
                return result;
            }

            shift += 7;
        }

        throw new IOException("VarLong超过64位范围");
    }

    /**
     * 计算无符号long值编码为VarLong所需的字节数
     *
     * @param value 无符号64位整数
     * @return 所需字节数
     */
    public static int varLongSize(long value) {
        int size = 1;
        while ((value & ~0x7FL) != 0) {
            size++;
            value >>>= 7;
        }
        return size;
    }
}
