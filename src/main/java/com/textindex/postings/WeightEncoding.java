package com.textindex.postings;

import com.textindex.storage.CompressedReader;
import com.textindex.storage.CompressedWriter;

import java.io.IOException;

/**
 * 权重表示方式。
 *
 * 编码标签不写入数据流，写入方与读取方必须使用相同的标签，
 * 否则读取结果没有意义。
 */
public enum WeightEncoding {
    /**
     * 权重截断为非负整数，按无符号整数写入，适用于原始词频。
     */
    INTEGER {
        @Override
        void write(CompressedWriter writer, double weight) throws IOException {
            if (weight < 0 || Double.isNaN(weight)) {
                throw new IllegalArgumentException("整数编码不支持负数或NaN权重: " + weight);
            }
            writer.writeUnsigned(unsignedFromDouble(weight));
        }

        @Override
        double read(CompressedReader reader) throws IOException {
            return unsignedToDouble(reader.readUnsigned());
        }
    },

    /**
     * 权重按双精度浮点数写入，适用于已加权的得分。
     */
    FLOATING {
        @Override
        void write(CompressedWriter writer, double weight) throws IOException {
            writer.writeDouble(weight);
        }

        @Override
        double read(CompressedReader reader) throws IOException {
            return reader.readDouble();
        }
    };

    abstract void write(CompressedWriter writer, double weight) throws IOException;

    abstract double read(CompressedReader reader) throws IOException;

    static double unsignedToDouble(long value) {
        if (value >= 0) {
            return value;
        }
        // 高位为1时按无符号值换算
        return (double) (value >>> 1) * 2.0 + (value & 1L);
    }

    /**
     * 将非负实数截断为无符号64位整数。负数和NaN得到0，不小于2^64的值饱和为最大值。
     */
    static long unsignedFromDouble(double value) {
        if (!(value > 0)) {
            return 0L;
        }
        if (value >= 0x1p64) {
            return -1L;
        }
        if (value >= 0x1p63) {
            return (long) (value - 0x1p63) ^ Long.MIN_VALUE;
        }
        return (long) value;
    }
}
