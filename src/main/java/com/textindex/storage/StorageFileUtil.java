package com.textindex.storage;

import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.RandomAccessFile;
import java.util.zip.CRC32;
import java.util.zip.CheckedInputStream;

/**
 * 倒排文件的 CRC32 页脚读写，以及在随机访问文件上按区间读取的输入流。
 */
final class StorageFileUtil {
    private StorageFileUtil() {
    }

    /**
     * 计算文件前 length 字节的 CRC32，完成后恢复文件指针。
     *
     * @param randomAccessFile 源文件
     * @param length 参与校验的字节长度
     * @return CRC32 无符号值
     * @throws IOException 读取失败或文件短于 length 时抛出
     */
    static long computeCrc32(RandomAccessFile randomAccessFile, long length) throws IOException {
        long originalPointer = randomAccessFile.getFilePointer();
        randomAccessFile.seek(0L);
        CheckedInputStream checkedInput = new CheckedInputStream(boundedInputStream(randomAccessFile, length), new CRC32());
        byte[] buffer = new byte[8 * 1024];
        long consumedBytes = 0L;
        int readBytes;
        while ((readBytes = checkedInput.read(buffer)) != -1) {
            consumedBytes += readBytes;
        }
        if (consumedBytes != length) {
            throw new EOFException("计算 CRC32 时遇到 EOF: expected=" + length + ", actual=" + consumedBytes);
        }
        randomAccessFile.seek(originalPointer);
        return checkedInput.getChecksum().getValue();
    }

    /**
     * 在文件尾部追加数据区的 CRC32 页脚。
     *
     * @param randomAccessFile 目标文件
     * @throws IOException 写入失败时抛出
     */
    static void appendCrc32Footer(RandomAccessFile randomAccessFile) throws IOException {
        long dataLength = randomAccessFile.length();
        int footer = (int) computeCrc32(randomAccessFile, dataLength);
        randomAccessFile.seek(dataLength);
        randomAccessFile.writeInt(footer);
    }

    /**
     * 校验 CRC32 页脚。
     *
     * @param randomAccessFile 源文件
     * @param fileName 文件名，用于错误消息
     * @return 页脚之前的数据区长度
     * @throws IOException 页脚缺失或校验值不一致时抛出
     */
    static long verifyCrc32Footer(RandomAccessFile randomAccessFile, String fileName) throws IOException {
        long dataLength = randomAccessFile.length() - Integer.BYTES;
        if (dataLength < 0) {
            throw new IOException("文件过短，缺少 CRC32 页脚: " + fileName);
        }
        randomAccessFile.seek(dataLength);
        long storedCrc32 = Integer.toUnsignedLong(randomAccessFile.readInt());
        long computedCrc32 = computeCrc32(randomAccessFile, dataLength);
        if (storedCrc32 != computedCrc32) {
            throw new IOException("CRC32 校验失败: " + fileName + ", stored=" + storedCrc32 + ", computed=" + computedCrc32);
        }
        return dataLength;
    }

    /**
     * 从文件当前位置开始读取，到 limit 偏移处视为流结束。
     *
     * @param randomAccessFile 源文件
     * @param limit 数据区结束偏移
     * @return 共享文件指针的输入流，关闭它不会关闭文件
     */
    static InputStream boundedInputStream(RandomAccessFile randomAccessFile, long limit) {
        return new InputStream() {
            @Override
            public int read() throws IOException {
                if (randomAccessFile.getFilePointer() >= limit) {
                    return -1;
                }
                return randomAccessFile.read();
            }

            @Override
            public int read(byte[] buffer, int offset, int length) throws IOException {
                long remaining = limit - randomAccessFile.getFilePointer();
                if (remaining <= 0) {
                    return -1;
                }
                return randomAccessFile.read(buffer, offset, (int) Math.min(length, remaining));
            }
        };
    }
}
