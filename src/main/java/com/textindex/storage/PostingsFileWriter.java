package com.textindex.storage;

import com.textindex.config.Constants;
import com.textindex.postings.PostingsData;
import com.textindex.postings.WeightEncoding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.RandomAccessFile;

/**
 * 倒排文件写入器：文件头、按序写入的倒排记录、CRC32 页脚。
 *
 * 每条记录为 VarLong 主键加上 {@link PostingsData#writeCompressed} 的输出。
 */
public final class PostingsFileWriter implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(PostingsFileWriter.class);

    private final RandomAccessFile randomAccessFile;
    private final String postingsFileName;
    private final WeightEncoding encoding;
    private int recordCount;
    private boolean closed;

    /**
     * 创建倒排写入器并写入文件头。
     *
     * @param file 倒排文件，已存在时被截断
     * @param encoding 权重编码，记录在文件头中
     * @throws IOException 初始化失败时抛出
     */
    public PostingsFileWriter(File file, WeightEncoding encoding) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException("倒排文件不能为空");
        }
        if (encoding == null) {
            throw new IllegalArgumentException("权重编码不能为空");
        }
        this.randomAccessFile = new RandomAccessFile(file, "rw");
        this.postingsFileName = file.getName();
        this.encoding = encoding;
        this.randomAccessFile.setLength(0L);
        this.randomAccessFile.writeInt(Constants.POSTINGS_MAGIC);
        this.randomAccessFile.writeShort(Constants.FORMAT_VERSION);
        this.randomAccessFile.writeByte(encoding.ordinal());
        logger.debug("创建倒排文件: {}, encoding={}", postingsFileName, encoding);
    }

    /**
     * 写入一条倒排记录并返回写入起始偏移。
     *
     * @param postingsData 主键为非负 long 的倒排列表
     * @return 该记录在文件中的偏移
     * @throws IOException 写入失败时抛出
     */
    public long write(PostingsData<Long> postingsData) throws IOException {
        ensureOpen();
        if (postingsData == null) {
            throw new IllegalArgumentException("倒排列表不能为空");
        }

        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        VarIntCompressedWriter compressedWriter = new VarIntCompressedWriter(buffer);
        compressedWriter.writeUnsigned(postingsData.primaryKey());
        postingsData.writeCompressed(compressedWriter, encoding);

        long recordOffset = randomAccessFile.getFilePointer();
        randomAccessFile.write(buffer.toByteArray());
        recordCount++;
        return recordOffset;
    }

    public int getRecordCount() {
        return recordCount;
    }

    /**
     * 关闭写入器并追加文件级 CRC32。
     *
     * @throws IOException 关闭失败时抛出
     */
    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        try {
            randomAccessFile.seek(randomAccessFile.length());
            StorageFileUtil.appendCrc32Footer(randomAccessFile);
            StorageFileUtil.verifyCrc32Footer(randomAccessFile, postingsFileName);
            logger.debug("倒排文件写入完成: {}, records={}", postingsFileName, recordCount);
        } catch (IOException exception) {
            throw new IOException("关闭倒排写入器失败: file=" + postingsFileName, exception);
        } finally {
            randomAccessFile.close();
            closed = true;
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("PostingsFileWriter 已关闭");
        }
    }
}
