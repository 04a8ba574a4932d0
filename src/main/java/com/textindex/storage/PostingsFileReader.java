package com.textindex.storage;

import com.textindex.config.Constants;
import com.textindex.postings.PostingsData;
import com.textindex.postings.WeightEncoding;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.util.ArrayList;
import java.util.List;

/**
 * 倒排文件读取器，按偏移或顺序读取倒排记录。读出的倒排列表均为只读。
 */
public final class PostingsFileReader implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(PostingsFileReader.class);

    private final RandomAccessFile randomAccessFile;
    private final String postingsFileName;
    private final WeightEncoding encoding;
    private final long dataLength;
    private boolean closed;

    /**
     * 构造读取器并完成 CRC、文件头与权重编码校验。
     *
     * @param file 倒排文件
     * @param encoding 调用方期望的权重编码
     * @throws IOException 文件损坏、版本不兼容或编码不一致时抛出
     */
    public PostingsFileReader(File file, WeightEncoding encoding) throws IOException {
        if (file == null) {
            throw new IllegalArgumentException("倒排文件不能为空");
        }
        if (encoding == null) {
            throw new IllegalArgumentException("权重编码不能为空");
        }
        this.randomAccessFile = new RandomAccessFile(file, "r");
        this.postingsFileName = file.getName();
        this.encoding = encoding;
        try {
            this.dataLength = StorageFileUtil.verifyCrc32Footer(randomAccessFile, postingsFileName);
            verifyHeader();
        } catch (IOException exception) {
            randomAccessFile.close();
            throw exception;
        }
        logger.debug("打开倒排文件: {}, dataLength={}", postingsFileName, dataLength);
    }

    /**
     * 从指定偏移读取一条倒排记录。
     *
     * @param offset 记录偏移
     * @return 只读倒排列表
     * @throws IOException 读取或解码失败时抛出
     */
    public PostingsData<Long> read(long offset) throws IOException {
        ensureOpen();
        if (offset < Constants.POSTINGS_HEADER_BYTES || offset >= dataLength) {
            throw new IOException("无效倒排偏移: " + offset + ", file=" + postingsFileName);
        }
        randomAccessFile.seek(offset);
        return readRecord(new VarIntCompressedReader(StorageFileUtil.boundedInputStream(randomAccessFile, dataLength)));
    }

    /**
     * 按文件顺序读取全部倒排记录。
     *
     * @return 倒排列表
     * @throws IOException 读取或解码失败时抛出
     */
    public List<PostingsData<Long>> readAll() throws IOException {
        ensureOpen();
        randomAccessFile.seek(Constants.POSTINGS_HEADER_BYTES);
        CompressedReader reader = new VarIntCompressedReader(StorageFileUtil.boundedInputStream(randomAccessFile, dataLength));
        List<PostingsData<Long>> records = new ArrayList<>();
        while (randomAccessFile.getFilePointer() < dataLength) {
            records.add(readRecord(reader));
        }
        return records;
    }

    @Override
    public void close() throws IOException {
        if (closed) {
            return;
        }
        randomAccessFile.close();
        closed = true;
    }

    private PostingsData<Long> readRecord(CompressedReader reader) throws IOException {
        long primaryKey = reader.readUnsigned();
        return PostingsData.readFrom(primaryKey, reader, encoding);
    }

    private void verifyHeader() throws IOException {
        if (dataLength < Constants.POSTINGS_HEADER_BYTES) {
            throw new IOException("倒排文件缺少文件头: " + postingsFileName);
        }
        randomAccessFile.seek(0L);
        int magic = randomAccessFile.readInt();
        if (magic != Constants.POSTINGS_MAGIC) {
            throw new IOException("倒排文件 magic 不匹配: " + postingsFileName);
        }
        short version = randomAccessFile.readShort();
        if (version != Constants.FORMAT_VERSION) {
            throw new IOException("倒排文件版本不支持: " + version);
        }
        int encodingOrdinal = randomAccessFile.readUnsignedByte();
        if (encodingOrdinal != encoding.ordinal()) {
            throw new IOException("权重编码不一致: file=" + postingsFileName + ", expected=" + encoding + ", actual ordinal=" + encodingOrdinal);
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("PostingsFileReader 已关闭");
        }
    }
}
