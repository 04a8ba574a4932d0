package com.textindex.postings;

import com.textindex.config.Constants;
import com.textindex.storage.CompressedReader;
import com.textindex.storage.CompressedWriter;

import java.io.IOException;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * 一个主键（词项或文档）的倒排列表：次级键到权重的稀疏映射。
 *
 * <p>次级键为无符号64位ID，按无符号顺序升序排列且唯一。
 * 比较与相等性只由主键决定，倒排内容不参与比较，
 * 上层容器据此按主键排序和去重。
 *
 * <p>实例不是线程安全的。通过 {@link #readCompressed} 读取或调用 {@link #freeze()}
 * 后实例进入只读状态，任何修改都会抛出 {@link IllegalStateException}。
 *
 * @param <P> 主键类型
 */
public class PostingsData<P extends Comparable<? super P>> implements Comparable<PostingsData<P>> {
    private P primaryKey;
    private CountStore counts = new CountStore();
    private boolean frozen;

    /**
     * 以空倒排创建实例。
     *
     * @param primaryKey 主键
     */
    public PostingsData(P primaryKey) {
        this.primaryKey = requirePrimaryKey(primaryKey);
    }

    /**
     * 创建实例并从压缩流读取倒排内容，返回的实例为只读。
     *
     * @param primaryKey 主键
     * @param reader 压缩流读取器
     * @param encoding 写入时使用的权重编码
     * @return 只读倒排列表
     * @throws IOException 读取失败时抛出
     */
    public static <P extends Comparable<? super P>> PostingsData<P> readFrom(
            P primaryKey, CompressedReader reader, WeightEncoding encoding) throws IOException {
        PostingsData<P> postingsData = new PostingsData<>(primaryKey);
        postingsData.readCompressed(reader, encoding);
        return postingsData;
    }

    public P primaryKey() {
        return primaryKey;
    }

    public void setPrimaryKey(P primaryKey) {
        checkMutable();
        this.primaryKey = requirePrimaryKey(primaryKey);
    }

    /**
     * 累加次级键的权重；键不存在时以 amount 作为初始权重插入。
     *
     * @param secondaryKey 次级键
     * @param amount 增量，可以为任意实数
     */
    public void increaseCount(long secondaryKey, double amount) {
        checkMutable();
        counts.increaseCount(secondaryKey, amount);
    }

    /**
     * 查询次级键的权重。
     *
     * @param secondaryKey 次级键
     * @return 权重
     * @throws SecondaryKeyNotFoundException 键不存在时抛出
     */
    public double count(long secondaryKey) {
        return counts.count(secondaryKey);
    }

    public boolean contains(long secondaryKey) {
        return counts.contains(secondaryKey);
    }

    /**
     * 返回按次级键升序排列的倒排项快照。
     *
     * @return 不可修改的倒排项列表
     */
    public List<PostingEntry> counts() {
        return counts.entries();
    }

    public int size() {
        return counts.size();
    }

    public boolean isEmpty() {
        return counts.isEmpty();
    }

    /**
     * 获取有序位置上的次级键。
     *
     * @param index 倒排项下标
     * @return 次级键
     */
    public long secondaryKey(int index) {
        return counts.secondaryKey(index);
    }

    /**
     * 获取有序位置上的权重。
     *
     * @param index 倒排项下标
     * @return 权重
     */
    public double weight(int index) {
        return counts.weight(index);
    }

    /**
     * 用给定倒排项替换全部内容，输入顺序任意。
     *
     * @param entries 键唯一的倒排项
     * @throws IllegalArgumentException 输入为null或包含重复键时抛出
     */
    public void setCounts(List<PostingEntry> entries) {
        checkMutable();
        if (entries == null) {
            throw new IllegalArgumentException("倒排项列表不能为null");
        }
        counts.replaceContents(entries);
    }

    /**
     * 从游标读取倒排项替换全部内容。排序延迟到首次读取，存储收缩到精确大小。
     * 重复键在排序时以 {@link IllegalStateException} 报告。
     *
     * @param entries 键唯一的倒排项游标
     */
    public void setCounts(Iterator<PostingEntry> entries) {
        checkMutable();
        if (entries == null) {
            throw new IllegalArgumentException("倒排项游标不能为null");
        }
        counts.replaceContents(entries);
    }

    /**
     * 将另一个倒排列表合并到当前实例，同键权重相加。
     *
     * <p>只在当前实例原有的有序前缀中二分查找，未命中的项追加到尾部，
     * 最后整体排序一次。不校验两者主键是否一致，由调用方保证。
     *
     * @param other 待合并的倒排列表，不会被修改
     */
    public void mergeWith(PostingsData<P> other) {
        checkMutable();
        if (other == null) {
            throw new IllegalArgumentException("待合并的倒排列表不能为null");
        }
        counts.ensureSorted();
        other.counts.ensureSorted();

        int originalSize = counts.size();
        int otherSize = other.counts.size();
        boolean appended = false;
        for (int index = 0; index < otherSize; index++) {
            long key = other.counts.secondaryKey(index);
            double weight = other.counts.weight(index);
            int found = counts.indexOf(key, originalSize);
            if (found >= 0) {
                counts.addWeightAt(found, weight);
            } else {
                counts.appendUnsorted(key, weight);
                appended = true;
            }
        }
        if (appended) {
            counts.ensureSorted();
        }
    }

    /**
     * 以差值编码写入压缩流。
     *
     * <p>顺序：倒排项数量、权重总和（截断为无符号整数）、首个键的绝对值与权重，
     * 之后每项写入与前一个键的差值及权重。权重编码不写入流中。
     *
     * @param writer 压缩流写入器
     * @param encoding 权重编码
     * @throws IOException 写入失败时抛出
     */
    public void writeCompressed(CompressedWriter writer, WeightEncoding encoding) throws IOException {
        requireCodecArguments(writer, encoding);
        counts.ensureSorted();
        int entryCount = counts.size();

        writer.writeUnsigned(entryCount);
        writer.writeUnsigned(truncateSum(counts.totalWeight()));
        if (entryCount == 0) {
            return;
        }

        long previousKey = counts.secondaryKey(0);
        writer.writeUnsigned(previousKey);
        encoding.write(writer, counts.weight(0));
        for (int index = 1; index < entryCount; index++) {
            long key = counts.secondaryKey(index);
            writer.writeUnsigned(key - previousKey);
            encoding.write(writer, counts.weight(index));
            previousKey = key;
        }
    }

    /**
     * 从压缩流读取倒排内容，替换现有内容，收缩存储并进入只读状态。
     *
     * <p>不校验流的完整性，损坏的差值会被原样解码。读取中途失败时实例不变，仍可修改。
     *
     * @param reader 压缩流读取器
     * @param encoding 写入时使用的权重编码
     * @throws IOException 读取失败或数量超出可表示范围时抛出
     */
    public void readCompressed(CompressedReader reader, WeightEncoding encoding) throws IOException {
        checkMutable();
        requireCodecArguments(reader, encoding);

        long entryCount = reader.readUnsigned();
        if (entryCount < 0 || entryCount > Integer.MAX_VALUE) {
            throw new IOException("倒排项数量超出范围: " + Long.toUnsignedString(entryCount));
        }
        // 权重总和仅供不解码全文时使用
        reader.readUnsigned();

        // 整条记录解码成功后才替换，失败时原内容保持不变
        CountStore decoded = new CountStore();
        long key = 0L;
        for (long index = 0; index < entryCount; index++) {
            key += reader.readUnsigned();
            decoded.appendUnsorted(key, encoding.read(reader));
        }
        decoded.shrinkToFit();
        counts = decoded;
        frozen = true;
    }

    /**
     * 收缩存储并进入只读状态。
     */
    public void freeze() {
        counts.ensureSorted();
        counts.shrinkToFit();
        frozen = true;
    }

    public boolean isFrozen() {
        return frozen;
    }

    /**
     * 估算常驻内存字节数：每项固定开销乘以项数，再加主键占用。
     *
     * @return 估算字节数
     */
    public long bytesUsed() {
        return Constants.POSTING_ENTRY_BYTES * counts.size() + KeyFootprint.of(primaryKey);
    }

    @Override
    public int compareTo(PostingsData<P> other) {
        return primaryKey.compareTo(other.primaryKey);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof PostingsData<?> that)) {
            return false;
        }
        return primaryKey.equals(that.primaryKey);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(primaryKey);
    }

    @Override
    public String toString() {
        return "PostingsData{primaryKey=" + primaryKey + ", size=" + counts.size() + ", frozen=" + frozen + "}";
    }

    static long truncateSum(double sum) {
        return WeightEncoding.unsignedFromDouble(sum);
    }

    private void checkMutable() {
        if (frozen) {
            throw new IllegalStateException("倒排列表已只读，不能修改: primaryKey=" + primaryKey);
        }
    }

    private static <P> P requirePrimaryKey(P primaryKey) {
        if (primaryKey == null) {
            throw new IllegalArgumentException("主键不能为null");
        }
        return primaryKey;
    }

    private static void requireCodecArguments(Object stream, WeightEncoding encoding) {
        if (stream == null) {
            throw new IllegalArgumentException("压缩流不能为null");
        }
        if (encoding == null) {
            throw new IllegalArgumentException("权重编码不能为null");
        }
    }
}
