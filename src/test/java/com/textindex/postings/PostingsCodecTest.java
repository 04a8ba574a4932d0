package com.textindex.postings;

import com.textindex.storage.CompressedWriter;
import com.textindex.storage.VarIntCompressedReader;
import com.textindex.storage.VarIntCompressedWriter;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 倒排列表压缩编解码测试
 */
class PostingsCodecTest {

    @Test
    @DisplayName("整数编码字段顺序：数量、总和、首键、差值")
    void testIntegerWireLayout() throws IOException {
        PostingsData<Long> postingsData = new PostingsData<>(1L);
        postingsData.setCounts(List.of(new PostingEntry(10, 3), new PostingEntry(12, 1), new PostingEntry(20, 2)));

        RecordingStream stream = new RecordingStream();
        postingsData.writeCompressed(stream, WeightEncoding.INTEGER);

        assertEquals(Arrays.asList(3L, 6L, 10L, 3L, 2L, 1L, 8L, 2L), stream.values());

        PostingsData<Long> decoded = PostingsData.readFrom(1L, stream, WeightEncoding.INTEGER);
        assertEquals(postingsData.counts(), decoded.counts());
        assertTrue(decoded.isFrozen());
    }

    @Test
    @DisplayName("浮点编码写入double权重，总和截断为整数")
    void testFloatingWireLayout() throws IOException {
        PostingsData<Long> postingsData = new PostingsData<>(1L);
        postingsData.setCounts(List.of(new PostingEntry(7, 0.75), new PostingEntry(4, 1.5)));

        RecordingStream stream = new RecordingStream();
        postingsData.writeCompressed(stream, WeightEncoding.FLOATING);

        assertEquals(Arrays.asList(2L, 2L, 4L, 1.5, 3L, 0.75), stream.values());
    }

    @Test
    void testIntegerEncodingTruncatesWeights() throws IOException {
        PostingsData<Long> postingsData = new PostingsData<>(1L);
        postingsData.setCounts(List.of(new PostingEntry(1, 2.9), new PostingEntry(2, 0.4)));

        RecordingStream stream = new RecordingStream();
        postingsData.writeCompressed(stream, WeightEncoding.INTEGER);
        PostingsData<Long> decoded = PostingsData.readFrom(1L, stream, WeightEncoding.INTEGER);

        assertEquals(List.of(new PostingEntry(1, 2.0), new PostingEntry(2, 0.0)), decoded.counts());
    }

    @Test
    void testIntegerEncodingRejectsNegativeWeight() {
        PostingsData<Long> postingsData = new PostingsData<>(1L);
        postingsData.increaseCount(1, -1.0);

        assertThrows(IllegalArgumentException.class,
            () -> postingsData.writeCompressed(new RecordingStream(), WeightEncoding.INTEGER));
    }

    @Test
    void testEmptyPostingsWritesOnlyHeader() throws IOException {
        RecordingStream stream = new RecordingStream();
        new PostingsData<>(1L).writeCompressed(stream, WeightEncoding.FLOATING);

        assertEquals(Arrays.asList(0L, 0L), stream.values());
        PostingsData<Long> decoded = PostingsData.readFrom(1L, stream, WeightEncoding.FLOATING);
        assertTrue(decoded.isEmpty());
    }

    @ParameterizedTest
    @EnumSource(WeightEncoding.class)
    @DisplayName("VarInt流 round-trip")
    void testRoundTripThroughVarIntStream(WeightEncoding encoding) throws IOException {
        Random random = new Random(23);
        PostingsData<String> postingsData = new PostingsData<>("term");
        for (int index = 0; index < 500; index++) {
            postingsData.increaseCount(random.nextInt(100_000), random.nextInt(20) + 1);
        }

        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        postingsData.writeCompressed(new VarIntCompressedWriter(buffer), encoding);

        PostingsData<String> decoded = new PostingsData<>("term");
        decoded.readCompressed(new VarIntCompressedReader(new ByteArrayInputStream(buffer.toByteArray())), encoding);

        assertEquals(postingsData.counts(), decoded.counts());
    }

    @Test
    @DisplayName("大无符号键的差值编码")
    void testRoundTripWithLargeUnsignedKeys() throws IOException {
        PostingsData<Long> postingsData = new PostingsData<>(1L);
        postingsData.setCounts(List.of(
            new PostingEntry(-2L, 1.0),
            new PostingEntry(Long.MAX_VALUE, 2.0),
            new PostingEntry(0L, 3.0)));

        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        postingsData.writeCompressed(new VarIntCompressedWriter(buffer), WeightEncoding.FLOATING);
        PostingsData<Long> decoded = PostingsData.readFrom(
            1L, new VarIntCompressedReader(new ByteArrayInputStream(buffer.toByteArray())), WeightEncoding.FLOATING);

        assertEquals(postingsData.counts(), decoded.counts());
    }

    @Test
    @DisplayName("截断的流读取失败后保留原有内容")
    void testTruncatedStreamKeepsExistingContents() throws IOException {
        PostingsData<Long> postingsData = new PostingsData<>(1L);
        postingsData.setCounts(List.of(new PostingEntry(1, 1.0), new PostingEntry(300, 2.0)));
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        postingsData.writeCompressed(new VarIntCompressedWriter(buffer), WeightEncoding.FLOATING);
        byte[] truncated = Arrays.copyOf(buffer.toByteArray(), buffer.size() - 3);

        PostingsData<Long> target = new PostingsData<>(1L);
        List<PostingEntry> existing = List.of(new PostingEntry(7, 5.0), new PostingEntry(9, 6.0));
        target.setCounts(existing);
        assertThrows(EOFException.class, () -> target.readCompressed(
            new VarIntCompressedReader(new ByteArrayInputStream(truncated)), WeightEncoding.FLOATING));

        assertEquals(existing, target.counts());
        assertFalse(target.isFrozen());
        target.increaseCount(7, 1.0);
        assertEquals(6.0, target.count(7));
    }

    @Test
    @DisplayName("写入失败原样向上传播")
    void testWriterFailurePropagates() {
        PostingsData<Long> postingsData = new PostingsData<>(1L);
        postingsData.increaseCount(1, 1.0);
        CompressedWriter failing = new CompressedWriter() {
            @Override
            public void writeUnsigned(long value) throws IOException {
                throw new IOException("disk full");
            }

            @Override
            public void writeDouble(double value) throws IOException {
                throw new IOException("disk full");
            }
        };

        IOException exception = assertThrows(IOException.class,
            () -> postingsData.writeCompressed(failing, WeightEncoding.INTEGER));
        assertEquals("disk full", exception.getMessage());
    }

    @Test
    void testReadIntoFrozenInstanceRejected() throws IOException {
        RecordingStream stream = new RecordingStream();
        new PostingsData<>(1L).writeCompressed(stream, WeightEncoding.INTEGER);
        PostingsData<Long> frozen = new PostingsData<>(1L);
        frozen.freeze();

        assertThrows(IllegalStateException.class, () -> frozen.readCompressed(stream, WeightEncoding.INTEGER));
    }

    @Test
    void testDecodedStorageIsCompacted() throws IOException {
        PostingsData<Long> postingsData = new PostingsData<>(1L);
        for (int key = 0; key < 37; key++) {
            postingsData.increaseCount(key * 3L, 1.0);
        }
        RecordingStream stream = new RecordingStream();
        postingsData.writeCompressed(stream, WeightEncoding.INTEGER);

        PostingsData<Long> decoded = PostingsData.readFrom(1L, stream, WeightEncoding.INTEGER);

        assertEquals(37, decoded.size());
        assertEquals(37L * 16 + Long.BYTES, decoded.bytesUsed());
    }

    @Test
    void testWeightSumTruncation() {
        assertEquals(0L, PostingsData.truncateSum(-3.5));
        assertEquals(0L, PostingsData.truncateSum(Double.NaN));
        assertEquals(6L, PostingsData.truncateSum(6.99));
        assertEquals(Long.parseUnsignedLong("10000000000000000000"), PostingsData.truncateSum(1e19));
        assertEquals(-1L, PostingsData.truncateSum(Double.POSITIVE_INFINITY));
    }

    @Test
    @DisplayName("整数编码覆盖完整的无符号64位范围")
    void testIntegerWeightAboveSignedRange() throws IOException {
        PostingsData<Long> postingsData = new PostingsData<>(1L);
        postingsData.increaseCount(1, 1.5e19);

        RecordingStream stream = new RecordingStream();
        postingsData.writeCompressed(stream, WeightEncoding.INTEGER);

        long wireWeight = Long.parseUnsignedLong("15000000000000000000");
        assertEquals(Arrays.asList(1L, wireWeight, 1L, wireWeight), stream.values());

        PostingsData<Long> decoded = PostingsData.readFrom(1L, stream, WeightEncoding.INTEGER);
        assertEquals(1.5e19, decoded.count(1));
    }

    @Test
    void testUnsignedFromDouble() {
        assertEquals(0L, WeightEncoding.unsignedFromDouble(-1.0));
        assertEquals(0L, WeightEncoding.unsignedFromDouble(Double.NaN));
        assertEquals(42L, WeightEncoding.unsignedFromDouble(42.9));
        assertEquals(Long.MIN_VALUE, WeightEncoding.unsignedFromDouble(0x1p63));
        assertEquals(Long.MIN_VALUE | 2048L, WeightEncoding.unsignedFromDouble(0x1p63 + 2048));
        assertEquals(-1L, WeightEncoding.unsignedFromDouble(0x1p64));
        assertEquals(-1L, WeightEncoding.unsignedFromDouble(Double.POSITIVE_INFINITY));
        assertEquals(0x1p63, WeightEncoding.unsignedToDouble(WeightEncoding.unsignedFromDouble(0x1p63)));
    }

    @Test
    void testUnsignedToDouble() {
        assertEquals(5.0, WeightEncoding.unsignedToDouble(5L));
        assertEquals(18446744073709551615.0, WeightEncoding.unsignedToDouble(-1L));
    }
}
