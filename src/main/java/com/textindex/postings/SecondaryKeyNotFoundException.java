package com.textindex.postings;

import java.util.NoSuchElementException;

/**
 * 查询的次级键不在倒排列表中。缺失与权重为0语义不同，调用方不应将其视为0。
 */
public class SecondaryKeyNotFoundException extends NoSuchElementException {
    private final long secondaryKey;

    public SecondaryKeyNotFoundException(long secondaryKey) {
        super("次级键不存在: " + Long.toUnsignedString(secondaryKey));
        this.secondaryKey = secondaryKey;
    }

    public long getSecondaryKey() {
        return secondaryKey;
    }
}
