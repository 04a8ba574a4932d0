package com.textindex.postings;

/**
 * 倒排项，记录次级键及其权重。
 *
 * @param secondaryKey 次级键（无符号64位ID，如文档ID或词项ID）
 * @param weight 权重
 */
public record PostingEntry(long secondaryKey, double weight) {
}
