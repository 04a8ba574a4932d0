package com.textindex.config;

/**
 * 全局常量定义
 *
 * 包含存储格式魔数、内存估算参数和命令行参数上限
 */
public final class Constants {
    private Constants() {
        // 工具类，禁止实例化
    }

    // ==================== 存储格式魔数 ====================
    /** 倒排文件魔数 "TXPL" */
    public static final int POSTINGS_MAGIC = 0x5458504C;
    /** 文件格式版本号 */
    public static final short FORMAT_VERSION = 1;
    /** 文件头长度：魔数 + 版本号 + 权重编码 */
    public static final int POSTINGS_HEADER_BYTES = Integer.BYTES + Short.BYTES + Byte.BYTES;

    // ==================== 内存估算参数 ====================
    /** 单个倒排项的固定开销：一个long键加一个double权重 */
    public static final long POSTING_ENTRY_BYTES = Long.BYTES + Double.BYTES;

    // ==================== 命令行参数 ====================
    /** inspect 默认输出的倒排列表条数 */
    public static final int DEFAULT_INSPECT_LIMIT = 20;
    /** inspect 输出条数上限 */
    public static final int MAX_INSPECT_LIMIT = 100_000;
}
