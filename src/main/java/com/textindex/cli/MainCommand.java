package com.textindex.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.textindex.config.Constants;
import com.textindex.config.EngineConfig;
import com.textindex.postings.PostingEntry;
import com.textindex.postings.PostingsData;
import com.textindex.postings.WeightEncoding;
import com.textindex.storage.PostingsFileReader;
import com.textindex.storage.PostingsFileWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.Callable;

@Command(
    name = "postings",
    description = "📚 倒排列表文件工具",
    mixinStandardHelpOptions = true,
    version = "1.0.0",
    subcommands = {
        MainCommand.InspectSubcommand.class,
        MainCommand.StatsSubcommand.class,
        MainCommand.MergeSubcommand.class
    }
)
public class MainCommand implements Callable<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(MainCommand.class);

    @Option(names = {"--config"}, description = "JSON 配置文件路径")
    private Path configFile;

    @Option(names = {"--encoding"}, description = "权重编码 (${COMPLETION-CANDIDATES})，覆盖配置文件")
    private WeightEncoding encoding;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new MainCommand()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() {
        System.out.println("📚 倒排列表文件工具");
        System.out.println("使用 --help 查看帮助信息");
        return 0;
    }

    /**
     * 合并配置文件与命令行选项，命令行优先。
     */
    EngineConfig resolveConfig() throws IOException {
        EngineConfig config = configFile == null ? EngineConfig.defaults() : EngineConfig.load(configFile);
        if (encoding != null) {
            config.setWeightEncoding(encoding);
        }
        return config;
    }

    /**
     * 把多组倒排记录按主键归并，同主键的记录依次合并。
     *
     * @param shards 各分片读出的倒排记录
     * @return 按主键无符号升序排列的合并结果
     */
    static Map<Long, PostingsData<Long>> reduceShards(List<List<PostingsData<Long>>> shards) {
        Map<Long, PostingsData<Long>> merged = new TreeMap<>(Long::compareUnsigned);
        for (List<PostingsData<Long>> shard : shards) {
            for (PostingsData<Long> record : shard) {
                merged.computeIfAbsent(record.primaryKey(), PostingsData::new).mergeWith(record);
            }
        }
        return merged;
    }

    @Command(name = "inspect", description = "🔎 打印倒排文件内容")
    static class InspectSubcommand implements Callable<Integer> {

        @Parameters(description = "倒排文件路径", arity = "1")
        private Path postingsFile;

        @Option(names = {"-l", "--limit"}, description = "最多输出的倒排列表条数")
        private Integer limit;

        @Option(names = {"-f", "--format"}, description = "输出格式 (text|json)", defaultValue = "text")
        private String format;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                EngineConfig config = main.resolveConfig();
                int safeLimit = sanitizeLimit(limit == null ? config.getInspectLimit() : limit);
                try (PostingsFileReader reader = new PostingsFileReader(postingsFile.toFile(), config.getWeightEncoding())) {
                    List<PostingsData<Long>> records = reader.readAll();
                    List<PostingsData<Long>> shown = records.subList(0, Math.min(safeLimit, records.size()));
                    if ("json".equalsIgnoreCase(format)) {
                        printJson(shown);
                    } else {
                        printText(shown);
                    }
                    System.out.println("📊 共 " + records.size() + " 条倒排列表，显示 " + shown.size() + " 条");
                }
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 读取失败: " + exception.getMessage());
                logger.debug("inspect 失败: {}", postingsFile, exception);
                return 1;
            }
        }

        private int sanitizeLimit(int rawLimit) {
            if (rawLimit < 0) {
                System.err.printf("⚠️ limit=%d 非法，已使用 0%n", rawLimit);
                return 0;
            }
            if (rawLimit > Constants.MAX_INSPECT_LIMIT) {
                System.err.printf("⚠️ limit=%d 超过上限 %d，已自动限制%n", rawLimit, Constants.MAX_INSPECT_LIMIT);
                return Constants.MAX_INSPECT_LIMIT;
            }
            return rawLimit;
        }

        private void printText(List<PostingsData<Long>> records) {
            for (PostingsData<Long> record : records) {
                StringBuilder line = new StringBuilder();
                line.append(Long.toUnsignedString(record.primaryKey())).append(" ->");
                for (PostingEntry entry : record.counts()) {
                    line.append(' ').append(Long.toUnsignedString(entry.secondaryKey())).append(':').append(entry.weight());
                }
                System.out.println(line);
            }
        }

        private void printJson(List<PostingsData<Long>> records) throws IOException {
            List<PostingsView> views = records.stream()
                .map(record -> new PostingsView(record.primaryKey(), record.size(), record.bytesUsed(), record.counts()))
                .toList();
            ObjectMapper mapper = new ObjectMapper();
            System.out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(views));
        }
    }

    @Command(name = "stats", description = "📊 查看倒排文件统计信息")
    static class StatsSubcommand implements Callable<Integer> {

        @Parameters(description = "倒排文件路径", arity = "1")
        private Path postingsFile;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                EngineConfig config = main.resolveConfig();
                try (PostingsFileReader reader = new PostingsFileReader(postingsFile.toFile(), config.getWeightEncoding())) {
                    List<PostingsData<Long>> records = reader.readAll();
                    long totalEntries = 0;
                    long totalBytes = 0;
                    for (PostingsData<Long> record : records) {
                        totalEntries += record.size();
                        totalBytes += record.bytesUsed();
                    }

                    System.out.println("📊 倒排文件统计");
                    System.out.println("═══════════");
                    System.out.println("📁 文件: " + postingsFile);
                    System.out.println("🔤 权重编码: " + config.getWeightEncoding());
                    System.out.println("📄 倒排列表数: " + records.size());
                    System.out.println("🔗 倒排项总数: " + totalEntries);
                    System.out.println("💾 估算内存: " + formatBytes(totalBytes));
                }
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 获取统计失败: " + exception.getMessage());
                return 1;
            }
        }

        private String formatBytes(long bytes) {
            if (bytes < 1024) {
                return bytes + " B";
            }
            if (bytes < 1024 * 1024L) {
                return String.format("%.2f KB", bytes / 1024.0);
            }
            if (bytes < 1024 * 1024L * 1024L) {
                return String.format("%.2f MB", bytes / (1024.0 * 1024.0));
            }
            return String.format("%.2f GB", bytes / (1024.0 * 1024.0 * 1024.0));
        }
    }

    @Command(name = "merge", description = "🔄 合并多个分片的倒排文件")
    static class MergeSubcommand implements Callable<Integer> {

        @Parameters(description = "待合并的倒排文件", arity = "1..*")
        private List<Path> inputFiles;

        @Option(names = {"-o", "--output"}, description = "输出文件路径", required = true)
        private Path outputFile;

        @ParentCommand
        private MainCommand main;

        @Override
        public Integer call() {
            try {
                EngineConfig config = main.resolveConfig();
                WeightEncoding weightEncoding = config.getWeightEncoding();
                long start = System.currentTimeMillis();

                List<List<PostingsData<Long>>> shards = new ArrayList<>();
                for (Path inputFile : inputFiles) {
                    try (PostingsFileReader reader = new PostingsFileReader(inputFile.toFile(), weightEncoding)) {
                        List<PostingsData<Long>> records = reader.readAll();
                        logger.info("读取分片: {}, records={}", inputFile, records.size());
                        shards.add(records);
                    }
                }

                Map<Long, PostingsData<Long>> merged = reduceShards(shards);
                try (PostingsFileWriter writer = new PostingsFileWriter(outputFile.toFile(), weightEncoding)) {
                    for (PostingsData<Long> postingsData : merged.values()) {
                        writer.write(postingsData);
                    }
                }

                long elapsed = System.currentTimeMillis() - start;
                System.out.println("✅ 合并完成！");
                System.out.println("   分片数: " + inputFiles.size());
                System.out.println("   倒排列表数: " + merged.size());
                System.out.println("   用时: " + elapsed + "ms");
                return 0;
            } catch (Exception exception) {
                System.err.println("❌ 合并失败: " + exception.getMessage());
                logger.debug("merge 失败: output={}", outputFile, exception);
                return 1;
            }
        }
    }

    /**
     * JSON 输出视图。
     */
    public record PostingsView(long primaryKey, int size, long bytesUsed, List<PostingEntry> counts) {
    }
}
