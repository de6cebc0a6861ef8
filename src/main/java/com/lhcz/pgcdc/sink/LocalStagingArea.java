package com.lhcz.pgcdc.sink;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lhcz.pgcdc.error.ApplyException;
import com.lhcz.pgcdc.util.JsonUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 本地目录暂存区，每个批次一个 JSON Lines 文件：
 * <pre>
 * staging/public.users/0-16B3748_16-16B37A0-3.jsonl
 * </pre>
 * 第一行是批次头 (表、范围、是否清空)，之后每行一个删除键或一行 upsert 数据。
 */
public class LocalStagingArea implements StagingArea {
    private static final Logger log = LoggerFactory.getLogger(LocalStagingArea.class);

    private final Path root;
    private final ObjectMapper mapper = JsonUtil.mapper();

    public LocalStagingArea(Path root) {
        this.root = root;
    }

    @Override
    public StagedBatch stage(MergePlan plan) {
        Path dir = root.resolve(plan.table().toString());
        Path file = dir.resolve(fileName(plan));
        try {
            Files.createDirectories(dir);
            try (BufferedWriter out = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
                Map<String, Object> header = new LinkedHashMap<>();
                header.put("table", plan.table().toString());
                header.put("low", plan.low().toString());
                header.put("high", plan.high().toString());
                header.put("truncate", plan.truncate());
                header.put("keyColumns", plan.keyColumns());
                writeLine(out, header);
                for (List<Object> key : plan.deletes()) {
                    writeLine(out, Map.of("op", "delete", "key", key));
                }
                for (Map<String, Object> row : plan.upserts()) {
                    writeLine(out, Map.of("op", "upsert", "row", row));
                }
            }
            log.debug("批次已暂存: {} (删除 {} 条, 写入 {} 条)", file, plan.deletes().size(), plan.upserts().size());
            return new StagedBatch(file.toString(), plan);
        } catch (IOException e) {
            throw new ApplyException("写入暂存文件失败: " + file, e);
        }
    }

    @Override
    public void discard(StagedBatch staged) {
        try {
            Files.deleteIfExists(Path.of(staged.location()));
        } catch (IOException e) {
            // 暂存文件只用于排查，清理失败不影响进度
            log.warn("清理暂存文件失败: {} ({})", staged.location(), e.getMessage());
        }
    }

    private void writeLine(BufferedWriter out, Object value) throws IOException {
        out.write(mapper.writeValueAsString(value));
        out.newLine();
    }

    private static String fileName(MergePlan plan) {
        return plan.low().toString().replace('/', '-').replace('#', '-')
                + "_" + plan.high().toString().replace('/', '-').replace('#', '-') + ".jsonl";
    }
}
