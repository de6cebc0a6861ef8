package com.lhcz.pgcdc.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lhcz.pgcdc.model.Batch;
import com.lhcz.pgcdc.model.ChangeRecord;
import com.lhcz.pgcdc.model.UnchangedToast;
import com.lhcz.pgcdc.util.JsonUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.text.SimpleDateFormat;
import java.util.ArrayList;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 死信队列管理器 (失败批次转储)
 * 作用：批次最终写入失败、会话即将停止时，把整批变更保存到本地文件，便于排查和人工补录。
 * 进度不会越过该批次，修复后重启会重新拉取同一批数据。
 */
public class DeadLetterQueueManager {
    private static final Logger log = LoggerFactory.getLogger(DeadLetterQueueManager.class);
    private final File failDir;
    private final ObjectMapper mapper = JsonUtil.mapper();

    public DeadLetterQueueManager(String failDir) {
        this.failDir = new File(failDir);
        if (!this.failDir.exists()) {
            if (this.failDir.mkdirs()) {
                log.info("📂 已创建失败批次目录: {}", this.failDir.getAbsolutePath());
            }
        }
    }

    /**
     * 保存失败批次到磁盘
     *
     * @return 文件路径，保存失败时为 null
     */
    public File save(Batch batch, String reason) {
        if (batch == null || batch.isEmpty()) return null;

        // 生成文件名: failed_表名_时间_原因.json
        String timeStr = new SimpleDateFormat("yyyyMMdd_HHmmss").format(new Date());
        String safeReason = reason == null ? "unknown" : reason.replaceAll("[^a-zA-Z0-9]", "_");
        if (safeReason.length() > 30) safeReason = safeReason.substring(0, 30);

        String tableName = batch.table().toString();
        File file = new File(failDir, String.format("failed_%s_%s_%s.json", tableName, timeStr, safeReason));

        Map<String, Object> dump = new LinkedHashMap<>();
        dump.put("table", tableName);
        dump.put("low", batch.low().toString());
        dump.put("high", batch.high().toString());
        dump.put("reason", reason);
        List<Map<String, Object>> records = new ArrayList<>(batch.size());
        for (ChangeRecord record : batch.records()) {
            records.add(toDump(record));
        }
        dump.put("records", records);

        try {
            mapper.writerWithDefaultPrettyPrinter().writeValue(file, dump);
            log.error("💾 [失败转储] 批次已保存到文件! 路径: {}, 范围: ({}, {}], 原因: {}",
                    file.getPath(), batch.low(), batch.high(), reason);
            return file;
        } catch (IOException e) {
            log.error("🚨 [严重错误] 无法保存失败批次! 表: {}, 范围: ({}, {}]", tableName, batch.low(), batch.high(), e);
            return null;
        }
    }

    private static Map<String, Object> toDump(ChangeRecord record) {
        Map<String, Object> item = new LinkedHashMap<>();
        item.put("position", record.position().toString());
        item.put("op", record.truncate() ? "TRUNCATE" : record.operation().name());
        item.put("commitTime", record.commitTime());
        if (record.before() != null) item.put("before", plain(record.before()));
        if (record.after() != null) item.put("after", plain(record.after()));
        return item;
    }

    // 占位符对象不能直接序列化
    private static Map<String, Object> plain(Map<String, Object> image) {
        Map<String, Object> copy = new LinkedHashMap<>();
        image.forEach((k, v) -> copy.put(k, UnchangedToast.is(v) ? v.toString() : v));
        return copy;
    }
}
