package com.lhcz.pgcdc.core;

import com.lhcz.pgcdc.util.JsonUtil;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 简易 Web 管理控制台
 * 提供复制会话状态监控页面
 */
public class WebConsole {
    private static final Logger log = LoggerFactory.getLogger(WebConsole.class);
    private final int port;
    private final ReplicationSession session;
    private HttpServer server;

    public WebConsole(int port, ReplicationSession session) {
        this.port = port;
        this.session = session;
    }

    public void start() {
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
            server.createContext("/", new DashboardHandler());
            server.createContext("/api/status", new StatusHandler());
            server.setExecutor(null); // creates a default executor
            server.start();
            log.info("🌐 Web 管理控制台已启动: http://localhost:{}", port);
        } catch (IOException e) {
            log.error("❌ Web 控制台启动失败", e);
        }
    }

    public void stop() {
        if (server != null) {
            server.stop(0);
        }
    }

    /**
     * /api/status 的内容
     */
    Map<String, Object> status() {
        Map<String, Object> status = new LinkedHashMap<>();
        status.put("state", session.state());
        status.put("checkpoint", session.checkpoint().toString());
        status.put("reconnects", session.reconnects());
        status.put("decodedEvents", session.decodedEvents());
        status.put("lastError", session.lastError());
        status.put("tables", session.tableStats());
        return status;
    }

    private class DashboardHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange t) throws IOException {
            String html = """
                <!DOCTYPE html>
                <html lang="zh-CN">
                <head>
                    <meta charset="UTF-8">
                    <meta name="viewport" content="width=device-width, initial-scale=1.0">
                    <title>PgCdc 复制监控</title>
                    <style>
                        body {
                            font-family: -apple-system, BlinkMacSystemFont, "Segoe UI", Roboto, "Helvetica Neue", Arial, sans-serif;
                            background-color: #f3f4f6;
                            margin: 0;
                            padding: 20px;
                            color: #1f2937;
                        }
                        .container { max-width: 1200px; margin: 0 auto; }
                        .header {
                            display: flex;
                            justify-content: space-between;
                            align-items: center;
                            margin-bottom: 20px;
                        }
                        h1 { font-size: 1.5rem; font-weight: bold; margin: 0; }
                        .summary { margin-bottom: 16px; font-size: 0.875rem; color: #4b5563; }
                        .summary span { margin-right: 24px; }
                        .card {
                            background: white;
                            border-radius: 8px;
                            box-shadow: 0 4px 6px -1px rgba(0, 0, 0, 0.1), 0 2px 4px -1px rgba(0, 0, 0, 0.06);
                            overflow: hidden;
                        }
                        table { width: 100%; border-collapse: collapse; text-align: left; }
                        th {
                            background-color: #f9fafb;
                            color: #4b5563;
                            font-weight: 600;
                            text-transform: uppercase;
                            font-size: 0.75rem;
                            padding: 12px 24px;
                            border-bottom: 2px solid #e5e7eb;
                        }
                        td { padding: 12px 24px; border-bottom: 1px solid #e5e7eb; font-size: 0.875rem; }
                        tr:last-child td { border-bottom: none; }
                        .badge {
                            display: inline-block;
                            padding: 2px 8px;
                            font-size: 0.75rem;
                            font-weight: 600;
                            border-radius: 9999px;
                            background-color: #dbeafe;
                            color: #1e40af;
                        }
                        .text-green { color: #059669; font-weight: bold; }
                        .text-yellow { color: #d97706; font-weight: bold; }
                        .text-red { color: #dc2626; font-weight: bold; }
                        .font-bold { font-weight: bold; }
                    </style>
                </head>
                <body>
                    <div class="container">
                        <div class="header">
                            <h1>PgCdc 增量复制监控</h1>
                            <span class="summary">自动刷新中...</span>
                        </div>
                        <div class="summary">
                            <span>状态: <b id="state">-</b></span>
                            <span>会话进度: <span class="badge" id="checkpoint">-</span></span>
                            <span>重连次数: <b id="reconnects">0</b></span>
                            <span class="text-red" id="last-error"></span>
                        </div>
                        <div class="card">
                            <table>
                                <thead>
                                    <tr>
                                        <th>表名 (Table)</th>
                                        <th>表进度</th>
                                        <th>缓冲 (Rows)</th>
                                        <th>在途</th>
                                        <th>已写批次</th>
                                        <th>已写记录</th>
                                        <th>跳过 (重放)</th>
                                    </tr>
                                </thead>
                                <tbody id="task-list">
                                    <!-- 数据将通过 JS 插入 -->
                                </tbody>
                            </table>
                        </div>
                    </div>

                    <script>
                        function fetchStatus() {
                            fetch('/api/status')
                                .then(response => response.json())
                                .then(data => {
                                    document.getElementById('state').textContent = data.state;
                                    document.getElementById('checkpoint').textContent = data.checkpoint;
                                    document.getElementById('reconnects').textContent = data.reconnects;
                                    document.getElementById('last-error').textContent = data.lastError || '';
                                    const tbody = document.getElementById('task-list');
                                    tbody.innerHTML = '';
                                    data.tables.forEach(task => {
                                        const row = `
                                            <tr>
                                                <td><span class="font-bold">${task.table}</span></td>
                                                <td><span class="badge">${task.committed}</span></td>
                                                <td>${task.bufferedRows}</td>
                                                <td>${task.inFlight ? '<span class="text-yellow">写入中</span>' : '-'}</td>
                                                <td>${task.appliedBatches}</td>
                                                <td><span class="text-green">+${task.appliedRecords}</span></td>
                                                <td>${task.skippedRecords}</td>
                                            </tr>
                                        `;
                                        tbody.innerHTML += row;
                                    });
                                })
                                .catch(err => console.error('Error fetching status:', err));
                        }

                        // 初始加载并每 3 秒刷新一次
                        fetchStatus();
                        setInterval(fetchStatus, 3000);
                    </script>
                </body>
                </html>
            """;

            write(t, "text/html; charset=utf-8", html);
        }
    }

    private class StatusHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange t) throws IOException {
            write(t, "application/json", JsonUtil.toJson(status()));
        }
    }

    private static void write(HttpExchange t, String contentType, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        t.getResponseHeaders().set("Content-Type", contentType);
        t.sendResponseHeaders(200, bytes.length);
        try (OutputStream os = t.getResponseBody()) {
            os.write(bytes);
        }
    }
}
