package com.lhcz.pgcdc;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.lhcz.pgcdc.config.AppConfig;
import com.lhcz.pgcdc.core.ModeOrchestrator;
import com.lhcz.pgcdc.core.Pipeline;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;

public class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) throws Exception {
        AppConfig config = loadConfig();
        ModeOrchestrator.Mode mode = ModeOrchestrator.Mode.parse(resolveMode(args, config));
        log.info("Starting PgCdc ({}) ...", mode);

        Pipeline pipeline = new Pipeline(config);
        Runtime.getRuntime().addShutdownHook(new Thread(pipeline::stop, "pgcdc-shutdown"));
        boolean ok = false;
        try {
            pipeline.run(mode);
            ok = true;
        } catch (RuntimeException e) {
            log.error("💥 运行失败: {}", e.getMessage(), e);
        } finally {
            pipeline.close();
        }
        if (!ok) {
            System.exit(1);
        }
    }

    static AppConfig loadConfig() throws IOException {
        // 读取 YAML 配置
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory())
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        File file = new File("application.yaml");

        // 如果同级目录没有，尝试读取 config/application.yaml (更规范的生产环境写法)
        if (!file.exists()) {
            file = new File("config/application.yaml");
        }
        if (file.exists()) {
            return mapper.readValue(file, AppConfig.class);
        }

        // 如果还没找到，尝试从 Jar 包内部读取（作为默认保底）
        try (InputStream is = Main.class.getClassLoader().getResourceAsStream("application.yaml")) {
            if (is == null) {
                throw new FileNotFoundException("找不到配置文件 application.yaml");
            }
            return mapper.readValue(is, AppConfig.class);
        }
    }

    /**
     * 运行模式优先级：命令行参数 > 环境变量 PIPELINE_MODE > 配置文件 mode
     */
    static String resolveMode(String[] args, AppConfig config) {
        if (args.length > 0 && !args[0].isBlank()) {
            return args[0];
        }
        String env = System.getenv("PIPELINE_MODE");
        if (env != null && !env.isBlank()) {
            return env;
        }
        return config.mode();
    }
}
