package com.quadscan.core.config;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;

@Slf4j
public class PipelineConfigLoader {

    public static final String DEFAULT_RESOURCE = "quadscan.json";

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .configure(SerializationFeature.INDENT_OUTPUT, true)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private PipelineConfigLoader() {
    }

    /**
     * 从JSON字符串加载管道配置。
     *
     * @param jsonString JSON格式的配置字符串
     * @return 校验通过的PipelineConfig对象
     * @throws JsonProcessingException 如果JSON解析失败
     */
    public static PipelineConfig fromJson(String jsonString) throws JsonProcessingException {
        return OBJECT_MAPPER.readValue(jsonString, PipelineConfig.class).validate();
    }

    public static PipelineConfig fromFile(Path path) throws IOException {
        log.info("从文件加载管道配置: {}", path);
        return fromJson(Files.readString(path));
    }

    /**
     * 从 classpath 资源加载管道配置
     *
     * @throws IOException 资源不存在或读取失败
     */
    public static PipelineConfig fromClasspath(String resource) throws IOException {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = PipelineConfigLoader.class.getClassLoader();
        }
        try (InputStream in = loader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IOException("classpath resource not found: " + resource);
            }
            log.info("从 classpath 加载管道配置: {}", resource);
            return OBJECT_MAPPER.readValue(in, PipelineConfig.class).validate();
        }
    }

    public static String toJson(PipelineConfig config) throws JsonProcessingException {
        return OBJECT_MAPPER.writeValueAsString(config);
    }
}
