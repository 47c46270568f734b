package com.asiainfo.semantic.infra.loader;

import com.asiainfo.semantic.core.SemanticModel;
import com.asiainfo.semantic.core.exception.SchemaException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 模型文档加载器
 * 支持 classpath:xxx.json 与文件系统路径。
 */
@ApplicationScoped
public class ModelDocumentLoader {

    private static final Logger log = LoggerFactory.getLogger(ModelDocumentLoader.class);
    private static final String CLASSPATH_PREFIX = "classpath:";

    @Inject
    ObjectMapper objectMapper;

    public ModelDocumentLoader() {
    }

    ModelDocumentLoader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ModelDocument read(String location) {
        long start = System.currentTimeMillis();
        try (InputStream in = open(location)) {
            ModelDocument doc = objectMapper.readValue(in, ModelDocument.class);
            log.info("[Loader] Read model document {} in {} ms", location, System.currentTimeMillis() - start);
            return doc;
        } catch (IOException e) {
            throw new SchemaException("Cannot read model document " + location + ": " + e.getMessage(), e);
        }
    }

    /**
     * 读取并构建模型快照
     *
     * @throws SchemaException 文档不可读或模型不合法
     */
    public SemanticModel load(String location, long version, long anchorCacheSize) {
        return ModelDocumentMapper.toModel(read(location), version, anchorCacheSize);
    }

    private static InputStream open(String location) throws IOException {
        if (location.startsWith(CLASSPATH_PREFIX)) {
            String resource = location.substring(CLASSPATH_PREFIX.length());
            if (resource.startsWith("/")) {
                resource = resource.substring(1);
            }
            InputStream in = Thread.currentThread().getContextClassLoader().getResourceAsStream(resource);
            if (in == null) {
                throw new IOException("classpath resource not found: " + resource);
            }
            return in;
        }
        return Files.newInputStream(Path.of(location));
    }
}
