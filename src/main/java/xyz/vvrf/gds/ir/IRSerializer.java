package xyz.vvrf.gds.ir;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * IR 文档的 JSON 读写。
 * <p>
 * 字段名使用 snake_case；块顺序、连线顺序、feedback/temporal 标记与层级树都原样往返。
 * Jackson 的 IOException 包装为 {@link UncheckedIOException}。
 * </p>
 *
 * @author ruifeng.wen
 */
@Slf4j
public class IRSerializer {

    private final ObjectMapper objectMapper;
    private final boolean prettyPrint;

    public IRSerializer() {
        this(true);
    }

    public IRSerializer(boolean prettyPrint) {
        this.prettyPrint = prettyPrint;
        this.objectMapper = createObjectMapper();
    }

    /**
     * IR 使用的 ObjectMapper 配置，SpecSerializer 也复用它。
     */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        return mapper;
    }

    public String toJson(IRDocument document) {
        Objects.requireNonNull(document, "IRDocument 不能为空");
        try {
            return prettyPrint
                    ? objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(document)
                    : objectMapper.writeValueAsString(document);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize IR document", e);
        }
    }

    public IRDocument fromJson(String json) {
        Objects.requireNonNull(json, "JSON 不能为空");
        try {
            return objectMapper.readValue(json, IRDocument.class);
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to parse IR document", e);
        }
    }

    public void write(IRDocument document, Path path) {
        String json = toJson(document);
        try {
            Files.write(path, json.getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write IR document to " + path, e);
        }
        log.info("IR 文档已写入 {} ({} 个系统)", path, document.getSystems().size());
    }

    public IRDocument read(Path path) {
        String json;
        try {
            json = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read IR document from " + path, e);
        }
        IRDocument document = fromJson(json);
        log.info("已从 {} 加载 IR 文档 ({} 个系统)", path, document.getSystems().size());
        return document;
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }
}
