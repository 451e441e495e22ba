package xyz.vvrf.gds.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * 惰性语义标签的基类。
 * <p>
 * 标签只是一个 {@code Map<String, String>}，在框架内部没有任何语义：
 * 组合、编译、验证都不会读取它，编译时会被剥离 (IR 中没有标签字段)。
 * 仅供下游消费者 (文档、可视化、领域包) 使用。
 * </p>
 * 子类负责提供返回自身类型的 {@code withTag} / {@code withTags}。
 *
 * @author ruifeng.wen
 */
public abstract class Tagged {

    private final Map<String, String> tags;

    protected Tagged(Map<String, String> tags) {
        this.tags = (tags == null || tags.isEmpty())
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(tags));
    }

    public Map<String, String> getTags() {
        return tags;
    }

    public boolean hasTag(String key) {
        return tags.containsKey(key);
    }

    /**
     * 标签存在且值等于 value 时返回 true。
     */
    public boolean hasTag(String key, String value) {
        return tags.containsKey(key) && Objects.equals(tags.get(key), value);
    }

    public Optional<String> getTag(String key) {
        return Optional.ofNullable(tags.get(key));
    }

    /**
     * 返回当前标签与 extra 合并后的新 Map (extra 覆盖同名键)。
     */
    protected Map<String, String> mergeTags(Map<String, String> extra) {
        Map<String, String> merged = new LinkedHashMap<>(tags);
        merged.putAll(Objects.requireNonNull(extra, "标签不能为空"));
        return merged;
    }
}
