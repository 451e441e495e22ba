package xyz.vvrf.gds.core;

import xyz.vvrf.gds.exception.ValidationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * 类型化的积空间（不可变数据类）：定义在 Block 之间流动的数据形状。
 * 每个字段名映射到一个 {@link TypeDef}。
 *
 * @author ruifeng.wen
 */
public final class Space {

    /** 端口上没有数据流动。 */
    public static final Space EMPTY = new Space("empty", Collections.emptyMap(), "No data flows through this port");
    /** 信号在此终止 (状态写入)。 */
    public static final Space TERMINAL = new Space("terminal", Collections.emptyMap(), "Signal terminates here (state write)");

    private final String name;
    private final Map<String, TypeDef> fields;
    private final String description;

    /**
     * @throws ValidationException 字段名或字段类型为 null 时，一次性列出所有问题
     */
    public Space(String name, Map<String, TypeDef> fields, String description) {
        this.name = Objects.requireNonNull(name, "空间名称不能为空");
        this.fields = fields == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        List<String> errors = new ArrayList<>();
        for (Map.Entry<String, TypeDef> field : this.fields.entrySet()) {
            if (field.getKey() == null) {
                errors.add(String.format("Space '%s' declares a field without a name", name));
            } else if (field.getValue() == null) {
                errors.add(String.format("Space '%s' field '%s' has no type", name, field.getKey()));
            }
        }
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }
        this.description = description == null ? "" : description;
    }

    public static Space of(String name, Map<String, TypeDef> fields) {
        return new Space(name, fields, "");
    }

    /**
     * 按字段 schema 校验一份数据。
     *
     * @return 错误描述列表，空表示通过
     */
    public List<String> validateData(Map<String, ?> data) {
        List<String> errors = new ArrayList<>();
        for (Map.Entry<String, TypeDef> field : fields.entrySet()) {
            String fieldName = field.getKey();
            TypeDef typedef = field.getValue();
            if (!data.containsKey(fieldName)) {
                errors.add("Missing field: " + fieldName);
            } else if (!typedef.checkValue(data.get(fieldName))) {
                Object value = data.get(fieldName);
                errors.add(String.format("%s: expected %s, got %s with value %s",
                        fieldName, typedef.getName(),
                        value == null ? "null" : value.getClass().getSimpleName(), value));
            }
        }
        Set<String> extra = new TreeSet<>(data.keySet());
        extra.removeAll(fields.keySet());
        if (!extra.isEmpty()) {
            errors.add("Unexpected fields: " + extra);
        }
        return errors;
    }

    /**
     * 另一个空间是否具有相同结构 (字段名与类型一致)。
     */
    public boolean isCompatible(Space other) {
        return fields.equals(other.fields);
    }

    public String getName() {
        return name;
    }

    public Map<String, TypeDef> getFields() {
        return fields;
    }

    public String getDescription() {
        return description;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Space space = (Space) o;
        return name.equals(space.name) && fields.equals(space.fields) && description.equals(space.description);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, fields, description);
    }

    @Override
    public String toString() {
        return String.format("Space[%s, fields=%s]", name, fields.keySet());
    }
}
