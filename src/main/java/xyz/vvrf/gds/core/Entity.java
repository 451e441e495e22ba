package xyz.vvrf.gds.core;

import xyz.vvrf.gds.exception.ValidationException;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 系统状态的一个命名组成部分（注册后不可变）。
 * <p>
 * 完整状态空间 X 是所有实体状态的乘积。实体对应跨时间步持续存在的
 * 参与者、资源、登记簿等。只有 Mechanism 可以声明对其变量的写入。
 * </p>
 *
 * @author ruifeng.wen
 */
public final class Entity extends Tagged {
    private final String name;
    private final Map<String, StateVariable> variables; // 保持声明顺序
    private final String description;

    /**
     * @throws ValidationException 变量为 null 或重名时，一次性列出所有问题
     */
    public Entity(String name, List<StateVariable> variables, String description, Map<String, String> tags) {
        super(tags);
        this.name = Objects.requireNonNull(name, "实体名称不能为空");
        Map<String, StateVariable> byName = new LinkedHashMap<>();
        List<String> errors = new ArrayList<>();
        if (variables != null) {
            for (int i = 0; i < variables.size(); i++) {
                StateVariable v = variables.get(i);
                if (v == null) {
                    errors.add(String.format("Entity '%s' variable #%d is null", name, i));
                } else if (byName.putIfAbsent(v.getName(), v) != null) {
                    errors.add(String.format("Entity '%s' declares variable '%s' more than once", name, v.getName()));
                }
            }
        }
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }
        this.variables = Collections.unmodifiableMap(byName);
        this.description = description == null ? "" : description;
    }

    public static Entity of(String name, StateVariable... variables) {
        return new Entity(name, Arrays.asList(variables), "", null);
    }

    /**
     * 校验一份实体状态快照。
     *
     * @return 错误描述列表，空表示通过
     */
    public List<String> validateState(Map<String, ?> data) {
        List<String> errors = new ArrayList<>();
        for (StateVariable var : variables.values()) {
            if (!data.containsKey(var.getName())) {
                errors.add(name + "." + var.getName() + ": missing");
            } else if (!var.checkValue(data.get(var.getName()))) {
                errors.add(name + "." + var.getName() + ": type/constraint violation");
            }
        }
        return errors;
    }

    public Entity withTag(String key, String value) {
        return withTags(Collections.singletonMap(key, value));
    }

    public Entity withTags(Map<String, String> extra) {
        return new Entity(name, new ArrayList<>(variables.values()), description, mergeTags(extra));
    }

    public String getName() {
        return name;
    }

    public Map<String, StateVariable> getVariables() {
        return variables;
    }

    public boolean hasVariable(String variableName) {
        return variables.containsKey(variableName);
    }

    public String getDescription() {
        return description;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Entity entity = (Entity) o;
        return name.equals(entity.name) && variables.equals(entity.variables)
                && description.equals(entity.description) && getTags().equals(entity.getTags());
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, variables, description, getTags());
    }

    @Override
    public String toString() {
        return String.format("Entity[%s, variables=%s]", name, variables.keySet());
    }
}
