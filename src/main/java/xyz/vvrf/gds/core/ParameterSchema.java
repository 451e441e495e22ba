package xyz.vvrf.gds.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.TreeSet;

/**
 * 规范层面的参数空间 Θ（不可变，写时复制）。
 * <p>
 * 每次 {@link #add(ParameterDef)} 都返回新实例，原实例不变，
 * 因此快照可以在多个读者之间无锁共享。框架不解释参数取值，只校验结构引用。
 * </p>
 *
 * @author ruifeng.wen
 */
public final class ParameterSchema {

    public static final ParameterSchema EMPTY = new ParameterSchema(Collections.emptyMap());

    private final Map<String, ParameterDef> parameters;

    private ParameterSchema(Map<String, ParameterDef> parameters) {
        this.parameters = parameters;
    }

    /**
     * 返回追加了 param 的新 schema。
     *
     * @throws IllegalArgumentException 如果同名参数已注册
     */
    public ParameterSchema add(ParameterDef param) {
        if (parameters.containsKey(param.getName())) {
            throw new IllegalArgumentException("Parameter '" + param.getName() + "' already registered");
        }
        Map<String, ParameterDef> copy = new LinkedHashMap<>(parameters);
        copy.put(param.getName(), param);
        return new ParameterSchema(Collections.unmodifiableMap(copy));
    }

    /**
     * @throws NoSuchElementException 如果参数不存在
     */
    public ParameterDef get(String name) {
        ParameterDef def = parameters.get(name);
        if (def == null) {
            throw new NoSuchElementException("Parameter '" + name + "' not defined in schema");
        }
        return def;
    }

    public Map<String, ParameterDef> getParameters() {
        return parameters;
    }

    public Set<String> names() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(parameters.keySet()));
    }

    public boolean contains(String name) {
        return parameters.containsKey(name);
    }

    public int size() {
        return parameters.size();
    }

    public boolean isEmpty() {
        return parameters.isEmpty();
    }

    /**
     * 校验引用的参数名是否都已定义，按名称排序输出。
     */
    public List<String> validateReferences(Set<String> refNames) {
        List<String> errors = new ArrayList<>();
        for (String name : new TreeSet<>(refNames)) {
            if (!parameters.containsKey(name)) {
                errors.add("Referenced parameter '" + name + "' not defined in schema");
            }
        }
        return errors;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return parameters.equals(((ParameterSchema) o).parameters);
    }

    @Override
    public int hashCode() {
        return parameters.hashCode();
    }

    @Override
    public String toString() {
        return "ParameterSchema" + parameters.keySet();
    }
}
