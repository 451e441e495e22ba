package xyz.vvrf.gds.builder;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.gds.block.Block;
import xyz.vvrf.gds.core.Entity;
import xyz.vvrf.gds.core.ParameterDef;
import xyz.vvrf.gds.core.ParameterSchema;
import xyz.vvrf.gds.core.Space;
import xyz.vvrf.gds.core.TypeDef;
import xyz.vvrf.gds.spec.GdsSpec;
import xyz.vvrf.gds.spec.SpecWiring;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 用于以编程方式构建不可变的 {@link GdsSpec}。
 * <p>
 * 构建器是注册表在构建阶段的唯一所有者：所有 {@code register*} 调用都发生在
 * {@link #build()} 之前，之后的分析只读取冻结的快照。
 * 每个 {@code register*} 在名称冲突时立即抛出 {@link IllegalArgumentException}，
 * 否则插入并返回自身以便链式调用。
 * 非线程安全，不应被多个所有者并发修改。
 * </p>
 *
 * @author ruifeng.wen
 */
@Slf4j
public class SpecBuilder {

    private final String name;
    private String description = "";
    private final Map<String, TypeDef> types = new LinkedHashMap<>();
    private final Map<String, Space> spaces = new LinkedHashMap<>();
    private final Map<String, Entity> entities = new LinkedHashMap<>();
    private final Map<String, Block> blocks = new LinkedHashMap<>();
    private final Map<String, SpecWiring> wirings = new LinkedHashMap<>();
    private final Map<String, String> tags = new LinkedHashMap<>();
    private ParameterSchema parameterSchema = ParameterSchema.EMPTY;

    public SpecBuilder(String name) {
        this.name = Objects.requireNonNull(name, "规范名称不能为空");
        log.debug("为规范 '{}' 创建 SpecBuilder", name);
    }

    public SpecBuilder description(String description) {
        this.description = description == null ? "" : description;
        return this;
    }

    public SpecBuilder tag(String key, String value) {
        tags.put(Objects.requireNonNull(key, "标签键不能为空"), value);
        return this;
    }

    public SpecBuilder registerType(TypeDef type) {
        Objects.requireNonNull(type, "TypeDef 不能为空");
        putUnique(types, type.getName(), type, "Type");
        return this;
    }

    public SpecBuilder registerSpace(Space space) {
        Objects.requireNonNull(space, "Space 不能为空");
        putUnique(spaces, space.getName(), space, "Space");
        return this;
    }

    public SpecBuilder registerEntity(Entity entity) {
        Objects.requireNonNull(entity, "Entity 不能为空");
        putUnique(entities, entity.getName(), entity, "Entity");
        return this;
    }

    public SpecBuilder registerBlock(Block block) {
        Objects.requireNonNull(block, "Block 不能为空");
        putUnique(blocks, block.getName(), block, "Block");
        return this;
    }

    public SpecBuilder registerWiring(SpecWiring wiring) {
        Objects.requireNonNull(wiring, "SpecWiring 不能为空");
        putUnique(wirings, wiring.getName(), wiring, "Wiring");
        return this;
    }

    public SpecBuilder registerParameter(ParameterDef param) {
        Objects.requireNonNull(param, "ParameterDef 不能为空");
        parameterSchema = parameterSchema.add(param);
        log.debug("规范 '{}': 已注册参数 '{}'", name, param.getName());
        return this;
    }

    /**
     * 按名称和类型注册参数的简写形式。
     */
    public SpecBuilder registerParameter(String paramName, TypeDef typedef) {
        Objects.requireNonNull(typedef, "typedef is required when registering by name");
        return registerParameter(ParameterDef.of(paramName, typedef));
    }

    /**
     * 按类型分派批量注册 TypeDef、Space、Entity、Block、ParameterDef。
     * SpecWiring 与参数简写仍需显式调用。
     *
     * @throws IllegalArgumentException 遇到不支持的对象类型
     */
    public SpecBuilder collect(Object... objects) {
        for (Object obj : objects) {
            if (obj instanceof TypeDef) {
                registerType((TypeDef) obj);
            } else if (obj instanceof Space) {
                registerSpace((Space) obj);
            } else if (obj instanceof Entity) {
                registerEntity((Entity) obj);
            } else if (obj instanceof ParameterDef) {
                registerParameter((ParameterDef) obj);
            } else if (obj instanceof Block) {
                registerBlock((Block) obj);
            } else {
                throw new IllegalArgumentException(String.format(
                        "collect() does not accept '%s'; expected TypeDef, Space, Entity, Block, or ParameterDef",
                        obj == null ? "null" : obj.getClass().getSimpleName()));
            }
        }
        return this;
    }

    /**
     * 冻结当前注册内容，生成不可变的 GdsSpec。
     * 不做 {@link GdsSpec#validateSpec()}；需要时调用 {@link GdsSpec#requireValid()}。
     */
    public GdsSpec build() {
        GdsSpec spec = new GdsSpec(name, description, types, spaces, entities, blocks, wirings,
                parameterSchema, tags);
        log.info("规范 '{}' 构建完成: {} 个类型, {} 个空间, {} 个实体, {} 个 Block, {} 个连线分组, {} 个参数",
                name, types.size(), spaces.size(), entities.size(), blocks.size(), wirings.size(),
                parameterSchema.size());
        return spec;
    }

    private <V> void putUnique(Map<String, V> target, String key, V value, String kind) {
        if (target.containsKey(key)) {
            throw new IllegalArgumentException(String.format("%s '%s' already registered", kind, key));
        }
        target.put(key, value);
        log.debug("规范 '{}': 已注册 {} '{}'", name, kind, key);
    }
}
