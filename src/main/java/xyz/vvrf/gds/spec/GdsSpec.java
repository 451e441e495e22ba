package xyz.vvrf.gds.spec;

import xyz.vvrf.gds.block.AtomicBlock;
import xyz.vvrf.gds.block.Block;
import xyz.vvrf.gds.block.HasParameters;
import xyz.vvrf.gds.block.Mechanism;
import xyz.vvrf.gds.core.Entity;
import xyz.vvrf.gds.core.ParameterSchema;
import xyz.vvrf.gds.core.Space;
import xyz.vvrf.gds.core.StateRef;
import xyz.vvrf.gds.core.Tagged;
import xyz.vvrf.gds.core.TypeDef;
import xyz.vvrf.gds.exception.ValidationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 完整的规范注册表 {h, X}（不可变）。
 * <p>
 * X 是实体状态的乘积空间，h 是由连线组成的转移映射。
 * 实例只能由 {@link xyz.vvrf.gds.builder.SpecBuilder#build()} 在构建阶段结束后产生，
 * 之后的验证、投影、查询都是只读的，读写不会交错。
 * 所有 Map 都保持注册顺序。
 * </p>
 *
 * @author ruifeng.wen
 */
public final class GdsSpec extends Tagged {

    private final String name;
    private final String description;
    private final Map<String, TypeDef> types;
    private final Map<String, Space> spaces;
    private final Map<String, Entity> entities;
    private final Map<String, Block> blocks;
    private final Map<String, SpecWiring> wirings;
    private final ParameterSchema parameterSchema;

    public GdsSpec(String name, String description,
                   Map<String, TypeDef> types, Map<String, Space> spaces, Map<String, Entity> entities,
                   Map<String, Block> blocks, Map<String, SpecWiring> wirings,
                   ParameterSchema parameterSchema, Map<String, String> tags) {
        super(tags);
        this.name = Objects.requireNonNull(name, "规范名称不能为空");
        this.description = description == null ? "" : description;
        this.types = freeze(types);
        this.spaces = freeze(spaces);
        this.entities = freeze(entities);
        this.blocks = freeze(blocks);
        this.wirings = freeze(wirings);
        this.parameterSchema = parameterSchema == null ? ParameterSchema.EMPTY : parameterSchema;
    }

    private static <V> Map<String, V> freeze(Map<String, V> source) {
        if (source == null || source.isEmpty()) {
            return Collections.emptyMap();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    // ── 校验 ─────────────────────────────────────────────

    /**
     * 整个注册表的结构校验，收集全部违规而不是遇错即停。
     * 顺序：空间字段类型、连线引用、Mechanism 更新目标、参数引用。
     *
     * @return 错误描述列表，空表示通过
     */
    public List<String> validateSpec() {
        List<String> errors = new ArrayList<>();
        errors.addAll(validateSpaceTypes());
        errors.addAll(validateWiringBlocks());
        errors.addAll(validateMechanismUpdates());
        errors.addAll(validateParamReferences());
        return errors;
    }

    /**
     * 校验失败时抛出携带全部错误的 {@link ValidationException}。
     */
    public GdsSpec requireValid() {
        List<String> errors = validateSpec();
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }
        return this;
    }

    private List<String> validateSpaceTypes() {
        List<String> errors = new ArrayList<>();
        for (Space space : spaces.values()) {
            for (Map.Entry<String, TypeDef> field : space.getFields().entrySet()) {
                // Space 构造时已拒绝 null 类型
                if (field.getValue() != null && !types.containsKey(field.getValue().getName())) {
                    errors.add(String.format("Space '%s' field '%s' uses unregistered type '%s'",
                            space.getName(), field.getKey(), field.getValue().getName()));
                }
            }
        }
        return errors;
    }

    private List<String> validateWiringBlocks() {
        List<String> errors = new ArrayList<>();
        for (SpecWiring wiring : wirings.values()) {
            for (String blockName : wiring.getBlockNames()) {
                if (!blocks.containsKey(blockName)) {
                    errors.add(String.format("Wiring '%s' references unregistered block '%s'",
                            wiring.getName(), blockName));
                }
            }
            for (Wire wire : wiring.getWires()) {
                if (!blocks.containsKey(wire.getSource())) {
                    errors.add(String.format("Wiring '%s' wire source '%s' not in registered blocks",
                            wiring.getName(), wire.getSource()));
                }
                if (!blocks.containsKey(wire.getTarget())) {
                    errors.add(String.format("Wiring '%s' wire target '%s' not in registered blocks",
                            wiring.getName(), wire.getTarget()));
                }
                if (wire.hasSpace() && !spaces.containsKey(wire.getSpace())) {
                    errors.add(String.format("Wiring '%s' wire references unregistered space '%s'",
                            wiring.getName(), wire.getSpace()));
                }
            }
        }
        return errors;
    }

    private List<String> validateMechanismUpdates() {
        List<String> errors = new ArrayList<>();
        for (Mechanism mech : getMechanisms()) {
            for (StateRef ref : mech.getUpdates()) {
                Entity entity = entities.get(ref.getEntity());
                if (entity == null) {
                    errors.add(String.format("Mechanism '%s' updates unknown entity '%s'",
                            mech.getName(), ref.getEntity()));
                } else if (!entity.hasVariable(ref.getVariable())) {
                    errors.add(String.format("Mechanism '%s' updates unknown variable '%s'",
                            mech.getName(), ref));
                }
            }
        }
        return errors;
    }

    private List<String> validateParamReferences() {
        List<String> errors = new ArrayList<>();
        Set<String> paramNames = parameterSchema.names();
        for (Block block : blocks.values()) {
            if (block instanceof HasParameters) {
                for (String param : ((HasParameters) block).getParamsUsed()) {
                    if (!paramNames.contains(param)) {
                        errors.add(String.format("Block '%s' references unregistered parameter '%s'",
                                block.getName(), param));
                    }
                }
            }
        }
        return errors;
    }

    // ── 访问 ─────────────────────────────────────────────

    /**
     * 按注册顺序返回所有 Mechanism。
     */
    public List<Mechanism> getMechanisms() {
        List<Mechanism> result = new ArrayList<>();
        for (Block block : blocks.values()) {
            if (block instanceof Mechanism) {
                result.add((Mechanism) block);
            }
        }
        return result;
    }

    /**
     * 按注册顺序返回所有原子块 (组合块被忽略)。
     */
    public List<AtomicBlock> getAtomicBlocks() {
        List<AtomicBlock> result = new ArrayList<>();
        for (Block block : blocks.values()) {
            if (block instanceof AtomicBlock) {
                result.add((AtomicBlock) block);
            }
        }
        return result;
    }

    /**
     * 参数名到类型的旧式视图。
     */
    public Map<String, TypeDef> getParameters() {
        Map<String, TypeDef> result = new LinkedHashMap<>();
        parameterSchema.getParameters().forEach((k, v) -> result.put(k, v.getTypedef()));
        return Collections.unmodifiableMap(result);
    }

    public GdsSpec withTag(String key, String value) {
        return withTags(Collections.singletonMap(key, value));
    }

    public GdsSpec withTags(Map<String, String> extra) {
        return new GdsSpec(name, description, types, spaces, entities, blocks, wirings, parameterSchema,
                mergeTags(extra));
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public Map<String, TypeDef> getTypes() {
        return types;
    }

    public Map<String, Space> getSpaces() {
        return spaces;
    }

    public Map<String, Entity> getEntities() {
        return entities;
    }

    public Map<String, Block> getBlocks() {
        return blocks;
    }

    public Map<String, SpecWiring> getWirings() {
        return wirings;
    }

    public ParameterSchema getParameterSchema() {
        return parameterSchema;
    }

    @Override
    public String toString() {
        return String.format("GdsSpec[%s, types=%d, spaces=%d, entities=%d, blocks=%d, wirings=%d, parameters=%d]",
                name, types.size(), spaces.size(), entities.size(), blocks.size(), wirings.size(),
                parameterSchema.size());
    }
}
