package xyz.vvrf.gds.serialize;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import xyz.vvrf.gds.block.AtomicBlock;
import xyz.vvrf.gds.block.Block;
import xyz.vvrf.gds.block.BoundaryAction;
import xyz.vvrf.gds.block.ControlAction;
import xyz.vvrf.gds.block.HasConstraints;
import xyz.vvrf.gds.block.HasOptions;
import xyz.vvrf.gds.block.HasParameters;
import xyz.vvrf.gds.block.Mechanism;
import xyz.vvrf.gds.block.Policy;
import xyz.vvrf.gds.block.RoleVisitor;
import xyz.vvrf.gds.core.Entity;
import xyz.vvrf.gds.core.Interface;
import xyz.vvrf.gds.core.ParameterDef;
import xyz.vvrf.gds.core.Port;
import xyz.vvrf.gds.core.Space;
import xyz.vvrf.gds.core.StateRef;
import xyz.vvrf.gds.core.StateVariable;
import xyz.vvrf.gds.core.TypeDef;
import xyz.vvrf.gds.ir.IRSerializer;
import xyz.vvrf.gds.spec.GdsSpec;
import xyz.vvrf.gds.spec.SpecWiring;
import xyz.vvrf.gds.spec.Wire;

import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * 把规范注册表投影为普通的嵌套 Map (以及 JSON)，用于交换与展示。
 * <p>
 * 只写不读：结果永远不会被读回成注册表。TypeDef 上的值约束谓词不可序列化，
 * 只输出 {@code has_constraint} 标记。
 * </p>
 *
 * @author ruifeng.wen
 */
public class SpecSerializer {

    private static final String COMPOSITE_KIND = "composite";

    private final ObjectMapper objectMapper;

    public SpecSerializer() {
        this.objectMapper = IRSerializer.createObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public Map<String, Object> toMap(GdsSpec spec) {
        Objects.requireNonNull(spec, "GdsSpec 不能为空");
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("name", spec.getName());
        result.put("description", spec.getDescription());
        result.put("types", mapValues(spec.getTypes(), this::typeToMap));
        result.put("spaces", mapValues(spec.getSpaces(), this::spaceToMap));
        result.put("entities", mapValues(spec.getEntities(), this::entityToMap));
        result.put("blocks", mapValues(spec.getBlocks(), this::blockToMap));
        result.put("wirings", mapValues(spec.getWirings(), this::wiringToMap));
        result.put("parameters", mapValues(spec.getParameterSchema().getParameters(), this::parameterToMap));
        if (!spec.getTags().isEmpty()) {
            result.put("tags", new LinkedHashMap<>(spec.getTags()));
        }
        return result;
    }

    public String toJson(GdsSpec spec) {
        try {
            return objectMapper.writeValueAsString(toMap(spec));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialize spec '" + spec.getName() + "'", e);
        }
    }

    private Map<String, Object> typeToMap(TypeDef type) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("name", type.getName());
        m.put("kind", type.getKind().label());
        m.put("description", type.getDescription());
        m.put("has_constraint", type.getConstraint().isPresent());
        m.put("units", type.getUnits().orElse(null));
        return m;
    }

    private Map<String, Object> spaceToMap(Space space) {
        Map<String, Object> schema = new LinkedHashMap<>();
        space.getFields().forEach((field, type) -> schema.put(field, type.getName()));
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("name", space.getName());
        m.put("schema", schema);
        m.put("description", space.getDescription());
        return m;
    }

    private Map<String, Object> entityToMap(Entity entity) {
        Map<String, Object> variables = new LinkedHashMap<>();
        for (StateVariable var : entity.getVariables().values()) {
            Map<String, Object> v = new LinkedHashMap<>();
            v.put("type", var.getTypedef().getName());
            v.put("description", var.getDescription());
            v.put("symbol", var.getSymbol());
            variables.put(var.getName(), v);
        }
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("name", entity.getName());
        m.put("variables", variables);
        m.put("description", entity.getDescription());
        return m;
    }

    private Map<String, Object> blockToMap(Block block) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("name", block.getName());
        m.put("kind", block instanceof AtomicBlock ? ((AtomicBlock) block).getKind().value() : COMPOSITE_KIND);
        m.put("interface", interfaceToMap(block.getInterface()));
        if (block instanceof HasParameters) {
            m.put("params_used", new ArrayList<>(((HasParameters) block).getParamsUsed()));
        }
        if (block instanceof HasConstraints) {
            m.put("constraints", new ArrayList<>(((HasConstraints) block).getConstraints()));
        }
        if (block instanceof HasOptions) {
            m.put("options", new ArrayList<>(((HasOptions) block).getOptions()));
        }
        if (block instanceof AtomicBlock) {
            ((AtomicBlock) block).acceptRole(new UpdatesWriter(m));
        }
        return m;
    }

    private Map<String, Object> interfaceToMap(Interface iface) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("forward_in", portNames(iface.getForwardIn()));
        m.put("forward_out", portNames(iface.getForwardOut()));
        m.put("backward_in", portNames(iface.getBackwardIn()));
        m.put("backward_out", portNames(iface.getBackwardOut()));
        return m;
    }

    private static List<String> portNames(List<Port> ports) {
        List<String> names = new ArrayList<>();
        for (Port p : ports) {
            names.add(p.getName());
        }
        return names;
    }

    private Map<String, Object> wiringToMap(SpecWiring wiring) {
        List<Map<String, Object>> wires = new ArrayList<>();
        for (Wire wire : wiring.getWires()) {
            Map<String, Object> w = new LinkedHashMap<>();
            w.put("source", wire.getSource());
            w.put("target", wire.getTarget());
            w.put("space", wire.getSpace());
            w.put("optional", wire.isOptional());
            wires.add(w);
        }
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("name", wiring.getName());
        m.put("block_names", new ArrayList<>(wiring.getBlockNames()));
        m.put("wires", wires);
        m.put("description", wiring.getDescription());
        return m;
    }

    private Map<String, Object> parameterToMap(ParameterDef param) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("name", param.getName());
        m.put("typedef", param.getTypedef().getName());
        m.put("kind", param.getTypedef().getKind().label());
        m.put("description", param.getDescription());
        if (param.hasBounds()) {
            List<Object> bounds = new ArrayList<>();
            bounds.add(param.getLowerBound().orElse(null));
            bounds.add(param.getUpperBound().orElse(null));
            m.put("bounds", bounds);
        } else {
            m.put("bounds", null);
        }
        return m;
    }

    private static <V> Map<String, Object> mapValues(Map<String, V> source,
                                                     Function<V, Map<String, Object>> fn) {
        Map<String, Object> result = new LinkedHashMap<>();
        source.forEach((k, v) -> result.put(k, fn.apply(v)));
        return result;
    }

    // 只有 Mechanism 输出 updates
    private static final class UpdatesWriter implements RoleVisitor<Void> {
        private final Map<String, Object> target;

        UpdatesWriter(Map<String, Object> target) {
            this.target = target;
        }

        @Override
        public Void visitBoundary(BoundaryAction block) {
            return null;
        }

        @Override
        public Void visitPolicy(Policy block) {
            return null;
        }

        @Override
        public Void visitControl(ControlAction block) {
            return null;
        }

        @Override
        public Void visitMechanism(Mechanism block) {
            List<List<String>> updates = new ArrayList<>();
            for (StateRef ref : block.getUpdates()) {
                List<String> pair = new ArrayList<>();
                pair.add(ref.getEntity());
                pair.add(ref.getVariable());
                updates.add(pair);
            }
            target.put("updates", updates);
            return null;
        }

        @Override
        public Void visitGeneric(AtomicBlock block) {
            return null;
        }
    }
}
