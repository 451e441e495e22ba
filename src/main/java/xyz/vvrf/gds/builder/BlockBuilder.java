package xyz.vvrf.gds.builder;

import xyz.vvrf.gds.block.AtomicBlock;
import xyz.vvrf.gds.block.BlockKind;
import xyz.vvrf.gds.block.BoundaryAction;
import xyz.vvrf.gds.block.ControlAction;
import xyz.vvrf.gds.block.Mechanism;
import xyz.vvrf.gds.block.Policy;
import xyz.vvrf.gds.core.Interface;
import xyz.vvrf.gds.core.StateRef;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 原子块的流式构建器，按角色区分入口。
 * <pre>{@code
 * Mechanism m = BlockBuilder.mechanism("Update Balance")
 *         .forwardIn("Transfer")
 *         .updates("Account", "balance")
 *         .params("fee_rate")
 *         .build();
 * }</pre>
 * 结构校验 (例如 BoundaryAction 不得有 forwardIn) 在 {@link #build()} 时由角色构造器执行。
 *
 * @param <B> 产出的原子块类型
 * @author ruifeng.wen
 */
public final class BlockBuilder<B extends AtomicBlock> {

    private final BlockKind kind;
    private final String name;
    private final List<String> forwardIn = new ArrayList<>();
    private final List<String> forwardOut = new ArrayList<>();
    private final List<String> backwardIn = new ArrayList<>();
    private final List<String> backwardOut = new ArrayList<>();
    private final List<String> options = new ArrayList<>();
    private final List<String> paramsUsed = new ArrayList<>();
    private final List<String> constraints = new ArrayList<>();
    private final List<StateRef> updates = new ArrayList<>();
    private final Map<String, String> tags = new LinkedHashMap<>();

    private BlockBuilder(BlockKind kind, String name) {
        this.kind = kind;
        this.name = Objects.requireNonNull(name, "Block 名称不能为空");
    }

    public static BlockBuilder<BoundaryAction> boundary(String name) {
        return new BlockBuilder<>(BlockKind.BOUNDARY, name);
    }

    public static BlockBuilder<Policy> policy(String name) {
        return new BlockBuilder<>(BlockKind.POLICY, name);
    }

    public static BlockBuilder<ControlAction> control(String name) {
        return new BlockBuilder<>(BlockKind.CONTROL, name);
    }

    public static BlockBuilder<Mechanism> mechanism(String name) {
        return new BlockBuilder<>(BlockKind.MECHANISM, name);
    }

    public static BlockBuilder<AtomicBlock> atomic(String name) {
        return new BlockBuilder<>(BlockKind.GENERIC, name);
    }

    public BlockBuilder<B> forwardIn(String... ports) {
        forwardIn.addAll(Arrays.asList(ports));
        return this;
    }

    public BlockBuilder<B> forwardOut(String... ports) {
        forwardOut.addAll(Arrays.asList(ports));
        return this;
    }

    public BlockBuilder<B> backwardIn(String... ports) {
        backwardIn.addAll(Arrays.asList(ports));
        return this;
    }

    public BlockBuilder<B> backwardOut(String... ports) {
        backwardOut.addAll(Arrays.asList(ports));
        return this;
    }

    public BlockBuilder<B> params(String... names) {
        requireRole("params");
        paramsUsed.addAll(Arrays.asList(names));
        return this;
    }

    public BlockBuilder<B> constraints(String... texts) {
        requireRole("constraints");
        constraints.addAll(Arrays.asList(texts));
        return this;
    }

    public BlockBuilder<B> options(String... names) {
        if (kind == BlockKind.MECHANISM || kind == BlockKind.GENERIC) {
            throw new IllegalStateException(String.format("%s block '%s' does not carry options", kind.value(), name));
        }
        options.addAll(Arrays.asList(names));
        return this;
    }

    public BlockBuilder<B> updates(String entity, String variable) {
        if (kind != BlockKind.MECHANISM) {
            throw new IllegalStateException(String.format(
                    "%s block '%s' cannot declare state updates; only mechanisms write state", kind.value(), name));
        }
        updates.add(StateRef.of(entity, variable));
        return this;
    }

    public BlockBuilder<B> tag(String key, String value) {
        tags.put(Objects.requireNonNull(key, "标签键不能为空"), value);
        return this;
    }

    @SuppressWarnings("unchecked")
    public B build() {
        Interface iface = Interface.of(forwardIn, forwardOut, backwardIn, backwardOut);
        AtomicBlock block;
        switch (kind) {
            case BOUNDARY:
                block = new BoundaryAction(name, iface, options, paramsUsed, constraints, tags);
                break;
            case POLICY:
                block = new Policy(name, iface, options, paramsUsed, constraints, tags);
                break;
            case CONTROL:
                block = new ControlAction(name, iface, options, paramsUsed, constraints, tags);
                break;
            case MECHANISM:
                block = new Mechanism(name, iface, updates, paramsUsed, constraints, tags);
                break;
            default:
                block = new AtomicBlock(name, iface, tags);
        }
        return (B) block;
    }

    private void requireRole(String attribute) {
        if (kind == BlockKind.GENERIC) {
            throw new IllegalStateException(String.format("generic block '%s' does not carry %s", name, attribute));
        }
    }
}
