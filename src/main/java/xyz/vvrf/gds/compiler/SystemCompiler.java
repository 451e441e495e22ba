package xyz.vvrf.gds.compiler;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.gds.block.AtomicBlock;
import xyz.vvrf.gds.block.Block;
import xyz.vvrf.gds.block.BlockVisitor;
import xyz.vvrf.gds.block.FeedbackLoop;
import xyz.vvrf.gds.block.ParallelComposition;
import xyz.vvrf.gds.block.StackComposition;
import xyz.vvrf.gds.block.TemporalLoop;
import xyz.vvrf.gds.block.Wiring;
import xyz.vvrf.gds.core.FlowDirection;
import xyz.vvrf.gds.core.ParameterDef;
import xyz.vvrf.gds.core.ParameterSchema;
import xyz.vvrf.gds.core.Port;
import xyz.vvrf.gds.core.Tokens;
import xyz.vvrf.gds.ir.BlockIR;
import xyz.vvrf.gds.ir.CompositionType;
import xyz.vvrf.gds.ir.HierarchyNodeIR;
import xyz.vvrf.gds.ir.ParameterIR;
import xyz.vvrf.gds.ir.SystemIR;
import xyz.vvrf.gds.ir.WiringIR;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Function;
import java.util.regex.Pattern;

/**
 * 把 Block 组合树编译为扁平的 {@link SystemIR}。
 * <p>
 * 三步变换：
 * <ol>
 *   <li>展开：按 flatten 顺序把原子块交给 {@link BlockCompiler}，决定 BlockIR 顺序</li>
 *   <li>连线：收集显式连线，并为没有显式连线的顺序组合按 token 自动连线</li>
 *   <li>层级：生成与组合树同形的层级树，并把同类型的嵌套顺序/并行链折叠为 n 元分组</li>
 * </ol>
 * 编译器无状态，可被多个调用方共享。
 * </p>
 *
 * @author ruifeng.wen
 */
@Slf4j
public class SystemCompiler {

    private static final Pattern NON_ID_CHARS = Pattern.compile("[^A-Za-z0-9_]");

    private final BlockCompiler blockCompiler;

    public SystemCompiler() {
        this(BlockCompiler.DEFAULT);
    }

    public SystemCompiler(BlockCompiler blockCompiler) {
        this.blockCompiler = Objects.requireNonNull(blockCompiler, "BlockCompiler 不能为空");
    }

    public SystemIR compile(String name, Block root) {
        return compile(name, root, CompositionType.SEQUENTIAL, "", ParameterSchema.EMPTY);
    }

    /**
     * 编译组合树。
     *
     * @param name            系统名称
     * @param root            组合树根
     * @param compositionType 顶层组合类型
     * @param source          来源标识
     * @param parameters      随 IR 一起携带的参数空间
     */
    public SystemIR compile(String name, Block root, CompositionType compositionType, String source,
                            ParameterSchema parameters) {
        Objects.requireNonNull(name, "系统名称不能为空");
        Objects.requireNonNull(root, "组合树根不能为空");
        log.info("开始编译系统 '{}' (根: {})", name, root.getName());

        List<BlockIR> blocks = new ArrayList<>();
        for (AtomicBlock leaf : root.flatten()) {
            blocks.add(blockCompiler.compile(leaf));
        }

        List<WiringIR> wirings = new ArrayList<>();
        root.accept(new WiringCollector(wirings));

        int[] counter = {0};
        HierarchyNodeIR hierarchy = collapseChains(root.accept(new HierarchyCollector(counter)));

        List<ParameterIR> parameterIrs = new ArrayList<>();
        for (ParameterDef def : parameters.getParameters().values()) {
            parameterIrs.add(ParameterIR.from(def));
        }

        SystemIR system = SystemIR.builder()
                .name(name)
                .blocks(Collections.unmodifiableList(blocks))
                .wirings(Collections.unmodifiableList(wirings))
                .compositionType(compositionType == null ? CompositionType.SEQUENTIAL : compositionType)
                .hierarchy(hierarchy)
                .source(source == null ? "" : source)
                .parameterSchema(Collections.unmodifiableList(parameterIrs))
                .build();
        log.info("系统 '{}' 编译完成: {} 个块, {} 条连线", name, blocks.size(), wirings.size());
        return system;
    }

    // ── 连线 ─────────────────────────────────────────────

    private static final class WiringCollector implements BlockVisitor<Void> {
        private final List<WiringIR> out;

        WiringCollector(List<WiringIR> out) {
            this.out = out;
        }

        @Override
        public Void visitAtomic(AtomicBlock block) {
            return null;
        }

        @Override
        public Void visitStack(StackComposition block) {
            block.getFirst().accept(this);
            block.getSecond().accept(this);
            if (block.hasExplicitWiring()) {
                for (Wiring w : block.getWiring()) {
                    out.add(toIr(w, false, false));
                }
            } else {
                autoWire(block.getFirst(), block.getSecond(), out);
            }
            return null;
        }

        @Override
        public Void visitParallel(ParallelComposition block) {
            block.getLeft().accept(this);
            block.getRight().accept(this);
            return null;
        }

        @Override
        public Void visitFeedback(FeedbackLoop block) {
            block.getInner().accept(this);
            for (Wiring w : block.getFeedbackWiring()) {
                out.add(toIr(w, true, false));
            }
            return null;
        }

        @Override
        public Void visitTemporal(TemporalLoop block) {
            block.getInner().accept(this);
            for (Wiring w : block.getTemporalWiring()) {
                out.add(toIr(w, false, true));
            }
            return null;
        }
    }

    /**
     * first.forwardOut 与 second.forwardIn 中每对 token 相交的端口生成一条协变连线，
     * 端点取拥有该端口的叶子，找不到时回退到 first 的最后一个叶子 / second 的第一个叶子。
     */
    private static void autoWire(Block first, Block second, List<WiringIR> out) {
        List<AtomicBlock> firstLeaves = first.flatten();
        List<AtomicBlock> secondLeaves = second.flatten();
        for (Port outPort : first.getInterface().getForwardOut()) {
            for (Port inPort : second.getInterface().getForwardIn()) {
                if (!Tokens.overlap(outPort.getTypeTokens(), inPort.getTypeTokens())) {
                    continue;
                }
                String source = findPortOwner(firstLeaves, outPort, leaf -> leaf.getInterface().getForwardOut());
                String target = findPortOwner(secondLeaves, inPort, leaf -> leaf.getInterface().getForwardIn());
                out.add(WiringIR.builder()
                        .source(source != null ? source : firstLeaves.get(firstLeaves.size() - 1).getName())
                        .target(target != null ? target : secondLeaves.get(0).getName())
                        .label(outPort.getName())
                        .direction(FlowDirection.COVARIANT)
                        .build());
            }
        }
    }

    private static String findPortOwner(List<AtomicBlock> leaves, Port port, Function<AtomicBlock, List<Port>> slot) {
        for (AtomicBlock leaf : leaves) {
            if (slot.apply(leaf).contains(port)) {
                return leaf.getName();
            }
        }
        return null;
    }

    private static WiringIR toIr(Wiring wiring, boolean feedback, boolean temporal) {
        return WiringIR.builder()
                .source(wiring.getSourceBlock())
                .target(wiring.getTargetBlock())
                .label(wiring.getSourcePort())
                .direction(wiring.getDirection())
                .feedback(feedback)
                .temporal(temporal)
                .build();
    }

    // ── 层级 ─────────────────────────────────────────────

    private static final class HierarchyCollector implements BlockVisitor<HierarchyNodeIR> {
        private final int[] counter;

        HierarchyCollector(int[] counter) {
            this.counter = counter;
        }

        @Override
        public HierarchyNodeIR visitAtomic(AtomicBlock block) {
            return HierarchyNodeIR.builder()
                    .id("leaf_" + sanitizeId(block.getName()))
                    .name(block.getName())
                    .blockName(block.getName())
                    .build();
        }

        @Override
        public HierarchyNodeIR visitStack(StackComposition block) {
            String id = nextGroupId();
            return group(id, block.getName(), CompositionType.SEQUENTIAL,
                    block.getFirst().accept(this), block.getSecond().accept(this));
        }

        @Override
        public HierarchyNodeIR visitParallel(ParallelComposition block) {
            String id = nextGroupId();
            return group(id, block.getName(), CompositionType.PARALLEL,
                    block.getLeft().accept(this), block.getRight().accept(this));
        }

        @Override
        public HierarchyNodeIR visitFeedback(FeedbackLoop block) {
            String id = nextGroupId();
            return group(id, block.getName(), CompositionType.FEEDBACK, block.getInner().accept(this));
        }

        @Override
        public HierarchyNodeIR visitTemporal(TemporalLoop block) {
            String id = nextGroupId();
            return group(id, block.getName(), CompositionType.TEMPORAL, block.getInner().accept(this))
                    .toBuilder()
                    .exitCondition(block.getExitCondition())
                    .build();
        }

        // 先分配 id 再递归子节点，保证父节点编号小于子节点
        private String nextGroupId() {
            counter[0]++;
            return "group_" + counter[0];
        }

        private static HierarchyNodeIR group(String id, String name, CompositionType type,
                                             HierarchyNodeIR... children) {
            return HierarchyNodeIR.builder()
                    .id(id)
                    .name(name)
                    .compositionType(type)
                    .children(Collections.unmodifiableList(Arrays.asList(children)))
                    .build();
        }
    }

    /**
     * 把嵌套的同类型顺序 / 并行二叉树折叠为 n 元分组。
     */
    static HierarchyNodeIR collapseChains(HierarchyNodeIR node) {
        List<HierarchyNodeIR> newChildren = new ArrayList<>();
        for (HierarchyNodeIR child : node.getChildren()) {
            newChildren.add(collapseChains(child));
        }
        CompositionType type = node.getCompositionType();
        if (type != CompositionType.SEQUENTIAL && type != CompositionType.PARALLEL) {
            return node.toBuilder().children(Collections.unmodifiableList(newChildren)).build();
        }
        List<HierarchyNodeIR> flattened = new ArrayList<>();
        for (HierarchyNodeIR child : newChildren) {
            if (child.getCompositionType() == type) {
                flattened.addAll(child.getChildren());
            } else {
                flattened.add(child);
            }
        }
        return node.toBuilder().children(Collections.unmodifiableList(flattened)).build();
    }

    static String sanitizeId(String name) {
        return NON_ID_CHARS.matcher(name).replaceAll("_");
    }
}
