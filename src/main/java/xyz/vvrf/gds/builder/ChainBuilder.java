package xyz.vvrf.gds.builder;

import lombok.extern.slf4j.Slf4j;
import xyz.vvrf.gds.block.Block;
import xyz.vvrf.gds.block.Wiring;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * 组合树的链式构建器。
 * 以一个起始 Block 开始，逐步追加顺序、并行、反馈与时间循环组合，
 * 每一步都立即构造组合块，因此组合校验在调用处就会失败。
 *
 * <pre>{@code
 * Block root = ChainBuilder.start(sensor)
 *         .then(controller)
 *         .then(plant)
 *         .loop(Collections.singletonList(Wiring.of("Plant", "State", "Sensor", "State")), "converged")
 *         .build();
 * }</pre>
 *
 * @author ruifeng.wen
 */
@Slf4j
public class ChainBuilder {

    private Block current;

    private ChainBuilder(Block start) {
        this.current = Objects.requireNonNull(start, "起始 Block 不能为空");
    }

    public static ChainBuilder start(Block start) {
        return new ChainBuilder(start);
    }

    /**
     * 把多个 Block 依次顺序组合：{@code b0 >> b1 >> ... >> bn}。
     */
    public static Block stack(Block... blocks) {
        return fold(true, blocks);
    }

    /**
     * 把多个 Block 并行组合：{@code b0 | b1 | ... | bn}。
     */
    public static Block parallel(Block... blocks) {
        return fold(false, blocks);
    }

    private static Block fold(boolean sequential, Block... blocks) {
        if (blocks == null || blocks.length == 0) {
            throw new IllegalArgumentException("at least one block is required");
        }
        ChainBuilder chain = start(blocks[0]);
        for (Block next : Arrays.asList(blocks).subList(1, blocks.length)) {
            if (sequential) {
                chain.then(next);
            } else {
                chain.parallel(next);
            }
        }
        return chain.build();
    }

    public ChainBuilder then(Block next) {
        current = current.then(Objects.requireNonNull(next, "后继 Block 不能为空"));
        log.debug("链式组合: {}", current.getName());
        return this;
    }

    public ChainBuilder then(Block next, List<Wiring> wiring) {
        current = current.then(Objects.requireNonNull(next, "后继 Block 不能为空"), wiring);
        log.debug("链式组合 (显式连线 {} 条): {}", wiring.size(), current.getName());
        return this;
    }

    public ChainBuilder parallel(Block other) {
        current = current.parallel(Objects.requireNonNull(other, "并行 Block 不能为空"));
        log.debug("并行组合: {}", current.getName());
        return this;
    }

    public ChainBuilder feedback(List<Wiring> wiring) {
        current = current.feedback(wiring);
        log.debug("反馈包装: {}", current.getName());
        return this;
    }

    public ChainBuilder loop(List<Wiring> wiring, String exitCondition) {
        current = current.loop(wiring, exitCondition);
        log.debug("时间循环包装: {}", current.getName());
        return this;
    }

    public Block build() {
        return current;
    }
}
