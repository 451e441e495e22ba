package xyz.vvrf.gds.compiler;

import xyz.vvrf.gds.block.AtomicBlock;
import xyz.vvrf.gds.core.Port;
import xyz.vvrf.gds.ir.BlockIR;
import xyz.vvrf.gds.ir.Signature;

import java.util.ArrayList;
import java.util.List;

/**
 * 把单个原子块转换为 {@link BlockIR}。领域前端可以提供自己的实现。
 */
@FunctionalInterface
public interface BlockCompiler {

    /**
     * 默认实现：名称、角色种类与四元签名。标签不进入 IR。
     */
    BlockCompiler DEFAULT = block -> BlockIR.builder()
            .name(block.getName())
            .blockType(block.getKind().value())
            .signature(signatureOf(block))
            .build();

    BlockIR compile(AtomicBlock block);

    static Signature signatureOf(AtomicBlock block) {
        return Signature.of(
                join(block.getInterface().getForwardIn()),
                join(block.getInterface().getForwardOut()),
                join(block.getInterface().getBackwardIn()),
                join(block.getInterface().getBackwardOut()));
    }

    /**
     * 端口名以 {@code " + "} 拼接，无端口时为空串。
     */
    static String join(List<Port> ports) {
        List<String> names = new ArrayList<>(ports.size());
        for (Port p : ports) {
            names.add(p.getName());
        }
        return String.join(" + ", names);
    }
}
