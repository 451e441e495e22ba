package xyz.vvrf.gds.block;

import xyz.vvrf.gds.core.Interface;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * 不可再分的叶子块。
 * <p>
 * 直接实例化时是不带角色的普通块；四种角色 ({@link BoundaryAction}、{@link Policy}、
 * {@link ControlAction}、{@link Mechanism}) 是它的受约束细化，
 * 各自在构造时执行一个结构校验。
 * </p>
 *
 * @author ruifeng.wen
 */
public class AtomicBlock extends Block {

    private final Interface iface;

    public AtomicBlock(String name, Interface iface, Map<String, String> tags) {
        super(name, tags);
        this.iface = iface == null ? Interface.EMPTY : iface;
    }

    public AtomicBlock(String name, Interface iface) {
        this(name, iface, null);
    }

    @Override
    public Interface getInterface() {
        return iface;
    }

    @Override
    public List<AtomicBlock> flatten() {
        return Collections.singletonList(this);
    }

    @Override
    public <R> R accept(BlockVisitor<R> visitor) {
        return visitor.visitAtomic(this);
    }

    /**
     * 按角色分派。普通原子块走 {@link RoleVisitor#visitGeneric}。
     */
    public <R> R acceptRole(RoleVisitor<R> visitor) {
        return visitor.visitGeneric(this);
    }

    public BlockKind getKind() {
        return BlockKind.of(this);
    }

    @Override
    public AtomicBlock withTags(Map<String, String> extra) {
        return new AtomicBlock(getName(), iface, mergeTags(extra));
    }
}
