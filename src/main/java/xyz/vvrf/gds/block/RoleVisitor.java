package xyz.vvrf.gds.block;

/**
 * 原子块角色的封闭分派。
 * <p>
 * 每个分支点 (投影、查询、校验、序列化) 都通过实现此接口做穷尽匹配；
 * 新增角色时所有实现都会在编译期报错，而不是在运行时漏判。
 * </p>
 *
 * @param <R> 访问结果类型
 */
public interface RoleVisitor<R> {

    R visitBoundary(BoundaryAction block);

    R visitPolicy(Policy block);

    R visitControl(ControlAction block);

    R visitMechanism(Mechanism block);

    /**
     * 不属于四种角色的普通原子块。
     */
    R visitGeneric(AtomicBlock block);
}
