package xyz.vvrf.gds.block;

/**
 * 组合树的访问者，覆盖全部 Block 形态。
 *
 * @param <R> 访问结果类型
 */
public interface BlockVisitor<R> {

    R visitAtomic(AtomicBlock block);

    R visitStack(StackComposition block);

    R visitParallel(ParallelComposition block);

    R visitFeedback(FeedbackLoop block);

    R visitTemporal(TemporalLoop block);
}
