package xyz.vvrf.gds.block;

/**
 * 原子块的角色种类。
 */
public enum BlockKind {
    BOUNDARY("boundary"),
    POLICY("policy"),
    CONTROL("control"),
    MECHANISM("mechanism"),
    GENERIC("generic");

    private static final RoleVisitor<BlockKind> RESOLVER = new RoleVisitor<BlockKind>() {
        @Override
        public BlockKind visitBoundary(BoundaryAction block) {
            return BOUNDARY;
        }

        @Override
        public BlockKind visitPolicy(Policy block) {
            return POLICY;
        }

        @Override
        public BlockKind visitControl(ControlAction block) {
            return CONTROL;
        }

        @Override
        public BlockKind visitMechanism(Mechanism block) {
            return MECHANISM;
        }

        @Override
        public BlockKind visitGeneric(AtomicBlock block) {
            return GENERIC;
        }
    };

    private final String value;

    BlockKind(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static BlockKind of(AtomicBlock block) {
        return block.acceptRole(RESOLVER);
    }
}
