package xyz.vvrf.gds.core;

/**
 * 内置的常用类型定义。
 */
public final class TypeDefs {

    private TypeDefs() {}

    public static final TypeDef PROBABILITY = new TypeDef("Probability", PrimitiveKind.FLOAT,
            v -> {
                double d = ((Number) v).doubleValue();
                return d >= 0.0 && d <= 1.0;
            },
            "A value in [0, 1]", null);

    public static final TypeDef NON_NEGATIVE_FLOAT = TypeDef.of("NonNegativeFloat", PrimitiveKind.FLOAT,
            v -> ((Number) v).doubleValue() >= 0);

    public static final TypeDef POSITIVE_INT = TypeDef.of("PositiveInt", PrimitiveKind.INTEGER,
            v -> ((Number) v).longValue() > 0);

    public static final TypeDef TOKEN_AMOUNT = new TypeDef("TokenAmount", PrimitiveKind.FLOAT,
            v -> ((Number) v).doubleValue() >= 0, "", "tokens");

    public static final TypeDef AGENT_ID = TypeDef.of("AgentID", PrimitiveKind.STRING);

    public static final TypeDef TIMESTAMP = new TypeDef("Timestamp", PrimitiveKind.FLOAT,
            v -> ((Number) v).doubleValue() >= 0, "", "seconds");
}
