package xyz.vvrf.gds.core;

import java.util.Locale;

/**
 * TypeDef 包装的原始值种类。
 */
public enum PrimitiveKind {
    STRING {
        @Override
        public boolean accepts(Object value) {
            return value instanceof CharSequence;
        }
    },
    INTEGER {
        @Override
        public boolean accepts(Object value) {
            return value instanceof Integer || value instanceof Long
                    || value instanceof Short || value instanceof Byte;
        }
    },
    FLOAT {
        @Override
        public boolean accepts(Object value) {
            return value instanceof Double || value instanceof Float;
        }
    },
    BOOLEAN {
        @Override
        public boolean accepts(Object value) {
            return value instanceof Boolean;
        }
    },
    ANY {
        @Override
        public boolean accepts(Object value) {
            return value != null;
        }
    };

    /**
     * 值是否属于此种类 (null 永远不属于任何种类)。
     */
    public abstract boolean accepts(Object value);

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
