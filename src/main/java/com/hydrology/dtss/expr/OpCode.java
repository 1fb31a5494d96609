package com.hydrology.dtss.expr;

/**
 * Element-wise arithmetic operators.
 *
 * <p>
 * Total over doubles: numeric domain problems produce NaN, never an
 * exception.
 */
public enum OpCode {
    ADD {
        @Override
        public double apply(double a, double b) {
            return a + b;
        }
    },
    SUB {
        @Override
        public double apply(double a, double b) {
            return a - b;
        }
    },
    MUL {
        @Override
        public double apply(double a, double b) {
            return a * b;
        }
    },
    DIV {
        @Override
        public double apply(double a, double b) {
            return b == 0.0 ? Double.NaN : a / b;
        }
    },
    MIN {
        @Override
        public double apply(double a, double b) {
            return Math.min(a, b);
        }
    },
    MAX {
        @Override
        public double apply(double a, double b) {
            return Math.max(a, b);
        }
    };

    public abstract double apply(double a, double b);

    public static OpCode fromOrdinal(int ordinal) {
        OpCode[] all = values();
        if (ordinal < 0 || ordinal >= all.length)
            throw new IllegalArgumentException("Unknown operator: " + ordinal);
        return all[ordinal];
    }

    public static OpCode fromString(String text) {
        for (OpCode op : values()) {
            if (op.name().equalsIgnoreCase(text))
                return op;
        }
        throw new IllegalArgumentException("Unknown operator: " + text);
    }
}
