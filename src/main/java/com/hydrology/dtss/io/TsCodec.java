package com.hydrology.dtss.io;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import com.hydrology.dtss.api.CycleException;
import com.hydrology.dtss.api.DecodeException;
import com.hydrology.dtss.expr.AccumulateNode;
import com.hydrology.dtss.expr.AverageNode;
import com.hydrology.dtss.expr.BinaryOpNode;
import com.hydrology.dtss.expr.BinaryOpScalarNode;
import com.hydrology.dtss.expr.ConvolveNode;
import com.hydrology.dtss.expr.ConvolvePolicy;
import com.hydrology.dtss.expr.IntegralNode;
import com.hydrology.dtss.expr.NodeKind;
import com.hydrology.dtss.expr.OpCode;
import com.hydrology.dtss.expr.PeriodicNode;
import com.hydrology.dtss.expr.PointNode;
import com.hydrology.dtss.expr.ReferenceNode;
import com.hydrology.dtss.expr.ScalarOpSeriesNode;
import com.hydrology.dtss.expr.TimeShiftNode;
import com.hydrology.dtss.expr.TsExpression;
import com.hydrology.dtss.expr.TsVector;
import com.hydrology.dtss.time.TimeAxis;

/**
 * Versioned, self-describing binary encoding of expression vectors.
 *
 * <h3>Layout</h3>
 *
 * <pre>
 * int    magic "DTSX"
 * short  format version
 * int    node count N
 * N x    node: byte tag, byte node version, fields..., child references
 * byte   VECTOR tag, byte version, int root count, int root index...
 * </pre>
 *
 * Child references and roots are indices into the node table. The encoder
 * writes every node instance once, children before parents, so shared
 * sub-expressions stay shared after decoding. All numbers are big-endian.
 *
 * <h3>Decoding</h3>
 * The whole table is read first and then materialised depth first from the
 * roots, using a work stack rather than recursion so deep chains decode on
 * any thread. A node reached again while it is still being materialised closes a
 * cycle and fails with {@link CycleException}; nothing is returned in that
 * case. Every other inconsistency is a {@link DecodeException} with the
 * offending byte offset.
 */
public final class TsCodec {
    public static final int MAGIC = 0x44545358;
    public static final short FORMAT_VERSION = 1;
    static final byte NODE_VERSION = 1;

    private TsCodec() {
        // Utility class
    }

    public static byte[] encode(TsVector vector) {
        BinaryWriter w = new BinaryWriter();
        write(vector, w);
        return w.toByteArray();
    }

    public static byte[] encode(TsExpression expression) {
        return encode(TsVector.of(expression));
    }

    public static TsVector decode(byte[] data) {
        BinaryReader r = new BinaryReader(data);
        TsVector v = read(r);
        r.requireFullyConsumed();
        return v;
    }

    /** Decodes data written by {@link #encode(TsExpression)}. */
    public static TsExpression decodeExpression(byte[] data) {
        TsVector v = decode(data);
        if (v.size() != 1)
            throw new DecodeException("Expected a single expression, found " + v.size(), 0);
        return v.get(0);
    }

    // ---------------------------------------------------------------- encode

    public static void write(TsVector vector, BinaryWriter w) {
        Map<TsExpression, Integer> index = new IdentityHashMap<>();
        List<TsExpression> table = new ArrayList<>();
        for (TsExpression e : vector)
            number(e, index, table);

        w.writeInt(MAGIC).writeShort(FORMAT_VERSION).writeInt(table.size());
        for (TsExpression node : table)
            writeNode(node, index, w);
        w.writeByte(NodeKind.VECTOR.tag()).writeByte(NODE_VERSION).writeInt(vector.size());
        for (TsExpression e : vector)
            w.writeInt(index.get(e));
    }

    /** Appends {@code root} and its unnumbered descendants to the table, children first. */
    private static void number(TsExpression root, Map<TsExpression, Integer> index, List<TsExpression> table) {
        Deque<TsExpression> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            TsExpression node = pending.peek();
            if (index.containsKey(node)) {
                pending.pop();
                continue;
            }
            boolean ready = true;
            List<TsExpression> children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                TsExpression c = children.get(i);
                if (!index.containsKey(c)) {
                    pending.push(c);
                    ready = false;
                }
            }
            if (ready) {
                pending.pop();
                index.put(node, table.size());
                table.add(node);
            }
        }
    }

    private static void writeNode(TsExpression node, Map<TsExpression, Integer> index, BinaryWriter w) {
        w.writeByte(node.kind().tag()).writeByte(NODE_VERSION);
        switch (node.kind()) {
            case POINT -> w.writeSeries(((PointNode) node).series());
            case REFERENCE -> w.writeString(((ReferenceNode) node).id());
            case AVERAGE, INTEGRAL, ACCUMULATE -> {
                w.writeAxis(node.timeAxis());
                w.writeInt(index.get(node.children().get(0)));
            }
            case TIME_SHIFT -> {
                TimeShiftNode n = (TimeShiftNode) node;
                w.writeLong(n.dt()).writeInt(index.get(n.source()));
            }
            case PERIODIC -> {
                PeriodicNode n = (PeriodicNode) node;
                w.writeLong(n.dt()).writeLong(n.t0()).writeAxis(n.timeAxis()).writeDoubles(n.profile());
            }
            case CONVOLVE -> {
                ConvolveNode n = (ConvolveNode) node;
                w.writeByte(n.policy().ordinal()).writeDoubles(n.weights()).writeInt(index.get(n.source()));
            }
            case BINARY_OP -> {
                BinaryOpNode n = (BinaryOpNode) node;
                w.writeByte(n.op().ordinal()).writeInt(index.get(n.lhs())).writeInt(index.get(n.rhs()));
                w.writeBoolean(n.timeAxis() != null);
                if (n.timeAxis() != null)
                    w.writeAxis(n.timeAxis());
                w.writeBoolean(n.isBound());
            }
            case BINARY_OP_SCALAR -> {
                BinaryOpScalarNode n = (BinaryOpScalarNode) node;
                w.writeByte(n.op().ordinal()).writeInt(index.get(n.lhs())).writeDouble(n.rhs());
                w.writeBoolean(n.isBound());
            }
            case SCALAR_OP_SERIES -> {
                ScalarOpSeriesNode n = (ScalarOpSeriesNode) node;
                w.writeByte(n.op().ordinal()).writeDouble(n.lhs()).writeInt(index.get(n.rhs()));
                w.writeBoolean(n.isBound());
            }
            case VECTOR -> throw new IllegalStateException("Vector tag on an expression node");
        }
    }

    // ---------------------------------------------------------------- decode

    /** A node as read from the table, before its children exist. */
    private record RawNode(NodeKind kind, int offset, int[] children, Boolean bound,
            Function<List<TsExpression>, TsExpression> factory) {
    }

    public static TsVector read(BinaryReader r) {
        int at = r.offset();
        int magic = r.readInt();
        if (magic != MAGIC)
            throw new DecodeException("Bad magic 0x" + Integer.toHexString(magic), at);
        at = r.offset();
        short version = r.readShort();
        if (version < 1 || version > FORMAT_VERSION)
            throw new DecodeException("Unsupported format version " + version, at);

        int count = r.readCount(2);
        RawNode[] table = new RawNode[count];
        for (int i = 0; i < count; i++)
            table[i] = readNode(r, count);

        at = r.offset();
        byte tag = r.readByte();
        if (tag != NodeKind.VECTOR.tag())
            throw new DecodeException("Expected VECTOR record, found tag " + tag, at);
        readVersion(r, NodeKind.VECTOR);
        int roots = r.readCount(4);
        int[] rootIndex = new int[roots];
        for (int i = 0; i < roots; i++)
            rootIndex[i] = readIndex(r, count);

        TsExpression[] built = new TsExpression[count];
        byte[] state = new byte[count];
        List<TsExpression> result = new ArrayList<>(roots);
        for (int idx : rootIndex)
            result.add(materialize(idx, table, built, state));
        return TsVector.of(result);
    }

    private static final byte VISITING = 1;
    private static final byte DONE = 2;

    /**
     * Builds node {@code root} and everything below it. A node is expanded
     * (VISITING) when first on top of the work stack and built (DONE) when it
     * comes back to the top with all children built. The VISITING nodes are
     * always the path from the root to the top of the stack, so reaching one
     * again closes a cycle.
     */
    private static TsExpression materialize(int root, RawNode[] table, TsExpression[] built, byte[] state) {
        Deque<Integer> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            int i = pending.peek();
            if (state[i] == DONE) {
                pending.pop();
                continue;
            }
            RawNode raw = table[i];
            if (state[i] == VISITING) {
                pending.pop();
                built[i] = build(raw, built);
                state[i] = DONE;
                continue;
            }
            state[i] = VISITING;
            int[] children = raw.children();
            for (int k = children.length - 1; k >= 0; k--) {
                int c = children[k];
                if (state[c] == VISITING)
                    throw new CycleException("Node " + c + " (" + table[c].kind() + " at byte "
                            + table[c].offset() + ") is part of a reference cycle");
                if (state[c] != DONE)
                    pending.push(c);
            }
        }
        return built[root];
    }

    private static TsExpression build(RawNode raw, TsExpression[] built) {
        List<TsExpression> children = new ArrayList<>(raw.children().length);
        for (int c : raw.children())
            children.add(built[c]);
        TsExpression node;
        try {
            node = raw.factory().apply(children);
        } catch (IllegalArgumentException e) {
            throw new DecodeException("Invalid " + raw.kind() + ": " + e.getMessage(), raw.offset(), e);
        }
        if (raw.bound() != null && raw.bound() != node.isBound())
            throw new DecodeException(raw.kind() + " bound flag " + raw.bound()
                    + " contradicts its operands", raw.offset());
        return node;
    }

    private static RawNode readNode(BinaryReader r, int count) {
        int at = r.offset();
        byte tag = r.readByte();
        NodeKind kind = NodeKind.fromTag(tag);
        if (kind == null || kind == NodeKind.VECTOR)
            throw new DecodeException("Unknown node tag " + tag, at);
        readVersion(r, kind);
        switch (kind) {
            case POINT -> {
                PointNode n = new PointNode(r.readSeries());
                return new RawNode(kind, at, new int[0], null, c -> n);
            }
            case REFERENCE -> {
                ReferenceNode n = new ReferenceNode(r.readString());
                return new RawNode(kind, at, new int[0], null, c -> n);
            }
            case AVERAGE, INTEGRAL, ACCUMULATE -> {
                TimeAxis axis = r.readAxis();
                int[] ch = { readIndex(r, count) };
                Function<List<TsExpression>, TsExpression> f = switch (kind) {
                    case AVERAGE -> c -> new AverageNode(c.get(0), axis);
                    case INTEGRAL -> c -> new IntegralNode(c.get(0), axis);
                    default -> c -> new AccumulateNode(c.get(0), axis);
                };
                return new RawNode(kind, at, ch, null, f);
            }
            case TIME_SHIFT -> {
                long dt = r.readLong();
                int[] ch = { readIndex(r, count) };
                return new RawNode(kind, at, ch, null, c -> new TimeShiftNode(c.get(0), dt));
            }
            case PERIODIC -> {
                long dt = r.readLong();
                long t0 = r.readLong();
                TimeAxis axis = r.readAxis();
                double[] profile = r.readDoubles();
                return new RawNode(kind, at, new int[0], null, c -> new PeriodicNode(profile, dt, t0, axis));
            }
            case CONVOLVE -> {
                ConvolvePolicy policy = readEnum(r, ConvolvePolicy::fromOrdinal);
                double[] weights = r.readDoubles();
                int[] ch = { readIndex(r, count) };
                return new RawNode(kind, at, ch, null, c -> new ConvolveNode(c.get(0), weights, policy));
            }
            case BINARY_OP -> {
                OpCode op = readEnum(r, OpCode::fromOrdinal);
                int[] ch = { readIndex(r, count), readIndex(r, count) };
                TimeAxis axis = r.readBoolean() ? r.readAxis() : null;
                boolean bound = r.readBoolean();
                return new RawNode(kind, at, ch, bound, c -> new BinaryOpNode(c.get(0), op, c.get(1), axis));
            }
            case BINARY_OP_SCALAR -> {
                OpCode op = readEnum(r, OpCode::fromOrdinal);
                int[] ch = { readIndex(r, count) };
                double rhs = r.readDouble();
                boolean bound = r.readBoolean();
                return new RawNode(kind, at, ch, bound, c -> new BinaryOpScalarNode(c.get(0), op, rhs));
            }
            case SCALAR_OP_SERIES -> {
                OpCode op = readEnum(r, OpCode::fromOrdinal);
                double lhs = r.readDouble();
                int[] ch = { readIndex(r, count) };
                boolean bound = r.readBoolean();
                return new RawNode(kind, at, ch, bound, c -> new ScalarOpSeriesNode(lhs, op, c.get(0)));
            }
            default -> throw new DecodeException("Unknown node tag " + tag, at);
        }
    }

    private static void readVersion(BinaryReader r, NodeKind kind) {
        int at = r.offset();
        byte v = r.readByte();
        if (v < 1 || v > NODE_VERSION)
            throw new DecodeException("Unsupported " + kind + " version " + v, at);
    }

    private static int readIndex(BinaryReader r, int count) {
        int at = r.offset();
        int idx = r.readInt();
        if (idx < 0 || idx >= count)
            throw new DecodeException("Node index " + idx + " outside table of " + count, at);
        return idx;
    }

    private static <E extends Enum<E>> E readEnum(BinaryReader r, Function<Integer, E> lookup) {
        int at = r.offset();
        byte b = r.readByte();
        try {
            return lookup.apply((int) b);
        } catch (IllegalArgumentException e) {
            throw new DecodeException(e.getMessage(), at, e);
        }
    }
}
