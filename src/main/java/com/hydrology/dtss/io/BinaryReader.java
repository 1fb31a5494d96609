package com.hydrology.dtss.io;

import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

import com.hydrology.dtss.api.DecodeException;
import com.hydrology.dtss.time.PointInterpretation;
import com.hydrology.dtss.time.PointSeries;
import com.hydrology.dtss.time.TimeAxis;
import com.hydrology.dtss.time.UtcPeriod;

/**
 * Big-endian reader over a byte array. Every failure is reported as a
 * {@link DecodeException} carrying the offset where reading went wrong.
 */
public final class BinaryReader {
    private final ByteBuffer buf;

    public BinaryReader(byte[] data) {
        this.buf = ByteBuffer.wrap(data);
    }

    public int offset() {
        return buf.position();
    }

    public int remaining() {
        return buf.remaining();
    }

    public DecodeException error(String message) {
        return new DecodeException(message, buf.position());
    }

    public byte readByte() {
        try {
            return buf.get();
        } catch (BufferUnderflowException e) {
            throw underflow(1);
        }
    }

    public boolean readBoolean() {
        byte b = readByte();
        if (b != 0 && b != 1)
            throw new DecodeException("Invalid boolean " + b, buf.position() - 1);
        return b == 1;
    }

    public short readShort() {
        try {
            return buf.getShort();
        } catch (BufferUnderflowException e) {
            throw underflow(2);
        }
    }

    public int readInt() {
        try {
            return buf.getInt();
        } catch (BufferUnderflowException e) {
            throw underflow(4);
        }
    }

    public long readLong() {
        try {
            return buf.getLong();
        } catch (BufferUnderflowException e) {
            throw underflow(8);
        }
    }

    public double readDouble() {
        try {
            return buf.getDouble();
        } catch (BufferUnderflowException e) {
            throw underflow(8);
        }
    }

    /** Reads a count and checks that at least {@code count * elementSize} bytes follow. */
    public int readCount(int elementSize) {
        int at = buf.position();
        int n = readInt();
        if (n < 0 || (long) n * elementSize > buf.remaining())
            throw new DecodeException("Invalid element count " + n, at);
        return n;
    }

    public byte[] readBytes(int n) {
        if (n < 0 || n > buf.remaining())
            throw underflow(n);
        byte[] b = new byte[n];
        buf.get(b);
        return b;
    }

    public String readString() {
        int n = readCount(1);
        return new String(readBytes(n), StandardCharsets.UTF_8);
    }

    public double[] readDoubles() {
        int n = readCount(8);
        double[] v = new double[n];
        for (int i = 0; i < n; i++)
            v[i] = buf.getDouble();
        return v;
    }

    public UtcPeriod readPeriod() {
        int at = buf.position();
        long start = readLong();
        long end = readLong();
        try {
            return new UtcPeriod(start, end);
        } catch (IllegalArgumentException e) {
            throw new DecodeException(e.getMessage(), at, e);
        }
    }

    public TimeAxis readAxis() {
        int at = buf.position();
        long start = readLong();
        long delta = readLong();
        int n = readInt();
        try {
            return new TimeAxis(start, delta, n);
        } catch (IllegalArgumentException e) {
            throw new DecodeException(e.getMessage(), at, e);
        }
    }

    public PointSeries readSeries() {
        TimeAxis axis = readAxis();
        int at = buf.position();
        PointInterpretation fx;
        try {
            fx = PointInterpretation.fromOrdinal(readByte());
        } catch (IllegalArgumentException e) {
            throw new DecodeException(e.getMessage(), at, e);
        }
        if ((long) axis.size() * 8 > buf.remaining())
            throw new DecodeException("Series of " + axis.size() + " values exceeds remaining data", at);
        double[] v = new double[axis.size()];
        for (int i = 0; i < v.length; i++)
            v[i] = buf.getDouble();
        return new PointSeries(axis, v, fx);
    }

    public void requireFullyConsumed() {
        if (buf.hasRemaining())
            throw error(buf.remaining() + " trailing bytes");
    }

    private DecodeException underflow(int wanted) {
        return new DecodeException("Unexpected end of data, wanted " + wanted + " more bytes", buf.position());
    }
}
