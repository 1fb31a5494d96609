package com.hydrology.dtss.io;

import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;

import com.hydrology.dtss.time.PointSeries;
import com.hydrology.dtss.time.TimeAxis;
import com.hydrology.dtss.time.UtcPeriod;

/**
 * Big-endian writer into a growable in-memory buffer. Counterpart of
 * {@link BinaryReader}.
 */
public final class BinaryWriter {
    private final ByteArrayOutputStream bytes;
    private final DataOutputStream out;

    public BinaryWriter() {
        this(256);
    }

    public BinaryWriter(int initialCapacity) {
        this.bytes = new ByteArrayOutputStream(initialCapacity);
        this.out = new DataOutputStream(bytes);
    }

    public BinaryWriter writeByte(int v) {
        try {
            out.writeByte(v);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return this;
    }

    public BinaryWriter writeBoolean(boolean v) {
        return writeByte(v ? 1 : 0);
    }

    public BinaryWriter writeShort(int v) {
        try {
            out.writeShort(v);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return this;
    }

    public BinaryWriter writeInt(int v) {
        try {
            out.writeInt(v);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return this;
    }

    public BinaryWriter writeLong(long v) {
        try {
            out.writeLong(v);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return this;
    }

    public BinaryWriter writeDouble(double v) {
        try {
            out.writeDouble(v);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return this;
    }

    public BinaryWriter writeBytes(byte[] b) {
        try {
            out.write(b);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return this;
    }

    /** Length-prefixed UTF-8. */
    public BinaryWriter writeString(String s) {
        byte[] b = s.getBytes(StandardCharsets.UTF_8);
        writeInt(b.length);
        return writeBytes(b);
    }

    /** Length-prefixed doubles. */
    public BinaryWriter writeDoubles(double[] values) {
        writeInt(values.length);
        for (double v : values)
            writeDouble(v);
        return this;
    }

    public BinaryWriter writePeriod(UtcPeriod p) {
        return writeLong(p.start()).writeLong(p.end());
    }

    public BinaryWriter writeAxis(TimeAxis axis) {
        return writeLong(axis.start()).writeLong(axis.delta()).writeInt(axis.size());
    }

    public BinaryWriter writeSeries(PointSeries s) {
        writeAxis(s.timeAxis());
        writeByte(s.interpretation().ordinal());
        for (int i = 0; i < s.size(); i++)
            writeDouble(s.value(i));
        return this;
    }

    public int size() {
        return bytes.size();
    }

    public byte[] toByteArray() {
        return bytes.toByteArray();
    }
}
