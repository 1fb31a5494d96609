package com.hydrology.dtss.wire;

import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.EOFException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import com.hydrology.dtss.api.DecodeException;
import com.hydrology.dtss.api.ErrorKind;
import com.hydrology.dtss.io.BinaryReader;
import com.hydrology.dtss.io.BinaryWriter;
import com.hydrology.dtss.io.TsCodec;
import com.hydrology.dtss.time.TimeAxis;
import com.hydrology.dtss.time.UtcPeriod;

/**
 * Frames requests and responses on a byte stream.
 *
 * <pre>
 * request  := byte type, int length, payload
 *   EVALUATE    payload := period, vector
 *   PERCENTILES payload := period, axis, int count, int[count] percentiles, vector
 *   CLOSE       payload := (empty)
 * response := byte status, int length, payload
 *   OK          payload := vector
 *   ERROR       payload := byte kind, string message
 * </pre>
 *
 * Offsets in a {@link DecodeException} raised for a payload are relative to
 * the start of that payload.
 */
public final class MessageCodec {
    public static final int HEADER_BYTES = 5;

    private MessageCodec() {
        // Utility class
    }

    // ---------------------------------------------------------------- requests

    public static void writeRequest(DataOutputStream out, DtsRequest req) throws IOException {
        BinaryWriter w = new BinaryWriter();
        if (req.type() != MessageType.CLOSE) {
            w.writePeriod(req.period());
            if (req.type() == MessageType.PERCENTILES) {
                w.writeAxis(req.outputAxis()).writeInt(req.percentiles().size());
                for (int p : req.percentiles())
                    w.writeInt(p);
            }
            TsCodec.write(req.vector(), w);
        }
        writeFrame(out, req.type().code(), w.toByteArray());
    }

    /**
     * @return the next request, or null if the peer closed the stream cleanly
     *         between frames
     */
    public static DtsRequest readRequest(DataInputStream in, int maxMessageBytes) throws IOException {
        int type = in.read();
        if (type < 0)
            return null;
        MessageType mt = MessageType.fromCode(type);
        if (mt == null)
            throw new DecodeException("Unknown request type " + type, 0);
        BinaryReader r = new BinaryReader(readPayload(in, maxMessageBytes));
        if (mt == MessageType.CLOSE) {
            r.requireFullyConsumed();
            return DtsRequest.close();
        }
        UtcPeriod period = r.readPeriod();
        TimeAxis axis = null;
        List<Integer> percentiles = null;
        if (mt == MessageType.PERCENTILES) {
            axis = r.readAxis();
            int n = r.readCount(4);
            percentiles = new ArrayList<>(n);
            for (int i = 0; i < n; i++)
                percentiles.add(r.readInt());
        }
        var vector = TsCodec.read(r);
        r.requireFullyConsumed();
        return new DtsRequest(mt, period, vector, axis, percentiles);
    }

    // ---------------------------------------------------------------- responses

    public static void writeResponse(DataOutputStream out, DtsResponse resp) throws IOException {
        BinaryWriter w = new BinaryWriter();
        if (resp.isOk())
            TsCodec.write(resp.vector(), w);
        else
            w.writeByte(resp.errorKind().ordinal()).writeString(resp.message());
        writeFrame(out, resp.status().code(), w.toByteArray());
    }

    public static DtsResponse readResponse(DataInputStream in, int maxMessageBytes) throws IOException {
        int status = in.read();
        if (status < 0)
            throw new EOFException("Connection closed by server");
        ResponseStatus rs = ResponseStatus.fromCode(status);
        if (rs == null)
            throw new DecodeException("Unknown response status " + status, 0);
        BinaryReader r = new BinaryReader(readPayload(in, maxMessageBytes));
        DtsResponse resp;
        if (rs == ResponseStatus.OK) {
            resp = DtsResponse.ok(TsCodec.read(r));
        } else {
            ErrorKind kind = ErrorKind.fromOrdinal(r.readByte() & 0xFF);
            resp = DtsResponse.error(kind, r.readString());
        }
        r.requireFullyConsumed();
        return resp;
    }

    // ---------------------------------------------------------------- framing

    private static void writeFrame(DataOutputStream out, byte code, byte[] payload) throws IOException {
        out.writeByte(code);
        out.writeInt(payload.length);
        out.write(payload);
        out.flush();
    }

    private static byte[] readPayload(DataInputStream in, int maxMessageBytes) throws IOException {
        int length = in.readInt();
        if (length < 0 || length > maxMessageBytes)
            throw new DecodeException("Frame length " + length + " outside [0, " + maxMessageBytes + "]", 1);
        byte[] payload = new byte[length];
        in.readFully(payload);
        return payload;
    }
}
