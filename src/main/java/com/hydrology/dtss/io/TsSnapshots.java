package com.hydrology.dtss.io;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import com.hydrology.dtss.expr.TsVector;

/**
 * Persists expression vectors with the wire codec, independent of any
 * network connection.
 */
public final class TsSnapshots {
    private static final Logger log = LogManager.getLogger(TsSnapshots.class);

    private TsSnapshots() {
        // Utility class
    }

    public static void save(Path path, TsVector vector) throws IOException {
        byte[] data = TsCodec.encode(vector);
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null)
            Files.createDirectories(parent);
        Files.write(path, data);
        log.debug("Saved {} expressions ({} bytes) to {}", vector.size(), data.length, path);
    }

    public static TsVector load(Path path) throws IOException {
        return TsCodec.decode(Files.readAllBytes(path));
    }
}
