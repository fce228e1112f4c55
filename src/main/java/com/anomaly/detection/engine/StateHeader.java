package com.anomaly.detection.engine;

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;

/**
 * Header that opens every persisted engine stream: magic, type tag, format version.
 */
final class StateHeader {

    private static final int MAGIC = 0x41444554; // "ADET"
    private static final int VERSION = 1;

    private StateHeader() {}

    static void write(DataOutput out, String tag) throws IOException {
        out.writeInt(MAGIC);
        out.writeUTF(tag);
        out.writeInt(VERSION);
    }

    /**
     * @throws AnomalyDetectionException if the stream was written for another type or format version
     */
    static void read(DataInput in, String expectedTag) throws IOException {
        int magic = in.readInt();
        String tag = in.readUTF();
        int version = in.readInt();
        if (magic != MAGIC || !expectedTag.equals(tag)) {
            throw new AnomalyDetectionException(
                    String.format("Stream does not hold %s state (found tag '%s')", expectedTag, tag));
        }
        if (version != VERSION) {
            throw new AnomalyDetectionException("Unsupported state version " + version);
        }
    }
}
