package com.anomaly.detection.engine;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInput;
import java.io.DataInputStream;
import java.io.DataOutput;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Shared plumbing for detectors: one coarse per-instance lock, the sensitivity
 * config, dimensionality enforcement, anomaly-transition notification and the
 * framing of persisted state.
 *
 * Every public operation of a subclass holds {@link #lock} for its full duration,
 * so calls on one instance are serialized. The lock is reentrant because some
 * mutations trigger others (auto-train, auto-recluster).
 */
public abstract class AbstractAnomalyDetector implements AnomalyDetector {

    protected final ReentrantLock lock = new ReentrantLock();

    private final String name;
    private DetectorConfig config;
    private AnomalyEventListener listener;
    private boolean lastAnomalyState;

    // 0 until fixed by configuration or by the first ingested vector
    protected int dimensions;

    protected AbstractAnomalyDetector(String name, DetectorConfig config, int dimensions) {
        if (dimensions < 0) {
            throw new IllegalArgumentException("dimensions must be >= 0, got " + dimensions);
        }
        this.name = name;
        this.config = config != null ? config : DetectorConfig.defaults();
        this.dimensions = dimensions;
    }

    /**
     * Tag written into the state header; a stream saved by another detector type is rejected on load.
     */
    protected abstract String stateTag();

    protected abstract void writeState(DataOutput out) throws IOException;

    protected abstract void readState(DataInput in) throws IOException;

    @Override
    public String getName() {
        return name;
    }

    @Override
    public void addValues(double[] values) {
        for (double value : values) {
            addValue(value);
        }
    }

    @Override
    public DetectorConfig getConfig() {
        lock.lock();
        try {
            return config;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void setConfig(DetectorConfig config) {
        lock.lock();
        try {
            this.config = config != null ? config : DetectorConfig.defaults();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void setAnomalyEventListener(AnomalyEventListener listener) {
        lock.lock();
        try {
            this.listener = listener;
        } finally {
            lock.unlock();
        }
    }

    public int getDimensions() {
        lock.lock();
        try {
            return dimensions;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Fix the dimensionality on first use, reject any other length afterwards.
     * Caller must hold the lock.
     */
    protected void enforceDimensions(double[] vector) {
        if (dimensions == 0) {
            if (vector.length == 0) {
                throw new DimensionMismatchException(1, 0);
            }
            dimensions = vector.length;
        } else if (vector.length != dimensions) {
            throw new DimensionMismatchException(dimensions, vector.length);
        }
    }

    /**
     * Fire ANOMALY_DETECTED on a normal-to-anomaly transition and NORMAL_RESUMED on the
     * reverse, then remember the new state. Caller must hold the lock.
     */
    protected void notifyTransition(DetectionResult result) {
        if (result.isAnomaly() && !lastAnomalyState) {
            fireEvent(AnomalyEventType.ANOMALY_DETECTED, result);
        } else if (!result.isAnomaly() && lastAnomalyState) {
            fireEvent(AnomalyEventType.NORMAL_RESUMED, result);
        }
        lastAnomalyState = result.isAnomaly();
    }

    private void fireEvent(AnomalyEventType type, DetectionResult result) {
        if (listener == null) {
            return;
        }
        String info = switch (type) {
            case ANOMALY_DETECTED -> "Anomaly detected: " + result.getDescription();
            case NORMAL_RESUMED -> "Normal state resumed";
        };
        listener.onAnomalyEvent(AnomalyEvent.builder()
                .eventType(type)
                .timestamp(Instant.now())
                .result(result)
                .detectorName(name)
                .additionalInfo(info)
                .build());
    }

    @Override
    public void saveState(OutputStream out) throws IOException {
        DataOutputStream data = new DataOutputStream(out);
        lock.lock();
        try {
            StateHeader.write(data, stateTag());
            data.writeDouble(config.getSigmaMultiplier());
            data.writeDouble(config.getMinStdDev());
            writeState(data);
        } finally {
            lock.unlock();
        }
        data.flush();
    }

    @Override
    public void loadState(InputStream in) throws IOException {
        DataInputStream data = new DataInputStream(in);
        lock.lock();
        try {
            StateHeader.read(data, stateTag());
            DetectorConfig savedConfig = DetectorConfig.builder()
                    .sigmaMultiplier(data.readDouble())
                    .minStdDev(data.readDouble())
                    .build();
            readState(data);
            config = savedConfig;
            lastAnomalyState = false;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void saveToFile(Path file) throws IOException {
        try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(file))) {
            saveState(out);
        }
    }

    @Override
    public void loadFromFile(Path file) throws IOException {
        try (InputStream in = new BufferedInputStream(Files.newInputStream(file))) {
            loadState(in);
        }
    }

    protected static void writeVector(DataOutput out, double[] vector) throws IOException {
        out.writeInt(vector.length);
        for (double v : vector) {
            out.writeDouble(v);
        }
    }

    protected static double[] readVector(DataInput in) throws IOException {
        int length = in.readInt();
        if (length < 0) {
            throw new AnomalyDetectionException("Corrupt state: negative vector length " + length);
        }
        double[] vector = new double[length];
        for (int i = 0; i < length; i++) {
            vector[i] = in.readDouble();
        }
        return vector;
    }
}
