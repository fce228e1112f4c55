package com.anomaly.detection.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Holds back an anomaly until enough similar values were flagged recently.
 *
 * <p>Callers feed every potential anomaly into a sliding window and ask whether a value
 * is confirmed. A value is confirmed once at least {@code confirmationThreshold}
 * windowed values lie strictly within {@code max(|v|, 1) * tolerance} of it, so a
 * single spike never raises an alert on its own.</p>
 */
public class AnomalyConfirmationSystem {

    private static final Logger log = LoggerFactory.getLogger(AnomalyConfirmationSystem.class);

    private static final String STATE_TAG = "confirmation";

    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<Double> window = new ArrayDeque<>();

    private int windowSize;
    private int confirmationThreshold;
    private double tolerance;

    public AnomalyConfirmationSystem() {
        this(10, 3);
    }

    public AnomalyConfirmationSystem(int windowSize, int confirmationThreshold) {
        this(windowSize, confirmationThreshold, 0.1);
    }

    public AnomalyConfirmationSystem(int windowSize, int confirmationThreshold, double tolerance) {
        validate(windowSize, confirmationThreshold, tolerance);
        this.windowSize = windowSize;
        this.confirmationThreshold = confirmationThreshold;
        this.tolerance = tolerance;
    }

    public void addPotentialAnomaly(double value) {
        lock.lock();
        try {
            window.addLast(value);
            trim();
        } finally {
            lock.unlock();
        }
    }

    public boolean isConfirmedAnomaly(double value) {
        lock.lock();
        try {
            double band = Math.max(Math.abs(value), 1.0) * tolerance;
            int similar = 0;
            for (double recent : window) {
                if (Math.abs(recent - value) < band) {
                    similar++;
                }
            }
            return similar >= confirmationThreshold;
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            window.clear();
        } finally {
            lock.unlock();
        }
    }

    public int getRecentCount() {
        lock.lock();
        try {
            return window.size();
        } finally {
            lock.unlock();
        }
    }

    public int getWindowSize() {
        return windowSize;
    }

    public int getConfirmationThreshold() {
        return confirmationThreshold;
    }

    public double getTolerance() {
        lock.lock();
        try {
            return tolerance;
        } finally {
            lock.unlock();
        }
    }

    public void setTolerance(double tolerance) {
        validate(windowSize, confirmationThreshold, tolerance);
        lock.lock();
        try {
            this.tolerance = tolerance;
        } finally {
            lock.unlock();
        }
    }

    public void saveState(OutputStream out) throws IOException {
        DataOutputStream data = new DataOutputStream(out);
        lock.lock();
        try {
            StateHeader.write(data, STATE_TAG);
            data.writeInt(windowSize);
            data.writeInt(confirmationThreshold);
            data.writeDouble(tolerance);
            data.writeInt(window.size());
            for (double value : window) {
                data.writeDouble(value);
            }
        } finally {
            lock.unlock();
        }
        data.flush();
    }

    /**
     * Replaces parameters and window with the stream's. Nothing changes if the stream is
     * rejected.
     *
     * @throws AnomalyDetectionException if the stream holds another type's state
     * @throws IllegalArgumentException if the saved parameters are out of range
     */
    public void loadState(InputStream in) throws IOException {
        DataInputStream data = new DataInputStream(in);
        lock.lock();
        try {
            StateHeader.read(data, STATE_TAG);
            int savedWindowSize = data.readInt();
            int savedThreshold = data.readInt();
            double savedTolerance = data.readDouble();
            validate(savedWindowSize, savedThreshold, savedTolerance);

            int count = data.readInt();
            if (count < 0) {
                throw new AnomalyDetectionException("Corrupt state: negative window size " + count);
            }
            List<Double> values = new ArrayList<>(count);
            for (int i = 0; i < count; i++) {
                values.add(data.readDouble());
            }

            windowSize = savedWindowSize;
            confirmationThreshold = savedThreshold;
            tolerance = savedTolerance;
            window.clear();
            window.addAll(values);
            trim();
            log.info("Restored confirmation window with {} values (windowSize={}, threshold={})",
                    window.size(), windowSize, confirmationThreshold);
        } finally {
            lock.unlock();
        }
    }

    public void saveToFile(Path file) throws IOException {
        try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(file))) {
            saveState(out);
        }
    }

    public void loadFromFile(Path file) throws IOException {
        try (InputStream in = new BufferedInputStream(Files.newInputStream(file))) {
            loadState(in);
        }
    }

    private void trim() {
        while (window.size() > windowSize) {
            window.removeFirst();
        }
    }

    private static void validate(int windowSize, int confirmationThreshold, double tolerance) {
        if (windowSize < 1) {
            throw new IllegalArgumentException("windowSize must be >= 1, got " + windowSize);
        }
        if (confirmationThreshold < 1) {
            throw new IllegalArgumentException("confirmationThreshold must be >= 1, got " + confirmationThreshold);
        }
        if (!(tolerance >= 0.0)) {
            throw new IllegalArgumentException("tolerance must be >= 0, got " + tolerance);
        }
    }
}
