package com.ttennebkram.enhancer.util;

import org.opencv.core.Mat;

import java.io.PrintStream;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

/**
 * Accounting for native OpenCV Mat allocations made by the enhancer.
 *
 * Every intermediate Mat of an enhance call goes through create()/track() and release().
 * With tracking enabled, getActiveCount() returning to its previous value after a call
 * shows that the call released all of its native buffers.
 *
 * Tracking is off by default; a long-running process only pays for a null check.
 */
public class MatTracker {

    private static final Logger LOG = Logger.getLogger(MatTracker.class.getName());

    private static volatile boolean enabled = false;
    private static final Map<Long, String> activeMats = new ConcurrentHashMap<>();
    private static final AtomicLong totalCreated = new AtomicLong(0);
    private static final AtomicLong totalReleased = new AtomicLong(0);

    private MatTracker() {
    }

    public static void setEnabled(boolean enable) {
        enabled = enable;
        LOG.fine(enable ? "Mat tracking enabled" : "Mat tracking disabled");
    }

    public static boolean isEnabled() {
        return enabled;
    }

    /**
     * Create a new Mat and track it.
     * Use this instead of new Mat().
     */
    public static Mat create() {
        Mat mat = new Mat();
        track(mat);
        return mat;
    }

    /**
     * Track an existing Mat, e.g. one returned by Imgcodecs.imdecode().
     */
    public static Mat track(Mat mat) {
        if (!enabled || mat == null) return mat;

        totalCreated.incrementAndGet();
        activeMats.put(mat.getNativeObjAddr(), callerLocation());
        return mat;
    }

    /**
     * Release a Mat and remove it from tracking.
     * Use this instead of mat.release().
     */
    public static void release(Mat mat) {
        if (mat == null) return;

        if (enabled && activeMats.remove(mat.getNativeObjAddr()) != null) {
            totalReleased.incrementAndGet();
        }
        mat.release();
    }

    /**
     * Count of currently tracked, unreleased Mats.
     */
    public static int getActiveCount() {
        return activeMats.size();
    }

    public static long getTotalCreated() {
        return totalCreated.get();
    }

    public static long getTotalReleased() {
        return totalReleased.get();
    }

    /**
     * Print unreleased Mats grouped by the class and line that created them.
     */
    public static void dumpLeaksByLocation(PrintStream out) {
        if (activeMats.isEmpty()) {
            out.println("[MatTracker] No active Mats (no leaks detected)");
            return;
        }

        Map<String, AtomicLong> locationCounts = new ConcurrentHashMap<>();
        for (String location : activeMats.values()) {
            locationCounts.computeIfAbsent(location, k -> new AtomicLong(0)).incrementAndGet();
        }

        out.printf("[MatTracker] === LEAKS BY LOCATION (%d total) ===%n", activeMats.size());
        locationCounts.entrySet().stream()
            .sorted((a, b) -> Long.compare(b.getValue().get(), a.getValue().get()))
            .forEach(e -> out.printf("  %5d : %s%n", e.getValue().get(), e.getKey()));
        out.println("[MatTracker] === END ===");
    }

    /**
     * Clear all tracking data and reset counters.
     */
    public static void reset() {
        activeMats.clear();
        totalCreated.set(0);
        totalReleased.set(0);
    }

    private static String callerLocation() {
        for (StackTraceElement element : Thread.currentThread().getStackTrace()) {
            String className = element.getClassName();
            if (className.equals("java.lang.Thread") || className.equals(MatTracker.class.getName())) {
                continue;
            }
            return String.format("%s.%s(%s:%d)", className, element.getMethodName(),
                element.getFileName(), element.getLineNumber());
        }
        return "unknown";
    }
}
