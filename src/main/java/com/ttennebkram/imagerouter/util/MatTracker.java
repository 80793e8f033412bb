package com.ttennebkram.imagerouter.util;

import org.opencv.core.Mat;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Logger;

/**
 * Tracks OpenCV Mat allocations made by the OpenCV backend so leaked native memory can be found.
 *
 * Usage:
 * 1. Call MatTracker.track(mat) after creating a Mat the router will own
 * 2. Release through MatTracker.release(mat) instead of mat.release()
 * 3. Check getActiveCount() for Mats that were never released
 *
 * Tracking is on unless the {@code imagerouter.trackMats} system property is {@code false}.
 */
public class MatTracker {

    private static final Logger LOG = Logger.getLogger(MatTracker.class.getName());

    private static volatile boolean enabled =
        Boolean.parseBoolean(System.getProperty("imagerouter.trackMats", "true"));
    private static final Set<Long> activeMats = ConcurrentHashMap.newKeySet();
    private static final AtomicLong totalReleased = new AtomicLong(0);

    private MatTracker() {
    }

    public static void setEnabled(boolean enable) {
        enabled = enable;
        LOG.fine(enable ? "Mat tracking enabled" : "Mat tracking disabled");
    }

    /**
     * Track a Mat and return it, so creation sites can wrap their result.
     */
    public static Mat track(Mat mat) {
        if (!enabled || mat == null) return mat;

        activeMats.add(mat.getNativeObjAddr());
        return mat;
    }

    /**
     * Release a Mat and remove it from tracking.
     * Use this instead of mat.release().
     */
    public static void release(Mat mat) {
        if (mat == null) return;

        if (enabled && activeMats.remove(mat.getNativeObjAddr())) {
            totalReleased.incrementAndGet();
        }
        mat.release();
    }

    public static int getActiveCount() {
        return activeMats.size();
    }

    public static long getTotalReleased() {
        return totalReleased.get();
    }

    /**
     * Clear all tracking data and reset counters.
     */
    public static void reset() {
        activeMats.clear();
        totalReleased.set(0);
    }
}
