package com.ttennebkram.imagerouter.backends;

import com.ttennebkram.imagerouter.config.RouterConfig;
import com.ttennebkram.imagerouter.registry.CapabilityRegistry;

/**
 * An image library adapter. Each backend contributes its own representation(s),
 * the operations those support natively, and converters to and from the
 * shared file and buffer representations.
 *
 * Implementations must have a public no-arg constructor and carry {@link BackendInfo}
 * to be discovered by {@link BackendScanner}.
 */
public interface ImageBackend {

    /**
     * Whether the underlying library can be used in this process
     * (e.g. its native library loads). Unavailable backends are skipped.
     */
    boolean isAvailable();

    /**
     * Register this backend's operations and converters.
     * Called once, during the registry's registration phase.
     */
    void register(CapabilityRegistry registry, RouterConfig config);

    /**
     * Backend name from {@link BackendInfo}, or the simple class name.
     */
    default String getName() {
        BackendInfo info = getClass().getAnnotation(BackendInfo.class);
        if (info != null) {
            return info.name();
        }
        return getClass().getSimpleName();
    }
}
