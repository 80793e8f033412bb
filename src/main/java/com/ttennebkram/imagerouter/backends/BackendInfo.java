package com.ttennebkram.imagerouter.backends;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Annotation for ImageBackend classes to declare their metadata.
 * Used for auto-discovery at startup - no central list of backends to maintain.
 *
 * Example usage:
 * <pre>
 * {@literal @}BackendInfo(
 *     name = "awt",
 *     priority = 10,
 *     description = "Java2D / ImageIO raster backend"
 * )
 * public class AwtBackend implements ImageBackend { ... }
 * </pre>
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface BackendInfo {

    /**
     * Backend name, recorded on every operation and converter it registers
     * and matched against the {@code disabledBackends} setting.
     */
    String name();

    /**
     * Installation order; lower installs first. Among equally cheap routes,
     * converters of earlier backends win.
     */
    int priority() default 100;

    /**
     * Short human-readable description.
     */
    String description() default "";
}
