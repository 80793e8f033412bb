package com.ttennebkram.imagerouter;

import com.ttennebkram.imagerouter.backends.BackendInfo;
import com.ttennebkram.imagerouter.backends.BackendScanner;
import com.ttennebkram.imagerouter.backends.ImageBackend;
import com.ttennebkram.imagerouter.config.RouterConfig;
import com.ttennebkram.imagerouter.exceptions.UnrecognizedFormatException;
import com.ttennebkram.imagerouter.formats.FormatDetector;
import com.ttennebkram.imagerouter.model.ImageValue;
import com.ttennebkram.imagerouter.model.Representation;
import com.ttennebkram.imagerouter.processing.Session;
import com.ttennebkram.imagerouter.registry.CapabilityRegistry;
import com.ttennebkram.imagerouter.routing.Router;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point: owns a capability registry, its router and the backends installed into it.
 *
 * {@link #getDefault()} discovers every {@link BackendInfo}-annotated backend on the classpath.
 * Custom setups build their own:
 * <pre>
 * ImageRouter router = new ImageRouter(new CapabilityRegistry(), RouterConfig.defaults());
 * router.install(new AwtBackend());
 * Session image = router.open(Path.of("photo.png"));
 * image.resize(200, 100).saveAsJpeg(out);
 * </pre>
 * The first {@code open} or {@code wrap} freezes the registry; install backends before that.
 */
public class ImageRouter {

    private static final Logger LOG = Logger.getLogger(ImageRouter.class.getName());

    private static ImageRouter defaultRouter;

    private final CapabilityRegistry registry;
    private final RouterConfig config;
    private final Router router;
    private final FormatDetector detector = new FormatDetector();

    public ImageRouter(CapabilityRegistry registry, RouterConfig config) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.config = Objects.requireNonNull(config, "config");
        this.router = new Router(registry, config.isPathCacheEnabled());
    }

    /**
     * The process-wide router with all discovered backends, created on first use.
     */
    public static synchronized ImageRouter getDefault() {
        if (defaultRouter == null) {
            ImageRouter created = new ImageRouter(new CapabilityRegistry(), RouterConfig.load());
            created.installDiscoveredBackends();
            created.registry.freeze();
            defaultRouter = created;
        }
        return defaultRouter;
    }

    /**
     * Install a backend unless it is disabled by configuration or unavailable here.
     *
     * @return whether the backend was installed
     */
    public boolean install(ImageBackend backend) {
        String name = backend.getName();
        if (!config.isBackendEnabled(name)) {
            LOG.info("Backend " + name + " disabled by configuration");
            return false;
        }
        if (!backend.isAvailable()) {
            LOG.warning("Backend " + name + " is not available on this platform, skipping");
            return false;
        }
        registry.registerBackend(name, r -> backend.register(r, config));
        return true;
    }

    /**
     * Instantiate and install every backend found by {@link BackendScanner}, in priority order.
     *
     * @return number of backends installed
     */
    public int installDiscoveredBackends() {
        List<Class<? extends ImageBackend>> backendClasses = BackendScanner.findBackendClasses();
        int installed = 0;
        for (Class<? extends ImageBackend> backendClass : backendClasses) {
            ImageBackend backend;
            try {
                backend = backendClass.getDeclaredConstructor().newInstance();
            } catch (ReflectiveOperationException | LinkageError e) {
                LOG.log(Level.WARNING, "Cannot create backend " + backendClass.getName(), e);
                continue;
            }
            if (install(backend)) {
                installed++;
            }
        }
        LOG.info("ImageRouter: installed " + installed + " of " + backendClasses.size() + " backends "
            + registry.getBackends());
        return installed;
    }

    /**
     * Open encoded image bytes. The format is detected from magic numbers; nothing is decoded
     * until an operation needs it.
     */
    public Session open(byte[] data) throws UnrecognizedFormatException {
        registry.freeze();
        ImageValue<?> file = detector.decode(data);
        return new Session(router, file);
    }

    public Session open(InputStream in) throws IOException, UnrecognizedFormatException {
        return open(in.readAllBytes());
    }

    public Session open(Path path) throws IOException, UnrecognizedFormatException {
        return open(Files.readAllBytes(path));
    }

    /**
     * Start a session from a value already in a backend representation.
     * The session takes ownership of the value.
     */
    public <T> Session wrap(Representation<T> representation, T value) {
        registry.freeze();
        return new Session(router, ImageValue.of(representation, value));
    }

    public CapabilityRegistry getRegistry() {
        return registry;
    }

    public Router getRouter() {
        return router;
    }

    public RouterConfig getConfig() {
        return config;
    }
}
