package com.ttennebkram.imagerouter.fixtures;

import com.ttennebkram.imagerouter.backends.BackendInfo;
import com.ttennebkram.imagerouter.backends.ImageBackend;
import com.ttennebkram.imagerouter.config.RouterConfig;
import com.ttennebkram.imagerouter.model.Representation;
import com.ttennebkram.imagerouter.registry.ArgumentShape;
import com.ttennebkram.imagerouter.registry.CapabilityRegistry;

/**
 * Scanner fixture: a minimal available backend.
 */
@BackendInfo(name = "counting", priority = 5)
public class CountingBackend implements ImageBackend {

    public static final Representation<String> TEXT = Representation.of("text", String.class);

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public void register(CapabilityRegistry registry, RouterConfig config) {
        registry.registerOperation(TEXT, "count", ArgumentShape.none(), (value, args) -> value.length());
    }
}
