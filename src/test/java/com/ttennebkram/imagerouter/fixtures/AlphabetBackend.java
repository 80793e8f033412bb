package com.ttennebkram.imagerouter.fixtures;

import com.ttennebkram.imagerouter.backends.BackendInfo;
import com.ttennebkram.imagerouter.backends.ImageBackend;
import com.ttennebkram.imagerouter.config.RouterConfig;
import com.ttennebkram.imagerouter.registry.CapabilityRegistry;

/**
 * Scanner fixture: same priority as {@link CountingBackend}, sorts first by name.
 */
@BackendInfo(name = "alphabet", priority = 5)
public class AlphabetBackend implements ImageBackend {

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public void register(CapabilityRegistry registry, RouterConfig config) {
    }
}
