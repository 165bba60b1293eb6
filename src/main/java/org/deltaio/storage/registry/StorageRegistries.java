package org.deltaio.storage.registry;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.deltaio.storage.api.DeltaStorageException;
import org.deltaio.storage.api.ObjectStore;
import org.deltaio.storage.api.ObjectStoreRegistry;
import org.deltaio.storage.api.StorageOptions;

import java.net.URI;

/**
 * Process-wide default registries.
 * <p>
 * Libraries that manage their own lifetimes should create and pass around their own
 * {@link FactoryRegistry} and {@link DefaultObjectStoreRegistry} instead. The defaults are
 * created on first access; the factory registry starts with {@code memory://},
 * {@code file://} and the factories listed under {@code deltaio.storage.factories}.
 */
public final class StorageRegistries {

    public static final String FACTORIES_CONFIG_PATH = "deltaio.storage.factories";

    private StorageRegistries() {
    }

    /**
     * Returns the process-wide factory registry.
     */
    public static FactoryRegistry factories() {
        return FactoriesHolder.INSTANCE;
    }

    /**
     * Returns the process-wide store registry.
     */
    public static ObjectStoreRegistry objectStores() {
        return ObjectStoresHolder.INSTANCE;
    }

    /**
     * Builds a store for {@code url} through the process-wide factory registry.
     */
    public static ObjectStore storeFor(URI url, StorageOptions options) throws DeltaStorageException {
        return factories().storeFor(url, options);
    }

    private static final class FactoriesHolder {
        private static final FactoryRegistry INSTANCE = create();

        private static FactoryRegistry create() {
            FactoryRegistry registry = FactoryRegistry.withDefaults();
            Config config = ConfigFactory.load();
            if (config.hasPath(FACTORIES_CONFIG_PATH)) {
                registry.registerFromConfig(config.getConfig(FACTORIES_CONFIG_PATH));
            }
            return registry;
        }
    }

    private static final class ObjectStoresHolder {
        private static final DefaultObjectStoreRegistry INSTANCE = new DefaultObjectStoreRegistry();
    }
}
