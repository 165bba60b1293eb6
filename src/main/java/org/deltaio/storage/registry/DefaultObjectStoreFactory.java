package org.deltaio.storage.registry;

import org.deltaio.storage.api.DeltaStorageException;
import org.deltaio.storage.api.InvalidTableLocationException;
import org.deltaio.storage.api.ObjectPath;
import org.deltaio.storage.api.ObjectStore;
import org.deltaio.storage.api.ObjectStoreException;
import org.deltaio.storage.api.ObjectStoreFactory;
import org.deltaio.storage.api.StorageOptions;
import org.deltaio.storage.api.StoreWithRoot;
import org.deltaio.storage.stores.InMemoryObjectStore;
import org.deltaio.storage.stores.LocalFileSystemObjectStore;
import org.deltaio.storage.stores.ObjectStores;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * Builds the stores for the {@code memory://} and {@code file://} schemes.
 * <ul>
 *   <li>{@code memory://<path>} - a fresh {@link InMemoryObjectStore} rebased under the
 *       decoded URL path, which is also returned as the root</li>
 *   <li>{@code file:///<absolute-path>} - a {@link LocalFileSystemObjectStore} anchored at
 *       the path, with the root path as root</li>
 * </ul>
 * Both apply {@link ObjectStores#limitStoreHandler} last.
 */
public class DefaultObjectStoreFactory implements ObjectStoreFactory {

    private static final Logger log = LoggerFactory.getLogger(DefaultObjectStoreFactory.class);

    @Override
    public StoreWithRoot parseUrlOpts(URI url, StorageOptions options) throws DeltaStorageException {
        String scheme = url.getScheme() == null ? "" : url.getScheme().toLowerCase(Locale.ROOT);
        switch (scheme) {
            case "memory":
                return memoryStore(url, options);
            case "file":
                return fileStore(url, options);
            default:
                throw new InvalidTableLocationException(url);
        }
    }

    private StoreWithRoot memoryStore(URI url, StorageOptions options) throws InvalidTableLocationException {
        ObjectPath path;
        try {
            path = ObjectPath.fromUrlPath(url.getRawPath());
        } catch (IllegalArgumentException e) {
            throw new InvalidTableLocationException(url, "Invalid table location " + url + ": " + e.getMessage(), e);
        }
        ObjectStore inner = new InMemoryObjectStore();
        ObjectStore store = ObjectStores.limitStoreHandler(ObjectStores.urlPrefixHandler(inner, path), options);
        log.debug("Created {} for {}", store, url);
        return new StoreWithRoot(store, path);
    }

    private StoreWithRoot fileStore(URI url, StorageOptions options) throws InvalidTableLocationException {
        Path directory = toFilePath(url);
        ObjectStore inner;
        try {
            inner = LocalFileSystemObjectStore.newWithPrefix(directory);
        } catch (ObjectStoreException e) {
            throw new InvalidTableLocationException(url,
                    "Cannot open table location " + url + ": " + e.getMessage(), e);
        }
        ObjectStore store = ObjectStores.limitStoreHandler(inner, options);
        log.debug("Created {} for {}", store, url);
        return new StoreWithRoot(store, ObjectPath.root());
    }

    private static Path toFilePath(URI url) throws InvalidTableLocationException {
        String authority = url.getAuthority();
        if (authority != null && !authority.isEmpty() && !"localhost".equalsIgnoreCase(authority)) {
            throw new InvalidTableLocationException(url,
                    "Invalid table location " + url + ": file URLs cannot name a remote host", null);
        }
        String path = url.getPath();
        if (path == null || path.isEmpty()) {
            throw new InvalidTableLocationException(url,
                    "Invalid table location " + url + ": file URL has no path", null);
        }
        try {
            Path filePath = Paths.get(path);
            if (!filePath.isAbsolute()) {
                throw new InvalidTableLocationException(url,
                        "Invalid table location " + url + ": path is not absolute", null);
            }
            return filePath;
        } catch (InvalidPathException e) {
            throw new InvalidTableLocationException(url, "Invalid table location " + url + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String toString() {
        return "DefaultObjectStoreFactory";
    }
}
