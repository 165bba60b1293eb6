package org.deltaio.storage.stores.wrappers;

import org.deltaio.storage.api.GetResult;
import org.deltaio.storage.api.ListResult;
import org.deltaio.storage.api.MultipartUpload;
import org.deltaio.storage.api.NotFoundException;
import org.deltaio.storage.api.ObjectMeta;
import org.deltaio.storage.api.ObjectPath;
import org.deltaio.storage.api.ObjectStoreException;
import org.deltaio.storage.junit.extensions.logging.LogWatchExtension;
import org.deltaio.storage.stores.InMemoryObjectStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class PrefixObjectStoreTest {

    private InMemoryObjectStore inner;
    private PrefixObjectStore store;

    @BeforeEach
    void setUp() {
        inner = new InMemoryObjectStore();
        store = new PrefixObjectStore(inner, ObjectPath.parse("tables/t1"));
    }

    private static ObjectPath path(String raw) {
        return ObjectPath.parse(raw);
    }

    private static byte[] bytes(String s) {
        return s.getBytes(StandardCharsets.UTF_8);
    }

    @Test
    void testPut_WritesUnderPrefix() throws ObjectStoreException {
        store.put(path("_delta_log/0.json"), bytes("{}"));

        assertArrayEquals(bytes("{}"), inner.get(path("tables/t1/_delta_log/0.json")).payload());
        assertThrows(NotFoundException.class, () -> inner.head(path("_delta_log/0.json")));
    }

    @Test
    void testGet_BehavesAsInnerGetOfPrefixedPath() throws ObjectStoreException {
        inner.put(path("tables/t1/data.parquet"), bytes("rows"));

        GetResult result = store.get(path("data.parquet"));
        GetResult direct = inner.get(path("tables/t1/data.parquet"));
        assertArrayEquals(direct.payload(), result.payload());
        assertEquals(direct.meta().eTag(), result.meta().eTag());
        assertEquals(path("data.parquet"), result.meta().location());
        assertEquals(path("data.parquet"), store.head(path("data.parquet")).location());
        assertArrayEquals(bytes("ow"), store.getRange(path("data.parquet"), 1, 3));
    }

    @Test
    void testList_StripsPrefixAndHidesSiblings() throws ObjectStoreException {
        inner.put(path("tables/t1/a"), bytes("x"));
        inner.put(path("tables/t1/sub/b"), bytes("x"));
        inner.put(path("tables/t2/c"), bytes("x"));
        inner.put(path("tables/t10/d"), bytes("x"));

        try (Stream<ObjectMeta> stream = store.list(null)) {
            assertThat(stream.map(m -> m.location().asString())).containsExactly("a", "sub/b");
        }
        try (Stream<ObjectMeta> stream = store.list(path("sub"))) {
            assertThat(stream.map(m -> m.location().asString())).containsExactly("sub/b");
        }
        try (Stream<ObjectMeta> stream = store.listWithOffset(null, path("a"))) {
            assertThat(stream.map(m -> m.location().asString())).containsExactly("sub/b");
        }
    }

    @Test
    void testListWithDelimiter_StripsPrefix() throws ObjectStoreException {
        inner.put(path("tables/t1/_delta_log/0.json"), bytes("x"));
        inner.put(path("tables/t1/part-0.parquet"), bytes("x"));

        ListResult result = store.listWithDelimiter(null);
        assertEquals(List.of(path("_delta_log")), result.commonPrefixes());
        assertEquals(List.of(path("part-0.parquet")),
                result.objects().stream().map(ObjectMeta::location).collect(Collectors.toList()));
    }

    @Test
    void testCopyRenameDelete_UsePrefixedPaths() throws ObjectStoreException {
        store.put(path("a"), bytes("x"));
        store.copy(path("a"), path("b"));
        store.renameIfNotExists(path("b"), path("c"));
        store.delete(path("a"));

        try (Stream<ObjectMeta> stream = inner.list(null)) {
            assertThat(stream.map(m -> m.location().asString())).containsExactly("tables/t1/c");
        }
    }

    @Test
    void testMultipart_UsesPrefixedPath() throws ObjectStoreException {
        MultipartUpload upload = store.putMultipart(path("big"));
        upload.putPart(bytes("ab"));
        upload.complete();
        assertArrayEquals(bytes("ab"), inner.get(path("tables/t1/big")).payload());
    }

    @Test
    void testToStringAndInner() {
        assertEquals("PrefixObjectStore(tables/t1)", store.toString());
        assertSame(inner, store.inner());
    }
}
