package org.deltaio.storage.utils;

import org.deltaio.storage.junit.extensions.logging.LogWatchExtension;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class StorageUtilsTest {

    @Test
    void testCommitUriFromVersion() {
        assertEquals("_delta_log/00000000000000000000.json", StorageUtils.commitUriFromVersion(0).asString());
        assertEquals("_delta_log/00000000000000000001.json", StorageUtils.commitUriFromVersion(1).asString());
        assertEquals("_delta_log/09223372036854775807.json",
                StorageUtils.commitUriFromVersion(Long.MAX_VALUE).asString());
    }

    @Test
    void testCommitUriFromVersion_AlwaysTwentyDigits() {
        for (long version : new long[]{7, 42, 123_456_789L}) {
            String name = StorageUtils.commitUriFromVersion(version).filename().orElseThrow();
            assertTrue(name.matches("\\d{20}\\.json"), name);
        }
    }

    @Test
    void testCommitUriFromVersion_RejectsNegative() {
        assertThrows(IllegalArgumentException.class, () -> StorageUtils.commitUriFromVersion(-1));
    }

    @ParameterizedTest
    @ValueSource(strings = {"1", "true", "on", "YES", "Y", "True", "oN"})
    void testStrIsTruthy_True(String value) {
        assertTrue(StorageUtils.strIsTruthy(value));
    }

    @ParameterizedTest
    @ValueSource(strings = {"0", "FALSE", "off", "NO", "n", "bork", "", " true"})
    void testStrIsTruthy_False(String value) {
        assertFalse(StorageUtils.strIsTruthy(value));
    }
}
