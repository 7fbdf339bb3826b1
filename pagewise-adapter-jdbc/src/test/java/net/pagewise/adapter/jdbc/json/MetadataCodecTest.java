package net.pagewise.adapter.jdbc.json;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MetadataCodecTest {

    final MetadataCodec codec = new MetadataCodec();

    @Test
    void emptyMetadata_isStoredAsNull() {
        assertNull(codec.write(Map.of()));
        assertNull(codec.write(null));
        assertEquals(Map.of(), codec.read(null));
        assertEquals(Map.of(), codec.read("  "));
    }

    @Test
    void keepsInsertionOrder() {
        Map<String, String> meta = new LinkedHashMap<>();
        meta.put("pauseReason", "rate_limited");
        meta.put("resumeAt", "2024-05-01T00:10:00Z");

        String json = codec.write(meta);

        assertEquals("{\"pauseReason\":\"rate_limited\",\"resumeAt\":\"2024-05-01T00:10:00Z\"}", json);
        assertEquals(meta, codec.read(json));
    }

    @Test
    void corruptColumn_isReported() {
        assertThrows(IllegalStateException.class, () -> codec.read("[1,2"));
    }
}
