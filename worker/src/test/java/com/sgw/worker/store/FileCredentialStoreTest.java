package com.sgw.worker.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.sgw.protocol.Envelopes;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

class FileCredentialStoreTest {

    @TempDir
    Path dir;

    @Test
    void missingSessionLoadsEmpty() throws Exception {
        assertTrue(new FileCredentialStore(dir).load("nobody").isEmpty());
    }

    @Test
    void upsertReplacesRecord() throws Exception {
        FileCredentialStore store = new FileCredentialStore(dir);
        store.upsert(new CredentialRecord("a", "qr_ready", Instant.parse("2024-01-01T00:00:00Z"), new byte[]{1}));
        store.upsert(new CredentialRecord("a", "connected", Instant.parse("2024-01-02T00:00:00Z"), new byte[]{2, 3}));

        CredentialRecord r = store.load("a").orElseThrow();
        assertEquals("connected", r.status());
        assertEquals(Instant.parse("2024-01-02T00:00:00Z"), r.updatedAt());
        assertArrayEquals(new byte[]{2, 3}, r.blob());
        try (Stream<Path> files = Files.list(dir)) {
            assertEquals(1, files.count(), "no temp file left behind");
        }
    }

    @Test
    void recordLayoutWrapsBlobAsBuffer() throws Exception {
        FileCredentialStore store = new FileCredentialStore(dir);
        store.upsert(new CredentialRecord("a", "connected", Instant.now(), new byte[]{1, 2}));

        JsonNode node = Envelopes.MAPPER.readTree(dir.resolve("a.json").toFile());
        assertEquals("a", node.get("id").asText());
        assertEquals("Buffer", node.path("authData").path("type").asText());
        assertEquals("AQI=", node.path("authData").path("data").asText());
    }

    @Test
    void listsIdsIncludingEncodedOnes() throws Exception {
        FileCredentialStore store = new FileCredentialStore(dir);
        store.upsert(new CredentialRecord("plain", "connected", Instant.now(), new byte[]{1}));
        store.upsert(new CredentialRecord("tenant/42", "connected", Instant.now(), new byte[]{1}));

        assertEquals(new HashSet<>(List.of("plain", "tenant/42")), new HashSet<>(store.sessionIds()));
        assertArrayEquals(new byte[]{1}, store.load("tenant/42").orElseThrow().blob());
    }

    @Test
    void corruptFileSurfacesAsStoreError() throws Exception {
        FileCredentialStore store = new FileCredentialStore(dir);
        Files.writeString(dir.resolve("bad.json"), "{not json");
        assertThrows(CredentialStoreException.class, () -> store.load("bad"));
    }

    @Test
    void recordWithoutBlobParses() throws Exception {
        CredentialRecord r = CredentialRecord.fromJson(Envelopes.MAPPER.readTree("{\"id\":\"x\"}"));
        assertEquals("x", r.id());
        assertEquals("unknown", r.status());
        assertEquals(Instant.EPOCH, r.updatedAt());
        assertNull(r.blob());
    }
}
