package com.sgw.worker.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.sgw.protocol.Envelopes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URLDecoder;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * One JSON file per session under a directory. Writes go to a temp file first and are
 * moved into place, so a crash mid-write never leaves a truncated record behind.
 *
 * Safe to share between worker processes: each session is only ever written by its owner.
 */
public final class FileCredentialStore implements CredentialStore {

    private static final Logger log = LoggerFactory.getLogger(FileCredentialStore.class);
    private static final String SUFFIX = ".json";

    private final Path dir;

    public FileCredentialStore(Path dir) throws CredentialStoreException {
        this.dir = dir;
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new CredentialStoreException("Cannot create credential directory " + dir, e);
        }
        log.info("Credential store at {}", dir.toAbsolutePath());
    }

    @Override
    public Optional<CredentialRecord> load(String sessionId) throws CredentialStoreException {
        Path file = fileFor(sessionId);
        if (!Files.exists(file)) return Optional.empty();
        try {
            JsonNode node = Envelopes.MAPPER.readTree(file.toFile());
            return Optional.of(CredentialRecord.fromJson(node));
        } catch (IOException | RuntimeException e) {
            throw new CredentialStoreException("Cannot read credentials of " + sessionId, e);
        }
    }

    @Override
    public void upsert(CredentialRecord record) throws CredentialStoreException {
        Path target = fileFor(record.id());
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
        try {
            Files.write(tmp, Envelopes.MAPPER.writeValueAsBytes(record.toJson()));
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new CredentialStoreException("Cannot write credentials of " + record.id(), e);
        }
    }

    @Override
    public Collection<String> sessionIds() throws CredentialStoreException {
        List<String> ids = new ArrayList<>();
        try (Stream<Path> files = Files.list(dir)) {
            files.map(p -> p.getFileName().toString())
                 .filter(name -> name.endsWith(SUFFIX))
                 .forEach(name -> ids.add(URLDecoder.decode(
                         name.substring(0, name.length() - SUFFIX.length()), StandardCharsets.UTF_8)));
        } catch (IOException e) {
            throw new CredentialStoreException("Cannot list credential directory " + dir, e);
        }
        return ids;
    }

    private Path fileFor(String sessionId) {
        return dir.resolve(URLEncoder.encode(sessionId, StandardCharsets.UTF_8) + SUFFIX);
    }
}
