package com.modellifecycle.storage;

import com.modellifecycle.exception.StorageException;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.regex.Pattern;

/**
 * Content-addressed store: every blob lives at {@code <root>/<2 hex>/<sha256>.bin} and is
 * addressed as {@code sha256:<hex>}. Writing the same bytes twice yields the same location.
 */
@Slf4j
@Component
public class FileSystemArtifactStore implements ArtifactStore {

    private static final String SCHEME = "sha256:";
    private static final Pattern LOCATION_PATTERN = Pattern.compile("^sha256:[0-9a-f]{64}$");

    @Value("${artifacts.root-dir:./artifacts}")
    private String rootDir;

    private Path root;

    public FileSystemArtifactStore() {
    }

    public FileSystemArtifactStore(Path root) {
        this.rootDir = root.toString();
        init();
    }

    @PostConstruct
    void init() {
        this.root = Path.of(rootDir).toAbsolutePath();
        try {
            Files.createDirectories(root);
        } catch (IOException ex) {
            throw new StorageException("Cannot create artifact root " + root, ex);
        }
        log.info("ArtifactStore initialised → {}", root);
    }

    @Override
    public String put(byte[] content) {
        if (content == null || content.length == 0) {
            throw new StorageException("Refusing to store an empty artifact");
        }
        String digest = sha256(content);
        Path target = pathFor(digest);
        if (Files.exists(target)) {
            return SCHEME + digest;
        }
        try {
            Files.createDirectories(target.getParent());
            Path tmp = Files.createTempFile(target.getParent(), digest, ".tmp");
            Files.write(tmp, content);
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException ex) {
            throw new StorageException("Failed to write artifact " + digest, ex);
        }
        log.info("Artifact stored | location={}{} | bytes={}", SCHEME, digest, content.length);
        return SCHEME + digest;
    }

    @Override
    public byte[] get(String location) {
        Path path = resolve(location);
        if (!Files.exists(path)) {
            throw new StorageException("Artifact not found at " + location);
        }
        try {
            return Files.readAllBytes(path);
        } catch (IOException ex) {
            throw new StorageException("Failed to read artifact " + location, ex);
        }
    }

    @Override
    public void delete(String location) {
        Path path = resolve(location);
        try {
            if (Files.deleteIfExists(path)) {
                log.info("Artifact deleted | location={}", location);
            }
        } catch (IOException ex) {
            throw new StorageException("Failed to delete artifact " + location, ex);
        }
    }

    @Override
    public boolean exists(String location) {
        return location != null && LOCATION_PATTERN.matcher(location).matches()
            && Files.exists(resolve(location));
    }

    private Path resolve(String location) {
        if (location == null || !LOCATION_PATTERN.matcher(location).matches()) {
            throw new StorageException("Malformed artifact location: " + location);
        }
        return pathFor(location.substring(SCHEME.length()));
    }

    private Path pathFor(String digest) {
        return root.resolve(digest.substring(0, 2)).resolve(digest + ".bin");
    }

    private static String sha256(byte[] content) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(content));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 not available", ex);
        }
    }
}
