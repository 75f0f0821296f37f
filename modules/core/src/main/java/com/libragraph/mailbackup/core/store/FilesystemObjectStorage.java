package com.libragraph.mailbackup.core.store;

import com.libragraph.mailbackup.util.ContentHash;
import io.quarkus.arc.properties.IfBuildProperty;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.io.IOException;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Filesystem-backed ObjectStorage, the default driver.
 *
 * <p>Layout: {@code {root}/{tier1}/{tier2}/{hex}}
 * where tier1 = hex[0:2], tier2 = hex[2:4].
 *
 * <p>Writes go to a temp file in the target directory and are published with
 * an atomic move, so a crash never leaves a partial blob under its digest.
 */
@ApplicationScoped
@IfBuildProperty(name = "backup.object-store.type", stringValue = "filesystem", enableIfMissing = true)
public class FilesystemObjectStorage implements ObjectStorage {

    @ConfigProperty(name = "backup.object-store.filesystem.root")
    String root;

    private Path resolvePath(ContentHash digest) {
        String hex = digest.toHex();
        String tier1 = hex.substring(0, 2);
        String tier2 = hex.substring(2, 4);
        return Path.of(root, tier1, tier2, hex);
    }

    @Override
    public String storageKey(ContentHash digest) {
        String hex = digest.toHex();
        return hex.substring(0, 2) + "/" + hex.substring(2, 4) + "/" + hex;
    }

    @Override
    public Uni<byte[]> read(ContentHash digest) {
        return Uni.createFrom().item(() -> {
            Path path = resolvePath(digest);
            try {
                return Files.readAllBytes(path);
            } catch (NoSuchFileException e) {
                throw new BlobNotFoundException(digest);
            } catch (IOException e) {
                throw new StorageException("Failed to read blob: " + digest, e);
            }
        });
    }

    @Override
    public Uni<Void> create(ContentHash digest, byte[] data) {
        return Uni.createFrom().voidItem().invoke(() -> {
            Path path = resolvePath(digest);
            Path tmp = null;
            try {
                Files.createDirectories(path.getParent());
                tmp = Files.createTempFile(path.getParent(), digest.toHex(), ".tmp");
                Files.write(tmp, data);
                Files.move(tmp, path, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } catch (IOException e) {
                StorageException failure = new StorageException("Failed to write blob: " + digest, e);
                discardTemp(tmp, failure);
                throw failure;
            }
        });
    }

    @Override
    public Uni<Boolean> exists(ContentHash digest) {
        return Uni.createFrom().item(() -> Files.exists(resolvePath(digest)));
    }

    @Override
    public Uni<Void> delete(ContentHash digest) {
        return Uni.createFrom().voidItem().invoke(() -> {
            Path path = resolvePath(digest);
            try {
                if (Files.deleteIfExists(path)) {
                    pruneEmptyParents(path.getParent(), Path.of(root));
                }
            } catch (IOException e) {
                throw new StorageException("Failed to delete blob: " + digest, e);
            }
        });
    }

    private void pruneEmptyParents(Path dir, Path stop) throws IOException {
        Path current = dir;
        while (current != null && !current.equals(stop)) {
            try (DirectoryStream<Path> entries = Files.newDirectoryStream(current)) {
                if (entries.iterator().hasNext()) {
                    break;
                }
            }
            try {
                Files.delete(current);
            } catch (DirectoryNotEmptyException e) {
                // repopulated by a concurrent write
                break;
            }
            current = current.getParent();
        }
    }

    private static void discardTemp(Path tmp, StorageException failure) {
        if (tmp == null) {
            return;
        }
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            failure.addSuppressed(e);
        }
    }
}
