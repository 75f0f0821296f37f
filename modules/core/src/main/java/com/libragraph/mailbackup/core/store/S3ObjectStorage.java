package com.libragraph.mailbackup.core.store;

import com.libragraph.mailbackup.util.ContentHash;
import io.minio.BucketExistsArgs;
import io.minio.GetObjectArgs;
import io.minio.MakeBucketArgs;
import io.minio.MinioClient;
import io.minio.PutObjectArgs;
import io.minio.RemoveObjectArgs;
import io.minio.StatObjectArgs;
import io.minio.errors.ErrorResponseException;
import io.quarkus.arc.properties.IfBuildProperty;
import io.smallrye.mutiny.Uni;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;

import java.io.ByteArrayInputStream;
import java.io.InputStream;

/**
 * S3/MinIO-backed ObjectStorage for production use.
 *
 * <p>One bucket holds every tenant's content, since blobs are deduplicated
 * across tenants. Keys are the flat digest hex; MinIO handles sharding
 * internally. A single PUT is atomic, so no temp object is needed.
 */
@ApplicationScoped
@IfBuildProperty(name = "backup.object-store.type", stringValue = "s3")
public class S3ObjectStorage implements ObjectStorage {

    @Inject
    MinioClient minioClient;

    @ConfigProperty(name = "backup.object-store.bucket", defaultValue = "mailbackup-content")
    String bucket;

    private volatile boolean bucketReady;

    private void ensureBucket() {
        if (bucketReady) {
            return;
        }
        try {
            if (!minioClient.bucketExists(BucketExistsArgs.builder().bucket(bucket).build())) {
                minioClient.makeBucket(MakeBucketArgs.builder().bucket(bucket).build());
            }
            bucketReady = true;
        } catch (ErrorResponseException e) {
            // another thread created the bucket first
            if ("BucketAlreadyOwnedByYou".equals(e.errorResponse().code())) {
                bucketReady = true;
                return;
            }
            throw new StorageException("Failed to ensure bucket: " + bucket, e);
        } catch (Exception e) {
            throw new StorageException("Failed to ensure bucket: " + bucket, e);
        }
    }

    private static boolean isMissing(ErrorResponseException e) {
        String code = e.errorResponse().code();
        return "NoSuchKey".equals(code) || "NoSuchBucket".equals(code);
    }

    @Override
    public String storageKey(ContentHash digest) {
        return bucket + "/" + digest.toHex();
    }

    @Override
    public Uni<byte[]> read(ContentHash digest) {
        return Uni.createFrom().item(() -> {
            try (InputStream is = minioClient.getObject(
                    GetObjectArgs.builder().bucket(bucket).object(digest.toHex()).build())) {
                return is.readAllBytes();
            } catch (ErrorResponseException e) {
                if (isMissing(e)) {
                    throw new BlobNotFoundException(digest);
                }
                throw new StorageException("Failed to read blob: " + digest, e);
            } catch (Exception e) {
                throw new StorageException("Failed to read blob: " + digest, e);
            }
        });
    }

    @Override
    public Uni<Void> create(ContentHash digest, byte[] data) {
        return Uni.createFrom().voidItem().invoke(() -> {
            ensureBucket();
            try (InputStream is = new ByteArrayInputStream(data)) {
                minioClient.putObject(PutObjectArgs.builder()
                        .bucket(bucket)
                        .object(digest.toHex())
                        .stream(is, data.length, -1)
                        .contentType("application/octet-stream")
                        .build());
            } catch (Exception e) {
                throw new StorageException("Failed to write blob: " + digest, e);
            }
        });
    }

    @Override
    public Uni<Boolean> exists(ContentHash digest) {
        return Uni.createFrom().item(() -> {
            try {
                minioClient.statObject(StatObjectArgs.builder()
                        .bucket(bucket).object(digest.toHex()).build());
                return true;
            } catch (ErrorResponseException e) {
                if (isMissing(e)) {
                    return false;
                }
                throw new StorageException("Failed to check existence: " + digest, e);
            } catch (Exception e) {
                throw new StorageException("Failed to check existence: " + digest, e);
            }
        });
    }

    @Override
    public Uni<Void> delete(ContentHash digest) {
        return Uni.createFrom().voidItem().invoke(() -> {
            // removeObject is silent on missing keys, which is what reclamation wants
            try {
                minioClient.removeObject(RemoveObjectArgs.builder()
                        .bucket(bucket).object(digest.toHex()).build());
            } catch (ErrorResponseException e) {
                if ("NoSuchBucket".equals(e.errorResponse().code())) {
                    return;
                }
                throw new StorageException("Failed to delete blob: " + digest, e);
            } catch (Exception e) {
                throw new StorageException("Failed to delete blob: " + digest, e);
            }
        });
    }
}
