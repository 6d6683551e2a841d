package org.influence.analytics.export.strategy;

import io.minio.BucketExistsArgs;
import io.minio.GetPresignedObjectUrlArgs;
import io.minio.MakeBucketArgs;
import io.minio.MinioClient;
import io.minio.PutObjectArgs;
import io.minio.http.Method;
import org.influence.analytics.engine.exception.ExportException;
import org.influence.analytics.export.model.ExportHandle;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.TimeUnit;

/**
 * Stores export records in a MinIO bucket and hands out presigned download links.
 */
@Service
@ConditionalOnProperty(name = "export.sink", havingValue = "minio", matchIfMissing = true)
public class MinioExportSink implements ExportSink {

    private static final Logger log = LoggerFactory.getLogger(MinioExportSink.class);

    private final MinioClient minioClient;
    private final Clock clock;

    @Value("${export.minio.bucket:analytics-exports}")
    private String bucket;

    @Value("${export.minio.url-expiry-hours:24}")
    private int urlExpiryHours;

    public MinioExportSink(MinioClient minioClient, Clock clock) {
        this.minioClient = minioClient;
        this.clock = clock;
    }

    @Override
    public ExportHandle export(String logicalName, byte[] csv) {
        String objectName = ExportObjectNames.next(logicalName, clock);
        try {
            if (!minioClient.bucketExists(BucketExistsArgs.builder().bucket(bucket).build())) {
                minioClient.makeBucket(MakeBucketArgs.builder().bucket(bucket).build());
                log.info("Created export bucket {}", bucket);
            }

            minioClient.putObject(
                    PutObjectArgs.builder()
                            .bucket(bucket)
                            .object(objectName)
                            .stream(new ByteArrayInputStream(csv), csv.length, -1)
                            .contentType("text/csv")
                            .build());

            String url = minioClient.getPresignedObjectUrl(
                    GetPresignedObjectUrlArgs.builder()
                            .method(Method.GET)
                            .bucket(bucket)
                            .object(objectName)
                            .expiry(urlExpiryHours, TimeUnit.HOURS)
                            .build());

            log.info("Exported {} bytes to {}/{}", csv.length, bucket, objectName);
            return new ExportHandle(objectName, url, Instant.now(clock).plus(Duration.ofHours(urlExpiryHours)));
        } catch (Exception e) {
            throw new ExportException(logicalName, e.getMessage(), e);
        }
    }

    @Override
    public String getSinkName() {
        return "minio";
    }
}
