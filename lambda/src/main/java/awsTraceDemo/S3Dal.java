package awsTraceDemo;

import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Request;
import software.amazon.awssdk.services.s3.model.ListObjectsV2Response;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;
import software.amazon.awssdk.services.s3.model.S3Object;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Data access for the object store: bucket readiness and an upload / list / delete lifecycle of
 * sample objects grouped under {@code sample-<operationId>/}.
 */
public class S3Dal {

    private final S3Client s3;
    private final String bucketName;
    private final ResourceReadiness readiness;
    private final OperationExecutor executor;
    private final OperationLog log;

    public S3Dal(S3Client s3, String bucketName, ResourceReadiness readiness, OperationExecutor executor, OperationLog log) {
        this.s3 = s3;
        this.bucketName = bucketName;
        this.readiness = readiness;
        this.executor = executor;
        this.log = log;
    }

    public boolean ensureBucketExists() {
        return readiness.ensureExists(bucketName);
    }

    /**
     * Puts one object.
     *
     * @param key object key
     * @param content UTF-8 text
     * @param contentType MIME type stored with the object
     */
    public void uploadObject(String key, String content, String contentType) {
        executor.execute("PUT_OBJECT", bucketName + "/" + key, () -> s3.putObject(
                PutObjectRequest.builder().bucket(bucketName).key(key).contentType(contentType).build(),
                RequestBody.fromString(content)));
    }

    /**
     * @param prefix key prefix, may be null for the whole bucket
     * @return keys of the first page of matching objects
     */
    public List<String> listObjects(String prefix) {
        ListObjectsV2Response response = executor.execute("LIST_OBJECTS", bucketName, () -> s3.listObjectsV2(
                ListObjectsV2Request.builder().bucket(bucketName).prefix(prefix).build()));
        List<String> keys = new ArrayList<>();
        for (S3Object object : response.contents()) {
            keys.add(object.key());
        }
        return keys;
    }

    public void deleteObject(String key) {
        executor.execute("DELETE_OBJECT", bucketName + "/" + key, () -> s3.deleteObject(
                DeleteObjectRequest.builder().bucket(bucketName).key(key).build()));
    }

    /**
     * Uploads two JSON documents and a text file. A failed upload is reported in the returned
     * operations and does not stop the others.
     *
     * @return objects_created and the per-object operations
     */
    public Map<String, Object> uploadSampleObjects(String operationId, String timestamp) {
        String prefix = samplePrefix(operationId);
        Map<String, String> samples = new LinkedHashMap<>();
        samples.put(prefix + "data1.json", sampleJson("1", "Sample data 1", timestamp, operationId));
        samples.put(prefix + "data2.json", sampleJson("2", "Sample data 2", timestamp, operationId));
        samples.put(prefix + "metadata.txt", "Operation ID: " + operationId + "\nTimestamp: " + timestamp
                + "\nBucket: " + bucketName);

        List<Map<String, Object>> operations = new ArrayList<>();
        int created = 0;
        for (Map.Entry<String, String> sample : samples.entrySet()) {
            String key = sample.getKey();
            String contentType = key.endsWith(".json") ? "application/json" : "text/plain";
            try {
                uploadObject(key, sample.getValue(), contentType);
                created++;
                operations.add(step("UPLOAD_OBJECT", key, null));
            } catch (RuntimeException e) {
                operations.add(step("UPLOAD_OBJECT", key, e));
            }
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("objects_created", created);
        result.put("operations", operations);
        return result;
    }

    /**
     * Lists what {@link #uploadSampleObjects} stored for the operation.
     *
     * @return object_count and the list operation, failed operations count zero objects
     */
    public Map<String, Object> listBucketObjects(String operationId) {
        Map<String, Object> result = new LinkedHashMap<>();
        try {
            List<String> keys = listObjects(samplePrefix(operationId));
            Map<String, Object> operation = step("LIST_OBJECTS", samplePrefix(operationId), null);
            operation.put("object_count", keys.size());
            result.put("operations", List.of(operation));
            result.put("object_count", keys.size());
        } catch (RuntimeException e) {
            result.put("operations", List.of(step("LIST_OBJECTS", samplePrefix(operationId), e)));
            result.put("object_count", 0);
        }
        return result;
    }

    /**
     * Deletes every object under the operation's prefix.
     *
     * @return objects_deleted and the per-object operations
     */
    public Map<String, Object> deleteBucketObjects(String operationId) {
        Map<String, Object> result = new LinkedHashMap<>();
        List<Map<String, Object>> operations = new ArrayList<>();
        int deleted = 0;
        try {
            List<String> keys = listObjects(samplePrefix(operationId));
            for (String key : keys) {
                try {
                    deleteObject(key);
                    deleted++;
                    operations.add(step("DELETE_OBJECT", key, null));
                } catch (RuntimeException e) {
                    operations.add(step("DELETE_OBJECT", key, e));
                }
            }
        } catch (RuntimeException e) {
            operations.add(step("DELETE_OBJECTS", samplePrefix(operationId), e));
        }
        result.put("objects_deleted", deleted);
        result.put("operations", operations);

        Map<String, Object> artifacts = new LinkedHashMap<>();
        artifacts.put("bucket_name", bucketName);
        artifacts.put("operation_id", operationId);
        artifacts.put("objects_deleted", deleted);
        log.event("S3_Operations", "Delete_Objects", artifacts);
        return result;
    }

    static String samplePrefix(String operationId) {
        return "sample-" + operationId + "/";
    }

    private static String sampleJson(String id, String message, String timestamp, String operationId) {
        Map<String, String> document = new LinkedHashMap<>();
        document.put("id", id);
        document.put("message", message);
        document.put("timestamp", timestamp);
        document.put("operation_id", operationId);
        return OperationLog.GSON.toJson(document);
    }

    private static Map<String, Object> step(String operation, String key, RuntimeException error) {
        Map<String, Object> step = new LinkedHashMap<>();
        step.put("operation", operation);
        step.put("status", error == null ? "success" : "failed");
        step.put("key", key);
        if (error != null) {
            step.put("error", String.valueOf(error.getMessage()));
        }
        return step;
    }

    public String getBucketName() {
        return bucketName;
    }
}
