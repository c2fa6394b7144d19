package awsTraceDemo;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Upload, list and delete a handful of sample objects in a round-robin bucket, creating the
 * bucket first when needed.
 */
public class S3Workflow implements CategoryWorkflow {

    @Override
    public String category() {
        return InvocationEvent.S3_OPERATIONS;
    }

    @Override
    public String resultKey() {
        return "s3_data";
    }

    @Override
    public String errorType() {
        return "S3_OPERATION_FAILED";
    }

    @Override
    public Map<String, Object> run(InvocationContext ctx) {
        Configuration conf = ctx.getConf();
        String bucket = ResourceSelector.select(conf.getBucketBaseName(), conf.getResourceReplicas(), ctx.getClock()).getSelected();
        ctx.getTrace().addExecutionTag("s3_bucket", bucket);

        S3BucketManager buckets = new S3BucketManager(ctx.getClients().getS3(), ctx.getClients().getRegion());
        S3Dal dal = new S3Dal(ctx.getClients().getS3(), bucket, ctx.readiness(buckets), ctx.getExecutor(), ctx.getLog());

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("bucket_used", bucket);
        if (!dal.ensureBucketExists()) {
            result.put("status", "bucket_setup_failed");
            ctx.getTrace().addExecutionTag("s3_status", "bucket_setup_failed");
            return result;
        }

        String operationId = UUID.randomUUID().toString().substring(0, 8);
        String timestamp = ctx.getClock().instant().toString();

        Map<String, Object> uploaded = dal.uploadSampleObjects(operationId, timestamp);
        Map<String, Object> listed = dal.listBucketObjects(operationId);
        Map<String, Object> deleted = dal.deleteBucketObjects(operationId);

        result.put("objects_created", uploaded.get("objects_created"));
        result.put("objects_listed", listed.get("object_count"));
        result.put("objects_deleted", deleted.get("objects_deleted"));
        result.put("operation_id", operationId);

        ctx.getTrace().addExecutionTag("s3_objects_created", String.valueOf(uploaded.get("objects_created")));
        ctx.getTrace().addExecutionTag("s3_status", "success");
        ctx.getLog().event("S3_Operations", "Lambda_Handler", result);
        return result;
    }
}
