package com.tracedemo;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Properties;

/**
 A bean class that reads the deployment settings of one environment from
 environments/&lt;environment&gt;/cdk.properties. Used by the stack to size the function and to fill
 its environment variables.
 * */

public class Configuration {

    private final String environment;
    private final Properties properties = new Properties();

    /**
     * Reads the properties file of the environment passed in the cdk context
     * @param environment directory name under environments/
     * @throws IOException when the file is missing or unreadable
     */
    public Configuration(String environment) throws IOException {
        this(Paths.get("environments"), environment);
    }

    Configuration(Path environmentsRoot, String environment) throws IOException {
        if (environment == null || environment.isBlank())
            throw new IllegalArgumentException("No environment given, pass -c environment=<name>");
        this.environment = environment;
        try (InputStream input = Files.newInputStream(environmentsRoot.resolve(environment).resolve("cdk.properties"))) {
            properties.load(input);
        }
    }

    private String getOrFail(String key) {
        String value = properties.getProperty(key);
        if (value == null || value.isBlank())
            throw new IllegalArgumentException(String.format("Property %s is not found in cdk.properties file", key));
        return value.trim();
    }

    private int getIntOrFail(String key) {
        String value = getOrFail(key);
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(String.format("Property %s must be an integer, got '%s'", key, value), e);
        }
    }

    public String getEnvironment() {
        return environment;
    }

    public String getCustomerAccountId() {
        return getOrFail("customer.account.id");
    }

    public String getCustomerRegion() {
        return getOrFail("customer.region");
    }

    public String getFunctionName() {
        return getOrFail("function.name");
    }

    public String getFunctionJarPath() {
        return getOrFail("function.jar.path");
    }

    public int getFunctionMemoryMb() {
        return getIntOrFail("function.memory.mb");
    }

    public int getFunctionTimeoutSeconds() {
        return getIntOrFail("function.timeout.seconds");
    }

    public int getLogRetentionDays() {
        return getIntOrFail("log.retention.days");
    }

    public String getTableName() {
        return getOrFail("dynamodb.table.name");
    }

    public String getBucketName() {
        return getOrFail("s3.bucket.name");
    }

    public int getResourceReplicas() {
        int replicas = getIntOrFail("resource.replicas");
        if (replicas < 1)
            throw new IllegalArgumentException("Property resource.replicas must be at least 1, got " + replicas);
        return replicas;
    }

    public String getApiBaseUrl() {
        return getOrFail("api.base.url");
    }

    public String getRdsHost() {
        return getOrFail("rds.host");
    }

    public int getRdsPort() {
        return getIntOrFail("rds.port");
    }

    public String getRdsDatabaseName() {
        return getOrFail("rds.database.name");
    }

    public String getRdsSecretName() {
        return getOrFail("rds.secret.name");
    }

    public String getParameterPrefix() {
        return getOrFail("parameter.prefix");
    }

    public boolean isRunCategoriesConcurrently() {
        return Boolean.parseBoolean(getOrFail("run.categories.concurrently"));
    }

    public String getOtelExporterEndpoint() {
        return getOrFail("otel.exporter.endpoint");
    }

    /**
     * @return ARNs of the layers to attach, empty when the property is absent or blank
     */
    public List<String> getFunctionLayerArns() {
        String value = properties.getProperty("function.layer.arns");
        List<String> arns = new ArrayList<>();
        if (value == null)
            return arns;
        for (String arn : value.split(",")) {
            if (!arn.isBlank())
                arns.add(arn.trim());
        }
        return arns;
    }

    public String getTeamTag() {
        return getOrFail("team.tag");
    }

    /**
     * Environment variables of the function. Every key is a setting the handler reads, the values
     * also land in Parameter Store where they take precedence.
     */
    public Map<String, String> getFunctionEnvironment() {
        Map<String, String> environment = new LinkedHashMap<>();
        environment.put("DYNAMODB_TABLE_NAME", getTableName());
        environment.put("S3_BUCKET_NAME", getBucketName());
        environment.put("RESOURCE_REPLICAS", String.valueOf(getResourceReplicas()));
        environment.put("API_BASE_URL", getApiBaseUrl());
        environment.put("RDS_HOST", getRdsHost());
        environment.put("RDS_PORT", String.valueOf(getRdsPort()));
        environment.put("RDS_DATABASE_NAME", getRdsDatabaseName());
        environment.put("RDS_SECRET_NAME", getRdsSecretName());
        environment.put("RUN_CATEGORIES_CONCURRENTLY", String.valueOf(isRunCategoriesConcurrently()));
        environment.put("PARAMETER_PREFIX", getParameterPrefix());
        environment.put("OTEL_SERVICE_NAME", getFunctionName());
        environment.put("OTEL_EXPORTER_OTLP_ENDPOINT", getOtelExporterEndpoint());
        return environment;
    }

    /**
     * Table ARNs covering every replica of the table base name.
     */
    public List<String> getTableArns() {
        String prefix = "arn:aws:dynamodb:" + getCustomerRegion() + ":" + getCustomerAccountId() + ":table/";
        return List.of(prefix + getTableName(), prefix + getTableName() + "-*");
    }

    public List<String> getBucketArns() {
        String prefix = "arn:aws:s3:::" + getBucketName();
        return List.of(prefix, prefix + "/*", prefix + "-*", prefix + "-*/*");
    }
}
