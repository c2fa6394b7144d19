package com.tracedemo;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ConfigurationTest {

    @Test
    void shouldLoadDevEnvironment() throws IOException {
        Configuration conf = new Configuration(Paths.get("environments"), "dev");

        assertEquals("dev", conf.getEnvironment());
        assertEquals("aws-trace-demo", conf.getFunctionName());
        assertEquals(512, conf.getFunctionMemoryMb());
        assertEquals(30, conf.getFunctionTimeoutSeconds());
        assertEquals(3, conf.getResourceReplicas());
        assertFalse(conf.isRunCategoriesConcurrently());
    }

    @Test
    void shouldFailOnMissingKey(@TempDir Path root) throws IOException {
        Files.createDirectories(root.resolve("qa"));
        Files.writeString(root.resolve("qa").resolve("cdk.properties"), "function.name=aws-trace-demo\n");
        Configuration conf = new Configuration(root, "qa");

        IllegalArgumentException thrown = assertThrows(IllegalArgumentException.class, conf::getCustomerRegion);
        assertEquals("Property customer.region is not found in cdk.properties file", thrown.getMessage());
    }

    @Test
    void shouldRejectNonNumericAndZeroReplicas(@TempDir Path root) throws IOException {
        Files.createDirectories(root.resolve("qa"));
        Files.writeString(root.resolve("qa").resolve("cdk.properties"),
                "function.memory.mb=lots\nresource.replicas=0\n");
        Configuration conf = new Configuration(root, "qa");

        assertThrows(IllegalArgumentException.class, conf::getFunctionMemoryMb);
        assertThrows(IllegalArgumentException.class, conf::getResourceReplicas);
    }

    @Test
    void shouldFailForUnknownEnvironment(@TempDir Path root) {
        assertThrows(NoSuchFileException.class, () -> new Configuration(root, "prod"));
        assertThrows(IllegalArgumentException.class, () -> new Configuration(root, " "));
    }

    @Test
    void shouldMapPropertiesToFunctionEnvironment() throws IOException {
        Configuration conf = new Configuration(Paths.get("environments"), "dev");

        Map<String, String> environment = conf.getFunctionEnvironment();

        assertEquals("example-table", environment.get("DYNAMODB_TABLE_NAME"));
        assertEquals("3", environment.get("RESOURCE_REPLICAS"));
        assertEquals("/aws-trace-demo/dev", environment.get("PARAMETER_PREFIX"));
        assertFalse(environment.containsKey("AWS_REGION"));
        assertEquals("aws-trace-demo", environment.get("OTEL_SERVICE_NAME"));
        assertEquals("http://localhost:4318", environment.get("OTEL_EXPORTER_OTLP_ENDPOINT"));
    }

    @Test
    void shouldListCollectorLayers(@TempDir Path root) throws IOException {
        Configuration dev = new Configuration(Paths.get("environments"), "dev");
        assertEquals(1, dev.getFunctionLayerArns().size());
        assertTrue(dev.getFunctionLayerArns().get(0).contains(":layer:aws-otel-collector"));

        Files.createDirectories(root.resolve("qa"));
        Files.writeString(root.resolve("qa").resolve("cdk.properties"), "function.layer.arns= a:1 , ,b:2\n");
        assertEquals(List.of("a:1", "b:2"), new Configuration(root, "qa").getFunctionLayerArns());
        Files.writeString(root.resolve("qa").resolve("cdk.properties"), "function.name=x\n");
        assertTrue(new Configuration(root, "qa").getFunctionLayerArns().isEmpty());
    }

    @Test
    void shouldGrantEveryReplicaName() throws IOException {
        Configuration conf = new Configuration(Paths.get("environments"), "dev");

        List<String> tables = conf.getTableArns();
        assertTrue(tables.contains("arn:aws:dynamodb:us-east-1:123456789012:table/example-table"));
        assertTrue(tables.contains("arn:aws:dynamodb:us-east-1:123456789012:table/example-table-*"));
        assertTrue(conf.getBucketArns().contains("arn:aws:s3:::example-bucket-*/*"));
    }
}
