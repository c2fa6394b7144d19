package awsTraceDemo;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class InvocationEventTest {

    @Test
    void shouldEnableAllCategoriesByDefault() {
        InvocationEvent event = InvocationEvent.parse(Map.of());
        for (String category : InvocationEvent.CATEGORIES) {
            assertTrue(event.isEnabled(category), category);
        }
        assertEquals("No data to process", event.processedResult());
        assertEquals(Map.of("has_data", "false"), event.tags());
    }

    @Test
    void shouldTreatNullEventAsEmpty() {
        assertTrue(InvocationEvent.parse(null).isEnabled(InvocationEvent.RDS_OPERATIONS));
    }

    @Test
    void shouldUppercaseData() {
        InvocationEvent event = InvocationEvent.parse(Map.of("data", "hello world"));
        assertEquals("Processed: HELLO WORLD", event.processedResult());
        assertEquals("11", event.tags().get("data_length"));
    }

    @Test
    void shouldUppercaseIndependentOfDefaultLocale() {
        Locale previous = Locale.getDefault();
        Locale.setDefault(new Locale("tr", "TR"));
        try {
            assertEquals("Processed: TITLE INFO", InvocationEvent.parse(Map.of("data", "title info")).processedResult());
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    void shouldHonourActionsGivenAsBooleansOrStrings() {
        Map<String, Object> actions = new HashMap<>();
        actions.put("api_operations", false);
        actions.put("s3_operations", "false");
        actions.put("unknown_operations", false);
        InvocationEvent event = InvocationEvent.parse(Map.of("actions", actions));

        assertFalse(event.isEnabled(InvocationEvent.API_OPERATIONS));
        assertFalse(event.isEnabled(InvocationEvent.S3_OPERATIONS));
        assertTrue(event.isEnabled(InvocationEvent.DATABASE_OPERATIONS));
        assertTrue(event.isEnabled(InvocationEvent.RDS_OPERATIONS));
    }

    @Test
    void shouldRejectMalformedFields() {
        assertThrows(IllegalArgumentException.class, () -> InvocationEvent.parse(Map.of("actions", List.of("api_operations"))));
        assertThrows(IllegalArgumentException.class, () -> InvocationEvent.parse(Map.of("actions", Map.of("api_operations", "maybe"))));
        assertThrows(IllegalArgumentException.class, () -> InvocationEvent.parse(Map.of("data", 42)));
    }

    @Test
    void shouldTagEventMetadata() {
        Map<String, Object> raw = new HashMap<>();
        raw.put("data", "x");
        raw.put("test", true);
        raw.put("source", "deploy-script");
        raw.put("timestamp", "2026-10-19T10:00:00Z");
        raw.put("action", "delete_table");
        InvocationEvent event = InvocationEvent.parse(raw);

        Map<String, String> tags = event.tags();
        assertEquals("true", tags.get("has_data"));
        assertEquals("true", tags.get("is_test"));
        assertEquals("deploy-script", tags.get("event_source"));
        assertEquals("2026-10-19T10:00:00Z", tags.get("event_timestamp"));
        assertTrue(event.isDeleteTable());
    }
}
