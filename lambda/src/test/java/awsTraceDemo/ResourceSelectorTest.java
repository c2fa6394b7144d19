package awsTraceDemo;

import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ResourceSelectorTest {

    @Test
    void shouldBuildSuffixedCandidates() {
        ResourceSelector.Selection selection = ResourceSelector.select("example-table", 3, TestSupport.MutableClock.atEpochSecond(0));
        assertEquals(List.of("example-table", "example-table-2", "example-table-3"), selection.getCandidates());
    }

    @Test
    void shouldPickByEpochSecondModuloCount() {
        assertEquals("orders", ResourceSelector.select("orders", 3, TestSupport.MutableClock.atEpochSecond(1_700_000_001L)).getSelected());
        assertEquals("orders-2", ResourceSelector.select("orders", 3, TestSupport.MutableClock.atEpochSecond(1_700_000_002L)).getSelected());
        assertEquals("orders-3", ResourceSelector.select("orders", 3, TestSupport.MutableClock.atEpochSecond(1_700_000_000L)).getSelected());
    }

    @Test
    void shouldBeStableWithinTheSameSecond() {
        TestSupport.MutableClock clock = TestSupport.MutableClock.atEpochSecond(1_700_000_123L);
        ResourceSelector.Selection first = ResourceSelector.select("bucket", 3, clock);
        clock.advance(999);
        assertEquals(first, ResourceSelector.select("bucket", 3, clock));
    }

    @Test
    void shouldVisitEveryCandidateOverConsecutiveSeconds() {
        TestSupport.MutableClock clock = TestSupport.MutableClock.atEpochSecond(1_700_000_000L);
        Set<String> seen = new HashSet<>();
        for (int i = 0; i < 5; i++) {
            ResourceSelector.Selection selection = ResourceSelector.select("bucket", 5, clock);
            assertTrue(selection.getIndex() >= 0 && selection.getIndex() < 5);
            seen.add(selection.getSelected());
            clock.advance(1000);
        }
        assertEquals(5, seen.size());
    }

    @Test
    void shouldAlwaysPickTheOnlyCandidate() {
        assertEquals(0, ResourceSelector.select("solo", 1, TestSupport.MutableClock.atEpochSecond(987_654_321L)).getIndex());
    }

    @Test
    void shouldSelectFromExplicitList() {
        List<String> endpoints = List.of("https://api/posts/1", "https://api/posts/2", "https://api/posts/3");
        assertEquals("https://api/posts/2", ResourceSelector.select(endpoints, TestSupport.MutableClock.atEpochSecond(4)).getSelected());
    }

    @Test
    void shouldRejectInvalidInput() {
        TestSupport.MutableClock clock = TestSupport.MutableClock.atEpochSecond(0);
        assertThrows(IllegalArgumentException.class, () -> ResourceSelector.select("table", 0, clock));
        assertThrows(IllegalArgumentException.class, () -> ResourceSelector.select(" ", 3, clock));
        assertThrows(IllegalArgumentException.class, () -> ResourceSelector.select(List.of(), clock));
    }

    @Test
    void shouldKeepIndexInRangeForNegativeSeconds() {
        assertEquals(2, ResourceSelector.indexFor(-1L, 3));
    }
}
