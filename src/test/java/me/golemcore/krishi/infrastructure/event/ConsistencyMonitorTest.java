package me.golemcore.krishi.infrastructure.event;

import me.golemcore.krishi.domain.model.ConsistencyWarning;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ConsistencyMonitorTest {

    private static ConsistencyWarning warning(String subject) {
        return new ConsistencyWarning(ConsistencyWarning.Kind.DANGLING_EDGE, subject, "missing target",
                Instant.parse("2026-03-01T00:00:00Z"));
    }

    @Test
    void shouldKeepWarningsOldestFirst() {
        ConsistencyMonitor monitor = new ConsistencyMonitor();
        monitor.onWarning(warning("a"));
        monitor.onWarning(warning("b"));

        List<String> subjects = monitor.getRecentWarnings().stream().map(ConsistencyWarning::subject).toList();

        assertEquals(List.of("a", "b"), subjects);
    }

    @Test
    void shouldDropOldestBeyondCapacity() {
        ConsistencyMonitor monitor = new ConsistencyMonitor();
        for (int i = 0; i <= ConsistencyMonitor.MAX_RECENT; i++) {
            monitor.onWarning(warning("w" + i));
        }

        List<ConsistencyWarning> recent = monitor.getRecentWarnings();

        assertEquals(ConsistencyMonitor.MAX_RECENT, recent.size());
        assertEquals("w1", recent.get(0).subject());
    }

    @Test
    void shouldClear() {
        ConsistencyMonitor monitor = new ConsistencyMonitor();
        monitor.onWarning(warning("a"));

        monitor.clear();

        assertTrue(monitor.getRecentWarnings().isEmpty());
    }
}
