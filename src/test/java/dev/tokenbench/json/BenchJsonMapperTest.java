package dev.tokenbench.json;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

public class BenchJsonMapperTest {
    record Sample(String taskId, Optional<String> error, long latencyMs) {}

    @Test
    void writesSnakeCaseAndOmitsEmptyOptionals() {
        var json = BenchJsonMapper.toJson(new Sample("t1", Optional.empty(), 12));
        var map = BenchJsonMapper.fromJson(json, Map.class);
        assertEquals("t1", map.get("task_id"));
        assertEquals(12, map.get("latency_ms"));
        assertFalse(map.containsKey("error"), json);
    }

    @Test
    void writesPresentOptionalsAsPlainValues() {
        var json = BenchJsonMapper.toJson(new Sample("t1", Optional.of("boom"), 0));
        assertTrue(json.contains("\"error\":\"boom\""), json);
    }

    @Test
    void ignoresUnknownProperties() {
        var sample =
                BenchJsonMapper.fromJson(
                        "{\"task_id\":\"t1\",\"latency_ms\":3,\"surprise\":true}", Sample.class);
        assertEquals("t1", sample.taskId());
        assertEquals(3, sample.latencyMs());
    }
}
