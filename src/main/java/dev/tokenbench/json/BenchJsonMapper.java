package dev.tokenbench.json;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.SneakyThrows;

/**
 * Centralized ObjectMapper for the harness.
 *
 * <p>snake_case property names, absent {@code Optional}s are omitted, unknown properties are
 * ignored. The run record and the Files/Skills API payloads all use this shape.
 */
public final class BenchJsonMapper {
    private static final ObjectMapper INSTANCE = create();

    private BenchJsonMapper() {}

    public static ObjectMapper get() {
        return INSTANCE;
    }

    /** Creates a fresh mapper with the harness defaults. */
    public static ObjectMapper create() {
        return new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .registerModule(new Jdk8Module())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .setDefaultPropertyInclusion(JsonInclude.Include.NON_ABSENT)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
    }

    @SneakyThrows
    public static String toJson(Object o) {
        return INSTANCE.writeValueAsString(o);
    }

    @SneakyThrows
    public static String toPrettyJson(Object o) {
        return INSTANCE.writerWithDefaultPrettyPrinter().writeValueAsString(o);
    }

    @SneakyThrows
    public static <T> T fromJson(String jsonString, Class<T> targetClass) {
        return INSTANCE.readValue(jsonString, targetClass);
    }
}
