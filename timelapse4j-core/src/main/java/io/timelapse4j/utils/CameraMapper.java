package io.timelapse4j.utils;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.timelapse4j.core.Camera;
import io.timelapse4j.core.CapturePolicy;
import io.timelapse4j.core.Frequency;
import io.timelapse4j.core.Schedule;
import io.timelapse4j.core.TimeWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Converts a generic configuration tree into {@link Camera} values.
 *
 * <p>Expected shape per camera (snake_case keys, every key optional except {@code url}):
 * <pre>
 * url: rtsp://host/stream
 * enabled: true
 * schedules:
 *   - name: daytime
 *     frequency: hourly | interval | x_per_day
 *     enabled: true
 *     value: 1
 *     time_window: { start: "06:00", end: "20:00" }
 * capture_settings:
 *   jpeg_quality: 90
 *   timeout_seconds: 10
 *   retry_count: 3
 *   retry_delay_seconds: 1.0
 *   resolution_scale: 0.5
 * </pre>
 */
public class CameraMapper {
    private static final Logger log = LoggerFactory.getLogger(CameraMapper.class);

    private static final List<String> SUPPORTED_SCHEMES = List.of("rtsp://", "rtsps://", "http://", "https://");

    private final ObjectMapper objectMapper;

    public CameraMapper(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    /**
     * Map a {@code name -> camera tree} section. Cameras with an unsupported URL or an
     * unreadable definition are skipped with a warning.
     */
    public Map<String, Camera> fromSnapshot(Map<String, ?> cameras) {
        Map<String, Camera> result = new LinkedHashMap<>();
        if (cameras == null) {
            return result;
        }

        for (var e : cameras.entrySet()) {
            String name = e.getKey();
            JsonNode node = objectMapper.valueToTree(e.getValue());
            if (node == null || !node.isObject()) {
                log.warn("Camera definition is not an object, skipping name={}", name);
                continue;
            }
            String url = node.path("url").asText("");
            if (!isSupportedUrl(url)) {
                log.warn("Camera has invalid URL, skipping name={} url={}", name, url);
                continue;
            }
            try {
                result.put(name, toCamera(name, node));
            } catch (IllegalArgumentException | DateTimeParseException ex) {
                log.warn("Camera definition rejected, skipping name={} msg={}", name, ex.getMessage());
            }
        }
        return result;
    }

    public Camera fromMap(String name, Map<String, ?> data) {
        return toCamera(name, objectMapper.valueToTree(data == null ? Map.of() : data));
    }

    public static boolean isSupportedUrl(String url) {
        if (url == null || url.isBlank()) {
            return false;
        }
        return SUPPORTED_SCHEMES.stream().anyMatch(url::startsWith);
    }

    private Camera toCamera(String name, JsonNode node) {
        List<Schedule> schedules = new ArrayList<>();
        for (JsonNode s : node.path("schedules")) {
            schedules.add(toSchedule(name, s));
        }

        return new Camera(
                name,
                node.path("url").asText(""),
                node.path("enabled").asBoolean(true),
                schedules,
                toPolicy(node.path("capture_settings"))
        );
    }

    private Schedule toSchedule(String cameraName, JsonNode node) {
        String tag = node.path("frequency").asText("hourly");
        Frequency frequency = Frequency.fromTag(tag);
        String name = node.path("name").asText(Schedule.DEFAULT_NAME);
        if (frequency == null) {
            log.warn("Unknown schedule frequency camera={} schedule={} frequency={}", cameraName, name, tag);
        }

        return new Schedule(
                name,
                frequency,
                node.path("enabled").asBoolean(true),
                node.path("value").asInt(1),
                toWindow(node.path("time_window"))
        );
    }

    private TimeWindow toWindow(JsonNode node) {
        if (node.isMissingNode() || node.isNull()) {
            return null;
        }
        LocalTime start = node.hasNonNull("start") ? LocalTime.parse(node.get("start").asText()) : TimeWindow.DEFAULT_START;
        LocalTime end = node.hasNonNull("end") ? LocalTime.parse(node.get("end").asText()) : TimeWindow.DEFAULT_END;
        return new TimeWindow(start, end);
    }

    private CapturePolicy toPolicy(JsonNode node) {
        Double scale = node.hasNonNull("resolution_scale") ? node.get("resolution_scale").asDouble() : null;
        return new CapturePolicy(
                node.path("jpeg_quality").asInt(CapturePolicy.DEFAULT_JPEG_QUALITY),
                node.path("timeout_seconds").asInt(CapturePolicy.DEFAULT_TIMEOUT_SECONDS),
                node.path("retry_count").asInt(CapturePolicy.DEFAULT_RETRY_COUNT),
                node.path("retry_delay_seconds").asDouble(CapturePolicy.DEFAULT_RETRY_DELAY_SECONDS),
                scale
        );
    }
}
