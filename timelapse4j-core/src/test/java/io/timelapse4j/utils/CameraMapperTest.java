package io.timelapse4j.utils;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.timelapse4j.core.Camera;
import io.timelapse4j.core.CapturePolicy;
import io.timelapse4j.core.Frequency;
import io.timelapse4j.core.Schedule;
import io.timelapse4j.core.TimeWindow;
import org.junit.jupiter.api.Test;

import java.time.LocalTime;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CameraMapperTest {

    private final CameraMapper mapper = new CameraMapper(new ObjectMapper());

    @Test
    void shouldMapFullCameraDefinition() {
        Map<String, Object> garden = Map.of(
                "url", "rtsp://cam.local/garden",
                "enabled", true,
                "schedules", List.of(
                        Map.of("name", "daytime", "frequency", "hourly",
                                "time_window", Map.of("start", "06:00", "end", "20:00")),
                        Map.of("name", "sparse", "frequency", "x_per_day", "value", 4)
                ),
                "capture_settings", Map.of(
                        "jpeg_quality", 80,
                        "timeout_seconds", 5,
                        "retry_count", 2,
                        "retry_delay_seconds", 0.5,
                        "resolution_scale", 0.5
                )
        );

        Map<String, Camera> cameras = mapper.fromSnapshot(Map.of("garden", garden));

        Camera camera = cameras.get("garden");
        assertThat(camera.url()).isEqualTo("rtsp://cam.local/garden");
        assertThat(camera.schedules()).containsExactly(
                Schedule.hourly("daytime", TimeWindow.of("06:00", "20:00")),
                Schedule.perDay("sparse", 4, null)
        );
        assertThat(camera.policy()).isEqualTo(new CapturePolicy(80, 5, 2, 0.5, 0.5));
    }

    @Test
    void shouldApplyDefaultsForMissingKeys() {
        Camera camera = mapper.fromMap("porch", Map.of(
                "url", "http://cam.local/porch",
                "schedules", List.of(Map.of("time_window", Map.of("start", "07:30")))
        ));

        assertThat(camera.enabled()).isTrue();
        assertThat(camera.policy()).isEqualTo(CapturePolicy.defaults());
        Schedule schedule = camera.schedules().get(0);
        assertThat(schedule.name()).isEqualTo(Schedule.DEFAULT_NAME);
        assertThat(schedule.frequency()).isEqualTo(Frequency.HOURLY);
        assertThat(schedule.value()).isEqualTo(1);
        assertThat(schedule.timeWindow()).isEqualTo(new TimeWindow(LocalTime.of(7, 30), LocalTime.of(23, 59)));
    }

    @Test
    void shouldSkipCamerasWithUnsupportedUrl() {
        Map<String, Camera> cameras = mapper.fromSnapshot(Map.of(
                "ftp", Map.of("url", "ftp://cam.local/x"),
                "blank", Map.of("url", ""),
                "ok", Map.of("url", "rtsps://cam.local/ok")
        ));

        assertThat(cameras).containsOnlyKeys("ok");
    }

    @Test
    void unknownFrequencyShouldMapToNull() {
        Camera camera = mapper.fromMap("odd", Map.of(
                "url", "rtsp://cam.local/odd",
                "schedules", List.of(Map.of("name", "weekly", "frequency", "weekly"))
        ));

        assertThat(camera.schedules().get(0).frequency()).isNull();
    }

    @Test
    void malformedWindowShouldSkipOnlyThatCamera() {
        Map<String, Camera> cameras = mapper.fromSnapshot(Map.of(
                "bad", Map.of("url", "rtsp://cam.local/bad",
                        "schedules", List.of(Map.of("time_window", Map.of("start", "25:99")))),
                "good", Map.of("url", "rtsp://cam.local/good")
        ));

        assertThat(cameras).containsOnlyKeys("good");
    }
}
