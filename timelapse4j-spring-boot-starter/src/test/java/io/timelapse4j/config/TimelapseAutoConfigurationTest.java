package io.timelapse4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.timelapse4j.CameraSource;
import io.timelapse4j.CaptureAction;
import io.timelapse4j.CaptureScheduler;
import io.timelapse4j.core.Camera;
import io.timelapse4j.core.Schedule;
import io.timelapse4j.utils.CameraMapper;
import io.timelapse4j.utils.TriggerCompiler;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.nio.file.Path;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class TimelapseAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(TimelapseConfig.class))
            .withBean(ObjectMapper.class, ObjectMapper::new)
            .withPropertyValues(
                    "timelapse.process-every=200ms",
                    "timelapse.drain-timeout=2s",
                    "timelapse.worker-threads=2",
                    "timelapse.timezone=Asia/Taipei"
            );

    @Test
    void shouldAutoConfigureSchedulerBeans() {
        contextRunner
                .withBean(CaptureAction.class, () -> camera -> Path.of(camera.name() + ".jpg"))
                .run(context -> {
                    assertThat(context).hasSingleBean(CaptureScheduler.class);
                    assertThat(context).hasSingleBean(TimelapseLifecycle.class);
                    assertThat(context).hasSingleBean(SchedulerProperties.class);
                    assertThat(context).hasSingleBean(CameraMapper.class);
                    assertThat(context.getBean(TriggerCompiler.class).zone()).isEqualTo(ZoneId.of("Asia/Taipei"));
                    assertThat(context.getBean(CaptureScheduler.class).isRunning()).isTrue();
                });
    }

    @Test
    void shouldBackOffWithoutCaptureAction() {
        contextRunner.run(context -> assertThat(context).doesNotHaveBean(CaptureScheduler.class));
    }

    @Test
    void shouldBackOffWhenDisabled() {
        contextRunner
                .withBean(CaptureAction.class, () -> camera -> Path.of(camera.name() + ".jpg"))
                .withPropertyValues("timelapse.enabled=false")
                .run(context -> assertThat(context).doesNotHaveBean(CaptureScheduler.class));
    }

    @Test
    void lifecycleShouldLoadCamerasFromSource() {
        contextRunner
                .withBean(CaptureAction.class, () -> camera -> Path.of(camera.name() + ".jpg"))
                .withBean(CameraSource.class, () -> () -> Map.of("garden", new Camera(
                        "garden", "rtsp://cam.local/garden", true,
                        List.of(Schedule.perDay("daily", 2, null)), null)))
                .run(context -> {
                    CaptureScheduler scheduler = context.getBean(CaptureScheduler.class);
                    assertThat(scheduler.cameras()).containsOnlyKeys("garden");
                    assertThat(scheduler.nextRunTimes().get("garden")).hasSize(2);
                });
    }
}
