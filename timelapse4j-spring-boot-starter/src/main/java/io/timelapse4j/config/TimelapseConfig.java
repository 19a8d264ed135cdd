package io.timelapse4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.timelapse4j.CameraSource;
import io.timelapse4j.CaptureAction;
import io.timelapse4j.CaptureScheduler;
import io.timelapse4j.internal.CaptureExecutor;
import io.timelapse4j.internal.engine.DefaultCaptureScheduler;
import io.timelapse4j.utils.CameraMapper;
import io.timelapse4j.utils.TriggerCompiler;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

import java.time.Clock;

/**
 * Spring Boot auto-configuration entrypoint for timelapse capture scheduling.
 *
 * <p>Activates once the application provides a {@link CaptureAction} bean. A {@link CameraSource}
 * bean, when present, supplies the cameras loaded at startup.
 */
@AutoConfiguration
@ConditionalOnClass(CaptureScheduler.class)
@ConditionalOnBean(CaptureAction.class)
@EnableConfigurationProperties(SchedulerProperties.class)
@ConditionalOnProperty(prefix = "timelapse", name = "enabled", havingValue = "true", matchIfMissing = true)
public class TimelapseConfig {

    @Bean
    @ConditionalOnMissingBean
    public TriggerCompiler triggerCompiler(SchedulerProperties props) {
        return new TriggerCompiler(props.zoneId());
    }

    @Bean
    @ConditionalOnMissingBean
    public CaptureExecutor captureExecutor(CaptureAction action) {
        return new CaptureExecutor(action);
    }

    @Bean
    @ConditionalOnMissingBean
    public CameraMapper cameraMapper(ObjectProvider<ObjectMapper> objectMapper) {
        return new CameraMapper(objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public CaptureScheduler captureScheduler(SchedulerProperties props, TriggerCompiler compiler, CaptureExecutor executor) {
        return new DefaultCaptureScheduler(props, compiler, executor, Clock.system(compiler.zone()));
    }

    @Bean
    @ConditionalOnMissingBean
    public TimelapseLifecycle timelapseLifecycle(CaptureScheduler scheduler, ObjectProvider<CameraSource> cameraSource) {
        return new TimelapseLifecycle(scheduler, cameraSource.getIfAvailable());
    }
}
