package io.jobcast4j.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.jobcast4j.BackupExecutor;
import io.jobcast4j.JobScheduler;
import io.jobcast4j.core.JobRegistry;
import io.jobcast4j.core.event.StatusEventChannel;
import io.jobcast4j.internal.TimerJobScheduler;
import io.jobcast4j.internal.hub.BroadcastHub;
import io.jobcast4j.internal.hub.StatusCodec;
import io.jobcast4j.internal.hub.StatusRelay;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Spring Boot auto-configuration entrypoint for the scheduler and status broadcast.
 */
@AutoConfiguration(after = JacksonAutoConfiguration.class)
@ConditionalOnClass(JobScheduler.class)
@EnableConfigurationProperties(JobcastProperties.class)
@ConditionalOnProperty(prefix = "jobcast", name = "enabled", havingValue = "true", matchIfMissing = true)
public class JobcastAutoConfiguration {
    private static final Logger log = LoggerFactory.getLogger(JobcastAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    public JobRegistry jobRegistry() {
        return new JobRegistry();
    }

    @Bean
    @ConditionalOnMissingBean
    public StatusEventChannel statusEventChannel() {
        return new StatusEventChannel();
    }

    /**
     * Fallback used when the application defines no executor: every run fails with a clear error.
     */
    @Bean
    @ConditionalOnMissingBean
    public BackupExecutor backupExecutor() {
        log.warn("No BackupExecutor bean defined; scheduled jobs will fail until one is provided");
        return (schedule, cancellation) -> {
            throw new IllegalStateException("No BackupExecutor configured for schedule " + schedule.id());
        };
    }

    @Bean
    @ConditionalOnMissingBean
    public JobScheduler jobScheduler(JobcastProperties props, BackupExecutor executor, JobRegistry registry, StatusEventChannel channel) {
        return new TimerJobScheduler(props, executor, registry, channel);
    }

    @Bean
    @ConditionalOnMissingBean
    public StatusCodec statusCodec(ObjectProvider<ObjectMapper> objectMapper) {
        return new StatusCodec(objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public BroadcastHub broadcastHub(JobcastProperties props) {
        return new BroadcastHub(props);
    }

    @Bean
    @ConditionalOnMissingBean
    public StatusRelay statusRelay(StatusEventChannel channel, BroadcastHub hub, StatusCodec codec, JobRegistry registry) {
        return new StatusRelay(channel, hub, codec, registry);
    }

    @Bean
    @ConditionalOnMissingBean
    public JobcastLifecycle jobcastLifecycle(JobScheduler scheduler, BroadcastHub hub, StatusRelay relay, JobcastProperties props) {
        return new JobcastLifecycle(scheduler, hub, relay, props);
    }
}
