package io.jobcast4j.config;

import io.jobcast4j.JobScheduler;
import io.jobcast4j.internal.hub.BroadcastHub;
import io.jobcast4j.web.ScheduleController;
import io.jobcast4j.web.StatusWebSocketHandler;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnWebApplication;
import org.springframework.context.annotation.Bean;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;

/**
 * Status WebSocket channel and trigger endpoints, for servlet web applications only.
 */
@AutoConfiguration(after = JobcastAutoConfiguration.class)
@ConditionalOnWebApplication(type = ConditionalOnWebApplication.Type.SERVLET)
@ConditionalOnClass(WebSocketConfigurer.class)
@ConditionalOnBean({JobScheduler.class, BroadcastHub.class})
@EnableWebSocket
public class JobcastWebConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public StatusWebSocketHandler statusWebSocketHandler(BroadcastHub hub) {
        return new StatusWebSocketHandler(hub);
    }

    @Bean
    public WebSocketConfigurer jobcastWebSocketConfigurer(StatusWebSocketHandler handler, JobcastProperties props) {
        return registry -> registry.addHandler(handler, props.getWebsocketPath())
                .setAllowedOriginPatterns(props.getAllowedOrigins().toArray(String[]::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public ScheduleController scheduleController(JobScheduler scheduler) {
        return new ScheduleController(scheduler);
    }
}
