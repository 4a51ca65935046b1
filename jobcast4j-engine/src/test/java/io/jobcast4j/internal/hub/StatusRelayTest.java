package io.jobcast4j.internal.hub;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.jobcast4j.core.JobRegistry;
import io.jobcast4j.core.Schedule;
import io.jobcast4j.core.TaskHandle;
import io.jobcast4j.core.event.JobFinishedError;
import io.jobcast4j.core.event.JobFinishedOk;
import io.jobcast4j.core.event.JobStarted;
import io.jobcast4j.core.event.JobStopped;
import io.jobcast4j.core.event.StatusEventChannel;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static io.jobcast4j.internal.hub.BroadcastHubTest.props;
import static io.jobcast4j.internal.hub.BroadcastHubTest.waitUntil;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StatusRelayTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final Instant now = Instant.parse("2024-05-01T10:00:00Z");

    private StatusEventChannel channel;
    private BroadcastHub hub;
    private RecordingConnection viewer;
    private JobRegistry registry;
    private StatusRelay relay;

    @Mock
    private StatusCodec failingCodec;

    @Mock
    private BroadcastHub mockHub;

    @BeforeEach
    void setUp() {
        channel = new StatusEventChannel();
        hub = new BroadcastHub(props(Duration.ofHours(1), Duration.ofHours(1)));
        hub.start();
        viewer = new RecordingConnection("v");
        hub.register(viewer);
        registry = new JobRegistry();
        registry.replace(bindings("s1", "s2", "a", "b"));
        relay = new StatusRelay(channel, hub, new StatusCodec(mapper), registry);
    }

    @AfterEach
    void tearDown() {
        relay.stop();
        hub.stop();
    }

    @Test
    void errorEventShouldBroadcastErrorTable() throws Exception {
        relay.relay(new JobFinishedOk("s2", now));
        relay.relay(new JobFinishedError("s2", "disk full", now));

        assertThat(waitUntil(5, TimeUnit.SECONDS, () -> viewer.received().size() == 2)).isTrue();
        assertThat(mapper.readTree(viewer.received().get(0)))
                .isEqualTo(mapper.readTree("[{\"id\":\"s2\",\"out\":\"{\\\"running\\\":false}\",\"err\":\"\"}]"));
        assertThat(mapper.readTree(viewer.received().get(1)))
                .isEqualTo(mapper.readTree("[{\"id\":\"s2\",\"out\":\"\",\"err\":\"disk full\"}]"));
    }

    @Test
    void repeatedEventsForSameIdShouldCoalesce() throws Exception {
        relay.relay(new JobStarted("a", now));
        relay.relay(new JobStarted("b", now));
        relay.relay(new JobFinishedOk("a", now));

        assertThat(waitUntil(5, TimeUnit.SECONDS, () -> viewer.received().size() == 3)).isTrue();
        JsonNode table = mapper.readTree(viewer.last());
        assertThat(table).hasSize(2);
        assertThat(table.get(0).get("id").asText()).isEqualTo("a");
        assertThat(mapper.readTree(table.get(0).get("out").asText()).get("running").asBoolean()).isFalse();
        assertThat(table.get(1).get("id").asText()).isEqualTo("b");
        assertThat(mapper.readTree(table.get(1).get("out").asText()).get("running").asBoolean()).isTrue();
    }

    @Test
    void stopEventShouldReportNotRunning() throws Exception {
        relay.relay(new JobStarted("s1", now));
        relay.relay(new JobStopped("s1", now));

        assertThat(waitUntil(5, TimeUnit.SECONDS, () -> viewer.received().size() == 2)).isTrue();
        JsonNode row = mapper.readTree(viewer.last()).get(0);
        assertThat(mapper.readTree(row.get("out").asText()).get("running").asBoolean()).isFalse();
        assertThat(row.get("err").asText()).isEmpty();
    }

    @Test
    void emptyErrorShouldBeFilteredFromTable() throws Exception {
        relay.relay(new JobFinishedError("s1", "", now));

        assertThat(waitUntil(5, TimeUnit.SECONDS, () -> viewer.received().size() == 1)).isTrue();
        assertThat(mapper.readTree(viewer.last())).isEmpty();
    }

    @Test
    void startedRelayShouldForwardPublishedEvents() throws Exception {
        relay.start();

        channel.publish(new JobStarted("s1", now));

        assertThat(waitUntil(5, TimeUnit.SECONDS, () -> viewer.last() != null)).isTrue();
        JsonNode row = mapper.readTree(viewer.last()).get(0);
        assertThat(row.get("id").asText()).isEqualTo("s1");
        assertThat(mapper.readTree(row.get("out").asText()).get("running").asBoolean()).isTrue();
    }

    @Test
    void marshalFailureShouldSkipBroadcast() throws Exception {
        when(failingCodec.payload(any())).thenThrow(new JsonProcessingException("boom") {
        });
        StatusRelay failing = new StatusRelay(channel, mockHub, failingCodec, registry);

        failing.relay(new JobStarted("s1", now));

        verify(mockHub, never()).broadcast(any());
    }

    @Test
    void idsRemovedByRebuildShouldDropOutOfTable() throws Exception {
        relay.relay(new JobFinishedError("s1", "disk full", now));
        relay.relay(new JobFinishedError("s2", "repository locked", now));

        registry.replace(bindings("s2"));
        relay.relay(new JobFinishedError("s2", "disk full", now));

        assertThat(waitUntil(5, TimeUnit.SECONDS, () -> viewer.received().size() == 3)).isTrue();
        assertThat(mapper.readTree(viewer.last()))
                .isEqualTo(mapper.readTree("[{\"id\":\"s2\",\"out\":\"\",\"err\":\"disk full\"}]"));
    }

    @Test
    void eventForIdOutsideGenerationShouldNotBeBroadcastAsRow() throws Exception {
        relay.relay(new JobStarted("gone", now));

        assertThat(waitUntil(5, TimeUnit.SECONDS, () -> viewer.received().size() == 1)).isTrue();
        assertThat(mapper.readTree(viewer.last())).isEmpty();
    }

    private static List<JobRegistry.Binding> bindings(String... ids) {
        List<JobRegistry.Binding> out = new ArrayList<>();
        for (String id : ids) {
            out.add(new JobRegistry.Binding(new Schedule(id, "*/5 * * * *", "home", "nas", null), new IdleTask()));
        }
        return out;
    }

    private static final class IdleTask implements TaskHandle {
        @Override
        public boolean runNow(Runnable onAccepted) {
            return false;
        }

        @Override
        public void retire() {
        }

        @Override
        public boolean isExecuting() {
            return false;
        }
    }
}
