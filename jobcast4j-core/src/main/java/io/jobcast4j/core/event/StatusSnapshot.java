package io.jobcast4j.core.event;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Coalesced last-known status per job id, one table per channel.
 *
 * <p>Last write wins per id; first-seen order of ids is kept. Entries whose payload is empty or the
 * empty JSON object are left out of {@link #records(StatusChannel)}.
 * Not thread-safe: owned by a single consumer.
 */
public class StatusSnapshot {
    private static final String EMPTY_OBJECT = "{}";

    private final Map<String, String> outputs = new LinkedHashMap<>();
    private final Map<String, String> errors = new LinkedHashMap<>();

    /**
     * Record the latest payload for a job. Blank ids are ignored.
     */
    public void record(StatusChannel channel, String id, String payload) {
        if (id == null || id.isEmpty()) {
            return;
        }
        table(channel).put(id, payload == null ? "" : payload);
    }

    /**
     * Records of one channel, ready for serialization: output records carry an empty {@code err},
     * error records an empty {@code out}.
     */
    public List<StatusRecord> records(StatusChannel channel) {
        List<StatusRecord> out = new ArrayList<>();
        for (var e : table(channel).entrySet()) {
            String payload = e.getValue();
            if (payload.isEmpty() || EMPTY_OBJECT.equals(payload)) {
                continue;
            }
            out.add(channel == StatusChannel.ERROR
                    ? new StatusRecord(e.getKey(), "", payload)
                    : new StatusRecord(e.getKey(), payload, ""));
        }
        return out;
    }

    /**
     * Drop every id not in {@code ids} from both tables.
     */
    public void retain(Set<String> ids) {
        outputs.keySet().retainAll(ids);
        errors.keySet().retainAll(ids);
    }

    private Map<String, String> table(StatusChannel channel) {
        return channel == StatusChannel.ERROR ? errors : outputs;
    }
}
