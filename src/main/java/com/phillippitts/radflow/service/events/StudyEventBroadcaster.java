package com.phillippitts.radflow.service.events;

import com.phillippitts.radflow.service.metrics.OrchestrationMetrics;
import com.phillippitts.radflow.service.study.event.CaseTerminatedEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONObject;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Formats terminal case notifications as {@code study_event} JSON messages and keeps the most
 * recent ones for consumers that poll.
 *
 * <p>Message shape:
 * <pre>{"type":"study_event","eventType":"signed","accession":"A1","hasCritical":false,"timestamp":"..."}</pre>
 */
@Component
public class StudyEventBroadcaster {

    private static final Logger LOG = LogManager.getLogger(StudyEventBroadcaster.class);
    static final int MAX_RECENT = 50;

    private final OrchestrationMetrics metrics;
    private final Deque<JSONObject> recent = new ArrayDeque<>();

    public StudyEventBroadcaster(OrchestrationMetrics metrics) {
        this.metrics = metrics;
    }

    @EventListener
    public void onCaseTerminated(CaseTerminatedEvent e) {
        JSONObject message = new JSONObject()
                .put("type", "study_event")
                .put("eventType", e.outcome().wireName())
                .put("accession", e.accession())
                .put("hasCritical", e.hasCriticalNote())
                .put("timestamp", e.at().toString());
        synchronized (recent) {
            recent.addLast(message);
            while (recent.size() > MAX_RECENT) {
                recent.removeFirst();
            }
        }
        metrics.incrementTerminal(e.outcome());
        LOG.info("Study event: {}", message);
    }

    /** @return recent messages, oldest first */
    public List<String> recent() {
        synchronized (recent) {
            List<String> out = new ArrayList<>(recent.size());
            recent.forEach(m -> out.add(m.toString()));
            return out;
        }
    }

    /** @return recent messages as one JSON array, oldest first */
    public String recentAsJson() {
        synchronized (recent) {
            JSONArray array = new JSONArray();
            recent.forEach(array::put);
            return array.toString();
        }
    }
}
