package com.xgraph.server.data.events;

import com.xgraph.server.data.DataNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-node event sequences kept sorted by timestamp. Events belong to exactly one node;
 * children do not see their parent's events.
 */
public class EventOverlay {

    private final Map<Integer, List<Event>> eventsByNode = new HashMap<>();

    /** Inserts after any events with the same timestamp, so ties keep insertion order. */
    public void addEvent(DataNode node, Event event) {
        List<Event> events = eventsByNode.computeIfAbsent(node.getId(), k -> new ArrayList<>());
        events.add(upperBound(events, event.getTimestamp()), event);
    }

    /** Removes the first event equal to {@code event}; returns false if there was none. */
    public boolean removeEvent(DataNode node, Event event) {
        List<Event> events = eventsByNode.get(node.getId());
        if (events == null) {
            return false;
        }
        boolean removed = events.remove(event);
        if (events.isEmpty()) {
            eventsByNode.remove(node.getId());
        }
        return removed;
    }

    /** Events with {@code tMin <= t <= tMax}, ascending. */
    public List<Event> eventsInRange(DataNode node, double tMin, double tMax) {
        List<Event> events = eventsByNode.get(node.getId());
        if (events == null || tMax < tMin) {
            return List.of();
        }
        int from = lowerBound(events, tMin);
        int to = upperBound(events, tMax);
        return Collections.unmodifiableList(new ArrayList<>(events.subList(from, to)));
    }

    public List<Event> events(DataNode node) {
        List<Event> events = eventsByNode.get(node.getId());
        return events == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(events));
    }

    public void clear(DataNode node) {
        eventsByNode.remove(node.getId());
    }

    public int count(DataNode node) {
        List<Event> events = eventsByNode.get(node.getId());
        return events == null ? 0 : events.size();
    }

    // first index with timestamp >= t
    private static int lowerBound(List<Event> events, double t) {
        int lo = 0;
        int hi = events.size();
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (events.get(mid).getTimestamp() < t) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }

    // first index with timestamp > t
    private static int upperBound(List<Event> events, double t) {
        int lo = 0;
        int hi = events.size();
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (events.get(mid).getTimestamp() <= t) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }
}
