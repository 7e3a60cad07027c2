package com.xgraph.server.data.events;

import java.util.Objects;

/**
 * A time-stamped text marker on a recording.
 */
public final class Event {
    private final double timestamp;
    private final String text;

    public Event(double timestamp, String text) {
        if (Double.isNaN(timestamp)) {
            throw new IllegalArgumentException("Event timestamp must be a number");
        }
        this.timestamp = timestamp;
        this.text = text != null ? text : "";
    }

    /** Seconds from the start of the recording. */
    public double getTimestamp() {
        return timestamp;
    }

    public String getText() {
        return text;
    }

    /** First line of the text, used as a short label. */
    public String label() {
        String trimmed = text.strip();
        int nl = trimmed.indexOf('\n');
        return (nl >= 0 ? trimmed.substring(0, nl) : trimmed).strip();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Event))
            return false;
        Event event = (Event) o;
        return Double.compare(event.timestamp, timestamp) == 0 && text.equals(event.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, text);
    }

    @Override
    public String toString() {
        return "Event{t=" + timestamp + ", '" + label() + "'}";
    }
}
