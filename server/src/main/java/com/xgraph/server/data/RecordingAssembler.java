package com.xgraph.server.data;

import com.xgraph.server.data.events.Event;
import com.xgraph.server.data.events.EventOverlay;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds a node from an electrophysiology recording as exported by acquisition software:
 * one or more channels sampled at a fixed interval over one or more sweeps, plus
 * time-stamped comments.
 *
 * <p>Single-sweep channels become 1-D variables over {@code time}; multi-sweep channels
 * become {@code (sweep, time)} variables with a 1-based {@code sweep} coordinate.
 */
public class RecordingAssembler {

    public static final String TIME = "time";
    public static final String SWEEP = "sweep";

    public static class Channel {
        final double[][] sweeps;
        final String units;

        public Channel(double[][] sweeps, String units) {
            this.sweeps = sweeps;
            this.units = units;
        }

        public Channel(double[] trace, String units) {
            this(new double[][] { trace }, units);
        }
    }

    public static class Recording {
        final Map<String, Channel> channels = new LinkedHashMap<>();
        final List<Event> comments = new ArrayList<>();
        double sampleInterval = 1.0;
        double startTime = 0.0;
        String timeUnits = "s";
        String notes;

        public Recording sampleInterval(double seconds) {
            this.sampleInterval = seconds;
            return this;
        }

        public Recording startTime(double start) {
            this.startTime = start;
            return this;
        }

        public Recording timeUnits(String units) {
            this.timeUnits = units;
            return this;
        }

        public Recording channel(String name, Channel channel) {
            channels.put(name, channel);
            return this;
        }

        public Recording comment(double time, String text) {
            comments.add(new Event(time, text));
            return this;
        }

        public Recording notes(String text) {
            this.notes = text;
            return this;
        }
    }

    public DataNode assemble(DataForest forest, DataNode parent, String name, Recording rec, EventOverlay overlay) {
        if (rec.channels.isEmpty()) {
            throw new IllegalArgumentException("Recording " + name + " has no channels");
        }
        int nSweeps = -1;
        int nSamples = -1;
        for (Map.Entry<String, Channel> e : rec.channels.entrySet()) {
            double[][] sweeps = e.getValue().sweeps;
            if (sweeps == null || sweeps.length == 0) {
                throw new IllegalArgumentException("Channel " + e.getKey() + " has no sweeps");
            }
            int samples = sweeps[0].length;
            for (double[] s : sweeps) {
                if (s.length != samples) {
                    throw new IllegalArgumentException("Channel " + e.getKey() + " has sweeps of unequal length");
                }
            }
            if (nSweeps < 0) {
                nSweeps = sweeps.length;
                nSamples = samples;
            } else if (nSweeps != sweeps.length || nSamples != samples) {
                throw new IllegalArgumentException("Channel " + e.getKey() + " does not match the other channels");
            }
        }

        DataNode node = parent == null ? forest.addRoot(name) : forest.addChild(parent, name);

        double[] time = new double[nSamples];
        for (int i = 0; i < nSamples; i++) {
            time[i] = rec.startTime + i * rec.sampleInterval;
        }
        node.putCoordinate(new Coordinate(TIME, time, rec.timeUnits));
        boolean multiSweep = nSweeps > 1;
        if (multiSweep) {
            double[] sweepIds = new double[nSweeps];
            for (int s = 0; s < nSweeps; s++) {
                sweepIds[s] = s + 1;
            }
            node.putCoordinate(new Coordinate(SWEEP, sweepIds, null));
        }

        for (Map.Entry<String, Channel> e : rec.channels.entrySet()) {
            Channel ch = e.getValue();
            if (multiSweep) {
                node.putVariable(new Variable(e.getKey(), List.of(SWEEP, TIME), NdArray.of(ch.sweeps), ch.units));
            } else {
                node.putVariable(new Variable(e.getKey(), List.of(TIME), NdArray.of(ch.sweeps[0]), ch.units));
            }
        }
        for (Event c : rec.comments) {
            overlay.addEvent(node, c);
        }
        if (rec.notes != null) {
            node.getAttrs().put("notes", rec.notes);
        }
        forest.touch();
        return node;
    }
}
