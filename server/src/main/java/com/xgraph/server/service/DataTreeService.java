package com.xgraph.server.service;

import com.xgraph.server.data.DataForest;
import com.xgraph.server.data.DataNode;
import com.xgraph.server.data.ForestLoader;
import com.xgraph.server.data.RecordingAssembler;
import com.xgraph.server.data.NodeNotFoundException;
import com.xgraph.server.data.events.Event;
import com.xgraph.server.data.events.EventOverlay;
import com.xgraph.server.data.slice.Slice;
import com.xgraph.server.data.slice.SliceExtractor;
import com.xgraph.server.data.slice.SliceSelection;
import com.xgraph.server.data.tree.TreeIndex;
import com.xgraph.server.data.tree.TreeIndexEntry;
import com.xgraph.server.data.tree.VisibilityConfig;
import com.xgraph.server.fit.FitEngine;
import com.xgraph.server.fit.FitResult;
import com.xgraph.server.fit.FitSpec;
import com.xgraph.server.fit.ModelRegistry;
import com.xgraph.server.measure.MeasureType;
import com.xgraph.server.measure.Measurement;
import com.xgraph.server.measure.SliceMeasurer;
import com.xgraph.server.util.DataPathResolver;
import com.xgraph.units.UnitRegistry;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Owns the forest and its event overlay and serializes every access to them. Fits run
 * outside the lock on a slice snapshot.
 */
@Service
public class DataTreeService {

    private static final Logger logger = LoggerFactory.getLogger(DataTreeService.class);

    private final XGraphConfig config;
    private final DataForest forest = new DataForest();
    private final EventOverlay overlay = new EventOverlay();
    private final UnitRegistry units = new UnitRegistry();
    private final ModelRegistry models = ModelRegistry.withBuiltins();
    private final SliceExtractor extractor;
    private final FitEngine fitEngine;
    private final SliceMeasurer measurer = new SliceMeasurer();

    private TreeIndex cachedIndex;

    @Autowired
    public DataTreeService() {
        this(XGraphConfig.load());
    }

    public DataTreeService(XGraphConfig config) {
        this.config = config;
        this.extractor = new SliceExtractor(forest, units);
        this.fitEngine = new FitEngine(models, config.fit);
    }

    @PostConstruct
    public void init() {
        String dataFile = DataPathResolver.resolveDataFile(config.dataDirectory, config.dataFile);
        if (dataFile == null) {
            logger.info("No data file configured; starting with an empty forest");
            return;
        }
        Path path = Paths.get(dataFile);
        if (!Files.exists(path)) {
            logger.warn("Configured data file {} does not exist; starting with an empty forest", path);
            return;
        }
        synchronized (this) {
            new ForestLoader().load(path, forest, overlay);
        }
    }

    public XGraphConfig getConfig() {
        return config;
    }

    public ModelRegistry getModels() {
        return models;
    }

    public UnitRegistry getUnits() {
        return units;
    }

    public synchronized void loadForest(InputStream json) {
        new ForestLoader().load(json, forest, overlay);
    }

    public synchronized DataNode addRecording(String parentPath, String name, RecordingAssembler.Recording rec) {
        DataNode parent = parentPath == null ? null : requireNode(parentPath);
        return new RecordingAssembler().assemble(forest, parent, name, rec, overlay);
    }

    public synchronized TreeIndex index() {
        return index(config.visibility);
    }

    /** The cached index when neither the forest nor the visibility settings changed since it was built. */
    public synchronized TreeIndex index(VisibilityConfig visibility) {
        if (cachedIndex == null || cachedIndex.getForestRevision() != forest.revision()
                || !cachedIndex.getVisibility().equals(visibility)) {
            cachedIndex = TreeIndex.build(forest, visibility);
        }
        return cachedIndex;
    }

    public synchronized Optional<TreeIndexEntry> lookup(String path) {
        return index().lookup(path);
    }

    public synchronized Optional<DataNode> findNode(String path) {
        return forest.resolve(path);
    }

    public synchronized Slice slice(SliceSelection selection) {
        return extractor.extract(selection);
    }

    public FitResult fit(SliceSelection selection, FitSpec spec) {
        Slice slice = slice(selection);
        return fitEngine.fit(slice, spec);
    }

    public Measurement measure(SliceSelection selection, MeasureType type, double xMin, double xMax,
            int plusMinusSamples) {
        Slice slice = slice(selection);
        return measurer.measure(slice, type, xMin, xMax, plusMinusSamples);
    }

    public synchronized List<Event> events(String path) {
        return overlay.events(requireNode(path));
    }

    public synchronized List<Event> eventsInRange(String path, double tMin, double tMax) {
        return overlay.eventsInRange(requireNode(path), tMin, tMax);
    }

    public synchronized void addEvent(String path, Event event) {
        overlay.addEvent(requireNode(path), event);
    }

    public synchronized boolean removeEvent(String path, Event event) {
        return overlay.removeEvent(requireNode(path), event);
    }

    public synchronized void renameNode(String path, String newName) {
        forest.renameNode(requireNode(path), newName);
    }

    public synchronized void moveNode(String path, String newParentPath, int row) {
        DataNode newParent = newParentPath == null ? null : requireNode(newParentPath);
        forest.moveNode(requireNode(path), newParent, row);
    }

    /** Removes the node's subtree together with the events attached to it. */
    public synchronized void removeNode(String path) {
        DataNode node = requireNode(path);
        List<DataNode> subtree = new ArrayList<>();
        Deque<DataNode> stack = new ArrayDeque<>();
        stack.push(node);
        while (!stack.isEmpty()) {
            DataNode n = stack.pop();
            subtree.add(n);
            n.getChildren().forEach(stack::push);
        }
        forest.removeNode(node);
        for (DataNode n : subtree) {
            overlay.clear(n);
        }
    }

    private DataNode requireNode(String path) {
        return forest.resolve(path).orElseThrow(() -> new NodeNotFoundException(path));
    }
}
