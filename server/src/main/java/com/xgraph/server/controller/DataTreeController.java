package com.xgraph.server.controller;

import com.xgraph.server.data.DataTreeException;
import com.xgraph.server.data.NodeNotFoundException;
import com.xgraph.server.data.events.Event;
import com.xgraph.server.data.slice.Slice;
import com.xgraph.server.data.slice.SliceSelection;
import com.xgraph.server.data.tree.TreeIndexEntry;
import com.xgraph.server.data.tree.VisibilityConfig;
import com.xgraph.server.fit.FitResult;
import com.xgraph.server.fit.FitSpec;
import com.xgraph.server.fit.ParameterSpec;
import com.xgraph.server.measure.MeasureType;
import com.xgraph.server.measure.Measurement;
import com.xgraph.server.service.DataTreeService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

@RestController
public class DataTreeController {

    private static final Logger logger = LoggerFactory.getLogger(DataTreeController.class);
    private final DataTreeService service;

    public DataTreeController(DataTreeService service) {
        this.service = service;
    }

    public static class SliceRequest {
        public String path;
        public String variable;
        public String xDim;
        public Map<String, Integer> fixed;
        public String xUnits;
        public String yUnits;

        SliceSelection toSelection() {
            if (path == null || variable == null || xDim == null) {
                throw new IllegalArgumentException("path, variable and xDim are required");
            }
            return new SliceSelection(path, variable, xDim, fixed == null ? Map.of() : fixed, xUnits, yUnits);
        }
    }

    public static class ParameterRequest {
        public String name;
        public double value;
        public boolean fixed;
        public Double min;
        public Double max;
    }

    public static class FitRequest {
        public SliceRequest slice;
        public String model;
        public Double xMin;
        public Double xMax;
        // Optional: registered defaults are used for parameters not listed here
        public List<ParameterRequest> parameters;
    }

    public static class MeasureRequest {
        public SliceRequest slice;
        public String type;
        public Double xMin;
        public Double xMax;
        public int plusMinusSamples;
    }

    public static class EventRequest {
        public String path;
        public double time;
        public String text;
    }

    public static class EntryView {
        public String path;
        public String name;
        public int depth;
        public List<String> dataVars;
        public List<String> ownCoords;
        public List<String> inheritedCoords;
        public List<String> children;
        public List<String> rows;
        public String details;

        static EntryView of(TreeIndexEntry e) {
            EntryView v = new EntryView();
            v.path = e.getPath();
            v.name = e.getName();
            v.depth = e.getDepth();
            v.dataVars = e.getDataVars();
            v.ownCoords = e.getOwnCoords();
            v.inheritedCoords = e.getInheritedCoords();
            v.children = e.getChildPaths();
            v.rows = e.rowNames();
            v.details = e.details();
            return v;
        }
    }

    public static class SliceView {
        public double[] x;
        public double[] y;
        public String xUnits;
        public String yUnits;

        static SliceView of(Slice s) {
            SliceView v = new SliceView();
            v.x = s.getX();
            v.y = s.getY();
            v.xUnits = s.getXUnits();
            v.yUnits = s.getYUnits();
            return v;
        }
    }

    public static class FitView {
        public String model;
        public Map<String, Double> parameters;
        public double[] standardErrors;
        public double[] x;
        public double[] fitted;
        public double[] residuals;
        public boolean converged;
        public String message;
        public double rms;

        static FitView of(FitResult r) {
            FitView v = new FitView();
            v.model = r.getModel();
            v.parameters = r.parameterMap();
            v.standardErrors = r.getStandardErrors();
            v.x = r.getX();
            v.fitted = r.getFitted();
            v.residuals = r.getResiduals();
            v.converged = r.isConverged();
            v.message = r.getMessage();
            v.rms = r.getRms();
            return v;
        }
    }

    @GetMapping("/tree/index")
    public ResponseEntity<?> index(@RequestParam(required = false) Boolean showDataVars,
            @RequestParam(required = false) Boolean showOwnCoords,
            @RequestParam(required = false) Boolean showInheritedCoords) {
        VisibilityConfig visibility = service.getConfig().visibility.copy();
        if (showDataVars != null) {
            visibility.showDataVars = showDataVars;
        }
        if (showOwnCoords != null) {
            visibility.showOwnCoords = showOwnCoords;
        }
        if (showInheritedCoords != null) {
            visibility.showInheritedCoords = showInheritedCoords;
        }
        List<EntryView> out = new ArrayList<>();
        for (TreeIndexEntry e : service.index(visibility).entries()) {
            out.add(EntryView.of(e));
        }
        return ResponseEntity.ok(out);
    }

    @GetMapping("/tree/lookup")
    public ResponseEntity<?> lookup(@RequestParam String path) {
        return service.lookup(path)
                .<ResponseEntity<?>>map(e -> ResponseEntity.ok(EntryView.of(e)))
                .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND).body("No node at path " + path));
    }

    @PostMapping("/slice")
    public ResponseEntity<?> slice(@RequestBody SliceRequest request) {
        return ResponseEntity.ok(SliceView.of(service.slice(request.toSelection())));
    }

    @GetMapping("/events")
    public ResponseEntity<?> events(@RequestParam String path, @RequestParam(required = false) Double tMin,
            @RequestParam(required = false) Double tMax) {
        if (tMin == null && tMax == null) {
            return ResponseEntity.ok(service.events(path));
        }
        double lo = tMin != null ? tMin : Double.NEGATIVE_INFINITY;
        double hi = tMax != null ? tMax : Double.POSITIVE_INFINITY;
        return ResponseEntity.ok(service.eventsInRange(path, lo, hi));
    }

    @PostMapping("/events")
    public ResponseEntity<?> addEvent(@RequestBody EventRequest request) {
        service.addEvent(request.path, new Event(request.time, request.text));
        return ResponseEntity.ok(service.events(request.path));
    }

    @DeleteMapping("/events")
    public ResponseEntity<?> removeEvent(@RequestBody EventRequest request) {
        if (!service.removeEvent(request.path, new Event(request.time, request.text))) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND).body("No such event on " + request.path);
        }
        return ResponseEntity.ok(service.events(request.path));
    }

    @PostMapping("/fit")
    public ResponseEntity<?> fit(@RequestBody FitRequest request) {
        if (request.slice == null || request.model == null) {
            return ResponseEntity.badRequest().body("slice and model are required");
        }
        double xMin = request.xMin != null ? request.xMin : Double.NEGATIVE_INFINITY;
        double xMax = request.xMax != null ? request.xMax : Double.POSITIVE_INFINITY;
        FitSpec spec = FitSpec.fromDefaults(service.getModels(), request.model, xMin, xMax);
        if (request.parameters != null) {
            for (ParameterRequest p : request.parameters) {
                ParameterSpec base = spec.parameter(p.name);
                if (base == null) {
                    return ResponseEntity.badRequest().body("Model " + request.model + " has no parameter " + p.name);
                }
                double min = p.min != null ? p.min : base.getMin();
                double max = p.max != null ? p.max : base.getMax();
                spec = spec.withParameter(new ParameterSpec(p.name, p.value, p.fixed, min, max));
            }
        }
        logger.info("Fitting {} to {}:{}", request.model, request.slice.path, request.slice.variable);
        return ResponseEntity.ok(FitView.of(service.fit(request.slice.toSelection(), spec)));
    }

    @PostMapping("/measure")
    public ResponseEntity<?> measure(@RequestBody MeasureRequest request) {
        if (request.slice == null || request.type == null) {
            return ResponseEntity.badRequest().body("slice and type are required");
        }
        MeasureType type = MeasureType.valueOf(request.type.toUpperCase(Locale.ROOT));
        double xMin = request.xMin != null ? request.xMin : Double.NEGATIVE_INFINITY;
        double xMax = request.xMax != null ? request.xMax : Double.POSITIVE_INFINITY;
        Measurement m = service.measure(request.slice.toSelection(), type, xMin, xMax, request.plusMinusSamples);
        return ResponseEntity.ok(m);
    }

    @ExceptionHandler(NodeNotFoundException.class)
    public ResponseEntity<String> handleNotFound(NodeNotFoundException e) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(e.getMessage());
    }

    @ExceptionHandler({ DataTreeException.class, IllegalArgumentException.class })
    public ResponseEntity<String> handleBadRequest(RuntimeException e) {
        logger.info("Rejected request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(e.getMessage());
    }
}
