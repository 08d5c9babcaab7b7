package io.casetime.api;

import io.casetime.core.EntityKind;
import io.casetime.core.FactId;
import io.casetime.core.Granularity;
import io.casetime.core.TemporalFact;
import io.casetime.engine.SegmentStrategy;
import io.casetime.engine.Timeline;
import io.casetime.engine.TimelineService;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api")
public class TimelineController {
    private final TimelineService timelines;
    public TimelineController(TimelineService timelines){ this.timelines = timelines; }

    record TimeframeReq(Instant start, Instant end, String scope, String kind){}
    record RelationReq(String from, String to, String type){}
    record EnhanceReq(String scope, String entityId, Instant time, Integer durationMinutes,
                      Boolean decision, String granularity){}

    @GetMapping("/timeline/{scope}")
    public ResponseEntity<Timeline> timeline(@PathVariable("scope") String scope) {
        return ResponseEntity.ok(timelines.buildTimeline(scope));
    }

    @GetMapping(value = "/temporal_context/{scope}", produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> context(@PathVariable("scope") String scope,
                                          @RequestParam(name = "confidence", required = false) String confidence,
                                          @RequestParam(name = "causal", required = false) String causal) {
        return ResponseEntity.ok(timelines.getContext(scope, flag(confidence), flag(causal)));
    }

    @PostMapping("/events_in_timeframe")
    public ResponseEntity<List<FactView>> inTimeframe(@RequestBody TimeframeReq req) {
        if (req.start() == null || req.end() == null || req.scope() == null || req.scope().isBlank()) {
            throw new IllegalArgumentException("start, end and scope are required");
        }
        var kind = (req.kind() == null || req.kind().isBlank()) ? null : EntityKind.parse(req.kind());
        return ResponseEntity.ok(views(timelines.findInTimeframe(req.scope(), req.start(), req.end(), kind)));
    }

    @GetMapping("/temporal_sequence/{scope}")
    public ResponseEntity<List<FactView>> sequence(@PathVariable("scope") String scope,
                                                   @RequestParam(name = "kind", required = false) String kind,
                                                   @RequestParam(name = "limit", required = false) Integer limit) {
        var k = (kind == null || kind.isBlank()) ? null : EntityKind.parse(kind);
        return ResponseEntity.ok(views(timelines.findSequence(scope, k, limit)));
    }

    @GetMapping("/temporal_relation/{factId}")
    public ResponseEntity<List<FactView>> related(@PathVariable("factId") String factId,
                                                  @RequestParam(name = "relation_type") String relationType) {
        return ResponseEntity.ok(views(timelines.findRelated(FactId.parse(factId), relationType)));
    }

    @PostMapping("/create_temporal_relation")
    public ResponseEntity<Map<String, Object>> createRelation(@RequestBody RelationReq req) {
        if (req.from() == null || req.to() == null || req.type() == null) {
            throw new IllegalArgumentException("from, to and type are required");
        }
        timelines.createRelation(FactId.parse(req.from()), FactId.parse(req.to()), req.type());
        return ResponseEntity.ok(Map.of("success", true));
    }

    @PostMapping("/enhance_event")
    public ResponseEntity<FactView> enhanceEvent(@RequestBody EnhanceReq req) {
        requireTarget(req);
        var fact = timelines.enhanceEvent(req.scope(), req.entityId(), req.time(),
                req.durationMinutes(), Granularity.parse(req.granularity()));
        return ResponseEntity.ok(FactView.of(fact));
    }

    @PostMapping("/enhance_action")
    public ResponseEntity<FactView> enhanceAction(@RequestBody EnhanceReq req) {
        requireTarget(req);
        var fact = timelines.enhanceAction(req.scope(), req.entityId(), req.time(),
                req.durationMinutes(), Boolean.TRUE.equals(req.decision()), Granularity.parse(req.granularity()));
        return ResponseEntity.ok(FactView.of(fact));
    }

    @PostMapping("/infer_relations/{scope}")
    public ResponseEntity<Map<String, Object>> infer(@PathVariable("scope") String scope) {
        return ResponseEntity.ok(Map.of("inferred", timelines.inferRelations(scope).size()));
    }

    @PostMapping("/timeline_order/{scope}")
    public ResponseEntity<Map<String, Integer>> reorder(@PathVariable("scope") String scope) {
        var out = new LinkedHashMap<String, Integer>();
        timelines.recomputeTimelineOrder(scope).forEach((id, order) -> out.put(id.toString(), order));
        return ResponseEntity.ok(out);
    }

    @GetMapping("/segments/{scope}")
    public ResponseEntity<Map<String, List<FactView>>> segments(
            @PathVariable("scope") String scope,
            @RequestParam(name = "strategy", required = false) String strategy,
            @RequestParam(name = "threshold_seconds", required = false) Long thresholdSeconds) {
        var gap = thresholdSeconds == null ? null : Duration.ofSeconds(thresholdSeconds);
        var out = new LinkedHashMap<String, List<FactView>>();
        timelines.group(scope, SegmentStrategy.parse(strategy), gap)
                .forEach((key, facts) -> out.put(key, views(facts)));
        return ResponseEntity.ok(out);
    }

    @DeleteMapping("/scope/{scope}")
    public ResponseEntity<Map<String, Object>> deleteScope(@PathVariable("scope") String scope) {
        return ResponseEntity.ok(Map.of("deleted", timelines.deleteScope(scope)));
    }

    /** A bare {@code ?confidence} switches the flag on; only "false" or "0" switch it off. */
    private static boolean flag(String v) {
        return v != null && !v.equalsIgnoreCase("false") && !v.equals("0");
    }

    private static void requireTarget(EnhanceReq req) {
        if (req.scope() == null || req.scope().isBlank() || req.entityId() == null || req.entityId().isBlank()
                || req.time() == null) {
            throw new IllegalArgumentException("scope, entityId and time are required");
        }
    }

    private static List<FactView> views(List<TemporalFact> facts) {
        return facts.stream().map(FactView::of).toList();
    }
}
