package com.bitanalytics.api;

import com.bitanalytics.api.dto.BucketResponse;
import com.bitanalytics.api.dto.DeleteResponse;
import com.bitanalytics.api.dto.MarkEventRequest;
import com.bitanalytics.api.dto.MarkEventResponse;
import com.bitanalytics.bucket.EventBucket;
import com.bitanalytics.config.BitAnalyticsProperties;
import com.bitanalytics.service.EventRecorder;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

/**
 * 事件接口：标记事件、按粒度查询桶、全量删除。
 */
@RestController
@RequestMapping("/api/v1/events")
public class EventController {

    private final EventRecorder recorder;
    private final BitAnalyticsProperties properties;
    private final Clock clock;

    public EventController(EventRecorder recorder, BitAnalyticsProperties properties, Clock clock) {
        this.recorder = recorder;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * 标记事件（月 / 周 / 日，可选小时）。
     */
    @PostMapping("/mark")
    public ResponseEntity<MarkEventResponse> mark(@Valid @RequestBody MarkEventRequest req) {
        Instant ts = req.getTimestamp() != null ? req.getTimestamp() : clock.instant();
        boolean hourly = req.getTrackHourly() != null ? req.getTrackHourly() : properties.isTrackHourly();
        List<String> keys = recorder.markEvent(req.getEvent(), req.getIdentifier(), ts, hourly);
        return ResponseEntity.ok(new MarkEventResponse(req.getEvent(), req.getIdentifier(), keys));
    }

    @GetMapping("/{event}/month/{year}/{month}")
    public ResponseEntity<BucketResponse> month(@PathVariable("event") String event,
                                                @PathVariable("year") int year,
                                                @PathVariable("month") int month,
                                                @RequestParam(value = "identifier", required = false) Long identifier) {
        return ResponseEntity.ok(describe(recorder.monthEvents(event, year, month), identifier));
    }

    /**
     * 周桶查询，year 为 ISO 周年。
     */
    @GetMapping("/{event}/week/{year}/{week}")
    public ResponseEntity<BucketResponse> week(@PathVariable("event") String event,
                                               @PathVariable("year") int year,
                                               @PathVariable("week") int week,
                                               @RequestParam(value = "identifier", required = false) Long identifier) {
        return ResponseEntity.ok(describe(recorder.weekEvents(event, year, week), identifier));
    }

    @GetMapping("/{event}/day/{year}/{month}/{day}")
    public ResponseEntity<BucketResponse> day(@PathVariable("event") String event,
                                              @PathVariable("year") int year,
                                              @PathVariable("month") int month,
                                              @PathVariable("day") int day,
                                              @RequestParam(value = "identifier", required = false) Long identifier) {
        return ResponseEntity.ok(describe(recorder.dayEvents(event, year, month, day), identifier));
    }

    @GetMapping("/{event}/hour/{year}/{month}/{day}/{hour}")
    public ResponseEntity<BucketResponse> hour(@PathVariable("event") String event,
                                               @PathVariable("year") int year,
                                               @PathVariable("month") int month,
                                               @PathVariable("day") int day,
                                               @PathVariable("hour") int hour,
                                               @RequestParam(value = "identifier", required = false) Long identifier) {
        return ResponseEntity.ok(describe(recorder.hourEvents(event, year, month, day, hour), identifier));
    }

    /**
     * 删除全部事件键（含位运算临时键）。
     */
    @DeleteMapping
    public ResponseEntity<DeleteResponse> deleteAll() {
        return ResponseEntity.ok(new DeleteResponse(recorder.deleteAllEvents()));
    }

    private static BucketResponse describe(EventBucket bucket, Long identifier) {
        Boolean present = identifier == null ? null : bucket.isPresent(identifier);
        return new BucketResponse(bucket.getKey(), bucket.count(), bucket.exists(), present);
    }
}
