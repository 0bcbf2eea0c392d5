package com.phillippitts.radflow.presentation.controller;

import com.phillippitts.radflow.domain.CaseClassification;
import com.phillippitts.radflow.domain.CaseSnapshot;
import com.phillippitts.radflow.exception.ProbeException;
import com.phillippitts.radflow.presentation.dto.ClassificationPush;
import com.phillippitts.radflow.presentation.dto.FlagPush;
import com.phillippitts.radflow.presentation.dto.ProbeFailurePush;
import com.phillippitts.radflow.service.device.DeviceButtonEvent;
import com.phillippitts.radflow.service.device.RecordButtonEvent;
import com.phillippitts.radflow.service.external.impl.PushedStateOracle;
import jakarta.validation.Valid;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;

/**
 * Intake for the companion processes: the screen scraper pushes oracle readings and the
 * dictation microphone bridge posts button events.
 */
@RestController
@RequestMapping("/api")
class BridgeController {

    private final PushedStateOracle oracle;
    private final ApplicationEventPublisher publisher;
    private final Clock clock;

    BridgeController(PushedStateOracle oracle, ApplicationEventPublisher publisher, Clock clock) {
        this.oracle = oracle;
        this.publisher = publisher;
        this.clock = clock;
    }

    @PutMapping("/oracle/recording")
    ResponseEntity<Void> pushRecording(@RequestBody FlagPush body) {
        oracle.pushRecordingActive(body.value());
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/oracle/case")
    ResponseEntity<Void> pushCase(@RequestBody CaseSnapshot snapshot) {
        oracle.pushCaseSnapshot(snapshot);
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/oracle/case/failure")
    ResponseEntity<Void> pushCaseFailure(@RequestBody ProbeFailurePush body) {
        oracle.pushCaseProbeFailure(body.reason());
        return ResponseEntity.noContent().build();
    }

    /**
     * Last fresh case snapshot, 503 when there is none.
     */
    @GetMapping("/oracle/case")
    ResponseEntity<CaseSnapshot> currentCase() {
        return oracle.probeCaseSnapshot()
                .map(ResponseEntity::ok)
                .orElseThrow(() -> new ProbeException("case", "No fresh case snapshot"));
    }

    @PutMapping("/oracle/discard-dialog")
    ResponseEntity<Void> pushDiscardDialog(@RequestBody FlagPush body) {
        oracle.pushDiscardDialogVisible(body.value());
        return ResponseEntity.noContent().build();
    }

    @PutMapping("/oracle/classification")
    ResponseEntity<Void> pushClassification(@Valid @RequestBody ClassificationPush body) {
        oracle.pushCaseClassification(body.accession(), new CaseClassification(body.priority(), body.classification()));
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/device/buttons/{button}")
    ResponseEntity<Void> deviceButton(@PathVariable String button) {
        publisher.publishEvent(new DeviceButtonEvent(button, clock.instant()));
        return ResponseEntity.accepted().build();
    }

    @PostMapping("/device/record-button")
    ResponseEntity<Void> recordButton(@RequestParam boolean pressed) {
        publisher.publishEvent(new RecordButtonEvent(pressed, clock.instant()));
        return ResponseEntity.accepted().build();
    }
}
