package com.mouse.keeper.controller;

import com.mouse.keeper.model.CheckinResult;
import com.mouse.keeper.model.CheckinStatus;
import com.mouse.keeper.service.CheckinService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequiredArgsConstructor
@RequestMapping("/checkin")
public class CheckinController {

    private final CheckinService checkinService;

    @GetMapping
    public ResponseEntity<CheckinStatus> status() {
        return ResponseEntity.ok(checkinService.status());
    }

    @PostMapping
    public ResponseEntity<Map<String, Object>> trigger() {
        if (checkinService.isRunning()) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(Map.of("status", "running", "message", "Check-in already in progress"));
        }
        log.info("POST /checkin - starting async check-in");
        checkinService.runAllAsync();
        return ResponseEntity.accepted().body(Map.of("status", "started"));
    }

    @PostMapping("/sync")
    public ResponseEntity<Map<String, Object>> runSync() {
        List<CheckinResult> results = checkinService.runAll();
        long ok = results.stream().filter(CheckinResult::isSuccess).count();
        return ResponseEntity.ok(Map.of(
                "success", ok == results.size(),
                "message", "Check-in completed: " + ok + "/" + results.size() + " successful",
                "results", results));
    }
}
