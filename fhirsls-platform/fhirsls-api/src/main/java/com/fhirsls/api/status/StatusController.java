package com.fhirsls.api.status;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

@RestController
@RequestMapping("/api/v1")
public class StatusController {

    private final StatusService statusService;

    public StatusController(StatusService statusService) {
        this.statusService = statusService;
    }

    @GetMapping("/status")
    public ResponseEntity<StatusService.StatusDto> status() {
        return ResponseEntity.ok(statusService.getStatus());
    }

    @DeleteMapping("/data")
    public ResponseEntity<Map<String, Object>> clear() {
        statusService.clearAll();
        return ResponseEntity.ok(Map.of("message", "All data cleared successfully"));
    }
}
