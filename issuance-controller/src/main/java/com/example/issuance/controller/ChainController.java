package com.example.issuance.controller;

import com.example.issuance.clock.HostBlockClock;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * Exposes the host block counter. Advancing it stands in for block production in development.
 */
@RestController
@RequestMapping("/chain")
public class ChainController {

    private final HostBlockClock clock;

    public ChainController(HostBlockClock clock) {
        this.clock = clock;
    }

    @GetMapping(value = "/block", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> getCurrentBlock() {
        return ResponseEntity.ok(Map.of("block", clock.currentBlock()));
    }

    @PostMapping(value = "/block/advance", produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<Map<String, Object>> advance(@RequestParam(defaultValue = "1") long blocks) {
        return ResponseEntity.ok(Map.of("block", clock.advance(blocks)));
    }
}
