package com.prodyna.pac.backend.api.controller;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness probe on the root path.
 *
 * @author PAC Team
 */
@RestController
public class HealthController {

    @GetMapping("/")
    public ResponseEntity<Void> alive() {
        return ResponseEntity.noContent().build();
    }
}
