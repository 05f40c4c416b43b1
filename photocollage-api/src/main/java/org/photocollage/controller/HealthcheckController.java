package org.photocollage.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.photocollage.model.dto.HealthcheckResponse;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.LocalDateTime;

@RestController
@RequestMapping("/api/v1/healthcheck")
@Tag(name = "Healthcheck", description = "Endpoints for checking the health of the application")
public class HealthcheckController {

    @Value("${app.version}")
    private String appVersion;

    @Operation(summary = "Get a ping response", description = "Check if the application is responding")
    @ApiResponse(responseCode = "200", description = "Health status returned successfully")
    @GetMapping
    public ResponseEntity<HealthcheckResponse> getPing() {
        HealthcheckResponse healthData = HealthcheckResponse.builder()
                .status("UP")
                .message("Collage renderer is running.")
                .version(appVersion)
                .timestamp(LocalDateTime.now())
                .build();

        return ResponseEntity.ok(healthData);
    }
}
