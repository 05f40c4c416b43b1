package org.photocollage.model.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HealthcheckResponse {
    private String status;
    private String message;
    private LocalDateTime timestamp;
    private String version;
}
