package org.photocollage.model.dto.request;

import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CollageRequest {

    @NotEmpty(message = "At least one image URL is required")
    @Size(max = 20, message = "A collage holds at most 20 images")
    private List<String> imageUrls;

    private Integer columns; // density hint: 2 sparse, 3 medium, 4 dense
    private Integer canvasSize;
    private String backgroundColor; // "#RRGGBB"
    private Long seed;
}
