package org.photocollage.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.AllArgsConstructor;
import org.photocollage.model.dto.request.CollageRequest;
import org.photocollage.service.collage.CollageService;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.util.List;

@RestController
@RequestMapping("/api/v1/collages")
@AllArgsConstructor
@Tag(name = "Collages", description = "Endpoints for rendering scattered photo collages")
public class CollageController {

    private final CollageService collageService;

    @Operation(summary = "Create a collage from image URLs", description = "Download the given images and render them as one scattered collage JPEG. Images that cannot be downloaded or decoded are left out.")
    @ApiResponse(responseCode = "200", description = "Collage rendered successfully")
    @ApiResponse(responseCode = "400", description = "Invalid request")
    @ApiResponse(responseCode = "422", description = "None of the images could be used")
    @PostMapping(consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<byte[]> createCollage(
            @Parameter(description = "Image URLs and rendering options") @Valid @RequestBody CollageRequest request) {
        byte[] jpeg = collageService.createCollage(request);
        return ResponseEntity.ok().contentType(MediaType.IMAGE_JPEG).body(jpeg);
    }

    @Operation(summary = "Create a collage from uploaded images", description = "Render the uploaded images, in upload order, as one scattered collage JPEG.")
    @ApiResponse(responseCode = "200", description = "Collage rendered successfully")
    @ApiResponse(responseCode = "400", description = "Invalid request")
    @ApiResponse(responseCode = "422", description = "None of the images could be used")
    @PostMapping(value = "/upload", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<byte[]> createCollageFromUploads(
            @Parameter(description = "Image files, bottom of the stack first") @RequestParam("images") List<MultipartFile> images,
            @Parameter(description = "Edge length of the square collage in pixels") @RequestParam(required = false) Integer canvasSize,
            @Parameter(description = "Background color as #RRGGBB") @RequestParam(required = false) String backgroundColor,
            @Parameter(description = "Seed for the layout and size variation") @RequestParam(required = false) Long seed) {
        byte[] jpeg = collageService.createCollageFromUploads(images, canvasSize, backgroundColor, seed);
        return ResponseEntity.ok().contentType(MediaType.IMAGE_JPEG).body(jpeg);
    }
}
