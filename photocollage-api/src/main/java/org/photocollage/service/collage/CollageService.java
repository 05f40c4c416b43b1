package org.photocollage.service.collage;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.photocollage.config.AppProperties;
import org.photocollage.exception.ApiError;
import org.photocollage.model.collage.CollageConfig;
import org.photocollage.model.collage.CollageStyle;
import org.photocollage.model.collage.ImageReference;
import org.photocollage.model.collage.LayoutSlot;
import org.photocollage.model.collage.SourceImage;
import org.photocollage.model.collage.TransformedImage;
import org.photocollage.model.dto.request.CollageRequest;
import org.photocollage.util.ImageUtils;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Renders scattered photo collages: fetch, plan, transform, composite, encode.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CollageService {

    static final int MIN_CANVAS_SIZE = 200;
    static final int MAX_CANVAS_SIZE = 4000;
    static final int DEFAULT_COLUMNS = 2;

    private final AppProperties appProperties;
    private final ImageFetcher imageFetcher;
    private final LayoutPlanner layoutPlanner;
    private final ImageTransformer imageTransformer;
    private final CollageCompositor collageCompositor;
    private final CollageEncoder collageEncoder;

    public byte[] createCollage(CollageRequest request) {
        List<ImageReference> references = toUrlReferences(request.getImageUrls());
        CollageConfig config = resolveConfig(request.getCanvasSize(), request.getBackgroundColor(), request.getSeed(), request.getColumns());
        return render(references, config);
    }

    public byte[] createCollageFromUploads(List<MultipartFile> files, Integer canvasSize, String backgroundColor, Long seed) {
        if (files == null || files.isEmpty()) {
            throw ApiError.INVALID_COLLAGE_REQUEST.createException("at least one image is required");
        }
        CollageConfig config = resolveConfig(canvasSize, backgroundColor, seed, null);

        List<ImageReference> references = new ArrayList<>(files.size());
        for (MultipartFile file : files) {
            try {
                references.add(ImageReference.ofBytes(file.getOriginalFilename(), file.getBytes()));
            } catch (IOException e) {
                log.warn("Failed to read uploaded image {}: {}", file.getOriginalFilename(), e.getMessage());
            }
        }
        if (references.isEmpty()) {
            throw ApiError.NO_IMAGES_AVAILABLE.createException(files.size());
        }
        return render(references, config);
    }

    /**
     * Renders one collage. Slots are planned for every requested reference, so when some images are
     * dropped the survivors keep the first slots of the requested layout. The render's random stream
     * is consumed by the planner first, then by one size variation per surviving image.
     */
    public byte[] render(List<ImageReference> references, CollageConfig config) {
        int maxImages = Math.min(appProperties.getCollage().getMaxImages(), LayoutPlanner.MAX_IMAGES);
        if (references == null || references.isEmpty()) {
            throw ApiError.INVALID_COLLAGE_REQUEST.createException("at least one image is required");
        }
        if (references.size() > maxImages) {
            throw ApiError.INVALID_COLLAGE_REQUEST.createException("at most " + maxImages + " images are allowed");
        }

        log.info("Creating collage with {} images (canvas {}px, density {}, seed {})",
                references.size(), config.canvasSize(), config.columns(), config.seed());
        long start = System.nanoTime();

        List<SourceImage> images = imageFetcher.fetchAll(references, appProperties.getCollage().getFetchTimeout());
        if (images.isEmpty()) {
            log.error("No images could be downloaded for collage of {} references", references.size());
            throw ApiError.NO_IMAGES_AVAILABLE.createException(references.size());
        }
        if (images.size() < references.size()) {
            log.warn("Using {} of {} requested images", images.size(), references.size());
        }

        Random random = new Random(config.seed());
        List<LayoutSlot> slots = layoutPlanner.plan(references.size(), config.canvasSize(), random);

        List<TransformedImage> transformed = new ArrayList<>(images.size());
        BufferedImage canvas = null;
        try {
            for (SourceImage image : images) {
                double sizeVariation = CollageStyle.MIN_SIZE_VARIATION
                        + random.nextDouble() * (CollageStyle.MAX_SIZE_VARIATION - CollageStyle.MIN_SIZE_VARIATION);
                int slotIndex = transformed.size();
                if (slotIndex < slots.size()) {
                    transformed.add(imageTransformer.transform(image, slots.get(slotIndex), sizeVariation));
                }
                image.image().flush();
            }

            canvas = collageCompositor.createCanvas(config.canvasSize(), config.backgroundColor());
            collageCompositor.composite(canvas, transformed, slots);
            byte[] jpeg = collageEncoder.encode(canvas, config.backgroundColor());

            long elapsedMs = (System.nanoTime() - start) / 1_000_000;
            log.info("Collage created: {} images, {} KB in {} ms", transformed.size(), String.format("%.1f", jpeg.length / 1024.0), elapsedMs);
            return jpeg;
        } finally {
            ImageUtils.flush(canvas);
            for (TransformedImage t : transformed) {
                t.image().flush();
            }
        }
    }

    /**
     * Merges request overrides with the configured defaults.
     */
    public CollageConfig resolveConfig(Integer canvasSize, String backgroundColor, Long seed, Integer columns) {
        AppProperties.Collage defaults = appProperties.getCollage();

        int size = canvasSize != null ? canvasSize : defaults.getCanvasSize();
        if (size < MIN_CANVAS_SIZE || size > MAX_CANVAS_SIZE) {
            throw ApiError.INVALID_COLLAGE_REQUEST.createException(
                    "canvas size must be between " + MIN_CANVAS_SIZE + " and " + MAX_CANVAS_SIZE + " but was " + size);
        }

        String color = backgroundColor != null ? backgroundColor : defaults.getBackgroundColor();
        if (!ImageUtils.isHexColor(color)) {
            throw ApiError.INVALID_COLLAGE_REQUEST.createException("background color must look like #RRGGBB but was " + color);
        }

        int density = columns != null ? columns : DEFAULT_COLUMNS;
        if (density < 1) {
            throw ApiError.INVALID_COLLAGE_REQUEST.createException("columns must be positive but was " + density);
        }

        return CollageConfig.builder()
                .canvasSize(size)
                .backgroundColor(ImageUtils.parseHexColor(color))
                .seed(seed != null ? seed : defaults.getSeed())
                .columns(density)
                .build();
    }

    List<ImageReference> toUrlReferences(List<String> urls) {
        if (urls == null || urls.isEmpty()) {
            throw ApiError.INVALID_COLLAGE_REQUEST.createException("at least one image URL is required");
        }
        List<ImageReference> references = new ArrayList<>(urls.size());
        for (String url : urls) {
            if (url == null || url.isBlank()) {
                throw ApiError.INVALID_COLLAGE_REQUEST.createException("image URLs must not be blank");
            }
            String scheme;
            try {
                scheme = URI.create(url.trim()).getScheme();
            } catch (IllegalArgumentException e) {
                throw ApiError.INVALID_COLLAGE_REQUEST.createException("malformed image URL " + url);
            }
            if (!"http".equalsIgnoreCase(scheme) && !"https".equalsIgnoreCase(scheme)) {
                throw ApiError.INVALID_COLLAGE_REQUEST.createException("only http and https image URLs are supported");
            }
            references.add(ImageReference.ofUrl(url.trim()));
        }
        return references;
    }
}
