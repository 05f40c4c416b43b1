package org.photocollage.service.collage;

import lombok.extern.slf4j.Slf4j;
import org.photocollage.exception.ImageDecodeException;
import org.photocollage.exception.ImageFetchException;
import org.photocollage.model.collage.ImageReference;
import org.photocollage.model.collage.SourceImage;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Downloads and decodes the source photos of one collage. Remote downloads run concurrently on the
 * shared fetch pool, uploads are decoded in place; the result keeps request order with failed entries
 * removed.
 */
@Slf4j
@Service
public class ImageFetcher {

    private final HttpClient httpClient;
    private final ImageDecoder imageDecoder;
    private final AsyncTaskExecutor fetchExecutor;

    public ImageFetcher(HttpClient httpClient,
                        ImageDecoder imageDecoder,
                        @Qualifier("collageFetchExecutor") AsyncTaskExecutor fetchExecutor) {
        this.httpClient = httpClient;
        this.imageDecoder = imageDecoder;
        this.fetchExecutor = fetchExecutor;
    }

    public List<SourceImage> fetchAll(List<ImageReference> references, Duration timeout) {
        int total = references.size();
        List<CompletableFuture<Optional<SourceImage>>> results = new ArrayList<>(total);
        for (int i = 0; i < total; i++) {
            ImageReference reference = references.get(i);
            if (reference.isRemote()) {
                results.add(submit(i, total, reference, timeout));
            } else {
                results.add(CompletableFuture.completedFuture(fetchOne(i, total, reference, timeout)));
            }
        }

        List<SourceImage> images = new ArrayList<>(total);
        for (int i = 0; i < total; i++) {
            await(results.get(i), i, references, timeout).ifPresent(images::add);
        }
        return images;
    }

    /**
     * Queues one download. The timeout clock starts when a worker picks the task up, so time spent
     * queued behind other renders does not count against this image. A task that runs past its
     * timeout is interrupted to free the worker.
     */
    private CompletableFuture<Optional<SourceImage>> submit(int index, int total, ImageReference reference, Duration timeout) {
        CompletableFuture<Optional<SourceImage>> result = new CompletableFuture<>();
        Future<?> task = fetchExecutor.submit(() -> {
            result.orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
            try {
                Optional<SourceImage> image = fetchOne(index, total, reference, timeout);
                if (!result.complete(image)) {
                    image.ifPresent(source -> source.image().flush());
                }
            } catch (RuntimeException e) {
                result.completeExceptionally(e);
            }
        });
        result.whenComplete((image, error) -> {
            if (error != null) {
                task.cancel(true);
            }
        });
        return result;
    }

    private Optional<SourceImage> await(CompletableFuture<Optional<SourceImage>> result, int index,
                                        List<ImageReference> references, Duration timeout) {
        ImageReference reference = references.get(index);
        try {
            return result.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            result.cancel(true);
            log.warn("Interrupted while waiting for image {}/{} {}", index + 1, references.size(), reference);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof TimeoutException) {
                log.warn("Timed out fetching image {}/{} {} after {} ms", index + 1, references.size(), reference, timeout.toMillis());
            } else {
                log.warn("Unexpected failure fetching image {}/{} {}", index + 1, references.size(), reference, e.getCause());
            }
        }
        return Optional.empty();
    }

    Optional<SourceImage> fetchOne(int index, int total, ImageReference reference, Duration timeout) {
        try {
            log.info("Downloading image {}/{}: {}", index + 1, total, reference);
            byte[] data = retrieve(reference, timeout);
            SourceImage image = imageDecoder.decode(index, data);
            log.info("Downloaded image {}/{}: {}x{}", index + 1, total, image.width(), image.height());
            return Optional.of(image);
        } catch (ImageFetchException e) {
            log.warn("Failed to download image {}/{} {}: {}", index + 1, total, reference, e.getMessage());
        } catch (ImageDecodeException e) {
            log.warn("Failed to decode image {}/{} {}: {}", index + 1, total, reference, e.getMessage());
        }
        return Optional.empty();
    }

    byte[] retrieve(ImageReference reference, Duration timeout) throws ImageFetchException {
        if (!reference.isRemote()) {
            return reference.getData();
        }

        HttpRequest request;
        try {
            request = HttpRequest.newBuilder()
                    .uri(URI.create(reference.getUrl()))
                    .timeout(timeout)
                    .GET()
                    .build();
        } catch (IllegalArgumentException e) {
            throw new ImageFetchException("Invalid image URL", e);
        }

        try {
            HttpResponse<byte[]> response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
            int status = response.statusCode();
            if (status < 200 || status >= 300) {
                throw new ImageFetchException("Unexpected HTTP status " + status);
            }
            byte[] body = response.body();
            if (body == null || body.length == 0) {
                throw new ImageFetchException("Empty response body");
            }
            return body;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ImageFetchException("Interrupted while downloading", e);
        } catch (IOException e) {
            throw new ImageFetchException(e.getClass().getSimpleName() + ": " + e.getMessage(), e);
        }
    }
}
