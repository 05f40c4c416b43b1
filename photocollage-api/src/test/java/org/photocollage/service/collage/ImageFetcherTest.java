package org.photocollage.service.collage;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.photocollage.exception.ImageFetchException;
import org.photocollage.model.collage.ImageReference;
import org.photocollage.model.collage.SourceImage;
import org.springframework.core.task.SimpleAsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.awt.Color;
import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class ImageFetcherTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    @Mock
    private HttpClient httpClient;

    private ImageFetcher imageFetcher;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        imageFetcher = new ImageFetcher(httpClient, new ImageDecoder(), new SimpleAsyncTaskExecutor("fetch-test-"));
    }

    @Test
    void fetchAll_keepsRequestOrderAndDropsFailures() throws Exception {
        Map<String, Object> responses = Map.of(
                "https://storage.test/a.jpg", response(200, TestImages.jpeg(30, 20, Color.RED)),
                "https://storage.test/missing.jpg", response(404, new byte[]{1}),
                "https://storage.test/slow.jpg", new HttpTimeoutException("request timed out"),
                "https://storage.test/page.html", response(200, "<html></html>".getBytes()),
                "https://storage.test/b.jpg", response(200, TestImages.jpeg(10, 40, Color.BLUE)));
        stubResponses(responses);

        List<SourceImage> images = imageFetcher.fetchAll(List.of(
                ImageReference.ofUrl("https://storage.test/a.jpg"),
                ImageReference.ofUrl("https://storage.test/missing.jpg"),
                ImageReference.ofUrl("https://storage.test/slow.jpg"),
                ImageReference.ofUrl("https://storage.test/page.html"),
                ImageReference.ofUrl("https://storage.test/b.jpg")), TIMEOUT);

        assertThat(images).extracting(SourceImage::index).containsExactly(0, 4);
        assertThat(images.get(0).width()).isEqualTo(30);
        assertThat(images.get(1).height()).isEqualTo(40);
    }

    @Test
    void fetchAll_allFailing_returnsEmptyList() throws Exception {
        when(httpClient.send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class)))
                .thenThrow(new IOException("connection refused"));

        List<SourceImage> images = imageFetcher.fetchAll(List.of(
                ImageReference.ofUrl("https://storage.test/a.jpg"),
                ImageReference.ofUrl("https://storage.test/b.jpg")), TIMEOUT);

        assertThat(images).isEmpty();
    }

    @Test
    void fetchAll_byteReferences_skipHttp() throws Exception {
        List<SourceImage> images = imageFetcher.fetchAll(List.of(
                ImageReference.ofBytes("one.jpg", TestImages.jpeg(8, 8, Color.GREEN)),
                ImageReference.ofBytes("two.jpg", TestImages.jpeg(9, 9, Color.GREEN))), TIMEOUT);

        assertThat(images).extracting(SourceImage::index).containsExactly(0, 1);
        verify(httpClient, never()).send(any(), any());
    }

    @Test
    void fetchAll_overlappingRenders_timeoutStartsWhenDownloadStarts() throws Exception {
        HttpResponse<byte[]> ok = response(200, TestImages.jpeg(12, 12, Color.RED));
        when(httpClient.send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class)))
                .thenAnswer(invocation -> {
                    Thread.sleep(200);
                    return ok;
                });
        ThreadPoolTaskExecutor singleWorker = singleWorkerExecutor();
        ImageFetcher sharedPoolFetcher = new ImageFetcher(httpClient, new ImageDecoder(), singleWorker);
        Duration timeout = Duration.ofMillis(500);

        try {
            CompletableFuture<List<SourceImage>> first = CompletableFuture.supplyAsync(() -> sharedPoolFetcher.fetchAll(List.of(
                    ImageReference.ofUrl("https://storage.test/a1.jpg"),
                    ImageReference.ofUrl("https://storage.test/a2.jpg"),
                    ImageReference.ofUrl("https://storage.test/a3.jpg")), timeout));
            Thread.sleep(50);

            List<SourceImage> second = sharedPoolFetcher.fetchAll(List.of(
                    ImageReference.ofUrl("https://storage.test/b1.jpg")), timeout);

            assertThat(first.get(10, TimeUnit.SECONDS)).hasSize(3);
            assertThat(second).hasSize(1);
        } finally {
            singleWorker.shutdown();
        }
    }

    @Test
    void fetchAll_uploadsAreNotQueuedBehindDownloads() throws Exception {
        HttpResponse<byte[]> ok = response(200, TestImages.jpeg(12, 12, Color.RED));
        when(httpClient.send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class)))
                .thenAnswer(invocation -> {
                    Thread.sleep(400);
                    return ok;
                });
        ThreadPoolTaskExecutor singleWorker = singleWorkerExecutor();
        ImageFetcher sharedPoolFetcher = new ImageFetcher(httpClient, new ImageDecoder(), singleWorker);
        Duration timeout = Duration.ofMillis(500);

        try {
            CompletableFuture<List<SourceImage>> downloads = CompletableFuture.supplyAsync(() -> sharedPoolFetcher.fetchAll(List.of(
                    ImageReference.ofUrl("https://storage.test/a1.jpg"),
                    ImageReference.ofUrl("https://storage.test/a2.jpg"),
                    ImageReference.ofUrl("https://storage.test/a3.jpg")), timeout));
            Thread.sleep(50);

            List<SourceImage> uploads = sharedPoolFetcher.fetchAll(List.of(
                    ImageReference.ofBytes("upload.jpg", TestImages.jpeg(8, 8, Color.GREEN))), timeout);

            assertThat(uploads).extracting(SourceImage::index).containsExactly(0);
            assertThat(downloads.get(10, TimeUnit.SECONDS)).hasSize(3);
        } finally {
            singleWorker.shutdown();
        }
    }

    @Test
    void fetchAll_hungDownload_timesOutAndReleasesWorker() throws Exception {
        HttpResponse<byte[]> ok = response(200, TestImages.jpeg(12, 12, Color.RED));
        when(httpClient.send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class)))
                .thenAnswer(invocation -> {
                    HttpRequest request = invocation.getArgument(0);
                    if (request.uri().toString().endsWith("hung.jpg")) {
                        Thread.sleep(30_000);
                    }
                    return ok;
                });
        ThreadPoolTaskExecutor singleWorker = singleWorkerExecutor();
        ImageFetcher sharedPoolFetcher = new ImageFetcher(httpClient, new ImageDecoder(), singleWorker);

        try {
            long start = System.nanoTime();
            List<SourceImage> images = sharedPoolFetcher.fetchAll(List.of(
                    ImageReference.ofUrl("https://storage.test/hung.jpg"),
                    ImageReference.ofUrl("https://storage.test/ok.jpg")), Duration.ofMillis(300));
            long elapsedMs = (System.nanoTime() - start) / 1_000_000;

            assertThat(images).extracting(SourceImage::index).containsExactly(1);
            assertThat(elapsedMs).isLessThan(10_000);
        } finally {
            singleWorker.shutdown();
        }
    }

    @Test
    void retrieve_appliesTimeoutToRequest() throws Exception {
        stubResponses(Map.of("https://storage.test/a.jpg", response(200, new byte[]{1, 2, 3})));

        byte[] body = imageFetcher.retrieve(ImageReference.ofUrl("https://storage.test/a.jpg"), TIMEOUT);

        assertThat(body).containsExactly(1, 2, 3);
        verify(httpClient).send(argThat(request -> request.timeout().orElseThrow().equals(TIMEOUT)), any());
    }

    @Test
    void retrieve_errorStatus_throwsFetchException() throws Exception {
        stubResponses(Map.of("https://storage.test/a.jpg", response(503, new byte[]{1})));

        assertThatThrownBy(() -> imageFetcher.retrieve(ImageReference.ofUrl("https://storage.test/a.jpg"), TIMEOUT))
                .isInstanceOf(ImageFetchException.class)
                .hasMessageContaining("503");
    }

    @Test
    void retrieve_malformedUrl_throwsFetchException() {
        assertThatThrownBy(() -> imageFetcher.retrieve(ImageReference.ofUrl("https://bad host/a b.jpg"), TIMEOUT))
                .isInstanceOf(ImageFetchException.class);
    }

    private ThreadPoolTaskExecutor singleWorkerExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(16);
        executor.setThreadNamePrefix("fetch-test-");
        executor.initialize();
        return executor;
    }

    @SuppressWarnings("unchecked")
    private HttpResponse<byte[]> response(int status, byte[] body) {
        HttpResponse<byte[]> response = mock(HttpResponse.class);
        when(response.statusCode()).thenReturn(status);
        when(response.body()).thenReturn(body);
        return response;
    }

    @SuppressWarnings("unchecked")
    private void stubResponses(Map<String, Object> byUrl) throws IOException, InterruptedException {
        when(httpClient.send(any(HttpRequest.class), any(HttpResponse.BodyHandler.class)))
                .thenAnswer(invocation -> {
                    HttpRequest request = invocation.getArgument(0);
                    Object outcome = byUrl.get(request.uri().toString());
                    if (outcome instanceof IOException e) {
                        throw e;
                    }
                    return outcome;
                });
    }
}
