package org.photocollage.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "app")
@Getter
@Setter
public class AppProperties {
    private String version;
    private Collage collage = new Collage();

    @Getter
    @Setter
    public static class Collage {
        private int canvasSize = 1200;
        private String backgroundColor = "#F5F5F5";

        /**
         * Seed for layout jitter, rotations and size variation. Two renders with the
         * same inputs and the same seed produce byte-identical JPEGs.
         */
        private long seed = 42L;

        /**
         * Upper bound for a single source image download. A timed out download drops
         * that image instead of failing the whole collage.
         */
        private Duration fetchTimeout = Duration.ofSeconds(30);
        private int fetchConcurrency = 8;
        private int maxImages = 20;
    }
}
