package org.photocollage.config;

import jakarta.servlet.MultipartConfigElement;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.util.unit.DataSize;

@Configuration
public class MultipartConfig {

    private static final long MAX_FILE_SIZE_MB = 10;
    private static final long MAX_REQUEST_SIZE_MB = 200;

    /**
     * Each uploaded photo is capped at 10 MB; a full request of up to 20 photos fits the request limit.
     */
    @Bean
    public MultipartConfigElement multipartConfigElement() {
        long maxFileBytes = DataSize.ofMegabytes(MAX_FILE_SIZE_MB).toBytes();
        long maxRequestBytes = DataSize.ofMegabytes(MAX_REQUEST_SIZE_MB).toBytes();
        return new MultipartConfigElement("", maxFileBytes, maxRequestBytes, 0);
    }
}
