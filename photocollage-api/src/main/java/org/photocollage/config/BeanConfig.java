package org.photocollage.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;

@Configuration
public class BeanConfig {

    @Bean
    public HttpClient httpClient(AppProperties appProperties) {
        return HttpClient.newBuilder()
                .followRedirects(HttpClient.Redirect.NORMAL)
                .connectTimeout(appProperties.getCollage().getFetchTimeout())
                .build();
    }
}
