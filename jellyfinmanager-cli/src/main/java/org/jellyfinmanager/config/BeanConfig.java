package org.jellyfinmanager.config;

import org.springframework.boot.web.client.RestClientCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;

import java.net.http.HttpClient;

@Configuration
public class BeanConfig {

    @Bean
    public HttpClient httpClient(AppProperties appProperties) {
        return HttpClient.newBuilder()
                .connectTimeout(appProperties.getHttp().getConnectTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Bean
    public RestClientCustomizer timeoutRestClientCustomizer(HttpClient httpClient, AppProperties appProperties) {
        JdkClientHttpRequestFactory factory = new JdkClientHttpRequestFactory(httpClient);
        factory.setReadTimeout(appProperties.getHttp().getReadTimeout());
        return builder -> builder.requestFactory(factory);
    }
}
