package com.vp.client;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.ClientHttpRequestInterceptor;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.util.UUID;

/**
 * Everything the collaborator clients need: the app.* properties, one outbound
 * RestClient and the scanned registry, geocoder, phone and vision clients.
 * Importing this class is enough; no auto-configuration of the host is assumed.
 */
@Configuration
@EnableConfigurationProperties
@ComponentScan("com.vp.client")
public class VpClientAutoConfiguration {

    static final String REQUEST_ID_HEADER = "X-Request-ID";

    @Bean(name = "vpClientProperties")
    @Primary
    @ConfigurationProperties(prefix = "app")
    public VpClientProperties vpClientProperties() {
        return new VpClientProperties();
    }

    /** Shared by the NPI, Nominatim and Gemini clients; every request is bounded by the configured timeouts. */
    @Bean
    public RestClient vpRestClient(RestClient.Builder builder, VpClientProperties props) {
        ClientHttpRequestInterceptor addRequestId =
                (request, body, execution) -> {
                    request.getHeaders().addIfAbsent(REQUEST_ID_HEADER, UUID.randomUUID().toString());
                    return execution.execute(request, body);
                };

        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) props.getConnectTimeout().toMillis());
        requestFactory.setReadTimeout((int) props.getReadTimeout().toMillis());

        return builder
                .requestFactory(requestFactory)
                .defaultHeader(HttpHeaders.USER_AGENT, props.getUserAgent())
                .requestInterceptor(addRequestId)
                .build();
    }
}
