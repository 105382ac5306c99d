package com.demo.coordination.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.MediaType;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.http.converter.json.MappingJackson2HttpMessageConverter;
import org.springframework.web.client.RestTemplate;

import java.net.http.HttpClient;
import java.util.Arrays;
import java.util.List;

/**
 * RestTemplate for the QA completion service
 */
@Configuration
public class RestTemplateConfig {

    /**
     * The QA service answers with text/plain on some endpoints, so the JSON
     * converter accepts every text type and sits first in the chain.
     * Responses are read as they arrive so NDJSON can be consumed line by line.
     * Exchanges must stay interruptible and bodies closable mid-answer without
     * draining, which the HttpURLConnection factory does not allow.
     */
    @Bean
    public RestTemplate completionRestTemplate(CoordinationProperties properties) {
        HttpClient httpClient = HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .connectTimeout(properties.getCompletion().getConnectTimeout())
            .build();
        JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
        requestFactory.setReadTimeout(properties.getCompletion().getReadTimeout());

        RestTemplate restTemplate = new RestTemplate(requestFactory);

        MappingJackson2HttpMessageConverter jsonConverter = new MappingJackson2HttpMessageConverter();
        List<MediaType> supportedMediaTypes = Arrays.asList(
            MediaType.APPLICATION_JSON,
            MediaType.TEXT_PLAIN,
            MediaType.APPLICATION_NDJSON,
            new MediaType("application", "*+json"),
            new MediaType("text", "*")
        );
        jsonConverter.setSupportedMediaTypes(supportedMediaTypes);
        restTemplate.getMessageConverters().add(0, jsonConverter);

        return restTemplate;
    }
}
