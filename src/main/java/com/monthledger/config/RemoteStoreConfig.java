package com.monthledger.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
public class RemoteStoreConfig {
  @Bean
  public RestClient remoteStoreRestClient(RestClient.Builder builder, RemoteStoreProperties properties) {
    SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
    if (properties.connectTimeoutMs() != null && properties.connectTimeoutMs() > 0) {
      requestFactory.setConnectTimeout(properties.connectTimeoutMs());
    }
    if (properties.readTimeoutMs() != null && properties.readTimeoutMs() > 0) {
      requestFactory.setReadTimeout(properties.readTimeoutMs());
    }
    String baseUrl = properties.baseUrl() == null ? "" : properties.baseUrl();
    return builder
        .baseUrl(baseUrl)
        .requestFactory(requestFactory)
        .build();
  }
}
