package com.riskgate.backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

@Configuration
public class ExchangeHttpConfig {

    @Bean
    public RestTemplate exchangeRestTemplate(ExchangeProperties exchangeProperties) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(exchangeProperties.getConnectTimeoutMs());
        factory.setReadTimeout(exchangeProperties.getReadTimeoutMs());
        return new RestTemplate(factory);
    }
}
