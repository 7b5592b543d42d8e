package com.medlake.telegram.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

import java.time.Clock;

@Configuration
public class PipelineConfiguration {

    @Bean
    public Clock pipelineClock() {
        return Clock.systemUTC();
    }

    /**
     * HTTP client for the MTProto gateway that fronts the Telegram history API.
     */
    @Bean("telegramGatewayClient")
    public RestClient telegramGatewayClient(RestClient.Builder builder, PipelineProperties properties) {
        PipelineProperties.Telegram telegram = properties.getTelegram();
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) telegram.getConnectTimeout().toMillis());
        requestFactory.setReadTimeout((int) telegram.getReadTimeout().toMillis());
        return builder.clone()
                .baseUrl(telegram.getGatewayUrl())
                .requestFactory(requestFactory)
                .build();
    }
}
