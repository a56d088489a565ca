package com.spacesync.backend.modules.downlink.infrastructure.transport;

import java.time.Duration;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.web.client.ClientHttpRequestFactories;
import org.springframework.boot.web.client.ClientHttpRequestFactorySettings;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.util.StringUtils;
import org.springframework.web.client.RestClient;

@Configuration
public class DownlinkTransportConfig {

    private static final Logger log = LoggerFactory.getLogger(DownlinkTransportConfig.class);

    @Bean
    public DownlinkTransport downlinkTransport(
            RestClient.Builder restClientBuilder,
            @Value("${app.downlink.network-server.base-url:}") String baseUrl,
            @Value("${app.downlink.network-server.api-token:}") String apiToken,
            @Value("${app.downlink.network-server.f-port:10}") int fPort,
            @Value("${app.downlink.network-server.timeout:PT5S}") Duration timeout
    ) {
        if (!StringUtils.hasText(baseUrl)) {
            log.info("No network server configured, downlinks are logged only");
            return new LoggingDownlinkTransport();
        }
        ClientHttpRequestFactorySettings settings = ClientHttpRequestFactorySettings.DEFAULTS
                .withConnectTimeout(timeout)
                .withReadTimeout(timeout);
        RestClient restClient = restClientBuilder
                .baseUrl(baseUrl)
                .requestFactory(ClientHttpRequestFactories.get(settings))
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + apiToken)
                .build();
        return new NetworkServerDownlinkTransport(restClient, fPort);
    }
}
