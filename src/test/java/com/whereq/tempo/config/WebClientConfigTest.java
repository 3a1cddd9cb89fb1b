package com.whereq.tempo.config;

import org.junit.jupiter.api.Test;
import org.springframework.util.unit.DataSize;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class WebClientConfigTest {

    @Test
    void testBuilderUsesNotificationSettings() {
        TempoProperties properties = new TempoProperties();
        properties.getNotifications().setTimeout(Duration.ofSeconds(2));
        properties.getNotifications().setMaxResponseSize(DataSize.ofKilobytes(64));

        WebClient.Builder builder = new WebClientConfig().webClientBuilder(properties);

        assertThat(builder.build()).isNotNull();
    }
}
