package com.example.pipelinesync.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * WebClient instances for the two remote systems and the Source token endpoint.
 * Every client carries connect, read, write and response timeouts.
 */
@Configuration
public class WebClientConfig {

    private static final int MAX_IN_MEMORY_SIZE = 16 * 1024 * 1024;

    @Bean("sourceWebClient")
    public WebClient sourceWebClient(SourceApiProperties properties) {
        return build(properties.getBaseUrl(), properties.getTimeout());
    }

    /**
     * Token exchange is a single small POST; a shorter deadline surfaces auth outages quickly.
     */
    @Bean("sourceAuthWebClient")
    public WebClient sourceAuthWebClient() {
        return build(null, Duration.ofSeconds(15));
    }

    @Bean("targetWebClient")
    public WebClient targetWebClient(TargetApiProperties properties) {
        return build(properties.getBaseUrl(), properties.getTimeout());
    }

    public static WebClient build(String baseUrl, Duration timeout) {
        long seconds = Math.max(1, timeout.toSeconds());
        HttpClient httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, 10000)
                .responseTimeout(timeout)
                .doOnConnected(conn ->
                        conn.addHandlerLast(new ReadTimeoutHandler(seconds, TimeUnit.SECONDS))
                                .addHandlerLast(new WriteTimeoutHandler(seconds, TimeUnit.SECONDS)));

        WebClient.Builder builder = WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .codecs(configurer -> configurer.defaultCodecs().maxInMemorySize(MAX_IN_MEMORY_SIZE));
        if (baseUrl != null) {
            builder.baseUrl(baseUrl);
        }
        return builder.build();
    }
}
