package org.devfriend.providerclient.config;

import okhttp3.OkHttpClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.TimeUnit;

@Configuration
public class OkHttpConfig {

    /**
     * Shared client for every provider call. All calls are bounded by the call timeout,
     * which surfaces as a {@link java.io.InterruptedIOException}.
     */
    @Bean
    public OkHttpClient providerHttpClient(
            @Value("${devfriend.http.connect-timeout-seconds:10}") long connectTimeoutSeconds,
            @Value("${devfriend.http.read-timeout-seconds:30}") long readTimeoutSeconds,
            @Value("${devfriend.http.call-timeout-seconds:45}") long callTimeoutSeconds
    ) {
        return new OkHttpClient.Builder()
                .connectTimeout(connectTimeoutSeconds, TimeUnit.SECONDS)
                .readTimeout(readTimeoutSeconds, TimeUnit.SECONDS)
                .writeTimeout(readTimeoutSeconds, TimeUnit.SECONDS)
                .callTimeout(callTimeoutSeconds, TimeUnit.SECONDS)
                .retryOnConnectionFailure(false)
                .build();
    }
}
