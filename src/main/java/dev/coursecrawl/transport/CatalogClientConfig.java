package dev.coursecrawl.transport;

import java.io.IOException;
import java.net.HttpURLConnection;
import java.time.Duration;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Configures the {@link RestClient}s used to talk to the listing service.
 *
 * <p>{@code catalogRestClient} targets the listing endpoint; {@code redirectCheckRestClient} is
 * used for absolute URLs and never follows redirects, so the {@code Location} of a 3xx answer
 * stays visible to the caller.
 */
@Configuration
public class CatalogClientConfig {

    @Bean
    public RestClient catalogRestClient(RestClient.Builder builder, CatalogProperties props) {
        return builder
                .baseUrl(props.baseUrl())
                .requestFactory(timeouts(new SimpleClientHttpRequestFactory(), props))
                .defaultHeader(HttpHeaders.ACCEPT, "text/html,application/xhtml+xml,*/*;q=0.8")
                .build();
    }

    @Bean
    public RestClient redirectCheckRestClient(RestClient.Builder builder, CatalogProperties props) {
        return builder
                .requestFactory(timeouts(new NoRedirectRequestFactory(), props))
                .build();
    }

    private static SimpleClientHttpRequestFactory timeouts(
            SimpleClientHttpRequestFactory requestFactory, CatalogProperties props) {
        requestFactory.setConnectTimeout(Duration.ofMillis(props.connectTimeoutMs()));
        requestFactory.setReadTimeout(Duration.ofMillis(props.readTimeoutMs()));
        return requestFactory;
    }

    static class NoRedirectRequestFactory extends SimpleClientHttpRequestFactory {

        @Override
        protected void prepareConnection(HttpURLConnection connection, String httpMethod)
                throws IOException {
            super.prepareConnection(connection, httpMethod);
            connection.setInstanceFollowRedirects(false);
        }
    }
}
