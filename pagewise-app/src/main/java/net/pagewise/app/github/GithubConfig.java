package net.pagewise.app.github;

import com.fasterxml.jackson.databind.ObjectMapper;
import net.pagewise.core.spi.Clock;
import net.pagewise.core.spi.UpstreamPageSource;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

@Configuration
@EnableConfigurationProperties(GithubProperties.class)
public class GithubConfig {

    @Bean
    public RestClient githubRestClient(RestClient.Builder builder, GithubProperties props) {
        var factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout((int) props.getConnectTimeout().toMillis());
        factory.setReadTimeout((int) props.getReadTimeout().toMillis());

        builder = builder.baseUrl(props.getBaseUrl())
                .requestFactory(factory)
                .defaultHeader(HttpHeaders.ACCEPT, "application/vnd.github+json")
                .defaultHeader("X-GitHub-Api-Version", "2022-11-28");
        if (props.getToken() != null && !props.getToken().isBlank()) {
            builder = builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + props.getToken());
        }
        return builder.build();
    }

    @Bean
    public UpstreamPageSource githubRestPageSource(RestClient githubRestClient, ObjectMapper mapper, Clock clock) {
        return new GithubRestPageSource(githubRestClient, mapper, clock);
    }
}
