package io.github.drompincen.labseed.cli.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.github.drompincen.labseed.client.GitLabProperties;
import io.github.drompincen.labseed.runtime.context.DuplicatePolicy;
import io.github.drompincen.labseed.runtime.context.LinkMode;
import io.github.drompincen.labseed.runtime.context.SeedOptions;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;
import java.time.Duration;

@Configuration
public class LabSeedConfig {

    @Bean
    ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.findAndRegisterModules();
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        return mapper;
    }

    @Bean
    HttpClient httpClient(@Value("${labseed.gitlab.connect-timeout:10s}") Duration connectTimeout) {
        return HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Bean
    GitLabProperties gitLabProperties(@Value("${labseed.gitlab.url:}") String url,
                                      @Value("${labseed.gitlab.token:}") String token,
                                      @Value("${labseed.gitlab.timeout:30s}") Duration timeout,
                                      @Value("${labseed.capabilities.epics:auto}") String epics,
                                      @Value("${labseed.capabilities.iterations:auto}") String iterations) {
        return new GitLabProperties(url, token, timeout,
                GitLabProperties.parseSupport(epics), GitLabProperties.parseSupport(iterations));
    }

    @Bean
    SeedOptions seedOptions(@Value("${labseed.duplicates:reuse}") String duplicates,
                            @Value("${labseed.link-mode:inline}") String linkMode,
                            @Value("${labseed.parent:}") String parent,
                            @Value("${labseed.visibility:private}") String visibility,
                            @Value("${labseed.settle.poll-interval:500ms}") Duration pollInterval,
                            @Value("${labseed.settle.timeout:30s}") Duration settleTimeout) {
        return new SeedOptions(DuplicatePolicy.parse(duplicates), LinkMode.parse(linkMode), parent, visibility,
                pollInterval, settleTimeout);
    }
}
