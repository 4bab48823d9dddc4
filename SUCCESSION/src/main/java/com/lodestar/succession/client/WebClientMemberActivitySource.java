package com.lodestar.succession.client;

import com.lodestar.succession.config.SuccessionProperties;
import com.lodestar.succession.domain.error.EligibilityComputationException;
import com.lodestar.succession.domain.model.MemberActivity;
import com.lodestar.succession.eligibility.MemberActivitySource;
import com.lodestar.succession.eligibility.MemberDirectory;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * WebClient-based implementation of MemberActivitySource.
 * Uses circuit breaker and retry for resilience; falls back to the local
 * {@link MemberDirectory} when no base URL is configured.
 */
@Component
@Slf4j
public class WebClientMemberActivitySource implements MemberActivitySource {

    private final WebClient webClient;
    private final SuccessionProperties.MemberData config;
    private final MemberDirectory directory;
    private final boolean stubMode;

    public WebClientMemberActivitySource(SuccessionProperties properties, MemberDirectory directory) {
        this.config = properties.getMemberData();
        this.directory = directory;

        this.stubMode = config.getBaseUrl() == null || config.getBaseUrl().isEmpty();

        if (!stubMode) {
            this.webClient = WebClient.builder()
                    .baseUrl(config.getBaseUrl())
                    .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
                    .build();
        } else {
            this.webClient = null;
            log.warn("Member data client running in stub mode - serving the local member directory");
        }
    }

    @Override
    @CircuitBreaker(name = "memberData")
    @Retry(name = "memberData")
    public Mono<MemberActivity> fetchActivity(String memberId) {
        if (stubMode) {
            return Mono.justOrEmpty(directory.find(memberId))
                    .switchIfEmpty(Mono.error(() -> new EligibilityComputationException(
                            "No activity recorded for member " + memberId, null)));
        }

        return webClient.get()
                .uri("/api/v1/members/{id}/activity", memberId)
                .retrieve()
                .bodyToMono(MemberActivity.class)
                .timeout(config.getTimeout())
                .onErrorMap(e -> !(e instanceof EligibilityComputationException),
                        e -> new EligibilityComputationException("Member data unavailable for " + memberId, e))
                .doOnError(e -> log.warn("Failed to fetch activity for member {}: {}", memberId, e.getMessage()));
    }

    @Override
    @CircuitBreaker(name = "memberData")
    public Flux<String> chapterMemberIds(String chapterId) {
        if (stubMode) {
            return Flux.fromIterable(directory.members(chapterId));
        }

        return webClient.get()
                .uri("/api/v1/chapters/{id}/members", chapterId)
                .retrieve()
                .bodyToFlux(String.class)
                .timeout(config.getTimeout())
                .doOnError(e -> log.error("Failed to list members of chapter {}: {}", chapterId, e.getMessage()));
    }
}
