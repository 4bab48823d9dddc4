package com.lodestar.succession.eligibility;

import com.lodestar.succession.domain.model.MemberActivity;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Read-only view of member data owned by the member service.
 */
public interface MemberActivitySource {

    /**
     * Activity snapshot of a member. Errors when the data cannot be retrieved.
     */
    Mono<MemberActivity> fetchActivity(String memberId);

    /**
     * Ids of the members of a chapter, the population eligibility is computed over.
     */
    Flux<String> chapterMemberIds(String chapterId);
}
