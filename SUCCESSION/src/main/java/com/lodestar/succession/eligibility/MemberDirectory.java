package com.lodestar.succession.eligibility;

import com.lodestar.succession.domain.model.MemberActivity;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Local member snapshots, served when no member data service is configured.
 */
@Component
public class MemberDirectory {

    private final Map<String, MemberActivity> activities = new ConcurrentHashMap<>();
    private final Map<String, Set<String>> chapterMembers = new ConcurrentHashMap<>();

    public void upsert(String chapterId, MemberActivity activity) {
        activities.put(activity.getMemberId(), activity);
        chapterMembers.computeIfAbsent(chapterId, key -> ConcurrentHashMap.newKeySet()).add(activity.getMemberId());
    }

    public Optional<MemberActivity> find(String memberId) {
        return Optional.ofNullable(activities.get(memberId));
    }

    /**
     * Member ids of a chapter in a stable order.
     */
    public List<String> members(String chapterId) {
        return List.copyOf(new TreeSet<>(chapterMembers.getOrDefault(chapterId, Set.of())));
    }
}
