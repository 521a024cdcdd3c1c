package com.advisor.chase.registry;

import com.advisor.chase.model.Activity;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only in-memory activity log, in commit order. Writes arrive through the
 * registry; the durable copy lives in the activity repository.
 */
@Component
public class ActivityLog {

    private final List<Activity> entries = new ArrayList<>();
    private final Map<String, List<Activity>> byItem = new HashMap<>();

    public synchronized void append(Activity activity) {
        entries.add(activity);
        byItem.computeIfAbsent(activity.getItemId(), k -> new ArrayList<>()).add(activity);
    }

    public synchronized void appendAll(List<Activity> activities) {
        for (Activity activity : activities) {
            append(activity);
        }
    }

    public synchronized List<Activity> forItem(String itemId) {
        List<Activity> list = byItem.get(itemId);
        return list == null ? List.of() : List.copyOf(list);
    }

    /**
     * Newest first.
     */
    public synchronized List<Activity> recent(int limit) {
        int from = Math.max(0, entries.size() - Math.max(0, limit));
        List<Activity> tail = new ArrayList<>(entries.subList(from, entries.size()));
        Collections.reverse(tail);
        return tail;
    }

    public synchronized List<Activity> all() {
        return List.copyOf(entries);
    }

    public synchronized int size() {
        return entries.size();
    }
}
