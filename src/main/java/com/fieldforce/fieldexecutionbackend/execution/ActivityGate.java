package com.fieldforce.fieldexecutionbackend.execution;

import com.fieldforce.fieldexecutionbackend.model.Activity;

import java.util.List;
import java.util.Set;

/**
 * Unlock rules for the activities of a visit.
 * <p>
 * Activities are worked in sequence order. An activity is <em>done</em> once it is completed, or
 * skipped when it is optional. The single unlockable activity is the first one that is not done;
 * a mandatory activity sitting in the skipped set is not done and keeps blocking.
 */
public final class ActivityGate {

    private ActivityGate() {
    }

    public static boolean isDone(Activity activity, Set<String> completed, Set<String> skipped) {
        String key = activity.getKey();
        if (completed.contains(key)) {
            return true;
        }
        return !activity.isMandatory() && skipped.contains(key);
    }

    /**
     * Index of the unlockable activity in {@code ordered}, or {@code ordered.size()} when every
     * activity is done.
     */
    public static int firstUnlockable(List<Activity> ordered, Set<String> completed, Set<String> skipped) {
        return advance(ordered, 0, completed, skipped);
    }

    static int advance(List<Activity> ordered, int from, Set<String> completed, Set<String> skipped) {
        int index = Math.max(from, 0);
        while (index < ordered.size() && isDone(ordered.get(index), completed, skipped)) {
            index++;
        }
        return index;
    }

    public static boolean canSkip(Activity activity) {
        return !activity.isMandatory();
    }
}
