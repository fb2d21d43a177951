package com.fieldforce.fieldexecutionbackend.execution;

import com.fieldforce.fieldexecutionbackend.exception.ExecutionValidationException;
import com.fieldforce.fieldexecutionbackend.model.Activity;
import com.fieldforce.fieldexecutionbackend.model.ActivityStatus;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Ordered activities of one visit with a cursor on the activity that may be worked on now.
 * The cursor only moves on a transition.
 */
public class ActivitySequence {

    private final String visitId;
    private final List<Activity> activities;
    private final Map<String, Integer> positions = new LinkedHashMap<>();
    private final Set<String> completed;
    private final Set<String> skipped;
    private final boolean readOnly;

    private int cursor;

    public ActivitySequence(String visitId, List<Activity> activities,
                            Set<String> completed, Set<String> skipped, boolean readOnly) {
        this.visitId = visitId;
        this.activities = new ArrayList<>();
        activities.stream()
                .sorted(Comparator.comparingInt(Activity::getSequence))
                .map(Activity::copy)
                .forEach(this.activities::add);
        for (int i = 0; i < this.activities.size(); i++) {
            positions.put(this.activities.get(i).getKey(), i);
        }
        this.completed = new LinkedHashSet<>(completed);
        this.skipped = new LinkedHashSet<>(skipped);
        // a mandatory activity can never count as skipped
        for (Activity activity : this.activities) {
            if (activity.isMandatory()) {
                this.skipped.remove(activity.getKey());
            }
        }
        this.readOnly = readOnly;
        this.cursor = ActivityGate.firstUnlockable(this.activities, this.completed, this.skipped);
        applyStatuses();
    }

    public String getVisitId() {
        return visitId;
    }

    public boolean isReadOnly() {
        return readOnly;
    }

    public List<Activity> getActivities() {
        return Collections.unmodifiableList(activities);
    }

    public Set<String> getCompleted() {
        return Collections.unmodifiableSet(completed);
    }

    public Set<String> getSkipped() {
        return Collections.unmodifiableSet(skipped);
    }

    public Optional<Activity> find(String key) {
        Integer position = positions.get(key);
        return position == null ? Optional.empty() : Optional.of(activities.get(position));
    }

    /**
     * The activity that may be worked on now. Empty when everything is done or the visit is
     * read-only.
     */
    public Optional<Activity> current() {
        if (readOnly || cursor >= activities.size()) {
            return Optional.empty();
        }
        return Optional.of(activities.get(cursor));
    }

    public boolean isUnlockable(String key) {
        return current().map(a -> a.getKey().equals(key)).orElse(false);
    }

    public boolean isCompleted(String key) {
        return completed.contains(key);
    }

    public ActivityAccess accessOf(String key) {
        if (readOnly) {
            return ActivityAccess.READ_ONLY;
        }
        if (isUnlockable(key)) {
            return ActivityAccess.CURRENT;
        }
        Activity activity = requireActivity(key);
        if (ActivityGate.isDone(activity, completed, skipped)) {
            return ActivityAccess.DONE;
        }
        return ActivityAccess.LOCKED;
    }

    /**
     * Completes the current activity, or amends an already completed one. Amending leaves the
     * cursor where it is.
     *
     * @return true when this was an amendment
     */
    public boolean complete(String key) {
        ensureWritable();
        Activity activity = requireActivity(key);
        if (completed.contains(key)) {
            return true;
        }
        if (skipped.contains(key)) {
            throw new ExecutionValidationException(activity.getName() + " was skipped and cannot be completed");
        }
        if (!isUnlockable(key)) {
            throw new ExecutionValidationException(activity.getName() + " is locked until "
                    + current().map(Activity::getName).orElse("earlier activities") + " is done");
        }
        completed.add(key);
        moveCursor();
        return false;
    }

    public void skip(String key) {
        ensureWritable();
        Activity activity = requireActivity(key);
        if (!ActivityGate.canSkip(activity)) {
            throw new ExecutionValidationException(activity.getName() + " is mandatory and cannot be skipped");
        }
        if (!isUnlockable(key)) {
            throw new ExecutionValidationException(activity.getName() + " can only be skipped while it is the current activity");
        }
        skipped.add(key);
        moveCursor();
    }

    /**
     * Mandatory activities that are not completed yet, in sequence order.
     */
    public List<Activity> pendingMandatory() {
        return activities.stream()
                .filter(Activity::isMandatory)
                .filter(a -> !completed.contains(a.getKey()))
                .toList();
    }

    public boolean hasProgress() {
        return !completed.isEmpty() || !skipped.isEmpty();
    }

    private void moveCursor() {
        cursor = ActivityGate.advance(activities, cursor, completed, skipped);
        applyStatuses();
    }

    private void applyStatuses() {
        for (Activity activity : activities) {
            if (completed.contains(activity.getKey())) {
                activity.setStatus(ActivityStatus.COMPLETED);
            } else if (skipped.contains(activity.getKey())) {
                activity.setStatus(ActivityStatus.SKIPPED);
            } else {
                activity.setStatus(ActivityStatus.PENDING);
            }
        }
    }

    private void ensureWritable() {
        if (readOnly) {
            throw new ExecutionValidationException("Visit " + visitId + " is closed and can only be viewed");
        }
    }

    private Activity requireActivity(String key) {
        return find(key).orElseThrow(() ->
                new ExecutionValidationException("Unknown activity " + key + " for visit " + visitId));
    }
}
