package com.fieldforce.fieldexecutionbackend.execution;

import com.fieldforce.fieldexecutionbackend.config.FieldExecutionProperties;
import com.fieldforce.fieldexecutionbackend.config.FieldExecutionProperties.ActivityTemplate;
import com.fieldforce.fieldexecutionbackend.model.Activity;
import com.fieldforce.fieldexecutionbackend.model.ActivityStatus;
import com.fieldforce.fieldexecutionbackend.model.ActivityType;
import com.fieldforce.fieldexecutionbackend.model.Visit;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Resolves the ordered activity list of a visit. The configured template is always the list;
 * rows the backend holds for the visit are records of work already done and are laid over the
 * template as completed or skipped facts, matched by key, then name, then type. A row that
 * matches no template entry is appended as an optional activity.
 */
@Component
@RequiredArgsConstructor
public class ActivityCatalog {

    private final FieldExecutionProperties properties;

    public List<Activity> defaultActivities() {
        List<Activity> activities = new ArrayList<>();
        int sequence = 1;
        for (ActivityTemplate template : properties.getDefaultActivities()) {
            activities.add(new Activity(template.getKey(), template.getType(), template.getName(),
                    sequence++, template.isMandatory()));
        }
        return activities;
    }

    public List<Activity> activitiesFor(Visit visit) {
        List<Activity> resolved = defaultActivities();
        if (visit == null || visit.getActivities() == null || visit.getActivities().isEmpty()) {
            return resolved;
        }

        Set<String> claimed = new HashSet<>();
        int nextSequence = resolved.size() + 1;
        for (Activity row : visit.getActivities()) {
            ActivityStatus recorded = row.getStatus() == ActivityStatus.SKIPPED
                    ? ActivityStatus.SKIPPED : ActivityStatus.COMPLETED;
            Activity target = match(resolved, row, claimed);
            if (target == null) {
                target = row.copy();
                if (target.getType() == null) {
                    target.setType(ActivityType.CUSTOM);
                }
                target.setKey(isBlank(row.getKey()) ? slug(row, nextSequence) : row.getKey());
                target.setSequence(nextSequence++);
                target.setMandatory(false);
                resolved.add(target);
            } else {
                target.setResult(row.getResult());
                target.setCompletedAt(row.getCompletedAt());
            }
            claimed.add(target.getKey());
            // mandatory work is never skipped
            if (recorded == ActivityStatus.SKIPPED && target.isMandatory()) {
                continue;
            }
            target.setStatus(recorded);
        }
        return resolved;
    }

    private Activity match(List<Activity> activities, Activity row, Set<String> claimed) {
        if (!isBlank(row.getKey())) {
            for (Activity activity : activities) {
                if (activity.getKey().equals(row.getKey())) {
                    return activity;
                }
            }
        }
        if (!isBlank(row.getName())) {
            for (Activity activity : activities) {
                if (!claimed.contains(activity.getKey()) && activity.getName() != null
                        && activity.getName().equalsIgnoreCase(row.getName().trim())) {
                    return activity;
                }
            }
        }
        if (row.getType() != null && row.getType() != ActivityType.CUSTOM) {
            for (Activity activity : activities) {
                if (!claimed.contains(activity.getKey()) && activity.getType() == row.getType()) {
                    return activity;
                }
            }
        }
        return null;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private String slug(Activity activity, int position) {
        String name = activity.getName();
        if (name == null || name.isBlank()) {
            return "activity_" + position;
        }
        return name.trim().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "_");
    }
}
