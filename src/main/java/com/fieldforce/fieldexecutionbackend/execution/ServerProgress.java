package com.fieldforce.fieldexecutionbackend.execution;

import com.fieldforce.fieldexecutionbackend.model.Activity;
import com.fieldforce.fieldexecutionbackend.model.ActivityStatus;
import com.fieldforce.fieldexecutionbackend.model.MediaRef;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * What the backend confirmed for a unit of work. {@code media} is {@code null} when the media
 * list could not be fetched.
 */
@Data
@NoArgsConstructor
public class ServerProgress {
    private Set<String> completed = new LinkedHashSet<>();
    private Set<String> skipped = new LinkedHashSet<>();
    private List<MediaRef> media;

    public static ServerProgress of(List<Activity> activities, List<MediaRef> media) {
        ServerProgress progress = new ServerProgress();
        for (Activity activity : activities) {
            if (activity.getStatus() == ActivityStatus.COMPLETED) {
                progress.completed.add(activity.getKey());
            } else if (activity.getStatus() == ActivityStatus.SKIPPED) {
                progress.skipped.add(activity.getKey());
            }
        }
        progress.media = media;
        return progress;
    }
}
