package com.buildsentinel.core.model;

import com.buildsentinel.core.error.ValidationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Planned period during which alerts for the covered jobs are dropped.
 *
 * <p>
 * The interval is half-open: a window is active iff
 * {@code start <= now < end}. An empty {@code affectedJobs} set covers every
 * job; otherwise job names are matched exactly.
 * </p>
 *
 * @since 1.0.0
 */
public final class MaintenanceWindow implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String name;
    private final Instant start;
    private final Instant end;
    private final Set<String> affectedJobs;

    /**
     * @param name         unique window name
     * @param start        inclusive start
     * @param end          exclusive end; must be after {@code start}
     * @param affectedJobs jobs covered by the window; {@code null} or empty
     *                     covers all jobs
     * @throws ValidationException if a field is missing or {@code end <= start}
     */
    @JsonCreator
    public MaintenanceWindow(@JsonProperty("name") String name,
            @JsonProperty("start") Instant start,
            @JsonProperty("end") Instant end,
            @JsonProperty("affected_jobs") Collection<String> affectedJobs) {
        List<String> errors = new ArrayList<>();
        if (name == null || name.isBlank()) {
            errors.add("Maintenance window 'name' is required");
        }
        if (start == null) {
            errors.add("Maintenance window '" + name + "' requires 'start'");
        }
        if (end == null) {
            errors.add("Maintenance window '" + name + "' requires 'end'");
        }
        if (start != null && end != null && !end.isAfter(start)) {
            errors.add("Maintenance window '" + name + "' must end after it starts (start="
                    + start + ", end=" + end + ")");
        }
        if (!errors.isEmpty()) {
            throw new ValidationException("Invalid MaintenanceWindow: " + String.join("; ", errors));
        }

        this.name = name;
        this.start = start;
        this.end = end;
        Set<String> jobs = new LinkedHashSet<>();
        if (affectedJobs != null) {
            for (String job : affectedJobs) {
                if (job != null && !job.isBlank()) {
                    jobs.add(job.trim());
                }
            }
        }
        this.affectedJobs = Collections.unmodifiableSet(jobs);
    }

    /**
     * Window covering every job.
     */
    public static MaintenanceWindow forAllJobs(String name, Instant start, Instant end) {
        return new MaintenanceWindow(name, start, end, null);
    }

    /**
     * @param now instant to test
     * @return {@code true} iff {@code start <= now < end}
     */
    public boolean isActive(Instant now) {
        return !now.isBefore(start) && now.isBefore(end);
    }

    /**
     * @param jobName job to test
     * @return {@code true} if the window covers all jobs or names this one
     */
    public boolean affects(String jobName) {
        return affectedJobs.isEmpty() || affectedJobs.contains(jobName);
    }

    /**
     * @return {@code true} once {@code now} has reached the exclusive end
     */
    public boolean hasEnded(Instant now) {
        return !now.isBefore(end);
    }

    @JsonProperty("name")
    public String getName() {
        return name;
    }

    @JsonProperty("start")
    public Instant getStart() {
        return start;
    }

    @JsonProperty("end")
    public Instant getEnd() {
        return end;
    }

    @JsonProperty("affected_jobs")
    public Set<String> getAffectedJobs() {
        return affectedJobs;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MaintenanceWindow that))
            return false;
        return name.equals(that.name)
                && start.equals(that.start)
                && end.equals(that.end)
                && affectedJobs.equals(that.affectedJobs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, start, end, affectedJobs);
    }

    @Override
    public String toString() {
        return "MaintenanceWindow{" +
                "name='" + name + '\'' +
                ", start=" + start +
                ", end=" + end +
                ", affectedJobs=" + affectedJobs +
                '}';
    }
}
