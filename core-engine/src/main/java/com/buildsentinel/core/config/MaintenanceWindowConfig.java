package com.buildsentinel.core.config;

import com.buildsentinel.core.error.ValidationException;
import com.buildsentinel.core.model.MaintenanceWindow;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * One entry of the {@code maintenanceWindows} list in {@code alerting.yml}.
 * {@code start} and {@code end} are ISO-8601 date-times with an offset, for
 * example {@code 2024-06-01T02:00:00Z}.
 *
 * @since 1.0.0
 */
public class MaintenanceWindowConfig {

    private String name;
    private String start;
    private String end;
    private List<String> affectedJobs = new ArrayList<>();

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getStart() {
        return start;
    }

    public void setStart(String start) {
        this.start = start;
    }

    public String getEnd() {
        return end;
    }

    public void setEnd(String end) {
        this.end = end;
    }

    public List<String> getAffectedJobs() {
        return affectedJobs;
    }

    public void setAffectedJobs(List<String> affectedJobs) {
        this.affectedJobs = affectedJobs != null ? new ArrayList<>(affectedJobs) : new ArrayList<>();
    }

    /**
     * @throws ValidationException if a timestamp does not parse or the window
     *                             is otherwise invalid
     */
    public MaintenanceWindow toWindow() {
        return new MaintenanceWindow(name, parse("start", start), parse("end", end), affectedJobs);
    }

    private Instant parse(String field, String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            return OffsetDateTime.parse(value.trim()).toInstant();
        } catch (DateTimeParseException e) {
            throw new ValidationException("Maintenance window '" + name + "' has an unparseable '"
                    + field + "': " + value, e);
        }
    }

    @Override
    public String toString() {
        return "MaintenanceWindowConfig{name='" + name + "', start=" + start + ", end=" + end
                + ", affectedJobs=" + affectedJobs + '}';
    }
}
