package com.infrakit.synth.resource.cloudwatch;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import com.infrakit.synth.model.ConfigurationException;
import com.infrakit.synth.model.IdGenerator;
import com.infrakit.synth.model.ResourceId;

public class LogGroupBuilder {

    /**
     * Retention periods the logs service accepts.
     */
    public static final Set<Integer> ALLOWED_RETENTION_DAYS = Set.of(
            1, 3, 5, 7, 14, 30, 60, 90, 120, 150, 180, 365, 400, 545, 731,
            1096, 1827, 2192, 2557, 2922, 3288, 3653);

    private final ResourceId resourceId;
    private IdGenerator idGenerator = IdGenerator.shared();
    private String logGroupName;
    private LogGroupClass logGroupClass;
    private Integer retentionInDays;

    private LogGroupBuilder(ResourceId resourceId) {
        this.resourceId = resourceId;
    }

    public static LogGroupBuilder create(String id) {
        return create(ResourceId.of(id));
    }

    public static LogGroupBuilder create(ResourceId id) {
        return new LogGroupBuilder(id);
    }

    public LogGroupBuilder logGroupName(String logGroupName) {
        this.logGroupName = logGroupName;
        return this;
    }

    public LogGroupBuilder logGroupClass(LogGroupClass logGroupClass) {
        this.logGroupClass = logGroupClass;
        return this;
    }

    public LogGroupBuilder retentionInDays(int retentionInDays) {
        this.retentionInDays = retentionInDays;
        return this;
    }

    public LogGroupBuilder idGenerator(IdGenerator idGenerator) {
        this.idGenerator = idGenerator;
        return this;
    }

    public LogGroup build() {
        List<String> violations = new ArrayList<>();
        if (retentionInDays != null && !ALLOWED_RETENTION_DAYS.contains(retentionInDays)) {
            violations.add("unsupported log retention of " + retentionInDays + " days");
        }
        if (logGroupName != null && (logGroupName.isBlank() || logGroupName.length() > 512)) {
            violations.add("log group name must be between 1 and 512 characters");
        }
        if (!violations.isEmpty()) {
            throw new ConfigurationException(violations);
        }

        LogGroupProperties properties = LogGroupProperties.builder()
                .logGroupName(logGroupName)
                .logGroupClass(logGroupClass)
                .retentionInDays(retentionInDays)
                .build();
        return new LogGroup(resourceId, idGenerator.generate(LogGroup.KIND), properties);
    }
}
