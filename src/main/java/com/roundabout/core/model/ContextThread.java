package com.roundabout.core.model;

import java.io.Serializable;
import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * The operational context handed to exactly one agent. A child never shares
 * its parent's thread: {@link #childOf} always derives a new one.
 *
 * @param id                   unique thread identifier
 * @param topLevelGoal         goal shared by the whole hierarchy
 * @param parentAgentId        agent that spawned the owner of this thread (nullable for roots)
 * @param taskDefinition       the owner's specific task
 * @param configurationProfile profile of the owning agent
 * @param memoryScope          memory scope of the owning agent
 * @param resourceBudget       ceiling for the owning agent
 * @param recursionDepth       0 for roots, parent depth + 1 for children
 * @param workspaceBranch      workspace branch inherited down the hierarchy
 * @param createdAt            creation time, used for elapsed-time decisions
 * @param updatedAt            last bookkeeping update
 */
public record ContextThread(
    String id,
    String topLevelGoal,
    String parentAgentId,
    String taskDefinition,
    ConfigurationProfile configurationProfile,
    String memoryScope,
    ResourceBudget resourceBudget,
    int recursionDepth,
    String workspaceBranch,
    Instant createdAt,
    Instant updatedAt
) implements Serializable {

    public static final String DEFAULT_USER = "default-user";
    private static final String USER_SCOPE_PREFIX = "user:";

    public static ContextThread root(String topLevelGoal, String taskDefinition,
                                     ConfigurationProfile profile, ResourceBudget budget, Clock clock) {
        Instant now = clock.instant();
        return new ContextThread(UUID.randomUUID().toString(), topLevelGoal, null, taskDefinition,
                profile, profile.memoryScope(), budget, 0, "main", now, now);
    }

    /**
     * Derives the thread for a child of the agent owning {@code parent}.
     */
    public static ContextThread childOf(ContextThread parent, String parentAgentId, ConfigurationProfile childProfile,
                                        String taskDefinition, ResourceBudget budget, Clock clock) {
        Instant now = clock.instant();
        return new ContextThread(UUID.randomUUID().toString(), parent.topLevelGoal(), parentAgentId, taskDefinition,
                childProfile, childProfile.memoryScope(), budget, parent.recursionDepth() + 1,
                parent.workspaceBranch(), now, now);
    }

    public boolean isRoot() {
        return parentAgentId == null;
    }

    /**
     * Owning user, taken from a {@code user:<id>} memory scope.
     */
    public String userId() {
        if (memoryScope != null && memoryScope.startsWith(USER_SCOPE_PREFIX)
                && memoryScope.length() > USER_SCOPE_PREFIX.length()) {
            return memoryScope.substring(USER_SCOPE_PREFIX.length());
        }
        return DEFAULT_USER;
    }

    public ContextThread touch(Clock clock) {
        return new ContextThread(id, topLevelGoal, parentAgentId, taskDefinition, configurationProfile, memoryScope,
                resourceBudget, recursionDepth, workspaceBranch, createdAt, clock.instant());
    }
}
