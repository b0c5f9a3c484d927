package io.github.drompincen.labseed.protocol.document;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Membership role, ordered by ascending GitLab access level.
 */
public enum MemberRole {
    @JsonProperty("guest") GUEST(10),
    @JsonProperty("planner") PLANNER(15),
    @JsonProperty("reporter") REPORTER(20),
    @JsonProperty("developer") DEVELOPER(30),
    @JsonProperty("maintainer") MAINTAINER(40),
    @JsonProperty("owner") OWNER(50);

    private final int accessLevel;

    MemberRole(int accessLevel) {
        this.accessLevel = accessLevel;
    }

    public int accessLevel() {
        return accessLevel;
    }
}
