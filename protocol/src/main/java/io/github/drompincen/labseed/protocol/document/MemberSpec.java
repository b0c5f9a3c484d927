package io.github.drompincen.labseed.protocol.document;

import com.fasterxml.jackson.annotation.JsonProperty;

public record MemberSpec(
        @JsonProperty("user_id") String userId,
        MemberRole role
) {
    public MemberSpec {
        role = role == null ? MemberRole.GUEST : role;
    }
}
