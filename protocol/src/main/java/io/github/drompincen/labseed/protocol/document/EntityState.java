package io.github.drompincen.labseed.protocol.document;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Declared state of an epic or issue. GitLab only accepts {@code close}/{@code reopen}
 * transitions after creation, so a closed declaration is applied as an update.
 */
public enum EntityState {
    @JsonProperty("opened") OPENED,
    @JsonProperty("closed") CLOSED
}
