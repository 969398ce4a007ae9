package com.plainer.collab.message;

import com.fasterxml.jackson.annotation.JsonProperty;

public enum ChangeType {
    @JsonProperty("insert")
    INSERT,
    @JsonProperty("delete")
    DELETE,
    @JsonProperty("replace")
    REPLACE
}
