package com.dcruver.compass.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Last-used sync settings, cached between sessions.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class SyncConfig {

    @JsonProperty("repo_url")
    private String remote;

    @JsonProperty("branch")
    private String branch;

    @JsonProperty("last_updated")
    private String lastUpdated;
}
