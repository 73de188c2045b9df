package com.tcode.gateway.directory;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

/**
 * A codespace as listed by the directory. Field names follow the GitHub REST
 * API so the list can be relayed to the browser as received.
 */
@Data
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class Codespace {

    private Long id;
    private String name;

    @JsonProperty("display_name")
    private String displayName;

    private String state;

    @JsonProperty("web_url")
    private String webUrl;

    @JsonProperty("created_at")
    private String createdAt;

    @JsonProperty("last_used_at")
    private String lastUsedAt;

    private Repository repository;
    private Machine machine;

    @JsonProperty("git_status")
    private GitStatus gitStatus;

    @JsonIgnore
    public String getRepositoryFullName() {
        return repository != null ? repository.getFullName() : null;
    }

    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Repository {
        private Long id;
        private String name;

        @JsonProperty("full_name")
        private String fullName;

        @JsonProperty("html_url")
        private String htmlUrl;
    }

    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Machine {
        private String name;

        @JsonProperty("display_name")
        private String displayName;

        @JsonProperty("operating_system")
        private String operatingSystem;

        private Integer cpus;

        @JsonProperty("memory_in_bytes")
        private Long memoryInBytes;
    }

    @Data
    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class GitStatus {
        private String ref;
        private Integer ahead;
        private Integer behind;

        @JsonProperty("has_uncommitted_changes")
        private Boolean hasUncommittedChanges;
    }
}
