package de.bsommerfeld.gridkeeper.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class StorageConfig {

    @JsonProperty("data-directory")
    private String dataDirectory;

    /** Default target database when a write names none. */
    @JsonProperty("database-name")
    private String databaseName;

    @JsonProperty("checkpoint-interval-seconds")
    private long checkpointIntervalSeconds = 30;

    public String getDataDirectory() {
        return dataDirectory;
    }

    public void setDataDirectory(String dataDirectory) {
        this.dataDirectory = dataDirectory;
    }

    public String getDatabaseName() {
        return databaseName;
    }

    public void setDatabaseName(String databaseName) {
        this.databaseName = databaseName;
    }

    public long getCheckpointIntervalSeconds() {
        return checkpointIntervalSeconds;
    }

    public void setCheckpointIntervalSeconds(long checkpointIntervalSeconds) {
        this.checkpointIntervalSeconds = checkpointIntervalSeconds;
    }
}
