package de.bsommerfeld.gridkeeper.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class DaemonConfig {

    /** Protocol generation baked into the channel name. */
    public static final String PROTOCOL_SUFFIX = "-v1";

    /** Environment variable through which a spawned daemon learns its socket path. */
    public static final String SOCKET_ENV = "GRIDKEEPER_SOCKET";

    @JsonProperty("namespace")
    private String namespace = "gridkeeper";

    @JsonProperty("socket-directory")
    private String socketDirectory;

    @JsonProperty("executable")
    private String executable;

    @JsonProperty("max-retries")
    private int maxRetries = 3;

    @JsonProperty("startup-settle-millis")
    private long startupSettleMillis = 500;

    @JsonProperty("retry-base-delay-millis")
    private long retryBaseDelayMillis = 200;

    @JsonProperty("file-operation-settle-millis")
    private long fileOperationSettleMillis = 100;

    @JsonProperty("max-frame-bytes")
    private int maxFrameBytes = 64 * 1024 * 1024;

    public String channelName() {
        return namespace + PROTOCOL_SUFFIX;
    }

    public String getNamespace() {
        return namespace;
    }

    public void setNamespace(String namespace) {
        this.namespace = namespace;
    }

    public String getSocketDirectory() {
        return socketDirectory;
    }

    public void setSocketDirectory(String socketDirectory) {
        this.socketDirectory = socketDirectory;
    }

    public String getExecutable() {
        return executable;
    }

    public void setExecutable(String executable) {
        this.executable = executable;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public long getStartupSettleMillis() {
        return startupSettleMillis;
    }

    public void setStartupSettleMillis(long startupSettleMillis) {
        this.startupSettleMillis = startupSettleMillis;
    }

    public long getRetryBaseDelayMillis() {
        return retryBaseDelayMillis;
    }

    public void setRetryBaseDelayMillis(long retryBaseDelayMillis) {
        this.retryBaseDelayMillis = retryBaseDelayMillis;
    }

    public long getFileOperationSettleMillis() {
        return fileOperationSettleMillis;
    }

    public void setFileOperationSettleMillis(long fileOperationSettleMillis) {
        this.fileOperationSettleMillis = fileOperationSettleMillis;
    }

    public int getMaxFrameBytes() {
        return maxFrameBytes;
    }

    public void setMaxFrameBytes(int maxFrameBytes) {
        this.maxFrameBytes = maxFrameBytes;
    }
}
