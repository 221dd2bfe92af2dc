// file: host/src/main/java/io/threadtree/host/JsonHostConfig.java
package io.threadtree.host;

/**
 * JSON shape of a host config file. Absent fields keep their defaults.
 */
public class JsonHostConfig {
    public Integer maxDepth;
    public Integer depthLimit;
    public Integer maxNodes;
    public Long readyTimeoutMillis;
    public Long joinTimeoutMillis;
    public Long runSeconds;
}
