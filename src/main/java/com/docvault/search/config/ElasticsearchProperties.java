package com.docvault.search.config;

import com.docvault.search.model.DocumentType;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Search backend connection and index configuration.
 *
 * Properties are prefixed with "elasticsearch" in application.yml.
 */
@ConfigurationProperties(prefix = "elasticsearch")
public class ElasticsearchProperties {
    /** Elasticsearch base URL, e.g. http://localhost:9200 */
    private String host = "http://localhost:9200";
    /** Prefix for every index name: {prefix}_articles, {prefix}_users */
    private String indexPrefix = "app";
    /** Basic auth user (optional, sent only together with password) */
    private String username;
    /** Basic auth password (optional) */
    private String password;
    /** Per-request timeout in milliseconds */
    private int timeoutMs = 20000;
    /** Max retries for transport failures */
    private int maxRetries = 10;
    /** Initial backoff between retries in milliseconds */
    private int retryBackoffMs = 200;
    /** Upper bound for a single backoff delay in milliseconds */
    private int retryMaxBackoffMs = 1000;
    /** Overall budget for one backend call including all retries, in milliseconds */
    private int retryTotalTimeoutMs = 30000;
    /** Whether a request timeout counts as a retryable transport failure */
    private boolean retryOnTimeout = true;
    /** Refresh policy for writes: false, true or wait_for */
    private String refresh = "false";
    private int numberOfShards = 1;
    private int numberOfReplicas = 0;
    /** Ping the cluster and create missing indexes before serving traffic */
    private boolean verifyOnStartup = true;

    public String indexName(DocumentType type) {
        return indexPrefix + "_" + type.getSuffix();
    }

    public String getHost() { return host; }
    public void setHost(String host) { this.host = host; }

    public String getIndexPrefix() { return indexPrefix; }
    public void setIndexPrefix(String indexPrefix) { this.indexPrefix = indexPrefix; }

    public String getUsername() { return username; }
    public void setUsername(String username) { this.username = username; }

    public String getPassword() { return password; }
    public void setPassword(String password) { this.password = password; }

    public int getTimeoutMs() { return timeoutMs; }
    public void setTimeoutMs(int timeoutMs) { this.timeoutMs = timeoutMs; }

    public int getMaxRetries() { return maxRetries; }
    public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }

    public int getRetryBackoffMs() { return retryBackoffMs; }
    public void setRetryBackoffMs(int retryBackoffMs) { this.retryBackoffMs = retryBackoffMs; }

    public int getRetryMaxBackoffMs() { return retryMaxBackoffMs; }
    public void setRetryMaxBackoffMs(int retryMaxBackoffMs) { this.retryMaxBackoffMs = retryMaxBackoffMs; }

    public int getRetryTotalTimeoutMs() { return retryTotalTimeoutMs; }
    public void setRetryTotalTimeoutMs(int retryTotalTimeoutMs) { this.retryTotalTimeoutMs = retryTotalTimeoutMs; }

    public boolean isRetryOnTimeout() { return retryOnTimeout; }
    public void setRetryOnTimeout(boolean retryOnTimeout) { this.retryOnTimeout = retryOnTimeout; }

    public String getRefresh() { return refresh; }
    public void setRefresh(String refresh) { this.refresh = refresh; }

    public int getNumberOfShards() { return numberOfShards; }
    public void setNumberOfShards(int numberOfShards) { this.numberOfShards = numberOfShards; }

    public int getNumberOfReplicas() { return numberOfReplicas; }
    public void setNumberOfReplicas(int numberOfReplicas) { this.numberOfReplicas = numberOfReplicas; }

    public boolean isVerifyOnStartup() { return verifyOnStartup; }
    public void setVerifyOnStartup(boolean verifyOnStartup) { this.verifyOnStartup = verifyOnStartup; }
}
