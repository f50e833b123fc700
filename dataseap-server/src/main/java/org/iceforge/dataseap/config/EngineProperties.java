package org.iceforge.dataseap.config;

import org.iceforge.dataseap.engine.EngineClientConfig;
import org.iceforge.dataseap.engine.SelectionPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Connection settings for the analytical engine frontends.
 */
@ConfigurationProperties(prefix = "dataseap.engine")
public class EngineProperties {

    /** Frontend addresses, {@code host} or {@code host:port}. */
    private List<String> hosts = new ArrayList<>(List.of("localhost:8030"));

    /** Frontends for stream load and 2PC control. Empty means {@link #hosts}. */
    private List<String> loadHosts = new ArrayList<>();

    /** Port used for addresses that carry none. */
    private int httpPort = EngineClientConfig.DEFAULT_HTTP_PORT;

    private String user = "root";

    private String password = "";

    /** Default database sent with queries. */
    private String database;

    private Duration connectTimeout = Duration.ofSeconds(10);

    private Duration queryTimeout = Duration.ofSeconds(30);

    private SelectionPolicy querySelection = SelectionPolicy.RANDOM;

    /** Upper bound of pooled HTTP connections across all frontends. */
    private int maxConnections = 100;

    public EngineClientConfig toClientConfig() {
        return new EngineClientConfig(hosts, loadHosts, httpPort, user, password, database,
                connectTimeout, queryTimeout, querySelection, maxConnections);
    }

    public List<String> getHosts() {
        return hosts;
    }

    public void setHosts(List<String> hosts) {
        this.hosts = hosts;
    }

    public List<String> getLoadHosts() {
        return loadHosts;
    }

    public void setLoadHosts(List<String> loadHosts) {
        this.loadHosts = loadHosts;
    }

    public int getHttpPort() {
        return httpPort;
    }

    public void setHttpPort(int httpPort) {
        this.httpPort = httpPort;
    }

    public String getUser() {
        return user;
    }

    public void setUser(String user) {
        this.user = user;
    }

    public String getPassword() {
        return password;
    }

    public void setPassword(String password) {
        this.password = password;
    }

    public String getDatabase() {
        return database;
    }

    public void setDatabase(String database) {
        this.database = database;
    }

    public Duration getConnectTimeout() {
        return connectTimeout;
    }

    public void setConnectTimeout(Duration connectTimeout) {
        this.connectTimeout = connectTimeout;
    }

    public Duration getQueryTimeout() {
        return queryTimeout;
    }

    public void setQueryTimeout(Duration queryTimeout) {
        this.queryTimeout = queryTimeout;
    }

    public SelectionPolicy getQuerySelection() {
        return querySelection;
    }

    public void setQuerySelection(SelectionPolicy querySelection) {
        this.querySelection = querySelection;
    }

    public int getMaxConnections() {
        return maxConnections;
    }

    public void setMaxConnections(int maxConnections) {
        this.maxConnections = maxConnections;
    }
}
