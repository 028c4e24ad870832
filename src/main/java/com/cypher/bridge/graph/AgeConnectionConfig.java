package com.cypher.bridge.graph;

/**
 * Connection settings for a PostgreSQL server with the Apache AGE extension.
 */
public class AgeConnectionConfig {

    private final String host;
    private final int port;
    private final String database;
    private final String user;
    private final String password;
    private final String graphName;
    private final int maxPoolSize;
    private final int minIdle;
    private final long connectionTimeoutMillis;
    private final String applicationName;
    private final boolean decodeAgtype;

    private AgeConnectionConfig(Builder builder) {
        this.host = builder.host;
        this.port = builder.port;
        this.database = builder.database;
        this.user = builder.user;
        this.password = builder.password;
        this.graphName = builder.graphName;
        this.maxPoolSize = builder.maxPoolSize;
        this.minIdle = builder.minIdle;
        this.connectionTimeoutMillis = builder.connectionTimeoutMillis;
        this.applicationName = builder.applicationName;
        this.decodeAgtype = builder.decodeAgtype;
    }

    public String getHost() { return host; }
    public int getPort() { return port; }
    public String getDatabase() { return database; }
    public String getUser() { return user; }
    public String getPassword() { return password; }
    public String getGraphName() { return graphName; }
    public int getMaxPoolSize() { return maxPoolSize; }
    public int getMinIdle() { return minIdle; }
    public long getConnectionTimeoutMillis() { return connectionTimeoutMillis; }
    public String getApplicationName() { return applicationName; }
    public boolean isDecodeAgtype() { return decodeAgtype; }

    public String jdbcUrl() {
        return "jdbc:postgresql://" + host + ":" + port + "/" + database;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String host = "localhost";
        private int port = 5432;
        private String database = "postgres";
        private String user = "postgres";
        private String password = "";
        private String graphName = "demo";
        private int maxPoolSize = 5;
        private int minIdle = 1;
        private long connectionTimeoutMillis = 30_000;
        private String applicationName = "cypher-bridge";
        private boolean decodeAgtype = true;

        public Builder host(String host) {
            if (host == null || host.isBlank()) throw new IllegalArgumentException("host must not be blank");
            this.host = host;
            return this;
        }

        public Builder port(int port) {
            if (port <= 0 || port > 65535) throw new IllegalArgumentException("port must be in 1..65535");
            this.port = port;
            return this;
        }

        public Builder database(String database) {
            if (database == null || database.isBlank()) throw new IllegalArgumentException("database must not be blank");
            this.database = database;
            return this;
        }

        public Builder user(String user) {
            this.user = user;
            return this;
        }

        public Builder password(String password) {
            this.password = password != null ? password : "";
            return this;
        }

        public Builder graphName(String graphName) {
            this.graphName = GraphNames.validate(graphName);
            return this;
        }

        public Builder maxPoolSize(int maxPoolSize) {
            if (maxPoolSize <= 0) throw new IllegalArgumentException("maxPoolSize must be > 0");
            this.maxPoolSize = maxPoolSize;
            return this;
        }

        public Builder minIdle(int minIdle) {
            if (minIdle < 0) throw new IllegalArgumentException("minIdle must be >= 0");
            this.minIdle = minIdle;
            return this;
        }

        public Builder connectionTimeoutMillis(long connectionTimeoutMillis) {
            // HikariCP rejects anything below 250ms
            if (connectionTimeoutMillis < 250) throw new IllegalArgumentException("connectionTimeoutMillis must be >= 250");
            this.connectionTimeoutMillis = connectionTimeoutMillis;
            return this;
        }

        public Builder applicationName(String applicationName) {
            this.applicationName = applicationName;
            return this;
        }

        public Builder decodeAgtype(boolean decodeAgtype) {
            this.decodeAgtype = decodeAgtype;
            return this;
        }

        public AgeConnectionConfig build() {
            if (minIdle > maxPoolSize) {
                throw new IllegalArgumentException("minIdle cannot exceed maxPoolSize");
            }
            return new AgeConnectionConfig(this);
        }
    }

    @Override
    public String toString() {
        return "AgeConnectionConfig{" +
                "host='" + host + '\'' +
                ", port=" + port +
                ", database='" + database + '\'' +
                ", user='" + user + '\'' +
                ", password='" + (password.isEmpty() ? "" : "****") + '\'' +
                ", graphName='" + graphName + '\'' +
                ", maxPoolSize=" + maxPoolSize +
                ", minIdle=" + minIdle +
                ", connectionTimeoutMillis=" + connectionTimeoutMillis +
                ", applicationName='" + applicationName + '\'' +
                '}';
    }
}
