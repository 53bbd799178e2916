package com.schemalens.dialects.jdbc;

import com.schemalens.core.model.Engine;

/**
 * Where and how to connect. Unset fields are null; {@code port} falls back to the engine's
 * default. An explicit {@code url} wins over the individual parts.
 */
public record ConnectionSettings(
        Engine engine,
        String host,
        Integer port,
        String database,
        String user,
        String password,
        String serviceName,
        String sid,
        String path,
        String url,
        boolean trustedConnection
) {
    public int effectivePort() {
        return port != null ? port : engine.defaultPort();
    }

    /**
     * @throws ConfigurationException when a required setting for the engine is missing
     */
    public ConnectionSettings validate() {
        if (url != null) {
            return this;
        }
        switch (engine) {
            case SQLITE -> {
                if (path == null && database == null) {
                    throw new ConfigurationException("Database path is required for SQLite");
                }
            }
            case ORACLE -> {
                requireHost();
                if (serviceName == null && sid == null && database == null) {
                    throw new ConfigurationException("Service name or SID is required for Oracle");
                }
                if (user == null || password == null) {
                    throw new ConfigurationException("Username and password are required for Oracle");
                }
            }
            case MSSQL -> {
                requireHost();
                requireDatabase();
                if (!trustedConnection && (user == null || password == null)) {
                    throw new ConfigurationException(
                            "Either a trusted connection or username and password is required for SQL Server");
                }
            }
            default -> {
                requireHost();
                requireDatabase();
                if (user == null) {
                    throw new ConfigurationException("Username is required");
                }
            }
        }
        return this;
    }

    private void requireHost() {
        if (host == null) {
            throw new ConfigurationException("Host is required");
        }
    }

    private void requireDatabase() {
        if (database == null) {
            throw new ConfigurationException("Database is required");
        }
    }

    @Override
    public String toString() {
        return "ConnectionSettings{engine=" + engine + ", host=" + host + ", port=" + port
                + ", database=" + database + ", user=" + user + ", password=" + (password == null ? null : "****")
                + ", path=" + path + "}";
    }

    public static Builder builder(Engine engine) {
        return new Builder(engine);
    }

    public static class Builder {
        private final Engine engine;
        private String host;
        private Integer port;
        private String database;
        private String user;
        private String password;
        private String serviceName;
        private String sid;
        private String path;
        private String url;
        private boolean trustedConnection;

        private Builder(Engine engine) {
            this.engine = engine;
        }

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder port(Integer port) {
            this.port = port;
            return this;
        }

        public Builder database(String database) {
            this.database = database;
            return this;
        }

        public Builder user(String user) {
            this.user = user;
            return this;
        }

        public Builder password(String password) {
            this.password = password;
            return this;
        }

        public Builder serviceName(String serviceName) {
            this.serviceName = serviceName;
            return this;
        }

        public Builder sid(String sid) {
            this.sid = sid;
            return this;
        }

        public Builder path(String path) {
            this.path = path;
            return this;
        }

        public Builder url(String url) {
            this.url = url;
            return this;
        }

        public Builder trustedConnection(boolean trustedConnection) {
            this.trustedConnection = trustedConnection;
            return this;
        }

        public ConnectionSettings build() {
            return new ConnectionSettings(engine, host, port, database, user, password, serviceName, sid, path,
                    url, trustedConnection);
        }
    }
}
