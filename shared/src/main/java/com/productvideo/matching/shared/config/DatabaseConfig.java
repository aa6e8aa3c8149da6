package com.productvideo.matching.shared.config;

import java.util.Objects;

public class DatabaseConfig {
    private final String jdbcUrl;
    private final String username;
    private final String password;

    public DatabaseConfig(String jdbcUrl, String username, String password) {
        this.jdbcUrl = Objects.requireNonNull(jdbcUrl, "jdbcUrl is null");
        this.username = Objects.requireNonNull(username, "username is null");
        this.password = password;
    }

    public static DatabaseConfig fromEnv(EnvConfig env) {
        return new DatabaseConfig(env.require("PG_URL"), env.require("PG_USER"), env.get("PG_PASSWORD", ""));
    }

    public String getJdbcUrl() {
        return jdbcUrl;
    }

    public String getUsername() {
        return username;
    }

    public String getPassword() {
        return password;
    }

    @Override
    public String toString() {
        return "DatabaseConfig{jdbcUrl='" + jdbcUrl + "', username='" + username + "'}";
    }
}
