package com.vedant.queryguard.dto;

public class SqlCheckRequestDTO {
    private String sql;

    public SqlCheckRequestDTO() {}

    public String getSql() { return sql; }
    public void setSql(String sql) { this.sql = sql; }
}
