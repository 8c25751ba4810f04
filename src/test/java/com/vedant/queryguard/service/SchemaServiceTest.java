package com.vedant.queryguard.service;

import com.vedant.queryguard.util.SchemaColumnResolver;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;

import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class SchemaServiceTest {

    @Test
    @SuppressWarnings("unchecked")
    void describesTablesInTheTextualSchemaFormat() throws Exception {
        Connection con = mock(Connection.class);
        DatabaseMetaData md = mock(DatabaseMetaData.class);
        when(con.getMetaData()).thenReturn(md);
        when(con.getCatalog()).thenReturn("shop");
        when(con.getSchema()).thenReturn("public");

        ResultSet tables = mock(ResultSet.class);
        when(tables.next()).thenReturn(true, false);
        when(tables.getString("TABLE_NAME")).thenReturn("users");
        when(md.getTables(eq("shop"), eq("public"), eq("%"), any(String[].class))).thenReturn(tables);

        ResultSet keys = mock(ResultSet.class);
        when(keys.next()).thenReturn(true, false);
        when(keys.getString("COLUMN_NAME")).thenReturn("id");
        when(md.getPrimaryKeys("shop", "public", "users")).thenReturn(keys);

        ResultSet cols = mock(ResultSet.class);
        when(cols.next()).thenReturn(true, true, false);
        when(cols.getString("COLUMN_NAME")).thenReturn("id", "email");
        when(cols.getString("TYPE_NAME")).thenReturn("int4", "varchar");
        when(cols.getString("IS_NULLABLE")).thenReturn("NO");
        when(md.getColumns("shop", "public", "users", "%")).thenReturn(cols);

        JdbcTemplate jdbc = mock(JdbcTemplate.class);
        when(jdbc.execute(any(ConnectionCallback.class)))
                .thenAnswer(inv -> ((ConnectionCallback<String>) inv.getArgument(0)).doInConnection(con));

        String schema = new SchemaService(jdbc).describeSchema();

        assertEquals("Table: users\n  - id (int4) PRIMARY KEY\n  - email (varchar) NOT NULL\n\n", schema);
        assertEquals(List.of("id", "email"), SchemaColumnResolver.columnsForTable(schema, "users"));
    }
}
