package com.schemalens.dialects.mysql;

/**
 * {@code information_schema} queries for MySQL 8.0.16 and later. A MySQL schema is a
 * database, so every query spans the whole server and the extractor narrows it down.
 */
public final class MysqlQueries {

    private MysqlQueries() {
    }

    public static final String DESCRIBE = """
            SELECT DATABASE() AS database_name,
                   VERSION() AS version,
                   DATABASE() AS default_schema
            """;

    public static final String SCHEMAS = """
            SELECT schema_name AS schema_name
            FROM information_schema.schemata
            ORDER BY schema_name
            """;

    public static final String TABLES = """
            SELECT t.table_schema AS schema_name,
                   t.table_name AS table_name,
                   t.table_rows AS row_count,
                   ROUND((t.data_length + t.index_length) / 1024) AS size_kb,
                   NULLIF(t.table_comment, '') AS description,
                   t.engine AS storage_engine
            FROM information_schema.tables t
            WHERE t.table_type = 'BASE TABLE'
            ORDER BY t.table_schema, t.table_name
            """;

    public static final String COLUMNS = """
            SELECT c.table_schema AS schema_name,
                   c.table_name AS table_name,
                   c.column_name AS column_name,
                   c.ordinal_position AS ordinal,
                   c.column_type AS data_type,
                   c.is_nullable = 'YES' AS nullable,
                   c.column_default AS default_value,
                   c.extra AS extra,
                   NULLIF(c.generation_expression, '') AS generation_expression,
                   NULLIF(c.column_comment, '') AS description
            FROM information_schema.columns c
            JOIN information_schema.tables t
              ON t.table_schema = c.table_schema AND t.table_name = c.table_name
            WHERE t.table_type = 'BASE TABLE'
            ORDER BY c.table_schema, c.table_name, c.ordinal_position
            """;

    public static final String PRIMARY_KEYS = """
            SELECT k.table_schema AS schema_name,
                   k.table_name AS table_name,
                   k.constraint_name AS constraint_name,
                   k.column_name AS column_name,
                   k.ordinal_position AS key_ordinal,
                   CASE WHEN t.engine = 'InnoDB' THEN 1 END AS clustered
            FROM information_schema.key_column_usage k
            JOIN information_schema.tables t
              ON t.table_schema = k.table_schema AND t.table_name = k.table_name
            WHERE k.constraint_name = 'PRIMARY'
            ORDER BY k.table_schema, k.table_name, k.ordinal_position
            """;

    public static final String INDEXES = """
            SELECT s.table_schema AS schema_name,
                   s.table_name AS table_name,
                   s.index_name AS index_name,
                   s.non_unique = 0 AS is_unique,
                   s.index_name = 'PRIMARY' AS is_primary,
                   s.column_name AS column_name,
                   s.expression AS expression,
                   s.seq_in_index AS key_ordinal,
                   s.index_type AS method,
                   CASE WHEN s.index_name = 'PRIMARY' AND t.engine = 'InnoDB' THEN 1 END AS clustered
            FROM information_schema.statistics s
            JOIN information_schema.tables t
              ON t.table_schema = s.table_schema AND t.table_name = s.table_name
            WHERE t.table_type = 'BASE TABLE'
            ORDER BY s.table_schema, s.table_name, s.index_name, s.seq_in_index
            """;

    public static final String FOREIGN_KEYS = """
            SELECT k.table_schema AS schema_name,
                   k.table_name AS table_name,
                   k.constraint_name AS constraint_name,
                   k.column_name AS column_name,
                   k.ordinal_position AS key_ordinal,
                   k.referenced_table_schema AS ref_schema,
                   k.referenced_table_name AS ref_table,
                   k.referenced_column_name AS ref_column,
                   r.delete_rule AS on_delete,
                   r.update_rule AS on_update
            FROM information_schema.key_column_usage k
            JOIN information_schema.referential_constraints r
              ON r.constraint_schema = k.constraint_schema
             AND r.constraint_name = k.constraint_name
             AND r.table_name = k.table_name
            WHERE k.referenced_table_name IS NOT NULL
            ORDER BY k.table_schema, k.table_name, k.constraint_name, k.ordinal_position
            """;

    public static final String CHECKS = """
            SELECT tc.table_schema AS schema_name,
                   tc.table_name AS table_name,
                   tc.constraint_name AS constraint_name,
                   cc.check_clause AS expression
            FROM information_schema.table_constraints tc
            JOIN information_schema.check_constraints cc
              ON cc.constraint_schema = tc.constraint_schema
             AND cc.constraint_name = tc.constraint_name
            WHERE tc.constraint_type = 'CHECK'
            ORDER BY tc.table_schema, tc.table_name, tc.constraint_name
            """;

    public static final String VIEWS = """
            SELECT 'VIEW' AS row_kind,
                   v.table_schema AS schema_name,
                   v.table_name AS view_name,
                   v.view_definition AS definition,
                   0 AS materialized,
                   NULL AS description
            FROM information_schema.views v
            ORDER BY v.table_schema, v.table_name
            """;

    public static final String VIEW_COLUMNS = """
            SELECT 'COLUMN' AS row_kind,
                   c.table_schema AS schema_name,
                   c.table_name AS view_name,
                   c.column_name AS column_name,
                   c.ordinal_position AS ordinal,
                   c.column_type AS data_type,
                   c.is_nullable = 'YES' AS nullable
            FROM information_schema.columns c
            JOIN information_schema.views v
              ON v.table_schema = c.table_schema AND v.table_name = c.table_name
            ORDER BY c.table_schema, c.table_name, c.ordinal_position
            """;

    public static final String VIEW_DEPENDENCIES = """
            SELECT 'DEPENDENCY' AS row_kind,
                   u.view_schema AS schema_name,
                   u.view_name AS view_name,
                   u.table_schema AS ref_schema,
                   u.table_name AS ref_name
            FROM information_schema.view_table_usage u
            ORDER BY u.view_schema, u.view_name, u.table_schema, u.table_name
            """;

    public static final String ROUTINES = """
            SELECT 'ROUTINE' AS row_kind,
                   r.routine_schema AS schema_name,
                   r.routine_name AS routine_name,
                   r.specific_name AS specific_name,
                   r.routine_type AS routine_type,
                   r.routine_body AS language,
                   r.routine_definition AS definition,
                   CASE WHEN r.routine_type = 'FUNCTION' THEN r.dtd_identifier END AS return_type,
                   NULLIF(r.routine_comment, '') AS description
            FROM information_schema.routines r
            ORDER BY r.routine_schema, r.routine_name
            """;

    // ordinal 0 is the return value of a function
    public static final String ROUTINE_PARAMETERS = """
            SELECT 'PARAMETER' AS row_kind,
                   p.specific_schema AS schema_name,
                   p.specific_name AS specific_name,
                   p.parameter_name AS parameter_name,
                   p.ordinal_position AS ordinal,
                   p.dtd_identifier AS data_type,
                   p.parameter_mode AS mode
            FROM information_schema.parameters p
            WHERE p.ordinal_position > 0
            ORDER BY p.specific_schema, p.specific_name, p.ordinal_position
            """;

    public static final String TRIGGERS = """
            SELECT t.trigger_schema AS schema_name,
                   t.trigger_name AS trigger_name,
                   t.event_object_schema AS table_schema,
                   t.event_object_table AS table_name,
                   t.action_timing AS timing,
                   t.event_manipulation AS events,
                   1 AS enabled,
                   t.action_statement AS definition
            FROM information_schema.triggers t
            ORDER BY t.trigger_schema, t.trigger_name
            """;

    // roles are locked accounts without a password
    public static final String PRINCIPALS = """
            SELECT 'PRINCIPAL' AS row_kind,
                   CONCAT(u.user, '@', u.host) AS principal_name,
                   CASE WHEN u.account_locked = 'Y' AND u.authentication_string = '' THEN 'ROLE'
                        ELSE 'USER' END AS principal_kind
            FROM mysql.user u
            WHERE u.user NOT LIKE 'mysql.%'
            ORDER BY u.user, u.host
            """;

    public static final String GRANTS = """
            SELECT 'GRANT' AS row_kind,
                   REPLACE(g.grantee, '''', '') AS principal_name,
                   g.privilege_type AS privilege,
                   NULL AS object_schema,
                   g.table_schema AS object_name
            FROM information_schema.schema_privileges g
            UNION ALL
            SELECT 'GRANT' AS row_kind,
                   REPLACE(g.grantee, '''', '') AS principal_name,
                   g.privilege_type AS privilege,
                   g.table_schema AS object_schema,
                   g.table_name AS object_name
            FROM information_schema.table_privileges g
            """;

    // from_user is the role, to_user the account it was granted to
    public static final String MEMBERSHIPS = """
            SELECT 'MEMBERSHIP' AS row_kind,
                   CONCAT(e.to_user, '@', e.to_host) AS principal_name,
                   CONCAT(e.from_user, '@', e.from_host) AS role_name
            FROM mysql.role_edges e
            ORDER BY e.to_user, e.from_user
            """;
}
