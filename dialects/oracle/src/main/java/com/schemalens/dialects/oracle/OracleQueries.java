package com.schemalens.dialects.oracle;

/**
 * {@code ALL_*} dictionary view queries for Oracle 12.2 and later. Owners marked
 * {@code ORACLE_MAINTAINED} are skipped here already; the remaining filtering is the
 * schema filter's job. {@code LONG} columns (view text, defaults, trigger bodies) cannot
 * take part in expressions, so they are selected bare.
 */
public final class OracleQueries {

    private OracleQueries() {
    }

    private static final String USER_OWNERS =
            "(SELECT username FROM all_users WHERE oracle_maintained = 'N')";

    public static final String DESCRIBE = """
            SELECT SYS_CONTEXT('USERENV', 'DB_NAME') AS database_name,
                   (SELECT 'Oracle ' || version FROM product_component_version
                     WHERE product LIKE 'Oracle%' AND ROWNUM = 1) AS version,
                   SYS_CONTEXT('USERENV', 'CURRENT_SCHEMA') AS default_schema
            FROM dual
            """;

    public static final String SCHEMAS = """
            SELECT username AS schema_name
            FROM all_users
            ORDER BY username
            """;

    // materialized view container tables are reported as views
    public static final String TABLES = """
            SELECT t.owner AS schema_name,
                   t.table_name AS table_name,
                   t.num_rows AS row_count,
                   t.blocks * 8 AS size_kb,
                   tc.comments AS description
            FROM all_tables t
            LEFT JOIN all_tab_comments tc ON tc.owner = t.owner AND tc.table_name = t.table_name
            WHERE t.owner IN %s
              AND t.nested = 'NO' AND t.secondary = 'N' AND t.dropped = 'NO'
              AND NOT EXISTS (SELECT 1 FROM all_mviews m WHERE m.owner = t.owner AND m.mview_name = t.table_name)
            ORDER BY t.owner, t.table_name
            """.formatted(USER_OWNERS);

    public static final String COLUMNS = """
            SELECT c.owner AS schema_name,
                   c.table_name AS table_name,
                   c.column_name AS column_name,
                   c.column_id AS ordinal,
                   c.data_type AS data_type,
                   c.data_type_owner AS type_owner,
                   c.data_length AS max_length,
                   c.char_length AS char_length,
                   c.data_precision AS precision,
                   c.data_scale AS scale,
                   c.nullable AS nullable,
                   c.data_default AS default_value,
                   c.identity_column AS identity_column,
                   c.virtual_column AS virtual_column,
                   ic.identity_options AS identity_options,
                   cc.comments AS description
            FROM all_tab_cols c
            JOIN all_tables t ON t.owner = c.owner AND t.table_name = c.table_name
            LEFT JOIN all_tab_identity_cols ic
                   ON ic.owner = c.owner AND ic.table_name = c.table_name AND ic.column_name = c.column_name
            LEFT JOIN all_col_comments cc
                   ON cc.owner = c.owner AND cc.table_name = c.table_name AND cc.column_name = c.column_name
            WHERE c.owner IN %s AND c.hidden_column = 'NO'
            ORDER BY c.owner, c.table_name, c.column_id
            """.formatted(USER_OWNERS);

    // only index-organized tables store rows in primary key order
    public static final String PRIMARY_KEYS = """
            SELECT c.owner AS schema_name,
                   c.table_name AS table_name,
                   c.constraint_name AS constraint_name,
                   cc.column_name AS column_name,
                   cc.position AS key_ordinal,
                   CASE WHEN t.iot_type = 'IOT' THEN 1 ELSE 0 END AS clustered
            FROM all_constraints c
            JOIN all_cons_columns cc ON cc.owner = c.owner AND cc.constraint_name = c.constraint_name
            JOIN all_tables t ON t.owner = c.owner AND t.table_name = c.table_name
            WHERE c.constraint_type = 'P' AND c.owner IN %s
            ORDER BY c.owner, c.table_name, cc.position
            """.formatted(USER_OWNERS);

    public static final String INDEXES = """
            SELECT i.table_owner AS schema_name,
                   i.table_name AS table_name,
                   i.index_name AS index_name,
                   CASE WHEN i.uniqueness = 'UNIQUE' THEN 1 ELSE 0 END AS is_unique,
                   CASE WHEN pk.constraint_name IS NOT NULL THEN 1 ELSE 0 END AS is_primary,
                   ic.column_name AS column_name,
                   ie.column_expression AS expression,
                   ic.column_position AS key_ordinal,
                   i.index_type AS method,
                   CASE WHEN i.index_type = 'IOT - TOP' THEN 1 ELSE 0 END AS clustered
            FROM all_indexes i
            JOIN all_ind_columns ic ON ic.index_owner = i.owner AND ic.index_name = i.index_name
            LEFT JOIN all_ind_expressions ie
                   ON ie.index_owner = ic.index_owner AND ie.index_name = ic.index_name
                  AND ie.column_position = ic.column_position
            LEFT JOIN all_constraints pk
                   ON pk.owner = i.table_owner AND pk.index_name = i.index_name AND pk.constraint_type = 'P'
            WHERE i.table_owner IN %s AND i.index_type <> 'LOB' AND i.table_type = 'TABLE'
            ORDER BY i.table_owner, i.table_name, i.index_name, ic.column_position
            """.formatted(USER_OWNERS);

    // Oracle has no ON UPDATE rule; on_update stays unknown
    public static final String FOREIGN_KEYS = """
            SELECT c.owner AS schema_name,
                   c.table_name AS table_name,
                   c.constraint_name AS constraint_name,
                   cc.column_name AS column_name,
                   cc.position AS key_ordinal,
                   r.owner AS ref_schema,
                   r.table_name AS ref_table,
                   rcc.column_name AS ref_column,
                   c.delete_rule AS on_delete
            FROM all_constraints c
            JOIN all_cons_columns cc ON cc.owner = c.owner AND cc.constraint_name = c.constraint_name
            JOIN all_constraints r ON r.owner = c.r_owner AND r.constraint_name = c.r_constraint_name
            JOIN all_cons_columns rcc
                   ON rcc.owner = r.owner AND rcc.constraint_name = r.constraint_name AND rcc.position = cc.position
            WHERE c.constraint_type = 'R' AND c.owner IN %s
            ORDER BY c.owner, c.table_name, c.constraint_name, cc.position
            """.formatted(USER_OWNERS);

    // NOT NULL columns show up as system-named check constraints
    public static final String CHECKS = """
            SELECT c.owner AS schema_name,
                   c.table_name AS table_name,
                   c.constraint_name AS constraint_name,
                   c.search_condition_vc AS expression
            FROM all_constraints c
            WHERE c.constraint_type = 'C' AND c.owner IN %s
              AND NOT (c.generated = 'GENERATED NAME' AND c.search_condition_vc LIKE '%%IS NOT NULL')
            ORDER BY c.owner, c.table_name, c.constraint_name
            """.formatted(USER_OWNERS);

    public static final String VIEWS = """
            SELECT 'VIEW' AS row_kind,
                   v.owner AS schema_name,
                   v.view_name AS view_name,
                   v.text AS definition,
                   0 AS materialized,
                   tc.comments AS description
            FROM all_views v
            LEFT JOIN all_tab_comments tc ON tc.owner = v.owner AND tc.table_name = v.view_name
            WHERE v.owner IN %s
            ORDER BY v.owner, v.view_name
            """.formatted(USER_OWNERS);

    public static final String MATERIALIZED_VIEWS = """
            SELECT 'VIEW' AS row_kind,
                   m.owner AS schema_name,
                   m.mview_name AS view_name,
                   m.query AS definition,
                   1 AS materialized,
                   mc.comments AS description
            FROM all_mviews m
            LEFT JOIN all_mview_comments mc ON mc.owner = m.owner AND mc.mview_name = m.mview_name
            WHERE m.owner IN %s
            ORDER BY m.owner, m.mview_name
            """.formatted(USER_OWNERS);

    public static final String VIEW_COLUMNS = """
            SELECT 'COLUMN' AS row_kind,
                   c.owner AS schema_name,
                   c.table_name AS view_name,
                   c.column_name AS column_name,
                   c.column_id AS ordinal,
                   c.data_type AS data_type,
                   c.data_type_owner AS type_owner,
                   c.data_length AS max_length,
                   c.char_length AS char_length,
                   c.data_precision AS precision,
                   c.data_scale AS scale,
                   c.nullable AS nullable
            FROM all_tab_columns c
            WHERE c.owner IN %s
              AND (EXISTS (SELECT 1 FROM all_views v WHERE v.owner = c.owner AND v.view_name = c.table_name)
                OR EXISTS (SELECT 1 FROM all_mviews m WHERE m.owner = c.owner AND m.mview_name = c.table_name))
            ORDER BY c.owner, c.table_name, c.column_id
            """.formatted(USER_OWNERS);

    public static final String VIEW_DEPENDENCIES = """
            SELECT DISTINCT 'DEPENDENCY' AS row_kind,
                   d.owner AS schema_name,
                   d.name AS view_name,
                   d.referenced_owner AS ref_schema,
                   d.referenced_name AS ref_name
            FROM all_dependencies d
            WHERE d.type IN ('VIEW', 'MATERIALIZED VIEW')
              AND d.referenced_type IN ('TABLE', 'VIEW', 'MATERIALIZED VIEW')
              AND d.owner IN %s
            """.formatted(USER_OWNERS);

    // standalone routines only; package members are documented with their package
    public static final String ROUTINES = """
            SELECT 'ROUTINE' AS row_kind,
                   o.owner AS schema_name,
                   o.object_name AS routine_name,
                   TO_CHAR(o.object_id) AS specific_name,
                   o.object_type AS routine_type,
                   'PL/SQL' AS language,
                   r.data_type AS return_type,
                   r.type_owner AS return_type_owner,
                   r.type_name AS return_type_name,
                   r.data_length AS return_max_length,
                   r.char_length AS return_char_length,
                   r.data_precision AS return_precision,
                   r.data_scale AS return_scale
            FROM all_objects o
            LEFT JOIN all_arguments r
                   ON r.object_id = o.object_id AND r.package_name IS NULL
                  AND r.position = 0 AND r.data_level = 0
            WHERE o.object_type IN ('PROCEDURE', 'FUNCTION') AND o.owner IN %s
            ORDER BY o.owner, o.object_name
            """.formatted(USER_OWNERS);

    public static final String ROUTINE_PARAMETERS = """
            SELECT 'PARAMETER' AS row_kind,
                   a.owner AS schema_name,
                   TO_CHAR(a.object_id) AS specific_name,
                   a.argument_name AS parameter_name,
                   a.position AS ordinal,
                   a.data_type AS data_type,
                   a.type_owner AS type_owner,
                   a.type_name AS type_name,
                   a.data_length AS max_length,
                   a.char_length AS char_length,
                   a.data_precision AS precision,
                   a.data_scale AS scale,
                   a.in_out AS mode
            FROM all_arguments a
            JOIN all_objects o ON o.object_id = a.object_id AND o.object_type IN ('PROCEDURE', 'FUNCTION')
            WHERE a.package_name IS NULL AND a.position > 0 AND a.data_level = 0
              AND a.argument_name IS NOT NULL AND a.owner IN %s
            ORDER BY a.owner, a.object_name, a.position
            """.formatted(USER_OWNERS);

    public static final String ROUTINE_SOURCE = """
            SELECT 'SOURCE_LINE' AS row_kind,
                   s.owner AS schema_name,
                   TO_CHAR(o.object_id) AS specific_name,
                   s.line AS line,
                   s.text AS text
            FROM all_source s
            JOIN all_objects o ON o.owner = s.owner AND o.object_name = s.name AND o.object_type = s.type
            WHERE s.type IN ('PROCEDURE', 'FUNCTION') AND s.owner IN %s
            ORDER BY s.owner, s.name, s.line
            """.formatted(USER_OWNERS);

    // schema and database event triggers have no parent table
    public static final String TRIGGERS = """
            SELECT tr.owner AS schema_name,
                   tr.trigger_name AS trigger_name,
                   tr.table_owner AS table_schema,
                   tr.table_name AS table_name,
                   tr.trigger_type AS timing,
                   tr.triggering_event AS events,
                   tr.status AS enabled,
                   tr.trigger_body AS definition
            FROM all_triggers tr
            WHERE tr.base_object_type IN ('TABLE', 'VIEW') AND tr.owner IN %s
            ORDER BY tr.owner, tr.trigger_name
            """.formatted(USER_OWNERS);

    public static final String TYPES = """
            SELECT 'TYPE' AS row_kind,
                   t.owner AS schema_name,
                   t.type_name AS type_name,
                   CASE t.typecode WHEN 'OBJECT' THEN 'COMPOSITE' ELSE 'ALIAS' END AS category,
                   CASE WHEN ct.coll_type = 'TABLE' THEN 'TABLE OF ' || ct.elem_type_name
                        WHEN ct.coll_type IS NOT NULL
                        THEN 'VARRAY(' || ct.upper_bound || ') OF ' || ct.elem_type_name END AS base_type
            FROM all_types t
            LEFT JOIN all_coll_types ct ON ct.owner = t.owner AND ct.type_name = t.type_name
            WHERE t.typecode IN ('OBJECT', 'COLLECTION') AND t.owner IN %s
            ORDER BY t.owner, t.type_name
            """.formatted(USER_OWNERS);

    public static final String TYPE_ATTRIBUTES = """
            SELECT 'ATTRIBUTE' AS row_kind,
                   a.owner AS schema_name,
                   a.type_name AS type_name,
                   a.attr_name AS attribute_name,
                   a.attr_no AS ordinal,
                   a.attr_type_name AS data_type,
                   a.attr_type_owner AS type_owner,
                   a.length AS max_length,
                   a.precision AS precision,
                   a.scale AS scale
            FROM all_type_attrs a
            WHERE a.owner IN %s
            ORDER BY a.owner, a.type_name, a.attr_no
            """.formatted(USER_OWNERS);

    // the dictionary does not keep START WITH
    public static final String SEQUENCES = """
            SELECT s.sequence_owner AS schema_name,
                   s.sequence_name AS sequence_name,
                   s.min_value AS min_value,
                   s.max_value AS max_value,
                   s.increment_by AS increment,
                   s.cycle_flag AS cycle,
                   s.cache_size AS cache_size,
                   s.last_number AS current_value
            FROM all_sequences s
            WHERE s.sequence_owner IN %s
              AND s.sequence_name NOT LIKE 'ISEQ$$%%'
            ORDER BY s.sequence_owner, s.sequence_name
            """.formatted(USER_OWNERS);

    public static final String SYNONYMS = """
            SELECT s.owner AS schema_name,
                   s.synonym_name AS synonym_name,
                   s.table_owner AS target_schema,
                   s.table_name AS target_name,
                   s.db_link AS target_server
            FROM all_synonyms s
            WHERE s.owner <> 'PUBLIC' AND s.owner IN %s
            ORDER BY s.owner, s.synonym_name
            """.formatted(USER_OWNERS);

    // roles and their members are only visible through the DBA views
    public static final String PRINCIPALS = """
            SELECT 'PRINCIPAL' AS row_kind, u.username AS principal_name, 'USER' AS principal_kind
            FROM all_users u
            WHERE u.oracle_maintained = 'N'
            UNION ALL
            SELECT 'PRINCIPAL', r.role, 'ROLE'
            FROM dba_roles r
            WHERE r.oracle_maintained = 'N'
            """;

    public static final String GRANTS = """
            SELECT 'GRANT' AS row_kind,
                   p.grantee AS principal_name,
                   p.privilege AS privilege,
                   p.table_schema AS object_schema,
                   p.table_name AS object_name
            FROM all_tab_privs p
            WHERE p.grantee <> 'PUBLIC'
            UNION ALL
            SELECT 'GRANT', sp.grantee, sp.privilege, NULL, NULL
            FROM dba_sys_privs sp
            """;

    public static final String MEMBERSHIPS = """
            SELECT 'MEMBERSHIP' AS row_kind,
                   rp.grantee AS principal_name,
                   rp.granted_role AS role_name
            FROM dba_role_privs rp
            ORDER BY rp.grantee, rp.granted_role
            """;
}
