package com.schemalens.core.adapter;

import com.schemalens.core.model.Identifier;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Best-effort extraction of the relations a view reads from, for engines that do not track
 * view dependencies in their catalog. Finds names after {@code FROM} and {@code JOIN},
 * ignoring common table expressions and subqueries.
 */
public final class ViewDependencyParser {
    private static final String PART = "(?:\"[^\"]+\"|`[^`]+`|\\[[^\\]]+\\]|[A-Za-z_][\\w$]*)";
    private static final String NAME = PART + "(?:\\s*\\.\\s*" + PART + ")*";
    private static final String KEYWORDS =
            "(?:JOIN|WHERE|ON|INNER|LEFT|RIGHT|FULL|CROSS|NATURAL|OUTER|USING|GROUP|ORDER|HAVING|LIMIT"
                    + "|UNION|EXCEPT|INTERSECT|WINDOW)\\b";
    private static final Pattern SOURCE = Pattern.compile("\\b(?:FROM|JOIN)\\s+(" + NAME + ")",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern NEXT_IN_LIST = Pattern.compile(
            "(?:\\s+(?:AS\\s+)?(?!" + KEYWORDS + ")[A-Za-z_]\\w*)?\\s*,\\s*(" + NAME + ")",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern CTE = Pattern.compile(
            "(?:\\bWITH(?:\\s+RECURSIVE)?|,)\\s*(" + PART + ")\\s*(?:\\([^)]*\\)\\s*)?AS\\s*\\(",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern LINE_COMMENT = Pattern.compile("--[^\\n]*");
    private static final Pattern BLOCK_COMMENT = Pattern.compile("/\\*.*?\\*/", Pattern.DOTALL);
    private static final Pattern STRING = Pattern.compile("'(?:[^']|'')*'");

    private ViewDependencyParser() {}

    public static List<Identifier> parse(String definition, String defaultSchema) {
        if (definition == null || definition.isBlank()) {
            return List.of();
        }
        String sql = STRING.matcher(definition).replaceAll("''");
        sql = BLOCK_COMMENT.matcher(sql).replaceAll(" ");
        sql = LINE_COMMENT.matcher(sql).replaceAll(" ");

        Set<String> ctes = new HashSet<>();
        Matcher cte = CTE.matcher(sql);
        while (cte.find()) {
            ctes.add(Identifier.fold(cte.group(1)));
        }

        List<Identifier> found = new ArrayList<>();
        Matcher m = SOURCE.matcher(sql);
        while (m.find()) {
            add(found, ctes, m.group(1), defaultSchema);
            Matcher next = NEXT_IN_LIST.matcher(sql);
            int from = m.end();
            while (next.region(from, sql.length()).lookingAt()) {
                add(found, ctes, next.group(1), defaultSchema);
                from = next.end();
            }
        }
        return found.stream().distinct().toList();
    }

    private static void add(List<Identifier> found, Set<String> ctes, String name, String defaultSchema) {
        String compact = name.replaceAll("\\s*\\.\\s*", ".");
        if (compact.indexOf('.') < 0 && ctes.contains(Identifier.fold(compact))) {
            return;
        }
        found.add(Identifier.parse(compact, defaultSchema));
    }
}
