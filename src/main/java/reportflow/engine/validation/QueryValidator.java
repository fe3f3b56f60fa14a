package reportflow.engine.validation;

import reportflow.engine.exception.ValidationException;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Read-only guard for report query text.
 *
 * A query passes when, after comments are stripped, it
 * <ul>
 * <li>opens with {@code SELECT} or {@code WITH}</li>
 * <li>contains no deny-listed keyword as a whole word outside string literals</li>
 * <li>is a single statement (at most one trailing {@code ;})</li>
 * </ul>
 */
public final class QueryValidator {

    static final List<String> DENIED_KEYWORDS = List.of(
            "DROP", "DELETE", "TRUNCATE", "ALTER", "CREATE", "INSERT",
            "UPDATE", "EXEC", "EXECUTE", "GRANT", "REVOKE", "MERGE");

    private static final Pattern WORD = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern OPENING = Pattern.compile("^(SELECT|WITH)\\b", Pattern.CASE_INSENSITIVE);

    private QueryValidator() {
    }

    /**
     * @throws ValidationException with field {@code query} if the text is not an allowed read-only query
     */
    public static void validate(String query) {
        if (query == null || query.isBlank()) {
            throw new ValidationException("query", "SQL query must be a non-empty string");
        }

        String code = stripLiteralsAndComments(query).trim();
        if (code.isEmpty()) {
            throw new ValidationException("query", query, "SQL query cannot be empty");
        }

        if (!OPENING.matcher(code).find()) {
            throw new ValidationException("query", query, "Only SELECT queries are allowed");
        }

        Matcher words = WORD.matcher(code);
        while (words.find()) {
            String word = words.group().toUpperCase(Locale.ROOT);
            if (DENIED_KEYWORDS.contains(word)) {
                throw new ValidationException("query", query,
                        "Dangerous operation detected: " + word + " queries are not allowed");
            }
        }

        int semicolon = code.indexOf(';');
        if (semicolon >= 0 && semicolon != code.length() - 1) {
            throw new ValidationException("query", query, "Only a single statement is allowed");
        }
    }

    public static boolean isValid(String query) {
        try {
            validate(query);
            return true;
        } catch (ValidationException e) {
            return false;
        }
    }

    /**
     * Blank out quoted literals and identifiers, line comments and block comments,
     * keeping statement structure so keyword scanning only sees SQL code.
     */
    static String stripLiteralsAndComments(String sql) {
        StringBuilder out = new StringBuilder(sql.length());
        int i = 0;
        int n = sql.length();
        while (i < n) {
            char c = sql.charAt(i);
            if (c == '\'' || c == '"') {
                int end = i + 1;
                while (end < n) {
                    if (sql.charAt(end) == c) {
                        // doubled quote is an escaped quote
                        if (end + 1 < n && sql.charAt(end + 1) == c) {
                            end += 2;
                            continue;
                        }
                        break;
                    }
                    end++;
                }
                out.append(' ');
                i = end + 1;
            } else if (c == '-' && i + 1 < n && sql.charAt(i + 1) == '-') {
                int end = sql.indexOf('\n', i);
                i = end < 0 ? n : end;
                out.append(' ');
            } else if (c == '/' && i + 1 < n && sql.charAt(i + 1) == '*') {
                int end = sql.indexOf("*/", i + 2);
                i = end < 0 ? n : end + 2;
                out.append(' ');
            } else {
                out.append(c);
                i++;
            }
        }
        return out.toString();
    }
}
