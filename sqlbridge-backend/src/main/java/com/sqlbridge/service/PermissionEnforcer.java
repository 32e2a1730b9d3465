package com.sqlbridge.service;

import com.sqlbridge.model.PermissionDecision;
import com.sqlbridge.model.ServerProfile;
import com.sqlbridge.model.StatementClass;
import com.sqlbridge.util.SqlStatementScanner;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Set;

/**
 * Decides whether SQL text may run against a server profile.
 *
 * <p>Classification is an allow-list: a text is {@link StatementClass#READ} only when every
 * statement in it starts with {@code SELECT} or {@code WITH} and contains no verb that can
 * modify data from inside a query. Everything else, including text that cannot be scanned to
 * the end or whose string literals hold a backslash, is {@link StatementClass#WRITE}.
 */
@Slf4j
@Service
public class PermissionEnforcer {

    private static final Set<String> READ_KEYWORDS = Set.of("SELECT", "WITH");

    // Verbs that turn a SELECT/WITH statement into a write wherever they appear:
    // SELECT ... INTO, data-modifying CTEs, FOR UPDATE locks, procedure calls, ad hoc remote access.
    private static final Set<String> EMBEDDED_WRITE_KEYWORDS = Set.of(
            "INSERT", "UPDATE", "DELETE", "MERGE", "UPSERT", "INTO",
            "CREATE", "ALTER", "DROP", "TRUNCATE", "RENAME",
            "GRANT", "REVOKE", "DENY",
            "EXEC", "EXECUTE", "CALL",
            "OPENROWSET", "OPENQUERY", "OPENDATASOURCE"
    );

    public StatementClass classify(String sql) {
        SqlStatementScanner.ScanResult scan = SqlStatementScanner.scan(sql);
        if (!scan.isComplete() || scan.isAmbiguous() || scan.getStatements().isEmpty()) {
            return StatementClass.WRITE;
        }
        for (List<String> keywords : scan.getStatements()) {
            if (!READ_KEYWORDS.contains(keywords.get(0))) {
                return StatementClass.WRITE;
            }
            for (String keyword : keywords) {
                if (EMBEDDED_WRITE_KEYWORDS.contains(keyword)) {
                    return StatementClass.WRITE;
                }
            }
        }
        return StatementClass.READ;
    }

    public PermissionDecision check(ServerProfile profile, String sql) {
        StatementClass statementClass = classify(sql);
        if (statementClass == StatementClass.WRITE && profile.isReadOnly()) {
            return PermissionDecision.deny(statementClass, readOnlyReason(profile));
        }
        return PermissionDecision.allow(statementClass);
    }

    /**
     * Check and throw on denial.
     *
     * @throws PermissionDeniedException if the statement may not run against the profile
     */
    public PermissionDecision enforce(ServerProfile profile, String sql) {
        PermissionDecision decision = check(profile, sql);
        if (!decision.isAllowed()) {
            log.warn("Blocked {} statement on read-only server {}", decision.getStatementClass(), profile.getName());
            throw new PermissionDeniedException(decision.getReason());
        }
        return decision;
    }

    static String readOnlyReason(ServerProfile profile) {
        return "Access denied: Server '" + profile.getName()
                + "' is READ-ONLY. Only SELECT queries are allowed.";
    }
}
