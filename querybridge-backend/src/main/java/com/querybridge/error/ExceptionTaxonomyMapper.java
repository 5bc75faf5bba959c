package com.querybridge.error;

import java.net.ConnectException;
import java.net.NoRouteToHostException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.sql.SQLDataException;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLRecoverableException;
import java.sql.SQLSyntaxErrorException;
import java.sql.SQLTransientConnectionException;
import java.sql.SQLTransientException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Maps driver exceptions onto {@link ErrorKind}.
 *
 * <p>Type rules are evaluated top-down and the first match wins. The builder always places
 * exact-type overrides ahead of the ancestry checks, and the ancestry checks in the order
 * internal, operational, programming, so a transport failure that happens to extend a
 * driver's generic internal-error base class is still reported as a connection error.
 *
 * <p>When classifying a thrown exception the whole cause chain is searched. Overrides are
 * checked first, then the vendor error code of a remote failure, then the families.
 */
public class ExceptionTaxonomyMapper {

    /** Prefix trino-jdbc puts on every failure reported by the coordinator. */
    public static final String TRINO_REMOTE_FAILURE_PREFIX = "Query failed (#";

    private static final int MAX_CAUSE_DEPTH = 32;

    private final List<ExceptionMappingRule> rules;
    private final List<ErrorCodeRange> errorCodeRanges;
    private final String remoteFailurePrefix;

    private ExceptionTaxonomyMapper(List<ExceptionMappingRule> rules, List<ErrorCodeRange> errorCodeRanges,
                                    String remoteFailurePrefix) {
        this.rules = List.copyOf(rules);
        this.errorCodeRanges = List.copyOf(errorCodeRanges);
        this.remoteFailurePrefix = remoteFailurePrefix;
    }

    /**
     * Resolve the normalized kind for a driver exception type.
     *
     * @param exceptionType driver exception type
     * @return mapped kind, or {@link ErrorKind#UNKNOWN_ERROR} when no rule applies
     */
    public ErrorKind mapException(Class<? extends Throwable> exceptionType) {
        for (ExceptionMappingRule rule : rules) {
            if (rule.matches(exceptionType)) {
                return rule.kind();
            }
        }
        return ErrorKind.UNKNOWN_ERROR;
    }

    /**
     * Resolve the normalized kind for a thrown exception, looking through its causes.
     *
     * @param error thrown exception
     * @return mapped kind, or {@link ErrorKind#UNKNOWN_ERROR} when nothing in the chain matches
     */
    public ErrorKind classify(Throwable error) {
        List<Throwable> chain = causeChain(error);
        for (ExceptionMappingRule rule : rules) {
            if (rule.exact() && anyMatches(rule, chain)) {
                return rule.kind();
            }
        }
        for (Throwable candidate : chain) {
            ErrorKind byCode = mapRemoteErrorCode(candidate);
            if (byCode != null) {
                return byCode;
            }
        }
        for (ExceptionMappingRule rule : rules) {
            if (!rule.exact() && anyMatches(rule, chain)) {
                return rule.kind();
            }
        }
        return ErrorKind.UNKNOWN_ERROR;
    }

    /**
     * Wrap a driver exception into a {@link QueryExecutionException}, keeping its message.
     *
     * @param error driver exception
     * @return normalized exception
     */
    public QueryExecutionException translate(Throwable error) {
        if (error instanceof QueryExecutionException alreadyMapped) {
            return alreadyMapped;
        }
        ErrorKind kind = classify(error);
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getName();
        return new QueryExecutionException(kind, message, error);
    }

    public List<ExceptionMappingRule> getRules() {
        return rules;
    }

    public List<ErrorCodeRange> getErrorCodeRanges() {
        return errorCodeRanges;
    }

    private ErrorKind mapRemoteErrorCode(Throwable candidate) {
        if (!(candidate instanceof SQLException sqlException) || remoteFailurePrefix == null) {
            return null;
        }
        // A plain SQLException defaults to code 0, so only coordinator-reported failures carry a real code.
        String message = sqlException.getMessage();
        if (message == null || !message.startsWith(remoteFailurePrefix)) {
            return null;
        }
        for (ErrorCodeRange range : errorCodeRanges) {
            if (range.contains(sqlException.getErrorCode())) {
                return range.kind();
            }
        }
        return null;
    }

    private static boolean anyMatches(ExceptionMappingRule rule, List<Throwable> chain) {
        for (Throwable candidate : chain) {
            if (rule.matches(candidate.getClass())) {
                return true;
            }
        }
        return false;
    }

    private static List<Throwable> causeChain(Throwable error) {
        List<Throwable> chain = new ArrayList<>();
        Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        Throwable current = error;
        while (current != null && chain.size() < MAX_CAUSE_DEPTH && seen.add(current)) {
            chain.add(current);
            current = current.getCause();
        }
        return chain;
    }

    /**
     * Rules for JDBC drivers: transport and connection classes are exact overrides,
     * the {@link java.sql.SQLException} subtypes form the families, and Trino's error
     * categories are read from the code of a coordinator-reported failure.
     *
     * @return builder pre-populated with the JDBC profile
     */
    public static Builder jdbcDefaults() {
        return builder()
                .remoteFailurePrefix(TRINO_REMOTE_FAILURE_PREFIX)
                // USER_ERROR
                .errorCodeRange(0x0000_0000, 0x0001_0000, ErrorKind.PROGRAMMING_ERROR)
                // INTERNAL_ERROR
                .errorCodeRange(0x0001_0000, 0x0002_0000, ErrorKind.DATABASE_ERROR)
                // INSUFFICIENT_RESOURCES
                .errorCodeRange(0x0002_0000, 0x0003_0000, ErrorKind.OPERATIONAL_ERROR)
                // EXTERNAL, connector and plugin codes
                .errorCodeRange(0x0100_0000, Integer.MAX_VALUE, ErrorKind.OPERATIONAL_ERROR)
                .override(ConnectException.class, ErrorKind.CONNECTION_ERROR)
                .override(NoRouteToHostException.class, ErrorKind.CONNECTION_ERROR)
                .override(UnknownHostException.class, ErrorKind.CONNECTION_ERROR)
                .override(SQLTransientConnectionException.class, ErrorKind.CONNECTION_ERROR)
                .override(SQLNonTransientConnectionException.class, ErrorKind.CONNECTION_ERROR)
                .internalFamily(SQLRecoverableException.class)
                .operationalFamily(SQLTransientException.class)
                .operationalFamily(SocketTimeoutException.class)
                .programmingFamily(SQLSyntaxErrorException.class)
                .programmingFamily(SQLDataException.class)
                .programmingFamily(SQLFeatureNotSupportedException.class);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final List<ExceptionMappingRule> overrides = new ArrayList<>();
        private final List<ExceptionMappingRule> internal = new ArrayList<>();
        private final List<ExceptionMappingRule> operational = new ArrayList<>();
        private final List<ExceptionMappingRule> programming = new ArrayList<>();
        private final List<ErrorCodeRange> errorCodeRanges = new ArrayList<>();
        private String remoteFailurePrefix;

        public Builder remoteFailurePrefix(String prefix) {
            this.remoteFailurePrefix = prefix;
            return this;
        }

        public Builder errorCodeRange(int fromInclusive, int toExclusive, ErrorKind kind) {
            errorCodeRanges.add(new ErrorCodeRange(fromInclusive, toExclusive, kind));
            return this;
        }

        public Builder override(Class<? extends Throwable> type, ErrorKind kind) {
            overrides.add(ExceptionMappingRule.exactly(type, kind));
            return this;
        }

        public Builder internalFamily(Class<? extends Throwable> base) {
            internal.add(ExceptionMappingRule.descendantOf(base, ErrorKind.DATABASE_ERROR));
            return this;
        }

        public Builder operationalFamily(Class<? extends Throwable> base) {
            operational.add(ExceptionMappingRule.descendantOf(base, ErrorKind.OPERATIONAL_ERROR));
            return this;
        }

        public Builder programmingFamily(Class<? extends Throwable> base) {
            programming.add(ExceptionMappingRule.descendantOf(base, ErrorKind.PROGRAMMING_ERROR));
            return this;
        }

        public ExceptionTaxonomyMapper build() {
            List<ExceptionMappingRule> ordered = new ArrayList<>(overrides);
            ordered.addAll(internal);
            ordered.addAll(operational);
            ordered.addAll(programming);
            return new ExceptionTaxonomyMapper(ordered, errorCodeRanges, remoteFailurePrefix);
        }
    }
}
