package me.golemcore.logwhisper.plugin.builtin.sql;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.extern.slf4j.Slf4j;
import me.golemcore.logwhisper.domain.model.BlockType;
import me.golemcore.logwhisper.domain.model.LogEntry;
import me.golemcore.logwhisper.domain.model.RenderedBlock;
import me.golemcore.logwhisper.plugin.api.RenderContext;
import me.golemcore.logwhisper.plugin.builtin.AbstractRendererPlugin;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Joins MyBatis {@code Preparing:} statements with the {@code Parameters:} line
 * that follows and renders the executable SQL.
 *
 * <p>
 * A statement line only records the pending statement and renders nothing. The
 * matching parameters line renders one SQL block covering both lines. State is
 * kept per render pass ({@link RenderContext} instance), so passes over the same
 * source running in parallel never see each other's statements. Entries of a
 * pass must arrive in ascending line order; an entry that does not resets the
 * pass.
 */
@Slf4j
public class SqlCorrelationRenderer extends AbstractRendererPlugin {

    public static final String NAME = "sql";
    public static final int PRIORITY = 10;

    static final String STATEMENT_MARKER = "Preparing:";
    static final String PARAMETERS_MARKER = "Parameters:";

    static final String KEY_MAX_PENDING_LINES = "maxPendingLines";
    static final String KEY_PENDING_TIMEOUT_MS = "pendingTimeoutMs";
    static final String KEY_HIGHLIGHT_KEYWORDS = "highlightKeywords";

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final Clock clock;
    private final Map<RenderContext, SqlCorrelationState> states = new ConcurrentHashMap<>();

    public SqlCorrelationRenderer(Clock clock) {
        super(NAME, "Correlates MyBatis statements with their parameters into executable SQL", PRIORITY,
                Map.of(KEY_MAX_PENDING_LINES, 20,
                        KEY_PENDING_TIMEOUT_MS, 30_000L,
                        KEY_HIGHLIGHT_KEYWORDS, true));
        this.clock = clock;
    }

    @Override
    public boolean matches(LogEntry entry) {
        String content = entry.getContent();
        return content != null && (content.contains(STATEMENT_MARKER) || content.contains(PARAMETERS_MARKER));
    }

    @Override
    public List<RenderedBlock> render(LogEntry entry, RenderContext context) {
        SqlCorrelationState state = states.computeIfAbsent(context, ignored -> new SqlCorrelationState());
        synchronized (state) {
            if (!state.advanceTo(entry.getLineNumber())) {
                log.debug("[Sql] Out-of-order entry at line {} in {}, resetting correlation",
                        entry.getLineNumber(), context.getScopeId());
                state.reset();
            }
            String content = entry.getContent();
            int statementAt = content.indexOf(STATEMENT_MARKER);
            if (statementAt < 0) {
                int parametersAt = content.indexOf(PARAMETERS_MARKER);
                return onParameters(state, entry, context,
                        content.substring(parametersAt + PARAMETERS_MARKER.length()));
            }
            int statementStart = statementAt + STATEMENT_MARKER.length();
            int parametersAt = content.indexOf(PARAMETERS_MARKER, statementStart);
            if (parametersAt < 0) {
                onStatement(state, entry, content.substring(statementStart));
                return List.of();
            }
            // Parameters line folded into the statement entry: the prefix of its line is not SQL
            int statementEnd = content.lastIndexOf('\n', parametersAt);
            if (statementEnd < statementStart) {
                statementEnd = parametersAt;
            }
            onStatement(state, entry, content.substring(statementStart, statementEnd));
            return onParameters(state, entry, context,
                    content.substring(parametersAt + PARAMETERS_MARKER.length()));
        }
    }

    @Override
    public void endScope(RenderContext context) {
        states.remove(context);
    }

    @Override
    protected void validateSettings(Map<String, Object> candidate) {
        readInt(candidate, KEY_MAX_PENDING_LINES, 1);
        readLong(candidate, KEY_PENDING_TIMEOUT_MS, 0);
        readBoolean(candidate, KEY_HIGHLIGHT_KEYWORDS);
    }

    int activeScopes() {
        return states.size();
    }

    private void onStatement(SqlCorrelationState state, LogEntry entry, String statementText) {
        String sql = WHITESPACE.matcher(statementText).replaceAll(" ").trim();
        if (sql.isEmpty()) {
            log.debug("[Sql] Empty statement at line {}", entry.getLineNumber());
            state.reset();
            return;
        }
        if (state.isAwaitingParameters()) {
            log.debug("[Sql] Statement at line {} replaces pending statement from line {}",
                    entry.getLineNumber(), state.getPendingLine());
        }
        state.await(sql, entry.getLineNumber(), clock.instant());
    }

    private List<RenderedBlock> onParameters(SqlCorrelationState state, LogEntry entry, RenderContext context,
            String parametersText) {
        if (!state.isAwaitingParameters()) {
            log.debug("[Sql] Parameters at line {} without a pending statement, dropped", entry.getLineNumber());
            return List.of();
        }
        if (isStale(state, entry)) {
            log.debug("[Sql] Pending statement from line {} expired before parameters at line {}",
                    state.getPendingLine(), entry.getLineNumber());
            state.reset();
            return List.of();
        }
        String template = state.getPendingSql();
        int statementLine = state.getPendingLine();
        state.reset();

        List<SqlParameter> parameters = SqlParameterParser.parse(parametersText.trim());
        Substitution substitution = substitute(template, parameters);
        String title;
        if (substitution.placeholders() == parameters.size()) {
            title = "SQL (" + parameters.size() + " parameters)";
        } else {
            title = "SQL (bound " + substitution.bound() + " of " + substitution.placeholders()
                    + " placeholders, " + parameters.size() + " parameters)";
            log.debug("[Sql] Placeholder count {} does not match parameter count {} at line {}",
                    substitution.placeholders(), parameters.size(), entry.getLineNumber());
        }
        String sql = substitution.sql();
        String formatted = booleanSetting(KEY_HIGHLIGHT_KEYWORDS)
                ? SqlKeywordHighlighter.highlight(sql)
                : SqlKeywordHighlighter.escape(sql);
        return List.of(block(context, statementLine, entry.getLineEnd(), BlockType.SQL, title, sql, formatted, 1.0));
    }

    private boolean isStale(SqlCorrelationState state, LogEntry entry) {
        if (entry.getLineNumber() - state.getPendingLine() > intSetting(KEY_MAX_PENDING_LINES)) {
            return true;
        }
        Duration waited = Duration.between(state.getPendingSince(), Instant.now(clock));
        return waited.toMillis() > longSetting(KEY_PENDING_TIMEOUT_MS);
    }

    /**
     * Replaces {@code ?} placeholders outside quoted literals left to right.
     * Surplus placeholders stay in place.
     */
    static Substitution substitute(String template, List<SqlParameter> parameters) {
        StringBuilder out = new StringBuilder(template.length() + parameters.size() * 8);
        int placeholders = 0;
        int bound = 0;
        int i = 0;
        while (i < template.length()) {
            char c = template.charAt(i);
            if (c == '\'' || c == '"' || c == '`') {
                int end = SqlKeywordHighlighter.quotedEnd(template, i);
                out.append(template, i, end);
                i = end;
                continue;
            }
            if (c == '?') {
                placeholders++;
                if (bound < parameters.size()) {
                    out.append(parameters.get(bound).toSqlLiteral());
                    bound++;
                } else {
                    out.append(c);
                }
            } else {
                out.append(c);
            }
            i++;
        }
        return new Substitution(out.toString(), placeholders, bound);
    }

    record Substitution(String sql, int placeholders, int bound) {
    }
}
