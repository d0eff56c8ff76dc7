package com.company.placeholder.template;

import com.company.placeholder.domain.DisplayName;
import com.company.placeholder.domain.ParameterSet;
import com.company.placeholder.exception.TemplateValidationException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Validates SQL templates, substitutes {{name}} tokens and computes period-only values.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SqlTemplateFiller {

    public static final String UNRECOGNIZED_PERIOD_MARKER = "UnrecognizedPeriodPlaceholder";

    private static final Pattern TOKEN = Pattern.compile("\\{\\{\\s*([^{}]*?)\\s*}}");

    private static final List<String> RISKY_FRAGMENTS =
            List.of("--", ";", "drop", "delete", "update", "insert", "exec");

    private static final List<String> TIME_HINTS =
            List.of("date", "time", "start", "end", "week", "month", "year", "day");

    private final Clock clock;

    public TemplateValidationResult validate(String template) {
        TemplateValidationResult.TemplateValidationResultBuilder result = TemplateValidationResult.builder();

        if (template == null || template.isBlank()) {
            return result.valid(false).issue("SQL template is empty").build();
        }

        boolean valid = true;
        String head = template.trim().toUpperCase(Locale.ROOT);
        if (!head.startsWith("SELECT") && !head.startsWith("WITH")) {
            result.issue("SQL template must start with SELECT or WITH");
            valid = false;
        }

        Set<String> placeholders = extractPlaceholders(template);
        result.placeholders(placeholders);
        for (String name : placeholders) {
            if (isTimeParameter(name)) {
                result.requiredTimeParam(name);
            }
        }

        long opening = template.chars().filter(c -> c == '{').count();
        long closing = template.chars().filter(c -> c == '}').count();
        if (opening != closing) {
            result.warning(String.format("Unmatched braces: %d '{' vs %d '}'", opening, closing));
        }

        String lowered = template.toLowerCase(Locale.ROOT);
        for (String fragment : RISKY_FRAGMENTS) {
            if (lowered.contains(fragment)) {
                result.warning("Template contains potentially unsafe fragment: " + fragment);
            }
        }

        return result.valid(valid).build();
    }

    public TemplateValidationResult requireValid(String template) {
        TemplateValidationResult validation = validate(template);
        if (!validation.isValid()) {
            throw new TemplateValidationException(validation.getIssues());
        }
        return validation;
    }

    public FillResult fill(String template, ParameterSet params) {
        return fill(template, params.asMap());
    }

    /**
     * Substitutes every {{key}} found in params. Unknown keys stay in the SQL verbatim and are
     * reported as missing; the caller decides whether a partial fill is acceptable.
     */
    public FillResult fill(String template, Map<String, ?> params) {
        Matcher matcher = TOKEN.matcher(template);
        StringBuilder sql = new StringBuilder();
        Set<String> missing = new LinkedHashSet<>();

        while (matcher.find()) {
            String key = matcher.group(1);
            String replacement;
            if (params.containsKey(key)) {
                replacement = renderLiteral(params.get(key), isQuotedInTemplate(template, matcher));
            } else {
                missing.add(key);
                replacement = matcher.group(0);
            }
            matcher.appendReplacement(sql, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(sql);

        if (!missing.isEmpty()) {
            log.debug("Template left {} token(s) unfilled: {}", missing.size(), missing);
        }
        return new FillResult(sql.toString(), new ArrayList<>(missing));
    }

    /**
     * Value of a placeholder that needs no data source, derived from its name and the base date
     */
    public String computePeriodValue(String placeholderName, LocalDate baseDate) {
        DisplayName name = DisplayName.of(placeholderName);

        if (name.isTaskStartTime()) {
            return LocalDateTime.now(clock.withZone(ZoneOffset.UTC)).format(ParameterSet.DATE_TIME);
        }

        Optional<Integer> offset = name.taskTimeOffsetDays();
        if (offset.isPresent()) {
            return baseDate.plusDays(offset.get()).format(TemplateParameterBuilder.LONG_DATE_CN);
        }
        if (name.isYearMonthDay()) {
            return baseDate.format(TemplateParameterBuilder.LONG_DATE_CN);
        }
        if (name.isMonthDay()) {
            return baseDate.format(TemplateParameterBuilder.SHORT_DATE_CN);
        }
        if (name.isYesterday()) {
            return baseDate.minusDays(1).format(TemplateParameterBuilder.LONG_DATE_CN);
        }
        if (name.isTomorrow()) {
            return baseDate.plusDays(1).format(TemplateParameterBuilder.LONG_DATE_CN);
        }

        log.warn("No period rule matches placeholder '{}'", placeholderName);
        return UNRECOGNIZED_PERIOD_MARKER + "(" + placeholderName + ")";
    }

    public Set<String> extractPlaceholders(String template) {
        Set<String> names = new LinkedHashSet<>();
        if (template == null) {
            return names;
        }
        Matcher matcher = TOKEN.matcher(template);
        while (matcher.find()) {
            names.add(matcher.group(1));
        }
        return names;
    }

    private boolean isTimeParameter(String name) {
        String lowered = name.toLowerCase(Locale.ROOT);
        return TIME_HINTS.stream().anyMatch(lowered::contains);
    }

    private boolean isQuotedInTemplate(String template, Matcher matcher) {
        int before = matcher.start() - 1;
        int after = matcher.end();
        return before >= 0 && after < template.length()
                && template.charAt(before) == '\'' && template.charAt(after) == '\'';
    }

    private String renderLiteral(Object value, boolean quotedInTemplate) {
        if (value == null) {
            return "NULL";
        }
        if (value instanceof BigDecimal) {
            return ((BigDecimal) value).toPlainString();
        }
        if (value instanceof Number) {
            return value.toString();
        }
        if (value instanceof Boolean) {
            return value.toString().toUpperCase(Locale.ROOT);
        }

        String text = ParameterSet.render(value);
        if (quotedInTemplate) {
            return text;
        }
        if (text.length() >= 2 && text.startsWith("'") && text.endsWith("'")) {
            return text;
        }
        return "'" + text.replace("'", "''") + "'";
    }
}
