package com.gdin.inspection.gsw.models;

import cn.hutool.core.date.DateUtil;
import cn.hutool.core.date.LocalDateTimeUtil;
import cn.hutool.core.util.StrUtil;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDateTime;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * A date as written in the source ("15 March 2019", "2019-03-15", "early 2019").
 * Parsing is attempted once, leniently; unparseable text is kept verbatim and never rejected.
 */
@Slf4j
@Value
public class FuzzyDate {
    // DateUtil fills a missing date part with "today"; without a year the result is not reproducible
    private static final Pattern HAS_YEAR = Pattern.compile("\\b\\d{4}\\b");

    String rawText;
    LocalDateTime parsed;

    public static FuzzyDate of(String rawText) {
        if (StrUtil.isBlank(rawText)) return null;
        String raw = rawText.trim();
        return new FuzzyDate(raw, parseLenient(raw));
    }

    public Optional<LocalDateTime> parsedTimestamp() {
        return Optional.ofNullable(parsed);
    }

    public boolean isParsed() {
        return parsed != null;
    }

    private static LocalDateTime parseLenient(String raw) {
        if (!HAS_YEAR.matcher(raw).find()) return null;
        try {
            return LocalDateTimeUtil.of(DateUtil.parse(raw));
        } catch (RuntimeException e) {
            log.debug("date kept unparsed: {}", raw);
            return null;
        }
    }
}
