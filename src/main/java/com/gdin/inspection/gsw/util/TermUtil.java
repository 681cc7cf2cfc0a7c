package com.gdin.inspection.gsw.util;

import cn.hutool.core.util.StrUtil;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

public final class TermUtil {
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private TermUtil() {}

    /** trim, collapse inner whitespace, lower-case. Blank input yields {@code null}. */
    public static String normalize(String s) {
        if (StrUtil.isBlank(s)) return null;
        return WHITESPACE.matcher(s.trim()).replaceAll(" ").toLowerCase(Locale.ROOT);
    }

    public static Set<String> normalizeAll(Collection<String> values) {
        Set<String> out = new LinkedHashSet<>();
        if (values == null) return out;
        values.stream()
                .map(TermUtil::normalize)
                .filter(Objects::nonNull)
                .forEach(out::add);
        return out;
    }

    /** trimmed surface form, or {@code null} when blank */
    public static String clean(String s) {
        return StrUtil.isBlank(s) ? null : s.trim();
    }
}
