package com.gdin.inspection.gsw.toon;

import cn.hutool.core.collection.CollectionUtil;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Token-oriented tabular encoding for sequences of flat records.
 *
 * <pre>
 * Entities[2]{id,name,roles}
 * E0,John Smith,[husband|applicant]
 * E1,Jane Smith\, QC,~
 * </pre>
 *
 * <ul>
 *   <li>Records sharing one ordered field list are written as a header plus one line per record.
 *       Anything else falls back to a verbose block: {@code Name[n]:} then, per record, a {@code -}
 *       line followed by {@code "  key: value"} lines.</li>
 *   <li>Values are strings, {@code null} (written as {@code ~}) or lists of strings
 *       ({@code [a|b]}, {@code []} empty, {@code ""} for an empty element). An empty string is written as nothing.</li>
 *   <li>{@code \ , | [ ] ~ " :} are escaped with a backslash; line breaks become {@code \n} / {@code \r}.</li>
 * </ul>
 * Encoding is a pure function of its input. Non-string scalars are written with {@code String.valueOf}
 * and come back as strings.
 */
public final class ToonCodec {

    public static final char DELIMITER = ',';
    public static final char LIST_DELIMITER = '|';
    public static final char ESCAPE = '\\';
    public static final String NULL_MARKER = "~";
    private static final String EMPTY_ELEMENT = "\"\"";
    private static final String INDENT = "  ";
    private static final String ESCAPED = "\\,|[]~\":";

    private static final Pattern NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern FIELD = Pattern.compile("[A-Za-z_][A-Za-z0-9_.\\-]*");
    private static final Pattern HEADER = Pattern.compile("^([A-Za-z_][A-Za-z0-9_]*)\\[(\\d+)](?:\\{([^}]*)}|(:))$");

    private ToonCodec() {}

    // ======================= encode =======================

    public static String encode(String name, List<? extends Map<String, ?>> records) {
        checkName(name, NAME);
        List<? extends Map<String, ?>> rows = records == null ? List.of() : records;
        if (rows.isEmpty()) return name + "[0]{}";

        List<String> fields = new ArrayList<>(rows.get(0).keySet());
        fields.forEach(f -> checkName(f, FIELD));
        boolean tabular = isTabular(rows);

        StringBuilder out = new StringBuilder();
        if (tabular) {
            out.append(name).append('[').append(rows.size()).append("]{")
                    .append(String.join(",", fields)).append('}');
            for (Map<String, ?> row : rows) {
                out.append('\n');
                for (int i = 0; i < fields.size(); i++) {
                    if (i > 0) out.append(DELIMITER);
                    out.append(encodeValue(row.get(fields.get(i))));
                }
            }
            return out.toString();
        }

        out.append(name).append('[').append(rows.size()).append("]:");
        for (Map<String, ?> row : rows) {
            out.append("\n-");
            for (Map.Entry<String, ?> e : row.entrySet()) {
                checkName(e.getKey(), FIELD);
                out.append('\n').append(INDENT).append(e.getKey()).append(": ").append(encodeValue(e.getValue()));
            }
        }
        return out.toString();
    }

    public static String encode(ToonDocument document) {
        List<String> blocks = new ArrayList<>();
        for (String comment : document.getComments()) {
            blocks.add("# " + comment.replace('\n', ' ').replace('\r', ' '));
        }
        String head = String.join("\n", blocks);
        List<String> tables = new ArrayList<>();
        document.getTables().forEach((name, records) -> tables.add(encode(name, records)));
        String body = String.join("\n\n", tables);
        if (head.isEmpty()) return body + "\n";
        return head + "\n\n" + body + "\n";
    }

    static String encodeValue(Object v) {
        if (v == null) return NULL_MARKER;
        if (v instanceof Collection<?> list) {
            StringBuilder sb = new StringBuilder("[");
            boolean first = true;
            for (Object e : list) {
                if (e == null) throw new IllegalArgumentException("null list element is not encodable");
                if (!first) sb.append(LIST_DELIMITER);
                String s = String.valueOf(e);
                sb.append(s.isEmpty() ? EMPTY_ELEMENT : escape(s));
                first = false;
            }
            return sb.append(']').toString();
        }
        return escape(String.valueOf(v));
    }

    static String escape(String s) {
        StringBuilder sb = new StringBuilder(s.length() + 4);
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == '\n') {
                sb.append(ESCAPE).append('n');
            } else if (c == '\r') {
                sb.append(ESCAPE).append('r');
            } else {
                if (ESCAPED.indexOf(c) >= 0) sb.append(ESCAPE);
                sb.append(c);
            }
        }
        return sb.toString();
    }

    // ======================= decode =======================

    public static ToonDocument decode(String text) {
        ToonDocument doc = new ToonDocument();
        if (text == null || text.isEmpty()) return doc;
        String[] lines = text.split("\n", -1);

        int i = 0;
        while (i < lines.length) {
            String line = lines[i];
            if (line.isBlank()) {
                i++;
                continue;
            }
            if (line.startsWith("#")) {
                doc.getComments().add(line.substring(1).trim());
                i++;
                continue;
            }
            Matcher m = HEADER.matcher(line);
            if (!m.matches()) throw new ToonFormatException(i + 1, "expected block header, got: " + line);
            String name = m.group(1);
            int count = Integer.parseInt(m.group(2));
            if (doc.getTables().containsKey(name)) throw new ToonFormatException(i + 1, "duplicate block " + name);
            i++;
            List<Map<String, Object>> records = new ArrayList<>(count);
            if (m.group(4) == null) {
                List<String> fields = splitHeader(m.group(3));
                for (int r = 0; r < count; r++, i++) {
                    if (i >= lines.length) throw new ToonFormatException(i + 1, name + ": expected " + count + " rows");
                    List<String> raw = splitUnescaped(lines[i], DELIMITER);
                    if (raw.size() != fields.size()) {
                        throw new ToonFormatException(i + 1, name + ": expected " + fields.size() + " values, got " + raw.size());
                    }
                    Map<String, Object> rec = new LinkedHashMap<>();
                    for (int f = 0; f < fields.size(); f++) rec.put(fields.get(f), decodeValue(raw.get(f), i + 1));
                    records.add(rec);
                }
            } else {
                for (int r = 0; r < count; r++) {
                    if (i >= lines.length || !"-".equals(lines[i])) {
                        throw new ToonFormatException(i + 1, name + ": expected record marker '-'");
                    }
                    i++;
                    Map<String, Object> rec = new LinkedHashMap<>();
                    while (i < lines.length && lines[i].startsWith(INDENT)) {
                        String body = lines[i].substring(INDENT.length());
                        int colon = body.indexOf(':');
                        if (colon <= 0) throw new ToonFormatException(i + 1, name + ": expected 'key: value'");
                        String raw = body.length() > colon + 1 ? body.substring(colon + 2) : "";
                        rec.put(body.substring(0, colon), decodeValue(raw, i + 1));
                        i++;
                    }
                    records.add(rec);
                }
            }
            doc.put(name, records);
        }
        return doc;
    }

    static Object decodeValue(String raw, int lineNo) {
        if (NULL_MARKER.equals(raw)) return null;
        if (raw.length() >= 2 && raw.charAt(0) == '[' && raw.charAt(raw.length() - 1) == ']') {
            String inner = raw.substring(1, raw.length() - 1);
            List<String> out = new ArrayList<>();
            if (inner.isEmpty()) return out;
            for (String e : splitUnescaped(inner, LIST_DELIMITER)) {
                out.add(EMPTY_ELEMENT.equals(e) ? "" : unescape(e, lineNo));
            }
            return out;
        }
        return unescape(raw, lineNo);
    }

    static String unescape(String s, int lineNo) {
        StringBuilder sb = new StringBuilder(s.length());
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c != ESCAPE) {
                sb.append(c);
                continue;
            }
            if (++i >= s.length()) throw new ToonFormatException(lineNo, "dangling escape");
            char n = s.charAt(i);
            sb.append(n == 'n' ? '\n' : n == 'r' ? '\r' : n);
        }
        return sb.toString();
    }

    /** splits on {@code sep} not preceded by an escape; escapes are kept in the pieces */
    static List<String> splitUnescaped(String s, char sep) {
        List<String> out = new ArrayList<>();
        StringBuilder cur = new StringBuilder();
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (c == ESCAPE && i + 1 < s.length()) {
                cur.append(c).append(s.charAt(++i));
            } else if (c == sep) {
                out.add(cur.toString());
                cur.setLength(0);
            } else {
                cur.append(c);
            }
        }
        out.add(cur.toString());
        return out;
    }

    private static List<String> splitHeader(String fields) {
        if (fields == null || fields.isEmpty()) return List.of();
        List<String> out = new ArrayList<>();
        for (String f : fields.split(",", -1)) out.add(f.trim());
        return out;
    }

    private static void checkName(String name, Pattern pattern) {
        if (name == null || !pattern.matcher(name).matches()) {
            throw new IllegalArgumentException("not a valid TOON name: " + name);
        }
    }

    /** true when every record has the same, non-empty, ordered field list */
    public static boolean isTabular(List<? extends Map<String, ?>> records) {
        if (CollectionUtil.isEmpty(records)) return true;
        List<String> fields = new ArrayList<>(records.get(0).keySet());
        return !fields.isEmpty() && records.stream().allMatch(r -> fields.equals(new ArrayList<>(r.keySet())));
    }
}
