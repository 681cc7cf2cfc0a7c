package com.gdin.inspection.gsw.toon;

import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Slf4j
public class ToonCodecTest {

    private static Map<String, Object> row(Object... kv) {
        Map<String, Object> m = new LinkedHashMap<>();
        for (int i = 0; i < kv.length; i += 2) m.put((String) kv[i], kv[i + 1]);
        return m;
    }

    @Test
    public void testTabularEncoding() {
        List<Map<String, Object>> rows = List.of(
                row("id", "E0", "name", "John Smith", "roles", List.of("husband", "applicant")),
                row("id", "E1", "name", "Jane Smith, QC", "roles", null));

        String text = ToonCodec.encode("Entities", rows);
        log.info("\n{}", text);

        Assertions.assertEquals("Entities[2]{id,name,roles}\n"
                + "E0,John Smith,[husband|applicant]\n"
                + "E1,Jane Smith\\, QC,~", text);
        Assertions.assertEquals(rows, ToonCodec.decode(text).get("Entities"));
    }

    @Test
    public void testHeterogeneousRecordsFallBackToVerbose() {
        List<Map<String, Object>> rows = List.of(row("a", "1"), row("b", "2", "c", "x"));

        String text = ToonCodec.encode("Mixed", rows);

        Assertions.assertFalse(ToonCodec.isTabular(rows));
        Assertions.assertEquals("Mixed[2]:\n-\n  a: 1\n-\n  b: 2\n  c: x", text);
        Assertions.assertEquals(rows, ToonCodec.decode(text).get("Mixed"));
    }

    @Test
    public void testEscapesAndEdgeValues() {
        List<Map<String, Object>> rows = List.of(
                row("v", "a:b|c[d]~e\"f\\g", "w", "line1\nline2\r"),
                row("v", "", "w", "~"),
                row("v", new ArrayList<>(), "w", List.of("", "x,y", "p|q")));

        String text = ToonCodec.encode("Edge", rows);
        Map<String, Object> decodedNullMarker = ToonCodec.decode(text).get("Edge").get(1);

        Assertions.assertEquals(rows, ToonCodec.decode(text).get("Edge"));
        // a literal "~" is escaped and must not come back as null
        Assertions.assertEquals("~", decodedNullMarker.get("w"));
        Assertions.assertEquals("", decodedNullMarker.get("v"));
        Assertions.assertEquals(3, text.split("\n").length - 1);
    }

    @Test
    public void testDocumentWithCommentsAndEmptyBlock() {
        ToonDocument doc = new ToonDocument()
                .comment("snapshot of test")
                .put("A", List.of(row("k", "v")))
                .put("B", List.of());

        String text = ToonCodec.encode(doc);

        Assertions.assertEquals("# snapshot of test\n\nA[1]{k}\nv\n\nB[0]{}\n", text);
        ToonDocument decoded = ToonCodec.decode(text);
        Assertions.assertEquals(doc, decoded);
        Assertions.assertEquals(List.of("snapshot of test"), decoded.getComments());
        Assertions.assertTrue(decoded.has("B"));
        // 编码是纯函数
        Assertions.assertEquals(text, ToonCodec.encode(decoded));
    }

    @Test
    public void testMalformedInputIsRejected() {
        Assertions.assertThrows(ToonFormatException.class, () -> ToonCodec.decode("X[2]{a}\n1"));
        Assertions.assertThrows(ToonFormatException.class, () -> ToonCodec.decode("X[1]{a,b}\n1"));
        Assertions.assertThrows(ToonFormatException.class, () -> ToonCodec.decode("not a header"));
        Assertions.assertThrows(ToonFormatException.class, () -> ToonCodec.decode("X[1]{a}\nbad\\"));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> ToonCodec.encode("X", List.of(row("bad key", "v"))));
    }
}
