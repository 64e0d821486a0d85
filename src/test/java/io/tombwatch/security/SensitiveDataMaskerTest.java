package io.tombwatch.security;

import com.fasterxml.jackson.databind.JsonNode;
import io.tombwatch.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

final class SensitiveDataMaskerTest {

    @Test
    void masksSensitiveKeysAtAnyDepth() throws Exception {
        JsonNode input = Jsons.mapper().readTree("""
                {"file":"a.mp4","Secret":"admin888","nested":{"api_token":"t","ok":1},"list":[{"password":"p"}]}
                """);

        JsonNode out = SensitiveDataMasker.masked(input);

        Assertions.assertEquals("a.mp4", out.get("file").asText());
        Assertions.assertEquals(SensitiveDataMasker.MASK, out.get("Secret").asText());
        Assertions.assertEquals(SensitiveDataMasker.MASK, out.get("nested").get("api_token").asText());
        Assertions.assertEquals(1, out.get("nested").get("ok").asInt());
        Assertions.assertEquals(SensitiveDataMasker.MASK, out.get("list").get(0).get("password").asText());
    }

    @Test
    void redactsCredentialQueryParameters() {
        Assertions.assertEquals("/delete?name=a.mp4&secret=***",
                SensitiveDataMasker.redactQuery("/delete?name=a.mp4&secret=admin888"));
        Assertions.assertEquals("/stats?token=*** done",
                SensitiveDataMasker.redactQuery("/stats?token=abc done"));
        Assertions.assertEquals("no query here", SensitiveDataMasker.redactQuery("no query here"));
    }

    @Test
    void redactsLiteralCredentialValues() {
        Assertions.assertEquals("used *** twice: ***", SensitiveDataMasker.redactValue("used admin888 twice: admin888", "admin888"));
        Assertions.assertEquals("short ab stays", SensitiveDataMasker.redactValue("short ab stays", "ab"));
        Assertions.assertNull(SensitiveDataMasker.redactValue(null, "admin888"));
    }

    @Test
    void keyHintsAreCaseInsensitive() {
        Assertions.assertTrue(SensitiveDataMasker.isSensitiveKey("X-Authorization"));
        Assertions.assertFalse(SensitiveDataMasker.isSensitiveKey("file_name"));
        Assertions.assertFalse(SensitiveDataMasker.isSensitiveKey(" "));
    }
}
