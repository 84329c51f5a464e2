package com.di.healthnova.handler.markup;

import com.di.healthnova.exception.UnsupportedFormatException;
import com.di.healthnova.handler.AdapterParseResult;
import com.di.healthnova.handler.TestAdapters;
import com.di.healthnova.model.RawFile;
import com.di.healthnova.model.RawRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AppleHealthXmlAdapter Tests")
class AppleHealthXmlAdapterTest {

    private final AppleHealthXmlAdapter adapter = new AppleHealthXmlAdapter();

    @Test
    @DisplayName("Should emit one raw record per Record element")
    void testParse_Records() {
        AdapterParseResult result = adapter.parse(TestAdapters.fixture("export.xml"));

        assertEquals(4, result.getRecords().size());
        RawRecord steps = result.getRecords().get(0);
        assertEquals("HKQuantityTypeIdentifierStepCount", steps.fieldName());
        assertEquals("640", steps.rawValue());
        assertEquals("count", steps.unitHint());
        assertEquals("2024-01-01 09:00:00 +0100", steps.timestampRaw());
        assertEquals("apple_health", steps.provider());
    }

    @Test
    @DisplayName("Should skip a Record without value")
    void testParse_RecordWithoutValue() {
        AdapterParseResult result = adapter.parse(TestAdapters.fixture("export.xml"));

        assertEquals(1, result.skippedCount());
        assertEquals(5, result.getSkipped().get(0).position());
    }

    @Test
    @DisplayName("Should reject a document with another root element")
    void testParse_WrongRoot() {
        assertThrows(UnsupportedFormatException.class, () -> adapter.parse(TestAdapters.fixture("not_health.xml")));
    }

    @Test
    @DisplayName("Should reject malformed XML")
    void testParse_Malformed() {
        RawFile file = RawFile.of("export.xml", "<HealthData><Record type=\"x\" value=\"1\" startDate=\"2024-01-01\"></HealthData>");
        assertThrows(UnsupportedFormatException.class, () -> adapter.parse(file));
    }

    @Test
    @DisplayName("Should not resolve external entities")
    void testParse_ExternalEntityRejected() {
        RawFile file = RawFile.of("export.xml", "<?xml version=\"1.0\"?>\n"
                + "<!DOCTYPE HealthData [<!ENTITY xxe SYSTEM \"file:///etc/passwd\">]>\n"
                + "<HealthData><Record type=\"HKQuantityTypeIdentifierStepCount\" value=\"&xxe;\" "
                + "startDate=\"2024-01-01 09:00:00 +0100\"/></HealthData>");
        try {
            AdapterParseResult result = adapter.parse(file);
            assertTrue(result.getRecords().stream().noneMatch(r -> r.rawValue().contains("root:")));
        } catch (UnsupportedFormatException expected) {
            // the undeclared entity is rejected by the parser
        }
    }
}
