package com.di.healthnova.handler.markup;

import com.di.healthnova.exception.ErrorCategory;
import com.di.healthnova.exception.RawFileReadException;
import com.di.healthnova.exception.UnsupportedFormatException;
import com.di.healthnova.handler.AdapterParseResult;
import com.di.healthnova.handler.ProviderAdapter;
import com.di.healthnova.handler.RawFormat;
import com.di.healthnova.model.PartialIngestionWarning;
import com.di.healthnova.model.RawFile;
import com.di.healthnova.model.RawRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import java.io.IOException;
import java.io.InputStream;
import java.util.Locale;

/**
 * Apple Health {@code export.xml}. Streams the document and emits one raw record per
 * {@code <Record type="…" unit="…" value="…" startDate="2024-01-01 07:00:00 +0100"/>} element.
 * Other elements (Workout, ActivitySummary, Me) are ignored.
 */
@Slf4j
@Component
public class AppleHealthXmlAdapter implements ProviderAdapter {

    public static final String PROVIDER = "apple_health";

    private static final String ROOT = "HealthData";
    private static final String RECORD = "Record";

    private static final XMLInputFactory XML_INPUT_FACTORY = newInputFactory();

    @Override
    public String provider() {
        return PROVIDER;
    }

    @Override
    public RawFormat format() {
        return RawFormat.TAGGED_MARKUP;
    }

    @Override
    public boolean canHandle(String fileName) {
        String name = fileName.toLowerCase(Locale.ROOT);
        return name.endsWith(".xml") && (name.endsWith("export.xml") || name.contains("apple") || name.contains("health"));
    }

    @Override
    public AdapterParseResult parse(RawFile file) {
        AdapterParseResult.Collector collector = new AdapterParseResult.Collector();
        XMLStreamReader reader = null;
        try (InputStream in = file.openStream()) {
            reader = XML_INPUT_FACTORY.createXMLStreamReader(in);
            requireRoot(reader, file);
            int position = 0;
            while (reader.hasNext()) {
                if (reader.next() != XMLStreamConstants.START_ELEMENT || !RECORD.equals(reader.getLocalName())) {
                    continue;
                }
                position++;
                String type = attribute(reader, "type");
                String value = attribute(reader, "value");
                String startDate = attribute(reader, "startDate");
                String unit = attribute(reader, "unit");
                if (type == null || value == null || startDate == null) {
                    String detail = "Record element lacks " + (type == null ? "type" : value == null ? "value" : "startDate");
                    log.warn("[apple_health] skipping record {} of '{}': {}", position, file.getFileName(), detail);
                    collector.skip(new PartialIngestionWarning(position, ErrorCategory.MALFORMED_RECORD, detail));
                    continue;
                }
                collector.add(new RawRecord(type, value, unit, startDate, PROVIDER, position));
            }
        } catch (XMLStreamException e) {
            throw new UnsupportedFormatException("apple_health: '" + file.getFileName() + "' is not well-formed XML: "
                    + e.getMessage(), e);
        } catch (IOException e) {
            throw new RawFileReadException("apple_health: cannot read '" + file.getFileName() + "'", e);
        } finally {
            closeQuietly(reader);
        }
        return collector.build();
    }

    private static void requireRoot(XMLStreamReader reader, RawFile file) throws XMLStreamException {
        while (reader.hasNext()) {
            if (reader.next() == XMLStreamConstants.START_ELEMENT) {
                if (!ROOT.equals(reader.getLocalName())) {
                    throw new UnsupportedFormatException(String.format(
                            "apple_health: '%s' has root <%s>, expected <%s>", file.getFileName(), reader.getLocalName(), ROOT));
                }
                return;
            }
        }
        throw new UnsupportedFormatException("apple_health: '" + file.getFileName() + "' has no root element");
    }

    private static String attribute(XMLStreamReader reader, String name) {
        String value = reader.getAttributeValue(null, name);
        return value == null || value.isBlank() ? null : value.trim();
    }

    private static void closeQuietly(XMLStreamReader reader) {
        if (reader == null) return;
        try {
            reader.close();
        } catch (XMLStreamException e) {
            log.debug("Failed to close XML reader: {}", e.getMessage());
        }
    }

    private static XMLInputFactory newInputFactory() {
        XMLInputFactory factory = XMLInputFactory.newFactory();
        factory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
        factory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
        return factory;
    }
}
