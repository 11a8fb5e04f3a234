package com.bko.biketracker.tracking.domain;

import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;
import java.io.ByteArrayOutputStream;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Writes an activity as a GPX 1.1 document with a single track segment.
 * Every probe becomes a track point, idle ones included.
 */
public class GpxTrackExporter {
    private static final String GPX_NAMESPACE = "http://www.topografix.com/GPX/1/1";
    private static final String CREATOR = "bike-tracker";

    private final XMLOutputFactory outputFactory = XMLOutputFactory.newFactory();

    public byte[] export(Activity activity, List<Probe> probes) {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try {
            XMLStreamWriter xml = outputFactory.createXMLStreamWriter(buffer, StandardCharsets.UTF_8.name());
            xml.writeStartDocument(StandardCharsets.UTF_8.name(), "1.0");
            xml.writeStartElement("gpx");
            xml.writeDefaultNamespace(GPX_NAMESPACE);
            xml.writeAttribute("version", "1.1");
            xml.writeAttribute("creator", CREATOR);

            if (!probes.isEmpty()) {
                xml.writeStartElement("metadata");
                writeText(xml, "time", probes.get(0).receivedAt().toString());
                xml.writeEndElement();
            }

            xml.writeStartElement("trk");
            writeText(xml, "name", trackName(activity));
            xml.writeStartElement("trkseg");
            for (Probe probe : probes) {
                xml.writeStartElement("trkpt");
                xml.writeAttribute("lat", decimal(probe.latitude()));
                xml.writeAttribute("lon", decimal(probe.longitude()));
                if (probe.altitude() != null) {
                    writeText(xml, "ele", decimal(probe.altitude()));
                }
                writeText(xml, "time", probe.receivedAt().toString());
                xml.writeEndElement();
            }
            xml.writeEndElement();
            xml.writeEndElement();

            xml.writeEndElement();
            xml.writeEndDocument();
            xml.flush();
            xml.close();
        } catch (XMLStreamException e) {
            throw new IllegalStateException("Failed to write GPX for activity " + activity.id(), e);
        }
        return buffer.toByteArray();
    }

    public static String trackName(Activity activity) {
        return "Ride #" + activity.id();
    }

    // GPX types coordinates and elevation as xsd:decimal, which has no exponent form.
    private static String decimal(double value) {
        return BigDecimal.valueOf(value).toPlainString();
    }

    private static void writeText(XMLStreamWriter xml, String element, String text) throws XMLStreamException {
        xml.writeStartElement(element);
        xml.writeCharacters(text);
        xml.writeEndElement();
    }
}
