/*
 * Copyright 2025 Steven Lopez
 * SPDX-License-Identifier: Apache-2.0
 */

package com.intuitivedesigns.telemetrykernel.output;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.intuitivedesigns.telemetrykernel.config.PipelineConfig;
import com.intuitivedesigns.telemetrykernel.core.EventRecord;
import com.intuitivedesigns.telemetrykernel.core.JsonSupport;
import com.intuitivedesigns.telemetrykernel.metrics.NoopMetricsRuntime;
import org.apache.kafka.clients.producer.MockProducer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.serialization.ByteArraySerializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class KafkaEventSinkTest {

    private static EventRecord record() throws Exception {
        final ObjectNode body = (ObjectNode) JsonSupport.MAPPER.readTree(
                "{\"class_uid\":2004,\"metadata\":{\"uid\":\"evt-42\"}}");
        return EventRecord.of(body)
                .putMetadata("tag.category", "detection")
                .putMetadata("http.received_at", "2025-01-01T00:00:00Z");
    }

    private static MockProducer<String, byte[]> producer(boolean autoComplete) {
        return new MockProducer<>(autoComplete, new StringSerializer(), new ByteArraySerializer());
    }

    @Test
    void publishesBodyKeyAndHeaders() throws Exception {
        final MockProducer<String, byte[]> producer = producer(true);
        final KafkaEventSink sink = new KafkaEventSink(producer, "ocsf-events", false, 10, 1_000, NoopMetricsRuntime.INSTANCE);

        sink.write(record());

        assertEquals(1, producer.history().size());
        final ProducerRecord<String, byte[]> sent = producer.history().get(0);
        assertEquals("ocsf-events", sent.topic());
        assertEquals("evt-42", sent.key());

        final JsonNode value = JsonSupport.MAPPER.readTree(sent.value());
        assertEquals(2004, value.get("class_uid").asInt());

        assertEquals("detection",
                new String(sent.headers().lastHeader("tag.category").value(), StandardCharsets.UTF_8));
        assertEquals("2025-01-01T00:00:00Z",
                new String(sent.headers().lastHeader("http.received_at").value(), StandardCharsets.UTF_8));

        assertEquals(1, sink.sentOkTotal());
        assertEquals(0, sink.inFlightTotal());
        assertEquals("kafka:ocsf-events", sink.id());
    }

    @Test
    void asyncFailureIsCountedAndReleasesPermit() throws Exception {
        final MockProducer<String, byte[]> producer = producer(false);
        final KafkaEventSink sink = new KafkaEventSink(producer, "ocsf-events", false, 1, 1_000, NoopMetricsRuntime.INSTANCE);

        sink.write(record());
        assertEquals(1, sink.inFlightTotal());

        assertTrue(producer.errorNext(new KafkaException("broker down")));

        assertEquals(1, sink.sentFailTotal());
        assertEquals(0, sink.inFlightTotal());

        // permit is back, so a second write does not block
        sink.write(record());
        assertTrue(producer.completeNext());
        assertEquals(1, sink.sentOkTotal());
    }

    @Test
    void syncFailureIsThrownForDeadLettering() throws Exception {
        final MockProducer<String, byte[]> producer = producer(true);
        producer.sendException = new KafkaException("not authorized");
        final KafkaEventSink sink = new KafkaEventSink(producer, "ocsf-events", true, 10, 1_000, NoopMetricsRuntime.INSTANCE);

        assertThrows(KafkaException.class, () -> sink.write(record()));

        assertEquals(1, sink.sentFailTotal());
        assertEquals(0, sink.inFlightTotal());
    }

    @Test
    void closeFlushesAndClosesProducer() throws Exception {
        final MockProducer<String, byte[]> producer = producer(true);
        final KafkaEventSink sink = new KafkaEventSink(producer, "t", false, 0, 1_000, NoopMetricsRuntime.INSTANCE);

        sink.write(record());
        sink.close();

        assertTrue(producer.closed());
    }

    @Test
    void producerPropsFromConfig() {
        final Properties props = KafkaEventSink.buildProducerProps(PipelineConfig.fromMap(Map.of(
                "kafka.bootstrap.servers", "broker:9093",
                "kafka.security.protocol", "SSL",
                "kafka.ssl.truststore.location", "/etc/kafka/trust.jks")));

        assertEquals("broker:9093", props.get(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG));
        assertEquals(ByteArraySerializer.class.getName(), props.get(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG));
        assertEquals("SSL", props.get("security.protocol"));
        assertEquals("/etc/kafka/trust.jks", props.get("ssl.truststore.location"));
        assertEquals("all", props.get(ProducerConfig.ACKS_CONFIG));
    }
}
