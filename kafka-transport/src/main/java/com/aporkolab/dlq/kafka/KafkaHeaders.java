package com.aporkolab.dlq.kafka;

import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

import org.apache.kafka.common.header.Header;
import org.apache.kafka.common.header.Headers;

/**
 * Conversion between Kafka's byte-valued headers and the string headers the retry engine uses.
 */
final class KafkaHeaders {

    private KafkaHeaders() {
    }

    /**
     * Later headers with the same key win.
     */
    static Map<String, String> toMap(Headers headers) {
        Map<String, String> map = new LinkedHashMap<>();
        if (headers == null) {
            return map;
        }
        for (Header header : headers) {
            map.put(header.key(), header.value() == null ? "" : new String(header.value(), StandardCharsets.UTF_8));
        }
        return map;
    }

    static void copyInto(Map<String, String> source, Headers target) {
        if (source == null) {
            return;
        }
        source.forEach((key, value) -> {
            target.remove(key);
            target.add(key, value == null ? new byte[0] : value.getBytes(StandardCharsets.UTF_8));
        });
    }
}
