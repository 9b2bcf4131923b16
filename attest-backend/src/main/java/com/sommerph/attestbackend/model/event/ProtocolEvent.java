package com.sommerph.attestbackend.model.event;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProtocolEvent {

    // assigned by the event log on commit
    private long sequence;

    private long blockNumber;
    private long timestamp;
    private String unit;
    private EventType type;

    @Builder.Default
    private Map<String, Object> attributes = new LinkedHashMap<>();

    public Object attribute(String name) {
        return attributes.get(name);
    }

    /**
     * Builds an ordered attribute map from alternating names and values.
     */
    public static Map<String, Object> attrs(Object... namesAndValues) {
        if (namesAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("Attributes must be given as name/value pairs");
        }
        Map<String, Object> attributes = new LinkedHashMap<>();
        for (int i = 0; i < namesAndValues.length; i += 2) {
            attributes.put(String.valueOf(namesAndValues[i]), namesAndValues[i + 1]);
        }
        return attributes;
    }

}
