package com.jiralert.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.OffsetDateTime;
import java.util.Map;

/**
 * 单条告警, 解码后不可变
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Alert {

    public static final String STATUS_FIRING = "firing";

    public static final String STATUS_RESOLVED = "resolved";

    /** firing | resolved */
    String status;

    @Builder.Default
    Map<String, String> labels = Map.of();

    @Builder.Default
    Map<String, String> annotations = Map.of();

    OffsetDateTime startsAt;

    OffsetDateTime endsAt;

    String generatorURL;

    String fingerprint;

    @JsonIgnore
    public boolean isFiring() {
        return STATUS_FIRING.equals(status);
    }
}
