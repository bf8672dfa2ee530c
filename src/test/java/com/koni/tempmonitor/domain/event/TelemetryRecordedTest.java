package com.koni.tempmonitor.domain.event;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.koni.tempmonitor.domain.model.DeviceReading;
import com.koni.tempmonitor.tags.UnitTest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

@UnitTest
class TelemetryRecordedTest {

    private static final Instant RECORDED_AT = Instant.parse("2024-03-01T10:15:30Z");

    @ParameterizedTest
    @CsvSource({
            "37.0, 98.6",
            "0.0, 32.0",
            "-40.0, -40.0",
            "38.55, 101.4",
            "36.1, 97.0"
    })
    void shouldConvertObjectTemperatureToFahrenheit(double celsius, double fahrenheit) {
        assertThat(TelemetryRecorded.toFahrenheit(celsius)).isEqualTo(fahrenheit);
    }

    @Test
    void ofShouldCopyTheReading() {
        DeviceReading reading = new DeviceReading("D1", 23.4, 37.0, 1_700_000_000_000L);

        TelemetryRecorded event = TelemetryRecorded.of(reading, RECORDED_AT);

        assertThat(event.getEventId()).isNotNull();
        assertThat(event.getDeviceId()).isEqualTo("D1");
        assertThat(event.getAmbientTemp()).isEqualTo(23.4);
        assertThat(event.getObjectTemp()).isEqualTo(37.0);
        assertThat(event.getObjectTempF()).isEqualTo(98.6);
        assertThat(event.getTimestamp()).isEqualTo(1_700_000_000_000L);
        assertThat(event.getRecordedAt()).isEqualTo(RECORDED_AT);
    }

    @Test
    void eachEventShouldGetItsOwnId() {
        DeviceReading reading = new DeviceReading("D1", 23.4, 37.0, 1L);

        assertThat(TelemetryRecorded.of(reading, RECORDED_AT).getEventId())
                .isNotEqualTo(TelemetryRecorded.of(reading, RECORDED_AT).getEventId());
    }

    @Test
    void shouldDeserializeWhatTheProducerWrites() throws Exception {
        ObjectMapper objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        TelemetryRecorded event = TelemetryRecorded.of(new DeviceReading("D1", 23.4, 37.0, 1L), RECORDED_AT);

        String json = objectMapper.writeValueAsString(event);

        assertThat(json).contains("\"recordedAt\":\"2024-03-01T10:15:30Z\"");
        assertThat(objectMapper.readValue(json, TelemetryRecorded.class)).isEqualTo(event);
    }
}
