package com.koni.tempmonitor.application.ingestion;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.koni.tempmonitor.domain.exception.MalformedFrameException;
import com.koni.tempmonitor.domain.model.DeviceReading;
import com.koni.tempmonitor.tags.UnitTest;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@UnitTest
class FrameDecoderTest {

    private static final long RECEIVED_AT = 1_700_000_000_000L;

    private final FrameDecoder decoder = new FrameDecoder(new ObjectMapper());

    @Test
    void shouldDecodeTemperatureFrame() {
        String payload = "{\"type\":\"temperature\",\"deviceId\":\"D1\",\"ambientTemp\":24.5,"
                + "\"objectTemp\":32.1,\"timestamp\":1699999999000}";

        InboundFrame frame = decoder.decode(payload, RECEIVED_AT);

        assertThat(frame.getKind()).isEqualTo(InboundFrame.Kind.TEMPERATURE);
        DeviceReading reading = ((TemperatureFrame) frame).toReading();
        assertThat(reading).isEqualTo(new DeviceReading("D1", 24.5, 32.1, 1_699_999_999_000L));
    }

    @Test
    void shouldAcceptIntegerTemperatures() {
        String payload = "{\"type\":\"temperature\",\"deviceId\":\"D1\",\"ambientTemp\":24,\"objectTemp\":37}";

        TemperatureFrame frame = (TemperatureFrame) decoder.decode(payload, RECEIVED_AT);

        assertThat(frame.getAmbientTemp()).isEqualTo(24.0);
        assertThat(frame.getObjectTemp()).isEqualTo(37.0);
    }

    @Test
    void shouldUseReceiptTimeWhenTimestampIsMissing() {
        String payload = "{\"type\":\"temperature\",\"deviceId\":\"D1\",\"ambientTemp\":24.5,\"objectTemp\":32.1}";

        TemperatureFrame frame = (TemperatureFrame) decoder.decode(payload, RECEIVED_AT);

        assertThat(frame.getTimestamp()).isEqualTo(RECEIVED_AT);
    }

    @Test
    void shouldUseReceiptTimeWhenTimestampIsNotANumber() {
        String payload = "{\"type\":\"temperature\",\"deviceId\":\"D1\",\"ambientTemp\":24.5,"
                + "\"objectTemp\":32.1,\"timestamp\":\"yesterday\"}";

        TemperatureFrame frame = (TemperatureFrame) decoder.decode(payload, RECEIVED_AT);

        assertThat(frame.getTimestamp()).isEqualTo(RECEIVED_AT);
    }

    @Test
    void shouldDecodeHandshakeWithOptionalFields() {
        HandshakeFrame full = (HandshakeFrame) decoder.decode(
                "{\"type\":\"handshake\",\"deviceId\":\"D1\",\"deviceName\":\"Ward 3 bed 2\"}", RECEIVED_AT);
        HandshakeFrame bare = (HandshakeFrame) decoder.decode("{\"type\":\"handshake\"}", RECEIVED_AT);

        assertThat(full.getDeviceId()).isEqualTo("D1");
        assertThat(full.getDeviceName()).isEqualTo("Ward 3 bed 2");
        assertThat(bare.getDeviceId()).isNull();
        assertThat(bare.getDeviceName()).isNull();
    }

    @Test
    void shouldReturnUnknownFrameForUnrecognisedType() {
        InboundFrame frame = decoder.decode("{\"type\":\"firmware-update\",\"version\":\"2.1\"}", RECEIVED_AT);

        assertThat(frame.getKind()).isEqualTo(InboundFrame.Kind.UNKNOWN);
        assertThat(((UnknownFrame) frame).getType()).isEqualTo("firmware-update");
    }

    @Test
    void shouldReturnUnknownFrameWhenTypeIsMissing() {
        InboundFrame frame = decoder.decode("{\"deviceId\":\"D1\",\"ambientTemp\":24.5}", RECEIVED_AT);

        assertThat(frame.getKind()).isEqualTo(InboundFrame.Kind.UNKNOWN);
        assertThat(((UnknownFrame) frame).getType()).isNull();
    }

    @ParameterizedTest
    @ValueSource(strings = {"not json", "{\"type\":", "[1,2,3]", "\"temperature\"", "42", ""})
    void shouldRejectPayloadsThatAreNotJsonObjects(String payload) {
        assertThatThrownBy(() -> decoder.decode(payload, RECEIVED_AT))
                .isInstanceOf(MalformedFrameException.class);
    }

    @Test
    void shouldRejectNullPayload() {
        assertThatThrownBy(() -> decoder.decode(null, RECEIVED_AT))
                .isInstanceOf(MalformedFrameException.class);
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "{\"type\":\"temperature\",\"ambientTemp\":24.5,\"objectTemp\":32.1}",
            "{\"type\":\"temperature\",\"deviceId\":\"  \",\"ambientTemp\":24.5,\"objectTemp\":32.1}",
            "{\"type\":\"temperature\",\"deviceId\":7,\"ambientTemp\":24.5,\"objectTemp\":32.1}",
            "{\"type\":\"temperature\",\"deviceId\":\"D1\",\"objectTemp\":32.1}",
            "{\"type\":\"temperature\",\"deviceId\":\"D1\",\"ambientTemp\":\"warm\",\"objectTemp\":32.1}",
            "{\"type\":\"temperature\",\"deviceId\":\"D1\",\"ambientTemp\":24.5,\"objectTemp\":null}"
    })
    void shouldRejectTemperatureFramesWithInvalidFields(String payload) {
        assertThatThrownBy(() -> decoder.decode(payload, RECEIVED_AT))
                .isInstanceOf(MalformedFrameException.class);
    }
}
