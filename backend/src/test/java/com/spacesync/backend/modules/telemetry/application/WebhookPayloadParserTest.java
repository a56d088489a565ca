package com.spacesync.backend.modules.telemetry.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;

import com.spacesync.backend.global.error.ProblemException;
import com.spacesync.backend.modules.telemetry.domain.AckEvent;
import com.spacesync.backend.modules.telemetry.domain.UplinkEvent;

import com.fasterxml.jackson.databind.ObjectMapper;

import org.junit.jupiter.api.Test;

class WebhookPayloadParserTest {

    private final WebhookPayloadParser parser = new WebhookPayloadParser(new ObjectMapper());

    @Test
    void parsesDecodedUplink() {
        UplinkEvent uplink = parser.parseUplink(parser.readTree(bytes("""
                {
                  "deviceInfo": {"devEui": "01-02-03-04-05-06-07-0A"},
                  "fCnt": 42,
                  "object": {"occupied": true},
                  "rxInfo": [{"rssi": -101, "snr": -3.5}, {"rssi": -60, "snr": 9.0}]
                }
                """)));

        assertThat(uplink.devEui()).isEqualTo("010203040506070a");
        assertThat(uplink.fcnt()).isEqualTo(42L);
        assertThat(uplink.occupied()).isTrue();
        assertThat(uplink.rssi()).isEqualTo(-101);
        assertThat(uplink.snr()).isEqualTo(-3.5);
    }

    @Test
    void fallsBackToRawData() {
        UplinkEvent occupied = parser.parseUplink(parser.readTree(bytes("""
                {"deviceInfo": {"devEui": "0102030405060708"}, "fCnt": 1, "data": "AQ=="}
                """)));
        UplinkEvent free = parser.parseUplink(parser.readTree(bytes("""
                {"deviceInfo": {"devEui": "0102030405060708"}, "fCnt": 2, "data": "AA=="}
                """)));
        UplinkEvent none = parser.parseUplink(parser.readTree(bytes("""
                {"deviceInfo": {"devEui": "0102030405060708"}, "fCnt": 3}
                """)));

        assertThat(occupied.occupied()).isTrue();
        assertThat(free.occupied()).isFalse();
        assertThat(none.occupied()).isNull();
        assertThat(none.rssi()).isNull();
    }

    @Test
    void lenientOccupancyValues() {
        assertThat(parser.parseUplink(parser.readTree(bytes("""
                {"deviceInfo": {"devEui": "0102030405060708"}, "fCnt": 1, "object": {"occupied": 1}}
                """))).occupied()).isTrue();
        assertThat(parser.parseUplink(parser.readTree(bytes("""
                {"deviceInfo": {"devEui": "0102030405060708"}, "fCnt": 1, "object": {"occupied": "free"}}
                """))).occupied()).isFalse();
    }

    @Test
    void rejectsMalformedPayloads() {
        assertMalformed("{\"fCnt\": 1}", true);
        assertMalformed("{\"deviceInfo\": {\"devEui\": \"0102030405060708\"}}", true);
        assertMalformed("{\"deviceInfo\": {\"devEui\": \"0102030405060708\"}, \"fCnt\": -1}", true);
        assertMalformed("{\"deviceInfo\": {\"devEui\": \"xyz\"}, \"fCnt\": 1}", true);
        assertMalformed("{not json", false);
        assertMalformed("[1, 2]", false);
    }

    @Test
    void frameCounterMustBeAWholeNumber() {
        assertMalformed("{\"deviceInfo\": {\"devEui\": \"0102030405060708\"}, \"fCnt\": 5.7}", true);
        assertMalformed("{\"deviceInfo\": {\"devEui\": \"0102030405060708\"}, \"fCnt\": \"5\"}", true);
        assertMalformed("{\"deviceInfo\": {\"devEui\": \"0102030405060708\"}, \"fCnt\": 99999999999999999999}", true);
    }

    @Test
    void parsesAck() {
        AckEvent ack = parser.parseAck(parser.readTree(bytes("""
                {"deviceInfo": {"devEui": "0102030405060708"}, "queueItemId": "q-1", "acknowledged": true}
                """)));

        assertThat(ack.queueItemId()).isEqualTo("q-1");
        assertThat(ack.acknowledged()).isTrue();
        assertThatThrownBy(() -> parser.parseAck(parser.readTree(bytes("""
                {"deviceInfo": {"devEui": "0102030405060708"}}
                """)))).isInstanceOf(ProblemException.class);
    }

    private void assertMalformed(String body, boolean asUplink) {
        assertThatThrownBy(() -> {
            if (asUplink) {
                parser.parseUplink(parser.readTree(bytes(body)));
            } else {
                parser.readTree(bytes(body));
            }
        }).isInstanceOfSatisfying(ProblemException.class,
                ex -> assertThat(ex.getCode()).isEqualTo("webhook.malformed_payload"));
    }

    private static byte[] bytes(String json) {
        return json.getBytes(StandardCharsets.UTF_8);
    }
}
