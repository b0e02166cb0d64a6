package com.browserpilot.core.captcha;

import com.browserpilot.client.AckResponse;
import com.browserpilot.core.PilotHarness;
import com.browserpilot.core.errors.CaptchaPendingException;
import com.browserpilot.core.errors.ErrorKind;
import com.browserpilot.core.errors.TransportException;
import com.browserpilot.core.errors.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static com.browserpilot.core.Responses.ok;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CaptchaGateTest {

    private PilotHarness h;
    private CaptchaGate gate;

    @BeforeEach
    void setUp() {
        h = new PilotHarness();
        h.startSession("S1");
        gate = h.captchaGate;
    }

    @Test
    @DisplayName("waiting_for_captcha raises the flag once")
    void raisesFlag() {
        gate.observe("S1", CaptchaGate.WAITING_FOR_CAPTCHA);
        gate.observe("S1", CaptchaGate.WAITING_FOR_CAPTCHA);

        assertTrue(gate.isPending());
        assertEquals(1, h.eventTypes().stream().filter("captcha.required"::equals).count());
        assertEquals(1.0, h.registry.find("browserpilot.captcha.pauses").counter().count());
        assertThrows(CaptchaPendingException.class, () -> gate.checkSubmissionAllowed("S1"));
    }

    @Test
    @DisplayName("any other status clears the flag")
    void otherStatusClears() {
        gate.observe("S1", CaptchaGate.WAITING_FOR_CAPTCHA);
        gate.observe("S1", "active");

        assertFalse(gate.isPending());
        assertTrue(h.eventTypes().contains("captcha.cleared"));
        assertDoesNotThrow(() -> gate.checkSubmissionAllowed("S1"));
    }

    @Test
    @DisplayName("observations for a session that is not current are ignored")
    void ignoresForeignSession() {
        gate.observe("OTHER", CaptchaGate.WAITING_FOR_CAPTCHA);

        assertFalse(gate.isPending());
        assertFalse(h.eventTypes().contains("captcha.required"));
    }

    @Test
    @DisplayName("resolve clears the flag after the service acknowledges")
    void resolveClears() {
        gate.observe("S1", CaptchaGate.WAITING_FOR_CAPTCHA);
        when(h.client.resolveCaptcha("S1")).thenReturn(ok());

        gate.resolve("S1");

        assertFalse(gate.isPending());
        assertTrue(h.eventTypes().contains("captcha.resolved"));
        assertDoesNotThrow(() -> gate.checkSubmissionAllowed("S1"));
    }

    @Test
    @DisplayName("a failed resolution keeps the flag set and records the error")
    void resolveFailureKeepsFlag() {
        gate.observe("S1", CaptchaGate.WAITING_FOR_CAPTCHA);
        when(h.client.resolveCaptcha("S1"))
                .thenThrow(new TransportException("resolveCaptcha", "S1", null, 500, "Internal error"));

        assertThrows(TransportException.class, () -> gate.resolve("S1"));

        assertTrue(gate.isPending());
        assertEquals(ErrorKind.TRANSPORT, h.store.get().lastError().kind());
    }

    @Test
    @DisplayName("a successful retry clears the error of the failed resolution")
    void retryClearsError() {
        gate.observe("S1", CaptchaGate.WAITING_FOR_CAPTCHA);
        when(h.client.resolveCaptcha("S1"))
                .thenThrow(new TransportException("resolveCaptcha", "S1", null, 500, "boom"))
                .thenReturn(ok());

        assertThrows(TransportException.class, () -> gate.resolve("S1"));
        assertNotNull(h.store.get().lastError());

        gate.resolve("S1");

        assertFalse(gate.isPending());
        assertNull(h.store.get().lastError());
    }

    @Test
    @DisplayName("an error acknowledgement keeps the flag set")
    void resolveErrorAck() {
        gate.observe("S1", CaptchaGate.WAITING_FOR_CAPTCHA);
        when(h.client.resolveCaptcha("S1")).thenReturn(new AckResponse("error", "no captcha pending"));

        assertThrows(TransportException.class, () -> gate.resolve("S1"));
        assertTrue(gate.isPending());
    }

    @Test
    @DisplayName("a blank session id is rejected without a call")
    void rejectsBlankId() {
        assertThrows(ValidationException.class, () -> gate.resolve(" "));
        verify(h.client, never()).resolveCaptcha(" ");
    }

    @Test
    @DisplayName("a session other than the current one is resolved on the service only")
    void resolvesForeignSession() {
        gate.observe("S1", CaptchaGate.WAITING_FOR_CAPTCHA);
        when(h.client.resolveCaptcha("OTHER")).thenReturn(ok());

        gate.resolve("OTHER");

        verify(h.client).resolveCaptcha("OTHER");
        assertTrue(gate.isPending());
    }
}
