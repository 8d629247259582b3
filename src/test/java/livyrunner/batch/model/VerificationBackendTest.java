package livyrunner.batch.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class VerificationBackendTest {

    @Test
    void parseKnownValues() {
        assertEquals(VerificationBackend.NONE, VerificationBackend.parse(null));
        assertEquals(VerificationBackend.NONE, VerificationBackend.parse(" "));
        assertEquals(VerificationBackend.NONE, VerificationBackend.parse("none"));
        assertEquals(VerificationBackend.SPARK, VerificationBackend.parse("spark"));
        assertEquals(VerificationBackend.YARN, VerificationBackend.parse(" YARN "));
    }

    @Test
    void unknownValueIsRejected() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> VerificationBackend.parse("mesos"));
        assertTrue(e.getMessage().contains("'mesos'"));
        assertTrue(e.getMessage().contains("spark"));
        assertTrue(e.getMessage().contains("yarn"));
    }

    @Test
    void logPolicyParsing() {
        assertEquals(LogPolicy.ALWAYS, LogPolicy.parse(null));
        assertEquals(LogPolicy.ON_FAILURE, LogPolicy.parse("on-failure"));
        assertEquals(LogPolicy.NEVER, LogPolicy.parse("never"));
        assertThrows(IllegalArgumentException.class, () -> LogPolicy.parse("sometimes"));
    }

    @Test
    void logPolicyDecision() {
        assertTrue(LogPolicy.ALWAYS.shouldSpill(false));
        assertTrue(LogPolicy.ON_FAILURE.shouldSpill(true));
        assertFalse(LogPolicy.ON_FAILURE.shouldSpill(false));
        assertFalse(LogPolicy.NEVER.shouldSpill(true));
    }
}
