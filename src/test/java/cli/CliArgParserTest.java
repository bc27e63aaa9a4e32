package cli;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CliArgParserTest {

    @Test
    void parseArgs_shouldAcceptEqualsSpaceAndBareForms() {
        Map<String, String> m = CliArgParser.parseArgs(new String[]{
                "--dataset=dev.json", "--pred", "pred.txt", "--execute", "positional", "--threads=4"});

        assertEquals("dev.json", m.get("dataset"));
        assertEquals("pred.txt", m.get("pred"));
        assertEquals("positional", m.get("execute"), "a bare flag consumes the next non-option token");
        assertEquals("4", m.get("threads"));
    }

    @Test
    void flag_shouldTreatPresenceAsTrue() {
        Map<String, String> m = CliArgParser.parseArgs(new String[]{"--execute", "--noReport=false"});

        assertTrue(CliArgParser.flag(m, "execute"));
        assertFalse(CliArgParser.flag(m, "noReport"));
        assertFalse(CliArgParser.flag(m, "missing"));
    }

    @Test
    void parseNumbers_shouldFallBackToDefault() {
        assertEquals(7, CliArgParser.parseInt(" 7 ", 1));
        assertEquals(1, CliArgParser.parseInt("seven", 1));
        assertEquals(5000L, CliArgParser.parseLong(null, 5000L));
        assertTrue(CliArgParser.parseBoolean("YES", false));
        assertFalse(CliArgParser.parseBoolean("off", true));
    }
}
