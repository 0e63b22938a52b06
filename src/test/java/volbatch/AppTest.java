package volbatch;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AppTest {

    @Test
    void helpExitsZero() {
        assertEquals(0, App.run(new String[] {"-h"}));
    }

    @Test
    void unknownFlagExitsOne() {
        assertEquals(1, App.run(new String[] {"--definitely-not-a-flag"}));
    }

    @Test
    void badConcurrencyExitsOne() {
        assertEquals(1, App.run(new String[] {"-p", "vol", "-i", "img", "-m", "m.txt", "-o", "out", "-j", "0"}));
    }
}
