package component.config;

import component.GameLoop;
import component.board.KeyBindingInstaller.KeySet;
import org.junit.After;
import org.junit.Test;

import java.util.Properties;

import static org.junit.Assert.*;

public class SettingsTest {

    @After
    public void clearOverrides() {
        System.clearProperty(Settings.KEY_TICK_INTERVAL);
        System.clearProperty(Settings.KEY_KEY_SET);
        System.clearProperty(Settings.KEY_SEED);
    }

    @Test
    public void testDefaults() {
        Settings s = Settings.from(new Properties());

        assertEquals(GameLoop.DEFAULT_INTERVAL_MS, s.tickIntervalMs);
        assertEquals(KeySet.ARROWS, s.keySet);
        assertNull(s.seed);
    }

    @Test
    public void testValidValues() {
        Properties p = new Properties();
        p.setProperty(Settings.KEY_TICK_INTERVAL, " 250 ");
        p.setProperty(Settings.KEY_KEY_SET, "wasd");
        p.setProperty(Settings.KEY_SEED, "42");

        Settings s = Settings.from(p);

        assertEquals(250, s.tickIntervalMs);
        assertEquals(KeySet.WASD, s.keySet);
        assertEquals(Long.valueOf(42), s.seed);
    }

    @Test
    public void testInvalidValuesFallBack() {
        Properties p = new Properties();
        p.setProperty(Settings.KEY_TICK_INTERVAL, "0");
        p.setProperty(Settings.KEY_KEY_SET, "JOYSTICK");
        p.setProperty(Settings.KEY_SEED, "abc");

        Settings s = Settings.from(p);

        assertEquals(GameLoop.DEFAULT_INTERVAL_MS, s.tickIntervalMs);
        assertEquals(KeySet.ARROWS, s.keySet);
        assertNull(s.seed);
    }

    @Test
    public void testLoadReadsBundledResource() {
        Settings s = Settings.load();

        assertEquals(1000, s.tickIntervalMs);
        assertEquals(KeySet.ARROWS, s.keySet);
    }

    @Test
    public void testSystemPropertyOverrides() {
        System.setProperty(Settings.KEY_TICK_INTERVAL, "500");
        System.setProperty(Settings.KEY_SEED, "7");

        Settings s = Settings.load();

        assertEquals(500, s.tickIntervalMs);
        assertEquals(Long.valueOf(7), s.seed);
    }
}
