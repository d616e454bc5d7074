package component.config;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

import component.GameLoop;
import component.board.KeyBindingInstaller.KeySet;

/**
 * Settings
 * -----------------------
 * - classpath의 tetris.properties → JVM 시스템 프로퍼티 순서로 덮어씀
 * - 잘못된 값은 경고만 찍고 기본값 사용
 */
public class Settings {

    public static final String RESOURCE = "tetris.properties";
    public static final String KEY_TICK_INTERVAL = "tetris.tickIntervalMs";
    public static final String KEY_KEY_SET = "tetris.keySet";
    public static final String KEY_SEED = "tetris.seed";

    public int tickIntervalMs = GameLoop.DEFAULT_INTERVAL_MS;
    public KeySet keySet = KeySet.ARROWS;
    public Long seed = null; // null = 매번 다른 Random

    public static Settings load() {
        Properties props = new Properties();
        try (InputStream in = Settings.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in != null) {
                props.load(in);
                System.out.println("[Settings] loaded " + RESOURCE);
            } else {
                System.out.println("[Settings] " + RESOURCE + " not found, using defaults");
            }
        } catch (IOException e) {
            System.out.println("[Settings] failed to read " + RESOURCE + ": " + e.getMessage());
        }

        for (String key : new String[] { KEY_TICK_INTERVAL, KEY_KEY_SET, KEY_SEED }) {
            String override = System.getProperty(key);
            if (override != null)
                props.setProperty(key, override);
        }
        return from(props);
    }

    public static Settings from(Properties props) {
        Settings s = new Settings();

        String interval = trimmed(props.getProperty(KEY_TICK_INTERVAL));
        if (interval != null) {
            try {
                int v = Integer.parseInt(interval);
                if (v >= 1)
                    s.tickIntervalMs = v;
                else
                    warn(KEY_TICK_INTERVAL, interval);
            } catch (NumberFormatException e) {
                warn(KEY_TICK_INTERVAL, interval);
            }
        }

        String keySet = trimmed(props.getProperty(KEY_KEY_SET));
        if (keySet != null) {
            try {
                s.keySet = KeySet.valueOf(keySet.toUpperCase());
            } catch (IllegalArgumentException e) {
                warn(KEY_KEY_SET, keySet);
            }
        }

        String seed = trimmed(props.getProperty(KEY_SEED));
        if (seed != null) {
            try {
                s.seed = Long.parseLong(seed);
            } catch (NumberFormatException e) {
                warn(KEY_SEED, seed);
            }
        }
        return s;
    }

    private static String trimmed(String v) {
        if (v == null) return null;
        v = v.trim();
        return v.isEmpty() ? null : v;
    }

    private static void warn(String key, String value) {
        System.out.println("[Settings] invalid " + key + "='" + value + "', using default");
    }

    @Override
    public String toString() {
        return "Settings{tick=" + tickIntervalMs + "ms, keys=" + keySet + ", seed=" + seed + "}";
    }
}
