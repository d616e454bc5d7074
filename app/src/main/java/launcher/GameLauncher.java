package launcher;

import javax.swing.SwingUtilities;

import component.GameFrame;
import component.config.Settings;

public class GameLauncher {

    public static void main(String[] args) {
        Settings settings = Settings.load();
        System.out.println("[GameLauncher] " + settings);

        SwingUtilities.invokeLater(() -> new GameFrame(settings).start());
    }
}
