package component.board;

import blocks.PieceType;
import component.PieceCatalogue;
import logic.BoardLogic;
import logic.CommandQueue;
import logic.GameCommand;
import org.junit.Before;
import org.junit.Test;

import javax.swing.*;
import java.awt.event.KeyEvent;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.Assert.*;

public class KeyBindingInstallerTest {

    private BoardLogic logic;
    private CommandQueue queue;
    private JPanel panel;
    private AtomicInteger draws;
    private AtomicInteger restarts;

    @Before
    public void setup() {
        logic = new BoardLogic(PieceCatalogue.scripted(PieceType.O));
        queue = new CommandQueue(logic);
        queue.submit(GameCommand.TICK);
        queue.drain();
        panel = new JPanel();
        draws = new AtomicInteger();
        restarts = new AtomicInteger();
    }

    private KeyBindingInstaller.Deps deps() {
        return new KeyBindingInstaller.Deps(queue, draws::incrementAndGet, restarts::incrementAndGet);
    }

    private void press(String keyStroke) {
        InputMap im = panel.getInputMap(JComponent.WHEN_IN_FOCUSED_WINDOW);
        Object name = im.get(KeyStroke.getKeyStroke(keyStroke));
        assertNotNull("unbound " + keyStroke, name);
        panel.getActionMap().get(name).actionPerformed(null);
    }

    @Test
    public void testArrowKeys() {
        new KeyBindingInstaller().install(panel, deps(), KeyBindingInstaller.KeySet.ARROWS);

        press("LEFT");
        press("LEFT");
        press("DOWN");
        press("RIGHT");
        press("UP");

        assertEquals(3, logic.getX());
        assertEquals(1, logic.getY());
        assertEquals(5, draws.get());
    }

    @Test
    public void testPauseKey() {
        new KeyBindingInstaller().install(panel, deps(), KeyBindingInstaller.KeySet.ARROWS);

        press("P");
        assertTrue(logic.isPaused());
        press("LEFT");
        assertEquals(4, logic.getX());
        press("P");
        assertFalse(logic.isPaused());
    }

    @Test
    public void testWasdKeys() {
        new KeyBindingInstaller().install(panel, deps(), KeyBindingInstaller.KeySet.WASD);

        press("A");
        press("S");
        press("D");
        press("D");
        press("R");

        assertEquals(5, logic.getX());
        assertEquals(1, logic.getY());
        assertTrue(logic.isPaused());
        assertNull(panel.getInputMap(JComponent.WHEN_IN_FOCUSED_WINDOW).get(KeyStroke.getKeyStroke("LEFT")));
    }

    @Test
    public void testResetKeysDelegateToRestart() {
        new KeyBindingInstaller().install(panel, deps(), KeyBindingInstaller.KeySet.ARROWS);

        InputMap im = panel.getInputMap(JComponent.WHEN_IN_FOCUSED_WINDOW);
        assertEquals(KeyBindingInstaller.ACT_RESET, im.get(KeyStroke.getKeyStroke(KeyEvent.VK_F2, 0)));
        press("ENTER");

        assertEquals(1, restarts.get());
        assertEquals(1, draws.get());
    }
}
