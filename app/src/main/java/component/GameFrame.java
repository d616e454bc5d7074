package component;

import java.util.Random;

import javax.swing.JFrame;
import javax.swing.SwingUtilities;
import javax.swing.WindowConstants;

import component.board.KeyBindingInstaller;
import component.config.Settings;
import logic.BoardLogic;
import logic.CommandQueue;
import logic.GameCommand;

/**
 * 게임 창: 엔진 하나, 명령 큐 하나, 루프와 뷰를 묶는다.
 * 타이머와 키 입력 모두 EDT에서 같은 큐로 들어간다.
 */
public class GameFrame extends JFrame {

    private final BoardLogic logic;
    private final CommandQueue queue;
    private final BoardView view;
    private final GameLoop loop;

    public GameFrame(Settings settings) {
        super("TETRIS");

        PieceCatalogue catalogue = (settings.seed != null)
                ? new PieceCatalogue(new Random(settings.seed))
                : new PieceCatalogue();

        this.logic = new BoardLogic(this::onGameOver, catalogue);
        this.queue = new CommandQueue(logic);
        this.view = new BoardView(logic);
        this.loop = new GameLoop(queue, view::repaint, settings.tickIntervalMs);

        new KeyBindingInstaller().install(view,
                new KeyBindingInstaller.Deps(queue, view::repaint, this::restart),
                settings.keySet);

        setDefaultCloseOperation(WindowConstants.DISPOSE_ON_CLOSE);
        add(view);
        pack();
        setResizable(false);
        setLocationRelativeTo(null);
    }

    /** 창 띄우고 첫 블록 스폰 */
    public void start() {
        setVisible(true);
        view.requestFocusInWindow();
        queue.submit(GameCommand.TICK);
        queue.drain();
        loop.start();
    }

    /** 어떤 상태에서든 처음부터 */
    public void restart() {
        setTitle("TETRIS");
        queue.clear();
        queue.submit(GameCommand.RESET);
        queue.submit(GameCommand.TICK);
        queue.drain();
        loop.start();
        view.repaint();
    }

    private void onGameOver(int score) {
        loop.stop();
        System.out.println("[GameFrame] final state " + SnapshotJson.toJson(logic.snapshot()));
        setTitle("TETRIS - GAME OVER (" + score + ")");
        SwingUtilities.invokeLater(view::repaint);
    }

    @Override
    public void dispose() {
        loop.stop();
        super.dispose();
    }
}
