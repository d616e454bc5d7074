package component.board;

import logic.CommandQueue;
import logic.GameCommand;

import javax.swing.*;
import java.awt.event.ActionEvent;
import java.awt.event.KeyEvent;

/**
 * 키 바인딩 전담 설치기.
 * 키 입력은 명령으로 바꿔 큐에 넣고, 같은 EDT에서 바로 drain 한다.
 */
public class KeyBindingInstaller {

    /** 사용할 키셋 */
    public enum KeySet { ARROWS, WASD }

    /** 보드 쪽에서 제공해야 하는 의존성 */
    public static class Deps {
        public final CommandQueue queue;
        public final Runnable drawBoard;
        public final Runnable restart;

        public Deps(CommandQueue queue, Runnable drawBoard, Runnable restart) {
            this.queue = queue;
            this.drawBoard = drawBoard;
            this.restart = restart;
        }
    }

    // 액션명 상수
    static final String ACT_LEFT   = "left";
    static final String ACT_RIGHT  = "right";
    static final String ACT_DOWN   = "down";
    static final String ACT_ROT    = "rotate";
    static final String ACT_PAUSE  = "pause";
    static final String ACT_RESET  = "reset";

    private void registerCoreActions(ActionMap am, Deps d) {
        am.put(ACT_LEFT,  commandAction(d, GameCommand.LEFT));
        am.put(ACT_RIGHT, commandAction(d, GameCommand.RIGHT));
        am.put(ACT_DOWN,  commandAction(d, GameCommand.DOWN));
        am.put(ACT_ROT,   commandAction(d, GameCommand.ROTATE));
        am.put(ACT_PAUSE, commandAction(d, GameCommand.PAUSE));

        // 리셋은 루프 재시작까지 필요하므로 보드 쪽에 맡긴다
        am.put(ACT_RESET, new AbstractAction() {
            public void actionPerformed(ActionEvent e) {
                d.restart.run();
                d.drawBoard.run();
            }
        });
    }

    private Action commandAction(Deps d, GameCommand command) {
        return new AbstractAction() {
            public void actionPerformed(ActionEvent e) {
                d.queue.submit(command);
                d.queue.drain();
                d.drawBoard.run();
            }
        };
    }

    /**
     * @param comp 바인딩 대상 컴포넌트(보드 뷰)
     * @param d    의존성
     * @param set  키셋 (ARROWS or WASD)
     */
    public void install(JComponent comp, Deps d, KeySet set) {
        InputMap im = comp.getInputMap(JComponent.WHEN_IN_FOCUSED_WINDOW);
        ActionMap am = comp.getActionMap();

        if (set == KeySet.ARROWS) {
            im.put(KeyStroke.getKeyStroke("LEFT"),  ACT_LEFT);
            im.put(KeyStroke.getKeyStroke("RIGHT"), ACT_RIGHT);
            im.put(KeyStroke.getKeyStroke("DOWN"),  ACT_DOWN);
            im.put(KeyStroke.getKeyStroke("UP"),    ACT_ROT);
            im.put(KeyStroke.getKeyStroke("P"),     ACT_PAUSE);
        } else { // WASD
            im.put(KeyStroke.getKeyStroke("A"), ACT_LEFT);
            im.put(KeyStroke.getKeyStroke("D"), ACT_RIGHT);
            im.put(KeyStroke.getKeyStroke("S"), ACT_DOWN);
            im.put(KeyStroke.getKeyStroke("W"), ACT_ROT);
            im.put(KeyStroke.getKeyStroke("R"), ACT_PAUSE);
        }

        im.put(KeyStroke.getKeyStroke(KeyEvent.VK_F2, 0), ACT_RESET);
        im.put(KeyStroke.getKeyStroke(KeyEvent.VK_ENTER, 0), ACT_RESET);

        registerCoreActions(am, d);
    }
}
