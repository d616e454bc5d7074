package component;

import javax.swing.SwingUtilities;
import javax.swing.Timer;

import logic.CommandQueue;
import logic.GameCommand;

/**
 * GameLoop (Swing Timer 버전)
 * - 일정 간격마다 TICK 을 큐에 넣고 EDT에서 바로 drain
 * - 일시정지는 엔진이 처리 (paused 상태의 TICK 은 무시됨)
 * - 게임 오버가 되면 스스로 멈춘다
 */
public class GameLoop {
    public static final int DEFAULT_INTERVAL_MS = 1000;

    private final CommandQueue queue;
    private final Runnable repaint;
    private final Timer timer;

    private volatile boolean running = false;

    public GameLoop(CommandQueue queue, Runnable repaint) {
        this(queue, repaint, DEFAULT_INTERVAL_MS);
    }

    public GameLoop(CommandQueue queue, Runnable repaint, int intervalMs) {
        this.queue = queue;
        this.repaint = (repaint != null) ? repaint : () -> {};

        this.timer = new Timer(Math.max(1, intervalMs), e -> {
            queue.submit(GameCommand.TICK);
            queue.drain();

            if (queue.getLogic().isGameOver()) {
                stop();
            }
            // 그리기는 EDT에서
            SwingUtilities.invokeLater(this.repaint);
        });
        this.timer.setRepeats(true);
    }

    /* ===== 메인 제어 ===== */
    public synchronized void start() {
        if (running) return;
        running = true;
        timer.start();
        System.out.println("[GameLoop] started (" + timer.getDelay() + "ms)");
    }

    public synchronized void stop() {
        if (!running) return;
        running = false;
        timer.stop();
        System.out.println("[GameLoop] stopped");
    }

    /* ===== 유틸 ===== */
    public void setInterval(int ms) { timer.setDelay(Math.max(1, ms)); }
    public int getInterval() { return timer.getDelay(); }
    public boolean isRunning() { return running; }
}
