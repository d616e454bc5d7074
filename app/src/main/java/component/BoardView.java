package component;

import logic.BoardLogic;
import logic.BoardSnapshot;

import javax.swing.*;
import java.awt.*;

/**
 * 엔진 snapshot()을 그대로 그리는 보드 뷰.
 * 게임 상태는 읽기만 한다.
 */
public class BoardView extends JPanel {
    private final BoardLogic logic;

    static final int CELL_SIZE = 25;
    private static final int HUD_HEIGHT = 40;
    public static final int WIDTH = BoardLogic.WIDTH;
    public static final int HEIGHT = BoardLogic.HEIGHT;

    private static final Color BG_GAME = new Color(25, 30, 42);
    private static final Color EMPTY_TILE = new Color(40, 42, 52);
    private static final Color OVERLAY = new Color(0, 0, 0, 190);

    public BoardView(BoardLogic logic) {
        this.logic = logic;
        setBackground(BG_GAME);
        setFocusable(true);
    }

    @Override
    public Dimension getPreferredSize() {
        return new Dimension(WIDTH * CELL_SIZE, HEIGHT * CELL_SIZE + HUD_HEIGHT);
    }

    @Override
    protected void paintComponent(Graphics g) {
        super.paintComponent(g);
        Graphics2D g2 = (Graphics2D) g.create();
        g2.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);

        BoardSnapshot snap = logic.snapshot();

        // === 점수 ===
        g2.setColor(Color.WHITE);
        g2.setFont(new Font("SansSerif", Font.BOLD, 20));
        g2.drawString("Score: " + snap.getScore(), 10, HUD_HEIGHT - 12);

        // === 보드 ===
        int top = HUD_HEIGHT;
        for (int y = 0; y < snap.getHeight(); y++) {
            for (int x = 0; x < snap.getWidth(); x++) {
                Color c = snap.getCell(x, y);
                int px = x * CELL_SIZE;
                int py = top + y * CELL_SIZE;

                g2.setColor(c != null ? c : EMPTY_TILE);
                g2.fillRect(px + 1, py + 1, CELL_SIZE - 2, CELL_SIZE - 2);
                if (c != null) {
                    g2.setColor(c.brighter());
                    g2.drawRect(px + 1, py + 1, CELL_SIZE - 3, CELL_SIZE - 3);
                }
            }
        }

        // === 일시정지 / 게임오버 오버레이 ===
        if (snap.isGameOver() || snap.isPaused()) {
            int w = WIDTH * CELL_SIZE;
            int h = HEIGHT * CELL_SIZE;
            g2.setColor(OVERLAY);
            g2.fillRect(0, top, w, h);

            String title = snap.isGameOver() ? "Game Over!" : "Paused";
            String hint = snap.isGameOver() ? "ENTER - Play Again" : "P - Resume";

            g2.setColor(Color.WHITE);
            g2.setFont(new Font("SansSerif", Font.BOLD, 26));
            drawCentered(g2, title, w, top + h / 2 - 10);
            g2.setFont(new Font("SansSerif", Font.PLAIN, 14));
            drawCentered(g2, hint, w, top + h / 2 + 20);
        }

        g2.dispose();
    }

    private void drawCentered(Graphics2D g2, String text, int width, int baseline) {
        FontMetrics fm = g2.getFontMetrics();
        g2.drawString(text, (width - fm.stringWidth(text)) / 2, baseline);
    }
}
