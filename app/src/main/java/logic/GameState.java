package logic;

import java.awt.Color;
import blocks.Block;

/**
 * GameState
 * -----------------------
 * - 보드, 현재 블록, 좌표, 점수, 일시정지/게임오버 플래그
 * - BoardLogic만 소유하며 외부에 그대로 노출하지 않는다
 */
public class GameState {
    public static final int HEIGHT = 20;
    public static final int WIDTH = 10;

    // 스폰 위치: x = floor(width / 2) - 1, y = 0
    public static final int SPAWN_X = WIDTH / 2 - 1;
    public static final int SPAWN_Y = 0;

    // === 핵심 필드 ===
    // null = 빈 칸, 그 외 = 고정된 블록 색
    private final Color[][] board = new Color[HEIGHT][WIDTH];

    private Block curr;     // 현재 블록 (첫 스폰 전에는 null)
    private boolean gameOver = false;
    private boolean paused = false;
    private int score = 0;
    private int linesCleared = 0;

    private int x = SPAWN_X, y = SPAWN_Y;

    // === Getter / Setter ===
    Color[][] getBoard() { return board; }

    public Block getCurr() { return curr; }
    void setCurr(Block b) { this.curr = b; }

    public boolean isGameOver() { return gameOver; }
    void setGameOver(boolean value) { this.gameOver = value; }

    public boolean isPaused() { return paused; }
    void setPaused(boolean value) { this.paused = value; }

    public int getScore() { return score; }
    void addScore(int delta) { this.score += delta; }

    public int getLinesCleared() { return linesCleared; }
    void addLinesCleared(int lines) { this.linesCleared += lines; }

    public int getX() { return x; }
    public int getY() { return y; }
    void setPosition(int x, int y) { this.x = x; this.y = y; }

    /**
     * 상태 전체 초기화
     */
    void reset() {
        curr = null;
        gameOver = false;
        paused = false;
        score = 0;
        linesCleared = 0;

        x = SPAWN_X;
        y = SPAWN_Y;

        for (int yy = 0; yy < HEIGHT; yy++) {
            for (int xx = 0; xx < WIDTH; xx++) {
                board[yy][xx] = null;
            }
        }
    }
}
