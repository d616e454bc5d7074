package logic;

import java.awt.Color;

/**
 * 한 시점의 화면용 상태 (불변).
 * cells 는 고정된 칸 위에 현재 블록(y >= 0 부분)을 겹친 결과.
 */
public final class BoardSnapshot {

    private final Color[][] cells;
    private final int score;
    private final GameStatus status;
    private final boolean hasPiece;
    private final int pieceX;
    private final int pieceY;

    public BoardSnapshot(Color[][] cells, int score, GameStatus status,
                         boolean hasPiece, int pieceX, int pieceY) {
        this.cells = copyOf(cells);
        this.score = score;
        this.status = status;
        this.hasPiece = hasPiece;
        this.pieceX = pieceX;
        this.pieceY = pieceY;
    }

    public Color[][] getCells() { return copyOf(cells); }
    public Color getCell(int x, int y) { return cells[y][x]; }
    public int getWidth() { return cells[0].length; }
    public int getHeight() { return cells.length; }

    public int getScore() { return score; }
    public GameStatus getStatus() { return status; }
    public boolean isGameOver() { return status == GameStatus.GAME_OVER; }
    public boolean isPaused() { return status == GameStatus.PAUSED; }

    public boolean hasPiece() { return hasPiece; }
    public int getPieceX() { return pieceX; }
    public int getPieceY() { return pieceY; }

    public boolean isEmpty() {
        for (Color[] row : cells)
            for (Color c : row)
                if (c != null)
                    return false;
        return true;
    }

    private static Color[][] copyOf(Color[][] src) {
        Color[][] dst = new Color[src.length][];
        for (int y = 0; y < src.length; y++) {
            dst[y] = src[y].clone();
        }
        return dst;
    }

    @Override
    public String toString() {
        return "BoardSnapshot{score=" + score + ", status=" + status
                + ", piece=" + (hasPiece ? "(" + pieceX + "," + pieceY + ")" : "none") + "}";
    }
}
