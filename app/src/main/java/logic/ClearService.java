package logic;

import java.awt.Color;
import java.util.ArrayList;
import java.util.List;

import blocks.Block;

/**
 * 블록 고정(lock)과 줄 삭제.
 * 꽉 찬 줄을 먼저 모두 찾은 다음 한 번에 압축한다.
 */
public class ClearService {

    private final GameState state;
    private List<Integer> lastClearedRows = new ArrayList<>();

    public ClearService(GameState state) {
        this.state = state;
    }

    /**
     * 현재 블록을 보드에 기록한다. y < 0 인 칸은 버린다.
     */
    public void lockPiece(Block block, int px, int py) {
        Color[][] board = state.getBoard();

        for (int by = 0; by < block.height(); by++) {
            for (int bx = 0; bx < block.width(); bx++) {
                if (block.getShape(bx, by) != 1)
                    continue;

                int x = px + bx;
                int y = py + by;
                if (y < 0)
                    continue;

                board[y][x] = block.getColor();
            }
        }
    }

    /**
     * 꽉 찬 줄을 모두 지우고 그만큼 맨 위에 빈 줄을 넣는다.
     * @return 지운 줄 수
     */
    public int clearLines() {
        List<Integer> fullRows = findFullRows();
        lastClearedRows = fullRows;

        if (fullRows.isEmpty())
            return 0;

        compressBoardByRows();
        return fullRows.size();
    }

    // ============================================
    // 줄 단위 압축: 아래에서 위로 읽으면서 꽉 찬 줄은 건너뛴다
    // ============================================
    private void compressBoardByRows() {
        Color[][] board = state.getBoard();

        Color[][] temp = new Color[GameState.HEIGHT][];
        int writeRow = GameState.HEIGHT - 1;

        for (int readRow = GameState.HEIGHT - 1; readRow >= 0; readRow--) {
            if (!isRowFull(board[readRow])) {
                temp[writeRow--] = board[readRow];
            }
        }

        // 위쪽 빈 줄
        for (int y = writeRow; y >= 0; y--) {
            temp[y] = new Color[GameState.WIDTH];
        }

        for (int y = 0; y < GameState.HEIGHT; y++) {
            board[y] = temp[y];
        }
    }

    public List<Integer> findFullRows() {
        Color[][] board = state.getBoard();
        List<Integer> fullRows = new ArrayList<>();

        for (int y = GameState.HEIGHT - 1; y >= 0; y--) {
            if (isRowFull(board[y]))
                fullRows.add(y);
        }
        return fullRows;
    }

    public int countFullLines() {
        return findFullRows().size();
    }

    private boolean isRowFull(Color[] row) {
        for (Color c : row)
            if (c == null)
                return false;
        return true;
    }

    /** 직전 clearLines()에서 지운 줄 (아래 → 위, 삭제 전 인덱스) */
    public List<Integer> getLastClearedRows() {
        return lastClearedRows;
    }
}
