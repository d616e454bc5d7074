package logic;

import java.awt.Color;

import blocks.Block;

/**
 * 충돌 판정과 이동 프리미티브.
 * 이동 가능 여부를 먼저 canMove()로 확인한 뒤 moveXxx()를 호출한다.
 */
public class MovementService {

    private final GameState state;

    public MovementService(GameState state) {
        this.state = state;
    }

    /**
     * 블록을 (px, py)에 놓았을 때 충돌하는지.
     * 좌우 벽, 바닥, 고정된 칸과 겹치면 true.
     * y < 0 (보드 위쪽) 칸은 좌우 벽 검사만 받는다.
     */
    public static boolean collides(Block block, int px, int py, Color[][] board) {
        int height = board.length;
        int width = board[0].length;

        for (int by = 0; by < block.height(); by++) {
            for (int bx = 0; bx < block.width(); bx++) {
                if (block.getShape(bx, by) != 1)
                    continue;

                int x = px + bx;
                int y = py + by;

                if (x < 0 || x >= width || y >= height)
                    return true;
                if (y >= 0 && board[y][x] != null)
                    return true;
            }
        }
        return false;
    }

    public boolean canMove(Block block, int x, int y) {
        return !collides(block, x, y, state.getBoard());
    }

    public void moveLeft() {
        state.setPosition(state.getX() - 1, state.getY());
    }

    public void moveRight() {
        state.setPosition(state.getX() + 1, state.getY());
    }

    public void moveDown() {
        state.setPosition(state.getX(), state.getY() + 1);
    }
}
