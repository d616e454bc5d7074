package logic;

import java.awt.Color;
import java.util.Objects;
import java.util.function.Consumer;

import blocks.Block;
import component.PieceCatalogue;

/**
 * BoardLogic
 * -----------------------
 * - 엔진의 명령/조회 창구 (tick, moveLeft/Right, rotateBlock, togglePause, reset)
 * - 모든 명령은 동기적으로 끝까지 실행되며, 실패는 예외가 아니라 "아무 일도 안 함"
 * - 호출은 한 스레드에서만 (CommandQueue 참고)
 */
public class BoardLogic {
    public static final int WIDTH = GameState.WIDTH;
    public static final int HEIGHT = GameState.HEIGHT;
    public static final int SCORE_PER_LINE = 100;

    private final GameState state = new GameState();
    private final PieceCatalogue catalogue;
    private final MovementService move = new MovementService(state);
    private final ClearService clear = new ClearService(state);

    private final Consumer<Integer> onGameOver;
    private Runnable onFrameUpdate;
    private java.util.function.IntConsumer onLineCleared;

    public BoardLogic() {
        this(score -> {}, new PieceCatalogue());
    }

    public BoardLogic(PieceCatalogue catalogue) {
        this(score -> {}, catalogue);
    }

    public BoardLogic(Consumer<Integer> onGameOver, PieceCatalogue catalogue) {
        this.onGameOver = onGameOver;
        this.catalogue = Objects.requireNonNull(catalogue, "catalogue");
    }

    // ============================================
    // tick - 중력 한 칸, 못 내려가면 고정 → 줄 삭제 → 점수 → 스폰
    // ============================================
    public void tick() {
        if (state.isGameOver() || state.isPaused())
            return;

        // 첫 스폰 (생성 직후 / reset 직후)
        if (state.getCurr() == null) {
            spawnNext();
            fireFrameUpdate();
            return;
        }

        if (move.canMove(state.getCurr(), state.getX(), state.getY() + 1)) {
            move.moveDown();
        } else {
            fixBlock();
        }
        fireFrameUpdate();
    }

    /** 아래 키. tick()과 동일 */
    public void moveDown() {
        tick();
    }

    private void fixBlock() {
        Block b = state.getCurr();
        clear.lockPiece(b, state.getX(), state.getY());
        state.setCurr(null);

        int lines = clear.clearLines();
        if (lines > 0) {
            state.addLinesCleared(lines);
            state.addScore(lines * SCORE_PER_LINE);
            System.out.println("[BoardLogic] Cleared " + lines + " line(s) " + clear.getLastClearedRows()
                    + " → score " + state.getScore());
            if (onLineCleared != null)
                onLineCleared.accept(lines);
        }

        spawnNext();
    }

    private void spawnNext() {
        Block next = catalogue.randomPiece();

        if (!move.canMove(next, GameState.SPAWN_X, GameState.SPAWN_Y)) {
            gameOver();
            return;
        }

        state.setCurr(next);
        state.setPosition(GameState.SPAWN_X, GameState.SPAWN_Y);
    }

    private void gameOver() {
        if (state.isGameOver())
            return;
        state.setGameOver(true);
        System.out.println("[BoardLogic] GAME OVER - score " + state.getScore()
                + ", lines " + state.getLinesCleared());

        if (onGameOver != null)
            onGameOver.accept(state.getScore());
    }

    // === 이동 입력 ===
    public void moveHorizontal(int direction) {
        if (direction != -1 && direction != 1)
            throw new IllegalArgumentException("direction must be -1 or +1: " + direction);
        if (!acceptsInput())
            return;

        if (move.canMove(state.getCurr(), state.getX() + direction, state.getY())) {
            if (direction < 0)
                move.moveLeft();
            else
                move.moveRight();
            fireFrameUpdate();
        }
    }

    public void moveLeft() {
        moveHorizontal(-1);
    }

    public void moveRight() {
        moveHorizontal(1);
    }

    /** 벽 차기 없음: 회전 결과가 현재 위치에서 충돌하면 그대로 둔다 */
    public void rotateBlock() {
        if (!acceptsInput())
            return;

        Block rotated = state.getCurr().rotated();
        if (move.canMove(rotated, state.getX(), state.getY())) {
            state.setCurr(rotated);
            fireFrameUpdate();
        }
    }

    private boolean acceptsInput() {
        return state.getCurr() != null && !state.isGameOver() && !state.isPaused();
    }

    // === 일시정지 / 리셋 ===
    public void togglePause() {
        if (state.isGameOver())
            return;
        state.setPaused(!state.isPaused());
        System.out.println("[BoardLogic] " + (state.isPaused() ? "Paused" : "Resumed"));
        fireFrameUpdate();
    }

    public void reset() {
        state.reset();
        System.out.println("[BoardLogic] Reset complete.");
        fireFrameUpdate();
    }

    // === 조회 ===

    /**
     * 고정된 보드 위에 현재 블록을 겹친 복사본. 엔진 상태는 바꾸지 않는다.
     */
    public Color[][] getRenderableBoard() {
        Color[][] board = state.getBoard();
        Color[][] display = new Color[HEIGHT][];
        for (int y = 0; y < HEIGHT; y++) {
            display[y] = board[y].clone();
        }

        Block curr = state.getCurr();
        if (curr != null) {
            for (int j = 0; j < curr.height(); j++) {
                for (int i = 0; i < curr.width(); i++) {
                    if (curr.getShape(i, j) != 1)
                        continue;
                    int x = state.getX() + i;
                    int y = state.getY() + j;
                    if (y >= 0 && y < HEIGHT && x >= 0 && x < WIDTH)
                        display[y][x] = curr.getColor();
                }
            }
        }
        return display;
    }

    public BoardSnapshot snapshot() {
        return new BoardSnapshot(getRenderableBoard(), state.getScore(), getStatus(),
                state.getCurr() != null, state.getX(), state.getY());
    }

    public int getScore() {
        return state.getScore();
    }

    public int getLinesCleared() {
        return state.getLinesCleared();
    }

    public boolean isGameOver() {
        return state.isGameOver();
    }

    public boolean isPaused() {
        return state.isPaused();
    }

    public GameStatus getStatus() {
        return GameStatus.of(state.isGameOver(), state.isPaused());
    }

    /** 현재 블록 복사본 (없으면 null) */
    public Block getCurr() {
        Block curr = state.getCurr();
        return curr == null ? null : curr.clone();
    }

    public int getX() {
        return state.getX();
    }

    public int getY() {
        return state.getY();
    }

    public void setOnFrameUpdate(Runnable r) {
        this.onFrameUpdate = r;
    }

    public void setOnLineCleared(java.util.function.IntConsumer c) {
        this.onLineCleared = c;
    }

    // 같은 패키지(테스트 포함)에서만 내부 상태 접근
    GameState getState() {
        return state;
    }

    ClearService getClearService() {
        return clear;
    }

    private void fireFrameUpdate() {
        if (onFrameUpdate != null)
            onFrameUpdate.run();
    }
}
