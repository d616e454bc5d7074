package logic;

/** Running ⇄ Paused, Running → GameOver (reset 으로만 복귀) */
public enum GameStatus {
    RUNNING,
    PAUSED,
    GAME_OVER;

    static GameStatus of(boolean gameOver, boolean paused) {
        if (gameOver) return GAME_OVER;
        return paused ? PAUSED : RUNNING;
    }
}
