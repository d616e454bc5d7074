package logic;

/**
 * 엔진에 들어가는 명령. 타이머(TICK)와 키 입력(나머지)이 같은 큐로 들어온다.
 * DOWN 은 TICK 과 같은 동작이다.
 */
public enum GameCommand {
    TICK,
    LEFT,
    RIGHT,
    DOWN,
    ROTATE,
    PAUSE,
    RESET
}
