package logic;

import java.util.Objects;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * CommandQueue
 * -----------------------
 * - submit(): 어느 스레드에서든 호출 가능 (타이머, 키 입력)
 * - drain(): 엔진 소유자 한 곳에서만 호출, 들어온 순서대로 적용
 * - 두 drain()이 동시에 돌지 않으므로 BoardLogic에는 항상 한 명의 writer만 존재
 */
public class CommandQueue {

    private final BoardLogic logic;
    private final Queue<GameCommand> pending = new ConcurrentLinkedQueue<>();

    public CommandQueue(BoardLogic logic) {
        this.logic = Objects.requireNonNull(logic, "logic");
    }

    public void submit(GameCommand command) {
        if (command == null) {
            throw new IllegalArgumentException("command must not be null");
        }
        pending.add(command);
    }

    /**
     * 대기 중인 명령을 모두 적용한다.
     * @return 적용한 명령 수
     */
    public synchronized int drain() {
        int applied = 0;
        GameCommand command;
        while ((command = pending.poll()) != null) {
            apply(command);
            applied++;
        }
        return applied;
    }

    private void apply(GameCommand command) {
        switch (command) {
            case TICK, DOWN -> logic.tick();
            case LEFT -> logic.moveLeft();
            case RIGHT -> logic.moveRight();
            case ROTATE -> logic.rotateBlock();
            case PAUSE -> logic.togglePause();
            case RESET -> logic.reset();
        }
    }

    public int pendingCount() {
        return pending.size();
    }

    public void clear() {
        pending.clear();
    }

    public BoardLogic getLogic() {
        return logic;
    }
}
