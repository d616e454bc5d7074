package blocks;

import java.awt.Color;

/**
 * Block
 * -----------------------
 * - 현재 떨어지고 있는 조각 (템플릿의 복사본 + 색)
 * - shape[row][col] == 1 이면 채워진 칸
 * - 회전은 새 Block을 돌려주며 자신은 바꾸지 않음
 */
public class Block implements Cloneable {

    protected final Color color;
    protected int[][] shape;

    public Block(Color color, int[][] shape) {
        if (shape == null || shape.length == 0 || shape[0].length == 0) {
            throw new IllegalArgumentException("shape must have at least one row and one column");
        }
        int w = shape[0].length;
        for (int[] row : shape) {
            if (row.length != w) {
                throw new IllegalArgumentException("shape must be rectangular");
            }
        }
        this.color = color;
        this.shape = copyOf(shape);
    }

    public Color getColor() { return color; }

    /** (x, y) 칸 값. x = 열, y = 행 */
    public int getShape(int x, int y) {
        return shape[y][x];
    }

    public boolean isFilled(int x, int y) {
        return shape[y][x] == 1;
    }

    public int[][] getShapeArray() {
        return copyOf(shape);
    }

    public int width() { return shape[0].length; }
    public int height() { return shape.length; }

    /**
     * 시계 방향 90도 회전: 전치 후 각 행을 뒤집는다.
     * rotated[r][c] = shape[h - 1 - c][r]
     */
    public Block rotated() {
        int h = height();
        int w = width();
        int[][] next = new int[w][h];
        for (int r = 0; r < w; r++) {
            for (int c = 0; c < h; c++) {
                next[r][c] = shape[h - 1 - c][r];
            }
        }
        return new Block(color, next);
    }

    @Override
    public Block clone() {
        try {
            Block b = (Block) super.clone();
            b.shape = copyOf(shape);
            return b;
        } catch (CloneNotSupportedException e) {
            throw new AssertionError(e);
        }
    }

    /** 같은 모양 + 같은 색인지 */
    public boolean sameShapeAs(Block other) {
        if (other == null || other.height() != height() || other.width() != width()) {
            return false;
        }
        for (int y = 0; y < height(); y++) {
            for (int x = 0; x < width(); x++) {
                if (shape[y][x] != other.shape[y][x]) return false;
            }
        }
        return true;
    }

    private static int[][] copyOf(int[][] src) {
        int[][] dst = new int[src.length][];
        for (int i = 0; i < src.length; i++) {
            dst[i] = src[i].clone();
        }
        return dst;
    }

    @Override
    public String toString() {
        return "Block{" + width() + "x" + height() + ", color=" + color + "}";
    }
}
