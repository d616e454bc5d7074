package blocks;

import java.awt.Color;

/**
 * 7가지 고정 템플릿 (I, J, L, O, S, T, Z).
 * 템플릿 배열은 외부로 나가지 않고, newBlock()이 항상 복사본을 만든다.
 */
public enum PieceType {
    I(new Color(0x06, 0xB6, 0xD4), new int[][] {
            { 1, 1, 1, 1 }
    }),
    J(new Color(0x3B, 0x82, 0xF6), new int[][] {
            { 1, 0, 0 },
            { 1, 1, 1 }
    }),
    L(new Color(0xF9, 0x73, 0x16), new int[][] {
            { 0, 0, 1 },
            { 1, 1, 1 }
    }),
    O(new Color(0xEA, 0xB3, 0x08), new int[][] {
            { 1, 1 },
            { 1, 1 }
    }),
    S(new Color(0x22, 0xC5, 0x5E), new int[][] {
            { 0, 1, 1 },
            { 1, 1, 0 }
    }),
    T(new Color(0xA8, 0x55, 0xF7), new int[][] {
            { 0, 1, 0 },
            { 1, 1, 1 }
    }),
    Z(new Color(0xEF, 0x44, 0x44), new int[][] {
            { 1, 1, 0 },
            { 0, 1, 1 }
    });

    private final Color color;
    private final int[][] template;

    PieceType(Color color, int[][] template) {
        this.color = color;
        this.template = template;
    }

    public Color getColor() { return color; }

    /** 템플릿의 독립 복사본으로 새 조각 생성 */
    public Block newBlock() {
        return new Block(color, template);
    }
}
