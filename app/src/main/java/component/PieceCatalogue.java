package component;

import java.util.Objects;
import java.util.Random;
import java.util.function.Supplier;

import blocks.Block;
import blocks.PieceType;

/**
 * 7가지 템플릿 중 하나를 균등 확률로 골라 복사본을 돌려준다.
 */
public class PieceCatalogue {

    private static final PieceType[] TYPES = PieceType.values();

    private final Supplier<PieceType> picker;

    public PieceCatalogue() {
        this(new Random());
    }

    public PieceCatalogue(Random random) {
        Objects.requireNonNull(random, "random");
        this.picker = () -> TYPES[random.nextInt(TYPES.length)];
    }

    private PieceCatalogue(Supplier<PieceType> picker) {
        this.picker = picker;
    }

    /** 주어진 순서를 반복해서 내보내는 카탈로그 (테스트/재현용) */
    public static PieceCatalogue scripted(PieceType... sequence) {
        if (sequence == null || sequence.length == 0)
            throw new IllegalArgumentException("sequence must not be empty");
        PieceType[] order = sequence.clone();
        int[] cursor = { 0 };
        return new PieceCatalogue(() -> {
            PieceType t = order[cursor[0]];
            cursor[0] = (cursor[0] + 1) % order.length;
            return t;
        });
    }

    public Block randomPiece() {
        return picker.get().newBlock();
    }

    public Block template(PieceType type) {
        return type.newBlock();
    }
}
