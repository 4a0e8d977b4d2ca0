package io.github.yok.danp.core.error;

import lombok.Getter;

/**
 * 次元グルーピングに指標を 1 つも持たない次元が含まれる場合の例外です（設定の誤り）。
 */
@Getter
public final class EmptyGroupException extends DanpAnalysisException {

    private static final long serialVersionUID = 1L;

    /**
     * 空だった次元の名前です。
     */
    private final String dimension;

    /**
     * 例外を生成します。
     *
     * @param dimension 空だった次元の名前です
     */
    public EmptyGroupException(String dimension) {
        super("EMPTY_GROUP", "次元に指標が 1 つもありません: " + dimension);
        this.dimension = dimension;
    }

    @Override
    public boolean isUserCorrectable() {
        return false;
    }
}
