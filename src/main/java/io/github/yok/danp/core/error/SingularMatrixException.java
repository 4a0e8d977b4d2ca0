package io.github.yok.danp.core.error;

/**
 * 総影響行列の連立方程式 {@code (I - D) T = D} が解けない場合の例外です。
 *
 * <p>
 * {@code (I - D)} が特異または特異に近い場合、あるいは解の残差が許容値を超えた場合に発生します。 正規化済みの入力では通常起こらない内部的な数値異常として扱います。
 * </p>
 */
public final class SingularMatrixException extends DanpAnalysisException {

    private static final long serialVersionUID = 1L;

    /**
     * 例外を生成します。
     *
     * @param message 詳細メッセージです
     */
    public SingularMatrixException(String message) {
        super("SINGULAR_MATRIX", message);
    }

    @Override
    public boolean isUserCorrectable() {
        return false;
    }
}
