package io.github.yok.danp.core.error;

/**
 * 直接影響行列を正規化できない（影響関係が 1 つも入力されていない）場合の例外です。
 */
public final class DegenerateMatrixException extends DanpAnalysisException {

    private static final long serialVersionUID = 1L;

    /**
     * 例外を生成します。
     *
     * @param message 詳細メッセージです
     */
    public DegenerateMatrixException(String message) {
        super("DEGENERATE_MATRIX", message);
    }

    @Override
    public boolean isUserCorrectable() {
        return true;
    }
}
