package io.github.yok.danp.core.error;

import lombok.Getter;

/**
 * 入力（行列の形状・値、ラベル、グルーピング）が不正な場合の例外です。
 *
 * <p>
 * どの項目が不正かを {@link #getField()} で返します（例: {@code matrix[2][3]}, {@code labels}）。
 * </p>
 */
@Getter
public final class InvalidInputException extends DanpAnalysisException {

    private static final long serialVersionUID = 1L;

    /**
     * 不正だった入力項目です。
     */
    private final String field;

    /**
     * 例外を生成します。
     *
     * @param field 不正だった入力項目です
     * @param message 詳細メッセージです
     */
    public InvalidInputException(String field, String message) {
        super("VALIDATION", field + ": " + message);
        this.field = field;
    }

    /**
     * 例外を生成します。
     *
     * @param field 不正だった入力項目です
     * @param message 詳細メッセージです
     * @param cause 原因です
     */
    public InvalidInputException(String field, String message, Throwable cause) {
        super("VALIDATION", field + ": " + message, cause);
        this.field = field;
    }

    @Override
    public boolean isUserCorrectable() {
        return true;
    }
}
