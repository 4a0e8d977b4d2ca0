package io.github.yok.danp.core.error;

import com.google.common.base.Preconditions;
import lombok.Getter;

/**
 * DEMATEL / DANP 解析 1 回分の失敗を表す例外の基底クラスです。
 *
 * <p>
 * メッセージには {@code [理由コード]} を前置します。 利用者が入力を直せば解消する失敗かどうかを {@link #isUserCorrectable()} で返します。
 * </p>
 */
@Getter
public abstract class DanpAnalysisException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /**
     * 失敗の理由コードです。
     */
    private final String reasonCode;

    /**
     * 理由コード付きの例外を生成します。
     *
     * @param reasonCode 理由コードです（空白不可）
     * @param message 詳細メッセージです
     */
    protected DanpAnalysisException(String reasonCode, String message) {
        super(formatMessage(reasonCode, message));
        this.reasonCode = reasonCode;
    }

    /**
     * 理由コードと原因付きの例外を生成します。
     *
     * @param reasonCode 理由コードです（空白不可）
     * @param message 詳細メッセージです
     * @param cause 原因です
     */
    protected DanpAnalysisException(String reasonCode, String message, Throwable cause) {
        super(formatMessage(reasonCode, message), cause);
        this.reasonCode = reasonCode;
    }

    /**
     * 利用者が入力を修正すれば解消する失敗かどうかを返します。
     *
     * @return 入力起因の失敗なら true です
     */
    public abstract boolean isUserCorrectable();

    private static String formatMessage(String reasonCode, String message) {
        Preconditions.checkNotNull(reasonCode, "reasonCode は null 不可です");
        Preconditions.checkArgument(!reasonCode.isBlank(), "reasonCode は空白不可です");
        return "[" + reasonCode + "] " + Preconditions.checkNotNull(message, "message は null 不可です");
    }
}
