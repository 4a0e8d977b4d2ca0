package io.github.yok.danp.core.error;

import lombok.Getter;

/**
 * 極限超行列が反復上限までに安定しなかった場合の例外です。
 *
 * <p>
 * 未収束の行列から重みを取り出して返すことはしません。
 * </p>
 */
@Getter
public final class ConvergenceException extends DanpAnalysisException {

    private static final long serialVersionUID = 1L;

    /**
     * 実行した反復回数です。
     */
    private final int iterations;

    /**
     * 最終反復での最大変化量です。
     */
    private final double lastMaxChange;

    /**
     * 例外を生成します。
     *
     * @param message 詳細メッセージです
     * @param iterations 実行した反復回数です
     * @param lastMaxChange 最終反復での最大変化量です
     */
    public ConvergenceException(String message, int iterations, double lastMaxChange) {
        super("CONVERGENCE", message);
        this.iterations = iterations;
        this.lastMaxChange = lastMaxChange;
    }

    @Override
    public boolean isUserCorrectable() {
        return false;
    }
}
