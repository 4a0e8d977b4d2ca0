package io.github.yok.danp.core.linearalgebra;

import lombok.Value;
import org.ejml.data.DMatrixRMaj;

/**
 * 連立一次方程式 {@code A X = B} を解くバックエンドを表すインタフェースです。
 *
 * <p>
 * 使用するライブラリや分解手法を差し替えやすくするためのインタフェースです。
 * </p>
 */
public interface LinearSystemBackend {

    /**
     * {@code A X = B} を解いて X を返します。
     *
     * <p>
     * 引数の行列は変更しません。
     * </p>
     *
     * @param a 係数行列 A です（正方）
     * @param b 右辺 B です（行数は A と同じ）
     * @return 解と分解の品質です
     * @throws IllegalStateException 分解に失敗した場合に発生します
     */
    LinearSolveResult solve(DMatrixRMaj a, DMatrixRMaj b);

    /**
     * 連立一次方程式の解を保持するクラスです。
     */
    @Value
    class LinearSolveResult {

        /**
         * 解 X です。
         */
        DMatrixRMaj solution;

        /**
         * 係数行列の分解品質です（0 に近いほど特異に近いことを表します）。
         */
        double quality;
    }
}
