package io.github.yok.danp.core.linearalgebra;

import com.google.common.base.Preconditions;
import org.ejml.LinearSolverSafe;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.factory.LinearSolverFactory_DDRM;
import org.ejml.interfaces.linsol.LinearSolverDense;

/**
 * EJML の LU 分解を用いて、連立一次方程式 {@code A X = B} を解くクラスです。
 *
 * <p>
 * {@link LinearSolverSafe} で包むため、A と B は分解・求解の過程で書き換えられません。
 * </p>
 */
public final class EjmlLuLinearSystemBackend implements LinearSystemBackend {

    /**
     * {@code A X = B} を LU 分解で解きます。
     *
     * @param a 係数行列 A です（正方）
     * @param b 右辺 B です（行数は A と同じ）
     * @return 解と分解の品質です
     * @throws NullPointerException a または b が null の場合に発生します
     * @throws IllegalArgumentException 行列の形状が不正な場合に発生します
     * @throws IllegalStateException LU 分解に失敗した場合に発生します
     */
    @Override
    public LinearSolveResult solve(DMatrixRMaj a, DMatrixRMaj b) {
        Preconditions.checkNotNull(a, "a は null 不可です");
        Preconditions.checkNotNull(b, "b は null 不可です");
        Preconditions.checkArgument(a.numRows == a.numCols, "a は正方行列である必要があります: %sx%s",
                a.numRows, a.numCols);
        Preconditions.checkArgument(a.numRows == b.numRows, "a と b の行数が一致しません: %s vs %s",
                a.numRows, b.numRows);

        int dim = a.numRows;

        // 入力を書き換えない LU ソルバを生成します。
        LinearSolverDense<DMatrixRMaj> solver =
                new LinearSolverSafe<>(LinearSolverFactory_DDRM.lu(dim));

        if (!solver.setA(a)) {
            throw new IllegalStateException("LU 分解に失敗しました（EJML）");
        }

        // 分解の品質（三角因子の対角から求める特異性の目安）です。
        double quality = solver.quality();

        DMatrixRMaj x = new DMatrixRMaj(dim, b.numCols);
        solver.solve(b, x);

        return new LinearSolveResult(x, quality);
    }
}
