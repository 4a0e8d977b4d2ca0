package io.github.yok.danp.core.danp;

import com.google.common.base.Preconditions;
import io.github.yok.danp.core.error.ConvergenceException;
import io.github.yok.danp.core.linearalgebra.Matrices;
import java.util.Locale;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;
import org.ejml.dense.row.MatrixFeatures_DDRM;

/**
 * 重み付き超行列を {@code W <- W * W} で繰り返し二乗し、極限超行列と重みを求めるクラスです。
 *
 * <p>
 * 連続する反復の差の最大値が {@code tolerance} 未満になった時点で収束とします。 収束後、列和が 0 でない列がすべて
 * {@code columnTolerance} 以内で一致することを確かめます。 周期的な行列（例: {@code [[0,1],[1,0]]} は二乗すると単位行列）は
 * 反復としては止まりますが列が一致しないため、ここで {@link ConvergenceException} になります。
 * </p>
 */
@Getter
@Slf4j
public final class LimitingSupermatrixSolver {

    /**
     * 列和が 0 とみなす上限です。
     */
    private static final double ZERO_COLUMN_SUM = 1e-12;

    /**
     * 連続する反復の差の許容値です。
     */
    private final double tolerance;

    /**
     * 二乗の最大回数です。
     */
    private final int maxIterations;

    /**
     * 極限超行列の列どうしの一致に求める許容値です。
     */
    private final double columnTolerance;

    /**
     * ソルバを生成します。
     *
     * @param tolerance 連続する反復の差の許容値です（正）
     * @param maxIterations 二乗の最大回数です（1 以上）
     * @param columnTolerance 列どうしの一致の許容値です（正）
     */
    public LimitingSupermatrixSolver(double tolerance, int maxIterations, double columnTolerance) {
        Preconditions.checkArgument(tolerance > 0.0, "tolerance は 0 より大きい必要があります: %s", tolerance);
        Preconditions.checkArgument(maxIterations >= 1, "maxIterations は 1 以上が必要です: %s", maxIterations);
        Preconditions.checkArgument(columnTolerance > 0.0, "columnTolerance は 0 より大きい必要があります: %s",
                columnTolerance);
        this.tolerance = tolerance;
        this.maxIterations = maxIterations;
        this.columnTolerance = columnTolerance;
    }

    /**
     * 極限超行列と重みを求めます。
     *
     * @param weighted 重み付き超行列です（正方、変更しません）
     * @return 極限超行列・正規化した重み・反復回数です
     * @throws ConvergenceException 上限までに収束しない、または極限の列が一致しない場合に発生します
     */
    public LimitingSupermatrix solve(DMatrixRMaj weighted) {
        Preconditions.checkNotNull(weighted, "weighted は null 不可です");
        Preconditions.checkArgument(weighted.numRows == weighted.numCols && weighted.numRows > 0,
                "weighted は空でない正方行列である必要があります: %sx%s", weighted.numRows, weighted.numCols);

        int n = weighted.numRows;
        DMatrixRMaj current = weighted.copy();
        DMatrixRMaj next = new DMatrixRMaj(n, n);

        boolean converged = false;
        double lastMaxChange = Double.POSITIVE_INFINITY;
        int performedIterations = 0;

        for (int iter = 1; iter <= maxIterations; iter++) {
            performedIterations = iter;

            CommonOps_DDRM.mult(current, current, next);

            if (MatrixFeatures_DDRM.hasUncountable(next)) {
                throw new ConvergenceException("極限超行列に有限でない値が現れました: iter=" + iter, iter,
                        lastMaxChange);
            }

            lastMaxChange = Matrices.maxAbsDifference(current, next);
            log.debug("極限超行列の反復 {}: 最大変化量={}", iter, fmtSci(lastMaxChange));

            DMatrixRMaj swap = current;
            current = next;
            next = swap;

            if (lastMaxChange < tolerance) {
                converged = true;
                break;
            }
        }

        if (!converged) {
            throw new ConvergenceException("極限超行列が反復上限までに収束しませんでした: 最大変化量="
                    + fmtSci(lastMaxChange) + " >= " + fmtSci(tolerance), performedIterations,
                    lastMaxChange);
        }

        double[] weights = extractWeights(current, performedIterations, lastMaxChange);

        log.info("極限超行列が収束しました。反復={}、最大変化量={}", performedIterations, fmtSci(lastMaxChange));

        return new LimitingSupermatrix(current, weights, performedIterations, lastMaxChange);
    }

    /**
     * 極限超行列から重みを取り出します。
     *
     * <p>
     * 列和が 0 でない最初の列を基準とし、他の 0 でない列がすべて基準列と一致することを確かめてから、基準列を和 1 に正規化します。
     * </p>
     *
     * @param limit 極限超行列です
     * @param iterations 反復回数です（例外用）
     * @param lastMaxChange 最終反復での最大変化量です（例外用）
     * @return 正規化した重みです
     */
    private double[] extractWeights(DMatrixRMaj limit, int iterations, double lastMaxChange) {
        int n = limit.numRows;
        double[] columnSums = Matrices.columnSums(limit);

        int reference = -1;
        for (int j = 0; j < n; j++) {
            if (columnSums[j] > ZERO_COLUMN_SUM) {
                reference = j;
                break;
            }
        }
        if (reference < 0) {
            throw new ConvergenceException("極限超行列がすべて 0 になりました", iterations, lastMaxChange);
        }

        double[] weights = new double[n];
        for (int i = 0; i < n; i++) {
            weights[i] = limit.get(i, reference) / columnSums[reference];
        }

        for (int j = reference + 1; j < n; j++) {
            if (columnSums[j] <= ZERO_COLUMN_SUM) {
                continue;
            }
            for (int i = 0; i < n; i++) {
                double diff = Math.abs(limit.get(i, j) / columnSums[j] - weights[i]);
                if (diff > columnTolerance) {
                    throw new ConvergenceException("極限超行列の列が一致しません（周期的または可約な超行列）: column="
                            + j + ", row=" + i + ", 差=" + fmtSci(diff), iterations, lastMaxChange);
                }
            }
        }

        return weights;
    }

    private static String fmtSci(double v) {
        return String.format(Locale.ROOT, "%.3e", v);
    }
}
