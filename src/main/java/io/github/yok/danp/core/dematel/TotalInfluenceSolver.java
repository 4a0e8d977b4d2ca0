package io.github.yok.danp.core.dematel;

import com.google.common.base.Preconditions;
import io.github.yok.danp.core.error.SingularMatrixException;
import io.github.yok.danp.core.linearalgebra.LinearSystemBackend;
import io.github.yok.danp.core.linearalgebra.LinearSystemBackend.LinearSolveResult;
import java.util.Locale;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;

/**
 * 正規化直接影響行列 D から総影響行列 {@code T = D (I - D)^-1} を計算するクラスです。
 *
 * <p>
 * 逆行列を明示的に作らず、連立方程式 {@code (I - D) T = D} を解きます（D と {@code (I - D)^-1} は可換なので同じ T になります）。
 * 特異性は次の 3 段階で検出します。
 * </p>
 * <ul>
 * <li>LU 分解の品質が {@code singularityTolerance} 未満</li>
 * <li>解に NaN / 無限大が含まれる</li>
 * <li>残差 {@code max |(I - D) T - D|} が {@code residualTolerance} を超える</li>
 * </ul>
 */
@Getter
@Slf4j
public final class TotalInfluenceSolver {

    /**
     * 丸め誤差とみなして 0 に切り上げる負値の相対幅です（{@code max|T|} に対する比）。
     */
    private static final double NEGATIVE_ROUNDING_RELATIVE = 1e-12;

    /**
     * 連立方程式を解くバックエンドです。
     */
    private final LinearSystemBackend linearSystemBackend;

    /**
     * {@code (I - D)} の LU 分解品質の下限です。
     */
    private final double singularityTolerance;

    /**
     * 解の残差（絶対値の最大）の上限です。
     */
    private final double residualTolerance;

    /**
     * ソルバを生成します。
     *
     * @param linearSystemBackend 連立方程式バックエンドです（null 不可）
     * @param singularityTolerance LU 分解品質の下限です（0 以上）
     * @param residualTolerance 残差の上限です（正）
     * @throws NullPointerException linearSystemBackend が null の場合に発生します
     * @throws IllegalArgumentException 閾値が範囲外の場合に発生します
     */
    public TotalInfluenceSolver(LinearSystemBackend linearSystemBackend,
            double singularityTolerance, double residualTolerance) {
        this.linearSystemBackend =
                Preconditions.checkNotNull(linearSystemBackend, "linearSystemBackend は null 不可です");
        Preconditions.checkArgument(singularityTolerance >= 0.0,
                "singularityTolerance は 0 以上が必要です: %s", singularityTolerance);
        Preconditions.checkArgument(residualTolerance > 0.0, "residualTolerance は 0 より大きい必要があります: %s",
                residualTolerance);
        this.singularityTolerance = singularityTolerance;
        this.residualTolerance = residualTolerance;
    }

    /**
     * 総影響行列 T を計算します。
     *
     * @param normalized 正規化直接影響行列 D です（正方、変更しません）
     * @return 総影響行列 T です（D と同じ形状、全要素 0 以上）
     * @throws SingularMatrixException {@code (I - D)} が特異または特異に近い場合に発生します
     */
    public DMatrixRMaj solve(DMatrixRMaj normalized) {
        Preconditions.checkNotNull(normalized, "normalized は null 不可です");
        Preconditions.checkArgument(normalized.numRows == normalized.numCols,
                "normalized は正方行列である必要があります: %sx%s", normalized.numRows, normalized.numCols);

        int n = normalized.numRows;

        // A = I - D
        DMatrixRMaj identityMinusD = CommonOps_DDRM.identity(n);
        CommonOps_DDRM.subtractEquals(identityMinusD, normalized);

        LinearSolveResult solved;
        try {
            solved = linearSystemBackend.solve(identityMinusD, normalized);
        } catch (IllegalStateException e) {
            throw new SingularMatrixException("(I - D) の分解に失敗しました: " + e.getMessage());
        }

        if (solved.getQuality() < singularityTolerance) {
            throw new SingularMatrixException("(I - D) が特異または特異に近い行列です: quality="
                    + fmtSci(solved.getQuality()) + " < " + fmtSci(singularityTolerance));
        }

        DMatrixRMaj total = solved.getSolution();

        for (int i = 0; i < total.getNumElements(); i++) {
            if (!Double.isFinite(total.get(i))) {
                throw new SingularMatrixException("総影響行列に有限でない値が含まれます: index=" + i);
            }
        }

        double residual = residual(identityMinusD, total, normalized);
        if (residual > residualTolerance) {
            throw new SingularMatrixException("総影響行列の残差が許容値を超えました: residual=" + fmtSci(residual)
                    + " > " + fmtSci(residualTolerance));
        }

        clampRoundingNegatives(total);

        log.info("総影響行列を計算しました。n={}、LU品質={}、残差={}", n, fmtSci(solved.getQuality()),
                fmtSci(residual));

        return total;
    }

    /**
     * 残差 {@code max |A T - D|} を計算します。
     *
     * @param a 係数行列 {@code I - D} です
     * @param total 解 T です
     * @param normalized 右辺 D です
     * @return 残差の絶対値の最大です
     */
    private static double residual(DMatrixRMaj a, DMatrixRMaj total, DMatrixRMaj normalized) {
        DMatrixRMaj product = new DMatrixRMaj(a.numRows, total.numCols);
        CommonOps_DDRM.mult(a, total, product);
        CommonOps_DDRM.subtractEquals(product, normalized);
        return CommonOps_DDRM.elementMaxAbs(product);
    }

    /**
     * 丸め誤差による微小な負値を 0 にします。
     *
     * <p>
     * 非負の D に対して T は非負です。許容幅を超える負値は数値異常として扱います。
     * </p>
     *
     * @param total 総影響行列です（この行列を直接更新します）
     * @throws SingularMatrixException 許容幅を超える負値がある場合に発生します
     */
    private static void clampRoundingNegatives(DMatrixRMaj total) {
        double bound = NEGATIVE_ROUNDING_RELATIVE * Math.max(1.0, CommonOps_DDRM.elementMaxAbs(total));
        for (int i = 0; i < total.getNumElements(); i++) {
            double v = total.get(i);
            if (v < 0.0) {
                if (v < -bound) {
                    throw new SingularMatrixException("総影響行列に負の値が含まれます: index=" + i + ", value=" + v);
                }
                total.set(i, 0.0);
            }
        }
    }

    private static String fmtSci(double v) {
        return String.format(Locale.ROOT, "%.3e", v);
    }
}
