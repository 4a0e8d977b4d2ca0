package io.github.yok.danp.core.dematel;

import com.google.common.base.Preconditions;
import io.github.yok.danp.core.error.DegenerateMatrixException;
import io.github.yok.danp.core.linearalgebra.Matrices;
import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;

/**
 * 直接影響行列 X を、単一の尺度 s で割って正規化するクラスです。
 *
 * <p>
 * {@code s = max(max_i 行和, max_j 列和)} とし、{@code D = X / s} を返します。 D の行和・列和はすべて 1 以下になります。
 * </p>
 */
public final class DirectInfluenceNormalizer {

    /**
     * 直接影響行列を正規化します。
     *
     * @param directInfluence 直接影響行列 X です（変更しません）
     * @return 正規化行列と尺度です
     * @throws DegenerateMatrixException 行和・列和がすべて 0（影響関係なし）、または尺度が有限でない場合に発生します
     */
    public NormalizedMatrix normalize(DMatrixRMaj directInfluence) {
        Preconditions.checkNotNull(directInfluence, "directInfluence は null 不可です");
        Preconditions.checkArgument(directInfluence.numRows > 0 && directInfluence.numCols > 0,
                "directInfluence が空です");

        double maxRowSum = Matrices.max(Matrices.rowSums(directInfluence));
        double maxColumnSum = Matrices.max(Matrices.columnSums(directInfluence));
        double scale = Math.max(maxRowSum, maxColumnSum);

        if (!Double.isFinite(scale)) {
            throw new DegenerateMatrixException("正規化尺度が有限値になりません: s=" + scale);
        }
        if (scale <= 0.0) {
            throw new DegenerateMatrixException("行列がすべて 0 のため正規化できません。影響関係を入力してください");
        }

        DMatrixRMaj normalized = new DMatrixRMaj(directInfluence.numRows, directInfluence.numCols);
        CommonOps_DDRM.divide(directInfluence, scale, normalized);

        return new NormalizedMatrix(normalized, scale);
    }
}
